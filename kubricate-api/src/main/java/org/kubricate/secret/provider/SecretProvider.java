/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.kubricate.secret.provider;

import org.kubricate.secret.PreparedEffect;
import org.kubricate.secret.SecretValue;
import org.kubricate.secret.injection.SecretInjectionStrategy;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Provider converting secret values into prepared effects and injection requests into resource payloads
 */
public interface SecretProvider {

    /**
     * Get provider name assigned on registration with a Secret Manager
     *
     * @return Provider name
     */
    String getName();

    /**
     * Set provider name assigned on registration with a Secret Manager
     *
     * @param name Provider name
     */
    void setName(String name);

    /**
     * Get resource kind targeted when an injection does not name a resource
     *
     * @return Resource kind such as Deployment
     */
    String getTargetKind();

    /**
     * Get injection strategy kinds supported by this provider
     *
     * @return Supported strategy kinds
     */
    Set<String> getSupportedStrategies();

    /**
     * Whether colliding effects from this provider can be merged
     *
     * @return Merge allowed status
     */
    boolean isAllowMerge();

    /**
     * Prepare effects for a secret value after validating its shape
     *
     * @param name Secret name
     * @param value Secret value
     * @return Prepared effects
     */
    List<PreparedEffect> prepare(String name, SecretValue value);

    /**
     * Get resource path for an injection strategy
     *
     * @param strategy Injection strategy
     * @return Resource path
     */
    String getTargetPath(SecretInjectionStrategy strategy);

    /**
     * Get payload for a group of injections sharing provider, resource and path
     *
     * @param injections Injections in declaration order
     * @return Payload entries to be injected
     */
    List<Map<String, Object>> getInjectionPayload(List<ProviderInjection> injections);

    /**
     * Merge effects sharing an identifier into one effect per identifier
     *
     * @param effects Effects to merge
     * @return Merged effects
     */
    List<PreparedEffect> mergeSecrets(List<PreparedEffect> effects);

    /**
     * Get identifier used for conflict detection between effects
     *
     * @param effect Prepared effect
     * @return Effect identifier
     */
    String getEffectIdentifier(PreparedEffect effect);
}
