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
package org.kubricate.stack;

import org.kubricate.secret.injection.SecretInjectionStrategy;

import java.util.Objects;

/**
 * Immutable injection request accumulated for one secret, pending resolution into a provider injection
 */
public final class SecretInjectionRequest {
    private final String secretName;

    private final String targetName;

    private final SecretInjectionStrategy strategy;

    private final String resourceId;

    SecretInjectionRequest(final String secretName, final String targetName, final SecretInjectionStrategy strategy, final String resourceId) {
        this.secretName = Objects.requireNonNull(secretName, "Secret Name required");
        this.targetName = targetName;
        this.strategy = Objects.requireNonNull(strategy, "Strategy required");
        this.resourceId = resourceId;
    }

    public String getSecretName() {
        return secretName;
    }

    /**
     * Get target name in the resource
     *
     * @return Target name or the secret name when not specified
     */
    public String getTargetName() {
        return targetName == null ? secretName : targetName;
    }

    public SecretInjectionStrategy getStrategy() {
        return strategy;
    }

    /**
     * Get explicit resource identifier
     *
     * @return Resource identifier or null when resolved from context defaults
     */
    public String getResourceId() {
        return resourceId;
    }
}
