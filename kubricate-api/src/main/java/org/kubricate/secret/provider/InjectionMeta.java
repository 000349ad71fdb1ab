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

import org.kubricate.secret.injection.SecretInjectionStrategy;

import java.util.Objects;

/**
 * Metadata describing the secret and strategy behind one injection
 */
public final class InjectionMeta {
    private final String secretName;

    private final String targetName;

    private final SecretInjectionStrategy strategy;

    /**
     * Injection Meta constructor
     *
     * @param secretName Secret name required
     * @param targetName Target name in the resource, such as an environment variable name
     * @param strategy Strategy or null when the kind is inferred from the path
     */
    public InjectionMeta(final String secretName, final String targetName, final SecretInjectionStrategy strategy) {
        this.secretName = Objects.requireNonNull(secretName, "Secret Name required");
        this.targetName = targetName;
        this.strategy = strategy;
    }

    public String getSecretName() {
        return secretName;
    }

    public String getTargetName() {
        return targetName;
    }

    public SecretInjectionStrategy getStrategy() {
        return strategy;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        final InjectionMeta meta = (InjectionMeta) other;
        return secretName.equals(meta.secretName)
                && Objects.equals(targetName, meta.targetName)
                && Objects.equals(strategy, meta.strategy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(secretName, targetName, strategy);
    }
}
