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
package org.kubricate.config;

import org.kubricate.exception.SecretConfigurationException;
import org.kubricate.secret.manager.SecretManager;
import org.kubricate.secret.manager.SecretRegistry;
import org.kubricate.secret.orchestrator.ConflictOptions;
import org.kubricate.stack.Stack;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Project configuration with stacks by identifier, an optional secret manager or registry, and conflict options
 */
public final class ProjectConfiguration {
    private final Map<String, Stack> stacks;

    private final SecretManager secretManager;

    private final SecretRegistry secretRegistry;

    private final ConflictOptions conflictOptions;

    private ProjectConfiguration(final Builder builder) {
        this.stacks = Collections.unmodifiableMap(new LinkedHashMap<>(builder.stacks));
        this.secretManager = builder.secretManager;
        this.secretRegistry = builder.secretRegistry;
        this.conflictOptions = builder.conflictOptions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Stack> getStacks() {
        return stacks;
    }

    public Optional<SecretManager> getSecretManager() {
        return Optional.ofNullable(secretManager);
    }

    public Optional<SecretRegistry> getSecretRegistry() {
        return Optional.ofNullable(secretRegistry);
    }

    public ConflictOptions getConflictOptions() {
        return conflictOptions;
    }

    public static final class Builder {
        private final Map<String, Stack> stacks = new LinkedHashMap<>();

        private SecretManager secretManager;

        private SecretRegistry secretRegistry;

        private ConflictOptions conflictOptions = ConflictOptions.withDefaults();

        private Builder() {

        }

        public Builder stack(final String stackId, final Stack stack) {
            Objects.requireNonNull(stackId, "Stack ID required");
            Objects.requireNonNull(stack, "Stack required");
            if (stacks.containsKey(stackId)) {
                throw new SecretConfigurationException(String.format("[config] Duplicate stack ID: \"%s\"", stackId));
            }
            stacks.put(stackId, stack);
            return this;
        }

        public Builder secretManager(final SecretManager secretManager) {
            this.secretManager = Objects.requireNonNull(secretManager, "Secret Manager required");
            return this;
        }

        public Builder secretRegistry(final SecretRegistry secretRegistry) {
            this.secretRegistry = Objects.requireNonNull(secretRegistry, "Secret Registry required");
            return this;
        }

        public Builder conflictOptions(final ConflictOptions conflictOptions) {
            this.conflictOptions = Objects.requireNonNull(conflictOptions, "Conflict Options required");
            return this;
        }

        public ProjectConfiguration build() {
            if (secretManager != null && secretRegistry != null) {
                throw new SecretConfigurationException("[config] Conflict: cannot define both a secret manager and a secret registry");
            }
            return new ProjectConfiguration(this);
        }
    }
}
