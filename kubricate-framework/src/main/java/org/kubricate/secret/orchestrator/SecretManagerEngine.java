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
package org.kubricate.secret.orchestrator;

import org.kubricate.config.ProjectConfiguration;
import org.kubricate.exception.SecretConfigurationException;
import org.kubricate.secret.PreparedEffect;
import org.kubricate.secret.manager.PreparedSecret;
import org.kubricate.secret.manager.SecretManager;
import org.kubricate.secret.manager.SecretRegistry;
import org.kubricate.secret.provider.SecretProvider;
import org.kubricate.stack.Stack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Engine collecting Secret Managers from project configuration, loading their secrets and preparing effects
 */
public class SecretManagerEngine {
    static final String DEFAULT_MANAGER_NAME = "default";

    private static final Logger logger = LoggerFactory.getLogger(SecretManagerEngine.class);

    private final ProjectConfiguration configuration;

    private final EffectsOptions effectsOptions;

    public SecretManagerEngine(final ProjectConfiguration configuration, final EffectsOptions effectsOptions) {
        this.configuration = Objects.requireNonNull(configuration, "Project Configuration required");
        this.effectsOptions = Objects.requireNonNull(effectsOptions, "Effects Options required");
    }

    /**
     * Collect Secret Managers from the configured registry or manager, otherwise from stacks in declaration order
     * with each manager instance collected once
     *
     * @return Secret Managers by scope name
     */
    public Map<String, SecretManager> collect() {
        final Map<String, SecretManager> managers = new LinkedHashMap<>();
        if (configuration.getSecretRegistry().isPresent()) {
            final SecretRegistry registry = configuration.getSecretRegistry().get();
            managers.putAll(registry.list());
        } else if (configuration.getSecretManager().isPresent()) {
            managers.put(DEFAULT_MANAGER_NAME, configuration.getSecretManager().get());
        } else {
            final Set<SecretManager> collected = Collections.newSetFromMap(new IdentityHashMap<>());
            for (final Map.Entry<String, Stack> stackEntry : configuration.getStacks().entrySet()) {
                for (final Map.Entry<Integer, SecretManager> managerEntry : stackEntry.getValue().getSecretManagers().entrySet()) {
                    if (collected.add(managerEntry.getValue())) {
                        managers.put(String.format("%s.%d", stackEntry.getKey(), managerEntry.getKey()), managerEntry.getValue());
                    }
                }
            }
        }

        if (managers.isEmpty()) {
            throw new SecretConfigurationException("[config] No secret manager or secret registry found");
        }
        logger.debug("Collected Secret Managers {}", managers.keySet());
        return managers;
    }

    /**
     * Load every declared secret of every manager, failing on the first secret that cannot be resolved
     *
     * @param managers Secret Managers by scope name required
     */
    public void validate(final Map<String, SecretManager> managers) {
        for (final Map.Entry<String, SecretManager> entry : managers.entrySet()) {
            final SecretManager manager = entry.getValue();
            manager.applyWorkingDir(effectsOptions.getWorkingDir());
            manager.loadSecrets();
            logger.debug("Secret Manager [{}] validated: secrets [{}]", entry.getKey(), manager.getSecrets().size());
        }
    }

    /**
     * Prepare effects of every manager in registration order
     *
     * @param managers Secret Managers by scope name required
     * @return Effects with originating manager and provider
     */
    public List<TrackedEffect> prepareEffects(final Map<String, SecretManager> managers) {
        final List<TrackedEffect> effects = new ArrayList<>();
        for (final Map.Entry<String, SecretManager> entry : managers.entrySet()) {
            final SecretManager manager = entry.getValue();
            manager.applyWorkingDir(effectsOptions.getWorkingDir());
            for (final PreparedSecret secret : manager.prepare()) {
                final SecretProvider provider = manager.resolveProviderFor(secret.getName()).getProvider();
                for (final PreparedEffect effect : secret.getEffects()) {
                    effects.add(new TrackedEffect(entry.getKey(), provider, effect));
                }
            }
        }
        return effects;
    }
}
