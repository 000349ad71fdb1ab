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
import org.kubricate.exception.SecretRegistrationException;
import org.kubricate.secret.PreparedEffect;
import org.kubricate.secret.manager.SecretManager;
import org.kubricate.secret.provider.SecretProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orchestrator running collection, validation, effect preparation and multi-level conflict resolution for one run
 */
public class SecretsOrchestrator {
    private final ProjectConfiguration configuration;

    private final SecretManagerEngine managerEngine;

    private final SecretMergeEngine mergeEngine;

    private final Logger logger;

    private final Map<String, SecretProvider> providerCache = new HashMap<>();

    public SecretsOrchestrator(final ProjectConfiguration configuration, final EffectsOptions effectsOptions) {
        this(configuration, effectsOptions, LoggerFactory.getLogger(SecretsOrchestrator.class));
    }

    /**
     * Secrets Orchestrator constructor with Logger receiving conflict warnings
     *
     * @param configuration Project Configuration required
     * @param effectsOptions Effects Options required
     * @param logger Logger required
     */
    public SecretsOrchestrator(final ProjectConfiguration configuration, final EffectsOptions effectsOptions, final Logger logger) {
        this.configuration = Objects.requireNonNull(configuration, "Project Configuration required");
        this.logger = Objects.requireNonNull(logger, "Logger required");
        this.managerEngine = new SecretManagerEngine(configuration, effectsOptions);
        this.mergeEngine = new SecretMergeEngine(logger);
    }

    /**
     * Validate conflict configuration, collect managers and load every declared secret
     *
     * @return Secret Managers by scope name
     */
    public Map<String, SecretManager> validate() {
        configuration.getConflictOptions().validate();
        final Map<String, SecretManager> managers = managerEngine.collect();
        managerEngine.validate(managers);
        logger.info("Validated [{}] Secret Managers", managers.size());
        return managers;
    }

    /**
     * Validate, prepare effects and resolve conflicts into the final effect list
     *
     * @return Effects ready to be applied
     */
    public List<PreparedEffect> apply() {
        final Map<String, SecretManager> managers = validate();
        final List<TrackedEffect> prepared = managerEngine.prepareEffects(managers);
        final List<PreparedEffect> effects = mergeEngine.merge(prepared, configuration.getConflictOptions());
        logger.info("Prepared [{}] effects from [{}] Secret Managers", effects.size(), managers.size());
        return effects;
    }

    /**
     * Find provider by registration name across collected managers in order
     *
     * @param providerName Provider name required
     * @return Secret Provider
     */
    public SecretProvider resolveProviderByName(final String providerName) {
        Objects.requireNonNull(providerName, "Provider Name required");
        final SecretProvider cached = providerCache.get(providerName);
        if (cached != null) {
            return cached;
        }

        for (final SecretManager manager : managerEngine.collect().values()) {
            final SecretProvider provider = manager.getProviders().get(providerName);
            if (provider != null) {
                providerCache.put(providerName, provider);
                return provider;
            }
        }
        throw new SecretRegistrationException(String.format("[SecretsOrchestrator] Provider \"%s\" not found in any registered SecretManager", providerName));
    }
}
