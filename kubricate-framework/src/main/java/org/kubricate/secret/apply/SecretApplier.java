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
package org.kubricate.secret.apply;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.kubricate.exception.KubricateException;
import org.kubricate.secret.PreparedEffect;
import org.kubricate.secret.orchestrator.SecretsOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Applier running the orchestrator and handing resolved effects to an external Effect Applier
 */
public class SecretApplier {
    private static final Logger logger = LoggerFactory.getLogger(SecretApplier.class);

    private static final ObjectWriter PRETTY_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private final SecretsOrchestrator orchestrator;

    private final EffectApplier effectApplier;

    private final SecretPayloadCensor censor = new SecretPayloadCensor();

    public SecretApplier(final SecretsOrchestrator orchestrator, final EffectApplier effectApplier) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "Secrets Orchestrator required");
        this.effectApplier = Objects.requireNonNull(effectApplier, "Effect Applier required");
    }

    /**
     * Apply resolved effects, or log censored payloads without applying when dry run is enabled
     *
     * @param dryRun Dry run enabled
     * @return Resolved effects
     */
    public List<PreparedEffect> apply(final boolean dryRun) {
        final List<PreparedEffect> effects = orchestrator.apply();
        if (effects.isEmpty()) {
            logger.warn("No secrets to apply.");
            return effects;
        }

        for (final PreparedEffect effect : effects) {
            if (dryRun) {
                logger.info("Dry run effect [{}] for secret [{}]:\n{}", effect.getType(), effect.getSecretName(), render(effect));
            } else {
                effectApplier.apply(effect);
                logger.info("Applied effect [{}] for secret [{}] from provider [{}]", effect.getType(), effect.getSecretName(), effect.getProviderName());
            }
        }
        return effects;
    }

    private String render(final PreparedEffect effect) {
        try {
            return PRETTY_WRITER.writeValueAsString(censor.censor(effect));
        } catch (final JsonProcessingException e) {
            throw new KubricateException(String.format("Rendering effect for secret [%s] failed", effect.getSecretName()), e);
        }
    }
}
