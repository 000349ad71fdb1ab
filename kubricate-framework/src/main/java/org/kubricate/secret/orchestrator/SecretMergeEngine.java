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

import org.kubricate.exception.SecretConflictException;
import org.kubricate.secret.PreparedEffect;
import org.kubricate.secret.provider.SecretProvider;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Merge engine reconciling effects that share an identifier at intra-provider, cross-provider and cross-manager levels
 */
public class SecretMergeEngine {
    private final Logger logger;

    public SecretMergeEngine(final Logger logger) {
        this.logger = Objects.requireNonNull(logger, "Logger required");
    }

    /**
     * Merge effects level by level using the strategy configured for each level
     *
     * @param effects Effects in preparation order
     * @param options Conflict Options required
     * @return Merged effects in order of first appearance
     */
    public List<PreparedEffect> merge(final List<TrackedEffect> effects, final ConflictOptions options) {
        Objects.requireNonNull(effects, "Effects required");
        Objects.requireNonNull(options, "Conflict Options required");

        List<TrackedEffect> current = effects;
        current = mergeLevel(current, ConflictLevel.INTRA_PROVIDER, options.getStrategy(ConflictLevel.INTRA_PROVIDER),
                effect -> List.of(effect.getManagerName(), String.valueOf(effect.getProvider().getName()), effect.getIdentifier()));
        current = mergeLevel(current, ConflictLevel.CROSS_PROVIDER, options.getStrategy(ConflictLevel.CROSS_PROVIDER),
                effect -> List.of(effect.getManagerName(), effect.getIdentifier()));
        current = mergeLevel(current, ConflictLevel.CROSS_MANAGER, options.getStrategy(ConflictLevel.CROSS_MANAGER),
                effect -> List.of(effect.getIdentifier()));

        return current.stream().map(TrackedEffect::getEffect).collect(Collectors.toList());
    }

    private List<TrackedEffect> mergeLevel(
            final List<TrackedEffect> effects,
            final ConflictLevel level,
            final ConflictStrategy strategy,
            final Function<TrackedEffect, List<String>> groupKey
    ) {
        final Map<List<String>, List<TrackedEffect>> groups = new LinkedHashMap<>();
        for (final TrackedEffect effect : effects) {
            groups.computeIfAbsent(groupKey.apply(effect), key -> new ArrayList<>()).add(effect);
        }

        final List<TrackedEffect> resolved = new ArrayList<>();
        for (final List<TrackedEffect> group : groups.values()) {
            if (group.size() == 1) {
                resolved.add(group.get(0));
            } else {
                resolved.addAll(resolveConflict(group, level, strategy));
            }
        }
        return resolved;
    }

    private List<TrackedEffect> resolveConflict(final List<TrackedEffect> group, final ConflictLevel level, final ConflictStrategy strategy) {
        final TrackedEffect first = group.get(0);
        final String identifier = first.getIdentifier();

        if (strategy == ConflictStrategy.ERROR) {
            throw new SecretConflictException(level.getName(), identifier, String.format(
                    "[conflict:error:%s] Duplicate resource identifier \"%s\" produced by %s",
                    level.getName(), identifier, describe(group)));
        }

        if (strategy == ConflictStrategy.AUTO_MERGE) {
            final SecretProvider provider = first.getProvider();
            final Optional<SecretProvider> restricted = group.stream()
                    .map(TrackedEffect::getProvider)
                    .filter(groupProvider -> !groupProvider.isAllowMerge())
                    .findFirst();
            if (restricted.isEmpty()) {
                final List<PreparedEffect> groupEffects = group.stream().map(TrackedEffect::getEffect).collect(Collectors.toList());
                final List<TrackedEffect> merged = new ArrayList<>();
                for (final PreparedEffect mergedEffect : provider.mergeSecrets(groupEffects)) {
                    merged.add(first.withEffect(mergedEffect));
                }
                logger.debug("Merged [{}] effects with identifier [{}] at level [{}]", group.size(), identifier, level);
                return merged;
            }
            logger.warn(String.format("[conflict:overwrite:%s] Provider \"%s\" does not allow merge: keeping last effect for identifier \"%s\"",
                    level.getName(), restricted.get().getName(), identifier));
        }

        final TrackedEffect last = group.get(group.size() - 1);
        for (final TrackedEffect dropped : group.subList(0, group.size() - 1)) {
            logger.warn(String.format("[conflict:overwrite:%s] Dropped effect for identifier \"%s\" from %s, keeping %s",
                    level.getName(), identifier, describe(dropped), describe(last)));
        }
        return List.of(last);
    }

    private static String describe(final List<TrackedEffect> group) {
        return group.stream().map(SecretMergeEngine::describe).collect(Collectors.joining(", "));
    }

    private static String describe(final TrackedEffect effect) {
        return String.format("manager \"%s\" provider \"%s\" secret \"%s\"",
                effect.getManagerName(), effect.getProvider().getName(), effect.getEffect().getSecretName());
    }
}
