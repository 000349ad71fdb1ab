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

import org.kubricate.exception.SecretInjectionStrategyException;
import org.kubricate.secret.injection.SecretInjectionStrategy;
import org.kubricate.secret.injection.StrategyKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Shared injection strategy rules for providers: default target paths, kind inference, homogeneity and envFrom prefixes
 */
public final class InjectionStrategies {
    private static final String CONTAINER_PATH_FORMAT = "spec.template.spec.containers[%d].%s";

    private static final String IMAGE_PULL_SECRETS_PATH = "spec.template.spec.imagePullSecrets";

    private static final String ENV_FROM_PATH_SEGMENT = "envFrom";

    private static final String NO_PREFIX = "(none)";

    private static final int DEFAULT_CONTAINER_INDEX = 0;

    private InjectionStrategies() {

    }

    /**
     * Get default target path for a Deployment-style resource, honoring an explicit target path
     *
     * @param strategy Injection strategy required
     * @return Target path or empty when the kind has no default path
     */
    public static Optional<String> getDefaultTargetPath(final SecretInjectionStrategy strategy) {
        if (strategy.getTargetPath() != null) {
            return Optional.of(strategy.getTargetPath());
        }

        final String kind = strategy.getKind();
        final int containerIndex = strategy.getContainerIndex() == null ? DEFAULT_CONTAINER_INDEX : strategy.getContainerIndex();
        if (StrategyKind.ENV.equals(kind) || StrategyKind.ENV_FROM.equals(kind)) {
            return Optional.of(String.format(CONTAINER_PATH_FORMAT, containerIndex, kind));
        } else if (StrategyKind.IMAGE_PULL_SECRET.equals(kind)) {
            return Optional.of(IMAGE_PULL_SECRETS_PATH);
        }
        return Optional.empty();
    }

    /**
     * Get strategy kind from injection metadata, inferring from the path when metadata has no strategy
     *
     * @param injection Provider Injection required
     * @return Strategy kind
     */
    public static String getStrategyKind(final ProviderInjection injection) {
        final SecretInjectionStrategy strategy = injection.getMeta().getStrategy();
        if (strategy != null) {
            return strategy.getKind();
        }
        return injection.getPath().contains(ENV_FROM_PATH_SEGMENT) ? StrategyKind.ENV_FROM : StrategyKind.ENV;
    }

    /**
     * Get the single strategy kind shared by all injections in a group
     *
     * @param injections Injections required and not empty
     * @return Strategy kind
     * @throws SecretInjectionStrategyException when the group mixes kinds
     */
    public static String requireHomogeneousKind(final List<ProviderInjection> injections) {
        final Set<String> kinds = new LinkedHashSet<>();
        for (final ProviderInjection injection : injections) {
            kinds.add(getStrategyKind(injection));
        }

        final String expectedKind = kinds.iterator().next();
        if (kinds.size() > 1) {
            throw new SecretInjectionStrategyException(String.format(
                    "Mixed injection strategies are not allowed. Expected all injections to use '%s' but found: %s. "
                            + "This is likely a framework bug or incorrect targetPath configuration.",
                    expectedKind, String.join(", ", kinds)));
        }
        return expectedKind;
    }

    /**
     * Get the single envFrom prefix shared by all injections in a group, treating an absent or empty prefix as a distinct value
     *
     * @param injections Injections required
     * @return Prefix or empty when no injection declares one
     * @throws SecretInjectionStrategyException when injections declare different prefixes
     */
    public static Optional<String> requireSinglePrefix(final List<ProviderInjection> injections) {
        final Set<Optional<String>> prefixes = new LinkedHashSet<>();
        for (final ProviderInjection injection : injections) {
            final SecretInjectionStrategy strategy = injection.getMeta().getStrategy();
            final Optional<String> prefix = Optional.ofNullable(strategy == null ? null : strategy.getPrefix());
            prefixes.add(prefix.filter(value -> !value.isEmpty()));
        }

        if (prefixes.size() > 1) {
            final List<String> displayed = new ArrayList<>();
            for (final Optional<String> prefix : prefixes) {
                displayed.add(prefix.orElse(NO_PREFIX));
            }
            throw new SecretInjectionStrategyException(String.format(
                    "Multiple envFrom prefixes detected: %s. All envFrom injections for the same secret must use the same prefix.",
                    String.join(", ", displayed)));
        }
        return prefixes.isEmpty() ? Optional.empty() : prefixes.iterator().next();
    }
}
