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

import org.kubricate.exception.SecretInjectionStrategyException;
import org.kubricate.secret.injection.SecretInjectionStrategy;
import org.kubricate.secret.injection.StrategyKind;
import org.kubricate.secret.manager.ResolvedProvider;
import org.kubricate.secret.provider.SecretProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Accumulator for how one secret is injected into a stack resource, producing an immutable request
 */
public class SecretInjectionBuilder {
    private final String secretName;

    private final String providerId;

    private final SecretProvider provider;

    private String targetName;

    private SecretInjectionStrategy strategy;

    private String resourceId;

    SecretInjectionBuilder(final String secretName, final ResolvedProvider resolvedProvider) {
        this.secretName = Objects.requireNonNull(secretName, "Secret Name required");
        Objects.requireNonNull(resolvedProvider, "Resolved Provider required");
        this.providerId = resolvedProvider.getProviderId();
        this.provider = resolvedProvider.getProvider();
    }

    /**
     * Set target name such as the environment variable name
     *
     * @param targetName Target name required
     * @return Secret Injection Builder
     */
    public SecretInjectionBuilder forName(final String targetName) {
        this.targetName = Objects.requireNonNull(targetName, "Target Name required");
        return this;
    }

    /**
     * Inject using the default strategy of the only kind supported by the provider
     *
     * @return Secret Injection Builder
     */
    public SecretInjectionBuilder inject() {
        final List<String> supported = new ArrayList<>(provider.getSupportedStrategies());
        if (supported.size() != 1) {
            Collections.sort(supported);
            throw new SecretInjectionStrategyException(String.format(
                    "[SecretInjectionBuilder] inject() requires a strategy because provider supports multiple strategies: %s",
                    String.join(", ", supported)));
        }
        this.strategy = getDefaultStrategy(supported.get(0));
        return this;
    }

    /**
     * Inject using the default strategy for the kind
     *
     * @param kind Strategy kind required
     * @return Secret Injection Builder
     */
    public SecretInjectionBuilder inject(final String kind) {
        Objects.requireNonNull(kind, "Kind required");
        this.strategy = getDefaultStrategy(kind);
        return this;
    }

    /**
     * Inject using an explicit strategy
     *
     * @param strategy Strategy required
     * @return Secret Injection Builder
     */
    public SecretInjectionBuilder inject(final SecretInjectionStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "Strategy required");
        return this;
    }

    /**
     * Set resource identifier overriding context default and kind-based resolution
     *
     * @param resourceId Resource identifier required
     * @return Secret Injection Builder
     */
    public SecretInjectionBuilder intoResource(final String resourceId) {
        this.resourceId = Objects.requireNonNull(resourceId, "Resource ID required");
        return this;
    }

    /**
     * Create immutable request from accumulated settings
     *
     * @return Secret Injection Request
     */
    public SecretInjectionRequest toRequest() {
        if (strategy == null) {
            throw new SecretInjectionStrategyException(String.format("No injection strategy defined for secret: %s", secretName));
        }
        return new SecretInjectionRequest(secretName, targetName, strategy, resourceId);
    }

    String getProviderId() {
        return providerId;
    }

    SecretProvider getProvider() {
        return provider;
    }

    private static SecretInjectionStrategy getDefaultStrategy(final String kind) {
        if (StrategyKind.ENV.equals(kind) || StrategyKind.ENV_FROM.equals(kind)) {
            return SecretInjectionStrategy.builder(kind).containerIndex(0).build();
        } else if (StrategyKind.IMAGE_PULL_SECRET.equals(kind) || StrategyKind.ANNOTATION.equals(kind)) {
            return SecretInjectionStrategy.of(kind);
        }
        throw new SecretInjectionStrategyException(String.format(
                "[SecretInjectionBuilder] inject() without options is not implemented for kind=\"%s\"", kind));
    }
}
