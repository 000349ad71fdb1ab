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

import org.kubricate.composer.ResourceComposer;
import org.kubricate.exception.ResourceCompositionException;
import org.kubricate.secret.provider.InjectionMeta;
import org.kubricate.secret.provider.ProviderInjection;
import org.kubricate.secret.provider.SecretProvider;

import java.util.List;
import java.util.Objects;

/**
 * Resolver turning injection requests into provider injections: resource from the request, then the context
 * default, then the single composer resource whose kind matches the provider target kind
 */
public class SecretInjectionResolver {
    private static final String RESOURCE_HINT = "Use intoResource(...) to select a resource explicitly, or setDefaultResourceId(...) on the injection context.";

    private final ResourceComposer composer;

    private final String providerId;

    private final SecretProvider provider;

    private final String defaultResourceId;

    public SecretInjectionResolver(final ResourceComposer composer, final String providerId, final SecretProvider provider, final String defaultResourceId) {
        this.composer = Objects.requireNonNull(composer, "Resource Composer required");
        this.providerId = Objects.requireNonNull(providerId, "Provider ID required");
        this.provider = Objects.requireNonNull(provider, "Provider required");
        this.defaultResourceId = defaultResourceId;
    }

    /**
     * Resolve request into a provider injection
     *
     * @param request Secret Injection Request required
     * @return Provider Injection
     */
    public ProviderInjection resolve(final SecretInjectionRequest request) {
        Objects.requireNonNull(request, "Request required");
        final String resourceId = resolveResourceId(request);
        final String path = provider.getTargetPath(request.getStrategy());
        final InjectionMeta meta = new InjectionMeta(request.getSecretName(), request.getTargetName(), request.getStrategy());
        return new ProviderInjection(providerId, provider, resourceId, path, meta);
    }

    private String resolveResourceId(final SecretInjectionRequest request) {
        if (request.getResourceId() != null) {
            return request.getResourceId();
        }
        if (defaultResourceId != null) {
            return defaultResourceId;
        }

        final String kind = provider.getTargetKind();
        final List<String> resourceIds = composer.findResourceIdsByKind(kind);
        if (resourceIds.isEmpty()) {
            throw new ResourceCompositionException(String.format(
                    "[SecretInjectionBuilder] Could not resolve resourceId for secret \"%s\" from provider targetKind \"%s\". %s",
                    request.getSecretName(), kind, RESOURCE_HINT));
        } else if (resourceIds.size() > 1) {
            throw new ResourceCompositionException(String.format(
                    "[SecretInjectionBuilder] Multiple resourceIds %s found for secret \"%s\" from provider targetKind \"%s\". %s",
                    resourceIds, request.getSecretName(), kind, RESOURCE_HINT));
        }
        return resourceIds.get(0);
    }
}
