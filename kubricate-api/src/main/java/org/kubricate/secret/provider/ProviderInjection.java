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

import java.util.Objects;

/**
 * Resolved request to place a secret into a path of a named output resource
 */
public final class ProviderInjection {
    private final String providerId;

    private final SecretProvider provider;

    private final String resourceId;

    private final String path;

    private final InjectionMeta meta;

    public ProviderInjection(
            final String providerId,
            final SecretProvider provider,
            final String resourceId,
            final String path,
            final InjectionMeta meta
    ) {
        this.providerId = Objects.requireNonNull(providerId, "Provider ID required");
        this.provider = Objects.requireNonNull(provider, "Provider required");
        this.resourceId = Objects.requireNonNull(resourceId, "Resource ID required");
        this.path = Objects.requireNonNull(path, "Path required");
        this.meta = Objects.requireNonNull(meta, "Injection Meta required");
    }

    public String getProviderId() {
        return providerId;
    }

    public SecretProvider getProvider() {
        return provider;
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getPath() {
        return path;
    }

    public InjectionMeta getMeta() {
        return meta;
    }

    @Override
    public String toString() {
        return String.format("ProviderInjection[providerId=%s, resourceId=%s, path=%s, secretName=%s]",
                providerId, resourceId, path, meta.getSecretName());
    }
}
