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

import org.kubricate.secret.manager.SecretManager;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Context collecting secret injections declared for one Secret Manager within a Stack
 */
public class SecretsInjectionContext {
    private final Stack stack;

    private final SecretManager manager;

    private final int managerId;

    private final List<SecretInjectionBuilder> builders = new ArrayList<>();

    private String defaultResourceId;

    SecretsInjectionContext(final Stack stack, final SecretManager manager, final int managerId) {
        this.stack = Objects.requireNonNull(stack, "Stack required");
        this.manager = Objects.requireNonNull(manager, "Secret Manager required");
        this.managerId = managerId;
    }

    /**
     * Set resource identifier used when an injection does not select one
     *
     * @param resourceId Resource identifier required
     * @return Secrets Injection Context
     */
    public SecretsInjectionContext setDefaultResourceId(final String resourceId) {
        this.defaultResourceId = Objects.requireNonNull(resourceId, "Resource ID required");
        return this;
    }

    /**
     * Start injection of a registered secret
     *
     * @param secretName Secret name registered with the Secret Manager
     * @return Secret Injection Builder
     */
    public SecretInjectionBuilder secrets(final String secretName) {
        final SecretInjectionBuilder builder = new SecretInjectionBuilder(secretName, manager.resolveProviderFor(secretName));
        builders.add(builder);
        return builder;
    }

    public int getManagerId() {
        return managerId;
    }

    void resolveAll() {
        for (final SecretInjectionBuilder builder : builders) {
            final SecretInjectionResolver resolver = new SecretInjectionResolver(
                    stack.getComposer(), builder.getProviderId(), builder.getProvider(), defaultResourceId);
            stack.registerSecretInjection(resolver.resolve(builder.toRequest()));
        }
    }
}
