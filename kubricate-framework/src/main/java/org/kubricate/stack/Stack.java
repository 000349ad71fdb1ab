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
import org.kubricate.secret.manager.SecretManager;
import org.kubricate.secret.provider.ProviderInjection;
import org.kubricate.secret.provider.SecretProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Stack of composed resources with secret injections resolved against its Secret Managers
 */
public class Stack {
    private static final Logger logger = LoggerFactory.getLogger(Stack.class);

    private final ResourceComposer composer;

    private final Map<Integer, SecretManager> secretManagers = new LinkedHashMap<>();

    private final List<ProviderInjection> injections = new ArrayList<>();

    private String name;

    private boolean injected;

    public Stack(final ResourceComposer composer) {
        this.composer = Objects.requireNonNull(composer, "Resource Composer required");
    }

    /**
     * Create Stack with resources from a template added as object entries
     *
     * @param template Stack Template required
     * @param input Template input
     * @param <T> Input type
     * @return Stack
     */
    public static <T> Stack fromTemplate(final StackTemplate<T> template, final T input) {
        Objects.requireNonNull(template, "Stack Template required");
        final ResourceComposer composer = new ResourceComposer();
        template.create(input).forEach(composer::addObject);

        final Stack stack = new Stack(composer);
        stack.setName(template.getName());
        return stack;
    }

    /**
     * Register Secret Manager and resolve the injections declared in the configurer
     *
     * @param manager Secret Manager required
     * @param configurer Configurer declaring injections required
     * @return Stack
     */
    public Stack useSecrets(final SecretManager manager, final Consumer<SecretsInjectionContext> configurer) {
        Objects.requireNonNull(manager, "Secret Manager required");
        Objects.requireNonNull(configurer, "Configurer required");

        final int managerId = secretManagers.size();
        secretManagers.put(managerId, manager);

        final SecretsInjectionContext context = new SecretsInjectionContext(this, manager, managerId);
        configurer.accept(context);
        context.resolveAll();
        return this;
    }

    public void registerSecretInjection(final ProviderInjection injection) {
        injections.add(Objects.requireNonNull(injection, "Provider Injection required"));
    }

    public List<ProviderInjection> getTargetInjects() {
        return Collections.unmodifiableList(injections);
    }

    public Map<Integer, SecretManager> getSecretManagers() {
        return Collections.unmodifiableMap(secretManagers);
    }

    public SecretManager getSecretManager(final int managerId) {
        final SecretManager manager = secretManagers.get(managerId);
        if (manager == null) {
            throw new IllegalArgumentException(String.format("Secret Manager [%d] not defined: call useSecrets() first", managerId));
        }
        return manager;
    }

    public Stack override(final Map<String, Object> overrides) {
        composer.override(overrides);
        return this;
    }

    public ResourceComposer getComposer() {
        return composer;
    }

    public String getName() {
        return name;
    }

    public void setName(final String name) {
        this.name = name;
    }

    /**
     * Inject secret payloads grouped by provider, resource and path on first invocation, then build resources
     *
     * @return Built resources by identifier
     */
    public Map<String, Object> build() {
        if (!injected) {
            injectSecrets();
            injected = true;
        }
        return composer.build();
    }

    private void injectSecrets() {
        final Map<String, List<ProviderInjection>> groups = new LinkedHashMap<>();
        for (final ProviderInjection injection : injections) {
            final String key = String.format("%s:%s:%s", injection.getProviderId(), injection.getResourceId(), injection.getPath());
            groups.computeIfAbsent(key, groupKey -> new ArrayList<>()).add(injection);
        }

        for (final List<ProviderInjection> group : groups.values()) {
            final ProviderInjection first = group.get(0);
            final SecretProvider provider = first.getProvider();
            final List<Map<String, Object>> payload = provider.getInjectionPayload(group);
            composer.inject(first.getResourceId(), first.getPath(), payload);
            logger.debug("Injected secrets from provider [{}] into resource [{}] at path [{}]", first.getProviderId(), first.getResourceId(), first.getPath());
        }
    }
}
