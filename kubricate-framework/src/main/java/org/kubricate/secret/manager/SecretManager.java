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
package org.kubricate.secret.manager;

import org.kubricate.exception.SecretConfigurationException;
import org.kubricate.exception.SecretRegistrationException;
import org.kubricate.secret.PreparedEffect;
import org.kubricate.secret.SecretValue;
import org.kubricate.secret.connector.SecretConnector;
import org.kubricate.secret.provider.SecretProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registry binding secret names to connectors resolving their values and providers preparing their effects
 */
public class SecretManager {
    private static final Logger logger = LoggerFactory.getLogger(SecretManager.class);

    private final Map<String, SecretConnector> connectors = new LinkedHashMap<>();

    private final Map<String, SecretProvider> providers = new LinkedHashMap<>();

    private final Map<String, SecretOptions> secrets = new LinkedHashMap<>();

    private String defaultConnector;

    private String defaultProvider;

    private Map<String, SecretOptions> resolvedSecrets;

    /**
     * Add Connector under a unique name
     *
     * @param name Connector name required
     * @param connector Connector required
     * @return Secret Manager
     */
    public SecretManager addConnector(final String name, final SecretConnector connector) {
        Objects.requireNonNull(name, "Connector Name required");
        Objects.requireNonNull(connector, "Connector required");
        if (connectors.containsKey(name)) {
            throw new SecretRegistrationException(String.format("Connector %s already exists", name));
        }
        connectors.put(name, connector);
        resolvedSecrets = null;
        return this;
    }

    /**
     * Add Provider under a unique name and assign the name to the provider
     *
     * @param name Provider name required
     * @param provider Provider required
     * @return Secret Manager
     */
    public SecretManager addProvider(final String name, final SecretProvider provider) {
        Objects.requireNonNull(name, "Provider Name required");
        Objects.requireNonNull(provider, "Provider required");
        if (providers.containsKey(name)) {
            throw new SecretRegistrationException(String.format("Provider %s already exists", name));
        }
        provider.setName(name);
        providers.put(name, provider);
        resolvedSecrets = null;
        return this;
    }

    public SecretManager addSecret(final String name) {
        return addSecret(SecretOptions.of(name));
    }

    /**
     * Add Secret declaration with a unique name
     *
     * @param options Secret Options required
     * @return Secret Manager
     */
    public SecretManager addSecret(final SecretOptions options) {
        Objects.requireNonNull(options, "Secret Options required");
        if (secrets.containsKey(options.getName())) {
            throw new SecretRegistrationException(String.format("Secret %s already exists", options.getName()));
        }
        secrets.put(options.getName(), options);
        resolvedSecrets = null;
        return this;
    }

    public SecretManager setDefaultConnector(final String name) {
        this.defaultConnector = Objects.requireNonNull(name, "Default Connector required");
        resolvedSecrets = null;
        return this;
    }

    public SecretManager setDefaultProvider(final String name) {
        this.defaultProvider = Objects.requireNonNull(name, "Default Provider required");
        resolvedSecrets = null;
        return this;
    }

    /**
     * Validate registrations and resolve default connector and provider for every declared secret
     *
     * @return Secret Manager
     */
    public SecretManager build() {
        if (connectors.isEmpty()) {
            throw new SecretRegistrationException("No connectors registered");
        }
        if (providers.isEmpty()) {
            throw new SecretRegistrationException("No providers registered");
        }
        if (secrets.isEmpty()) {
            throw new SecretRegistrationException("No secrets registered");
        }

        final String connectorName = resolveDefault(defaultConnector, connectors, "connector");
        final String providerName = resolveDefault(defaultProvider, providers, "provider");

        final Map<String, SecretOptions> resolved = new LinkedHashMap<>();
        for (final SecretOptions options : secrets.values()) {
            final SecretOptions secret = options.withDefaults(connectorName, providerName);
            getConnector(secret.getConnector());
            getProvider(secret.getProvider());
            resolved.put(secret.getName(), secret);
        }
        resolvedSecrets = resolved;
        logger.debug("Secret Manager built: secrets [{}] default connector [{}] default provider [{}]", resolved.size(), connectorName, providerName);
        return this;
    }

    /**
     * Get declared secrets with connector and provider resolved
     *
     * @return Secrets in registration order
     */
    public Map<String, SecretOptions> getSecrets() {
        return Collections.unmodifiableMap(getResolvedSecrets());
    }

    public Map<String, SecretConnector> getConnectors() {
        return Collections.unmodifiableMap(connectors);
    }

    public Map<String, SecretProvider> getProviders() {
        return Collections.unmodifiableMap(providers);
    }

    /**
     * Get default connector name, either configured or the sole registered connector
     *
     * @return Default connector name or null when multiple connectors are registered without a configured default
     */
    public String getDefaultConnector() {
        return findDefault(defaultConnector, connectors);
    }

    /**
     * Get default provider name, either configured or the sole registered provider
     *
     * @return Default provider name or null when multiple providers are registered without a configured default
     */
    public String getDefaultProvider() {
        return findDefault(defaultProvider, providers);
    }

    public SecretConnector getConnector(final String name) {
        final SecretConnector connector = connectors.get(name);
        if (connector == null) {
            throw new SecretRegistrationException(String.format("Connector %s not found", name));
        }
        return connector;
    }

    public SecretProvider getProvider(final String name) {
        final SecretProvider provider = providers.get(name);
        if (provider == null) {
            throw new SecretRegistrationException(String.format("Provider %s not found", name));
        }
        return provider;
    }

    /**
     * Assign working directory to every connector that does not have one configured
     *
     * @param workingDir Working directory required
     */
    public void applyWorkingDir(final Path workingDir) {
        Objects.requireNonNull(workingDir, "Working Directory required");
        for (final SecretConnector connector : connectors.values()) {
            if (connector.getWorkingDir() == null) {
                connector.setWorkingDir(workingDir);
            }
        }
    }

    /**
     * Load every declared secret through its connector, loading each name once per connector
     *
     * @return Secret values in registration order
     */
    public Map<String, SecretValue> loadSecrets() {
        final Map<String, SecretOptions> resolved = getResolvedSecrets();

        final Map<String, List<String>> namesByConnector = new LinkedHashMap<>();
        for (final SecretOptions secret : resolved.values()) {
            namesByConnector.computeIfAbsent(secret.getConnector(), connector -> new ArrayList<>()).add(secret.getName());
        }

        final Map<String, SecretValue> values = new LinkedHashMap<>();
        for (final Map.Entry<String, List<String>> entry : namesByConnector.entrySet()) {
            final SecretConnector connector = getConnector(entry.getKey());
            connector.load(entry.getValue());
            for (final String name : entry.getValue()) {
                values.put(name, connector.get(name));
            }
        }

        final Map<String, SecretValue> ordered = new LinkedHashMap<>();
        for (final String name : resolved.keySet()) {
            ordered.put(name, values.get(name));
        }
        return ordered;
    }

    /**
     * Resolve secret values and prepare provider effects for every declared secret
     *
     * @return Prepared secrets in registration order
     */
    public List<PreparedSecret> prepare() {
        final Map<String, SecretValue> values = loadSecrets();

        final List<PreparedSecret> prepared = new ArrayList<>();
        for (final SecretOptions secret : getResolvedSecrets().values()) {
            final SecretValue value = values.get(secret.getName());
            final List<PreparedEffect> effects = getProvider(secret.getProvider()).prepare(secret.getName(), value);
            prepared.add(new PreparedSecret(secret.getName(), value, effects));
        }
        return prepared;
    }

    /**
     * Resolve provider for a secret during injection planning without loading values
     *
     * @param secretName Secret name required
     * @return Resolved Provider with registration name
     */
    public ResolvedProvider resolveProviderFor(final String secretName) {
        final SecretOptions secret = requireSecret(secretName);
        return new ResolvedProvider(secret.getProvider(), getProvider(secret.getProvider()));
    }

    /**
     * Resolve provider and load the value of a secret at apply time
     *
     * @param secretName Secret name required
     * @return Resolved Secret Value
     */
    public ResolvedSecretValue resolveSecretValueForApply(final String secretName) {
        final SecretOptions secret = requireSecret(secretName);
        final SecretConnector connector = getConnector(secret.getConnector());
        connector.load(List.of(secretName));
        return new ResolvedSecretValue(getProvider(secret.getProvider()), connector.get(secretName));
    }

    private SecretOptions requireSecret(final String secretName) {
        Objects.requireNonNull(secretName, "Secret Name required");
        final SecretOptions secret = getResolvedSecrets().get(secretName);
        if (secret == null) {
            throw new SecretRegistrationException(String.format("Secret \"%s\" is not registered.", secretName));
        }
        return secret;
    }

    private Map<String, SecretOptions> getResolvedSecrets() {
        if (resolvedSecrets == null) {
            build();
        }
        return resolvedSecrets;
    }

    private static String resolveDefault(final String configured, final Map<String, ?> registered, final String type) {
        if (configured != null && !registered.containsKey(configured)) {
            throw new SecretRegistrationException(String.format("Default %s %s not found", type, configured));
        }
        final String resolved = findDefault(configured, registered);
        if (resolved == null) {
            throw new SecretConfigurationException(String.format("No default %s set, and multiple %ss registered", type, type));
        }
        return resolved;
    }

    private static String findDefault(final String configured, final Map<String, ?> registered) {
        if (configured != null) {
            return configured;
        }
        return registered.size() == 1 ? registered.keySet().iterator().next() : null;
    }
}
