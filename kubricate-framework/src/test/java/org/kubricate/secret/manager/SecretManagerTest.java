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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.kubricate.exception.SecretConfigurationException;
import org.kubricate.exception.SecretConnectorException;
import org.kubricate.exception.SecretRegistrationException;
import org.kubricate.mock.InMemoryConnector;
import org.kubricate.mock.InMemoryProvider;
import org.kubricate.secret.SecretValue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SecretManagerTest {
    private static final String CONNECTOR_NAME = "memory";

    private static final String PROVIDER_NAME = "store";

    private static final String API_KEY = "API_KEY";

    private static final String DB_PASSWORD = "DB_PASSWORD";

    private InMemoryConnector connector;

    private InMemoryProvider provider;

    private SecretManager manager;

    @BeforeEach
    void setManager() {
        connector = new InMemoryConnector(Map.of(API_KEY, "api-secret", DB_PASSWORD, "db-secret"));
        provider = new InMemoryProvider();
        manager = new SecretManager();
    }

    @Test
    void testAddConnectorDuplicate() {
        manager.addConnector(CONNECTOR_NAME, connector);

        final SecretRegistrationException exception = assertThrows(SecretRegistrationException.class, () -> manager.addConnector(CONNECTOR_NAME, connector));
        assertEquals("Connector memory already exists", exception.getMessage());
    }

    @Test
    void testAddProviderDuplicate() {
        manager.addProvider(PROVIDER_NAME, provider);

        final SecretRegistrationException exception = assertThrows(SecretRegistrationException.class, () -> manager.addProvider(PROVIDER_NAME, provider));
        assertEquals("Provider store already exists", exception.getMessage());
    }

    @Test
    void testAddSecretDuplicate() {
        manager.addSecret(API_KEY);

        final SecretRegistrationException exception = assertThrows(SecretRegistrationException.class, () -> manager.addSecret(API_KEY));
        assertEquals("Secret API_KEY already exists", exception.getMessage());
    }

    @Test
    void testAddProviderAssignsName() {
        manager.addProvider(PROVIDER_NAME, provider);

        assertEquals(PROVIDER_NAME, provider.getName());
    }

    @Test
    void testBuildRequiresRegistrations() {
        assertEquals("No connectors registered", assertThrows(SecretRegistrationException.class, manager::build).getMessage());

        manager.addConnector(CONNECTOR_NAME, connector);
        assertEquals("No providers registered", assertThrows(SecretRegistrationException.class, manager::build).getMessage());

        manager.addProvider(PROVIDER_NAME, provider);
        assertEquals("No secrets registered", assertThrows(SecretRegistrationException.class, manager::build).getMessage());
    }

    @Test
    void testBuildMultipleProvidersWithoutDefault() {
        manager.addConnector(CONNECTOR_NAME, connector)
                .addProvider(PROVIDER_NAME, provider)
                .addProvider("other", new InMemoryProvider("other"))
                .addSecret(API_KEY);

        final SecretConfigurationException exception = assertThrows(SecretConfigurationException.class, manager::build);
        assertEquals("No default provider set, and multiple providers registered", exception.getMessage());
    }

    @Test
    void testBuildMultipleConnectorsWithoutDefault() {
        manager.addConnector(CONNECTOR_NAME, connector)
                .addConnector("other", new InMemoryConnector(Map.of()))
                .addProvider(PROVIDER_NAME, provider)
                .addSecret(API_KEY);

        final SecretConfigurationException exception = assertThrows(SecretConfigurationException.class, manager::build);
        assertEquals("No default connector set, and multiple connectors registered", exception.getMessage());
    }

    @Test
    void testBuildResolvesSoleDefaults() {
        newManager().build();

        final SecretOptions secret = manager.getSecrets().get(API_KEY);
        assertEquals(CONNECTOR_NAME, secret.getConnector());
        assertEquals(PROVIDER_NAME, secret.getProvider());
        assertEquals(CONNECTOR_NAME, manager.getDefaultConnector());
        assertEquals(PROVIDER_NAME, manager.getDefaultProvider());
    }

    @Test
    void testGetDefaultsFollowRegistrations() {
        assertNull(manager.getDefaultConnector());
        assertNull(manager.getDefaultProvider());

        manager.addConnector(CONNECTOR_NAME, connector)
                .addProvider(PROVIDER_NAME, provider);
        assertEquals(CONNECTOR_NAME, manager.getDefaultConnector());
        assertEquals(PROVIDER_NAME, manager.getDefaultProvider());

        manager.addProvider("other", new InMemoryProvider("other"));
        assertNull(manager.getDefaultProvider());

        manager.setDefaultProvider("other");
        assertEquals("other", manager.getDefaultProvider());
    }

    @Test
    void testBuildExplicitDefaults() {
        final InMemoryProvider other = new InMemoryProvider("other");
        manager.addConnector(CONNECTOR_NAME, connector)
                .addProvider(PROVIDER_NAME, provider)
                .addProvider("other", other)
                .setDefaultProvider("other")
                .addSecret(API_KEY)
                .addSecret(new SecretOptions(DB_PASSWORD, null, PROVIDER_NAME));

        assertSame(other, manager.resolveProviderFor(API_KEY).getProvider());
        assertSame(provider, manager.resolveProviderFor(DB_PASSWORD).getProvider());
        assertEquals(PROVIDER_NAME, manager.resolveProviderFor(DB_PASSWORD).getProviderId());
    }

    @Test
    void testBuildUnknownProviderReference() {
        manager.addConnector(CONNECTOR_NAME, connector)
                .addProvider(PROVIDER_NAME, provider)
                .addSecret(new SecretOptions(API_KEY, null, "missing"));

        final SecretRegistrationException exception = assertThrows(SecretRegistrationException.class, manager::build);
        assertEquals("Provider missing not found", exception.getMessage());
    }

    @Test
    void testPrepare() {
        final List<PreparedSecret> prepared = newManager().prepare();

        assertEquals(2, prepared.size());
        assertEquals(API_KEY, prepared.get(0).getName());
        assertEquals(SecretValue.of("api-secret"), prepared.get(0).getValue());
        assertEquals(1, prepared.get(0).getEffects().size());
        assertEquals(DB_PASSWORD, prepared.get(1).getName());
    }

    @Test
    void testPrepareLoadsOnce() {
        final InMemoryConnector spyConnector = spy(connector);
        manager.addConnector(CONNECTOR_NAME, spyConnector)
                .addProvider(PROVIDER_NAME, provider)
                .addSecret(API_KEY)
                .addSecret(DB_PASSWORD);

        manager.prepare();

        verify(spyConnector, times(1)).load(anyCollection());
    }

    @Test
    void testPrepareMissingSecret() {
        manager.addConnector(CONNECTOR_NAME, new InMemoryConnector(Map.of()))
                .addProvider(PROVIDER_NAME, provider)
                .addSecret(API_KEY);

        final SecretConnectorException exception = assertThrows(SecretConnectorException.class, manager::prepare);
        assertEquals("Missing secret: API_KEY", exception.getMessage());
    }

    @Test
    void testResolveProviderForUnregistered() {
        newManager();

        final SecretRegistrationException exception = assertThrows(SecretRegistrationException.class, () -> manager.resolveProviderFor("UNKNOWN"));
        assertEquals("Secret \"UNKNOWN\" is not registered.", exception.getMessage());
    }

    @Test
    void testResolveSecretValueForApply() {
        final ResolvedSecretValue resolved = newManager().resolveSecretValueForApply(DB_PASSWORD);

        assertSame(provider, resolved.getProvider());
        assertEquals(SecretValue.of("db-secret"), resolved.getValue());
    }

    @Test
    void testApplyWorkingDirKeepsConfigured() {
        final Path configured = Path.of("configured");
        connector.setWorkingDir(configured);
        newManager().applyWorkingDir(Path.of("project"));

        assertEquals(configured, connector.getWorkingDir());
    }

    private SecretManager newManager() {
        return manager.addConnector(CONNECTOR_NAME, connector)
                .addProvider(PROVIDER_NAME, provider)
                .addSecret(API_KEY)
                .addSecret(DB_PASSWORD);
    }
}
