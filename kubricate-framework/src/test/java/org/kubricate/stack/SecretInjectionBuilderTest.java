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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.kubricate.exception.SecretInjectionStrategyException;
import org.kubricate.mock.InMemoryConnector;
import org.kubricate.secret.injection.SecretInjectionStrategy;
import org.kubricate.secret.injection.StrategyKind;
import org.kubricate.secret.manager.SecretManager;
import org.kubricate.secret.provider.SecretProvider;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SecretInjectionBuilderTest {
    private static final String SECRET_NAME = "DB_CREDENTIALS";

    @Mock
    SecretProvider provider;

    private SecretManager manager;

    @BeforeEach
    void setManager() {
        manager = new SecretManager()
                .addConnector("memory", new InMemoryConnector(Map.of()))
                .addProvider("basicAuth", provider)
                .addSecret(SECRET_NAME);
    }

    @Test
    void testInjectRequiresStrategyForMultipleKinds() {
        when(provider.getSupportedStrategies()).thenReturn(Set.of(StrategyKind.ENV_FROM, StrategyKind.ENV));
        final SecretInjectionBuilder builder = newBuilder();

        final SecretInjectionStrategyException exception = assertThrows(SecretInjectionStrategyException.class, builder::inject);
        assertEquals("[SecretInjectionBuilder] inject() requires a strategy because provider supports multiple strategies: env, envFrom", exception.getMessage());
    }

    @Test
    void testInjectSingleKindDefault() {
        when(provider.getSupportedStrategies()).thenReturn(Set.of(StrategyKind.IMAGE_PULL_SECRET));

        final SecretInjectionRequest request = newBuilder().inject().toRequest();

        assertEquals(SecretInjectionStrategy.of(StrategyKind.IMAGE_PULL_SECRET), request.getStrategy());
    }

    @Test
    void testInjectEnvDefaultContainerIndex() {
        final SecretInjectionRequest request = newBuilder().inject(StrategyKind.ENV).toRequest();

        assertEquals(Integer.valueOf(0), request.getStrategy().getContainerIndex());
    }

    @Test
    void testInjectKindWithoutDefault() {
        final SecretInjectionBuilder builder = newBuilder();

        assertThrows(SecretInjectionStrategyException.class, () -> builder.inject(StrategyKind.VOLUME));
    }

    @Test
    void testToRequest() {
        final SecretInjectionStrategy strategy = SecretInjectionStrategy.builder(StrategyKind.ENV).key("password").build();

        final SecretInjectionRequest request = newBuilder().forName("DB_PASSWORD").inject(strategy).intoResource("api").toRequest();

        assertEquals(SECRET_NAME, request.getSecretName());
        assertEquals("DB_PASSWORD", request.getTargetName());
        assertEquals(strategy, request.getStrategy());
        assertEquals("api", request.getResourceId());
    }

    @Test
    void testToRequestTargetNameDefaultsToSecretName() {
        final SecretInjectionRequest request = newBuilder().inject(StrategyKind.ENV).toRequest();

        assertEquals(SECRET_NAME, request.getTargetName());
        assertNull(request.getResourceId());
    }

    private SecretInjectionBuilder newBuilder() {
        return new SecretInjectionBuilder(SECRET_NAME, manager.resolveProviderFor(SECRET_NAME));
    }
}
