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
import org.kubricate.composer.ResourceComposer;
import org.kubricate.exception.ResourceCompositionException;
import org.kubricate.exception.SecretInjectionStrategyException;
import org.kubricate.mock.InMemoryConnector;
import org.kubricate.mock.InMemoryProvider;
import org.kubricate.object.path.ObjectPath;
import org.kubricate.secret.injection.StrategyKind;
import org.kubricate.secret.manager.SecretManager;
import org.kubricate.secret.provider.ProviderInjection;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StackTest {
    private static final String ENV_PATH = "spec.template.spec.containers[0].env";

    private static final String API_KEY = "API_KEY";

    private static final String DB_PASSWORD = "DB_PASSWORD";

    private static final String DEPLOYMENT_ID = "deployment";

    private static final StackTemplate<String> APP_TEMPLATE = StackTemplate.of("app", name -> Map.of(
            DEPLOYMENT_ID, Map.of("kind", "Deployment", "metadata", Map.of("name", name)),
            "service", Map.of("kind", "Service", "metadata", Map.of("name", name))
    ));

    private SecretManager manager;

    @BeforeEach
    void setManager() {
        manager = new SecretManager()
                .addConnector("memory", new InMemoryConnector(Map.of(API_KEY, "api", DB_PASSWORD, "db")))
                .addProvider("store", new InMemoryProvider())
                .addSecret(API_KEY)
                .addSecret(DB_PASSWORD);
    }

    @Test
    void testFromTemplate() {
        final Stack stack = Stack.fromTemplate(APP_TEMPLATE, "web");

        assertEquals("app", stack.getName());
        assertEquals(List.of(DEPLOYMENT_ID), stack.getComposer().findResourceIdsByKind("Deployment"));
    }

    @Test
    void testUseSecretsResolvesByTargetKind() {
        final Stack stack = Stack.fromTemplate(APP_TEMPLATE, "web")
                .useSecrets(manager, context -> context.secrets(API_KEY).forName("APP_API_KEY").inject());

        final List<ProviderInjection> injections = stack.getTargetInjects();
        assertEquals(1, injections.size());
        final ProviderInjection injection = injections.get(0);
        assertEquals("store", injection.getProviderId());
        assertEquals(DEPLOYMENT_ID, injection.getResourceId());
        assertEquals(ENV_PATH, injection.getPath());
        assertEquals("APP_API_KEY", injection.getMeta().getTargetName());
        assertSame(manager, stack.getSecretManager(0));
    }

    @Test
    void testBuildGroupsInjections() {
        final Stack stack = Stack.fromTemplate(APP_TEMPLATE, "web")
                .useSecrets(manager, context -> {
                    context.secrets(API_KEY).inject(StrategyKind.ENV);
                    context.secrets(DB_PASSWORD).inject(StrategyKind.ENV);
                });

        final Map<String, Object> resources = stack.build();

        final Object env = ObjectPath.parse(ENV_PATH).get(resources.get(DEPLOYMENT_ID));
        final List<Object> expected = List.of(
                Map.of("name", API_KEY, "valueFrom", Map.of("secretKeyRef", Map.of("name", "in-memory", "key", API_KEY))),
                Map.of("name", DB_PASSWORD, "valueFrom", Map.of("secretKeyRef", Map.of("name", "in-memory", "key", DB_PASSWORD)))
        );
        assertEquals(expected, env);
        assertEquals(resources, stack.build());
    }

    @Test
    void testBuildAppendsToExistingEnv() {
        final Map<String, Object> container = Map.of("name", "app", "env", List.of(Map.of("name", "MODE", "value", "production")));
        final ResourceComposer composer = new ResourceComposer().addObject(DEPLOYMENT_ID, Map.of(
                "kind", "Deployment",
                "spec", Map.of("template", Map.of("spec", Map.of("containers", List.of(container))))
        ));
        final Stack stack = new Stack(composer).useSecrets(manager, context -> context.secrets(API_KEY).inject());

        final List<?> env = (List<?>) ObjectPath.parse(ENV_PATH).get(stack.build().get(DEPLOYMENT_ID));

        assertEquals(2, env.size());
        assertEquals(Map.of("name", "MODE", "value", "production"), env.get(0));
    }

    @Test
    void testUseSecretsIntoResource() {
        final ResourceComposer composer = new ResourceComposer()
                .addObject("api", Map.of("kind", "Deployment"))
                .addObject("worker", Map.of("kind", "Deployment"));

        final Stack stack = new Stack(composer).useSecrets(manager, context -> context.secrets(API_KEY).inject().intoResource("worker"));

        assertEquals("worker", stack.getTargetInjects().get(0).getResourceId());
    }

    @Test
    void testUseSecretsDefaultResourceId() {
        final ResourceComposer composer = new ResourceComposer()
                .addObject("api", Map.of("kind", "Deployment"))
                .addObject("worker", Map.of("kind", "Deployment"));

        final Stack stack = new Stack(composer).useSecrets(manager, context -> {
            context.setDefaultResourceId("api");
            context.secrets(API_KEY).inject();
        });

        assertEquals("api", stack.getTargetInjects().get(0).getResourceId());
    }

    @Test
    void testUseSecretsMultipleResourcesOfKind() {
        final ResourceComposer composer = new ResourceComposer()
                .addObject("api", Map.of("kind", "Deployment"))
                .addObject("worker", Map.of("kind", "Deployment"));
        final Stack stack = new Stack(composer);

        final ResourceCompositionException exception = assertThrows(ResourceCompositionException.class,
                () -> stack.useSecrets(manager, context -> context.secrets(API_KEY).inject()));
        assertTrue(exception.getMessage().contains("Multiple resourceIds"));
    }

    @Test
    void testUseSecretsNoResourceOfKind() {
        final Stack stack = new Stack(new ResourceComposer().addObject("service", Map.of("kind", "Service")));

        final ResourceCompositionException exception = assertThrows(ResourceCompositionException.class,
                () -> stack.useSecrets(manager, context -> context.secrets(API_KEY).inject()));
        assertTrue(exception.getMessage().contains("Could not resolve resourceId"));
    }

    @Test
    void testUseSecretsWithoutStrategy() {
        final Stack stack = Stack.fromTemplate(APP_TEMPLATE, "web");

        final SecretInjectionStrategyException exception = assertThrows(SecretInjectionStrategyException.class,
                () -> stack.useSecrets(manager, context -> context.secrets(API_KEY).forName("KEY")));
        assertEquals("No injection strategy defined for secret: API_KEY", exception.getMessage());
    }

    @Test
    void testOverride() {
        final Stack stack = Stack.fromTemplate(APP_TEMPLATE, "web")
                .override(Map.of("service", Map.of("metadata", Map.of("namespace", "apps"))));

        final Object service = stack.build().get("service");

        assertEquals(Map.of("kind", "Service", "metadata", Map.of("name", "web", "namespace", "apps")), service);
    }
}
