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
package org.kubricate.kubernetes.secret;

import org.junit.jupiter.api.Test;
import org.kubricate.composer.ResourceComposer;
import org.kubricate.config.ProjectConfiguration;
import org.kubricate.exception.SecretConflictException;
import org.kubricate.mock.InMemoryConnector;
import org.kubricate.object.path.ObjectPath;
import org.kubricate.secret.PreparedEffect;
import org.kubricate.secret.injection.SecretInjectionStrategy;
import org.kubricate.secret.injection.StrategyKind;
import org.kubricate.secret.manager.SecretManager;
import org.kubricate.secret.manager.SecretRegistry;
import org.kubricate.secret.orchestrator.ConflictOptions;
import org.kubricate.secret.orchestrator.ConflictStrategy;
import org.kubricate.secret.orchestrator.EffectsOptions;
import org.kubricate.secret.orchestrator.SecretsOrchestrator;
import org.kubricate.stack.Stack;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KubernetesSecretsOrchestrationTest {
    private static final EffectsOptions EFFECTS_OPTIONS = new EffectsOptions(Path.of("target"));

    private static final Map<String, Object> VALUES = Map.of(
            "API_KEY", "abc",
            "DB_PASSWORD", "secret",
            "GIT", Map.of("username", "robot", "password", "changeit")
    );

    @Test
    void testIntraProviderAutoMerge() {
        final SecretManager manager = newOpaqueManager();
        final ProjectConfiguration configuration = ProjectConfiguration.builder()
                .secretManager(manager)
                .conflictOptions(ConflictOptions.builder().intraProvider(ConflictStrategy.AUTO_MERGE).build())
                .build();

        final List<PreparedEffect> effects = new SecretsOrchestrator(configuration, EFFECTS_OPTIONS).apply();

        assertEquals(1, effects.size());
        assertEquals(Map.of("API_KEY", "YWJj", "DB_PASSWORD", "c2VjcmV0"), effects.get(0).getValue().get("data"));
    }

    @Test
    void testCrossManagerError() {
        final SecretRegistry registry = new SecretRegistry()
                .add("frontend", newOpaqueManager())
                .add("backend", newOpaqueManager());
        final ProjectConfiguration configuration = ProjectConfiguration.builder()
                .secretRegistry(registry)
                .conflictOptions(ConflictOptions.builder().crossManager(ConflictStrategy.ERROR).build())
                .build();

        final SecretsOrchestrator orchestrator = new SecretsOrchestrator(configuration, EFFECTS_OPTIONS);

        final SecretConflictException exception = assertThrows(SecretConflictException.class, orchestrator::apply);
        assertTrue(exception.getMessage().contains("[conflict:error:crossManager]"));
        assertTrue(exception.getMessage().contains("default/app-secrets"));
    }

    @Test
    void testStackEnvFromWithPrefix() {
        final SecretManager manager = new SecretManager()
                .addConnector("memory", new InMemoryConnector(VALUES))
                .addProvider("basicAuth", new BasicAuthSecretProvider(KubernetesSecretConfiguration.of("git-credentials")))
                .addSecret("GIT");
        final ResourceComposer composer = new ResourceComposer().addObject("deployment", Map.of("kind", "Deployment"));
        final SecretInjectionStrategy strategy = SecretInjectionStrategy.builder(StrategyKind.ENV_FROM).prefix("GIT_").build();

        final Stack stack = new Stack(composer).useSecrets(manager, context -> {
            context.secrets("GIT").inject(strategy);
            context.secrets("GIT").inject(strategy);
        });

        final Object envFrom = ObjectPath.parse("spec.template.spec.containers[0].envFrom").get(stack.build().get("deployment"));
        assertEquals(List.of(Map.of("prefix", "GIT_", "secretRef", Map.of("name", "git-credentials"))), envFrom);
    }

    @Test
    void testStackEnvKeys() {
        final SecretManager manager = new SecretManager()
                .addConnector("memory", new InMemoryConnector(VALUES))
                .addProvider("basicAuth", new BasicAuthSecretProvider(KubernetesSecretConfiguration.of("git-credentials")))
                .addSecret("GIT");
        final ResourceComposer composer = new ResourceComposer().addObject("deployment", Map.of("kind", "Deployment"));

        final Stack stack = new Stack(composer).useSecrets(manager, context -> {
            context.secrets("GIT").forName("GIT_USERNAME").inject(SecretInjectionStrategy.builder(StrategyKind.ENV).key("username").build());
            context.secrets("GIT").forName("GIT_PASSWORD").inject(SecretInjectionStrategy.builder(StrategyKind.ENV).key("password").build());
        });

        final List<?> env = (List<?>) ObjectPath.parse("spec.template.spec.containers[0].env").get(stack.build().get("deployment"));
        assertEquals(2, env.size());
        assertEquals("GIT_USERNAME", ((Map<?, ?>) env.get(0)).get("name"));
        assertEquals("GIT_PASSWORD", ((Map<?, ?>) env.get(1)).get("name"));
    }

    private static SecretManager newOpaqueManager() {
        return new SecretManager()
                .addConnector("memory", new InMemoryConnector(VALUES))
                .addProvider("opaque", new OpaqueSecretProvider(KubernetesSecretConfiguration.of("app-secrets")))
                .addSecret("API_KEY")
                .addSecret("DB_PASSWORD");
    }
}
