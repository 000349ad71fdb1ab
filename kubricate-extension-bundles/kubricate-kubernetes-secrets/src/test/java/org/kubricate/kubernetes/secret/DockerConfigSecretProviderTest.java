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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.kubricate.exception.SecretValidationException;
import org.kubricate.secret.SecretValue;
import org.kubricate.secret.injection.SecretInjectionStrategy;
import org.kubricate.secret.injection.StrategyKind;
import org.kubricate.secret.provider.InjectionMeta;
import org.kubricate.secret.provider.ProviderInjection;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DockerConfigSecretProviderTest {
    private static final String REGISTRY = "ghcr.io";

    private final DockerConfigSecretProvider provider = new DockerConfigSecretProvider(KubernetesSecretConfiguration.of("registry-credentials"));

    @Test
    void testPrepare() throws Exception {
        final SecretValue value = SecretValue.of(Map.of("username", "robot", "password", "token", "registry", REGISTRY));

        final Map<String, Object> manifest = provider.prepare("REGISTRY", value).get(0).getValue();

        assertEquals("kubernetes.io/dockerconfigjson", manifest.get("type"));
        final Map<?, ?> data = (Map<?, ?>) manifest.get("data");
        final byte[] decoded = Base64.getDecoder().decode((String) data.get(DockerConfigSecretProvider.DOCKER_CONFIG_KEY));
        final JsonNode credentials = new ObjectMapper().readTree(new String(decoded, StandardCharsets.UTF_8)).path("auths").path(REGISTRY);
        assertEquals("robot", credentials.path("username").asText());
        assertEquals("token", credentials.path("password").asText());
        assertEquals(Base64.getEncoder().encodeToString("robot:token".getBytes(StandardCharsets.UTF_8)), credentials.path("auth").asText());
    }

    @Test
    void testPrepareMissingRegistry() {
        final SecretValue value = SecretValue.of(Map.of("username", "robot", "password", "token"));

        assertThrows(SecretValidationException.class, () -> provider.prepare("REGISTRY", value));
    }

    @Test
    void testImagePullSecret() {
        final SecretInjectionStrategy strategy = SecretInjectionStrategy.of(StrategyKind.IMAGE_PULL_SECRET);
        final String path = provider.getTargetPath(strategy);
        final ProviderInjection injection = new ProviderInjection("docker", provider, "deployment", path, new InjectionMeta("REGISTRY", null, strategy));

        final List<Map<String, Object>> payload = provider.getInjectionPayload(List.of(injection));

        assertEquals("spec.template.spec.imagePullSecrets", path);
        assertEquals(List.of(Map.of("name", "registry-credentials")), payload);
    }
}
