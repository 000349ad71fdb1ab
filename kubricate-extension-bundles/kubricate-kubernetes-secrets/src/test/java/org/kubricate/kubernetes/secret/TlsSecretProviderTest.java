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
import org.kubricate.exception.SecretValidationException;
import org.kubricate.secret.SecretValue;
import org.kubricate.secret.injection.SecretInjectionStrategy;
import org.kubricate.secret.injection.StrategyKind;
import org.kubricate.secret.provider.InjectionMeta;
import org.kubricate.secret.provider.ProviderInjection;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TlsSecretProviderTest {
    private final TlsSecretProvider provider = new TlsSecretProvider(new KubernetesSecretConfiguration("ingress-tls", "edge"));

    @Test
    void testPrepareMapsDataKeys() {
        final SecretValue value = SecretValue.of(Map.of("cert", "certificate", "key", "private-key"));

        final Map<?, ?> data = (Map<?, ?>) provider.prepare("INGRESS_TLS", value).get(0).getValue().get("data");

        assertEquals(List.of("tls.crt", "tls.key"), List.copyOf(data.keySet()));
    }

    @Test
    void testPrepareMissingKey() {
        final SecretValue value = SecretValue.of(Map.of("cert", "certificate"));

        assertThrows(SecretValidationException.class, () -> provider.prepare("INGRESS_TLS", value));
    }

    @Test
    void testGetInjectionPayloadEnv() {
        final SecretInjectionStrategy strategy = SecretInjectionStrategy.builder(StrategyKind.ENV).key("tls.crt").build();
        final ProviderInjection injection = new ProviderInjection("tls", provider, "deployment", "spec.template.spec.containers[0].env",
                new InjectionMeta("INGRESS_TLS", "TLS_CERT", strategy));

        final List<Map<String, Object>> payload = provider.getInjectionPayload(List.of(injection));

        assertEquals(List.of(Map.of("name", "TLS_CERT", "valueFrom", Map.of("secretKeyRef", Map.of("name", "ingress-tls", "key", "tls.crt")))), payload);
    }
}
