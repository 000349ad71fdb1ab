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

import org.kubricate.exception.SecretConfigurationException;
import org.kubricate.exception.SecretInjectionStrategyException;
import org.kubricate.exception.SecretValidationException;
import org.kubricate.secret.SecretValue;
import org.kubricate.secret.injection.StrategyKind;
import org.kubricate.secret.provider.ProviderInjection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider for Secrets of a caller-defined type holding arbitrary keys, optionally restricted to a list of allowed keys
 */
public class CustomTypeSecretProvider extends AbstractKubernetesSecretProvider {
    private final List<String> allowedKeys;

    public CustomTypeSecretProvider(final KubernetesSecretConfiguration configuration, final String secretType) {
        this(configuration, secretType, List.of());
    }

    /**
     * Custom Type Secret Provider constructor
     *
     * @param configuration Secret name and namespace required
     * @param secretType Kubernetes Secret type such as vendor.com/custom required
     * @param allowedKeys Allowed keys or empty to accept any key
     */
    public CustomTypeSecretProvider(final KubernetesSecretConfiguration configuration, final String secretType, final List<String> allowedKeys) {
        super(configuration, createSchema(secretType), StrategyKind.ENV, StrategyKind.ENV_FROM);
        this.allowedKeys = allowedKeys == null ? List.of() : List.copyOf(allowedKeys);
    }

    public List<String> getAllowedKeys() {
        return allowedKeys;
    }

    @Override
    protected Map<String, String> createData(final String secretName, final SecretValue value) {
        if (!value.isMap()) {
            throw new SecretValidationException(String.format("Validation error: secret [%s] requires an object of key and value pairs", secretName));
        }

        final Map<String, Object> values = value.asMap();
        if (!allowedKeys.isEmpty()) {
            final List<String> invalidKeys = new ArrayList<>();
            for (final String key : values.keySet()) {
                if (!allowedKeys.contains(key)) {
                    invalidKeys.add(key);
                }
            }
            if (!invalidKeys.isEmpty()) {
                throw new SecretValidationException(String.format("[%s] Invalid keys provided: %s. Allowed keys are: %s.",
                        getProviderType(), String.join(", ", invalidKeys), String.join(", ", allowedKeys)));
            }
        }

        final Map<String, String> data = new LinkedHashMap<>();
        for (final Map.Entry<String, Object> entry : values.entrySet()) {
            if (entry.getValue() != null) {
                data.put(entry.getKey(), entry.getValue().toString());
            }
        }
        return data;
    }

    @Override
    protected String resolveEnvKey(final ProviderInjection injection) {
        final String key = getStrategyKey(injection);
        if (key == null || key.isEmpty()) {
            throw new SecretInjectionStrategyException(String.format("[%s] 'key' is required for env injection.", getProviderType()));
        }
        if (!allowedKeys.isEmpty() && !allowedKeys.contains(key)) {
            throw new SecretInjectionStrategyException(String.format("[%s] Key '%s' is not allowed. Allowed keys are: %s.",
                    getProviderType(), key, String.join(", ", allowedKeys)));
        }
        return key;
    }

    private static SecretDataSchema createSchema(final String secretType) {
        if (secretType == null || secretType.trim().isEmpty()) {
            throw new SecretConfigurationException("[CustomTypeSecretProvider] secretType cannot be empty");
        }
        return SecretDataSchema.builder(secretType).build();
    }
}
