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

import org.kubricate.exception.SecretValidationException;
import org.kubricate.secret.SecretValue;
import org.kubricate.secret.injection.StrategyKind;
import org.kubricate.secret.provider.ProviderInjection;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider for Opaque Secrets storing each scalar secret value under the secret name
 */
public class OpaqueSecretProvider extends AbstractKubernetesSecretProvider {
    static final SecretDataSchema SCHEMA = SecretDataSchema.builder("Opaque").build();

    public OpaqueSecretProvider(final KubernetesSecretConfiguration configuration) {
        super(configuration, SCHEMA, StrategyKind.ENV);
    }

    @Override
    protected Map<String, String> createData(final String secretName, final SecretValue value) {
        if (value.isMap()) {
            throw new SecretValidationException(String.format("Validation error: secret [%s] requires a single value", secretName));
        }

        final Map<String, String> data = new LinkedHashMap<>();
        data.put(secretName, value.asString());
        return data;
    }

    @Override
    protected String resolveEnvKey(final ProviderInjection injection) {
        final String key = getStrategyKey(injection);
        return key == null ? injection.getMeta().getSecretName() : key;
    }
}
