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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.kubricate.exception.KubricateException;
import org.kubricate.secret.SecretValue;
import org.kubricate.secret.injection.StrategyKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider for Secrets of type kubernetes.io/dockerconfigjson referenced as image pull secrets
 */
public class DockerConfigSecretProvider extends AbstractKubernetesSecretProvider {
    static final String DOCKER_CONFIG_KEY = ".dockerconfigjson";

    static final SecretDataSchema SCHEMA = SecretDataSchema.builder("kubernetes.io/dockerconfigjson")
            .required("username", "username")
            .required("password", "password")
            .required("registry", "registry")
            .build();

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public DockerConfigSecretProvider(final KubernetesSecretConfiguration configuration) {
        super(configuration, SCHEMA, StrategyKind.IMAGE_PULL_SECRET);
    }

    @Override
    protected Map<String, String> createData(final String secretName, final SecretValue value) {
        final Map<String, String> values = getSchema().toData(secretName, value);
        final String username = values.get("username");
        final String password = values.get("password");

        final Map<String, Object> credentials = new LinkedHashMap<>();
        credentials.put("username", username);
        credentials.put("password", password);
        credentials.put("auth", encode(username + ":" + password));

        final Map<String, Object> auths = new LinkedHashMap<>();
        auths.put(values.get("registry"), credentials);

        final Map<String, String> data = new LinkedHashMap<>();
        try {
            data.put(DOCKER_CONFIG_KEY, objectMapper.writeValueAsString(Map.of("auths", auths)));
        } catch (final JsonProcessingException e) {
            throw new KubricateException(String.format("Docker configuration serialization failed for secret [%s]", secretName), e);
        }
        return data;
    }
}
