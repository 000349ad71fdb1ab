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
package org.kubricate.env.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.kubricate.exception.SecretConnectorException;
import org.kubricate.secret.SecretValue;
import org.kubricate.secret.connector.AbstractSecretConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Secret Connector reading prefixed environment variables, optionally supplemented from a dotenv file in the working directory
 */
public class EnvConnector extends AbstractSecretConnector {
    private static final Logger logger = LoggerFactory.getLogger(EnvConnector.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final EnvConnectorConfiguration configuration;

    private final Supplier<Map<String, String>> environmentSupplier;

    private final DotEnvReader dotEnvReader = new DotEnvReader();

    private final Map<String, SecretValue> secrets = new LinkedHashMap<>();

    public EnvConnector() {
        this(EnvConnectorConfiguration.withDefaults());
    }

    public EnvConnector(final EnvConnectorConfiguration configuration) {
        this(configuration, System::getenv);
    }

    /**
     * Environment Connector constructor with environment variables source
     *
     * @param configuration Connector configuration required
     * @param environmentSupplier Supplier of environment variables required
     */
    public EnvConnector(final EnvConnectorConfiguration configuration, final Supplier<Map<String, String>> environmentSupplier) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration required");
        this.environmentSupplier = Objects.requireNonNull(environmentSupplier, "Environment Supplier required");
    }

    public EnvConnectorConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Get dotenv file path resolved against the working directory or the current directory
     *
     * @return Path to dotenv file
     */
    public Path getDotEnvPath() {
        final Path workingDir = getWorkingDir() == null ? Path.of("") : getWorkingDir();
        return workingDir.resolve(DotEnvReader.DOT_ENV_FILE_NAME).toAbsolutePath();
    }

    @Override
    public void load(final Collection<String> names) {
        final Map<String, String> environment = getEnvironment();

        for (final String name : names) {
            final String expectedName = configuration.getPrefix() + name;
            final String value = findVariable(environment, expectedName);
            if (StringUtils.isEmpty(value)) {
                throw new SecretConnectorException(String.format("Missing environment variable: %s", expectedName));
            }

            secrets.put(normalizeName(name), parseSecretValue(value));
            logger.debug("Loaded secret [{}] from [{}] value [{}]", name, expectedName, SecretValueMasker.mask(value));
        }
    }

    @Override
    public SecretValue get(final String name) {
        final SecretValue value = secrets.get(normalizeName(name));
        if (value == null) {
            throw new SecretConnectorException(String.format("Secret '%s' not loaded. Did you call load()?", name));
        }
        return value;
    }

    private Map<String, String> getEnvironment() {
        final Map<String, String> environment = new LinkedHashMap<>();
        if (configuration.isAllowDotEnv()) {
            final Path dotEnvPath = getDotEnvPath();
            environment.putAll(dotEnvReader.read(dotEnvPath));
            logger.debug("Loaded dotenv variables from [{}]", dotEnvPath);
        }
        // Process environment variables take precedence over dotenv variables
        environment.putAll(environmentSupplier.get());
        return environment;
    }

    private String findVariable(final Map<String, String> environment, final String expectedName) {
        if (!configuration.isCaseInsensitive()) {
            return environment.get(expectedName);
        }

        for (final Map.Entry<String, String> entry : environment.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(expectedName)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private String normalizeName(final String name) {
        return configuration.isCaseInsensitive() ? name.toLowerCase(Locale.ROOT) : name;
    }

    private SecretValue parseSecretValue(final String value) {
        final JsonNode node;
        try {
            node = objectMapper.readTree(value);
        } catch (final JsonProcessingException e) {
            // Values other than JSON documents are plain strings
            return SecretValue.of(value);
        }

        if (node == null || !node.isObject()) {
            return SecretValue.of(value);
        }

        final Map<String, Object> values = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            final JsonNode fieldValue = field.getValue();
            if (fieldValue.isNull()) {
                values.put(field.getKey(), null);
            } else if (fieldValue.isTextual()) {
                values.put(field.getKey(), fieldValue.textValue());
            } else if (fieldValue.isNumber()) {
                values.put(field.getKey(), fieldValue.numberValue());
            } else if (fieldValue.isBoolean()) {
                values.put(field.getKey(), fieldValue.booleanValue());
            } else {
                return SecretValue.of(value);
            }
        }
        return SecretValue.of(values);
    }
}
