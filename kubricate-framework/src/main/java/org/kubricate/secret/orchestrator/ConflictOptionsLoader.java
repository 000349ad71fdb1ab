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
package org.kubricate.secret.orchestrator;

import org.kubricate.deprecation.log.DeprecationLogger;
import org.kubricate.deprecation.log.DeprecationLoggerFactory;
import org.kubricate.exception.SecretConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;

/**
 * Loader reading Conflict Options from properties, accepting deprecated merge level names as aliases
 */
public class ConflictOptionsLoader {
    public static final String STRICT_PROPERTY = "kubricate.secret.conflict.strict";

    public static final String STRATEGY_PROPERTY_PREFIX = "kubricate.secret.conflict.strategies.";

    public static final String DEPRECATED_PROPERTY_PREFIX = "kubricate.secret.merge.";

    static final String WORKSPACE_LEVEL = "workspaceLevel";

    private final DeprecationLogger deprecationLogger;

    public ConflictOptionsLoader() {
        this(DeprecationLoggerFactory.getLogger(ConflictOptionsLoader.class));
    }

    ConflictOptionsLoader(final DeprecationLogger deprecationLogger) {
        this.deprecationLogger = Objects.requireNonNull(deprecationLogger, "Deprecation Logger required");
    }

    /**
     * Load Conflict Options from properties file
     *
     * @param propertiesPath Path to properties file required
     * @return Conflict Options
     */
    public ConflictOptions load(final Path propertiesPath) {
        Objects.requireNonNull(propertiesPath, "Properties Path required");
        final Properties properties = new Properties();
        try (InputStream inputStream = Files.newInputStream(propertiesPath)) {
            properties.load(inputStream);
        } catch (final IOException e) {
            throw new SecretConfigurationException(String.format("Conflict properties [%s] read failed", propertiesPath), e);
        }
        return load(properties);
    }

    /**
     * Load Conflict Options from properties where canonical level names take precedence over deprecated aliases
     *
     * @param properties Properties required
     * @return Conflict Options
     */
    public ConflictOptions load(final Properties properties) {
        Objects.requireNonNull(properties, "Properties required");
        final ConflictOptions.Builder builder = ConflictOptions.builder();

        final String strict = properties.getProperty(STRICT_PROPERTY);
        if (strict != null) {
            builder.strict(parseBoolean(strict.trim()));
        }

        for (final ConflictLevel level : ConflictLevel.values()) {
            final String value = getStrategyValue(properties, level);
            if (value != null) {
                builder.strategy(level, ConflictStrategy.fromValue(value.trim()));
            }
        }

        final String workspaceProperty = DEPRECATED_PROPERTY_PREFIX + WORKSPACE_LEVEL;
        if (properties.getProperty(workspaceProperty) != null) {
            deprecationLogger.warnAlias(workspaceProperty, STRATEGY_PROPERTY_PREFIX + ConflictLevel.CROSS_MANAGER.getName());
        }

        return builder.build();
    }

    private String getStrategyValue(final Properties properties, final ConflictLevel level) {
        final String canonicalProperty = STRATEGY_PROPERTY_PREFIX + level.getName();
        final String deprecatedProperty = DEPRECATED_PROPERTY_PREFIX + level.getDeprecatedName();

        final String canonical = properties.getProperty(canonicalProperty);
        String deprecated = properties.getProperty(deprecatedProperty);
        if (deprecated != null) {
            deprecationLogger.warnAlias(deprecatedProperty, canonicalProperty);
        } else if (level == ConflictLevel.CROSS_MANAGER) {
            deprecated = properties.getProperty(DEPRECATED_PROPERTY_PREFIX + WORKSPACE_LEVEL);
        }
        return canonical == null ? deprecated : canonical;
    }

    private static boolean parseBoolean(final String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        } else if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new SecretConfigurationException(String.format("Property [%s] value [%s] must be true or false", STRICT_PROPERTY, value));
    }
}
