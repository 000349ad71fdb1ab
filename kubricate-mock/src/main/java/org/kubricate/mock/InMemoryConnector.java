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
package org.kubricate.mock;

import org.kubricate.exception.SecretConnectorException;
import org.kubricate.secret.SecretValue;
import org.kubricate.secret.connector.AbstractSecretConnector;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Connector serving secret values from an in-memory map for tests and examples
 */
public class InMemoryConnector extends AbstractSecretConnector {
    private final Map<String, SecretValue> values = new LinkedHashMap<>();

    private final Map<String, SecretValue> loaded = new LinkedHashMap<>();

    /**
     * In-Memory Connector constructor with source values
     *
     * @param values Map of secret names to scalars or flat maps
     */
    public InMemoryConnector(final Map<String, ?> values) {
        Objects.requireNonNull(values, "Values required");
        values.forEach((name, value) -> this.values.put(name, SecretValue.fromObject(value)));
    }

    @Override
    public void load(final Collection<String> names) {
        for (final String name : names) {
            final SecretValue value = values.get(name);
            if (value == null) {
                throw new SecretConnectorException(String.format("Missing secret: %s", name));
            }
            loaded.put(name, value);
        }
    }

    @Override
    public SecretValue get(final String name) {
        final SecretValue value = loaded.get(name);
        if (value == null) {
            throw new SecretConnectorException(String.format("Secret %s not loaded", name));
        }
        return value;
    }
}
