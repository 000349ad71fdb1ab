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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shape of a Kubernetes Secret: manifest type and the mapping of required and optional input keys to data keys
 */
public final class SecretDataSchema {
    private final String manifestType;

    private final Map<String, String> requiredKeys;

    private final Map<String, String> optionalKeys;

    private SecretDataSchema(final Builder builder) {
        this.manifestType = builder.manifestType;
        this.requiredKeys = Collections.unmodifiableMap(new LinkedHashMap<>(builder.requiredKeys));
        this.optionalKeys = Collections.unmodifiableMap(new LinkedHashMap<>(builder.optionalKeys));
    }

    public static Builder builder(final String manifestType) {
        return new Builder(manifestType);
    }

    public String getManifestType() {
        return manifestType;
    }

    /**
     * Get data keys in declaration order, required keys first
     *
     * @return Data keys
     */
    public List<String> getDataKeys() {
        final List<String> dataKeys = new ArrayList<>(requiredKeys.values());
        dataKeys.addAll(optionalKeys.values());
        return dataKeys;
    }

    /**
     * Validate a secret value against the schema and map input keys to data keys
     *
     * @param secretName Secret name for messages
     * @param value Secret value
     * @return Data values keyed by data key in declaration order
     * @throws SecretValidationException when the value is not a map, has unexpected keys or misses required keys
     */
    public Map<String, String> toData(final String secretName, final SecretValue value) {
        if (!value.isMap()) {
            throw new SecretValidationException(String.format("Validation error: secret [%s] requires an object with keys: %s",
                    secretName, String.join(", ", getInputKeys())));
        }

        final Map<String, Object> values = value.asMap();
        for (final String key : values.keySet()) {
            if (!requiredKeys.containsKey(key) && !optionalKeys.containsKey(key)) {
                throw new SecretValidationException(String.format("Validation error: secret [%s] has unexpected key '%s'. Allowed keys are: %s",
                        secretName, key, String.join(", ", getInputKeys())));
            }
        }

        final Map<String, String> data = new LinkedHashMap<>();
        for (final Map.Entry<String, String> requiredKey : requiredKeys.entrySet()) {
            final Object keyValue = values.get(requiredKey.getKey());
            if (keyValue == null || keyValue.toString().isEmpty()) {
                throw new SecretValidationException(String.format("Validation error: secret [%s] is missing required key '%s'",
                        secretName, requiredKey.getKey()));
            }
            data.put(requiredKey.getValue(), keyValue.toString());
        }
        for (final Map.Entry<String, String> optionalKey : optionalKeys.entrySet()) {
            final Object keyValue = values.get(optionalKey.getKey());
            if (keyValue != null) {
                data.put(optionalKey.getValue(), keyValue.toString());
            }
        }
        return data;
    }

    private List<String> getInputKeys() {
        final List<String> inputKeys = new ArrayList<>(requiredKeys.keySet());
        inputKeys.addAll(optionalKeys.keySet());
        return inputKeys;
    }

    public static final class Builder {
        private final String manifestType;

        private final Map<String, String> requiredKeys = new LinkedHashMap<>();

        private final Map<String, String> optionalKeys = new LinkedHashMap<>();

        private Builder(final String manifestType) {
            this.manifestType = Objects.requireNonNull(manifestType, "Manifest Type required");
        }

        public Builder required(final String inputKey, final String dataKey) {
            requiredKeys.put(inputKey, dataKey);
            return this;
        }

        public Builder optional(final String inputKey, final String dataKey) {
            optionalKeys.put(inputKey, dataKey);
            return this;
        }

        public SecretDataSchema build() {
            return new SecretDataSchema(this);
        }
    }
}
