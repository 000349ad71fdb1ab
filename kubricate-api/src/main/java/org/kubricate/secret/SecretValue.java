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
package org.kubricate.secret;

import org.kubricate.exception.SecretValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Raw secret value resolved by a connector: either a scalar or a flat map of scalars keyed by string
 */
public final class SecretValue {
    private static final String MASKED = "SecretValue[***]";

    private final Object value;

    private SecretValue(final Object value) {
        this.value = value;
    }

    /**
     * Create Secret Value from a scalar String
     *
     * @param value String value required
     * @return Secret Value
     */
    public static SecretValue of(final String value) {
        Objects.requireNonNull(value, "Value required");
        return new SecretValue(value);
    }

    /**
     * Create Secret Value from a flat map where every value is a String, Number, Boolean or null
     *
     * @param values Map of values required
     * @return Secret Value
     */
    public static SecretValue of(final Map<String, ?> values) {
        Objects.requireNonNull(values, "Values required");
        final Map<String, Object> flat = new LinkedHashMap<>();
        for (final Map.Entry<String, ?> entry : values.entrySet()) {
            final Object entryValue = entry.getValue();
            if (entryValue != null && !isScalar(entryValue)) {
                throw new SecretValidationException(String.format("Secret value must be flat: key [%s] holds a nested value", entry.getKey()));
            }
            flat.put(entry.getKey(), entryValue);
        }
        return new SecretValue(Collections.unmodifiableMap(flat));
    }

    /**
     * Create Secret Value from an untyped object read from an external source
     *
     * @param value Scalar or flat Map required
     * @return Secret Value
     */
    @SuppressWarnings("unchecked")
    public static SecretValue fromObject(final Object value) {
        Objects.requireNonNull(value, "Value required");
        if (value instanceof Map) {
            return of((Map<String, ?>) value);
        }
        if (isScalar(value)) {
            return new SecretValue(value);
        }
        throw new SecretValidationException(String.format("Secret value type [%s] not supported", value.getClass().getName()));
    }

    public boolean isMap() {
        return value instanceof Map;
    }

    /**
     * Get flat map of values
     *
     * @return Map of values
     * @throws SecretValidationException when the value is a scalar
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> asMap() {
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        throw new SecretValidationException("Expected a key-value map but found a scalar secret value");
    }

    /**
     * Get scalar value as String
     *
     * @return String representation of scalar value
     * @throws SecretValidationException when the value is a map
     */
    public String asString() {
        if (value instanceof Map) {
            throw new SecretValidationException("Expected a scalar but found a key-value map secret value");
        }
        return String.valueOf(value);
    }

    public Object getValue() {
        return value;
    }

    private static boolean isScalar(final Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        return value.equals(((SecretValue) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return MASKED;
    }
}
