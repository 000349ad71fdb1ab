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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Materialized output of one provider for one secret, such as a Kubernetes Secret manifest applied with kubectl
 */
public final class PreparedEffect {
    public static final String KUBECTL_TYPE = "kubectl";

    public static final String CUSTOM_TYPE = "custom";

    private final String type;

    private final String secretName;

    private final String providerName;

    private final Map<String, Object> value;

    /**
     * Prepared Effect constructor
     *
     * @param type Effect type such as kubectl
     * @param secretName Name of the secret that produced the effect
     * @param providerName Name of the provider that prepared the effect
     * @param value Effect payload
     */
    public PreparedEffect(final String type, final String secretName, final String providerName, final Map<String, Object> value) {
        this.type = Objects.requireNonNull(type, "Type required");
        this.secretName = secretName;
        this.providerName = providerName;
        this.value = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(value, "Value required")));
    }

    public String getType() {
        return type;
    }

    public String getSecretName() {
        return secretName;
    }

    public String getProviderName() {
        return providerName;
    }

    public Map<String, Object> getValue() {
        return value;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        final PreparedEffect effect = (PreparedEffect) other;
        return type.equals(effect.type)
                && Objects.equals(secretName, effect.secretName)
                && Objects.equals(providerName, effect.providerName)
                && value.equals(effect.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, secretName, providerName, value);
    }

    @Override
    public String toString() {
        return String.format("PreparedEffect[type=%s, secretName=%s, providerName=%s]", type, secretName, providerName);
    }
}
