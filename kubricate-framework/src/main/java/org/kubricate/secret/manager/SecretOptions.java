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
package org.kubricate.secret.manager;

import java.util.Objects;

/**
 * Declared secret with optional connector and provider names falling back to the manager defaults
 */
public final class SecretOptions {
    private final String name;

    private final String connector;

    private final String provider;

    public SecretOptions(final String name, final String connector, final String provider) {
        this.name = Objects.requireNonNull(name, "Secret Name required");
        this.connector = connector;
        this.provider = provider;
    }

    public static SecretOptions of(final String name) {
        return new SecretOptions(name, null, null);
    }

    public String getName() {
        return name;
    }

    /**
     * Get connector name
     *
     * @return Connector name or null when the default connector applies
     */
    public String getConnector() {
        return connector;
    }

    /**
     * Get provider name
     *
     * @return Provider name or null when the default provider applies
     */
    public String getProvider() {
        return provider;
    }

    SecretOptions withDefaults(final String defaultConnector, final String defaultProvider) {
        return new SecretOptions(
                name,
                connector == null ? defaultConnector : connector,
                provider == null ? defaultProvider : provider
        );
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        final SecretOptions options = (SecretOptions) other;
        return name.equals(options.name) && Objects.equals(connector, options.connector) && Objects.equals(provider, options.provider);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, connector, provider);
    }

    @Override
    public String toString() {
        return String.format("SecretOptions[name=%s, connector=%s, provider=%s]", name, connector, provider);
    }
}
