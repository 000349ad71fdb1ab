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

import java.util.Objects;

/**
 * Environment Connector Configuration with variable prefix, dotenv loading and name matching options
 */
public class EnvConnectorConfiguration {
    public static final String DEFAULT_PREFIX = "KUBRICATE_SECRET_";

    private final String prefix;

    private final boolean allowDotEnv;

    private final boolean caseInsensitive;

    private EnvConnectorConfiguration(final Builder builder) {
        this.prefix = builder.prefix;
        this.allowDotEnv = builder.allowDotEnv;
        this.caseInsensitive = builder.caseInsensitive;
    }

    public static EnvConnectorConfiguration withDefaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean isAllowDotEnv() {
        return allowDotEnv;
    }

    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    public static final class Builder {
        private String prefix = DEFAULT_PREFIX;

        private boolean allowDotEnv = true;

        private boolean caseInsensitive;

        private Builder() {

        }

        public Builder prefix(final String prefix) {
            this.prefix = Objects.requireNonNull(prefix, "Prefix required");
            return this;
        }

        public Builder allowDotEnv(final boolean allowDotEnv) {
            this.allowDotEnv = allowDotEnv;
            return this;
        }

        public Builder caseInsensitive(final boolean caseInsensitive) {
            this.caseInsensitive = caseInsensitive;
            return this;
        }

        public EnvConnectorConfiguration build() {
            return new EnvConnectorConfiguration(this);
        }
    }
}
