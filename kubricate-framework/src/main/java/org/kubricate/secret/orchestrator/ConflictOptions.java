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

import org.kubricate.exception.SecretConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Conflict strategies per level with optional strict mode forcing every level to fail on collisions
 */
public final class ConflictOptions {
    private static final Map<ConflictLevel, ConflictStrategy> DEFAULT_STRATEGIES;

    static {
        final Map<ConflictLevel, ConflictStrategy> defaults = new EnumMap<>(ConflictLevel.class);
        defaults.put(ConflictLevel.INTRA_PROVIDER, ConflictStrategy.AUTO_MERGE);
        defaults.put(ConflictLevel.CROSS_PROVIDER, ConflictStrategy.ERROR);
        defaults.put(ConflictLevel.CROSS_MANAGER, ConflictStrategy.ERROR);
        DEFAULT_STRATEGIES = Collections.unmodifiableMap(defaults);
    }

    private final Map<ConflictLevel, ConflictStrategy> strategies;

    private final boolean strict;

    private ConflictOptions(final Map<ConflictLevel, ConflictStrategy> strategies, final boolean strict) {
        this.strategies = Collections.unmodifiableMap(new EnumMap<>(strategies));
        this.strict = strict;
    }

    public static ConflictOptions withDefaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Get strategies configured explicitly
     *
     * @return Configured strategies by level
     */
    public Map<ConflictLevel, ConflictStrategy> getConfiguredStrategies() {
        return strategies;
    }

    /**
     * Get effective strategy for level: error in strict mode, otherwise the configured or default strategy
     *
     * @param level Conflict Level required
     * @return Conflict Strategy
     */
    public ConflictStrategy getStrategy(final ConflictLevel level) {
        Objects.requireNonNull(level, "Conflict Level required");
        if (strict) {
            return ConflictStrategy.ERROR;
        }
        return strategies.getOrDefault(level, DEFAULT_STRATEGIES.get(level));
    }

    /**
     * Validate that strict mode is not combined with a configured strategy other than error
     *
     * @throws SecretConfigurationException when strict mode conflicts with a configured strategy
     */
    public void validate() {
        if (!strict) {
            return;
        }
        for (final Map.Entry<ConflictLevel, ConflictStrategy> entry : strategies.entrySet()) {
            if (entry.getValue() != ConflictStrategy.ERROR) {
                throw new SecretConfigurationException(String.format(
                        "[config:strictConflictMode] Conflict strategy for level \"%s\" is \"%s\" but strict mode requires \"error\" for every level",
                        entry.getKey().getName(), entry.getValue().getValue()));
            }
        }
    }

    @Override
    public String toString() {
        return String.format("ConflictOptions[strict=%s, strategies=%s]", strict, strategies);
    }

    public static final class Builder {
        private final Map<ConflictLevel, ConflictStrategy> strategies = new EnumMap<>(ConflictLevel.class);

        private boolean strict;

        private Builder() {

        }

        public Builder strategy(final ConflictLevel level, final ConflictStrategy strategy) {
            strategies.put(Objects.requireNonNull(level, "Conflict Level required"), Objects.requireNonNull(strategy, "Conflict Strategy required"));
            return this;
        }

        public Builder intraProvider(final ConflictStrategy strategy) {
            return strategy(ConflictLevel.INTRA_PROVIDER, strategy);
        }

        public Builder crossProvider(final ConflictStrategy strategy) {
            return strategy(ConflictLevel.CROSS_PROVIDER, strategy);
        }

        public Builder crossManager(final ConflictStrategy strategy) {
            return strategy(ConflictLevel.CROSS_MANAGER, strategy);
        }

        public Builder strict(final boolean strict) {
            this.strict = strict;
            return this;
        }

        public ConflictOptions build() {
            return new ConflictOptions(strategies, strict);
        }
    }
}
