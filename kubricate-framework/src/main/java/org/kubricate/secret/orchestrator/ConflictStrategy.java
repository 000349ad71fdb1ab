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

/**
 * Policy applied when effects collide at a conflict level
 */
public enum ConflictStrategy {
    /** Fail on the first duplicate identifier */
    ERROR("error"),

    /** Keep the most recent effect and warn for each dropped effect */
    OVERWRITE("overwrite"),

    /** Merge colliding effects through the provider */
    AUTO_MERGE("autoMerge");

    private final String value;

    ConflictStrategy(final String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Get Conflict Strategy from configured value
     *
     * @param value Configured value required
     * @return Conflict Strategy
     * @throws SecretConfigurationException when the value is not supported
     */
    public static ConflictStrategy fromValue(final String value) {
        for (final ConflictStrategy strategy : values()) {
            if (strategy.value.equals(value)) {
                return strategy;
            }
        }
        throw new SecretConfigurationException(String.format("Conflict strategy [%s] not supported: expected one of [error, overwrite, autoMerge]", value));
    }

    @Override
    public String toString() {
        return value;
    }
}
