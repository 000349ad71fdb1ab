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

import java.util.Optional;

/**
 * Granularity at which effects sharing an identifier are reconciled, in increasing scope
 */
public enum ConflictLevel {
    /** Effects from the same provider instance within one manager */
    INTRA_PROVIDER("intraProvider", "providerLevel"),

    /** Effects from different providers within one manager */
    CROSS_PROVIDER("crossProvider", "managerLevel"),

    /** Effects from different managers or stacks */
    CROSS_MANAGER("crossManager", "stackLevel");

    private final String name;

    private final String deprecatedName;

    ConflictLevel(final String name, final String deprecatedName) {
        this.name = name;
        this.deprecatedName = deprecatedName;
    }

    public String getName() {
        return name;
    }

    /**
     * Get name used by the earlier provider, manager and stack merge level scheme
     *
     * @return Deprecated level name
     */
    public String getDeprecatedName() {
        return deprecatedName;
    }

    public static Optional<ConflictLevel> fromName(final String name) {
        for (final ConflictLevel level : values()) {
            if (level.name.equals(name)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return name;
    }
}
