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
package org.kubricate.exception;

/**
 * Conflict between prepared effects sharing an identifier, or between values of the same key under one identifier
 */
public class SecretConflictException extends KubricateException {
    private final String level;

    private final String identifier;

    /**
     * Secret Conflict Exception with level and identifier for reporting
     *
     * @param level Conflict level or merge scope where the conflict was detected
     * @param identifier Effect identifier or key in conflict
     * @param message Formatted message
     */
    public SecretConflictException(final String level, final String identifier, final String message) {
        super(message);
        this.level = level;
        this.identifier = identifier;
    }

    public String getLevel() {
        return level;
    }

    public String getIdentifier() {
        return identifier;
    }
}
