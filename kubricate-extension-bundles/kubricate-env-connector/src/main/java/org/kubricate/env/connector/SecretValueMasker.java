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

import org.apache.commons.lang3.StringUtils;

/**
 * Masker for logging secret values showing a short leading portion
 */
final class SecretValueMasker {
    static final int VISIBLE_LENGTH = 4;

    static final int MAXIMUM_LENGTH = 20;

    private static final String MASK = "*";

    private SecretValueMasker() {

    }

    /**
     * Mask value keeping the leading characters when the value is longer than the visible length
     *
     * @param value Value to be masked
     * @return Masked value no longer than the maximum length
     */
    static String mask(final String value) {
        if (value == null) {
            return null;
        }
        final int maskedLength = Math.min(value.length(), MAXIMUM_LENGTH);
        if (value.length() <= VISIBLE_LENGTH) {
            return StringUtils.repeat(MASK, maskedLength);
        }
        return StringUtils.left(value, VISIBLE_LENGTH) + StringUtils.repeat(MASK, maskedLength - VISIBLE_LENGTH);
    }
}
