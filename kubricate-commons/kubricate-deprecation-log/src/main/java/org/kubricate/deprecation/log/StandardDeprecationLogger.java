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
package org.kubricate.deprecation.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Standard implementation of Deprecation Logger based on SLF4J with a dedicated logger name prefix
 */
class StandardDeprecationLogger implements DeprecationLogger {
    private static final String LOGGER_NAME_FORMAT = "deprecation.%s";

    private static final String ALIAS_MESSAGE = "Deprecated [{}] found: use [{}] instead";

    private final Class<?> referenceClass;

    private final Logger logger;

    private final Set<String> reportedNames = ConcurrentHashMap.newKeySet();

    StandardDeprecationLogger(final Class<?> referenceClass) {
        this.referenceClass = Objects.requireNonNull(referenceClass, "Reference Class required");
        this.logger = LoggerFactory.getLogger(String.format(LOGGER_NAME_FORMAT, referenceClass.getName()));
    }

    @Override
    public void warn(final String message, final Object... arguments) {
        Objects.requireNonNull(message, "Message required");
        logger.warn(message, withUsageException(null, arguments));
    }

    @Override
    public void warnAlias(final String deprecatedName, final String replacementName) {
        Objects.requireNonNull(deprecatedName, "Deprecated Name required");
        Objects.requireNonNull(replacementName, "Replacement Name required");
        if (reportedNames.add(deprecatedName)) {
            logger.warn(ALIAS_MESSAGE, withUsageException(deprecatedName, deprecatedName, replacementName));
        }
    }

    private Object[] withUsageException(final String deprecatedName, final Object... arguments) {
        final Object[] messageArguments = arguments == null ? new Object[0] : arguments;
        final Object[] extendedArguments = Arrays.copyOf(messageArguments, messageArguments.length + 1);
        extendedArguments[messageArguments.length] = new DeprecatedUsageException(referenceClass, deprecatedName);
        return extendedArguments;
    }
}
