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

/**
 * Logger abstraction for reporting usage of deprecated names and configuration aliases
 */
public interface DeprecationLogger {
    /**
     * Log deprecation warning with optional arguments for message placeholders
     *
     * @param message Message required
     * @param arguments Variable array of arguments to populate message placeholders
     */
    void warn(String message, Object... arguments);

    /**
     * Log deprecation warning for a deprecated name with its replacement, once per deprecated name
     *
     * @param deprecatedName Deprecated name required
     * @param replacementName Replacement name required
     */
    void warnAlias(String deprecatedName, String replacementName);
}
