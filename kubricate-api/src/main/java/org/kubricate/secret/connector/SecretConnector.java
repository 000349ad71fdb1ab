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
package org.kubricate.secret.connector;

import org.kubricate.secret.SecretValue;

import java.nio.file.Path;
import java.util.Collection;

/**
 * Connector resolving raw secret values from an external source
 */
public interface SecretConnector {

    /**
     * Load named secrets from the source, failing on the first secret that cannot be resolved
     *
     * @param names Secret names required
     */
    void load(Collection<String> names);

    /**
     * Get a secret value previously loaded
     *
     * @param name Secret name required
     * @return Secret Value
     */
    SecretValue get(String name);

    /**
     * Get working directory for resolving relative sources
     *
     * @return Working directory or null when not configured
     */
    Path getWorkingDir();

    /**
     * Set working directory for resolving relative sources
     *
     * @param workingDir Working directory
     */
    void setWorkingDir(Path workingDir);
}
