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

import org.kubricate.exception.SecretRegistrationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named collection of isolated Secret Managers preserving registration order
 */
public class SecretRegistry {
    private final Map<String, SecretManager> managers = new LinkedHashMap<>();

    /**
     * Add Secret Manager under a unique name
     *
     * @param name Manager name required
     * @param manager Secret Manager required
     * @return Secret Registry
     */
    public SecretRegistry add(final String name, final SecretManager manager) {
        Objects.requireNonNull(name, "Manager Name required");
        Objects.requireNonNull(manager, "Secret Manager required");
        if (managers.containsKey(name)) {
            throw new SecretRegistrationException(String.format("[SecretRegistry] Duplicate secret manager name: \"%s\"", name));
        }
        managers.put(name, manager);
        return this;
    }

    public SecretManager get(final String name) {
        final SecretManager manager = managers.get(name);
        if (manager == null) {
            throw new SecretRegistrationException(String.format("[SecretRegistry] Secret manager not found for name: \"%s\"", name));
        }
        return manager;
    }

    /**
     * List Secret Managers
     *
     * @return Secret Managers by name in registration order
     */
    public Map<String, SecretManager> list() {
        return Collections.unmodifiableMap(managers);
    }
}
