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
package org.kubricate.composer;

import java.util.Map;
import java.util.function.Function;

/**
 * Composed output resource
 */
public final class ResourceEntry {
    private final Object config;

    private final EntryType entryType;

    private final Function<Map<String, Object>, ?> factory;

    ResourceEntry(final Object config, final EntryType entryType, final Function<Map<String, Object>, ?> factory) {
        this.config = config;
        this.entryType = entryType;
        this.factory = factory;
    }

    /**
     * Get configuration which is a Map for object and factory entries and any object for instance entries
     *
     * @return Configuration
     */
    public Object getConfig() {
        return config;
    }

    public EntryType getEntryType() {
        return entryType;
    }

    Function<Map<String, Object>, ?> getFactory() {
        return factory;
    }

    @SuppressWarnings("unchecked")
    Map<String, Object> getConfigMap() {
        return (Map<String, Object>) config;
    }
}
