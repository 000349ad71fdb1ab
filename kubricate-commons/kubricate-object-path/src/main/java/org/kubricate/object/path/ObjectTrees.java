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
package org.kubricate.object.path;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural operations over trees of Maps, Lists and scalar values
 */
public final class ObjectTrees {

    private ObjectTrees() {

    }

    public static boolean isPlainObject(final Object value) {
        return value instanceof Map;
    }

    public static boolean isArray(final Object value) {
        return value instanceof List;
    }

    /**
     * Copy Maps and Lists recursively, sharing scalar values
     *
     * @param value Tree to copy
     * @param <T> Tree type
     * @return Copied tree
     */
    @SuppressWarnings("unchecked")
    public static <T> T deepCopy(final T value) {
        if (value instanceof Map) {
            final Map<String, Object> copy = new LinkedHashMap<>();
            for (final Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
            }
            return (T) copy;
        }
        if (value instanceof List) {
            final List<Object> copy = new ArrayList<>();
            for (final Object element : (List<?>) value) {
                copy.add(deepCopy(element));
            }
            return (T) copy;
        }
        return value;
    }

    /**
     * Merge source onto base into a new tree: Maps merge by key, Lists merge by index, other source values replace
     * base values, and null source values keep the base value
     *
     * @param base Base tree
     * @param source Source tree applied over the base
     * @return Merged tree without modifying either argument
     */
    public static Object deepMerge(final Object base, final Object source) {
        if (source == null) {
            return deepCopy(base);
        }
        if (base instanceof Map && source instanceof Map) {
            final Map<String, Object> merged = deepCopy(asMap(base));
            for (final Map.Entry<?, ?> entry : ((Map<?, ?>) source).entrySet()) {
                final String key = String.valueOf(entry.getKey());
                merged.put(key, deepMerge(merged.get(key), entry.getValue()));
            }
            return merged;
        }
        if (base instanceof List && source instanceof List) {
            final List<?> baseList = (List<?>) base;
            final List<?> sourceList = (List<?>) source;
            final List<Object> merged = new ArrayList<>();
            final int size = Math.max(baseList.size(), sourceList.size());
            for (int i = 0; i < size; i++) {
                final Object baseElement = i < baseList.size() ? baseList.get(i) : null;
                final Object sourceElement = i < sourceList.size() ? sourceList.get(i) : null;
                merged.add(deepMerge(baseElement, sourceElement));
            }
            return merged;
        }
        return deepCopy(source);
    }

    /**
     * Merge source Map onto base Map into a new Map
     *
     * @param base Base Map
     * @param source Source Map
     * @return Merged Map
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> deepMergeMaps(final Map<String, Object> base, final Map<String, Object> source) {
        return (Map<String, Object>) deepMerge(base == null ? new LinkedHashMap<>() : base, source);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(final Object value) {
        return (Map<String, Object>) value;
    }
}
