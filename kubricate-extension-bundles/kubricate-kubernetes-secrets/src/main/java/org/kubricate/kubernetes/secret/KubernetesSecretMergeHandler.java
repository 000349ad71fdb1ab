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
package org.kubricate.kubernetes.secret;

import org.kubricate.exception.SecretConflictException;
import org.kubricate.secret.PreparedEffect;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merge handler unioning the data of Secret manifests sharing a namespace and name
 */
final class KubernetesSecretMergeHandler {
    static final String MERGE_LEVEL = "merge:k8s";

    static final String METADATA = "metadata";

    static final String DATA = "data";

    private static final String NAME = "name";

    private static final String NAMESPACE = "namespace";

    private KubernetesSecretMergeHandler() {

    }

    /**
     * Get identifier formatted as namespace/name with the default namespace when absent
     *
     * @param effect Prepared effect holding a Secret manifest
     * @return Effect identifier
     */
    static String getIdentifier(final PreparedEffect effect) {
        final Map<?, ?> metadata = getMap(effect.getValue().get(METADATA));
        final Object namespace = metadata.get(NAMESPACE);
        return String.format("%s/%s", namespace == null ? KubernetesSecretConfiguration.DEFAULT_NAMESPACE : namespace, metadata.get(NAME));
    }

    static List<PreparedEffect> merge(final List<PreparedEffect> effects) {
        final Map<String, PreparedEffect> firstEffects = new LinkedHashMap<>();
        final Map<String, Map<String, Object>> mergedData = new LinkedHashMap<>();

        for (final PreparedEffect effect : effects) {
            final String identifier = getIdentifier(effect);
            firstEffects.putIfAbsent(identifier, effect);
            final Map<String, Object> data = mergedData.computeIfAbsent(identifier, key -> new LinkedHashMap<>());

            for (final Map.Entry<?, ?> entry : getMap(effect.getValue().get(DATA)).entrySet()) {
                final String key = String.valueOf(entry.getKey());
                if (data.containsKey(key) && !Objects.equals(data.get(key), entry.getValue())) {
                    final Map<?, ?> metadata = getMap(effect.getValue().get(METADATA));
                    throw new SecretConflictException(MERGE_LEVEL, identifier, String.format(
                            "[%s] Conflict detected: key \"%s\" already exists in Secret \"%s\" in namespace \"%s\" with a different value",
                            MERGE_LEVEL, key, metadata.get(NAME), identifier.substring(0, identifier.indexOf('/'))));
                }
                data.put(key, entry.getValue());
            }
        }

        final List<PreparedEffect> merged = new ArrayList<>();
        for (final Map.Entry<String, PreparedEffect> entry : firstEffects.entrySet()) {
            final PreparedEffect first = entry.getValue();
            final Map<String, Object> value = new LinkedHashMap<>(first.getValue());
            value.put(DATA, mergedData.get(entry.getKey()));
            merged.add(new PreparedEffect(first.getType(), first.getSecretName(), first.getProviderName(), value));
        }
        return merged;
    }

    private static Map<?, ?> getMap(final Object value) {
        return value instanceof Map ? (Map<?, ?>) value : Map.of();
    }
}
