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
package org.kubricate.secret.apply;

import org.kubricate.object.path.ObjectTrees;
import org.kubricate.secret.PreparedEffect;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Censor replacing secret values in effect payloads before they are displayed
 */
public class SecretPayloadCensor {
    static final String CENSORED = "***";

    private static final Set<String> SECRET_FIELDS = Set.of("data", "stringData", "rawData");

    /**
     * Get copy of effect payload with every value under data fields replaced
     *
     * @param effect Prepared effect required
     * @return Censored payload copy
     */
    public Map<String, Object> censor(final PreparedEffect effect) {
        Objects.requireNonNull(effect, "Effect required");
        final Map<String, Object> payload = ObjectTrees.deepCopy(effect.getValue());
        censorFields(payload);
        return payload;
    }

    @SuppressWarnings("unchecked")
    private void censorFields(final Map<String, Object> tree) {
        for (final Map.Entry<String, Object> entry : tree.entrySet()) {
            final Object value = entry.getValue();
            if (value instanceof Map) {
                final Map<String, Object> child = (Map<String, Object>) value;
                if (SECRET_FIELDS.contains(entry.getKey())) {
                    child.replaceAll((key, secret) -> CENSORED);
                } else {
                    censorFields(child);
                }
            }
        }
    }
}
