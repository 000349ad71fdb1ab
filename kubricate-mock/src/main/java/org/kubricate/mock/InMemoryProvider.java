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
package org.kubricate.mock;

import org.kubricate.exception.SecretConflictException;
import org.kubricate.exception.UnsupportedStrategyException;
import org.kubricate.secret.PreparedEffect;
import org.kubricate.secret.SecretValue;
import org.kubricate.secret.injection.SecretInjectionStrategy;
import org.kubricate.secret.injection.StrategyKind;
import org.kubricate.secret.provider.InjectionStrategies;
import org.kubricate.secret.provider.ProviderInjection;
import org.kubricate.secret.provider.SecretProvider;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Provider producing custom effects that record raw values per in-memory store, used for framework tests
 */
public class InMemoryProvider implements SecretProvider {
    public static final String DEFAULT_STORE_NAME = "in-memory";

    static final String STORE_NAME = "storeName";

    static final String RAW_DATA = "rawData";

    private static final String TARGET_KIND = "Deployment";

    private final String storeName;

    private final boolean allowMerge;

    private String name;

    public InMemoryProvider() {
        this(DEFAULT_STORE_NAME);
    }

    public InMemoryProvider(final String storeName) {
        this(storeName, true);
    }

    /**
     * In-Memory Provider constructor
     *
     * @param storeName Store name used as the effect identifier
     * @param allowMerge Whether colliding effects can be merged
     */
    public InMemoryProvider(final String storeName, final boolean allowMerge) {
        this.storeName = Objects.requireNonNull(storeName, "Store Name required");
        this.allowMerge = allowMerge;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void setName(final String name) {
        this.name = name;
    }

    public String getStoreName() {
        return storeName;
    }

    @Override
    public String getTargetKind() {
        return TARGET_KIND;
    }

    @Override
    public Set<String> getSupportedStrategies() {
        return Set.of(StrategyKind.ENV);
    }

    @Override
    public boolean isAllowMerge() {
        return allowMerge;
    }

    @Override
    public List<PreparedEffect> prepare(final String secretName, final SecretValue value) {
        final Map<String, Object> rawData = new LinkedHashMap<>();
        rawData.put(secretName, value.getValue());

        final Map<String, Object> effectValue = new LinkedHashMap<>();
        effectValue.put(STORE_NAME, storeName);
        effectValue.put(RAW_DATA, rawData);
        return List.of(new PreparedEffect(PreparedEffect.CUSTOM_TYPE, secretName, name, effectValue));
    }

    @Override
    public String getTargetPath(final SecretInjectionStrategy strategy) {
        if (StrategyKind.ENV.equals(strategy.getKind())) {
            return InjectionStrategies.getDefaultTargetPath(strategy).orElseThrow();
        }
        throw new UnsupportedStrategyException(strategy.getKind(), String.format("[InMemoryProvider] Unsupported strategy: %s", strategy.getKind()));
    }

    @Override
    public List<Map<String, Object>> getInjectionPayload(final List<ProviderInjection> injections) {
        final List<Map<String, Object>> payload = new ArrayList<>();
        for (final ProviderInjection injection : injections) {
            final String secretName = injection.getMeta().getSecretName();
            final String targetName = injection.getMeta().getTargetName();

            final Map<String, Object> secretKeyRef = new LinkedHashMap<>();
            secretKeyRef.put("name", storeName);
            secretKeyRef.put("key", secretName);

            final Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", targetName == null ? secretName : targetName);
            entry.put("valueFrom", Map.of("secretKeyRef", secretKeyRef));
            payload.add(entry);
        }
        return payload;
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<PreparedEffect> mergeSecrets(final List<PreparedEffect> effects) {
        final Map<String, PreparedEffect> firstEffects = new LinkedHashMap<>();
        final Map<String, Map<String, Object>> mergedData = new LinkedHashMap<>();

        for (final PreparedEffect effect : effects) {
            final String identifier = getEffectIdentifier(effect);
            firstEffects.putIfAbsent(identifier, effect);
            final Map<String, Object> data = mergedData.computeIfAbsent(identifier, key -> new LinkedHashMap<>());

            final Map<String, Object> rawData = (Map<String, Object>) effect.getValue().get(RAW_DATA);
            for (final Map.Entry<String, Object> entry : rawData.entrySet()) {
                if (data.containsKey(entry.getKey()) && !Objects.equals(data.get(entry.getKey()), entry.getValue())) {
                    throw new SecretConflictException("in-memory", identifier,
                            String.format("[conflict:in-memory] Duplicate key \"%s\" with different values in store \"%s\"", entry.getKey(), identifier));
                }
                data.put(entry.getKey(), entry.getValue());
            }
        }

        final List<PreparedEffect> merged = new ArrayList<>();
        for (final Map.Entry<String, PreparedEffect> entry : firstEffects.entrySet()) {
            final PreparedEffect first = entry.getValue();
            final Map<String, Object> value = new LinkedHashMap<>();
            value.put(STORE_NAME, entry.getKey());
            value.put(RAW_DATA, mergedData.get(entry.getKey()));
            merged.add(new PreparedEffect(first.getType(), first.getSecretName(), first.getProviderName(), value));
        }
        return merged;
    }

    @Override
    public String getEffectIdentifier(final PreparedEffect effect) {
        return String.valueOf(effect.getValue().get(STORE_NAME));
    }
}
