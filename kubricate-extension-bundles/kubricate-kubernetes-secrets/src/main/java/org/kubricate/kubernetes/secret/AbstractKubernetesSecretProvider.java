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

import org.kubricate.exception.SecretInjectionStrategyException;
import org.kubricate.exception.UnsupportedStrategyException;
import org.kubricate.secret.PreparedEffect;
import org.kubricate.secret.SecretValue;
import org.kubricate.secret.injection.SecretInjectionStrategy;
import org.kubricate.secret.injection.StrategyKind;
import org.kubricate.secret.provider.InjectionStrategies;
import org.kubricate.secret.provider.ProviderInjection;
import org.kubricate.secret.provider.SecretProvider;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Abstract Secret Provider producing Kubernetes Secret manifests and container references driven by a Secret Data Schema
 */
public abstract class AbstractKubernetesSecretProvider implements SecretProvider {
    static final String API_VERSION = "v1";

    static final String SECRET_KIND = "Secret";

    private static final String TARGET_KIND = "Deployment";

    private final KubernetesSecretConfiguration configuration;

    private final SecretDataSchema schema;

    private final Set<String> supportedStrategies;

    private String name;

    /**
     * Abstract Kubernetes Secret Provider constructor
     *
     * @param configuration Secret name and namespace required
     * @param schema Secret data schema required
     * @param supportedStrategies Strategy kinds supported by the provider
     */
    protected AbstractKubernetesSecretProvider(
            final KubernetesSecretConfiguration configuration,
            final SecretDataSchema schema,
            final String... supportedStrategies
    ) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration required");
        this.schema = Objects.requireNonNull(schema, "Schema required");
        this.supportedStrategies = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(supportedStrategies)));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void setName(final String name) {
        this.name = name;
    }

    @Override
    public String getTargetKind() {
        return TARGET_KIND;
    }

    @Override
    public Set<String> getSupportedStrategies() {
        return supportedStrategies;
    }

    @Override
    public boolean isAllowMerge() {
        return true;
    }

    public KubernetesSecretConfiguration getConfiguration() {
        return configuration;
    }

    protected SecretDataSchema getSchema() {
        return schema;
    }

    @Override
    public List<PreparedEffect> prepare(final String secretName, final SecretValue value) {
        final Map<String, Object> encodedData = new LinkedHashMap<>();
        for (final Map.Entry<String, String> entry : createData(secretName, value).entrySet()) {
            encodedData.put(entry.getKey(), encode(entry.getValue()));
        }

        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("name", configuration.getName());
        metadata.put("namespace", configuration.getNamespace());

        final Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("apiVersion", API_VERSION);
        manifest.put("kind", SECRET_KIND);
        manifest.put(KubernetesSecretMergeHandler.METADATA, metadata);
        manifest.put("type", schema.getManifestType());
        manifest.put(KubernetesSecretMergeHandler.DATA, encodedData);
        return List.of(new PreparedEffect(PreparedEffect.KUBECTL_TYPE, secretName, name, manifest));
    }

    @Override
    public String getTargetPath(final SecretInjectionStrategy strategy) {
        final String kind = strategy.getKind();
        final Optional<String> targetPath = supportedStrategies.contains(kind) ? InjectionStrategies.getDefaultTargetPath(strategy) : Optional.empty();
        return targetPath.orElseThrow(() -> new UnsupportedStrategyException(kind,
                String.format("[%s] Unsupported injection strategy: %s", getProviderType(), kind)));
    }

    @Override
    public List<Map<String, Object>> getInjectionPayload(final List<ProviderInjection> injections) {
        if (injections.isEmpty()) {
            return new ArrayList<>();
        }

        final String kind = InjectionStrategies.requireHomogeneousKind(injections);
        if (supportedStrategies.contains(kind)) {
            if (StrategyKind.ENV.equals(kind)) {
                return getEnvPayload(injections);
            } else if (StrategyKind.ENV_FROM.equals(kind)) {
                return getEnvFromPayload(injections);
            } else if (StrategyKind.IMAGE_PULL_SECRET.equals(kind)) {
                final Map<String, Object> reference = new LinkedHashMap<>();
                reference.put("name", configuration.getName());
                return new ArrayList<>(List.of(reference));
            }
        }
        throw new UnsupportedStrategyException(kind, String.format("[%s] Unsupported strategy kind: %s", getProviderType(), kind));
    }

    @Override
    public List<PreparedEffect> mergeSecrets(final List<PreparedEffect> effects) {
        return KubernetesSecretMergeHandler.merge(effects);
    }

    @Override
    public String getEffectIdentifier(final PreparedEffect effect) {
        return KubernetesSecretMergeHandler.getIdentifier(effect);
    }

    /**
     * Create unencoded Secret data from a secret value, validated against the schema by default
     *
     * @param secretName Secret name
     * @param value Secret value
     * @return Data values keyed by data key
     */
    protected Map<String, String> createData(final String secretName, final SecretValue value) {
        return schema.toData(secretName, value);
    }

    /**
     * Resolve the Secret data key referenced by an env injection, restricted to schema data keys by default
     *
     * @param injection Provider injection
     * @return Secret data key
     */
    protected String resolveEnvKey(final ProviderInjection injection) {
        final String key = getStrategyKey(injection);
        final List<String> dataKeys = schema.getDataKeys();
        if (key == null) {
            throw new SecretInjectionStrategyException(String.format("[%s] 'key' is required for env injection. Must be %s.",
                    getProviderType(), describeKeys(dataKeys)));
        }
        if (!dataKeys.contains(key)) {
            throw new SecretInjectionStrategyException(String.format("[%s] Invalid key '%s'. Must be %s.",
                    getProviderType(), key, describeKeys(dataKeys)));
        }
        return key;
    }

    protected String getProviderType() {
        return getClass().getSimpleName();
    }

    protected static String getStrategyKey(final ProviderInjection injection) {
        final SecretInjectionStrategy strategy = injection.getMeta().getStrategy();
        return strategy == null ? null : strategy.getKey();
    }

    protected static String encode(final String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    private List<Map<String, Object>> getEnvPayload(final List<ProviderInjection> injections) {
        final List<Map<String, Object>> payload = new ArrayList<>();
        for (final ProviderInjection injection : injections) {
            final String targetName = injection.getMeta().getTargetName();
            if (targetName == null || targetName.isEmpty()) {
                throw new SecretInjectionStrategyException(String.format("[%s] Missing targetName (.forName) for env injection.", getProviderType()));
            }

            final Map<String, Object> secretKeyRef = new LinkedHashMap<>();
            secretKeyRef.put("name", configuration.getName());
            secretKeyRef.put("key", resolveEnvKey(injection));

            final Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", targetName);
            entry.put("valueFrom", Map.of("secretKeyRef", secretKeyRef));
            payload.add(entry);
        }
        return payload;
    }

    private List<Map<String, Object>> getEnvFromPayload(final List<ProviderInjection> injections) {
        final Optional<String> prefix = InjectionStrategies.requireSinglePrefix(injections);

        final Map<String, Object> entry = new LinkedHashMap<>();
        prefix.ifPresent(value -> entry.put("prefix", value));
        entry.put("secretRef", Map.of("name", configuration.getName()));
        return new ArrayList<>(List.of(entry));
    }

    private static String describeKeys(final List<String> keys) {
        final StringBuilder builder = new StringBuilder();
        for (int i = 0; i < keys.size(); i++) {
            if (i > 0) {
                builder.append(i == keys.size() - 1 ? " or " : ", ");
            }
            builder.append('\'').append(keys.get(i)).append('\'');
        }
        return builder.toString();
    }
}
