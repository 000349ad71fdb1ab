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
package org.kubricate.secret.injection;

import java.util.Objects;

/**
 * Immutable description of how a secret is placed into a resource
 */
public final class SecretInjectionStrategy {
    private final String kind;

    private final Integer containerIndex;

    private final String key;

    private final String prefix;

    private final String targetPath;

    private final String mountPath;

    private SecretInjectionStrategy(final Builder builder) {
        this.kind = builder.kind;
        this.containerIndex = builder.containerIndex;
        this.key = builder.key;
        this.prefix = builder.prefix;
        this.targetPath = builder.targetPath;
        this.mountPath = builder.mountPath;
    }

    public static SecretInjectionStrategy of(final String kind) {
        return builder(kind).build();
    }

    public static Builder builder(final String kind) {
        return new Builder(kind);
    }

    public String getKind() {
        return kind;
    }

    /**
     * Get container index for container-scoped kinds
     *
     * @return Container index or null when not specified
     */
    public Integer getContainerIndex() {
        return containerIndex;
    }

    /**
     * Get key selected from a multi-key secret for env injection
     *
     * @return Key or null when not specified
     */
    public String getKey() {
        return key;
    }

    /**
     * Get variable prefix for envFrom injection
     *
     * @return Prefix or null when not specified
     */
    public String getPrefix() {
        return prefix;
    }

    /**
     * Get explicit target path overriding the provider default
     *
     * @return Target path or null when not specified
     */
    public String getTargetPath() {
        return targetPath;
    }

    public String getMountPath() {
        return mountPath;
    }

    /**
     * Create a copy of this strategy with a different container index
     *
     * @param index Container index
     * @return Secret Injection Strategy
     */
    public SecretInjectionStrategy withContainerIndex(final Integer index) {
        return toBuilder().containerIndex(index).build();
    }

    public Builder toBuilder() {
        return new Builder(kind)
                .containerIndex(containerIndex)
                .key(key)
                .prefix(prefix)
                .targetPath(targetPath)
                .mountPath(mountPath);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        final SecretInjectionStrategy strategy = (SecretInjectionStrategy) other;
        return kind.equals(strategy.kind)
                && Objects.equals(containerIndex, strategy.containerIndex)
                && Objects.equals(key, strategy.key)
                && Objects.equals(prefix, strategy.prefix)
                && Objects.equals(targetPath, strategy.targetPath)
                && Objects.equals(mountPath, strategy.mountPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, containerIndex, key, prefix, targetPath, mountPath);
    }

    @Override
    public String toString() {
        return String.format("SecretInjectionStrategy[kind=%s, containerIndex=%s, key=%s, prefix=%s, targetPath=%s]",
                kind, containerIndex, key, prefix, targetPath);
    }

    public static final class Builder {
        private final String kind;

        private Integer containerIndex;

        private String key;

        private String prefix;

        private String targetPath;

        private String mountPath;

        private Builder(final String kind) {
            this.kind = Objects.requireNonNull(kind, "Kind required");
        }

        public Builder containerIndex(final Integer containerIndex) {
            this.containerIndex = containerIndex;
            return this;
        }

        public Builder key(final String key) {
            this.key = key;
            return this;
        }

        public Builder prefix(final String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder targetPath(final String targetPath) {
            this.targetPath = targetPath;
            return this;
        }

        public Builder mountPath(final String mountPath) {
            this.mountPath = mountPath;
            return this;
        }

        public SecretInjectionStrategy build() {
            return new SecretInjectionStrategy(this);
        }
    }
}
