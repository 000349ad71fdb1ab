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

import java.util.Objects;

/**
 * Name and namespace of the Kubernetes Secret produced by a provider
 */
public class KubernetesSecretConfiguration {
    public static final String DEFAULT_NAMESPACE = "default";

    private final String name;

    private final String namespace;

    /**
     * Kubernetes Secret Configuration constructor
     *
     * @param name Secret resource name required
     * @param namespace Namespace or null for the default namespace
     */
    public KubernetesSecretConfiguration(final String name, final String namespace) {
        this.name = Objects.requireNonNull(name, "Name required");
        this.namespace = namespace;
    }

    public static KubernetesSecretConfiguration of(final String name) {
        return new KubernetesSecretConfiguration(name, null);
    }

    public String getName() {
        return name;
    }

    public String getNamespace() {
        return namespace == null ? DEFAULT_NAMESPACE : namespace;
    }
}
