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
package org.kubricate.secret.orchestrator;

import org.kubricate.secret.PreparedEffect;
import org.kubricate.secret.provider.SecretProvider;

import java.util.Objects;

/**
 * Prepared effect with the manager and provider instance that produced it
 */
public final class TrackedEffect {
    private final String managerName;

    private final SecretProvider provider;

    private final PreparedEffect effect;

    public TrackedEffect(final String managerName, final SecretProvider provider, final PreparedEffect effect) {
        this.managerName = Objects.requireNonNull(managerName, "Manager Name required");
        this.provider = Objects.requireNonNull(provider, "Provider required");
        this.effect = Objects.requireNonNull(effect, "Effect required");
    }

    public String getManagerName() {
        return managerName;
    }

    public SecretProvider getProvider() {
        return provider;
    }

    public PreparedEffect getEffect() {
        return effect;
    }

    public String getIdentifier() {
        return provider.getEffectIdentifier(effect);
    }

    TrackedEffect withEffect(final PreparedEffect mergedEffect) {
        return new TrackedEffect(managerName, provider, mergedEffect);
    }

    @Override
    public String toString() {
        return String.format("TrackedEffect[manager=%s, provider=%s, secretName=%s]", managerName, provider.getName(), effect.getSecretName());
    }
}
