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

import org.kubricate.exception.ResourceCompositionException;
import org.kubricate.object.path.ObjectPath;
import org.kubricate.object.path.PathConflictException;
import org.kubricate.object.path.ObjectTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Composer holding output resources by identifier, merging injected payloads and overrides into their trees
 */
public class ResourceComposer {
    private static final Logger logger = LoggerFactory.getLogger(ResourceComposer.class);

    private static final Pattern RESOURCE_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");

    private static final String KIND_FIELD = "kind";

    private final Map<String, ResourceEntry> entries = new LinkedHashMap<>();

    private Map<String, Object> overrides = new LinkedHashMap<>();

    /**
     * Add object tree supporting injection and overrides
     *
     * @param resourceId Resource identifier required
     * @param config Resource tree required
     * @return Resource Composer
     */
    public ResourceComposer addObject(final String resourceId, final Map<String, Object> config) {
        Objects.requireNonNull(config, "Config required");
        return addEntry(resourceId, new ResourceEntry(ObjectTrees.deepCopy(config), EntryType.OBJECT, null));
    }

    /**
     * Add object tree built into a typed resource through the factory after overrides are applied
     *
     * @param resourceId Resource identifier required
     * @param factory Factory required
     * @param config Resource tree required
     * @return Resource Composer
     */
    public ResourceComposer addFactory(final String resourceId, final Function<Map<String, Object>, ?> factory, final Map<String, Object> config) {
        Objects.requireNonNull(factory, "Factory required");
        Objects.requireNonNull(config, "Config required");
        return addEntry(resourceId, new ResourceEntry(ObjectTrees.deepCopy(config), EntryType.FACTORY, factory));
    }

    /**
     * Add opaque instance returned as-is and excluded from injection and overrides
     *
     * @param resourceId Resource identifier required
     * @param instance Resource instance required
     * @return Resource Composer
     */
    public ResourceComposer addInstance(final String resourceId, final Object instance) {
        Objects.requireNonNull(instance, "Instance required");
        return addEntry(resourceId, new ResourceEntry(instance, EntryType.INSTANCE, null));
    }

    /**
     * Set override tree keyed by resource identifier and merged onto resources on build
     *
     * @param overrides Override tree required
     * @return Resource Composer
     */
    public ResourceComposer override(final Map<String, Object> overrides) {
        Objects.requireNonNull(overrides, "Overrides required");
        this.overrides = ObjectTrees.deepCopy(overrides);
        return this;
    }

    public Optional<ResourceEntry> getEntry(final String resourceId) {
        return Optional.ofNullable(entries.get(resourceId));
    }

    public List<String> getResourceIds() {
        return Collections.unmodifiableList(new ArrayList<>(entries.keySet()));
    }

    /**
     * Inject value at path of a resource: absent values are set, Lists are concatenated, Maps are merged deeply,
     * and any other existing value, including an intermediate value that cannot hold the path, causes a failure
     * leaving the resource unchanged
     *
     * @param resourceId Resource identifier required
     * @param path Accessor path required
     * @param value Value to inject
     */
    public void inject(final String resourceId, final String path, final Object value) {
        final ResourceEntry entry = entries.get(resourceId);
        if (entry == null) {
            throw new ResourceCompositionException(String.format("Cannot inject, resource with ID %s not found.", resourceId));
        }
        if (!entry.getEntryType().isMergeable()) {
            throw new ResourceCompositionException(String.format("Cannot inject, resource with ID %s is not an object or factory entry.", resourceId));
        }

        final Map<String, Object> composed = ObjectTrees.deepCopy(entry.getConfigMap());
        final ObjectPath objectPath = ObjectPath.parse(path);
        final Object existingValue = objectPath.get(composed);
        final Object injectedValue = ObjectTrees.deepCopy(value);

        if (existingValue == null) {
            try {
                objectPath.set(composed, injectedValue);
            } catch (final PathConflictException e) {
                throw new ResourceCompositionException(String.format(
                        "Cannot inject, resource \"%s\" has an incompatible value at \"%s\" on path \"%s\". Existing: %s",
                        resourceId, e.getPath(), path, e.getExistingValue()), e);
            }
        } else if (ObjectTrees.isArray(existingValue) && ObjectTrees.isArray(injectedValue)) {
            final List<Object> concatenated = new ArrayList<>((List<?>) existingValue);
            concatenated.addAll((List<?>) injectedValue);
            objectPath.set(composed, concatenated);
        } else if (ObjectTrees.isPlainObject(existingValue) && ObjectTrees.isPlainObject(injectedValue)) {
            objectPath.set(composed, ObjectTrees.deepMerge(existingValue, injectedValue));
        } else {
            throw new ResourceCompositionException(String.format(
                    "Cannot inject, resource \"%s\" already has a value at path \"%s\". Existing: %s. New value: %s",
                    resourceId, path, existingValue, value));
        }

        entries.put(resourceId, new ResourceEntry(composed, entry.getEntryType(), entry.getFactory()));
        logger.debug("Injected value into resource [{}] at path [{}]", resourceId, path);
    }

    /**
     * Build resources in registration order, merging overrides onto object and factory entries
     *
     * @return Built resources by identifier
     */
    public Map<String, Object> build() {
        final Map<String, Object> resources = new LinkedHashMap<>();
        for (final Map.Entry<String, ResourceEntry> mapEntry : entries.entrySet()) {
            final String resourceId = mapEntry.getKey();
            final ResourceEntry entry = mapEntry.getValue();
            switch (entry.getEntryType()) {
                case INSTANCE:
                    resources.put(resourceId, entry.getConfig());
                    break;
                case FACTORY:
                    resources.put(resourceId, entry.getFactory().apply(getMergedConfig(resourceId, entry)));
                    break;
                default:
                    resources.put(resourceId, getMergedConfig(resourceId, entry));
                    break;
            }
        }
        return resources;
    }

    /**
     * Find identifiers of resources whose kind field matches ignoring case
     *
     * @param kind Resource kind required
     * @return Matching resource identifiers in registration order
     */
    public List<String> findResourceIdsByKind(final String kind) {
        Objects.requireNonNull(kind, "Kind required");
        final List<String> resourceIds = new ArrayList<>();
        for (final Map.Entry<String, ResourceEntry> mapEntry : entries.entrySet()) {
            final ResourceEntry entry = mapEntry.getValue();
            final Object config = entry.getEntryType().isMergeable() ? getMergedConfig(mapEntry.getKey(), entry) : entry.getConfig();
            if (config instanceof Map) {
                final Object resourceKind = ((Map<?, ?>) config).get(KIND_FIELD);
                if (resourceKind instanceof String && kind.equalsIgnoreCase((String) resourceKind)) {
                    resourceIds.add(mapEntry.getKey());
                }
            }
        }
        return resourceIds;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMergedConfig(final String resourceId, final ResourceEntry entry) {
        final Object override = overrides.get(resourceId);
        if (override instanceof Map) {
            return ObjectTrees.deepMergeMaps(entry.getConfigMap(), (Map<String, Object>) override);
        }
        return ObjectTrees.deepCopy(entry.getConfigMap());
    }

    private ResourceComposer addEntry(final String resourceId, final ResourceEntry entry) {
        Objects.requireNonNull(resourceId, "Resource ID required");
        if (!RESOURCE_ID_PATTERN.matcher(resourceId).matches()) {
            throw new ResourceCompositionException(String.format("Invalid resourceId [%s]: only letters, digits, '-' and '_' are allowed", resourceId));
        }
        entries.put(resourceId, entry);
        return this;
    }
}
