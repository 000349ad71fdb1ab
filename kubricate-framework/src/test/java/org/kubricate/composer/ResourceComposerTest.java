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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.kubricate.exception.ResourceCompositionException;
import org.kubricate.object.path.ObjectPath;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResourceComposerTest {
    private static final String RESOURCE_ID = "deployment";

    private static final String ENV_PATH = "spec.template.spec.containers[0].env";

    private static final Map<String, Object> HOST_ENV = Map.of("name", "HOST", "value", "localhost");

    private static final Map<String, Object> PORT_ENV = Map.of("name", "PORT", "value", "8080");

    private ResourceComposer composer;

    @BeforeEach
    void setComposer() {
        composer = new ResourceComposer();
    }

    @Test
    void testInjectResourceNotFound() {
        final ResourceCompositionException exception = assertThrows(ResourceCompositionException.class,
                () -> composer.inject("nonexistent", ENV_PATH, List.of()));
        assertEquals("Cannot inject, resource with ID nonexistent not found.", exception.getMessage());
    }

    @Test
    void testInjectInstanceRejected() {
        composer.addInstance(RESOURCE_ID, Map.of("kind", "Deployment"));

        final ResourceCompositionException exception = assertThrows(ResourceCompositionException.class,
                () -> composer.inject(RESOURCE_ID, ENV_PATH, List.of()));
        assertTrue(exception.getMessage().contains("is not an object or factory entry"));
    }

    @Test
    void testInjectAbsentPathSets() {
        composer.addObject(RESOURCE_ID, Map.of("kind", "Deployment"));

        composer.inject(RESOURCE_ID, ENV_PATH, List.of(HOST_ENV));

        final Map<String, Object> expected = Map.of(
                "kind", "Deployment",
                "spec", Map.of("template", Map.of("spec", Map.of("containers", List.of(Map.of("env", List.of(HOST_ENV))))))
        );
        assertEquals(expected, composer.build().get(RESOURCE_ID));
    }

    @Test
    void testInjectArraysConcatenated() {
        composer.addObject(RESOURCE_ID, newDeployment());

        composer.inject(RESOURCE_ID, ENV_PATH, List.of(HOST_ENV));
        composer.inject(RESOURCE_ID, ENV_PATH, List.of(PORT_ENV));

        final Map<String, Object> deployment = getBuiltDeployment();
        assertEquals(List.of(HOST_ENV, PORT_ENV), ObjectPath.parse(ENV_PATH).get(deployment));
    }

    @Test
    void testInjectObjectsMergedDeeply() {
        composer.addObject(RESOURCE_ID, Map.of("metadata", Map.of("annotations", Map.of("owner", "platform", "nested", Map.of("a", "1")))));

        composer.inject(RESOURCE_ID, "metadata.annotations", Map.of("team", "payments", "nested", Map.of("b", "2")));

        final Map<String, Object> expected = Map.of("metadata", Map.of("annotations", Map.of(
                "owner", "platform",
                "team", "payments",
                "nested", Map.of("a", "1", "b", "2")
        )));
        assertEquals(expected, composer.build().get(RESOURCE_ID));
    }

    @Test
    void testInjectIncompatibleValueRejectedWithoutChanges() {
        final Map<String, Object> config = Map.of("metadata", Map.of("name", "web"));
        composer.addObject(RESOURCE_ID, config);

        final ResourceCompositionException exception = assertThrows(ResourceCompositionException.class,
                () -> composer.inject(RESOURCE_ID, "metadata.name", List.of("api")));
        assertTrue(exception.getMessage().startsWith("Cannot inject, resource \"deployment\" already has a value at path \"metadata.name\""));
        assertTrue(exception.getMessage().contains("Existing: web"));
        assertEquals(config, composer.build().get(RESOURCE_ID));
    }

    @Test
    void testInjectScalarAncestorRejectedWithoutChanges() {
        final Map<String, Object> config = Map.of("kind", "Deployment", "spec", "template-ref");
        composer.addObject(RESOURCE_ID, config);

        final ResourceCompositionException exception = assertThrows(ResourceCompositionException.class,
                () -> composer.inject(RESOURCE_ID, ENV_PATH, List.of(HOST_ENV)));
        assertTrue(exception.getMessage().startsWith("Cannot inject, resource \"deployment\" has an incompatible value at \"spec\""));
        assertTrue(exception.getMessage().contains("Existing: template-ref"));
        assertEquals(config, composer.build().get(RESOURCE_ID));
    }

    @Test
    void testInjectIndexIntoMapAncestorRejectedWithoutChanges() {
        final Map<String, Object> config = Map.of("containers", Map.of("main", Map.of("image", "nginx")));
        composer.addObject(RESOURCE_ID, config);

        final ResourceCompositionException exception = assertThrows(ResourceCompositionException.class,
                () -> composer.inject(RESOURCE_ID, "containers[0].env", List.of(HOST_ENV)));
        assertTrue(exception.getMessage().contains("on path \"containers[0].env\""));
        assertEquals(config, composer.build().get(RESOURCE_ID));
    }

    @Test
    void testBuildAppliesOverrides() {
        composer.addObject(RESOURCE_ID, Map.of("metadata", Map.of("name", "web", "labels", Map.of("original", "value"))));
        composer.override(Map.of(RESOURCE_ID, Map.of("metadata", Map.of("labels", Map.of("override", "value")))));

        final Map<String, Object> expected = Map.of("metadata", Map.of(
                "name", "web",
                "labels", Map.of("original", "value", "override", "value")
        ));
        assertEquals(expected, composer.build().get(RESOURCE_ID));
    }

    @Test
    void testBuildInstanceAsIs() {
        final Object instance = new Object();
        composer.addInstance("instance", instance);
        composer.override(Map.of("instance", Map.of("metadata", Map.of("name", "ignored"))));

        assertSame(instance, composer.build().get("instance"));
    }

    @Test
    void testBuildFactory() {
        composer.addFactory(RESOURCE_ID, Deployment::new, Map.of("metadata", Map.of("name", "web")));
        composer.override(Map.of(RESOURCE_ID, Map.of("metadata", Map.of("namespace", "apps"))));

        final Object built = composer.build().get(RESOURCE_ID);

        final Deployment deployment = assertInstanceOf(Deployment.class, built);
        assertEquals(Map.of("name", "web", "namespace", "apps"), deployment.config.get("metadata"));
    }

    @Test
    void testFindResourceIdsByKind() {
        composer.addObject("web", Map.of("kind", "Deployment"));
        composer.addObject("service", Map.of("kind", "Service"));
        composer.addInstance("worker", Map.of("kind", "deployment"));

        assertEquals(List.of("web", "worker"), composer.findResourceIdsByKind("Deployment"));
    }

    @Test
    void testAddInvalidResourceId() {
        assertThrows(ResourceCompositionException.class, () -> composer.addObject("my.deployment", Map.of()));
    }

    @Test
    void testChaining() {
        final ResourceComposer chained = composer
                .addObject("web", Map.of())
                .addInstance("worker", Map.of());

        assertSame(composer, chained);
        assertEquals(List.of("web", "worker"), composer.getResourceIds());
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getBuiltDeployment() {
        return (Map<String, Object>) composer.build().get(RESOURCE_ID);
    }

    private static Map<String, Object> newDeployment() {
        final Map<String, Object> container = new LinkedHashMap<>();
        container.put("name", "app");
        container.put("image", "nginx");
        return Map.of(
                "kind", "Deployment",
                "spec", Map.of("template", Map.of("spec", Map.of("containers", List.of(container))))
        );
    }

    private static class Deployment {
        private final Map<String, Object> config;

        Deployment(final Map<String, Object> config) {
            this.config = config;
        }
    }
}
