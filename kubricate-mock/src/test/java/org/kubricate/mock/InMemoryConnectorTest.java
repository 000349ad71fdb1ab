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

import org.junit.jupiter.api.Test;
import org.kubricate.exception.SecretConnectorException;
import org.kubricate.secret.SecretValue;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InMemoryConnectorTest {
    private static final String SECRET_NAME = "API_KEY";

    @Test
    void testLoadGet() {
        final InMemoryConnector connector = new InMemoryConnector(Map.of(SECRET_NAME, "secret"));

        connector.load(List.of(SECRET_NAME));

        assertEquals(SecretValue.of("secret"), connector.get(SECRET_NAME));
    }

    @Test
    void testLoadMissing() {
        final InMemoryConnector connector = new InMemoryConnector(Map.of());

        final SecretConnectorException exception = assertThrows(SecretConnectorException.class, () -> connector.load(List.of(SECRET_NAME)));
        assertEquals("Missing secret: API_KEY", exception.getMessage());
    }

    @Test
    void testGetNotLoaded() {
        final InMemoryConnector connector = new InMemoryConnector(Map.of(SECRET_NAME, "secret"));

        final SecretConnectorException exception = assertThrows(SecretConnectorException.class, () -> connector.get(SECRET_NAME));
        assertEquals("Secret API_KEY not loaded", exception.getMessage());
    }
}
