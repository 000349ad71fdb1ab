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
package org.kubricate.env.connector;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DotEnvReaderTest {
    private final DotEnvReader reader = new DotEnvReader();

    @TempDir
    Path directory;

    @Test
    void testReadMissingFile() {
        assertTrue(reader.read(directory.resolve(".env")).isEmpty());
    }

    @Test
    void testRead() throws IOException {
        final String contents = String.join("\n",
                "# database",
                "",
                "export HOST=localhost",
                "PASSWORD=\"multi\\nline\"",
                "TOKEN='a#b'",
                "MODE=production # inline",
                "EMPTY=",
                "=ignored"
        );
        final Path dotEnvPath = directory.resolve(".env");
        Files.writeString(dotEnvPath, contents, StandardCharsets.UTF_8);

        final Map<String, String> variables = reader.read(dotEnvPath);

        assertEquals("localhost", variables.get("HOST"));
        assertEquals("multi\nline", variables.get("PASSWORD"));
        assertEquals("a#b", variables.get("TOKEN"));
        assertEquals("production", variables.get("MODE"));
        assertEquals("", variables.get("EMPTY"));
        assertEquals(5, variables.size());
    }
}
