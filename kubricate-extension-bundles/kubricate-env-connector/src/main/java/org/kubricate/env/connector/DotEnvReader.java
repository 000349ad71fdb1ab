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

import org.apache.commons.lang3.StringUtils;
import org.kubricate.exception.SecretConnectorException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reader for dotenv files containing KEY=VALUE lines with optional export keyword, quotes and comments
 */
class DotEnvReader {
    static final String DOT_ENV_FILE_NAME = ".env";

    private static final String EXPORT_KEYWORD = "export ";

    private static final char COMMENT = '#';

    private static final char SEPARATOR = '=';

    private static final char DOUBLE_QUOTE = '"';

    private static final char SINGLE_QUOTE = '\'';

    /**
     * Read variables from a dotenv file
     *
     * @param dotEnvPath Path to dotenv file
     * @return Variables in file order or empty when the file does not exist
     */
    Map<String, String> read(final Path dotEnvPath) {
        final Map<String, String> variables = new LinkedHashMap<>();
        if (!Files.isRegularFile(dotEnvPath)) {
            return variables;
        }

        try (BufferedReader reader = Files.newBufferedReader(dotEnvPath, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                readLine(line, variables);
            }
        } catch (final IOException e) {
            throw new SecretConnectorException(String.format("Failed to read dotenv file [%s]", dotEnvPath), e);
        }
        return variables;
    }

    private void readLine(final String line, final Map<String, String> variables) {
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.charAt(0) == COMMENT) {
            return;
        }
        if (trimmed.startsWith(EXPORT_KEYWORD)) {
            trimmed = trimmed.substring(EXPORT_KEYWORD.length()).trim();
        }

        final int separatorIndex = trimmed.indexOf(SEPARATOR);
        if (separatorIndex < 1) {
            return;
        }

        final String name = trimmed.substring(0, separatorIndex).trim();
        final String rawValue = trimmed.substring(separatorIndex + 1).trim();
        variables.put(name, parseValue(rawValue));
    }

    private String parseValue(final String rawValue) {
        if (rawValue.length() >= 2) {
            final char first = rawValue.charAt(0);
            final int closingIndex = rawValue.lastIndexOf(first);
            if ((first == DOUBLE_QUOTE || first == SINGLE_QUOTE) && closingIndex > 0) {
                final String quoted = rawValue.substring(1, closingIndex);
                return first == DOUBLE_QUOTE ? quoted.replace("\\n", "\n") : quoted;
            }
        }

        // Unquoted values end at an inline comment
        final int commentIndex = rawValue.indexOf(" #");
        return commentIndex < 0 ? rawValue : StringUtils.stripEnd(rawValue.substring(0, commentIndex), null);
    }
}
