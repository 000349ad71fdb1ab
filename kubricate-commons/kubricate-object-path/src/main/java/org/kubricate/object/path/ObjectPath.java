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
package org.kubricate.object.path;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Accessor path over trees of Maps and Lists, parsed from dotted and bracketed strings such as
 * {@code spec.template.spec.containers[0].env} or {@code metadata.annotations["example.com/key"]}
 */
public final class ObjectPath {
    private final String expression;

    private final List<Object> segments;

    private ObjectPath(final String expression, final List<Object> segments) {
        this.expression = expression;
        this.segments = Collections.unmodifiableList(segments);
    }

    /**
     * Parse path expression into segments where property names are Strings and list indexes are Integers
     *
     * @param expression Path expression required
     * @return Object Path
     * @throws IllegalArgumentException when the expression is empty or malformed
     */
    public static ObjectPath parse(final String expression) {
        Objects.requireNonNull(expression, "Path expression required");
        if (expression.isBlank()) {
            throw new IllegalArgumentException("Path expression cannot be empty");
        }

        final List<Object> segments = new ArrayList<>();
        final StringBuilder name = new StringBuilder();
        int position = 0;
        while (position < expression.length()) {
            final char current = expression.charAt(position);
            if (current == '.') {
                addName(expression, segments, name);
                position++;
            } else if (current == '[') {
                if (name.length() > 0) {
                    addName(expression, segments, name);
                }
                final int closing = expression.indexOf(']', position);
                if (closing < 0) {
                    throw new IllegalArgumentException(String.format("Path [%s] has unterminated bracket at position [%d]", expression, position));
                }
                segments.add(parseBracket(expression, expression.substring(position + 1, closing)));
                position = closing + 1;
                if (position < expression.length() && expression.charAt(position) == '.') {
                    position++;
                }
            } else {
                name.append(current);
                position++;
            }
        }
        if (name.length() > 0) {
            addName(expression, segments, name);
        }
        return new ObjectPath(expression, segments);
    }

    public List<Object> getSegments() {
        return segments;
    }

    /**
     * Get value at this path
     *
     * @param root Root Map or List
     * @return Value found or null when any segment is absent
     */
    public Object get(final Object root) {
        Object current = root;
        for (final Object segment : segments) {
            current = getChild(current, segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Set value at this path, creating absent intermediate Maps or Lists as required by the following segment
     *
     * @param root Root Map required
     * @param value Value to set
     * @throws PathConflictException when an existing intermediate value is not the container the following segment requires
     */
    @SuppressWarnings("unchecked")
    public void set(final Map<String, Object> root, final Object value) {
        Objects.requireNonNull(root, "Root required");
        Object current = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            final Object segment = segments.get(i);
            Object child = getChild(current, segment);
            final Object nextSegment = segments.get(i + 1);
            if (child != null && !isContainerFor(child, nextSegment)) {
                throw new PathConflictException(formatSegments(i + 1), child);
            }
            if (child == null) {
                child = nextSegment instanceof Integer ? new ArrayList<>() : new LinkedHashMap<String, Object>();
                putChild(current, segment, child);
            }
            current = child;
        }
        putChild(current, segments.get(segments.size() - 1), value);
    }

    @Override
    public String toString() {
        return expression;
    }

    private String formatSegments(final int count) {
        final StringBuilder builder = new StringBuilder();
        for (final Object segment : segments.subList(0, count)) {
            if (segment instanceof Integer) {
                builder.append('[').append(segment).append(']');
            } else {
                if (builder.length() > 0) {
                    builder.append('.');
                }
                builder.append(segment);
            }
        }
        return builder.toString();
    }

    private static boolean isContainerFor(final Object child, final Object segment) {
        return segment instanceof Integer ? child instanceof List : child instanceof Map;
    }

    private static Object getChild(final Object current, final Object segment) {
        if (current instanceof Map) {
            return ((Map<?, ?>) current).get(String.valueOf(segment));
        }
        if (current instanceof List && segment instanceof Integer) {
            final List<?> list = (List<?>) current;
            final int index = (Integer) segment;
            return index < list.size() ? list.get(index) : null;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static void putChild(final Object current, final Object segment, final Object value) {
        if (current instanceof Map) {
            ((Map<String, Object>) current).put(String.valueOf(segment), value);
        } else if (current instanceof List && segment instanceof Integer) {
            final List<Object> list = (List<Object>) current;
            final int index = (Integer) segment;
            while (list.size() <= index) {
                list.add(null);
            }
            list.set(index, value);
        } else {
            throw new IllegalArgumentException(String.format("Cannot set segment [%s] on value of type [%s]",
                    segment, current == null ? null : current.getClass().getSimpleName()));
        }
    }

    private static void addName(final String expression, final List<Object> segments, final StringBuilder name) {
        if (name.length() == 0) {
            throw new IllegalArgumentException(String.format("Path [%s] contains an empty property name", expression));
        }
        segments.add(name.toString());
        name.setLength(0);
    }

    private static Object parseBracket(final String expression, final String content) {
        final String trimmed = content.trim();
        if (trimmed.length() >= 2) {
            final char first = trimmed.charAt(0);
            final char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        try {
            final int index = Integer.parseInt(trimmed);
            if (index < 0) {
                throw new IllegalArgumentException(String.format("Path [%s] contains negative index [%d]", expression, index));
            }
            return index;
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Path [%s] contains invalid index [%s]", expression, content), e);
        }
    }
}
