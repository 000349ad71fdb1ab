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
package org.kubricate.stack;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Named template creating resource trees by identifier from typed input
 *
 * @param <T> Input type
 */
public interface StackTemplate<T> {

    String getName();

    /**
     * Create resource trees for the input
     *
     * @param input Template input
     * @return Resource trees by resource identifier in declaration order
     */
    Map<String, Map<String, Object>> create(T input);

    /**
     * Define Stack Template from a name and creation function
     *
     * @param name Template name required
     * @param creator Creation function required
     * @param <T> Input type
     * @return Stack Template
     */
    static <T> StackTemplate<T> of(final String name, final Function<T, Map<String, Map<String, Object>>> creator) {
        Objects.requireNonNull(name, "Name required");
        Objects.requireNonNull(creator, "Creator required");
        return new StackTemplate<>() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Map<String, Map<String, Object>> create(final T input) {
                return creator.apply(input);
            }
        };
    }
}
