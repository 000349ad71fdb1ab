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

/**
 * Existing node on a path does not have the container type required by the following segment
 */
public class PathConflictException extends IllegalStateException {
    private final String path;

    private final Object existingValue;

    /**
     * Path Conflict Exception with the conflicting path prefix and the value found there
     *
     * @param path Path prefix of the conflicting node
     * @param existingValue Value found at the path prefix
     */
    public PathConflictException(final String path, final Object existingValue) {
        super(String.format("Path [%s] holds value [%s] of type [%s] which cannot contain the following segment",
                path, existingValue, existingValue.getClass().getSimpleName()));
        this.path = path;
        this.existingValue = existingValue;
    }

    public String getPath() {
        return path;
    }

    public Object getExistingValue() {
        return existingValue;
    }
}
