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
package org.ocisecrets.provider.secret;

/**
 * Rotation stage of a secret version. The textual form matches the stage tokens used by OCI Vault.
 */
public enum Stage {
    NONE(""),

    CURRENT("CURRENT"),

    PENDING("PENDING"),

    LATEST("LATEST"),

    PREVIOUS("PREVIOUS"),

    DEPRECATED("DEPRECATED");

    private final String value;

    Stage(final String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Get Stage from exact textual value
     *
     * @param value Stage token; null and empty map to {@link #NONE}
     * @return Matching Stage
     * @throws UnknownStageException when the token does not match a known stage
     */
    public static Stage fromString(final String value) {
        if (value == null || value.isEmpty()) {
            return NONE;
        }
        for (final Stage stage : values()) {
            if (stage.value.equals(value)) {
                return stage;
            }
        }
        throw new UnknownStageException(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
