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

import org.apache.commons.lang3.StringUtils;

import java.util.Objects;
import java.util.Optional;

/**
 * Reference to a single secret bundle identified by name and either a stage or a version number.
 * When neither stage nor version number is set, the current stage is resolved.
 */
public final class SecretReference {
    private final String name;
    private final Stage stage;
    private final Long versionNumber;
    private final String fileAlias;

    private SecretReference(final Builder builder) {
        this.name = builder.name;
        this.stage = builder.stage;
        this.versionNumber = builder.versionNumber;
        this.fileAlias = builder.fileAlias;
    }

    public String getName() {
        return name;
    }

    /**
     * Get requested Stage
     *
     * @return Requested Stage or {@link Stage#NONE} when not requested
     */
    public Stage getStage() {
        return stage;
    }

    public Optional<Long> getVersionNumber() {
        return Optional.ofNullable(versionNumber);
    }

    public Optional<String> getFileAlias() {
        return Optional.ofNullable(fileAlias);
    }

    /**
     * Get path of the file relative to the mount target
     *
     * @return Trimmed file alias when configured, otherwise trimmed secret name
     */
    public String getEffectivePath() {
        return effectivePath(name, fileAlias);
    }

    /**
     * Whether the effective path comes from a configured file alias instead of the secret name
     *
     * @return Alias status
     */
    public boolean isAliased() {
        return StringUtils.isNotBlank(fileAlias);
    }

    static String effectivePath(final String name, final String fileAlias) {
        if (StringUtils.isNotBlank(fileAlias)) {
            return fileAlias.trim();
        }
        return StringUtils.trimToEmpty(name);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SecretReference reference)) {
            return false;
        }
        return Objects.equals(name, reference.name)
                && stage == reference.stage
                && Objects.equals(versionNumber, reference.versionNumber)
                && Objects.equals(fileAlias, reference.fileAlias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, stage, versionNumber, fileAlias);
    }

    @Override
    public String toString() {
        return String.format("{name=%s, version=%s, stage=%s}", name, versionNumber == null ? 0 : versionNumber, stage);
    }

    public static class Builder {
        private String name;
        private Stage stage = Stage.NONE;
        private Long versionNumber;
        private String fileAlias;

        public Builder name(final String name) {
            this.name = name;
            return this;
        }

        public Builder stage(final Stage stage) {
            this.stage = stage == null ? Stage.NONE : stage;
            return this;
        }

        public Builder versionNumber(final Long versionNumber) {
            if (versionNumber != null && versionNumber <= 0) {
                throw new IllegalArgumentException(String.format("Version number [%d] must be positive", versionNumber));
            }
            this.versionNumber = versionNumber;
            return this;
        }

        public Builder fileAlias(final String fileAlias) {
            this.fileAlias = fileAlias;
            return this;
        }

        public SecretReference build() {
            return new SecretReference(this);
        }
    }
}
