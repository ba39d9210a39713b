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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Resolved secret bundle. Identifier and version number always come from the vault response.
 */
public final class SecretBundle {
    private final String id;
    private final String name;
    private final long versionNumber;
    private final Set<Stage> stages;
    private final String fileAlias;
    private final SecretBundleContent content;

    private SecretBundle(final Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Secret identifier required");
        this.name = Objects.requireNonNull(builder.name, "Secret name required");
        this.versionNumber = builder.versionNumber;
        this.stages = builder.stages.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.stages));
        this.fileAlias = builder.fileAlias;
        this.content = Objects.requireNonNull(builder.content, "Secret content required");
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public long getVersionNumber() {
        return versionNumber;
    }

    public Set<Stage> getStages() {
        return stages;
    }

    public String getFileAlias() {
        return fileAlias;
    }

    public SecretBundleContent getContent() {
        return content;
    }

    public String getEffectivePath() {
        return SecretReference.effectivePath(name, fileAlias);
    }

    @Override
    public String toString() {
        return String.format("SecretBundle[id=%s, name=%s, version=%d, stages=%s]", id, name, versionNumber, stages);
    }

    public static class Builder {
        private String id;
        private String name;
        private long versionNumber;
        private Set<Stage> stages = Collections.emptySet();
        private String fileAlias;
        private SecretBundleContent content;

        public Builder id(final String id) {
            this.id = id;
            return this;
        }

        public Builder name(final String name) {
            this.name = name;
            return this;
        }

        public Builder versionNumber(final long versionNumber) {
            this.versionNumber = versionNumber;
            return this;
        }

        public Builder stages(final Set<Stage> stages) {
            this.stages = stages == null ? Collections.emptySet() : stages;
            return this;
        }

        public Builder fileAlias(final String fileAlias) {
            this.fileAlias = fileAlias;
            return this;
        }

        public Builder content(final SecretBundleContent content) {
            this.content = content;
            return this;
        }

        public SecretBundle build() {
            return new SecretBundle(this);
        }
    }
}
