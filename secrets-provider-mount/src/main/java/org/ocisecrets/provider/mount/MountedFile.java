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
package org.ocisecrets.provider.mount;

import java.util.Arrays;
import java.util.Objects;

/**
 * File returned to the driver
 *
 * @param path Path relative to the mount target
 * @param contents Decoded secret contents
 * @param mode File mode
 */
public record MountedFile(String path, byte[] contents, int mode) {

    public MountedFile {
        Objects.requireNonNull(path, "Path required");
        Objects.requireNonNull(contents, "Contents required");
        contents = contents.clone();
    }

    @Override
    public byte[] contents() {
        return contents.clone();
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MountedFile file)) {
            return false;
        }
        return mode == file.mode && path.equals(file.path) && Arrays.equals(contents, file.contents);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, mode) * 31 + Arrays.hashCode(contents);
    }

    @Override
    public String toString() {
        return String.format("MountedFile[path=%s, mode=%o]", path, mode);
    }
}
