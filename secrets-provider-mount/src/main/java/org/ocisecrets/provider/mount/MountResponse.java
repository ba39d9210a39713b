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

import java.util.List;

/**
 * Mount Response with files and object versions sharing the same index for each secret
 *
 * @param files Mounted files
 * @param objectVersions Object versions
 */
public record MountResponse(List<MountedFile> files, List<ObjectVersion> objectVersions) {

    public MountResponse {
        files = List.copyOf(files);
        objectVersions = List.copyOf(objectVersions);
        if (files.size() != objectVersions.size()) {
            throw new IllegalArgumentException(String.format("Files [%d] and Object Versions [%d] not aligned", files.size(), objectVersions.size()));
        }
    }
}
