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

import java.time.Instant;

/**
 * Mount Request from the driver
 *
 * @param attributes JSON object of string attributes combining SecretProviderClass parameters and pod metadata
 * @param targetPath Directory where the driver writes the returned files
 * @param permission JSON number of the file mode
 * @param deadline Instant after which the request is abandoned, null for no deadline
 */
public record MountRequest(String attributes, String targetPath, String permission, Instant deadline) {
}
