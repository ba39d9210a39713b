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
package org.ocisecrets.provider.oci;

import com.oracle.bmc.secrets.requests.GetSecretBundleByNameRequest;
import com.oracle.bmc.secrets.responses.GetSecretBundleByNameResponse;

/**
 * Vault client abstraction limited to the single remote operation required for mounting secrets
 */
public interface OciSecretClient extends AutoCloseable {

    /**
     * Fetch Secret Bundle identified by name and either version number or stage
     *
     * @param request Secret Bundle request
     * @return Secret Bundle response
     * @throws com.oracle.bmc.model.BmcException on remote failures
     */
    GetSecretBundleByNameResponse fetchByNameAndSelector(GetSecretBundleByNameRequest request);

    @Override
    void close();
}
