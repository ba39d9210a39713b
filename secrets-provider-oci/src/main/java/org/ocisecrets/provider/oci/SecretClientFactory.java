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

import com.oracle.bmc.auth.BasicAuthenticationDetailsProvider;
import org.ocisecrets.provider.auth.AuthPrincipal;

/**
 * Factory for authentication providers and vault clients
 */
public interface SecretClientFactory {

    /**
     * Create Authentication Details Provider for the resolved principal
     *
     * @param principal Resolved principal
     * @return Authentication Details Provider
     * @throws org.ocisecrets.provider.auth.AuthResolutionException when the provider cannot be created
     */
    BasicAuthenticationDetailsProvider createConfigProvider(AuthPrincipal principal);

    /**
     * Create Secret Client using the Authentication Details Provider
     *
     * @param provider Authentication Details Provider
     * @return Secret Client to be closed after use
     */
    OciSecretClient createSecretClient(BasicAuthenticationDetailsProvider provider);
}
