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

import org.ocisecrets.provider.auth.AuthPrincipal;

import java.time.Instant;
import java.util.List;

/**
 * Service that decouples mount request handling from the vault client
 */
public interface SecretBundleService {

    /**
     * Get Secret Bundles for each Secret Reference. Either every bundle is returned or the method fails.
     *
     * @param references Secret References in mount order
     * @param principal Principal used to access the vault
     * @param vaultId Vault identifier
     * @return Secret Bundles in the same order as the references
     */
    default List<SecretBundle> getSecretBundles(List<SecretReference> references, AuthPrincipal principal, String vaultId) {
        return getSecretBundles(references, principal, vaultId, Instant.MAX);
    }

    /**
     * Get Secret Bundles for each Secret Reference, abandoning the batch once the deadline has passed
     *
     * @param references Secret References in mount order
     * @param principal Principal used to access the vault
     * @param vaultId Vault identifier
     * @param deadline Instant after which no further secrets are fetched
     * @return Secret Bundles in the same order as the references
     */
    List<SecretBundle> getSecretBundles(List<SecretReference> references, AuthPrincipal principal, String vaultId, Instant deadline);
}
