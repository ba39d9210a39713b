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

import java.util.Map;

/**
 * Mount request attribute keys provided through SecretProviderClass parameters and driver pod metadata
 */
public enum MountAttribute {
    SECRETS("secrets"),

    VAULT_ID("vaultId"),

    AUTH_TYPE("authType"),

    AUTH_SECRET_NAME("authSecretName"),

    SECRET_PROVIDER_CLASS("secretProviderClass"),

    POD_NAME("csi.storage.k8s.io/pod.name"),

    POD_NAMESPACE("csi.storage.k8s.io/pod.namespace"),

    POD_UID("csi.storage.k8s.io/pod.uid"),

    SERVICE_ACCOUNT_NAME("csi.storage.k8s.io/serviceAccount.name");

    private final String key;

    MountAttribute(final String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Get attribute value
     *
     * @param attributes Mount request attributes
     * @return Attribute value or null when not found
     */
    public String getValue(final Map<String, String> attributes) {
        return attributes.get(key);
    }
}
