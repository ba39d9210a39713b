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
package org.ocisecrets.provider.config;

/**
 * Configuration keys with default values
 */
public enum ProviderPropertyKey {
    VAULT_CLIENT_TIMEOUT("secrets.provider.vault.client.timeout", "20"),

    WORKLOAD_TOKEN_TTL("secrets.provider.workload.token.ttl", "900"),

    RUNTIME_NAME("secrets.provider.runtime.name", "oci-secrets-store-csi-driver-provider"),

    RUNTIME_VERSION("secrets.provider.runtime.version", "unknown");

    private final String key;

    private final String defaultValue;

    ProviderPropertyKey(final String key, final String defaultValue) {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public String getKey() {
        return key;
    }

    public String getDefaultValue() {
        return defaultValue;
    }
}
