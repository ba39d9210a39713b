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

import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Read-only provider configuration set once at process start
 */
public class ProviderProperties {
    private final Properties rawProperties = new Properties();

    public ProviderProperties(final Properties properties) {
        Objects.requireNonNull(properties, "Properties are required");
        rawProperties.putAll(properties);
    }

    /**
     * Get Provider Properties containing only default values
     *
     * @return Default Provider Properties
     */
    public static ProviderProperties defaults() {
        return new ProviderProperties(new Properties());
    }

    /**
     * Get property value or default value when the property is blank or not configured
     *
     * @param propertyKey Property Key
     * @return Property value
     */
    public String getProperty(final ProviderPropertyKey propertyKey) {
        final String property = rawProperties.getProperty(propertyKey.getKey());
        return StringUtils.isBlank(property) ? propertyKey.getDefaultValue() : property.trim();
    }

    /**
     * Get connection and read timeout applied to vault clients
     *
     * @return Vault client timeout
     */
    public Duration getVaultClientTimeout() {
        return getSeconds(ProviderPropertyKey.VAULT_CLIENT_TIMEOUT);
    }

    /**
     * Get expiration of service account tokens issued for workload principals
     *
     * @return Workload token time to live
     */
    public Duration getWorkloadTokenTtl() {
        return getSeconds(ProviderPropertyKey.WORKLOAD_TOKEN_TTL);
    }

    public String getRuntimeName() {
        return getProperty(ProviderPropertyKey.RUNTIME_NAME);
    }

    public String getRuntimeVersion() {
        return getProperty(ProviderPropertyKey.RUNTIME_VERSION);
    }

    private Duration getSeconds(final ProviderPropertyKey propertyKey) {
        final String property = getProperty(propertyKey);
        final long seconds;
        try {
            seconds = Long.parseLong(property);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Property [%s] value [%s] is not a number of seconds", propertyKey.getKey(), property), e);
        }
        if (seconds <= 0) {
            throw new IllegalArgumentException(String.format("Property [%s] value [%s] must be positive", propertyKey.getKey(), property));
        }
        return Duration.ofSeconds(seconds);
    }

    @Override
    public String toString() {
        return String.format("Provider properties with [%d] configured keys", rawProperties.size());
    }
}
