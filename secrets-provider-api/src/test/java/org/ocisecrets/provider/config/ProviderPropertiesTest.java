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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ProviderPropertiesTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        final ProviderProperties properties = ProviderProperties.defaults();

        assertEquals(Duration.ofSeconds(20), properties.getVaultClientTimeout());
        assertEquals(Duration.ofMinutes(15), properties.getWorkloadTokenTtl());
        assertEquals("oci-secrets-store-csi-driver-provider", properties.getRuntimeName());
    }

    @Test
    void testBlankPropertyUsesDefault() {
        final Properties rawProperties = new Properties();
        rawProperties.setProperty(ProviderPropertyKey.VAULT_CLIENT_TIMEOUT.getKey(), " ");

        final ProviderProperties properties = new ProviderProperties(rawProperties);

        assertEquals(Duration.ofSeconds(20), properties.getVaultClientTimeout());
    }

    @Test
    void testInvalidTimeout() {
        final Properties rawProperties = new Properties();
        rawProperties.setProperty(ProviderPropertyKey.VAULT_CLIENT_TIMEOUT.getKey(), "20 secs");

        final ProviderProperties properties = new ProviderProperties(rawProperties);

        assertThrows(IllegalArgumentException.class, properties::getVaultClientTimeout);
    }

    @Test
    void testNegativeTtl() {
        final Properties rawProperties = new Properties();
        rawProperties.setProperty(ProviderPropertyKey.WORKLOAD_TOKEN_TTL.getKey(), "-1");

        final ProviderProperties properties = new ProviderProperties(rawProperties);

        assertThrows(IllegalArgumentException.class, properties::getWorkloadTokenTtl);
    }

    @Test
    void testLoadPath() throws IOException {
        final Path propertiesPath = tempDir.resolve("provider.properties");
        Files.writeString(propertiesPath, String.join(System.lineSeparator(),
                "secrets.provider.vault.client.timeout=5",
                "secrets.provider.runtime.version=1.2.3"));

        final ProviderProperties properties = new ProviderPropertiesLoader().load(propertiesPath);

        assertEquals(Duration.ofSeconds(5), properties.getVaultClientTimeout());
        assertEquals("1.2.3", properties.getRuntimeVersion());
    }

    @Test
    void testLoadPathNotFound() {
        final ProviderPropertiesLoader loader = new ProviderPropertiesLoader();

        assertThrows(IllegalArgumentException.class, () -> loader.load(tempDir.resolve("missing.properties")));
    }

    @Test
    void testLoadClasspathResource() {
        final ProviderProperties properties = new ProviderPropertiesLoader().load();

        assertEquals("test", properties.getRuntimeVersion());
    }
}
