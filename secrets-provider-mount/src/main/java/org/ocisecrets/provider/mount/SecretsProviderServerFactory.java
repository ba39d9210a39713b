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

import org.ocisecrets.provider.config.ProviderProperties;
import org.ocisecrets.provider.config.ProviderPropertiesLoader;
import org.ocisecrets.provider.kubernetes.KubernetesAuthConfigLookup;
import org.ocisecrets.provider.kubernetes.KubernetesClientProvider;
import org.ocisecrets.provider.kubernetes.KubernetesServiceAccountTokenIssuer;
import org.ocisecrets.provider.kubernetes.StandardKubernetesClientProvider;
import org.ocisecrets.provider.mount.auth.MountAuthResolver;
import org.ocisecrets.provider.oci.OciSecretBundleService;
import org.ocisecrets.provider.oci.StandardSecretClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory wiring the standard server with OCI Vault and in-cluster Kubernetes collaborators
 */
public class SecretsProviderServerFactory {
    private static final Logger logger = LoggerFactory.getLogger(SecretsProviderServerFactory.class);

    /**
     * Create server using Provider Properties from the standard locations
     *
     * @return Secrets Provider Server
     */
    public SecretsProviderServer getServer() {
        return getServer(new ProviderPropertiesLoader().load());
    }

    /**
     * Create server using Provider Properties
     *
     * @param providerProperties Provider Properties
     * @return Secrets Provider Server
     */
    public SecretsProviderServer getServer(final ProviderProperties providerProperties) {
        final KubernetesClientProvider kubernetesClientProvider = new StandardKubernetesClientProvider();
        final MountAuthResolver authResolver = new MountAuthResolver(
                new KubernetesAuthConfigLookup(kubernetesClientProvider),
                new KubernetesServiceAccountTokenIssuer(kubernetesClientProvider, providerProperties)
        );
        final OciSecretBundleService secretBundleService = new OciSecretBundleService(new StandardSecretClientFactory(providerProperties));

        logger.info("Created OCI Vault Secrets Provider Server [{}] version [{}]", providerProperties.getRuntimeName(), providerProperties.getRuntimeVersion());
        return new StandardSecretsProviderServer(secretBundleService, authResolver, providerProperties);
    }
}
