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

import com.oracle.bmc.ClientConfiguration;
import com.oracle.bmc.Region;
import com.oracle.bmc.auth.BasicAuthenticationDetailsProvider;
import com.oracle.bmc.auth.InstancePrincipalsAuthenticationDetailsProvider;
import com.oracle.bmc.auth.SimpleAuthenticationDetailsProvider;
import com.oracle.bmc.auth.StringPrivateKeySupplier;
import com.oracle.bmc.auth.okeworkloadidentity.OkeWorkloadIdentityAuthenticationDetailsProvider;
import com.oracle.bmc.auth.SuppliedServiceAccountTokenProvider;
import com.oracle.bmc.secrets.SecretsClient;
import org.ocisecrets.provider.auth.AuthConfig;
import org.ocisecrets.provider.auth.AuthPrincipal;
import org.ocisecrets.provider.auth.AuthResolutionException;
import org.ocisecrets.provider.auth.UserPrincipal;
import org.ocisecrets.provider.auth.WorkloadPrincipal;
import org.ocisecrets.provider.config.ProviderProperties;
import org.ocisecrets.provider.secret.SecretRetrievalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Standard Secret Client Factory creating SDK providers for each principal type without fallback
 */
public class StandardSecretClientFactory implements SecretClientFactory {
    private static final Logger logger = LoggerFactory.getLogger(StandardSecretClientFactory.class);

    private final Duration timeout;

    private final ClientConfiguration clientConfiguration;

    /**
     * Standard Secret Client Factory with timeouts read once from Provider Properties
     *
     * @param providerProperties Provider Properties
     * @throws IllegalArgumentException when the configured vault client timeout is invalid
     */
    public StandardSecretClientFactory(final ProviderProperties providerProperties) {
        Objects.requireNonNull(providerProperties, "Provider Properties required");
        this.timeout = providerProperties.getVaultClientTimeout();

        final int timeoutMillis;
        try {
            timeoutMillis = Math.toIntExact(timeout.toMillis());
        } catch (final ArithmeticException e) {
            throw new IllegalArgumentException(String.format("Vault client timeout [%s] exceeds maximum supported", timeout), e);
        }
        this.clientConfiguration = ClientConfiguration.builder()
                .connectionTimeoutMillis(timeoutMillis)
                .readTimeoutMillis(timeoutMillis)
                .build();
    }

    @Override
    public BasicAuthenticationDetailsProvider createConfigProvider(final AuthPrincipal principal) {
        Objects.requireNonNull(principal, "Principal required");
        logger.debug("OCI Authentication Principal Type [{}]", principal.getType());

        try {
            switch (principal.getType()) {
                case INSTANCE:
                    return createInstanceProvider();
                case USER:
                    return createUserProvider(((UserPrincipal) principal).config());
                case WORKLOAD:
                    return createWorkloadProvider((WorkloadPrincipal) principal);
                default:
                    throw new AuthResolutionException(String.format("OCI principal type [%s] not supported", principal.getType()));
            }
        } catch (final AuthResolutionException e) {
            throw e;
        } catch (final RuntimeException e) {
            throw new AuthResolutionException(String.format("OCI Authentication Provider Builder Failed for principal type [%s]", principal.getType()), e);
        }
    }

    @Override
    public OciSecretClient createSecretClient(final BasicAuthenticationDetailsProvider provider) {
        try {
            return new SdkOciSecretClient(createSecretsClient(provider, clientConfiguration));
        } catch (final RuntimeException e) {
            throw new SecretRetrievalException("OCI Secrets Client Builder Failed", false, e);
        }
    }

    ClientConfiguration getClientConfiguration() {
        return clientConfiguration;
    }

    protected SecretsClient createSecretsClient(final BasicAuthenticationDetailsProvider provider, final ClientConfiguration configuration) {
        return SecretsClient.builder()
                .configuration(configuration)
                .build(provider);
    }

    private InstancePrincipalsAuthenticationDetailsProvider createInstanceProvider() {
        final InstancePrincipalsAuthenticationDetailsProvider.InstancePrincipalsAuthenticationDetailsProviderBuilder builder = InstancePrincipalsAuthenticationDetailsProvider.builder();
        builder.timeoutForEachRetry(Math.toIntExact(timeout.getSeconds()));
        builder.additionalFederationClientConfigurator(new TimeoutClientConfigurator(timeout));
        return builder.build();
    }

    private SimpleAuthenticationDetailsProvider createUserProvider(final AuthConfig config) {
        final SimpleAuthenticationDetailsProvider.SimpleAuthenticationDetailsProviderBuilder builder = SimpleAuthenticationDetailsProvider.builder()
                .tenantId(config.getTenancyId())
                .userId(config.getUserId())
                .fingerprint(config.getFingerprint())
                .region(Region.fromRegionId(config.getRegion()))
                .privateKeySupplier(new StringPrivateKeySupplier(config.getPrivateKey()));
        config.getPassphrase().ifPresent(builder::passPhrase);
        return builder.build();
    }

    private BasicAuthenticationDetailsProvider createWorkloadProvider(final WorkloadPrincipal principal) {
        final String token = new String(principal.serviceAccountToken(), StandardCharsets.UTF_8);
        return OkeWorkloadIdentityAuthenticationDetailsProvider.builder()
                .tokenPath(new SuppliedServiceAccountTokenProvider(token))
                .build();
    }
}
