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
package org.ocisecrets.provider.kubernetes;

import io.fabric8.kubernetes.api.model.authentication.TokenRequest;
import io.fabric8.kubernetes.api.model.authentication.TokenRequestBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.apache.commons.lang3.StringUtils;
import org.ocisecrets.provider.auth.AuthResolutionException;
import org.ocisecrets.provider.auth.PodIdentity;
import org.ocisecrets.provider.auth.ServiceAccountTokenIssuer;
import org.ocisecrets.provider.config.ProviderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Objects;

/**
 * Service Account Token Issuer using the TokenRequest API with tokens bound to the requesting pod
 */
public class KubernetesServiceAccountTokenIssuer implements ServiceAccountTokenIssuer {
    private static final String POD_KIND = "Pod";

    private static final String POD_API_VERSION = "v1";

    private static final Logger logger = LoggerFactory.getLogger(KubernetesServiceAccountTokenIssuer.class);

    private final KubernetesClientProvider clientProvider;

    private final ProviderProperties providerProperties;

    public KubernetesServiceAccountTokenIssuer(final KubernetesClientProvider clientProvider, final ProviderProperties providerProperties) {
        this.clientProvider = Objects.requireNonNull(clientProvider, "Kubernetes Client Provider required");
        this.providerProperties = Objects.requireNonNull(providerProperties, "Provider Properties required");
    }

    @Override
    public String issueToken(final PodIdentity podIdentity) {
        Objects.requireNonNull(podIdentity, "Pod Identity required");

        final TokenRequest tokenRequest = new TokenRequestBuilder()
                .withNewSpec()
                    .withExpirationSeconds(providerProperties.getWorkloadTokenTtl().getSeconds())
                    .withAudiences(Collections.emptyList())
                    .withNewBoundObjectRef()
                        .withKind(POD_KIND)
                        .withApiVersion(POD_API_VERSION)
                        .withName(podIdentity.name())
                        .withUid(podIdentity.uid())
                    .endBoundObjectRef()
                .endSpec()
                .build();

        final TokenRequest issued;
        try {
            issued = clientProvider.getKubernetesClient()
                    .serviceAccounts()
                    .inNamespace(podIdentity.namespace())
                    .withName(podIdentity.serviceAccountName())
                    .tokenRequest(tokenRequest);
        } catch (final KubernetesClientException e) {
            throw new AuthResolutionException(String.format("Token request failed for Service Account [%s] in Namespace [%s]",
                    podIdentity.serviceAccountName(), podIdentity.namespace()), e);
        }

        final String token = issued == null || issued.getStatus() == null ? null : issued.getStatus().getToken();
        if (StringUtils.isEmpty(token)) {
            throw new AuthResolutionException(String.format("Token not returned for Service Account [%s] in Namespace [%s]",
                    podIdentity.serviceAccountName(), podIdentity.namespace()));
        }
        logger.debug("Token issued for Service Account [{}] bound to Pod [{}]", podIdentity.serviceAccountName(), podIdentity.name());
        return token;
    }
}
