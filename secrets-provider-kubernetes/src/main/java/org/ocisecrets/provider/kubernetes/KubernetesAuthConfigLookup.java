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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.apache.commons.lang3.StringUtils;
import org.ocisecrets.provider.auth.AuthConfig;
import org.ocisecrets.provider.auth.AuthConfigLookup;
import org.ocisecrets.provider.auth.AuthResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

/**
 * Auth Configuration Lookup reading a Kubernetes Secret in the namespace of the requesting pod
 */
public class KubernetesAuthConfigLookup implements AuthConfigLookup {
    static final String CONFIG_KEY = "config";

    static final String PRIVATE_KEY_KEY = "private-key";

    private static final String AUTH_FIELD = "auth";

    private static final Logger logger = LoggerFactory.getLogger(KubernetesAuthConfigLookup.class);

    private final KubernetesClientProvider clientProvider;

    private final ObjectMapper objectMapper = new ObjectMapper(new YAMLFactory());

    public KubernetesAuthConfigLookup(final KubernetesClientProvider clientProvider) {
        this.clientProvider = Objects.requireNonNull(clientProvider, "Kubernetes Client Provider required");
    }

    @Override
    public AuthConfig getAuthConfig(final String namespace, final String secretName) {
        final Secret secret = getSecret(namespace, secretName);
        logger.info("Auth configuration Secret [{}] retrieved from Namespace [{}]", secretName, namespace);

        final Map<String, String> data = secret.getData();
        final byte[] config = getDecodedValue(data, CONFIG_KEY, secretName);
        if (config.length == 0) {
            throw new AuthResolutionException(String.format("Auth config data is empty in Secret [%s]", secretName));
        }

        final JsonNode auth = readAuth(config, secretName);

        final byte[] privateKey = getDecodedValue(data, PRIVATE_KEY_KEY, secretName);
        if (privateKey.length == 0) {
            throw new AuthResolutionException(String.format("Private key not found in Secret [%s]", secretName));
        }

        return new AuthConfig.Builder()
                .tenancyId(getText(auth, "tenancy"))
                .userId(getText(auth, "user"))
                .region(getText(auth, "region"))
                .fingerprint(getText(auth, "fingerprint"))
                .passphrase(getText(auth, "passphrase"))
                .privateKey(new String(privateKey, StandardCharsets.UTF_8))
                .build();
    }

    private Secret getSecret(final String namespace, final String secretName) {
        if (StringUtils.isBlank(secretName)) {
            throw new AuthResolutionException("Auth config Secret name not specified");
        }

        final Secret secret;
        try {
            secret = clientProvider.getKubernetesClient().secrets().inNamespace(namespace).withName(secretName).get();
        } catch (final KubernetesClientException e) {
            throw new AuthResolutionException(String.format("Error retrieving Secret [%s] from Namespace [%s]", secretName, namespace), e);
        }

        if (secret == null) {
            throw new AuthResolutionException(String.format("Secret [%s] not found in Namespace [%s]", secretName, namespace));
        }
        return secret;
    }

    private JsonNode readAuth(final byte[] config, final String secretName) {
        final JsonNode document;
        try {
            document = objectMapper.readTree(config);
        } catch (final IOException e) {
            throw new AuthResolutionException(String.format("Invalid auth config data in Secret [%s]", secretName), e);
        }

        final JsonNode auth = document == null ? null : document.get(AUTH_FIELD);
        if (auth == null || !auth.isObject()) {
            throw new AuthResolutionException(String.format("Invalid auth config data in Secret [%s]", secretName));
        }
        return auth;
    }

    private byte[] getDecodedValue(final Map<String, String> data, final String key, final String secretName) {
        final String encoded = data == null ? null : data.get(key);
        if (encoded == null) {
            return new byte[0];
        }
        try {
            return Base64.getDecoder().decode(encoded);
        } catch (final IllegalArgumentException e) {
            throw new AuthResolutionException(String.format("Secret [%s] key [%s] is not Base64 encoded", secretName, key), e);
        }
    }

    private String getText(final JsonNode auth, final String field) {
        final JsonNode node = auth.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
