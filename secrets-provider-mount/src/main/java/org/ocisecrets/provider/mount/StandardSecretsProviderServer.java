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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.ocisecrets.provider.SecretsProviderException;
import org.ocisecrets.provider.auth.AuthPrincipal;
import org.ocisecrets.provider.config.ProviderProperties;
import org.ocisecrets.provider.mount.auth.MountAuthResolver;
import org.ocisecrets.provider.mount.secret.SecretReferenceParser;
import org.ocisecrets.provider.secret.SecretBundle;
import org.ocisecrets.provider.secret.SecretBundleService;
import org.ocisecrets.provider.secret.SecretDecodeException;
import org.ocisecrets.provider.secret.SecretReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Standard Secrets Provider Server handling mount requests with all-or-nothing semantics
 */
public class StandardSecretsProviderServer implements SecretsProviderServer {
    static final String API_VERSION = "v1alpha1";

    private static final TypeReference<Map<String, String>> ATTRIBUTES_TYPE = new TypeReference<>() {
    };

    private static final Logger logger = LoggerFactory.getLogger(StandardSecretsProviderServer.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final SecretReferenceParser secretReferenceParser = new SecretReferenceParser();

    private final SecretBundleService secretBundleService;

    private final MountAuthResolver authResolver;

    private final ProviderProperties providerProperties;

    public StandardSecretsProviderServer(final SecretBundleService secretBundleService, final MountAuthResolver authResolver, final ProviderProperties providerProperties) {
        this.secretBundleService = Objects.requireNonNull(secretBundleService, "Secret Bundle Service required");
        this.authResolver = Objects.requireNonNull(authResolver, "Auth Resolver required");
        this.providerProperties = Objects.requireNonNull(providerProperties, "Provider Properties required");
    }

    @Override
    public MountResponse mount(final MountRequest request) {
        Objects.requireNonNull(request, "Mount Request required");

        final Map<String, String> attributes = getAttributes(request.attributes());
        final List<SecretReference> references = getReferences(attributes);

        final String podName = MountAttribute.POD_NAME.getValue(attributes);
        final String secretProviderClass = MountAttribute.SECRET_PROVIDER_CLASS.getValue(attributes);
        final String vaultId = MountAttribute.VAULT_ID.getValue(attributes);

        final AuthPrincipal principal;
        try {
            principal = authResolver.resolve(attributes);
        } catch (final SecretsProviderException e) {
            logger.error("Unable to handle SecretProviderClass [{}] auth parameters for Pod [{}]", secretProviderClass, podName, e);
            throw new MountException(MountStatus.UNKNOWN, e.getMessage(), e);
        }

        final int permission = getPermission(request.permission());

        final Instant deadline = request.deadline() == null ? Instant.MAX : request.deadline();
        final List<SecretBundle> bundles;
        try {
            bundles = secretBundleService.getSecretBundles(references, principal, vaultId, deadline);
        } catch (final SecretsProviderException e) {
            logger.info("Unable to retrieve all secrets for Pod [{}] SecretProviderClass [{}]: {}", podName, secretProviderClass, e.getMessage());
            throw new MountException(MountStatus.NOT_FOUND, String.format("Unable to retrieve secrets: %s", e.getMessage()), e);
        }
        logger.info("Found requested secrets for Pod [{}] SecretProviderClass [{}]", podName, secretProviderClass);

        return getResponse(bundles, permission);
    }

    @Override
    public VersionResponse version() {
        return new VersionResponse(API_VERSION, providerProperties.getRuntimeName(), providerProperties.getRuntimeVersion());
    }

    private Map<String, String> getAttributes(final String attributes) {
        try {
            final Map<String, String> parsed = objectMapper.readValue(Objects.requireNonNullElse(attributes, ""), ATTRIBUTES_TYPE);
            return parsed == null ? Collections.emptyMap() : parsed;
        } catch (final JsonProcessingException e) {
            logger.info("Failed to read mount request attributes: {}", e.getOriginalMessage());
            throw new MountException(MountStatus.INVALID_ARGUMENT,
                    "Failed to unmarshal SecretProviderClass parameters or attributes provided by driver", e);
        }
    }

    private List<SecretReference> getReferences(final Map<String, String> attributes) {
        try {
            return secretReferenceParser.parse(MountAttribute.SECRETS.getValue(attributes));
        } catch (final SecretsProviderException e) {
            logger.info("Failed to read SecretProviderClass [{}] parameter: {}", MountAttribute.SECRETS.getKey(), e.getMessage());
            throw new MountException(MountStatus.INVALID_ARGUMENT,
                    String.format("Unable to handle SecretProviderClass secrets: %s", e.getMessage()), e);
        }
    }

    private int getPermission(final String permission) {
        final JsonNode node;
        try {
            node = objectMapper.readTree(Objects.requireNonNullElse(permission, ""));
        } catch (final JsonProcessingException e) {
            throw new MountException(MountStatus.INTERNAL, String.format("Failed to unmarshal file permission [%s]", permission), e);
        }

        if (node == null || !node.isIntegralNumber() || !node.canConvertToInt() || node.intValue() < 0) {
            throw new MountException(MountStatus.INTERNAL, String.format("Failed to unmarshal file permission [%s]", permission));
        }
        return node.intValue();
    }

    private MountResponse getResponse(final List<SecretBundle> bundles, final int permission) {
        final List<MountedFile> files = new ArrayList<>(bundles.size());
        final List<ObjectVersion> objectVersions = new ArrayList<>(bundles.size());

        for (final SecretBundle bundle : bundles) {
            final String content;
            try {
                content = bundle.getContent().decode();
            } catch (final SecretDecodeException e) {
                throw new MountException(MountStatus.INTERNAL, String.format("Secret [%s] content decoding failed: %s", bundle.getName(), e.getMessage()), e);
            }

            files.add(new MountedFile(bundle.getEffectivePath(), content.getBytes(StandardCharsets.UTF_8), permission));
            objectVersions.add(new ObjectVersion(bundle.getId(), Long.toString(bundle.getVersionNumber())));
        }
        return new MountResponse(files, objectVersions);
    }
}
