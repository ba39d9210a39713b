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
package org.ocisecrets.provider.mount.auth;

import org.apache.commons.lang3.StringUtils;
import org.ocisecrets.provider.auth.AuthConfig;
import org.ocisecrets.provider.auth.AuthConfigLookup;
import org.ocisecrets.provider.auth.AuthPrincipal;
import org.ocisecrets.provider.auth.AuthResolutionException;
import org.ocisecrets.provider.auth.InstancePrincipal;
import org.ocisecrets.provider.auth.PodIdentity;
import org.ocisecrets.provider.auth.PrincipalType;
import org.ocisecrets.provider.auth.ServiceAccountTokenIssuer;
import org.ocisecrets.provider.auth.UserPrincipal;
import org.ocisecrets.provider.auth.WorkloadPrincipal;
import org.ocisecrets.provider.mount.MountAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the principal for vault access from mount request attributes
 */
public class MountAuthResolver {
    private static final Logger logger = LoggerFactory.getLogger(MountAuthResolver.class);

    private final AuthConfigLookup authConfigLookup;

    private final ServiceAccountTokenIssuer tokenIssuer;

    public MountAuthResolver(final AuthConfigLookup authConfigLookup, final ServiceAccountTokenIssuer tokenIssuer) {
        this.authConfigLookup = Objects.requireNonNull(authConfigLookup, "Auth Config Lookup required");
        this.tokenIssuer = Objects.requireNonNull(tokenIssuer, "Token Issuer required");
    }

    /**
     * Resolve principal according to the authType attribute
     *
     * @param attributes Mount request attributes
     * @return Resolved principal
     * @throws AuthResolutionException when attributes are missing or the principal cannot be resolved
     */
    public AuthPrincipal resolve(final Map<String, String> attributes) {
        final String authType = getRequiredAttribute(attributes, MountAttribute.AUTH_TYPE);
        final PrincipalType principalType = PrincipalType.fromAuthType(authType);

        switch (principalType) {
            case USER:
                return resolveUser(attributes);
            case WORKLOAD:
                return resolveWorkload(attributes);
            case INSTANCE:
            default:
                return new InstancePrincipal();
        }
    }

    private UserPrincipal resolveUser(final Map<String, String> attributes) {
        final String secretName = getRequiredAttribute(attributes, MountAttribute.AUTH_SECRET_NAME);
        final String namespace = MountAttribute.POD_NAMESPACE.getValue(attributes);

        final AuthConfig config = authConfigLookup.getAuthConfig(namespace, secretName);
        config.validate();
        logger.debug("User principal configuration read from Secret [{}] Namespace [{}]", secretName, namespace);
        return new UserPrincipal(config);
    }

    private WorkloadPrincipal resolveWorkload(final Map<String, String> attributes) {
        final PodIdentity podIdentity = new PodIdentity(
                MountAttribute.POD_NAME.getValue(attributes),
                MountAttribute.POD_NAMESPACE.getValue(attributes),
                MountAttribute.POD_UID.getValue(attributes),
                MountAttribute.SERVICE_ACCOUNT_NAME.getValue(attributes)
        );

        final String token;
        try {
            token = tokenIssuer.issueToken(podIdentity);
        } catch (final AuthResolutionException e) {
            throw new AuthResolutionException(String.format("Cannot generate token for Service Account [%s] Namespace [%s]: %s",
                    podIdentity.serviceAccountName(), podIdentity.namespace(), e.getMessage()), e);
        }
        return new WorkloadPrincipal(token.getBytes(StandardCharsets.UTF_8), podIdentity);
    }

    private String getRequiredAttribute(final Map<String, String> attributes, final MountAttribute attribute) {
        final String value = attribute.getValue(attributes);
        if (StringUtils.isEmpty(value)) {
            throw new AuthResolutionException(String.format("Missed [%s] SecretProviderClass parameter", attribute.getKey()));
        }
        return value;
    }
}
