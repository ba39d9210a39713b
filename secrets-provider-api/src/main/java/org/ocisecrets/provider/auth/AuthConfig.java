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
package org.ocisecrets.provider.auth;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Configuration of an OCI user principal
 */
public final class AuthConfig {
    private final String tenancyId;
    private final String userId;
    private final String region;
    private final String fingerprint;
    private final String privateKey;
    private final String passphrase;

    private AuthConfig(final Builder builder) {
        this.tenancyId = builder.tenancyId;
        this.userId = builder.userId;
        this.region = builder.region;
        this.fingerprint = builder.fingerprint;
        this.privateKey = builder.privateKey;
        this.passphrase = builder.passphrase;
    }

    public String getTenancyId() {
        return tenancyId;
    }

    public String getUserId() {
        return userId;
    }

    public String getRegion() {
        return region;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public Optional<String> getPassphrase() {
        return StringUtils.isEmpty(passphrase) ? Optional.empty() : Optional.of(passphrase);
    }

    /**
     * Validate required fields and report every missing field together
     *
     * @throws AuthConfigValidationException when one or more required fields are missing
     */
    public void validate() {
        final List<String> violations = new ArrayList<>();
        if (StringUtils.isEmpty(tenancyId)) {
            violations.add("Tenancy is required for user principal");
        }
        if (StringUtils.isEmpty(region)) {
            violations.add("Region is required for user principal");
        }
        if (StringUtils.isEmpty(fingerprint)) {
            violations.add("Fingerprint is required for user principal");
        }
        if (StringUtils.isEmpty(userId)) {
            violations.add("UserID is required for user principal");
        }
        if (StringUtils.isEmpty(privateKey)) {
            violations.add("PrivateKey is required for user principal");
        }

        if (!violations.isEmpty()) {
            throw new AuthConfigValidationException(violations);
        }
    }

    @Override
    public String toString() {
        return String.format("AuthConfig[tenancy=%s, user=%s, region=%s, fingerprint=%s]", tenancyId, userId, region, fingerprint);
    }

    public static class Builder {
        private String tenancyId;
        private String userId;
        private String region;
        private String fingerprint;
        private String privateKey;
        private String passphrase;

        public Builder tenancyId(final String tenancyId) {
            this.tenancyId = tenancyId;
            return this;
        }

        public Builder userId(final String userId) {
            this.userId = userId;
            return this;
        }

        public Builder region(final String region) {
            this.region = region;
            return this;
        }

        public Builder fingerprint(final String fingerprint) {
            this.fingerprint = fingerprint;
            return this;
        }

        public Builder privateKey(final String privateKey) {
            this.privateKey = privateKey;
            return this;
        }

        public Builder passphrase(final String passphrase) {
            this.passphrase = passphrase;
            return this;
        }

        public AuthConfig build() {
            return new AuthConfig(this);
        }
    }
}
