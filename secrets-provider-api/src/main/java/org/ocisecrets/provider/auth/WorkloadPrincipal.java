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

import java.util.Arrays;
import java.util.Objects;

/**
 * Principal of a Kubernetes workload using a short-lived service account token
 *
 * @param serviceAccountToken Token issued for the pod, treated as opaque
 * @param podIdentity Identity of the pod the token was issued for
 */
public record WorkloadPrincipal(byte[] serviceAccountToken, PodIdentity podIdentity) implements AuthPrincipal {

    public WorkloadPrincipal {
        Objects.requireNonNull(serviceAccountToken, "Service account token required");
        serviceAccountToken = serviceAccountToken.clone();
    }

    @Override
    public byte[] serviceAccountToken() {
        return serviceAccountToken.clone();
    }

    @Override
    public PrincipalType getType() {
        return PrincipalType.WORKLOAD;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof WorkloadPrincipal principal)) {
            return false;
        }
        return Arrays.equals(serviceAccountToken, principal.serviceAccountToken) && Objects.equals(podIdentity, principal.podIdentity);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(serviceAccountToken) + Objects.hashCode(podIdentity);
    }

    @Override
    public String toString() {
        return String.format("WorkloadPrincipal[pod=%s]", podIdentity);
    }
}
