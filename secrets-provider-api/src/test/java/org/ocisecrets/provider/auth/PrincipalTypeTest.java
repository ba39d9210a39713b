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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PrincipalTypeTest {

    @Test
    void testFromAuthType() {
        assertEquals(PrincipalType.INSTANCE, PrincipalType.fromAuthType("instance"));
        assertEquals(PrincipalType.USER, PrincipalType.fromAuthType("user"));
        assertEquals(PrincipalType.WORKLOAD, PrincipalType.fromAuthType("workload"));
    }

    @Test
    void testFromAuthTypeUnknown() {
        assertThrows(UnknownPrincipalTypeException.class, () -> PrincipalType.fromAuthType("USER"));
        assertThrows(UnknownPrincipalTypeException.class, () -> PrincipalType.fromAuthType(null));
    }

    @Test
    void testWorkloadPrincipalTokenCopied() {
        final byte[] token = new byte[]{1, 2, 3};
        final WorkloadPrincipal principal = new WorkloadPrincipal(token, new PodIdentity("pod", "default", "uid", "account"));
        token[0] = 9;

        assertEquals(1, principal.serviceAccountToken()[0]);
        assertEquals(PrincipalType.WORKLOAD, principal.getType());
        assertNotEquals(principal, new WorkloadPrincipal(token, principal.podIdentity()));
    }
}
