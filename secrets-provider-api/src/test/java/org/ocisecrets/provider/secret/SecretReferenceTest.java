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
package org.ocisecrets.provider.secret;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SecretReferenceTest {

    @Test
    void testEffectivePathName() {
        final SecretReference reference = new SecretReference.Builder().name(" foo ").build();

        assertEquals("foo", reference.getEffectivePath());
        assertFalse(reference.isAliased());
    }

    @Test
    void testEffectivePathAlias() {
        final SecretReference reference = new SecretReference.Builder().name("foo").fileAlias(" fooAlias ").build();

        assertEquals("fooAlias", reference.getEffectivePath());
        assertTrue(reference.isAliased());
    }

    @Test
    void testEffectivePathBlankAlias() {
        final SecretReference reference = new SecretReference.Builder().name("foo").fileAlias("  ").build();

        assertEquals("foo", reference.getEffectivePath());
        assertFalse(reference.isAliased());
    }

    @Test
    void testDefaultStageNone() {
        final SecretReference reference = new SecretReference.Builder().name("foo").build();

        assertEquals(Stage.NONE, reference.getStage());
        assertTrue(reference.getVersionNumber().isEmpty());
    }

    @Test
    void testVersionNumberNotPositive() {
        final SecretReference.Builder builder = new SecretReference.Builder().name("foo");

        assertThrows(IllegalArgumentException.class, () -> builder.versionNumber(0L));
        assertThrows(IllegalArgumentException.class, () -> builder.versionNumber(-1L));
    }

    @Test
    void testToString() {
        final SecretReference reference = new SecretReference.Builder().name("foo").versionNumber(2L).build();

        assertEquals("{name=foo, version=2, stage=}", reference.toString());
    }
}
