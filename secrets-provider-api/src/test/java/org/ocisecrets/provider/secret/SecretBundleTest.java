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

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SecretBundleTest {

    @Test
    void testEffectivePath() {
        final SecretBundle bundle = new SecretBundle.Builder()
                .id("ocid1.vaultsecret.oc1..foo")
                .name("foo")
                .fileAlias("fooAlias")
                .versionNumber(3)
                .stages(Set.of(Stage.CURRENT, Stage.LATEST))
                .content(new SecretBundleContent(ContentEncoding.BASE64, "YmFyMQ=="))
                .build();

        assertEquals("fooAlias", bundle.getEffectivePath());
        assertEquals(Set.of(Stage.CURRENT, Stage.LATEST), bundle.getStages());
    }

    @Test
    void testStagesUnmodifiable() {
        final SecretBundle bundle = new SecretBundle.Builder()
                .id("id")
                .name("foo")
                .stages(Set.of(Stage.CURRENT))
                .content(new SecretBundleContent(ContentEncoding.BASE64, "YmFyMQ=="))
                .build();

        assertThrows(UnsupportedOperationException.class, () -> bundle.getStages().add(Stage.PREVIOUS));
    }

    @Test
    void testIdRequired() {
        final SecretBundle.Builder builder = new SecretBundle.Builder()
                .name("foo")
                .content(new SecretBundleContent(ContentEncoding.BASE64, "YmFyMQ=="));

        assertThrows(NullPointerException.class, builder::build);
    }
}
