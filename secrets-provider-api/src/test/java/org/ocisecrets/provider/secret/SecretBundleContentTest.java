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
import static org.junit.jupiter.api.Assertions.assertThrows;

class SecretBundleContentTest {

    @Test
    void testDecode() {
        final SecretBundleContent content = new SecretBundleContent(ContentEncoding.BASE64, "YmFyMQ==");

        assertEquals("bar1", content.decode());
    }

    @Test
    void testDecodeEmptyContent() {
        final SecretBundleContent content = new SecretBundleContent(ContentEncoding.BASE64, "");

        final SecretDecodeException exception = assertThrows(SecretDecodeException.class, content::decode);
        assertEquals(SecretDecodeException.Reason.EMPTY_CONTENT, exception.getReason());
    }

    @Test
    void testDecodeEmptyContentUnknownEncoding() {
        final SecretBundleContent content = new SecretBundleContent(null, null);

        final SecretDecodeException exception = assertThrows(SecretDecodeException.class, content::decode);
        assertEquals(SecretDecodeException.Reason.EMPTY_CONTENT, exception.getReason());
    }

    @Test
    void testDecodeUnsupportedEncoding() {
        final SecretBundleContent content = new SecretBundleContent(null, "YmFyMQ==");

        final SecretDecodeException exception = assertThrows(SecretDecodeException.class, content::decode);
        assertEquals(SecretDecodeException.Reason.UNSUPPORTED_ENCODING, exception.getReason());
    }

    @Test
    void testDecodeMalformed() {
        final SecretBundleContent content = new SecretBundleContent(ContentEncoding.BASE64, "not base64!");

        final SecretDecodeException exception = assertThrows(SecretDecodeException.class, content::decode);
        assertEquals(SecretDecodeException.Reason.MALFORMED_ENCODING, exception.getReason());
    }
}
