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

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Encoded content of a secret bundle as returned from the vault
 *
 * @param encoding Content encoding
 * @param content Encoded content
 */
public record SecretBundleContent(ContentEncoding encoding, String content) {

    /**
     * Decode content to plain text
     *
     * @return Decoded content using UTF-8
     * @throws SecretDecodeException when content is empty, the encoding is not supported or the content is malformed
     */
    public String decode() {
        if (content == null || content.isEmpty()) {
            throw new SecretDecodeException(SecretDecodeException.Reason.EMPTY_CONTENT, "Secret content not found");
        }
        if (encoding != ContentEncoding.BASE64) {
            throw new SecretDecodeException(SecretDecodeException.Reason.UNSUPPORTED_ENCODING,
                    String.format("Secret content encoding [%s] not supported", encoding));
        }

        try {
            final byte[] decoded = Base64.getDecoder().decode(content);
            return new String(decoded, StandardCharsets.UTF_8);
        } catch (final IllegalArgumentException e) {
            throw new SecretDecodeException(SecretDecodeException.Reason.MALFORMED_ENCODING, "Secret content is not valid Base64", e);
        }
    }

    @Override
    public String toString() {
        return String.format("SecretBundleContent[encoding=%s]", encoding);
    }
}
