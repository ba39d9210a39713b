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

import org.ocisecrets.provider.SecretsProviderException;

/**
 * Secret bundle content could not be converted to plain text
 */
public class SecretDecodeException extends SecretsProviderException {

    public enum Reason {
        EMPTY_CONTENT,

        UNSUPPORTED_ENCODING,

        MALFORMED_ENCODING
    }

    private final Reason reason;

    public SecretDecodeException(final Reason reason, final String message) {
        super(message);
        this.reason = reason;
    }

    public SecretDecodeException(final Reason reason, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
