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
 * Requested secret batch failed validation before contacting the vault
 */
public class SecretRequestValidationException extends SecretsProviderException {

    public enum Reason {
        EMPTY_BATCH("Requested secrets not found"),

        DUPLICATE_NAME("Duplicated secret name [%s]"),

        DUPLICATE_ALIAS("Duplicated file name [%s]"),

        MISSING_NAME("Secret name not found for %s"),

        AMBIGUOUS_IDENTIFIER("Secret %s must be identified with either a version number or a stage");

        private final String messageFormat;

        Reason(final String messageFormat) {
            this.messageFormat = messageFormat;
        }
    }

    private final Reason reason;

    private final String subject;

    public SecretRequestValidationException(final Reason reason, final String subject) {
        super(String.format(reason.messageFormat, subject));
        this.reason = reason;
        this.subject = subject;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Get the secret name, file name or request description that failed validation
     *
     * @return Subject of the failure or null for an empty batch
     */
    public String getSubject() {
        return subject;
    }
}
