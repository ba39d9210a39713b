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

import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates a batch of Secret References before any vault access
 */
public class SecretReferenceBatchValidator {

    /**
     * Validate batch and fail on the first violation in request order
     *
     * @param references Secret References
     * @throws SecretRequestValidationException on empty batch, duplicate paths, missing names or ambiguous identifiers
     */
    public void validate(final List<SecretReference> references) {
        if (references == null || references.isEmpty()) {
            throw new SecretRequestValidationException(SecretRequestValidationException.Reason.EMPTY_BATCH, null);
        }

        checkPathDuplication(references);

        for (final SecretReference reference : references) {
            if (StringUtils.isBlank(reference.getName())) {
                throw new SecretRequestValidationException(SecretRequestValidationException.Reason.MISSING_NAME, reference.toString());
            }
            if (reference.getVersionNumber().isPresent() && reference.getStage() != Stage.NONE) {
                throw new SecretRequestValidationException(SecretRequestValidationException.Reason.AMBIGUOUS_IDENTIFIER, reference.toString());
            }
        }
    }

    /**
     * Get Stage to request from the vault
     *
     * @param reference Secret Reference
     * @return Requested Stage, {@link Stage#CURRENT} when neither stage nor version is set, {@link Stage#NONE} when a version is set
     */
    public Stage getEffectiveStage(final SecretReference reference) {
        if (reference.getStage() == Stage.NONE && reference.getVersionNumber().isEmpty()) {
            return Stage.CURRENT;
        }
        return reference.getStage();
    }

    private void checkPathDuplication(final List<SecretReference> references) {
        final Map<String, SecretReference> referencesByPath = new HashMap<>();
        for (final SecretReference reference : references) {
            final String path = reference.getEffectivePath();
            if (path.isEmpty()) {
                // reported as a missing name
                continue;
            }

            final SecretReference previous = referencesByPath.putIfAbsent(path, reference);
            if (previous != null) {
                if (isNameDerived(previous, path) && isNameDerived(reference, path)) {
                    throw new SecretRequestValidationException(SecretRequestValidationException.Reason.DUPLICATE_NAME, path);
                }
                throw new SecretRequestValidationException(SecretRequestValidationException.Reason.DUPLICATE_ALIAS, path);
            }
        }
    }

    private boolean isNameDerived(final SecretReference reference, final String path) {
        return !reference.isAliased() || path.equals(StringUtils.trim(reference.getName()));
    }
}
