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
package org.ocisecrets.provider.mount.secret;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.apache.commons.lang3.StringUtils;
import org.ocisecrets.provider.secret.SecretReference;
import org.ocisecrets.provider.secret.SecretSpecException;
import org.ocisecrets.provider.secret.Stage;
import org.ocisecrets.provider.secret.UnknownStageException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Strict parser for the YAML list of declared secrets rejecting unknown fields, stages and versions
 */
public class SecretReferenceParser {
    private static final TypeReference<List<SecretReferenceDefinition>> DEFINITIONS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = YAMLMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .build();

    /**
     * Parse declared secrets
     *
     * @param secrets YAML list of secret entries
     * @return Secret References in declared order, empty when the list is empty
     * @throws SecretSpecException when the content is missing or cannot be decoded strictly
     */
    public List<SecretReference> parse(final String secrets) {
        if (StringUtils.isEmpty(secrets)) {
            throw new SecretSpecException("Secrets content not found");
        }

        final List<SecretReferenceDefinition> definitions;
        try {
            definitions = objectMapper.readValue(secrets, DEFINITIONS_TYPE);
        } catch (final JsonProcessingException e) {
            throw new SecretSpecException(String.format("Failed to decode secrets: %s", e.getOriginalMessage()), e);
        }

        if (definitions == null) {
            return Collections.emptyList();
        }

        final List<SecretReference> references = new ArrayList<>(definitions.size());
        for (int i = 0; i < definitions.size(); i++) {
            final SecretReferenceDefinition definition = definitions.get(i);
            if (definition == null) {
                throw new SecretSpecException(String.format("Secret entry [%d] is empty", i));
            }
            references.add(getReference(definition));
        }
        return references;
    }

    private SecretReference getReference(final SecretReferenceDefinition definition) {
        final Stage stage;
        try {
            stage = Stage.fromString(definition.getStage());
        } catch (final UnknownStageException e) {
            throw new SecretSpecException(String.format("Secret [%s] stage invalid: %s", definition.getName(), e.getMessage()), e);
        }

        return new SecretReference.Builder()
                .name(definition.getName())
                .stage(stage)
                .versionNumber(getVersionNumber(definition))
                .fileAlias(definition.getFileName())
                .build();
    }

    private Long getVersionNumber(final SecretReferenceDefinition definition) {
        final String versionNumber = definition.getVersionNumber();
        if (StringUtils.isEmpty(versionNumber)) {
            return null;
        }

        final long parsed;
        try {
            parsed = Long.parseLong(versionNumber);
        } catch (final NumberFormatException e) {
            throw new SecretSpecException(String.format("Secret [%s] version number [%s] is not a number", definition.getName(), versionNumber), e);
        }
        if (parsed <= 0) {
            throw new SecretSpecException(String.format("Secret [%s] version number [%s] must be positive", definition.getName(), versionNumber));
        }
        return parsed;
    }
}
