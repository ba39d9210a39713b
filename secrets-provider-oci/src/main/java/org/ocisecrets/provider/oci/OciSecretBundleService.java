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
package org.ocisecrets.provider.oci;

import com.oracle.bmc.auth.BasicAuthenticationDetailsProvider;
import com.oracle.bmc.model.BmcException;
import com.oracle.bmc.secrets.model.Base64SecretBundleContentDetails;
import com.oracle.bmc.secrets.model.SecretBundleContentDetails;
import com.oracle.bmc.secrets.requests.GetSecretBundleByNameRequest;
import com.oracle.bmc.secrets.responses.GetSecretBundleByNameResponse;
import org.ocisecrets.provider.auth.AuthPrincipal;
import org.ocisecrets.provider.secret.ContentEncoding;
import org.ocisecrets.provider.secret.SecretBundle;
import org.ocisecrets.provider.secret.SecretBundleContent;
import org.ocisecrets.provider.secret.SecretBundleService;
import org.ocisecrets.provider.secret.SecretReference;
import org.ocisecrets.provider.secret.SecretReferenceBatchValidator;
import org.ocisecrets.provider.secret.SecretRetrievalException;
import org.ocisecrets.provider.secret.Stage;
import org.ocisecrets.provider.secret.UnknownStageException;
import org.ocisecrets.provider.secret.UnsupportedContentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Secret Bundle Service retrieving bundles from OCI Vault one reference at a time
 */
public class OciSecretBundleService implements SecretBundleService {
    private static final Logger logger = LoggerFactory.getLogger(OciSecretBundleService.class);

    private static final int NOT_FOUND_STATUS = 404;

    private final SecretClientFactory clientFactory;

    private final SecretReferenceBatchValidator validator;

    private final Clock clock;

    public OciSecretBundleService(final SecretClientFactory clientFactory) {
        this(clientFactory, new SecretReferenceBatchValidator(), Clock.systemUTC());
    }

    public OciSecretBundleService(final SecretClientFactory clientFactory, final SecretReferenceBatchValidator validator, final Clock clock) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "Client Factory required");
        this.validator = Objects.requireNonNull(validator, "Validator required");
        this.clock = Objects.requireNonNull(clock, "Clock required");
    }

    @Override
    public List<SecretBundle> getSecretBundles(final List<SecretReference> references, final AuthPrincipal principal, final String vaultId, final Instant deadline) {
        validator.validate(references);
        Objects.requireNonNull(principal, "Principal required");
        Objects.requireNonNull(deadline, "Deadline required");

        final BasicAuthenticationDetailsProvider provider = clientFactory.createConfigProvider(principal);
        try (OciSecretClient client = clientFactory.createSecretClient(provider)) {
            final List<SecretBundle> bundles = new ArrayList<>(references.size());
            for (final SecretReference reference : references) {
                checkDeadline(deadline, String.format("before fetching secret bundle %s", reference));
                bundles.add(getSecretBundle(client, reference, vaultId));
            }
            checkDeadline(deadline, String.format("after fetching [%d] secret bundles", bundles.size()));
            logger.debug("Retrieved [{}] Secret Bundles from Vault [{}]", bundles.size(), vaultId);
            return bundles;
        }
    }

    private SecretBundle getSecretBundle(final OciSecretClient client, final SecretReference reference, final String vaultId) {
        final GetSecretBundleByNameRequest request = getRequest(reference, vaultId);

        final GetSecretBundleByNameResponse response;
        try {
            response = client.fetchByNameAndSelector(request);
        } catch (final BmcException e) {
            final boolean notFound = e.getStatusCode() == NOT_FOUND_STATUS;
            throw new SecretRetrievalException(String.format("Failed to fetch secret bundle %s: %s", reference, e.getMessage()), notFound, e);
        } catch (final RuntimeException e) {
            throw new SecretRetrievalException(String.format("Failed to fetch secret bundle %s", reference), false, e);
        }

        final com.oracle.bmc.secrets.model.SecretBundle remoteBundle = response.getSecretBundle();
        if (remoteBundle == null) {
            throw new SecretRetrievalException(String.format("Secret bundle %s not returned", reference), false);
        }
        logger.debug("Fetched Secret [{}] Version [{}]", reference.getName(), remoteBundle.getVersionNumber());

        final Long versionNumber = remoteBundle.getVersionNumber();
        return new SecretBundle.Builder()
                .id(remoteBundle.getSecretId())
                .name(reference.getName())
                .versionNumber(versionNumber == null ? 0 : versionNumber)
                .stages(getStages(remoteBundle.getStages()))
                .fileAlias(reference.getFileAlias().orElse(null))
                .content(getContent(reference, remoteBundle.getSecretBundleContent()))
                .build();
    }

    private GetSecretBundleByNameRequest getRequest(final SecretReference reference, final String vaultId) {
        final GetSecretBundleByNameRequest.Builder builder = GetSecretBundleByNameRequest.builder()
                .secretName(reference.getName())
                .vaultId(vaultId);

        if (reference.getVersionNumber().isPresent()) {
            builder.versionNumber(reference.getVersionNumber().get());
        } else {
            final Stage stage = validator.getEffectiveStage(reference);
            builder.stage(GetSecretBundleByNameRequest.Stage.create(stage.getValue()));
        }
        return builder.build();
    }

    private Set<Stage> getStages(final List<com.oracle.bmc.secrets.model.SecretBundle.Stages> remoteStages) {
        if (remoteStages == null || remoteStages.isEmpty()) {
            return Collections.emptySet();
        }

        final Set<Stage> stages = EnumSet.noneOf(Stage.class);
        for (final com.oracle.bmc.secrets.model.SecretBundle.Stages remoteStage : remoteStages) {
            final String value = remoteStage == null ? null : remoteStage.getValue();
            if (value == null || value.isEmpty()) {
                // SDK reports unrecognized stages without a value
                throw new UnknownStageException(String.valueOf(remoteStage));
            }
            stages.add(Stage.fromString(value));
        }
        return stages;
    }

    private SecretBundleContent getContent(final SecretReference reference, final SecretBundleContentDetails contentDetails) {
        if (contentDetails instanceof Base64SecretBundleContentDetails base64ContentDetails) {
            return new SecretBundleContent(ContentEncoding.BASE64, base64ContentDetails.getContent());
        }
        final String contentType = contentDetails == null ? null : contentDetails.getClass().getSimpleName();
        throw new UnsupportedContentException(String.format("Secret bundle %s content type [%s] not supported", reference, contentType));
    }

    private void checkDeadline(final Instant deadline, final String progress) {
        if (Thread.currentThread().isInterrupted()) {
            throw new SecretRetrievalException(String.format("Interrupted %s", progress), false);
        }
        if (clock.instant().isAfter(deadline)) {
            throw new SecretRetrievalException(String.format("Deadline [%s] exceeded %s", deadline, progress), false);
        }
    }
}
