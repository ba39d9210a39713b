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
import com.oracle.bmc.secrets.requests.GetSecretBundleByNameRequest;
import com.oracle.bmc.secrets.responses.GetSecretBundleByNameResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.ocisecrets.provider.auth.AuthPrincipal;
import org.ocisecrets.provider.auth.AuthResolutionException;
import org.ocisecrets.provider.auth.InstancePrincipal;
import org.ocisecrets.provider.secret.SecretBundle;
import org.ocisecrets.provider.secret.SecretReference;
import org.ocisecrets.provider.secret.SecretReferenceBatchValidator;
import org.ocisecrets.provider.secret.SecretRequestValidationException;
import org.ocisecrets.provider.secret.SecretRetrievalException;
import org.ocisecrets.provider.secret.Stage;
import org.ocisecrets.provider.secret.UnknownStageException;
import org.ocisecrets.provider.secret.UnsupportedContentException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OciSecretBundleServiceTest {
    private static final String VAULT_ID = "ocid1.vault.oc1..vault";

    private static final String SECRET_ID = "ocid1.vaultsecret.oc1..secret";

    private static final String ENCODED_CONTENT = "YmFyMQ==";

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private static final AuthPrincipal PRINCIPAL = new InstancePrincipal();

    @Mock
    private SecretClientFactory clientFactory;

    @Mock
    private BasicAuthenticationDetailsProvider authenticationProvider;

    @Mock
    private OciSecretClient secretClient;

    @Captor
    private ArgumentCaptor<GetSecretBundleByNameRequest> requestCaptor;

    private OciSecretBundleService service;

    @BeforeEach
    void setService() {
        service = new OciSecretBundleService(clientFactory, new SecretReferenceBatchValidator(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testGetSecretBundlesVersionNumber() {
        setClient();
        when(secretClient.fetchByNameAndSelector(any())).thenReturn(getResponse(2L, com.oracle.bmc.secrets.model.SecretBundle.Stages.Current));

        final List<SecretBundle> bundles = service.getSecretBundles(List.of(reference("foo").versionNumber(2L).build()), PRINCIPAL, VAULT_ID);

        assertEquals(1, bundles.size());
        final SecretBundle bundle = bundles.get(0);
        assertEquals(SECRET_ID, bundle.getId());
        assertEquals("foo", bundle.getEffectivePath());
        assertEquals(2L, bundle.getVersionNumber());
        assertEquals(Set.of(Stage.CURRENT), bundle.getStages());
        assertEquals("bar1", bundle.getContent().decode());

        verify(secretClient).fetchByNameAndSelector(requestCaptor.capture());
        final GetSecretBundleByNameRequest request = requestCaptor.getValue();
        assertEquals("foo", request.getSecretName());
        assertEquals(VAULT_ID, request.getVaultId());
        assertEquals(Long.valueOf(2), request.getVersionNumber());
        assertNull(request.getStage());
        verify(secretClient).close();
    }

    @Test
    void testGetSecretBundlesAliasOrder() {
        setClient();
        when(secretClient.fetchByNameAndSelector(any())).thenReturn(getResponse(1L, com.oracle.bmc.secrets.model.SecretBundle.Stages.Current));

        final List<SecretReference> references = List.of(
                reference("foo").fileAlias("fooAlias").build(),
                reference("hello").build()
        );
        final List<SecretBundle> bundles = service.getSecretBundles(references, PRINCIPAL, VAULT_ID);

        assertEquals(2, bundles.size());
        assertEquals("fooAlias", bundles.get(0).getEffectivePath());
        assertEquals("hello", bundles.get(1).getEffectivePath());

        verify(secretClient, times(2)).fetchByNameAndSelector(requestCaptor.capture());
        assertEquals("foo", requestCaptor.getAllValues().get(0).getSecretName());
        assertEquals("hello", requestCaptor.getAllValues().get(1).getSecretName());
    }

    @Test
    void testGetSecretBundlesDefaultStageCurrent() {
        setClient();
        when(secretClient.fetchByNameAndSelector(any())).thenReturn(getResponse(3L, com.oracle.bmc.secrets.model.SecretBundle.Stages.Current));

        service.getSecretBundles(List.of(reference("foo").build()), PRINCIPAL, VAULT_ID);
        service.getSecretBundles(List.of(reference("foo").stage(Stage.CURRENT).build()), PRINCIPAL, VAULT_ID);

        verify(secretClient, times(2)).fetchByNameAndSelector(requestCaptor.capture());
        final GetSecretBundleByNameRequest defaultRequest = requestCaptor.getAllValues().get(0);
        final GetSecretBundleByNameRequest currentRequest = requestCaptor.getAllValues().get(1);
        assertEquals(GetSecretBundleByNameRequest.Stage.Current, defaultRequest.getStage());
        assertEquals(currentRequest.getStage(), defaultRequest.getStage());
        assertNull(defaultRequest.getVersionNumber());
    }

    @Test
    void testGetSecretBundlesValidationNoClientCalls() {
        final List<SecretReference> references = List.of(reference("foo").stage(Stage.CURRENT).versionNumber(1L).build());

        final SecretRequestValidationException exception = assertThrows(SecretRequestValidationException.class,
                () -> service.getSecretBundles(references, PRINCIPAL, VAULT_ID));

        assertEquals(SecretRequestValidationException.Reason.AMBIGUOUS_IDENTIFIER, exception.getReason());
        verifyNoInteractions(clientFactory);
    }

    @Test
    void testGetSecretBundlesEmptyNoClientCalls() {
        final SecretRequestValidationException exception = assertThrows(SecretRequestValidationException.class,
                () -> service.getSecretBundles(Collections.emptyList(), PRINCIPAL, VAULT_ID));

        assertEquals(SecretRequestValidationException.Reason.EMPTY_BATCH, exception.getReason());
        verifyNoInteractions(clientFactory);
    }

    @Test
    void testGetSecretBundlesAuthenticationFailed() {
        when(clientFactory.createConfigProvider(PRINCIPAL)).thenThrow(new AuthResolutionException("Instance metadata not available"));

        assertThrows(AuthResolutionException.class, () -> service.getSecretBundles(List.of(reference("foo").build()), PRINCIPAL, VAULT_ID));
        verify(clientFactory, never()).createSecretClient(any());
    }

    @Test
    void testGetSecretBundlesNotFoundFailsBatch() {
        setClient();
        final BmcException notFound = mock(BmcException.class);
        when(notFound.getStatusCode()).thenReturn(404);
        when(secretClient.fetchByNameAndSelector(any()))
                .thenReturn(getResponse(1L, com.oracle.bmc.secrets.model.SecretBundle.Stages.Current))
                .thenThrow(notFound);

        final List<SecretReference> references = List.of(reference("foo").build(), reference("missing").build());
        final SecretRetrievalException exception = assertThrows(SecretRetrievalException.class,
                () -> service.getSecretBundles(references, PRINCIPAL, VAULT_ID));

        assertTrue(exception.isNotFound());
        verify(secretClient).close();
    }

    @Test
    void testGetSecretBundlesRemoteFailure() {
        setClient();
        final BmcException unavailable = mock(BmcException.class);
        when(unavailable.getStatusCode()).thenReturn(503);
        when(secretClient.fetchByNameAndSelector(any())).thenThrow(unavailable);

        final SecretRetrievalException exception = assertThrows(SecretRetrievalException.class,
                () -> service.getSecretBundles(List.of(reference("foo").build()), PRINCIPAL, VAULT_ID));

        assertFalse(exception.isNotFound());
    }

    @Test
    void testGetSecretBundlesUnknownStage() {
        setClient();
        when(secretClient.fetchByNameAndSelector(any())).thenReturn(getResponse(1L, com.oracle.bmc.secrets.model.SecretBundle.Stages.UnknownEnumValue));

        assertThrows(UnknownStageException.class, () -> service.getSecretBundles(List.of(reference("foo").build()), PRINCIPAL, VAULT_ID));
        verify(secretClient).close();
    }

    @Test
    void testGetSecretBundlesUnsupportedContent() {
        setClient();
        final com.oracle.bmc.secrets.model.SecretBundle remoteBundle = com.oracle.bmc.secrets.model.SecretBundle.builder()
                .secretId(SECRET_ID)
                .versionNumber(1L)
                .stages(List.of(com.oracle.bmc.secrets.model.SecretBundle.Stages.Current))
                .build();
        when(secretClient.fetchByNameAndSelector(any())).thenReturn(GetSecretBundleByNameResponse.builder().secretBundle(remoteBundle).build());

        assertThrows(UnsupportedContentException.class, () -> service.getSecretBundles(List.of(reference("foo").build()), PRINCIPAL, VAULT_ID));
    }

    @Test
    void testGetSecretBundlesDeadlineExceeded() {
        setClient();

        final Instant deadline = NOW.minusSeconds(1);
        assertThrows(SecretRetrievalException.class, () -> service.getSecretBundles(List.of(reference("foo").build()), PRINCIPAL, VAULT_ID, deadline));
        verify(secretClient, never()).fetchByNameAndSelector(any());
        verify(secretClient).close();
    }

    @Test
    void testGetSecretBundlesDeadlineExceededDuringFetch() {
        final Clock advancingClock = mock(Clock.class);
        when(advancingClock.instant()).thenReturn(NOW, NOW.plusSeconds(10));
        final OciSecretBundleService advancingService = new OciSecretBundleService(clientFactory, new SecretReferenceBatchValidator(), advancingClock);
        setClient();
        when(secretClient.fetchByNameAndSelector(any())).thenReturn(getResponse(1L, com.oracle.bmc.secrets.model.SecretBundle.Stages.Current));

        final Instant deadline = NOW.plusSeconds(5);
        final SecretRetrievalException exception = assertThrows(SecretRetrievalException.class,
                () -> advancingService.getSecretBundles(List.of(reference("foo").build()), PRINCIPAL, VAULT_ID, deadline));

        assertFalse(exception.isNotFound());
        verify(secretClient, times(1)).fetchByNameAndSelector(any());
        verify(secretClient).close();
    }

    private void setClient() {
        when(clientFactory.createConfigProvider(PRINCIPAL)).thenReturn(authenticationProvider);
        when(clientFactory.createSecretClient(authenticationProvider)).thenReturn(secretClient);
    }

    private static GetSecretBundleByNameResponse getResponse(final long versionNumber, final com.oracle.bmc.secrets.model.SecretBundle.Stages stage) {
        final com.oracle.bmc.secrets.model.SecretBundle remoteBundle = com.oracle.bmc.secrets.model.SecretBundle.builder()
                .secretId(SECRET_ID)
                .versionNumber(versionNumber)
                .stages(List.of(stage))
                .secretBundleContent(Base64SecretBundleContentDetails.builder().content(ENCODED_CONTENT).build())
                .build();
        return GetSecretBundleByNameResponse.builder().secretBundle(remoteBundle).build();
    }

    private static SecretReference.Builder reference(final String name) {
        return new SecretReference.Builder().name(name);
    }
}
