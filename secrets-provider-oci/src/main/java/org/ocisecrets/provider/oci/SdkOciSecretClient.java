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

import com.oracle.bmc.secrets.Secrets;
import com.oracle.bmc.secrets.requests.GetSecretBundleByNameRequest;
import com.oracle.bmc.secrets.responses.GetSecretBundleByNameResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * OCI Secret Client delegating to the SDK Secrets client
 */
public class SdkOciSecretClient implements OciSecretClient {
    private static final Logger logger = LoggerFactory.getLogger(SdkOciSecretClient.class);

    private final Secrets secrets;

    public SdkOciSecretClient(final Secrets secrets) {
        this.secrets = Objects.requireNonNull(secrets, "Secrets client required");
    }

    @Override
    public GetSecretBundleByNameResponse fetchByNameAndSelector(final GetSecretBundleByNameRequest request) {
        return secrets.getSecretBundleByName(request);
    }

    @Override
    public void close() {
        try {
            secrets.close();
        } catch (final Exception e) {
            logger.warn("Secrets client close failed", e);
        }
    }
}
