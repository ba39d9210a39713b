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

import com.oracle.bmc.http.ClientConfigurator;
import com.oracle.bmc.http.client.HttpClientBuilder;
import com.oracle.bmc.http.client.StandardClientProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * Client Configurator applying connect and read timeouts to federation and metadata clients
 */
class TimeoutClientConfigurator implements ClientConfigurator {
    private final Duration timeout;

    TimeoutClientConfigurator(final Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "Timeout required");
    }

    @Override
    public void customizeClient(final HttpClientBuilder builder) {
        builder.property(StandardClientProperties.CONNECT_TIMEOUT, timeout);
        builder.property(StandardClientProperties.READ_TIMEOUT, timeout);
    }
}
