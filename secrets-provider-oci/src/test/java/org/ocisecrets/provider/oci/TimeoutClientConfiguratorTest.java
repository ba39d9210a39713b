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

import com.oracle.bmc.http.client.HttpClientBuilder;
import com.oracle.bmc.http.client.StandardClientProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TimeoutClientConfiguratorTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(20);

    @Mock
    private HttpClientBuilder httpClientBuilder;

    @Test
    void testCustomizeClient() {
        new TimeoutClientConfigurator(TIMEOUT).customizeClient(httpClientBuilder);

        verify(httpClientBuilder).property(StandardClientProperties.CONNECT_TIMEOUT, TIMEOUT);
        verify(httpClientBuilder).property(StandardClientProperties.READ_TIMEOUT, TIMEOUT);
    }
}
