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
package org.ocisecrets.provider.kubernetes;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

/**
 * Standard implementation of Kubernetes Client Provider with default properties using in-cluster configuration
 */
public class StandardKubernetesClientProvider implements KubernetesClientProvider {
    private volatile KubernetesClient kubernetesClient;

    /**
     * Get Kubernetes Client with initialization on first request
     *
     * @return Kubernetes Client
     */
    @Override
    public KubernetesClient getKubernetesClient() {
        if (kubernetesClient == null) {
            synchronized (this) {
                if (kubernetesClient == null) {
                    kubernetesClient = new KubernetesClientBuilder().build();
                }
            }
        }
        return kubernetesClient;
    }
}
