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
package org.ocisecrets.provider.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Loads Provider Properties from a configured file, a classpath resource, or defaults
 */
public class ProviderPropertiesLoader {
    public static final String PROPERTIES_FILE_SYSTEM_PROPERTY = "secrets.provider.properties.file";

    static final String CLASSPATH_RESOURCE = "secrets-provider.properties";

    private static final Logger logger = LoggerFactory.getLogger(ProviderPropertiesLoader.class);

    /**
     * Load Provider Properties using the file named in the system property when set
     *
     * @return Provider Properties
     */
    public ProviderProperties load() {
        final String propertiesFile = System.getProperty(PROPERTIES_FILE_SYSTEM_PROPERTY);
        if (propertiesFile == null || propertiesFile.isEmpty()) {
            return loadClasspathResource();
        }
        return load(Paths.get(propertiesFile));
    }

    /**
     * Load Provider Properties from file
     *
     * @param propertiesPath Path to properties file
     * @return Provider Properties
     */
    public ProviderProperties load(final Path propertiesPath) {
        if (!Files.isReadable(propertiesPath)) {
            throw new IllegalArgumentException(String.format("Provider properties [%s] not readable", propertiesPath));
        }

        final Properties properties = new Properties();
        try (final InputStream inputStream = Files.newInputStream(propertiesPath)) {
            properties.load(inputStream);
        } catch (final IOException e) {
            throw new UncheckedIOException(String.format("Loading Provider Properties Failed [%s]", propertiesPath), e);
        }
        logger.info("Loaded Provider Properties [{}]", propertiesPath);
        return new ProviderProperties(properties);
    }

    private ProviderProperties loadClasspathResource() {
        final Properties properties = new Properties();
        try (final InputStream inputStream = ProviderPropertiesLoader.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (inputStream == null) {
                logger.debug("Provider Properties resource [{}] not found: using defaults", CLASSPATH_RESOURCE);
                return ProviderProperties.defaults();
            }
            properties.load(inputStream);
        } catch (final IOException e) {
            throw new UncheckedIOException(String.format("Loading Provider Properties Failed [%s]", CLASSPATH_RESOURCE), e);
        }
        return new ProviderProperties(properties);
    }
}
