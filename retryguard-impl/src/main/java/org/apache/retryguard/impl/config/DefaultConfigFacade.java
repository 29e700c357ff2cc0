/*
 *  Licensed to the Apache Software Foundation (ASF) under one
 *  or more contributor license agreements.  See the NOTICE file
 *  distributed with this work for additional information
 *  regarding copyright ownership.  The ASF licenses this file
 *  to you under the Apache License, Version 2.0 (the
 *  "License"); you may not use this file except in compliance
 *  with the License.  You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing,
 *  software distributed under the License is distributed on an
 *  "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 *  KIND, either express or implied.  See the License for the
 *  specific language governing permissions and limitations
 *  under the License.
 */

package org.apache.retryguard.impl.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

import org.apache.retryguard.api.config.ConfigFacade;
import org.apache.retryguard.api.exceptions.RetryDefinitionException;

/**
 * Reads environment variables, then system properties, then {@value #RESOURCE} from the context classloader.
 */
class DefaultConfigFacade extends ConfigFacade {
    static final String RESOURCE = "META-INF/retryguard/retry.properties";

    private final Map<String, String> defaults = new HashMap<>();

    DefaultConfigFacade() {
        this(RESOURCE);
    }

    DefaultConfigFacade(final String resource) {
        try (final InputStream stream = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
            if (stream != null) {
                final Properties properties = new Properties();
                properties.load(stream);
                properties.stringPropertyNames().forEach(k -> defaults.put(k, properties.getProperty(k)));
            }
        } catch (final IOException e) {
            throw new IllegalStateException("Can't read " + resource, e);
        }
    }

    @Override
    public boolean getBoolean(String name, boolean defaultValue) {
        return getOptionalValue(name).map(Boolean::parseBoolean).orElse(defaultValue);
    }

    @Override
    public long getLong(String name, long defaultValue) {
        return getOptionalValue(name).map(v -> parse(name, v, Long::parseLong)).orElse(defaultValue);
    }

    @Override
    public int getInt(String name, int defaultValue) {
        return getOptionalValue(name).map(v -> parse(name, v, Integer::parseInt)).orElse(defaultValue);
    }

    @Override
    public String getString(String name, String defaultValue) {
        return getOptionalValue(name).orElse(defaultValue);
    }

    @Override
    public ChronoUnit getChronoUnit(String name, ChronoUnit defaultValue) {
        return getOptionalValue(name)
                .map(v -> parse(name, v, it -> ChronoUnit.valueOf(it.toUpperCase(Locale.ROOT))))
                .orElse(defaultValue);
    }

    private static <T> T parse(final String name, final String value, final Function<String, T> parser) {
        try {
            return parser.apply(value.trim());
        } catch (final IllegalArgumentException e) {
            throw new RetryDefinitionException("Invalid value '" + value + "' for " + name, e);
        }
    }

    private Optional<String> getOptionalValue(final String name) {
        return Optional.ofNullable(Optional.ofNullable(System.getenv(name))
                .orElseGet(() -> System.getProperty(name, defaults.get(name))));
    }
}
