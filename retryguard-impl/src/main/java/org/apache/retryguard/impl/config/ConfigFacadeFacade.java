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

import java.time.temporal.ChronoUnit;

import javax.annotation.Priority;

import org.apache.retryguard.api.config.ConfigFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registered {@link ConfigFacade}: MicroProfile Config when an implementation is deployed, plain properties otherwise.
 */
@Priority(1)
public class ConfigFacadeFacade extends ConfigFacade {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigFacadeFacade.class);

    private final ConfigFacade delegate = loadDelegate();

    private ConfigFacade loadDelegate() {
        final ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try {
            final Class<?> loadClass = loader.loadClass("org.eclipse.microprofile.config.ConfigProvider");
            loadClass.getMethod("getConfig").invoke(null);
            return new MicroProfileConfigFacade();
        } catch (final Exception | LinkageError notHere) {
            LOGGER.debug("No MicroProfile Config available ({}), using system properties", notHere.toString());
            return new DefaultConfigFacade();
        }
    }

    ConfigFacade getDelegate() {
        return delegate;
    }

    @Override
    public boolean getBoolean(final String name, final boolean defaultValue) {
        return delegate.getBoolean(name, defaultValue);
    }

    @Override
    public long getLong(final String name, final long defaultValue) {
        return delegate.getLong(name, defaultValue);
    }

    @Override
    public int getInt(final String name, final int defaultValue) {
        return delegate.getInt(name, defaultValue);
    }

    @Override
    public String getString(final String name, final String defaultValue) {
        return delegate.getString(name, defaultValue);
    }

    @Override
    public ChronoUnit getChronoUnit(final String name, final ChronoUnit defaultValue) {
        return delegate.getChronoUnit(name, defaultValue);
    }
}
