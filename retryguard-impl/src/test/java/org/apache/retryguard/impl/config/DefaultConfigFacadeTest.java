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

import org.apache.retryguard.api.exceptions.RetryDefinitionException;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.Test;

import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DefaultConfigFacadeTest {
    private final DefaultConfigFacade config = new DefaultConfigFacade();

    @AfterMethod
    public void clearProperties() {
        System.clearProperty("retryguard.test.maxTries");
        System.clearProperty("retryguard.configured.maxTries");
    }

    @Test
    public void shouldReadClasspathDefaults() {
        assertThat(config.getInt("retryguard.configured.maxTries", 1)).isEqualTo(3);
        assertThat(config.getLong("retryguard.configured.delay", 0)).isEqualTo(20);
        assertThat(config.getChronoUnit("retryguard.configured.delayUnit", ChronoUnit.SECONDS))
                .isEqualTo(ChronoUnit.MILLIS);
        assertThat(config.getString("retryguard.strict.exhaustionPolicy", null)).isEqualTo("FAIL");
        assertThat(config.getBoolean("retryguard.configured.circuitBreaker", true)).isFalse();
    }

    @Test
    public void shouldPreferSystemProperties() {
        System.setProperty("retryguard.configured.maxTries", "8");

        assertThat(config.getInt("retryguard.configured.maxTries", 1)).isEqualTo(8);
    }

    @Test
    public void shouldFallBackToDefault() {
        assertThat(config.getInt("retryguard.test.maxTries", 5)).isEqualTo(5);
        assertThat(config.getString("retryguard.test.missing", "none")).isEqualTo("none");
    }

    @Test
    public void shouldRejectInvalidNumbers() {
        System.setProperty("retryguard.test.maxTries", "many");

        assertThatThrownBy(() -> config.getInt("retryguard.test.maxTries", 1))
                .isInstanceOf(RetryDefinitionException.class)
                .hasMessageContaining("retryguard.test.maxTries");
    }

    @Test
    public void shouldIgnoreMissingResource() {
        DefaultConfigFacade empty = new DefaultConfigFacade("META-INF/retryguard/missing.properties");

        assertThat(empty.getInt("retryguard.configured.maxTries", 1)).isEqualTo(1);
    }

    @Test
    public void shouldUsePropertiesWithoutMicroProfileConfig() {
        assertThat(new ConfigFacadeFacade().getDelegate()).isInstanceOf(DefaultConfigFacade.class);
    }
}
