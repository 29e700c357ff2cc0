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

package org.apache.retryguard.impl.retry;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

import org.apache.retryguard.api.config.ConfigFacade;
import org.apache.retryguard.api.exceptions.RetryDefinitionException;
import org.apache.retryguard.api.retry.ExhaustionPolicy;
import org.apache.retryguard.api.retry.RetryBuilder;

/**
 * Starts from the configured values, {@code retryguard.<name>.<key>} then {@code retryguard.retry.<key>}.
 * A max tries lower than one is raised to one.
 */
public class RetryBuilderImpl implements RetryBuilder {
    private final String name;
    private final RetryManagerImpl retryManager;
    private int maxTries;
    private Duration delay;
    private int halfOpenThreshold;
    private ExhaustionPolicy exhaustionPolicy;
    private boolean circuitBreaker;

    RetryBuilderImpl(String name, RetryManagerImpl retryManager) {
        this.name = name;
        this.retryManager = retryManager;

        final ConfigFacade config = ConfigFacade.getInstance();
        this.maxTries = config.getInt(key(name, "maxTries"), config.getInt("retryguard.retry.maxTries", 1));
        this.delay = Duration.of(
                config.getLong(key(name, "delay"), config.getLong("retryguard.retry.delay", 0)),
                config.getChronoUnit(key(name, "delayUnit"),
                        config.getChronoUnit("retryguard.retry.delayUnit", ChronoUnit.MILLIS)));
        this.halfOpenThreshold = config.getInt(key(name, "halfOpenThreshold"),
                config.getInt("retryguard.retry.halfOpenThreshold", 0));
        this.circuitBreaker = config.getBoolean(key(name, "circuitBreaker"),
                config.getBoolean("retryguard.retry.circuitBreaker", true));
        final String policy = config.getString(key(name, "exhaustionPolicy"),
                config.getString("retryguard.retry.exhaustionPolicy", ExhaustionPolicy.RETURN_LAST_RESULT.name()));
        try {
            this.exhaustionPolicy = ExhaustionPolicy.valueOf(policy.trim());
        } catch (final IllegalArgumentException e) {
            throw new RetryDefinitionException("Unknown exhaustion policy '" + policy + "' for retry '" + name + "'", e);
        }
    }

    private static String key(String name, String key) {
        return "retryguard." + name + "." + key;
    }

    @Override
    public RetryBuilderImpl withMaxTries(int maxTries) {
        this.maxTries = maxTries;
        return this;
    }

    @Override
    public RetryBuilderImpl withDelay(Duration delay) {
        this.delay = delay;
        return this;
    }

    @Override
    public RetryBuilderImpl withHalfOpenThreshold(int halfOpenThreshold) {
        this.halfOpenThreshold = halfOpenThreshold;
        return this;
    }

    @Override
    public RetryBuilderImpl withExhaustionPolicy(ExhaustionPolicy exhaustionPolicy) {
        this.exhaustionPolicy = exhaustionPolicy;
        return this;
    }

    @Override
    public RetryBuilderImpl withCircuitBreaker(boolean enabled) {
        this.circuitBreaker = enabled;
        return this;
    }

    @Override
    public RetryDefinitionImpl build() {
        RetryDefinitionImpl definition = new RetryDefinitionImpl(name, maxTries, delay, halfOpenThreshold,
                exhaustionPolicy, circuitBreaker);
        retryManager.register(name, definition);
        return definition;
    }
}
