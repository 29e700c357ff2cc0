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

import org.apache.retryguard.api.exceptions.RetryDefinitionException;
import org.apache.retryguard.api.retry.ExhaustionPolicy;
import org.apache.retryguard.api.retry.RetryDefinition;

public class RetryDefinitionImpl implements RetryDefinition {
    private final String name;
    private final int maxTries;
    private final Duration delay;
    private final int halfOpenThreshold;
    private final ExhaustionPolicy exhaustionPolicy;
    private final boolean circuitBreakerEnabled;

    public RetryDefinitionImpl(final String name, final int maxTries, final Duration delay, final int halfOpenThreshold,
                               final ExhaustionPolicy exhaustionPolicy, final boolean circuitBreakerEnabled) {
        if (delay == null || delay.isNegative()) {
            throw new RetryDefinitionException("delay can't be negative");
        }
        if (exhaustionPolicy == null) {
            throw new RetryDefinitionException("exhaustion policy can't be null");
        }
        this.name = name;
        this.maxTries = Math.max(maxTries, 1);
        this.delay = delay;
        this.halfOpenThreshold = halfOpenThreshold;
        this.exhaustionPolicy = exhaustionPolicy;
        this.circuitBreakerEnabled = circuitBreakerEnabled;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getMaxTries() {
        return maxTries;
    }

    @Override
    public Duration getDelay() {
        return delay;
    }

    @Override
    public int getHalfOpenThreshold() {
        return halfOpenThreshold;
    }

    @Override
    public ExhaustionPolicy getExhaustionPolicy() {
        return exhaustionPolicy;
    }

    @Override
    public boolean isCircuitBreakerEnabled() {
        return circuitBreakerEnabled;
    }

    @Override
    public String toString() {
        return "RetryDefinition{name='" + name + "', maxTries=" + maxTries + ", delay=" + delay
                + ", halfOpenThreshold=" + halfOpenThreshold + ", exhaustionPolicy=" + exhaustionPolicy
                + ", circuitBreakerEnabled=" + circuitBreakerEnabled + '}';
    }
}
