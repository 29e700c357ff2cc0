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

package org.apache.retryguard.impl.circuitbreaker;

import java.time.Duration;

import org.apache.retryguard.api.circuitbreaker.CircuitBreakerDefinition;
import org.apache.retryguard.api.exceptions.RetryDefinitionException;

public class CircuitBreakerDefinitionImpl implements CircuitBreakerDefinition {
    private final int threshold;
    private final Duration delay;
    private final int halfOpenThreshold;

    public CircuitBreakerDefinitionImpl(final int threshold, final Duration delay, final int halfOpenThreshold) {
        if (threshold < 1) {
            throw new RetryDefinitionException("CircuitBreaker threshold can't be < 1");
        }
        if (delay == null || delay.isNegative()) {
            throw new RetryDefinitionException("CircuitBreaker delay can't be < 0");
        }
        this.threshold = threshold;
        this.delay = delay;
        this.halfOpenThreshold = halfOpenThreshold;
    }

    @Override
    public int getThreshold() {
        return threshold;
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
    public String toString() {
        return "CircuitBreakerDefinition{threshold=" + threshold + ", delay=" + delay
                + ", halfOpenThreshold=" + halfOpenThreshold + '}';
    }
}
