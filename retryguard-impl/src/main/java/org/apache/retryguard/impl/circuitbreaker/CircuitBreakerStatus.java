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

import org.apache.retryguard.api.circuitbreaker.CircuitBreakerState;

/**
 * Immutable snapshot of the state and counters of a circuit breaker, they always change together.
 */
public final class CircuitBreakerStatus {
    static final CircuitBreakerStatus INITIAL = new CircuitBreakerStatus(CircuitBreakerState.CLOSED, 0, 0, true);

    private final CircuitBreakerState state;
    private final int failCount;
    private final int failedHalfOpenCount;
    private final boolean running;

    CircuitBreakerStatus(final CircuitBreakerState state, final int failCount,
                         final int failedHalfOpenCount, final boolean running) {
        this.state = state;
        this.failCount = failCount;
        this.failedHalfOpenCount = failedHalfOpenCount;
        this.running = running;
    }

    public CircuitBreakerState getState() {
        return state;
    }

    public int getFailCount() {
        return failCount;
    }

    public int getFailedHalfOpenCount() {
        return failedHalfOpenCount;
    }

    public boolean isRunning() {
        return running;
    }

    CircuitBreakerStatus withRunning(final boolean newRunning) {
        return newRunning == running ? this : new CircuitBreakerStatus(state, failCount, failedHalfOpenCount, newRunning);
    }

    CircuitBreakerStatus withFailCount(final int newFailCount) {
        return new CircuitBreakerStatus(state, newFailCount, failedHalfOpenCount, running);
    }

    @Override
    public String toString() {
        return "CircuitBreakerStatus{state=" + state + ", failCount=" + failCount
                + ", failedHalfOpenCount=" + failedHalfOpenCount + ", running=" + running + '}';
    }
}
