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

package org.apache.retryguard.api.exceptions;

import java.time.Duration;

/**
 * Raised by a circuit breaker when it refuses to run an attempt because it is open.
 * The retry loops recover from it internally, it never reaches the caller of a retry.
 */
public class OpenCircuitException extends RetryGuardException {
    private final String circuitBreaker;
    private final Duration remainingDelay;
    private final boolean exhausted;

    public OpenCircuitException(String circuitBreaker, Duration remainingDelay, boolean exhausted) {
        super("Circuit breaker '" + circuitBreaker + "' is open" + (exhausted ? " and exhausted" : ""));
        this.circuitBreaker = circuitBreaker;
        this.remainingDelay = remainingDelay;
        this.exhausted = exhausted;
    }

    public String getCircuitBreaker() {
        return circuitBreaker;
    }

    /**
     * @return time left before the breaker probes again, {@link Duration#ZERO} when no probe is pending.
     */
    public Duration getRemainingDelay() {
        return remainingDelay;
    }

    /**
     * @return true when the breaker gave up permanently and only a reset can revive it.
     */
    public boolean isExhausted() {
        return exhausted;
    }
}
