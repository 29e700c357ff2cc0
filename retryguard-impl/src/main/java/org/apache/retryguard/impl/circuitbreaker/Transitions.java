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

import static org.apache.retryguard.api.circuitbreaker.CircuitBreakerState.CLOSED;
import static org.apache.retryguard.api.circuitbreaker.CircuitBreakerState.HALF_OPEN;
import static org.apache.retryguard.api.circuitbreaker.CircuitBreakerState.OPEN;
import static org.apache.retryguard.impl.circuitbreaker.Transition.Effect;

import org.apache.retryguard.api.circuitbreaker.CircuitBreakerDefinition;

/**
 * Circuit breaker state machine. Pure functions, the caller publishes the status and runs the effects.
 */
public final class Transitions {
    private Transitions() {
        // no-op
    }

    public static Transition failure(final CircuitBreakerStatus current, final CircuitBreakerDefinition definition) {
        final int failCount = current.getFailCount() + 1;
        switch (current.getState()) {
            case CLOSED:
                if (failCount > definition.getThreshold()) {
                    return open(current, failCount, current.getFailedHalfOpenCount(), definition);
                }
                return new Transition(current, current.withFailCount(failCount));
            case HALF_OPEN: // a probe gets a single chance
                return open(current, failCount, current.getFailedHalfOpenCount() + 1, definition);
            case OPEN: // admitted before a concurrent trip
                return new Transition(current, current.withFailCount(failCount));
            default:
                throw new IllegalArgumentException("unknown state " + current.getState());
        }
    }

    public static Transition success(final CircuitBreakerStatus current) {
        if (current.getState() == OPEN) { // admitted before a concurrent trip, the pending probe decides
            return new Transition(current, current.withRunning(false));
        }
        final Transition closing = close(current);
        return new Transition(current, closing.getStatus().withRunning(false),
                closing.getEffects().toArray(new Effect[0]));
    }

    public static Transition probeElapsed(final CircuitBreakerStatus current) {
        if (current.getState() != OPEN) {
            return new Transition(current, current);
        }
        return new Transition(current, new CircuitBreakerStatus(HALF_OPEN, current.getFailCount(),
                current.getFailedHalfOpenCount(), current.isRunning()), Effect.HALF_OPENED);
    }

    public static Transition reset(final CircuitBreakerStatus current) {
        return close(current);
    }

    /**
     * Re-arms a breaker for a new retry sequence, an exhausted breaker stays stopped.
     */
    public static Transition resume(final CircuitBreakerStatus current, final CircuitBreakerDefinition definition) {
        if (isExhausted(current, definition)) {
            return new Transition(current, current);
        }
        return new Transition(current, current.withRunning(true));
    }

    public static boolean isExhausted(final CircuitBreakerStatus current, final CircuitBreakerDefinition definition) {
        return current.getState() == OPEN && !canProbe(definition.getHalfOpenThreshold(), current.getFailedHalfOpenCount());
    }

    static boolean canProbe(final int halfOpenThreshold, final int failedHalfOpenCount) {
        return (halfOpenThreshold > 0 && failedHalfOpenCount < halfOpenThreshold) || halfOpenThreshold < 0;
    }

    private static Transition open(final CircuitBreakerStatus current, final int failCount,
                                   final int failedHalfOpenCount, final CircuitBreakerDefinition definition) {
        if (canProbe(definition.getHalfOpenThreshold(), failedHalfOpenCount)) {
            return new Transition(current,
                    new CircuitBreakerStatus(OPEN, failCount, failedHalfOpenCount, current.isRunning()),
                    Effect.OPENED, Effect.SCHEDULE_PROBE);
        }
        return new Transition(current,
                new CircuitBreakerStatus(OPEN, failCount, failedHalfOpenCount, false),
                Effect.OPENED, Effect.EXHAUSTED);
    }

    private static Transition close(final CircuitBreakerStatus current) {
        final CircuitBreakerStatus closed = new CircuitBreakerStatus(CLOSED, 0, 0, true);
        if (current.getState() == CLOSED) {
            return new Transition(current, closed);
        }
        return new Transition(current, closed, Effect.CLOSED, Effect.CANCEL_PROBE);
    }
}
