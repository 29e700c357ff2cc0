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

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Function;

import org.apache.retryguard.api.circuitbreaker.CircuitBreaker;
import org.apache.retryguard.api.circuitbreaker.CircuitBreakerDefinition;
import org.apache.retryguard.api.circuitbreaker.CircuitBreakerState;
import org.apache.retryguard.api.exceptions.OpenCircuitException;
import org.apache.retryguard.impl.metrics.RetryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Circuit breaker counting consecutive failures.
 * <p>
 * Status changes are computed by {@link Transitions} and published under a single lock, the resulting effects
 * (logging, metrics, probe scheduling) run after the lock is released. The recovery probe is a
 * {@link ScheduledFuture} owned by the breaker, cancelled when the breaker closes or is {@link #close() disposed}.
 */
public class CircuitBreakerImpl implements CircuitBreaker, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(CircuitBreakerImpl.class);

    private final String name;
    private final CircuitBreakerDefinition definition;
    private final ScheduledExecutorService scheduler;
    private final RetryMetrics.Counter callsSucceeded;
    private final RetryMetrics.Counter callsFailed;
    private final RetryMetrics.Counter callsPrevented;
    private final RetryMetrics.Counter opened;

    private final Object lock = new Object();
    private CircuitBreakerStatus status = CircuitBreakerStatus.INITIAL;
    private Exception lastException;
    private long generation;
    private ScheduledFuture<?> probe;
    private long probeDeadline;
    private boolean disposed;

    public CircuitBreakerImpl(final String name, final CircuitBreakerDefinition definition,
                              final ScheduledExecutorService scheduler, final RetryMetrics metrics) {
        this.name = name;
        this.definition = definition;
        this.scheduler = scheduler;

        final String base = name + ".circuitbreaker";
        this.callsSucceeded = metrics.counter(RetryMetrics.name(base, "callsSucceeded.total"),
                "Number of calls allowed to run by the circuit breaker that returned successfully");
        this.callsFailed = metrics.counter(RetryMetrics.name(base, "callsFailed.total"),
                "Number of calls allowed to run by the circuit breaker that then failed");
        this.callsPrevented = metrics.counter(RetryMetrics.name(base, "callsPrevented.total"),
                "Number of calls prevented from running by an open circuit breaker");
        this.opened = metrics.counter(RetryMetrics.name(base, "opened.total"),
                "Number of times the circuit breaker has moved to open state");
    }

    @Override
    public <T> T attempt(final Callable<T> operation) throws Exception {
        final CircuitBreakerStatus admission = getStatus();
        if (admission.getState() == CircuitBreakerState.OPEN) {
            callsPrevented.inc();
            throw new OpenCircuitException(name, getRemainingDelay(), isExhausted());
        }

        final T result;
        try {
            result = operation.call();
        } catch (final Exception e) {
            callsFailed.inc();
            apply(current -> Transitions.failure(current, definition), e);
            throw e;
        }
        callsSucceeded.inc();
        apply(Transitions::success, null);
        return result;
    }

    /**
     * Prepares the breaker for a new retry sequence.
     *
     * @return false if the breaker is exhausted and will refuse every attempt until reset.
     */
    public boolean resume() {
        return apply(current -> Transitions.resume(current, definition), null).getStatus().isRunning();
    }

    @Override
    public void reset() {
        apply(Transitions::reset, null);
    }

    /**
     * Cancels the pending probe, an open breaker stays open afterwards.
     */
    @Override
    public void close() {
        synchronized (lock) {
            disposed = true;
            cancelProbe();
        }
    }

    private Transition apply(final Function<CircuitBreakerStatus, Transition> event, final Exception failure) {
        final Transition transition;
        final long currentGeneration;
        synchronized (lock) {
            if (failure != null) {
                lastException = failure;
            }
            transition = event.apply(status);
            status = transition.getStatus();
            if (transition.isStateChange()) {
                generation++;
            }
            currentGeneration = generation;
        }
        perform(transition, currentGeneration);
        return transition;
    }

    private void perform(final Transition transition, final long transitionGeneration) {
        final CircuitBreakerStatus next = transition.getStatus();
        if (transition.has(Transition.Effect.OPENED)) {
            opened.inc();
            LOGGER.warn("Circuit breaker '{}' opened after {} failure(s), last one: {}",
                    name, next.getFailCount(), String.valueOf(getLastException()));
        }
        if (transition.has(Transition.Effect.EXHAUSTED)) {
            LOGGER.warn("Circuit breaker '{}' gave up after {} failed probe(s), it stays open until reset",
                    name, next.getFailedHalfOpenCount());
        }
        if (transition.has(Transition.Effect.HALF_OPENED)) {
            LOGGER.info("Circuit breaker '{}' is half open, next attempt probes the operation", name);
        }
        if (transition.has(Transition.Effect.CLOSED)) {
            LOGGER.info("Circuit breaker '{}' closed", name);
        }
        if (transition.has(Transition.Effect.CANCEL_PROBE)) {
            synchronized (lock) {
                cancelProbe();
            }
        }
        if (transition.has(Transition.Effect.SCHEDULE_PROBE)) {
            scheduleProbe(transitionGeneration);
        }
    }

    private void scheduleProbe(final long probeGeneration) {
        final long delay = definition.getDelay().toNanos();
        synchronized (lock) {
            if (disposed || probeGeneration != generation) {
                return;
            }
            cancelProbe();
            probeDeadline = System.nanoTime() + delay;
            probe = scheduler.schedule(() -> onProbeElapsed(probeGeneration), delay, NANOSECONDS);
        }
        LOGGER.debug("Circuit breaker '{}' probes again in {}ms", name, definition.getDelay().toMillis());
    }

    private void onProbeElapsed(final long probeGeneration) {
        final Transition transition;
        final long currentGeneration;
        synchronized (lock) {
            if (disposed || probeGeneration != generation) {
                return;
            }
            transition = Transitions.probeElapsed(status);
            status = transition.getStatus();
            if (transition.isStateChange()) {
                generation++;
            }
            currentGeneration = generation;
        }
        perform(transition, currentGeneration);
    }

    // guarded by lock
    private void cancelProbe() {
        if (probe != null) {
            probe.cancel(false);
            probe = null;
        }
    }

    /**
     * @return time left before the pending probe runs, zero if none is pending.
     */
    public Duration getRemainingDelay() {
        synchronized (lock) {
            if (probe == null || probe.isDone()) {
                return Duration.ZERO;
            }
            return Duration.ofNanos(Math.max(0, probeDeadline - System.nanoTime()));
        }
    }

    public CircuitBreakerStatus getStatus() {
        synchronized (lock) {
            return status;
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CircuitBreakerDefinition getDefinition() {
        return definition;
    }

    @Override
    public CircuitBreakerState getState() {
        return getStatus().getState();
    }

    @Override
    public boolean isRunning() {
        return getStatus().isRunning();
    }

    @Override
    public boolean isExhausted() {
        return Transitions.isExhausted(getStatus(), definition);
    }

    @Override
    public int getFailCount() {
        return getStatus().getFailCount();
    }

    @Override
    public int getFailedHalfOpenCount() {
        return getStatus().getFailedHalfOpenCount();
    }

    @Override
    public Exception getLastException() {
        synchronized (lock) {
            return lastException;
        }
    }

    @Override
    public String toString() {
        return "CircuitBreakerImpl{name='" + name + "', " + getStatus() + '}';
    }
}
