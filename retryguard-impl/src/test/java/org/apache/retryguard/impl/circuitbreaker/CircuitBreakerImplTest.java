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
import org.apache.retryguard.api.exceptions.OpenCircuitException;
import org.apache.retryguard.impl.metrics.RecordingMetrics;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CircuitBreakerImplTest {
    private ScheduledExecutorService scheduler;

    @BeforeClass
    public void setupForTest() {
        scheduler = Executors.newScheduledThreadPool(2);
    }

    @AfterClass
    public void shutdown() {
        scheduler.shutdownNow();
    }

    private CircuitBreakerImpl breaker(String name, int threshold, long delayMs, int halfOpenThreshold,
                                       RecordingMetrics metrics) {
        return new CircuitBreakerImpl(name, new CircuitBreakerDefinitionImpl(threshold, Duration.ofMillis(delayMs),
                halfOpenThreshold), scheduler, metrics);
    }

    private static void fail(CircuitBreakerImpl breaker, RuntimeException failure) {
        assertThatThrownBy(() -> breaker.attempt(() -> {
            throw failure;
        })).isSameAs(failure);
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not reached in time");
            }
            Thread.sleep(5);
        }
    }

    @Test
    public void shouldTripAfterThresholdIsExceeded() {
        RecordingMetrics metrics = new RecordingMetrics();
        try (CircuitBreakerImpl breaker = breaker("trip", 2, 10_000, 1, metrics)) {
            fail(breaker, new IllegalStateException("1"));
            fail(breaker, new IllegalStateException("2"));
            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);

            IllegalStateException last = new IllegalStateException("3");
            fail(breaker, last);

            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
            assertThat(breaker.getFailCount()).isEqualTo(3);
            assertThat(breaker.getLastException()).isSameAs(last);
            assertThat(breaker.isRunning()).isTrue();
            assertThat(metrics.get("retryguard.trip.circuitbreaker.callsFailed.total")).isEqualTo(3);
            assertThat(metrics.get("retryguard.trip.circuitbreaker.opened.total")).isEqualTo(1);
        }
    }

    @Test
    public void shouldRejectWithoutInvokingWhenOpen() {
        RecordingMetrics metrics = new RecordingMetrics();
        try (CircuitBreakerImpl breaker = breaker("rejecting", 1, 10_000, 1, metrics)) {
            fail(breaker, new IllegalStateException());
            fail(breaker, new IllegalStateException());
            AtomicInteger invocations = new AtomicInteger();

            assertThatThrownBy(() -> breaker.attempt(invocations::incrementAndGet))
                    .isInstanceOfSatisfying(OpenCircuitException.class, oce -> {
                        assertThat(oce.getCircuitBreaker()).isEqualTo("rejecting");
                        assertThat(oce.getRemainingDelay()).isPositive();
                        assertThat(oce.isExhausted()).isFalse();
                    });
            assertThat(invocations).hasValue(0);
            assertThat(metrics.get("retryguard.rejecting.circuitbreaker.callsPrevented.total")).isEqualTo(1);
        }
    }

    @Test
    public void shouldStopForGoodWithoutProbes() {
        try (CircuitBreakerImpl breaker = breaker("exhausted", 1, 0, 0, new RecordingMetrics())) {
            fail(breaker, new IllegalStateException());
            fail(breaker, new IllegalStateException());

            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
            assertThat(breaker.isRunning()).isFalse();
            assertThat(breaker.isExhausted()).isTrue();
            assertThat(breaker.resume()).isFalse();
            assertThat(breaker.getRemainingDelay()).isZero();
        }
    }

    @Test
    public void shouldHalfOpenAfterDelayAndCloseOnSuccessfulProbe() throws Exception {
        try (CircuitBreakerImpl breaker = breaker("recovering", 1, 20, 1, new RecordingMetrics())) {
            fail(breaker, new IllegalStateException());
            fail(breaker, new IllegalStateException());
            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);

            await(() -> breaker.getState() == CircuitBreakerState.HALF_OPEN);
            assertThat(breaker.attempt(() -> "ok")).isEqualTo("ok");

            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
            assertThat(breaker.getFailCount()).isZero();
            assertThat(breaker.getFailedHalfOpenCount()).isZero();
            assertThat(breaker.isRunning()).isFalse();
        }
    }

    @Test
    public void shouldGiveUpAfterHalfOpenThresholdFailedProbes() throws Exception {
        try (CircuitBreakerImpl breaker = breaker("probing", 1, 10, 2, new RecordingMetrics())) {
            fail(breaker, new IllegalStateException());
            fail(breaker, new IllegalStateException());

            for (int probe = 1; probe <= 2; probe++) {
                await(() -> breaker.getState() == CircuitBreakerState.HALF_OPEN);
                fail(breaker, new IllegalStateException("probe " + probe));
                assertThat(breaker.getFailedHalfOpenCount()).isEqualTo(probe);
            }

            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
            assertThat(breaker.isRunning()).isFalse();
            assertThat(breaker.isExhausted()).isTrue();
            Thread.sleep(50);
            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        }
    }

    @Test
    public void shouldProbeForeverWithNegativeHalfOpenThreshold() throws Exception {
        try (CircuitBreakerImpl breaker = breaker("forever", 1, 5, -1, new RecordingMetrics())) {
            fail(breaker, new IllegalStateException());
            fail(breaker, new IllegalStateException());

            for (int probe = 0; probe < 5; probe++) {
                await(() -> breaker.getState() == CircuitBreakerState.HALF_OPEN);
                fail(breaker, new IllegalStateException());
            }

            assertThat(breaker.getFailedHalfOpenCount()).isEqualTo(5);
            assertThat(breaker.isRunning()).isTrue();
            assertThat(breaker.isExhausted()).isFalse();
        }
    }

    @Test
    public void shouldCancelPendingProbeOnReset() throws Exception {
        try (CircuitBreakerImpl breaker = breaker("reset", 1, 30, 1, new RecordingMetrics())) {
            fail(breaker, new IllegalStateException());
            fail(breaker, new IllegalStateException());

            breaker.reset();

            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
            assertThat(breaker.getFailCount()).isZero();
            assertThat(breaker.getRemainingDelay()).isZero();
            Thread.sleep(80);
            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        }
    }

    @Test
    public void shouldNotProbeOnceClosed() throws Exception {
        CircuitBreakerImpl breaker = breaker("disposed", 1, 20, 1, new RecordingMetrics());
        fail(breaker, new IllegalStateException());
        fail(breaker, new IllegalStateException());

        breaker.close();
        Thread.sleep(80);

        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    public void shouldAccountEveryConcurrentAttempt() throws Exception {
        int threads = 8;
        int attemptsPerThread = 50;
        RecordingMetrics metrics = new RecordingMetrics();
        AtomicInteger invocations = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try (CircuitBreakerImpl breaker = breaker("concurrent", 3, 10_000, 0, metrics)) {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> workers = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                workers.add(pool.submit(() -> {
                    start.await();
                    for (int attempt = 0; attempt < attemptsPerThread; attempt++) {
                        try {
                            breaker.attempt(() -> {
                                invocations.incrementAndGet();
                                throw new IllegalStateException("concurrent");
                            });
                        } catch (IllegalStateException | OpenCircuitException expected) {
                            // counted by the breaker metrics
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> worker : workers) {
                worker.get(10, TimeUnit.SECONDS);
            }

            long failed = metrics.get("retryguard.concurrent.circuitbreaker.callsFailed.total");
            long prevented = metrics.get("retryguard.concurrent.circuitbreaker.callsPrevented.total");
            assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
            assertThat(breaker.isExhausted()).isTrue();
            assertThat(breaker.isRunning()).isFalse();
            assertThat(failed + prevented).isEqualTo(threads * attemptsPerThread);
            assertThat(failed).isEqualTo(invocations.get());
            assertThat(breaker.getFailCount()).isGreaterThanOrEqualTo(4);
            assertThat(metrics.get("retryguard.concurrent.circuitbreaker.opened.total")).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
