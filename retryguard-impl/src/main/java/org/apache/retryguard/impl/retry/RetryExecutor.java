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

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;

import org.apache.retryguard.api.exceptions.OpenCircuitException;
import org.apache.retryguard.api.exceptions.RetriesExhaustedException;
import org.apache.retryguard.api.retry.ExhaustionPolicy;
import org.apache.retryguard.api.retry.FailureHandlers;
import org.apache.retryguard.api.retry.RetryDefinition;
import org.apache.retryguard.impl.cache.ResultCache;
import org.apache.retryguard.impl.circuitbreaker.CircuitBreakerDefinitionImpl;
import org.apache.retryguard.impl.circuitbreaker.CircuitBreakerImpl;
import org.apache.retryguard.impl.executorService.ExecutorServiceProvider;
import org.apache.retryguard.impl.metrics.RetryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a guarded operation through a {@link CircuitBreakerImpl} until it succeeds, the breaker stops or a failure
 * without handler is raised.
 * <p>
 * Each attempt failure is dispatched on its exact class through {@link FailureHandlers}; the handler result becomes
 * the current result and the loop goes on while the breaker is running. An open breaker is waited for, sleeping
 * in {@link #run} and through the scheduler in {@link #runAsync}. A failure without handler ends the retry and is
 * rethrown as is.
 * <p>
 * With a cache and an id, a completed retry stores its result and later retries with the same id return it without
 * invoking anything.
 */
public class RetryExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryExecutor.class);
    private static final long MIN_WAIT = Duration.ofMillis(1).toNanos();
    private static final String ANONYMOUS = "retry";

    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;
    private final RetryMetrics metrics;

    public RetryExecutor(final ExecutorServiceProvider executorServiceProvider, final RetryMetrics metrics) {
        this.executor = executorServiceProvider.getExecutorService();
        this.scheduler = executorServiceProvider.getScheduledExecutorService();
        this.metrics = metrics;
    }

    public <T> T run(final Callable<T> operation, final FailureHandlers<T> handlers,
                     final int maxTries, final long delayMs, final int halfOpenThreshold,
                     final ResultCache<T> cache, final String id) throws Exception {
        return run(operation, handlers, definition(maxTries, delayMs, halfOpenThreshold, id), cache, id);
    }

    /**
     * Runs the retry with a circuit breaker created for this call only.
     */
    public <T> T run(final Callable<T> operation, final FailureHandlers<T> handlers, final RetryDefinition definition,
                     final ResultCache<T> cache, final String id) throws Exception {
        final Optional<ResultCache.Entry<T>> cached = lookup(cache, id);
        if (cached.isPresent()) {
            return cached.get().getValue();
        }
        try (CircuitBreakerImpl circuitBreaker = newCircuitBreaker(definition)) {
            return run(operation, handlers, circuitBreaker, definition.getExhaustionPolicy(), cache, id);
        }
    }

    /**
     * Runs the retry through a caller owned circuit breaker, its failure budget is shared with the other retries
     * using it. An exhausted breaker does not run anything.
     */
    public <T> T run(final Callable<T> operation, final FailureHandlers<T> handlers,
                     final CircuitBreakerImpl circuitBreaker, final ExhaustionPolicy exhaustionPolicy,
                     final ResultCache<T> cache, final String id) throws Exception {
        final Optional<ResultCache.Entry<T>> cached = lookup(cache, id);
        if (cached.isPresent()) {
            return cached.get().getValue();
        }

        final Outcome<T> outcome = new Outcome<>();
        circuitBreaker.resume();
        while (circuitBreaker.isRunning()) {
            try {
                outcome.succeeded(circuitBreaker.attempt(operation));
                break;
            } catch (final OpenCircuitException oce) {
                LOGGER.debug("{}", oce.getMessage());
                final long wait = Math.max(MIN_WAIT, oce.getRemainingDelay().toNanos());
                if (circuitBreaker.isRunning()) {
                    NANOSECONDS.sleep(wait);
                }
            } catch (final Exception e) {
                outcome.handled(recover(handlers, e, circuitBreaker.getName()));
            }
        }
        return complete(outcome, circuitBreaker, exhaustionPolicy, cache, id);
    }

    public <T> CompletableFuture<T> runAsync(final Callable<T> operation, final FailureHandlers<T> handlers,
                                             final int maxTries, final long delayMs, final int halfOpenThreshold,
                                             final ResultCache<T> cache, final String id) {
        return runAsync(operation, handlers, definition(maxTries, delayMs, halfOpenThreshold, id), cache, id);
    }

    /**
     * Asynchronous {@link #run(Callable, FailureHandlers, RetryDefinition, ResultCache, String)}.
     * <p>
     * Cancelling the returned future stops scheduling attempts, an attempt already running is not interrupted.
     */
    public <T> CompletableFuture<T> runAsync(final Callable<T> operation, final FailureHandlers<T> handlers,
                                             final RetryDefinition definition,
                                             final ResultCache<T> cache, final String id) {
        final Optional<ResultCache.Entry<T>> cached = lookup(cache, id);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get().getValue());
        }
        final CircuitBreakerImpl circuitBreaker = newCircuitBreaker(definition);
        final CompletableFuture<T> result = runAsync(operation, handlers, circuitBreaker,
                definition.getExhaustionPolicy(), cache, id);
        result.whenComplete((value, error) -> circuitBreaker.close());
        return result;
    }

    public <T> CompletableFuture<T> runAsync(final Callable<T> operation, final FailureHandlers<T> handlers,
                                             final CircuitBreakerImpl circuitBreaker,
                                             final ExhaustionPolicy exhaustionPolicy,
                                             final ResultCache<T> cache, final String id) {
        final Optional<ResultCache.Entry<T>> cached = lookup(cache, id);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get().getValue());
        }
        final AsyncRun<T> run = new AsyncRun<>(operation, handlers, circuitBreaker, exhaustionPolicy, cache, id);
        circuitBreaker.resume();
        run.submit();
        return run.promise;
    }

    private <T> T recover(final FailureHandlers<T> handlers, final Exception failure, final String name) throws Exception {
        final String base = name + ".retry";
        if (!handlers.handles(failure)) {
            metrics.counter(RetryMetrics.name(base, "unhandled.total"),
                    "Number of failures without handler, they end the retry").inc();
            LOGGER.debug("No handler for {} in retry '{}', propagating it", failure.getClass().getName(), name);
            throw failure;
        }
        metrics.counter(RetryMetrics.name(base, "handled.total"),
                "Number of failures recovered by a handler").inc();
        return handlers.handle(failure);
    }

    private <T> T complete(final Outcome<T> outcome, final CircuitBreakerImpl circuitBreaker,
                           final ExhaustionPolicy exhaustionPolicy, final ResultCache<T> cache, final String id) {
        if (!outcome.succeeded && exhaustionPolicy == ExhaustionPolicy.FAIL) {
            throw new RetriesExhaustedException("Retry '" + circuitBreaker.getName() + "' stopped without success",
                    circuitBreaker.getLastException());
        }
        if (cache == null || !outcome.completed()) {
            return outcome.result;
        }
        return cache.resolve(id, outcome.result);
    }

    private static <T> Optional<ResultCache.Entry<T>> lookup(final ResultCache<T> cache, final String id) {
        if (cache == null) {
            return Optional.empty();
        }
        final Optional<ResultCache.Entry<T>> entry = cache.find(id);
        if (entry.isPresent()) {
            LOGGER.debug("Retry '{}' already completed, returning its stored result", id);
        }
        return entry;
    }

    private CircuitBreakerImpl newCircuitBreaker(final RetryDefinition definition) {
        return new CircuitBreakerImpl(definition.getName(),
                new CircuitBreakerDefinitionImpl(Math.max(definition.getMaxTries(), 1), definition.getDelay(),
                        definition.getHalfOpenThreshold()),
                scheduler, metrics);
    }

    private static RetryDefinition definition(final int maxTries, final long delayMs, final int halfOpenThreshold,
                                              final String id) {
        return new RetryDefinitionImpl(id == null || id.isEmpty() ? ANONYMOUS : id, maxTries,
                Duration.ofMillis(delayMs), halfOpenThreshold, ExhaustionPolicy.RETURN_LAST_RESULT, true);
    }

    private static final class Outcome<T> {
        private T result;
        private boolean succeeded;
        private boolean handled;

        private void succeeded(final T value) {
            result = value;
            succeeded = true;
        }

        private void handled(final T value) {
            result = value;
            handled = true;
        }

        // something ran to completion, an exhausted breaker that never admitted an attempt is not cached
        private boolean completed() {
            return succeeded || handled;
        }
    }

    private final class AsyncRun<T> implements Runnable {
        private final CompletableFuture<T> promise = new CompletableFuture<>();
        private final Outcome<T> outcome = new Outcome<>();
        private final Callable<T> operation;
        private final FailureHandlers<T> handlers;
        private final CircuitBreakerImpl circuitBreaker;
        private final ExhaustionPolicy exhaustionPolicy;
        private final ResultCache<T> cache;
        private final String id;

        private AsyncRun(final Callable<T> operation, final FailureHandlers<T> handlers,
                         final CircuitBreakerImpl circuitBreaker, final ExhaustionPolicy exhaustionPolicy,
                         final ResultCache<T> cache, final String id) {
            this.operation = operation;
            this.handlers = handlers;
            this.circuitBreaker = circuitBreaker;
            this.exhaustionPolicy = exhaustionPolicy;
            this.cache = cache;
            this.id = id;
        }

        private void submit() {
            try {
                executor.execute(this);
            } catch (final RejectedExecutionException ree) {
                promise.completeExceptionally(ree);
            }
        }

        @Override
        public void run() {
            if (promise.isDone()) { // cancelled
                return;
            }
            if (!circuitBreaker.isRunning()) {
                finish();
                return;
            }
            try {
                outcome.succeeded(circuitBreaker.attempt(operation));
                finish();
                return;
            } catch (final OpenCircuitException oce) {
                LOGGER.debug("{}", oce.getMessage());
                final long wait = Math.max(MIN_WAIT, oce.getRemainingDelay().toNanos());
                try {
                    scheduler.schedule(this::submit, wait, NANOSECONDS);
                } catch (final RejectedExecutionException ree) {
                    promise.completeExceptionally(ree);
                }
                return;
            } catch (final Exception e) {
                try {
                    outcome.handled(recover(handlers, e, circuitBreaker.getName()));
                } catch (final Exception | Error unhandled) {
                    promise.completeExceptionally(unhandled);
                    return;
                }
            } catch (final Error error) { // never leave the promise pending
                promise.completeExceptionally(error);
                return;
            }
            submit();
        }

        private void finish() {
            try {
                promise.complete(complete(outcome, circuitBreaker, exhaustionPolicy, cache, id));
            } catch (final RuntimeException re) {
                promise.completeExceptionally(re);
            }
        }
    }
}
