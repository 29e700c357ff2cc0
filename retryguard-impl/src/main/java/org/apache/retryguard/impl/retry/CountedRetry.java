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

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import net.jodah.failsafe.Failsafe;
import net.jodah.failsafe.FailsafeException;
import net.jodah.failsafe.RetryPolicy;
import org.apache.retryguard.api.retry.FailureHandlers;
import org.apache.retryguard.impl.cache.ResultCache;
import org.apache.retryguard.impl.executorService.ExecutorServiceProvider;
import org.apache.retryguard.impl.metrics.RetryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry without circuit breaker: up to {@code max(maxTries, 1) + 1} invocations with a fixed delay between them.
 * Failures go through the same exact class dispatch as {@link RetryExecutor}, a failure without handler stops the
 * retry and is rethrown unchanged. When attempts run out the last handler result is returned.
 */
public class CountedRetry {
    private static final Logger LOGGER = LoggerFactory.getLogger(CountedRetry.class);

    private final ExecutorService executor;
    private final RetryMetrics metrics;

    public CountedRetry(final ExecutorServiceProvider executorServiceProvider, final RetryMetrics metrics) {
        this.executor = executorServiceProvider.getExecutorService();
        this.metrics = metrics;
    }

    public <T> T run(final String name, final Callable<T> operation, final FailureHandlers<T> handlers,
                     final int maxTries, final long delayMs, final ResultCache<T> cache, final String id) throws Exception {
        if (cache != null) {
            final Optional<ResultCache.Entry<T>> entry = cache.find(id);
            if (entry.isPresent()) {
                return entry.get().getValue();
            }
        }

        final RetryPolicy retryPolicy = new RetryPolicy()
                .withMaxRetries(Math.max(maxTries, 1))
                .retryOn(HandledFailure.class);
        if (delayMs > 0) {
            retryPolicy.withDelay(delayMs, TimeUnit.MILLISECONDS);
        }

        final AtomicReference<T> substitute = new AtomicReference<>();
        T result;
        try {
            result = Failsafe.with(retryPolicy).get(() -> attempt(name, operation, handlers, substitute));
        } catch (final HandledFailure handled) {
            LOGGER.debug("Retry '{}' ran out of attempts, last failure was {}", name, handled.getCause().toString());
            result = substitute.get();
        } catch (final FailsafeException fe) {
            throw unwrap(fe);
        }
        return cache == null ? result : cache.resolve(id, result);
    }

    /**
     * Runs {@link #run} on the executor; the returned future fails with the propagated failure itself.
     */
    public <T> CompletableFuture<T> runAsync(final String name, final Callable<T> operation,
                                             final FailureHandlers<T> handlers, final int maxTries, final long delayMs,
                                             final ResultCache<T> cache, final String id) {
        final CompletableFuture<T> promise = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                if (promise.isDone()) {
                    return;
                }
                try {
                    promise.complete(run(name, operation, handlers, maxTries, delayMs, cache, id));
                } catch (final Exception | Error e) {
                    promise.completeExceptionally(e);
                }
            });
        } catch (final RejectedExecutionException ree) {
            promise.completeExceptionally(ree);
        }
        return promise;
    }

    private <T> T attempt(final String name, final Callable<T> operation, final FailureHandlers<T> handlers,
                          final AtomicReference<T> substitute) throws Exception {
        try {
            return operation.call();
        } catch (final Exception e) {
            if (!handlers.handles(e)) {
                metrics.counter(RetryMetrics.name(name + ".retry", "unhandled.total"),
                        "Number of failures without handler, they end the retry").inc();
                throw e;
            }
            metrics.counter(RetryMetrics.name(name + ".retry", "handled.total"),
                    "Number of failures recovered by a handler").inc();
            substitute.set(handlers.handle(e));
            throw new HandledFailure(e);
        }
    }

    private static Exception unwrap(final FailsafeException fe) {
        final Throwable cause = fe.getCause();
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        if (cause instanceof Exception) {
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return (Exception) cause;
        }
        return fe;
    }

    // marks a failure recovered by a handler so the policy retries it
    private static final class HandledFailure extends RuntimeException {
        private HandledFailure(final Exception failure) {
            super(failure.getMessage(), failure, false, false);
        }
    }
}
