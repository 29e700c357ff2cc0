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

package org.apache.retryguard.impl;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

import javax.enterprise.inject.Vetoed;

import org.apache.retryguard.api.ExecutionManager;
import org.apache.retryguard.api.retry.FailureHandlers;
import org.apache.retryguard.impl.cache.ResultCache;
import org.apache.retryguard.impl.circuitbreaker.CircuitBreakerManagerImpl;
import org.apache.retryguard.impl.executionPlans.ExecutionPlanFactory;
import org.apache.retryguard.impl.executorService.DefaultExecutorServiceProvider;
import org.apache.retryguard.impl.executorService.ExecutorServiceProvider;
import org.apache.retryguard.impl.metrics.RetryMetrics;
import org.apache.retryguard.impl.retry.CountedRetry;
import org.apache.retryguard.impl.retry.RetryExecutor;
import org.apache.retryguard.impl.retry.RetryManagerImpl;

@Vetoed
public class RetryExecutionManager implements ExecutionManager, AutoCloseable {
    private static final int DEFAULT_POOL_SIZE = 5;

    private final CircuitBreakerManagerImpl circuitBreakerManager;
    private final RetryManagerImpl retryManager;
    private final ExecutionPlanFactory executionPlanFactory;
    private final ExecutorServiceProvider executorServiceProvider;

    public RetryExecutionManager() {
        this(new DefaultExecutorServiceProvider(DEFAULT_POOL_SIZE), RetryMetrics.create());
    }

    public RetryExecutionManager(ExecutorServiceProvider executorServiceProvider, RetryMetrics metrics) {
        this.executorServiceProvider = executorServiceProvider;
        this.circuitBreakerManager = new CircuitBreakerManagerImpl(
                executorServiceProvider.getScheduledExecutorService(), metrics);
        this.retryManager = new RetryManagerImpl();
        this.retryManager.init();
        this.executionPlanFactory = new ExecutionPlanFactory(circuitBreakerManager, retryManager,
                new RetryExecutor(executorServiceProvider, metrics), new CountedRetry(executorServiceProvider, metrics));
    }

    @Override
    public <T> T execute(String name, Callable<T> callable, FailureHandlers<T> handlers) throws Exception {
        return execute(name, callable, handlers, null, null);
    }

    /**
     * Runs the retry registered under {@code name}; with a cache and an id the retry runs at most once.
     */
    public <T> T execute(String name, Callable<T> callable, FailureHandlers<T> handlers,
                         ResultCache<T> cache, String id) throws Exception {
        return executionPlanFactory.locateExecutionPlan(name).execute(callable, handlers, cache, id);
    }

    public <T> CompletableFuture<T> executeAsync(String name, Callable<T> callable, FailureHandlers<T> handlers) {
        return executeAsync(name, callable, handlers, null, null);
    }

    public <T> CompletableFuture<T> executeAsync(String name, Callable<T> callable, FailureHandlers<T> handlers,
                                                 ResultCache<T> cache, String id) {
        return executionPlanFactory.locateExecutionPlan(name).executeAsync(callable, handlers, cache, id);
    }

    public ExecutionPlanFactory getExecutionPlanFactory() {
        return executionPlanFactory;
    }

    @Override
    public CircuitBreakerManagerImpl getCircuitBreakerManager() {
        return circuitBreakerManager;
    }

    @Override
    public RetryManagerImpl getRetryManager() {
        return retryManager;
    }

    @Override
    public void close() {
        circuitBreakerManager.close();
        if (executorServiceProvider instanceof AutoCloseable) {
            try {
                ((AutoCloseable) executorServiceProvider).close();
            } catch (final Exception e) {
                throw new IllegalStateException("Can't shut down " + executorServiceProvider, e);
            }
        }
    }
}
