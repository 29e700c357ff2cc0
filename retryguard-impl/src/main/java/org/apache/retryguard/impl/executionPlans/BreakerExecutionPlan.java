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

package org.apache.retryguard.impl.executionPlans;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

import org.apache.retryguard.api.retry.FailureHandlers;
import org.apache.retryguard.api.retry.RetryDefinition;
import org.apache.retryguard.impl.cache.ResultCache;
import org.apache.retryguard.impl.circuitbreaker.CircuitBreakerImpl;
import org.apache.retryguard.impl.retry.RetryExecutor;

/**
 * Retry loop behind a circuit breaker. A named breaker registered under the same name is shared by every call,
 * without one each call gets its own breaker sized from the retry definition.
 */
public class BreakerExecutionPlan implements ExecutionPlan {
    private final RetryDefinition retryDefinition;
    private final CircuitBreakerImpl sharedCircuitBreaker;
    private final RetryExecutor retryExecutor;

    BreakerExecutionPlan(RetryDefinition retryDefinition, CircuitBreakerImpl sharedCircuitBreaker,
                         RetryExecutor retryExecutor) {
        this.retryDefinition = retryDefinition;
        this.sharedCircuitBreaker = sharedCircuitBreaker;
        this.retryExecutor = retryExecutor;
    }

    @Override
    public <T> T execute(Callable<T> callable, FailureHandlers<T> handlers, ResultCache<T> cache, String id)
            throws Exception {
        if (sharedCircuitBreaker == null) {
            return retryExecutor.run(callable, handlers, retryDefinition, cache, id);
        }
        return retryExecutor.run(callable, handlers, sharedCircuitBreaker, retryDefinition.getExhaustionPolicy(),
                cache, id);
    }

    @Override
    public <T> CompletableFuture<T> executeAsync(Callable<T> callable, FailureHandlers<T> handlers,
                                                 ResultCache<T> cache, String id) {
        if (sharedCircuitBreaker == null) {
            return retryExecutor.runAsync(callable, handlers, retryDefinition, cache, id);
        }
        return retryExecutor.runAsync(callable, handlers, sharedCircuitBreaker,
                retryDefinition.getExhaustionPolicy(), cache, id);
    }
}
