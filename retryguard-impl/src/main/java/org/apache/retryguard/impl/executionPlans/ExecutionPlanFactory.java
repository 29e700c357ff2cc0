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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.apache.retryguard.api.retry.RetryDefinition;
import org.apache.retryguard.impl.circuitbreaker.CircuitBreakerImpl;
import org.apache.retryguard.impl.circuitbreaker.CircuitBreakerManagerImpl;
import org.apache.retryguard.impl.retry.CountedRetry;
import org.apache.retryguard.impl.retry.RetryExecutor;
import org.apache.retryguard.impl.retry.RetryManagerImpl;

public class ExecutionPlanFactory {
    private final CircuitBreakerManagerImpl circuitBreakerManager;
    private final RetryManagerImpl retryManager;
    private final RetryExecutor retryExecutor;
    private final CountedRetry countedRetry;
    private final ConcurrentMap<String, ExecutionPlan> executionPlanMap = new ConcurrentHashMap<>();

    public ExecutionPlanFactory(CircuitBreakerManagerImpl circuitBreakerManager, RetryManagerImpl retryManager,
                                RetryExecutor retryExecutor, CountedRetry countedRetry) {
        this.circuitBreakerManager = circuitBreakerManager;
        this.retryManager = retryManager;
        this.retryExecutor = retryExecutor;
        this.countedRetry = countedRetry;
    }

    /**
     * Plans are built once per name, from the registered retry definition or, without one, from the configured
     * defaults. Register definitions and shared breakers before the first execution under their name.
     */
    public ExecutionPlan locateExecutionPlan(String name) {
        return executionPlanMap.computeIfAbsent(name, key -> {
            RetryDefinition retryDefinition = retryManager.getRetryDefinition(key);
            if (retryDefinition == null) {
                retryDefinition = retryManager.newRetryDefinition(key).build();
            }
            if (!retryDefinition.isCircuitBreakerEnabled()) {
                return new CountedExecutionPlan(retryDefinition, countedRetry);
            }
            CircuitBreakerImpl circuitBreaker = circuitBreakerManager.getCircuitBreaker(key);
            return new BreakerExecutionPlan(retryDefinition, circuitBreaker, retryExecutor);
        });
    }

    public void invalidate(String name) {
        executionPlanMap.remove(name);
    }
}
