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
import org.apache.retryguard.impl.retry.CountedRetry;

public class CountedExecutionPlan implements ExecutionPlan {
    private final RetryDefinition retryDefinition;
    private final CountedRetry countedRetry;

    CountedExecutionPlan(RetryDefinition retryDefinition, CountedRetry countedRetry) {
        this.retryDefinition = retryDefinition;
        this.countedRetry = countedRetry;
    }

    @Override
    public <T> T execute(Callable<T> callable, FailureHandlers<T> handlers, ResultCache<T> cache, String id)
            throws Exception {
        return countedRetry.run(retryDefinition.getName(), callable, handlers, retryDefinition.getMaxTries(),
                retryDefinition.getDelay().toMillis(), cache, id);
    }

    @Override
    public <T> CompletableFuture<T> executeAsync(Callable<T> callable, FailureHandlers<T> handlers,
                                                 ResultCache<T> cache, String id) {
        return countedRetry.runAsync(retryDefinition.getName(), callable, handlers, retryDefinition.getMaxTries(),
                retryDefinition.getDelay().toMillis(), cache, id);
    }
}
