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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;

import javax.enterprise.inject.Vetoed;

import org.apache.retryguard.api.circuitbreaker.CircuitBreakerManager;
import org.apache.retryguard.impl.metrics.RetryMetrics;

/**
 * Named circuit breakers shared by every retry executed under the same name.
 */
@Vetoed
public class CircuitBreakerManagerImpl implements CircuitBreakerManager, AutoCloseable {
    private final Map<String, CircuitBreakerImpl> circuitBreakers = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final RetryMetrics metrics;

    public CircuitBreakerManagerImpl(ScheduledExecutorService scheduler, RetryMetrics metrics) {
        this.scheduler = scheduler;
        this.metrics = metrics;
    }

    @Override
    public CircuitBreakerBuilderImpl newCircuitBreaker(String name) {
        return new CircuitBreakerBuilderImpl(name, this);
    }

    @Override
    public CircuitBreakerImpl getCircuitBreaker(String name) {
        return circuitBreakers.get(name);
    }

    void register(String name, CircuitBreakerDefinitionImpl definition) {
        CircuitBreakerImpl previous = circuitBreakers.put(name, new CircuitBreakerImpl(name, definition, scheduler, metrics));
        if (previous != null) {
            previous.close();
        }
    }

    @Override
    public void close() {
        circuitBreakers.values().forEach(CircuitBreakerImpl::close);
        circuitBreakers.clear();
    }
}
