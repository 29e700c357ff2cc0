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

import java.time.Duration;

import org.apache.retryguard.api.circuitbreaker.CircuitBreakerBuilder;
import org.apache.retryguard.api.config.ConfigFacade;

public class CircuitBreakerBuilderImpl implements CircuitBreakerBuilder {
    private final String name;
    private final CircuitBreakerManagerImpl circuitBreakerManager;
    private int threshold;
    private Duration delay;
    private int halfOpenThreshold;

    CircuitBreakerBuilderImpl(String name, CircuitBreakerManagerImpl circuitBreakerManager) {
        this.name = name;
        this.circuitBreakerManager = circuitBreakerManager;

        final ConfigFacade config = ConfigFacade.getInstance();
        final String prefix = "retryguard." + name + ".circuitbreaker.";
        this.threshold = config.getInt(prefix + "threshold", config.getInt("retryguard.circuitbreaker.threshold", 1));
        this.delay = Duration.ofMillis(config.getLong(prefix + "delay", config.getLong("retryguard.circuitbreaker.delay", 0)));
        this.halfOpenThreshold = config.getInt(prefix + "halfOpenThreshold",
                config.getInt("retryguard.circuitbreaker.halfOpenThreshold", 0));
    }

    @Override
    public CircuitBreakerBuilderImpl withThreshold(int threshold) {
        this.threshold = threshold;
        return this;
    }

    @Override
    public CircuitBreakerBuilderImpl withDelay(Duration delay) {
        this.delay = delay;
        return this;
    }

    @Override
    public CircuitBreakerBuilderImpl withHalfOpenThreshold(int halfOpenThreshold) {
        this.halfOpenThreshold = halfOpenThreshold;
        return this;
    }

    @Override
    public CircuitBreakerDefinitionImpl build() {
        CircuitBreakerDefinitionImpl definition = new CircuitBreakerDefinitionImpl(threshold, delay, halfOpenThreshold);
        circuitBreakerManager.register(name, definition);
        return definition;
    }
}
