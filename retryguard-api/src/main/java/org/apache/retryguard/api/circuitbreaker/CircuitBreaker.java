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

package org.apache.retryguard.api.circuitbreaker;

import java.util.concurrent.Callable;

/**
 * Counts failures of the attempts it admits and refuses attempts once the failure budget is spent.
 * <p>
 * A breaker is local to the process and is only mutated by attempts, by its own recovery timer and by
 * {@link #reset()}.
 */
public interface CircuitBreaker {
    String getName();

    CircuitBreakerDefinition getDefinition();

    CircuitBreakerState getState();

    /**
     * Runs the operation if the breaker is closed or half open.
     *
     * @param operation the guarded operation.
     * @param <T> the operation result type.
     * @return the operation result.
     * @throws org.apache.retryguard.api.exceptions.OpenCircuitException if the breaker is open, the operation is not
     * invoked in that case.
     * @throws Exception the failure raised by the operation, unchanged.
     */
    <T> T attempt(Callable<T> operation) throws Exception;

    /**
     * @return false once an attempt succeeded or once the breaker gave up probing.
     */
    boolean isRunning();

    /**
     * @return true when the breaker is open and will not probe anymore.
     */
    boolean isExhausted();

    int getFailCount();

    int getFailedHalfOpenCount();

    Exception getLastException();

    /**
     * Forces the breaker closed, clears its counters and cancels a pending probe.
     */
    void reset();
}
