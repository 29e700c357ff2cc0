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

package org.apache.retryguard.api.retry;

import static java.util.Collections.unmodifiableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable table from failure class to {@link FailureHandler}.
 * <p>
 * Lookup is done on the exact runtime class of the failure: a handler registered for {@code IOException} does not
 * fire for {@code FileNotFoundException}, and the reverse. A failure whose class is not registered is unhandled and
 * must propagate.
 *
 * @param <T> the result type the handlers produce.
 */
public final class FailureHandlers<T> {
    private final Map<Class<? extends Exception>, FailureHandler<Exception, ? extends T>> handlers;

    private FailureHandlers(final Map<Class<? extends Exception>, FailureHandler<Exception, ? extends T>> handlers) {
        this.handlers = unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public static <T> FailureHandlers<T> none() {
        return new FailureHandlers<>(new LinkedHashMap<>());
    }

    public static <T, E extends Exception> FailureHandlers<T> single(final Class<E> type,
                                                                     final FailureHandler<? super E, ? extends T> handler) {
        return FailureHandlers.<T>builder().on(type, handler).build();
    }

    public boolean handles(final Throwable failure) {
        return failure != null && handlers.containsKey(failure.getClass());
    }

    /**
     * Runs the handler registered for the exact class of the failure.
     *
     * @param failure the failure raised by the guarded operation.
     * @return the substitute result.
     * @throws Exception the failure itself, unchanged, when no handler is registered for its class, or whatever the
     * handler throws.
     */
    public T handle(final Exception failure) throws Exception {
        final FailureHandler<Exception, ? extends T> handler = handlers.get(failure.getClass());
        if (handler == null) {
            throw failure;
        }
        return handler.handle(failure);
    }

    public Set<Class<? extends Exception>> getHandledTypes() {
        return handlers.keySet();
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    @Override
    public String toString() {
        return "FailureHandlers" + handlers.keySet();
    }

    public static final class Builder<T> {
        private final Map<Class<? extends Exception>, FailureHandler<Exception, ? extends T>> handlers = new LinkedHashMap<>();

        private Builder() {
            // use FailureHandlers.builder()
        }

        public <E extends Exception> Builder<T> on(final Class<E> type, final FailureHandler<? super E, ? extends T> handler) {
            if (type == null || handler == null) {
                throw new IllegalArgumentException("type and handler are required");
            }
            // exact class lookup guarantees the failure passed to the handler is an E
            handlers.put(type, failure -> handler.handle(type.cast(failure)));
            return this;
        }

        /**
         * Registers a failure type as handled without a recovery function, its substitute result is {@code null}.
         */
        public Builder<T> on(final Class<? extends Exception> type) {
            if (type == null) {
                throw new IllegalArgumentException("type is required");
            }
            handlers.put(type, failure -> null);
            return this;
        }

        public FailureHandlers<T> build() {
            return new FailureHandlers<>(handlers);
        }
    }
}
