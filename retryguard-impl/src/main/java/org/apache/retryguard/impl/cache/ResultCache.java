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

package org.apache.retryguard.impl.cache;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.apache.retryguard.api.exceptions.DuplicateResultException;

/**
 * Results of completed retry sequences, keyed by the caller supplied id.
 * <p>
 * Share one instance between the retries that must run at most once, create separate instances to isolate them.
 * All operations are serialized on the instance.
 *
 * @param <T> the result type.
 */
public class ResultCache<T> {
    private final Object lock = new Object();
    private final Map<String, Entry<T>> results = new HashMap<>();

    /**
     * @param id the logical id of a retry, may be null.
     * @return true when there is no id or nothing is stored for it yet.
     */
    public boolean canRun(final String id) {
        if (isAnonymous(id)) {
            return true;
        }
        synchronized (lock) {
            return !results.containsKey(id);
        }
    }

    /**
     * Stores a result, ignored without id.
     *
     * @throws DuplicateResultException if a result is already stored for the id.
     */
    public void addResult(final String id, final T value) {
        if (isAnonymous(id)) {
            return;
        }
        synchronized (lock) {
            if (results.containsKey(id)) {
                throw new DuplicateResultException(id);
            }
            results.put(id, new Entry<>(value));
        }
    }

    /**
     * Stores the value unless the slot is already taken.
     *
     * @return the value owning the slot after the call, {@code value} itself without id.
     */
    public T resolve(final String id, final T value) {
        if (isAnonymous(id)) {
            return value;
        }
        synchronized (lock) {
            return results.computeIfAbsent(id, k -> new Entry<>(value)).value;
        }
    }

    public Optional<T> getResult(final String id) {
        return find(id).map(Entry::getValue);
    }

    /**
     * @return the stored entry, its value can be null if the retry produced null.
     */
    public Optional<Entry<T>> find(final String id) {
        if (isAnonymous(id)) {
            return Optional.empty();
        }
        synchronized (lock) {
            return Optional.ofNullable(results.get(id));
        }
    }

    public void removeResult(final String id) {
        if (isAnonymous(id)) {
            return;
        }
        synchronized (lock) {
            results.remove(id);
        }
    }

    public void clearResults() {
        synchronized (lock) {
            results.clear();
        }
    }

    public int size() {
        synchronized (lock) {
            return results.size();
        }
    }

    private static boolean isAnonymous(final String id) {
        return id == null || id.isEmpty();
    }

    public static final class Entry<T> {
        private final T value;

        private Entry(final T value) {
            this.value = value;
        }

        public T getValue() {
            return value;
        }

        @Override
        public String toString() {
            return "Entry{value=" + value + '}';
        }
    }
}
