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

import org.apache.retryguard.api.exceptions.DuplicateResultException;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ResultCacheTest {
    @Test
    public void shouldRunUntilAResultIsStored() {
        ResultCache<Integer> cache = new ResultCache<>();
        assertThat(cache.canRun("A")).isTrue();

        cache.addResult("A", 1);

        assertThat(cache.canRun("A")).isFalse();
        assertThat(cache.getResult("A")).contains(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    public void shouldNeverOverwrite() {
        ResultCache<Integer> cache = new ResultCache<>();
        cache.addResult("A", 1);

        assertThatThrownBy(() -> cache.addResult("A", 2))
                .isInstanceOf(DuplicateResultException.class)
                .hasMessageContaining("A");
        assertThat(cache.getResult("A")).contains(1);
    }

    @Test
    public void shouldIgnoreAnonymousRuns() {
        ResultCache<Integer> cache = new ResultCache<>();
        cache.addResult(null, 1);
        cache.addResult("", 2);

        assertThat(cache.size()).isZero();
        assertThat(cache.canRun(null)).isTrue();
        assertThat(cache.canRun("")).isTrue();
        assertThat(cache.resolve(null, 3)).isEqualTo(3);
        assertThat(cache.getResult("")).isEmpty();
    }

    @Test
    public void shouldReportStoredNullThroughFind() {
        ResultCache<Integer> cache = new ResultCache<>();
        cache.addResult("A", null);

        assertThat(cache.getResult("A")).isEmpty();
        assertThat(cache.find("A")).hasValueSatisfying(entry -> assertThat(entry.getValue()).isNull());
        assertThat(cache.canRun("A")).isFalse();
    }

    @Test
    public void shouldKeepFirstResolvedValue() {
        ResultCache<String> cache = new ResultCache<>();

        assertThat(cache.resolve("A", "first")).isEqualTo("first");
        assertThat(cache.resolve("A", "second")).isEqualTo("first");
    }

    @Test
    public void shouldResolveRacingRunsToOneValue() throws Exception {
        ResultCache<Integer> cache = new ResultCache<>();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Integer>> racers = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                int value = i;
                racers.add(() -> cache.resolve("shared", value));
            }
            List<Integer> owners = new ArrayList<>();
            for (Future<Integer> future : pool.invokeAll(racers)) {
                owners.add(future.get());
            }
            assertThat(owners).containsOnly(cache.getResult("shared").orElseThrow(IllegalStateException::new));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void shouldEvict() {
        ResultCache<Integer> cache = new ResultCache<>();
        cache.addResult("A", 1);
        cache.addResult("B", 2);

        cache.removeResult("A");
        assertThat(cache.canRun("A")).isTrue();
        assertThat(cache.canRun("B")).isFalse();

        cache.clearResults();
        assertThat(cache.size()).isZero();
    }
}
