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

package org.apache.retryguard.impl.executorService;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class DefaultExecutorServiceProvider implements ExecutorServiceProvider, AutoCloseable {
    private final ScheduledExecutorService executorService;

    public DefaultExecutorServiceProvider(ScheduledExecutorService executorService) {
        this.executorService = executorService;
    }

    public DefaultExecutorServiceProvider(int poolSize) {
        this(Executors.newScheduledThreadPool(poolSize, new DaemonThreadFactory()));
    }

    @Override
    public ExecutorService getExecutorService() {
        return executorService;
    }

    @Override
    public ScheduledExecutorService getScheduledExecutorService() {
        return executorService;
    }

    @Override
    public void close() {
        executorService.shutdownNow();
    }

    private static class DaemonThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(final Runnable r) {
            final Thread thread = new Thread(r, "retryguard-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
