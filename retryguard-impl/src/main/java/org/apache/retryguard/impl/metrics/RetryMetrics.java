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

package org.apache.retryguard.impl.metrics;

import static java.util.Comparator.comparing;
import static java.util.Optional.ofNullable;

import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.stream.StreamSupport;

import javax.annotation.Priority;
import javax.enterprise.inject.spi.CDI;

import org.eclipse.microprofile.metrics.MetricRegistry;
import org.slf4j.LoggerFactory;

public interface RetryMetrics {
    Counter counter(String name, String description);

    interface Counter {
        void inc();
    }

    static RetryMetrics create() {
        try {
            final Optional<RetryMetrics> metrics = StreamSupport.stream(
                    ServiceLoader.load(RetryMetrics.class).spliterator(), false)
                    .min(comparing(it -> ofNullable(it.getClass().getAnnotation(Priority.class)).map(Priority::value).orElse(0)));
            if (metrics.isPresent()) {
                return metrics.get();
            }
        } catch (final ServiceConfigurationError | RuntimeException | LinkageError e) {
            LoggerFactory.getLogger(RetryMetrics.class).warn("Can't load metrics implementation", e);
        }
        try {
            return new MicroprofileMetricsImpl(CDI.current().select(MetricRegistry.class).get());
        } catch (final RuntimeException | LinkageError e) {
            LoggerFactory.getLogger(RetryMetrics.class)
                    .debug("No MicroProfile Metrics registry available ({}), metrics are disabled", e.toString());
        }
        return NoMetrics.INSTANCE;
    }

    static String name(final String base, final String metric) {
        return "retryguard." + base + "." + metric;
    }
}
