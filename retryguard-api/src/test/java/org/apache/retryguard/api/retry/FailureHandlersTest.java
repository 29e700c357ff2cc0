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

import org.testng.annotations.Test;

import java.io.FileNotFoundException;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FailureHandlersTest {
    @Test
    public void shouldDispatchOnExactClass() throws Exception {
        FailureHandlers<String> handlers = FailureHandlers.<String>builder()
                .on(IOException.class, e -> "io:" + e.getMessage())
                .on(IllegalStateException.class, e -> "state")
                .build();

        assertThat(handlers.handles(new IOException("x"))).isTrue();
        assertThat(handlers.handle(new IOException("disk"))).isEqualTo("io:disk");
        assertThat(handlers.handle(new IllegalStateException())).isEqualTo("state");
        assertThat(handlers.getHandledTypes()).containsExactly(IOException.class, IllegalStateException.class);
    }

    @Test
    public void shouldNotMatchSubclasses() {
        FailureHandlers<String> handlers = FailureHandlers.single(IOException.class, e -> "io");
        FileNotFoundException failure = new FileNotFoundException("missing");

        assertThat(handlers.handles(failure)).isFalse();
        assertThatThrownBy(() -> handlers.handle(failure)).isSameAs(failure);
    }

    @Test
    public void shouldNotMatchSuperclasses() {
        FailureHandlers<String> handlers = FailureHandlers.single(FileNotFoundException.class, e -> "missing");

        assertThat(handlers.handles(new IOException())).isFalse();
    }

    @Test
    public void shouldSubstituteNullForTypeWithoutHandler() throws Exception {
        FailureHandlers<Integer> handlers = FailureHandlers.<Integer>builder()
                .on(IllegalArgumentException.class)
                .build();

        assertThat(handlers.handles(new IllegalArgumentException())).isTrue();
        assertThat(handlers.handle(new IllegalArgumentException())).isNull();
    }

    @Test
    public void shouldPropagateWhatTheHandlerThrows() {
        IllegalStateException rethrown = new IllegalStateException("from handler");
        FailureHandlers<Integer> handlers = FailureHandlers.single(IOException.class, e -> {
            throw rethrown;
        });

        assertThatThrownBy(() -> handlers.handle(new IOException())).isSameAs(rethrown);
    }

    @Test
    public void shouldHandleNothingWhenEmpty() {
        FailureHandlers<Object> handlers = FailureHandlers.none();

        assertThat(handlers.isEmpty()).isTrue();
        assertThat(handlers.handles(new RuntimeException())).isFalse();
        assertThat(handlers.handles(null)).isFalse();
    }

    @Test
    public void shouldRejectMissingType() {
        assertThatThrownBy(() -> FailureHandlers.builder().on(null, e -> null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
