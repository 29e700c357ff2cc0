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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Result of applying an event to a {@link CircuitBreakerStatus}: the next status and the side effects the breaker
 * must run once the new status is published.
 */
public final class Transition {
    public enum Effect {
        OPENED,
        SCHEDULE_PROBE,
        EXHAUSTED,
        HALF_OPENED,
        CLOSED,
        CANCEL_PROBE
    }

    private final CircuitBreakerStatus previous;
    private final CircuitBreakerStatus status;
    private final Set<Effect> effects;

    Transition(final CircuitBreakerStatus previous, final CircuitBreakerStatus status, final Effect... effects) {
        this.previous = previous;
        this.status = status;
        this.effects = effects.length == 0 ?
                Collections.emptySet() : Collections.unmodifiableSet(EnumSet.of(effects[0], effects));
    }

    public CircuitBreakerStatus getPrevious() {
        return previous;
    }

    public CircuitBreakerStatus getStatus() {
        return status;
    }

    public Set<Effect> getEffects() {
        return effects;
    }

    public boolean has(final Effect effect) {
        return effects.contains(effect);
    }

    public boolean isStateChange() {
        return previous.getState() != status.getState();
    }

    @Override
    public String toString() {
        return "Transition{" + previous.getState() + " -> " + status + ", effects=" + effects + '}';
    }
}
