/*
 * ====================================================================
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 * ====================================================================
 *
 * This software consists of voluntary contributions made by many
 * individuals on behalf of the Apache Software Foundation.  For more
 * information on the Apache Software Foundation, please see
 * <http://www.apache.org/>.
 *
 */
package io.github.rtmclient.impl;

import io.github.rtmclient.api.RtmEventType;
import io.github.rtmclient.api.RunState;
import io.github.rtmclient.api.RunStateChange;

import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Asserts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifecycle of one client: {@code STOPPED -> STARTING -> STARTED -> STOPPING -> STOPPED},
 * plus {@code STARTING -> STOPPED} for a failed handshake.
 * <p>
 * Every transition is a compare-and-set under a single lock and is published as a
 * {@link RtmEventType#RUN_STATE_CHANGED} event while the lock is held, so observers see
 * transitions in the order they happened.
 */
public final class RunStateMachine {

    private static final Logger LOG = LoggerFactory.getLogger(RunStateMachine.class);

    private final Object lock;
    private final SubscriptionRegistry registry;
    private volatile RunState state;

    public RunStateMachine(final SubscriptionRegistry registry) {
        this.lock = new Object();
        this.registry = Args.notNull(registry, "Subscription registry");
        this.state = RunState.STOPPED;
    }

    public RunState getState() {
        return state;
    }

    /**
     * Moves from {@code expected} to {@code next} if the current state is {@code expected}.
     *
     * @return the state observed before the attempt; the transition happened if and only
     * if it equals {@code expected}.
     */
    public RunState claim(final RunState expected, final RunState next) {
        Args.notNull(expected, "Expected state");
        Args.notNull(next, "Next state");
        Args.check(isValidTransition(expected, next), "Invalid transition %s -> %s", expected, next);
        synchronized (lock) {
            final RunState observed = state;
            if (observed != expected) {
                return observed;
            }
            state = next;
            if (LOG.isTraceEnabled()) {
                LOG.trace("Run state {} -> {}", expected, next);
            }
            registry.publish(RtmEventType.RUN_STATE_CHANGED, new RunStateChange(expected, next));
            return observed;
        }
    }

    /**
     * Unconditional transition for the owner of the current state.
     *
     * @throws IllegalStateException if the current state is not {@code expected}.
     */
    public void transition(final RunState expected, final RunState next) {
        final RunState observed = claim(expected, next);
        Asserts.check(observed == expected, "Expected run state %s, was %s", expected, observed);
    }

    /**
     * Runs {@code action} while holding the lock, provided the client is stopped.
     *
     * @throws IllegalStateException if the client is not stopped.
     */
    public void runIfStopped(final Runnable action) {
        synchronized (lock) {
            Asserts.check(state == RunState.STOPPED, "Client is %s, expected STOPPED", state);
            action.run();
        }
    }

    static boolean isValidTransition(final RunState from, final RunState to) {
        switch (from) {
            case STOPPED:
                return to == RunState.STARTING;
            case STARTING:
                return to == RunState.STARTED || to == RunState.STOPPED;
            case STARTED:
                return to == RunState.STOPPING;
            case STOPPING:
                return to == RunState.STOPPED;
            default:
                return false;
        }
    }

}
