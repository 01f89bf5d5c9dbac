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

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

import io.github.rtmclient.api.RtmEventListener;
import io.github.rtmclient.api.RtmEventType;
import io.github.rtmclient.api.Subscription;

import org.apache.hc.core5.function.Callback;
import org.apache.hc.core5.util.Args;

/**
 * Per event type ordered listener sets.
 * <p>
 * Listeners may be added or removed from any thread, including from inside a listener;
 * a dispatch in progress keeps iterating the set it started with.
 */
public final class SubscriptionRegistry {

    private final Map<RtmEventType<?>, Set<RtmEventListener<?>>> listeners;
    private final Callback<Exception> exceptionCallback;

    public SubscriptionRegistry(final Callback<Exception> exceptionCallback) {
        this.listeners = new ConcurrentHashMap<>();
        this.exceptionCallback = Args.notNull(exceptionCallback, "Exception callback");
    }

    public <T> Subscription subscribe(final RtmEventType<T> type, final RtmEventListener<? super T> listener) {
        Args.notNull(type, "Event type");
        Args.notNull(listener, "Listener");
        listeners.computeIfAbsent(type, k -> new CopyOnWriteArraySet<>()).add(listener);
        return new Subscription() {

            @Override
            public RtmEventType<?> getType() {
                return type;
            }

            @Override
            public boolean cancel() {
                return unsubscribe(type, listener);
            }

        };
    }

    public <T> boolean unsubscribe(final RtmEventType<T> type, final RtmEventListener<? super T> listener) {
        Args.notNull(type, "Event type");
        Args.notNull(listener, "Listener");
        final Set<RtmEventListener<?>> set = listeners.get(type);
        return set != null && set.remove(listener);
    }

    public boolean hasListeners(final RtmEventType<?> type) {
        final Set<RtmEventListener<?>> set = listeners.get(type);
        return set != null && !set.isEmpty();
    }

    /**
     * Invokes the listeners of {@code type} in subscription order on the calling thread.
     * A listener failure is passed to the exception callback and does not stop delivery
     * to the remaining listeners.
     */
    @SuppressWarnings("unchecked")
    public <T> void publish(final RtmEventType<T> type, final T event) {
        final Set<RtmEventListener<?>> set = listeners.get(type);
        if (set == null) {
            return;
        }
        for (final RtmEventListener<?> listener : set) {
            try {
                ((RtmEventListener<T>) listener).onEvent(event);
            } catch (final Exception ex) {
                exceptionCallback.execute(ex);
            }
        }
    }

}
