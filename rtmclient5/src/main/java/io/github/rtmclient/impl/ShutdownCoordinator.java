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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import io.github.rtmclient.transport.CancellationSignal;

/**
 * Cancellation flag and completion signal for one connection.
 * <p>
 * Completion is signalled exactly once, when the receive loop has fully exited.
 */
public final class ShutdownCoordinator implements CancellationSignal {

    private final AtomicBoolean cancelled;
    private final CompletableFuture<Void> completion;

    public ShutdownCoordinator() {
        this.cancelled = new AtomicBoolean(false);
        this.completion = new CompletableFuture<>();
    }

    /**
     * @return {@code true} if this call requested cancellation, {@code false} if it was
     * already requested.
     */
    public boolean requestCancellation() {
        return cancelled.compareAndSet(false, true);
    }

    @Override
    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    public void complete() {
        completion.complete(null);
    }

    public boolean isCompleted() {
        return completion.isDone();
    }

    /**
     * Blocks until {@link #complete()} is called. Interrupts do not cut the wait short;
     * the interrupt status is restored before returning.
     */
    public void awaitCompletion() {
        boolean interrupted = false;
        try {
            for (;;) {
                try {
                    completion.get();
                    return;
                } catch (final InterruptedException ex) {
                    interrupted = true;
                } catch (final ExecutionException ex) {
                    throw new IllegalStateException("Unexpected completion failure", ex.getCause());
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

}
