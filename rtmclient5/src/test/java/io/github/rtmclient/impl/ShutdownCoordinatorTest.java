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

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

class ShutdownCoordinatorTest {

    @Test
    void cancellation_is_requested_once() {
        final ShutdownCoordinator coordinator = new ShutdownCoordinator();
        assertFalse(coordinator.isCancellationRequested());
        assertTrue(coordinator.requestCancellation());
        assertFalse(coordinator.requestCancellation());
        assertTrue(coordinator.isCancellationRequested());
    }

    @Test
    void await_blocks_until_complete() throws Exception {
        final ShutdownCoordinator coordinator = new ShutdownCoordinator();
        final CountDownLatch returned = new CountDownLatch(1);
        final Thread waiter = new Thread(() -> {
            coordinator.awaitCompletion();
            returned.countDown();
        });
        waiter.start();

        assertFalse(returned.await(100, TimeUnit.MILLISECONDS));
        coordinator.complete();
        assertTrue(returned.await(5, TimeUnit.SECONDS));
        assertTrue(coordinator.isCompleted());
    }

    @Test
    void interrupt_does_not_cut_the_wait_short() throws Exception {
        final ShutdownCoordinator coordinator = new ShutdownCoordinator();
        final CountDownLatch returned = new CountDownLatch(1);
        final AtomicBoolean interruptedAfter = new AtomicBoolean();
        final Thread waiter = new Thread(() -> {
            coordinator.awaitCompletion();
            interruptedAfter.set(Thread.currentThread().isInterrupted());
            returned.countDown();
        });
        waiter.start();

        waiter.interrupt();
        assertFalse(returned.await(100, TimeUnit.MILLISECONDS));
        coordinator.complete();
        assertTrue(returned.await(5, TimeUnit.SECONDS));
        assertTrue(interruptedAfter.get());
    }

    @Test
    void completing_twice_is_harmless() {
        final ShutdownCoordinator coordinator = new ShutdownCoordinator();
        coordinator.complete();
        coordinator.complete();
        coordinator.awaitCompletion();
        assertTrue(coordinator.isCompleted());
    }

}
