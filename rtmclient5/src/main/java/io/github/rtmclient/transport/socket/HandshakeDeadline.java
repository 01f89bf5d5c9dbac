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
package io.github.rtmclient.transport.socket;

import java.util.concurrent.TimeUnit;

import io.github.rtmclient.transport.HandshakeTimeoutException;

import org.apache.hc.core5.util.Timeout;

/**
 * One time bound shared by every blocking step of the handshake.
 */
final class HandshakeDeadline {

    private final Timeout timeout;
    private final boolean bounded;
    private final long expiryNanos;

    private HandshakeDeadline(final Timeout timeout) {
        this.timeout = timeout;
        this.bounded = timeout != null && timeout.toMilliseconds() > 0;
        this.expiryNanos = bounded ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeout.toMilliseconds()) : 0L;
    }

    static HandshakeDeadline start(final Timeout timeout) {
        return new HandshakeDeadline(timeout);
    }

    /**
     * Remaining time as a socket timeout, {@code 0} when unbounded.
     *
     * @throws HandshakeTimeoutException if the deadline has passed
     */
    int remainingMillis() throws HandshakeTimeoutException {
        if (!bounded) {
            return 0;
        }
        final long remaining = TimeUnit.NANOSECONDS.toMillis(expiryNanos - System.nanoTime());
        if (remaining <= 0) {
            throw expired(null);
        }
        return remaining > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) remaining;
    }

    Timeout remainingTimeout() throws HandshakeTimeoutException {
        final int ms = remainingMillis();
        return ms > 0 ? Timeout.ofMilliseconds(ms) : Timeout.DISABLED;
    }

    HandshakeTimeoutException expired(final Throwable cause) {
        return new HandshakeTimeoutException("Handshake did not complete within " + timeout, cause);
    }

}
