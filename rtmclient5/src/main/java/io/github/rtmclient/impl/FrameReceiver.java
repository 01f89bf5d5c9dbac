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

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import io.github.rtmclient.api.CloseEvent;
import io.github.rtmclient.api.CloseReason;
import io.github.rtmclient.api.MessageTooLargeException;
import io.github.rtmclient.api.RtmEventType;
import io.github.rtmclient.api.RunState;
import io.github.rtmclient.transport.FrameOpcode;
import io.github.rtmclient.transport.IncomingFrame;
import io.github.rtmclient.transport.ReceiveCancelledException;
import io.github.rtmclient.transport.RtmTransport;

import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.ByteArrayBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receive loop of one connection.
 * <p>
 * Pulls frames off the transport, reassembles fragmented messages and hands every
 * complete text message to the {@link MessageRouter}. The loop ends on a CLOSE frame,
 * a transport failure or cancellation; on every path it then releases the transport,
 * publishes exactly one {@link RtmEventType#CLOSED} event, moves the client back to
 * {@link RunState#STOPPED} and signals completion, in that order.
 */
public final class FrameReceiver implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(FrameReceiver.class);

    private final RtmTransport transport;
    private final RunStateMachine stateMachine;
    private final MessageRouter router;
    private final SubscriptionRegistry registry;
    private final ShutdownCoordinator shutdown;
    private final byte[] readBuffer;
    private final long maxMessageSize;

    // reassembly arena, reused across messages
    private final ByteArrayBuffer message;
    private boolean assembling;
    private FrameOpcode messageOpcode;

    public FrameReceiver(
            final RtmTransport transport,
            final RunStateMachine stateMachine,
            final MessageRouter router,
            final SubscriptionRegistry registry,
            final ShutdownCoordinator shutdown,
            final int readBufferSize,
            final long maxMessageSize) {
        this.transport = Args.notNull(transport, "Transport");
        this.stateMachine = Args.notNull(stateMachine, "State machine");
        this.router = Args.notNull(router, "Message router");
        this.registry = Args.notNull(registry, "Subscription registry");
        this.shutdown = Args.notNull(shutdown, "Shutdown coordinator");
        this.readBuffer = new byte[Args.positive(readBufferSize, "Read buffer size")];
        this.maxMessageSize = Args.notNegative(maxMessageSize, "Max message size");
        this.message = new ByteArrayBuffer(readBufferSize);
    }

    @Override
    public void run() {
        CloseEvent closeEvent = null;
        try {
            closeEvent = receiveLoop();
        } catch (final ReceiveCancelledException ex) {
            closeEvent = new CloseEvent(CloseReason.USER_REQUESTED, null);
        } catch (final IOException | RuntimeException ex) {
            if (shutdown.isCancellationRequested()) {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Receive failed after cancellation: {}", ex.getMessage());
                }
                closeEvent = new CloseEvent(CloseReason.USER_REQUESTED, null);
            } else {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Receive failed", ex);
                }
                closeEvent = new CloseEvent(CloseReason.FAULT, ex);
            }
        } catch (final Error err) {
            closeEvent = new CloseEvent(CloseReason.FAULT, err);
            throw err;
        } finally {
            exit(closeEvent != null ? closeEvent : new CloseEvent(CloseReason.USER_REQUESTED, null));
        }
    }

    private CloseEvent receiveLoop() throws IOException {
        while (!shutdown.isCancellationRequested()) {
            final IncomingFrame frame = transport.receive(readBuffer, shutdown);
            if (frame.getOpcode() == FrameOpcode.CLOSE) {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Connection closed by server: {}", frame);
                }
                return new CloseEvent(CloseReason.REMOTE_CLOSE, null);
            }
            onDataFrame(frame);
        }
        return new CloseEvent(CloseReason.USER_REQUESTED, null);
    }

    private void onDataFrame(final IncomingFrame frame) throws MessageTooLargeException {
        final int count = frame.getCount();
        if (!frame.isEndOfMessage()) {
            if (!assembling) {
                assembling = true;
                messageOpcode = frame.getOpcode();
            }
            append(count);
            return;
        }
        if (!assembling) {
            checkSize(count);
            deliver(frame.getOpcode(), readBuffer, count);
            return;
        }
        append(count);
        try {
            deliver(messageOpcode, message.array(), message.length());
        } finally {
            message.clear();
            assembling = false;
            messageOpcode = null;
        }
    }

    private void append(final int count) throws MessageTooLargeException {
        checkSize((long) message.length() + count);
        message.append(readBuffer, 0, count);
    }

    private void checkSize(final long size) throws MessageTooLargeException {
        if (maxMessageSize > 0 && size > maxMessageSize) {
            throw new MessageTooLargeException(maxMessageSize);
        }
    }

    private void deliver(final FrameOpcode opcode, final byte[] data, final int len) {
        if (opcode == FrameOpcode.BINARY) {
            if (LOG.isTraceEnabled()) {
                LOG.trace("Binary message of {} bytes ignored", len);
            }
            return;
        }
        router.route(new String(data, 0, len, StandardCharsets.UTF_8));
    }

    /**
     * Each step runs even if an earlier one throws, so the client always ends up
     * {@link RunState#STOPPED} and waiters are always released.
     */
    private void exit(final CloseEvent closeEvent) {
        try {
            try {
                stateMachine.claim(RunState.STARTED, RunState.STOPPING);
            } finally {
                releaseTransport();
            }
        } finally {
            try {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Receive loop exited: {}", closeEvent);
                }
                registry.publish(RtmEventType.CLOSED, closeEvent);
            } finally {
                try {
                    stateMachine.claim(RunState.STOPPING, RunState.STOPPED);
                } finally {
                    shutdown.complete();
                }
            }
        }
    }

    private void releaseTransport() {
        try {
            transport.close();
        } catch (final IOException ex) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Error closing transport: {}", ex.getMessage());
            }
        } catch (final RuntimeException ex) {
            LOG.warn("Unexpected failure closing transport", ex);
        }
    }

}
