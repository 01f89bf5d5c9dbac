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
package io.github.rtmclient.client;

import java.io.Closeable;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.concurrent.ThreadFactory;

import io.github.rtmclient.api.RtmConnectResult;
import io.github.rtmclient.api.RtmEventListener;
import io.github.rtmclient.api.RtmEventType;
import io.github.rtmclient.api.RunState;
import io.github.rtmclient.api.Subscription;
import io.github.rtmclient.impl.FrameReceiver;
import io.github.rtmclient.impl.MessageRouter;
import io.github.rtmclient.impl.RunStateMachine;
import io.github.rtmclient.impl.ShutdownCoordinator;
import io.github.rtmclient.impl.SubscriptionRegistry;
import io.github.rtmclient.transport.HandshakeTimeoutException;
import io.github.rtmclient.transport.RtmTransport;
import io.github.rtmclient.transport.RtmTransportFactory;
import io.github.rtmclient.transport.socket.JdkSocketConnector;
import io.github.rtmclient.transport.socket.SocketTransportFactory;

import org.apache.hc.core5.concurrent.DefaultThreadFactory;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for one real-time messaging connection at a time.
 * <p>
 * {@link #connect(URI, int)} performs the handshake on the calling thread and then hands
 * the connection to a dedicated receiver thread, which publishes events to the
 * subscribed listeners in the order messages complete. Listeners run on the receiver
 * thread and must not block it for long.
 * <p>
 * A client goes through {@code STOPPED -> STARTING -> STARTED -> STOPPING -> STOPPED}
 * for every connection and can be connected again once stopped. All methods are
 * thread-safe.
 */
public class RtmClient implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(RtmClient.class);

    /**
     * Timeout value meaning the handshake is not bounded.
     */
    public static final int INFINITE_TIMEOUT = -1;

    private final RtmClientConfig config;
    private final RtmTransportFactory transportFactory;
    private final SubscriptionRegistry registry;
    private final RunStateMachine stateMachine;
    private final MessageRouter router;
    private final ThreadFactory threadFactory;

    private volatile int readBufferSize;
    private volatile long maxMessageSize;
    private volatile ShutdownCoordinator activeShutdown;
    private volatile Thread receiverThread;

    public RtmClient() {
        this(RtmClientConfig.DEFAULT);
    }

    public RtmClient(final RtmClientConfig config) {
        this(config, new SocketTransportFactory(
                new JdkSocketConnector(),
                Args.notNull(config, "Config").getMaxFrameSize(),
                config.getReceivePollInterval()));
    }

    public RtmClient(final RtmClientConfig config, final RtmTransportFactory transportFactory) {
        this.config = Args.notNull(config, "Config");
        this.transportFactory = Args.notNull(transportFactory, "Transport factory");
        this.registry = new SubscriptionRegistry(config.getListenerExceptionCallback());
        this.stateMachine = new RunStateMachine(registry);
        this.router = new MessageRouter(registry);
        this.threadFactory = new DefaultThreadFactory(config.getThreadNamePrefix(), true);
        this.readBufferSize = config.getReadBufferSize();
        this.maxMessageSize = config.getMaxMessageSize();
    }

    public RunState getRunState() {
        return stateMachine.getState();
    }

    public RtmClientConfig getConfig() {
        return config;
    }

    public int getReadBufferSize() {
        return readBufferSize;
    }

    /**
     * @throws IllegalArgumentException if {@code size < 1}.
     * @throws IllegalStateException if the client is not {@link RunState#STOPPED}.
     */
    public void setReadBufferSize(final int size) {
        Args.positive(size, "Read buffer size");
        stateMachine.runIfStopped(() -> readBufferSize = size);
    }

    public long getMaxMessageSize() {
        return maxMessageSize;
    }

    /**
     * Caps the size of a reassembled message; {@code 0} disables the cap.
     *
     * @throws IllegalArgumentException if {@code size} is negative.
     * @throws IllegalStateException if the client is not {@link RunState#STOPPED}.
     */
    public void setMaxMessageSize(final long size) {
        Args.notNegative(size, "Max message size");
        stateMachine.runIfStopped(() -> maxMessageSize = size);
    }

    public <T> Subscription subscribe(final RtmEventType<T> type, final RtmEventListener<? super T> listener) {
        return registry.subscribe(type, listener);
    }

    public <T> boolean unsubscribe(final RtmEventType<T> type, final RtmEventListener<? super T> listener) {
        return registry.unsubscribe(type, listener);
    }

    public RtmConnectResult connect(final URI endpoint) {
        return connect(endpoint, defaultTimeoutMillis());
    }

    int defaultTimeoutMillis() {
        final long ms = config.getConnectTimeout().toMilliseconds();
        return ms <= 0 ? INFINITE_TIMEOUT : (int) Math.min(ms, Integer.MAX_VALUE);
    }

    public RtmConnectResult connect(final String endpoint, final int timeoutMillis) {
        Args.notNull(endpoint, "Endpoint");
        return connect(URI.create(endpoint), timeoutMillis);
    }

    /**
     * Opens a connection and starts receiving.
     *
     * @param endpoint      {@code ws} or {@code wss} URI, usually obtained from {@code rtm.connect}.
     * @param timeoutMillis handshake bound in milliseconds, {@link #INFINITE_TIMEOUT} for none.
     * @return {@code SUCCESS} once the receiver runs; {@code INVALID_RUNNING_STATE} carrying the
     * observed state if the client was not stopped; {@code HANDSHAKE_TIMEOUT} or
     * {@code HANDSHAKE_FAILED} carrying the cause if the connection could not be established.
     */
    public RtmConnectResult connect(final URI endpoint, final int timeoutMillis) {
        Args.notNull(endpoint, "Endpoint");
        Args.check(timeoutMillis >= INFINITE_TIMEOUT, "Timeout must be >= -1: %s", timeoutMillis);

        final RunState observed = stateMachine.claim(RunState.STOPPED, RunState.STARTING);
        if (observed != RunState.STOPPED) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Connect rejected, client is {}", observed);
            }
            return RtmConnectResult.invalidRunningState(observed);
        }

        final RtmTransport transport;
        try {
            transport = openTransport(endpoint, timeoutMillis);
        } catch (final SocketTimeoutException ex) {
            stateMachine.transition(RunState.STARTING, RunState.STOPPED);
            LOG.error("Handshake with {} timed out after {} ms", endpoint, timeoutMillis);
            return RtmConnectResult.handshakeTimeout(ex);
        } catch (final IOException | IllegalArgumentException ex) {
            stateMachine.transition(RunState.STARTING, RunState.STOPPED);
            if (LOG.isDebugEnabled()) {
                LOG.debug("Handshake with {} failed", endpoint, ex);
            }
            return RtmConnectResult.handshakeFailed(ex);
        } catch (final RuntimeException ex) {
            stateMachine.transition(RunState.STARTING, RunState.STOPPED);
            throw ex;
        }

        final ShutdownCoordinator shutdown = new ShutdownCoordinator();
        final FrameReceiver receiver = new FrameReceiver(
                transport, stateMachine, router, registry, shutdown, readBufferSize, maxMessageSize);
        final Thread thread = threadFactory.newThread(receiver);
        activeShutdown = shutdown;
        receiverThread = thread;
        stateMachine.transition(RunState.STARTING, RunState.STARTED);
        try {
            thread.start();
        } catch (final RuntimeException ex) {
            // runs the exit path synchronously: transport released, state back to STOPPED
            shutdown.requestCancellation();
            receiver.run();
            throw ex;
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Connected to {}", endpoint);
        }
        return RtmConnectResult.success();
    }

    private RtmTransport openTransport(final URI endpoint, final int timeoutMillis) throws IOException {
        if (timeoutMillis == 0) {
            throw new HandshakeTimeoutException("Handshake timeout of 0 ms already elapsed");
        }
        final Timeout timeout = timeoutMillis == INFINITE_TIMEOUT
                ? Timeout.DISABLED
                : Timeout.ofMilliseconds(timeoutMillis);
        return transportFactory.open(endpoint, timeout);
    }

    /**
     * Stops the active connection and waits until the receiver has exited, the transport
     * is released and the client is {@link RunState#STOPPED}.
     * <p>
     * Cancellation is observed at the next receive boundary of the receiver. When called
     * from a listener, that is on the receiver thread, the method returns without waiting.
     *
     * @return {@code true} if this call stopped the connection, {@code false} if the client
     * was not {@link RunState#STARTED}.
     */
    public boolean disconnect() {
        if (stateMachine.getState() != RunState.STARTED) {
            return false;
        }
        final RunState observed = stateMachine.claim(RunState.STARTED, RunState.STOPPING);
        if (observed != RunState.STARTED) {
            return false;
        }
        final ShutdownCoordinator shutdown = activeShutdown;
        shutdown.requestCancellation();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Disconnect requested");
        }
        if (Thread.currentThread() == receiverThread) {
            return true;
        }
        shutdown.awaitCompletion();
        return true;
    }

    @Override
    public void close() {
        disconnect();
    }

    @Override
    public String toString() {
        return "RtmClient{state=" + stateMachine.getState() + "}";
    }

}
