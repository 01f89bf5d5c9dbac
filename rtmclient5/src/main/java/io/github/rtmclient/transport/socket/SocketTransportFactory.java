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

import java.io.IOException;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.URI;

import io.github.rtmclient.transport.HandshakeTimeoutException;
import io.github.rtmclient.transport.RtmTransport;
import io.github.rtmclient.transport.RtmTransportFactory;

import org.apache.hc.core5.http.ProtocolException;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens RFC 6455 connections over plain or TLS sockets.
 * <p>
 * TCP connect, TLS handshake and the HTTP Upgrade exchange all share one deadline.
 * Once upgraded, the socket read timeout is set to the receive poll interval.
 */
public final class SocketTransportFactory implements RtmTransportFactory {

    private static final Logger LOG = LoggerFactory.getLogger(SocketTransportFactory.class);

    public static final int DEFAULT_MAX_FRAME_SIZE = 16 * 1024 * 1024;
    public static final Timeout DEFAULT_POLL_INTERVAL = Timeout.ofMilliseconds(250);

    private final WebSocketConnector connector;
    private final int maxFrameSize;
    private final Timeout pollInterval;

    public SocketTransportFactory() {
        this(new JdkSocketConnector(), DEFAULT_MAX_FRAME_SIZE, DEFAULT_POLL_INTERVAL);
    }

    public SocketTransportFactory(final WebSocketConnector connector, final int maxFrameSize, final Timeout pollInterval) {
        this.connector = Args.notNull(connector, "Connector");
        this.maxFrameSize = Args.notNegative(maxFrameSize, "Max frame size");
        this.pollInterval = Args.notNull(pollInterval, "Poll interval");
        Args.check(pollInterval.toMilliseconds() > 0, "Poll interval must be positive");
    }

    @Override
    public RtmTransport open(final URI endpoint, final Timeout handshakeTimeout) throws IOException {
        Args.notNull(endpoint, "Endpoint");
        final String scheme = endpoint.getScheme();
        if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Scheme must be ws or wss: " + endpoint);
        }
        if (endpoint.getHost() == null) {
            throw new IllegalArgumentException("Endpoint has no host: " + endpoint);
        }

        final HandshakeDeadline deadline = HandshakeDeadline.start(handshakeTimeout);
        Socket socket = null;
        try {
            socket = connector.connect(endpoint, deadline.remainingTimeout());
            final UpgradeHandshake.Response response = UpgradeHandshake.execute(socket, endpoint, deadline);
            socket.setSoTimeout(pollInterval.toMillisecondsIntBound());
            if (LOG.isDebugEnabled()) {
                LOG.debug("Connected to {}: {}", endpoint, response.getStatusLine());
            }
            return new SocketTransport(socket, response.getRemaining(), maxFrameSize);
        } catch (final HandshakeTimeoutException ex) {
            closeQuietly(socket);
            throw ex;
        } catch (final SocketTimeoutException ex) {
            closeQuietly(socket);
            throw deadline.expired(ex);
        } catch (final ProtocolException ex) {
            closeQuietly(socket);
            throw new IOException("WebSocket upgrade failed: " + ex.getMessage(), ex);
        } catch (final IOException | RuntimeException ex) {
            closeQuietly(socket);
            throw ex;
        }
    }

    private static void closeQuietly(final Socket socket) {
        if (socket == null) {
            return;
        }
        try {
            socket.close();
        } catch (final IOException ex) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Error closing socket: {}", ex.getMessage());
            }
        }
    }

}
