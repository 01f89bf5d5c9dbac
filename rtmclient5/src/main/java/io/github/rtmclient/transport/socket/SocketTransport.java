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

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.net.ssl.SSLSocket;

import io.github.rtmclient.transport.CancellationSignal;
import io.github.rtmclient.transport.FrameOpcode;
import io.github.rtmclient.transport.IncomingFrame;
import io.github.rtmclient.transport.ReceiveCancelledException;
import io.github.rtmclient.transport.RtmTransport;

import org.apache.hc.core5.util.Args;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RtmTransport} over a blocking socket that already completed the Upgrade exchange.
 * <p>
 * The socket read timeout doubles as the cancellation poll interval: a timed out read makes
 * {@link #receive(byte[], CancellationSignal)} re-check the signal and read again. Control
 * frames are handled here and never reach the caller, except for CLOSE.
 */
final class SocketTransport implements RtmTransport {

    private static final Logger LOG = LoggerFactory.getLogger(SocketTransport.class);

    private static final int MAX_HEADER_SIZE = 14;
    private static final int MAX_BUFFER_SIZE = Integer.MAX_VALUE - 8;
    private static final int DEFAULT_CLOSE_LINGER_MILLIS = 250;

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final FrameDecoder decoder;
    private final FrameEncoder encoder;
    private final int maxBufferSize;
    private final AtomicBoolean open;
    private final Object writeLock;

    private ByteBuffer inbuf;
    private ByteBuffer pending;
    private FrameOpcode pendingOpcode;
    private boolean pendingFin;
    private int messageOpcode;
    private volatile boolean closeSent;

    SocketTransport(final Socket socket, final byte[] leftover, final int maxFrameSize) throws IOException {
        this.socket = Args.notNull(socket, "Socket");
        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
        this.decoder = new FrameDecoder(maxFrameSize);
        this.encoder = new FrameEncoder();
        this.maxBufferSize = maxFrameSize > 0
                ? (int) Math.min((long) maxFrameSize + MAX_HEADER_SIZE, MAX_BUFFER_SIZE)
                : MAX_BUFFER_SIZE;
        this.open = new AtomicBoolean(true);
        this.writeLock = new Object();
        final int initial = Math.max(8192, leftover != null ? leftover.length : 0);
        this.inbuf = ByteBuffer.allocate(initial);
        if (leftover != null && leftover.length > 0) {
            this.inbuf.put(leftover);
        }
        this.inbuf.flip();
        this.messageOpcode = -1;
    }

    @Override
    public IncomingFrame receive(final byte[] buffer, final CancellationSignal signal) throws IOException {
        Args.notNull(buffer, "Buffer");
        Args.check(buffer.length > 0, "Buffer may not be empty");
        final CancellationSignal cancellation = signal != null ? signal : CancellationSignal.NONE;
        for (;;) {
            if (cancellation.isCancellationRequested()) {
                throw new ReceiveCancelledException("Receive cancelled");
            }
            if (pending != null) {
                return deliverPending(buffer);
            }
            if (decoder.decode(inbuf)) {
                final IncomingFrame frame = onFrame();
                if (frame != null) {
                    return frame;
                }
                continue;
            }
            if (!open.get()) {
                throw new EOFException("Transport closed");
            }
            fill();
        }
    }

    private IncomingFrame deliverPending(final byte[] buffer) {
        final int n = Math.min(buffer.length, pending.remaining());
        pending.get(buffer, 0, n);
        final boolean last = !pending.hasRemaining();
        final IncomingFrame frame = IncomingFrame.data(pendingOpcode, n, last && pendingFin);
        if (last) {
            pending = null;
        }
        return frame;
    }

    private IncomingFrame onFrame() throws IOException {
        final int op = decoder.opcode();
        final boolean fin = decoder.fin();
        switch (op) {
            case WsOpcode.PING:
                if (LOG.isDebugEnabled()) {
                    LOG.debug("PING received, sending PONG");
                }
                send(encoder.pong(decoder.payload()));
                return null;
            case WsOpcode.PONG:
                return null;
            case WsOpcode.CLOSE: {
                final ByteBuffer payload = decoder.payload();
                final int code = CloseCodec.readCloseCode(payload);
                final String reason = CloseCodec.readCloseReason(payload);
                if (LOG.isDebugEnabled()) {
                    LOG.debug("CLOSE received: {} {}", code, reason);
                }
                echoClose(code);
                return IncomingFrame.close(code, reason);
            }
            case WsOpcode.CONT:
                if (messageOpcode < 0) {
                    throw new WsProtocolException(1002, "Continuation frame without a message in progress");
                }
                return startChunked(messageOpcode, fin);
            case WsOpcode.TEXT:
            case WsOpcode.BINARY:
                if (messageOpcode >= 0) {
                    throw new WsProtocolException(1002, "New data frame while a fragmented message is in progress");
                }
                messageOpcode = op;
                return startChunked(op, fin);
            default:
                throw new WsProtocolException(1002, "Unexpected opcode: " + op);
        }
    }

    private IncomingFrame startChunked(final int op, final boolean fin) {
        if (fin) {
            messageOpcode = -1;
        }
        pending = decoder.payload();
        pendingOpcode = op == WsOpcode.TEXT ? FrameOpcode.TEXT : FrameOpcode.BINARY;
        pendingFin = fin;
        if (!pending.hasRemaining()) {
            pending = null;
            return IncomingFrame.data(pendingOpcode, 0, fin);
        }
        return null;
    }

    private void fill() throws IOException {
        inbuf.compact();
        if (!inbuf.hasRemaining()) {
            if (inbuf.capacity() >= maxBufferSize) {
                inbuf.flip();
                throw new WsProtocolException(1009, "Frame exceeds buffer limit of " + maxBufferSize + " bytes");
            }
            final int grown = (int) Math.min((long) inbuf.capacity() * 2, maxBufferSize);
            final ByteBuffer bigger = ByteBuffer.allocate(grown);
            inbuf.flip();
            bigger.put(inbuf);
            inbuf = bigger;
        }
        final int n;
        try {
            n = in.read(inbuf.array(), inbuf.arrayOffset() + inbuf.position(), inbuf.remaining());
        } catch (final SocketTimeoutException ex) {
            inbuf.flip();
            return;
        }
        if (n < 0) {
            inbuf.flip();
            throw new EOFException("Connection closed by peer without a CLOSE frame");
        }
        inbuf.position(inbuf.position() + n);
        inbuf.flip();
    }

    private void echoClose(final int code) {
        if (closeSent) {
            return;
        }
        try {
            send(code == CloseCodec.NO_STATUS ? encoder.emptyClose() : encoder.close(code, ""));
        } catch (final IOException ex) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Could not echo CLOSE: {}", ex.getMessage());
            }
        }
    }

    private void send(final ByteBuffer frame) throws IOException {
        synchronized (writeLock) {
            if (frame.get(0) == (byte) (0x80 | WsOpcode.CLOSE)) {
                closeSent = true;
            }
            out.write(frame.array(), frame.arrayOffset() + frame.position(), frame.remaining());
            out.flush();
        }
    }

    @Override
    public boolean isOpen() {
        return open.get() && !socket.isClosed();
    }

    /**
     * Sends a normal closure unless a CLOSE frame already went out, then waits a bounded
     * time for the server to close the TCP connection before closing the socket.
     */
    @Override
    public void close() throws IOException {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        try {
            if (!closeSent) {
                send(encoder.close(1000, ""));
            }
            awaitPeerClose();
        } catch (final IOException ex) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Could not complete closing handshake: {}", ex.getMessage());
            }
        } finally {
            socket.close();
        }
    }

    /**
     * Half-closes the output and discards input until the server closes its side or the
     * linger time, one receive poll interval, runs out.
     */
    private void awaitPeerClose() throws IOException {
        final int linger = socket.getSoTimeout() > 0 ? socket.getSoTimeout() : DEFAULT_CLOSE_LINGER_MILLIS;
        final long deadline = System.currentTimeMillis() + linger;
        if (!(socket instanceof SSLSocket)) {
            socket.shutdownOutput();
        }
        final byte[] scratch = new byte[1024];
        for (;;) {
            final long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Server did not close the connection within {} ms", linger);
                }
                return;
            }
            socket.setSoTimeout((int) remaining);
            try {
                if (in.read(scratch) < 0) {
                    return;
                }
            } catch (final SocketTimeoutException ex) {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Server did not close the connection within {} ms", linger);
                }
                return;
            }
        }
    }

}
