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
package io.github.rtmclient.transport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link RtmTransport} fed from a script of frames. An empty script blocks the
 * receiver, polling the cancellation signal like the socket transport does.
 */
public final class ScriptedTransport implements RtmTransport {

    private static final class Step {

        final FrameOpcode opcode;
        final byte[] payload;
        final boolean fin;
        final int closeStatus;
        final IOException failure;

        Step(final FrameOpcode opcode, final byte[] payload, final boolean fin, final int closeStatus, final IOException failure) {
            this.opcode = opcode;
            this.payload = payload;
            this.fin = fin;
            this.closeStatus = closeStatus;
            this.failure = failure;
        }

    }

    private final LinkedBlockingDeque<Step> script = new LinkedBlockingDeque<>();
    private final CountDownLatch idle = new CountDownLatch(1);
    private final CountDownLatch closedLatch = new CountDownLatch(1);
    private final AtomicInteger closeCount = new AtomicInteger();
    private volatile boolean open = true;

    public ScriptedTransport text(final String text, final boolean fin) {
        script.add(new Step(FrameOpcode.TEXT, text.getBytes(StandardCharsets.UTF_8), fin, 0, null));
        return this;
    }

    public ScriptedTransport text(final String text) {
        return text(text, true);
    }

    public ScriptedTransport binary(final byte[] data, final boolean fin) {
        script.add(new Step(FrameOpcode.BINARY, data, fin, 0, null));
        return this;
    }

    public ScriptedTransport remoteClose(final int status) {
        script.add(new Step(FrameOpcode.CLOSE, new byte[0], true, status, null));
        return this;
    }

    public ScriptedTransport fail(final IOException ex) {
        script.add(new Step(null, null, true, 0, ex));
        return this;
    }

    /**
     * Waits until the receiver has consumed the script and is blocked waiting for more.
     */
    public boolean awaitIdle(final long timeout, final TimeUnit unit) throws InterruptedException {
        return idle.await(timeout, unit);
    }

    public boolean awaitClosed(final long timeout, final TimeUnit unit) throws InterruptedException {
        return closedLatch.await(timeout, unit);
    }

    public int getCloseCount() {
        return closeCount.get();
    }

    @Override
    public IncomingFrame receive(final byte[] buffer, final CancellationSignal signal) throws IOException {
        for (;;) {
            if (signal.isCancellationRequested()) {
                throw new ReceiveCancelledException("Receive cancelled");
            }
            final Step step;
            try {
                step = script.pollFirst(20, TimeUnit.MILLISECONDS);
            } catch (final InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new ReceiveCancelledException("Interrupted");
            }
            if (step == null) {
                idle.countDown();
                continue;
            }
            if (step.failure != null) {
                throw step.failure;
            }
            if (step.opcode == FrameOpcode.CLOSE) {
                return IncomingFrame.close(step.closeStatus, "");
            }
            final int n = Math.min(buffer.length, step.payload.length);
            System.arraycopy(step.payload, 0, buffer, 0, n);
            if (n < step.payload.length) {
                script.addFirst(new Step(step.opcode, Arrays.copyOfRange(step.payload, n, step.payload.length),
                        step.fin, 0, null));
                return IncomingFrame.data(step.opcode, n, false);
            }
            return IncomingFrame.data(step.opcode, n, step.fin);
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        closeCount.incrementAndGet();
        closedLatch.countDown();
    }

}
