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

import java.io.Closeable;
import java.io.IOException;

/**
 * Full-duplex message channel to the real-time service, as seen by the receive loop.
 * <p>
 * A transport is owned by exactly one receive loop; it is not safe for concurrent use.
 *
 * @since 1.0
 */
public interface RtmTransport extends Closeable {

    /**
     * Blocks until payload bytes, a close frame or an error arrive.
     * <p>
     * At most {@code buffer.length} bytes are returned per call. A message larger than
     * the buffer, or sent in several fragments, is returned over several calls; only the
     * last one reports {@link IncomingFrame#isEndOfMessage()}. After a close frame has been
     * returned the transport must not be read again.
     *
     * @param buffer destination of the payload bytes
     * @param signal consulted between blocking reads
     * @return the received frame
     * @throws ReceiveCancelledException if {@code signal} requested cancellation
     * @throws IOException on I/O or protocol errors
     */
    IncomingFrame receive(byte[] buffer, CancellationSignal signal) throws IOException;

    boolean isOpen();

    /**
     * Releases the channel, sending a normal close frame first if none has been exchanged.
     */
    @Override
    void close() throws IOException;

}
