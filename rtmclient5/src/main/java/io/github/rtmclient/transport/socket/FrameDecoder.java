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

import java.nio.ByteBuffer;

/**
 * Incremental RFC 6455 decoder for server-to-client frames, no extensions negotiated.
 * <p>
 * {@link #decode(ByteBuffer)} consumes one whole frame, or nothing if the buffer does not
 * hold a complete frame yet.
 */
final class FrameDecoder {

    private final int maxFrameSize;

    private int opcode;
    private boolean fin;
    private ByteBuffer payload = ByteBuffer.allocate(0);

    FrameDecoder(final int maxFrameSize) {
        this.maxFrameSize = maxFrameSize;
    }

    boolean decode(final ByteBuffer in) throws WsProtocolException {
        in.mark();
        if (in.remaining() < 2) {
            in.reset();
            return false;
        }

        final int b0 = in.get() & 0xFF;
        final int b1 = in.get() & 0xFF;
        final boolean frameFin = (b0 & 0x80) != 0;
        final int frameOpcode = b0 & 0x0F;

        if ((b0 & 0x70) != 0) {
            throw new WsProtocolException(1002, "RSV bits set without extension");
        }
        if (!WsOpcode.isKnown(frameOpcode)) {
            throw new WsProtocolException(1002, "Reserved/unknown opcode: 0x" + Integer.toHexString(frameOpcode));
        }
        // RFC 6455 section 5.1: server-to-client frames MUST NOT be masked
        if ((b1 & 0x80) != 0) {
            throw new WsProtocolException(1002, "Server frame is masked");
        }

        long len = b1 & 0x7F;
        if (len == 126) {
            if (in.remaining() < 2) {
                in.reset();
                return false;
            }
            len = in.getShort() & 0xFFFF;
        } else if (len == 127) {
            if (in.remaining() < 8) {
                in.reset();
                return false;
            }
            final long l = in.getLong();
            if (l < 0) {
                throw new WsProtocolException(1002, "Invalid 64-bit length");
            }
            len = l;
        }

        if (WsOpcode.isControl(frameOpcode)) {
            if (!frameFin) {
                throw new WsProtocolException(1002, "Fragmented control frame");
            }
            if (len > 125) {
                throw new WsProtocolException(1002, "Control frame too large: " + len);
            }
            if (frameOpcode == WsOpcode.CLOSE && len == 1) {
                throw new WsProtocolException(1002, "Close frame payload of length 1");
            }
        }

        if (len > Integer.MAX_VALUE || maxFrameSize > 0 && len > maxFrameSize) {
            throw new WsProtocolException(1009, "Frame too large: " + len);
        }
        if (in.remaining() < len) {
            in.reset();
            return false;
        }

        final ByteBuffer data = ByteBuffer.allocate((int) len);
        final int limit = in.limit();
        in.limit(in.position() + (int) len);
        data.put(in);
        in.limit(limit);
        data.flip();

        fin = frameFin;
        opcode = frameOpcode;
        payload = data;
        return true;
    }

    int opcode() {
        return opcode;
    }

    boolean fin() {
        return fin;
    }

    ByteBuffer payload() {
        return payload.asReadOnlyBuffer();
    }

}
