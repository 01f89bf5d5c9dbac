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
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds masked client-to-server frames.
 */
final class FrameEncoder {

    private static final int FIN = 0x80;
    private static final int MASK_BIT = 0x80;

    ByteBuffer close(final int code, final String reason) {
        final ByteBuffer reasonBuf = reason != null && !reason.isEmpty()
                ? StandardCharsets.UTF_8.encode(reason)
                : ByteBuffer.allocate(0);
        final ByteBuffer p = ByteBuffer.allocate(2 + reasonBuf.remaining());
        p.put((byte) (code >> 8 & 0xFF)).put((byte) (code & 0xFF));
        if (reasonBuf.hasRemaining()) {
            p.put(reasonBuf);
        }
        p.flip();
        return frame(WsOpcode.CLOSE, p, true);
    }

    /**
     * Close frame without status code, the reply to a close frame that carried none.
     */
    ByteBuffer emptyClose() {
        return frame(WsOpcode.CLOSE, null, true);
    }

    ByteBuffer pong(final ByteBuffer payload) {
        return frame(WsOpcode.PONG, payload, true);
    }

    ByteBuffer frame(final int opcode, final ByteBuffer payload, final boolean fin) {
        final int len = payload == null ? 0 : payload.remaining();
        final int hdrExtra = len <= 125 ? 0 : len <= 0xFFFF ? 2 : 8;
        final ByteBuffer out = ByteBuffer.allocate(2 + hdrExtra + 4 + len);

        out.put((byte) ((fin ? FIN : 0) | opcode & 0x0F));
        if (len <= 125) {
            out.put((byte) (MASK_BIT | len));
        } else if (len <= 0xFFFF) {
            out.put((byte) (MASK_BIT | 126));
            out.putShort((short) len);
        } else {
            out.put((byte) (MASK_BIT | 127));
            out.putLong(len);
        }

        final byte[] mkey = new byte[4];
        ThreadLocalRandom.current().nextBytes(mkey);
        out.put(mkey);

        if (len > 0) {
            final int pos = payload.position();
            final int lim = payload.limit();
            for (int i = pos; i < lim; i++) {
                out.put((byte) (payload.get(i) ^ mkey[i - pos & 3]));
            }
            payload.position(lim);
        }
        out.flip();
        return out;
    }

}
