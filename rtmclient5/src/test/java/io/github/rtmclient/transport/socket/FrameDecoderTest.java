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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

class FrameDecoderTest {

    private static ByteBuffer frame(final int b0, final byte[] payload) {
        final ByteBuffer buf = ByteBuffer.allocate(2 + payload.length);
        buf.put((byte) b0);
        buf.put((byte) payload.length);
        buf.put(payload);
        buf.flip();
        return buf;
    }

    @Test
    void unmasked_text_frame_decodes() throws Exception {
        final FrameDecoder d = new FrameDecoder(1024);
        final ByteBuffer buf = frame(0x81, "hello".getBytes(StandardCharsets.US_ASCII));

        assertTrue(d.decode(buf));
        assertEquals(WsOpcode.TEXT, d.opcode());
        assertTrue(d.fin());
        assertEquals("hello", StandardCharsets.US_ASCII.decode(d.payload()).toString());
        assertFalse(buf.hasRemaining());
    }

    @Test
    void two_frames_in_one_buffer_decode_one_at_a_time() throws Exception {
        final ByteBuffer buf = ByteBuffer.allocate(8);
        buf.put(new byte[] {0x01, 0x01, 'a', (byte) 0x80, 0x01, 'b', (byte) 0x8A, 0x00});
        buf.flip();
        final FrameDecoder d = new FrameDecoder(1024);

        assertTrue(d.decode(buf));
        assertEquals(WsOpcode.TEXT, d.opcode());
        assertFalse(d.fin());
        assertTrue(d.decode(buf));
        assertEquals(WsOpcode.CONT, d.opcode());
        assertTrue(d.fin());
        assertTrue(d.decode(buf));
        assertEquals(WsOpcode.PONG, d.opcode());
        assertEquals(0, d.payload().remaining());
        assertFalse(d.decode(buf));
    }

    @Test
    void extended_16_bit_length() throws Exception {
        final byte[] payload = new byte[300];
        final ByteBuffer buf = ByteBuffer.allocate(4 + payload.length);
        buf.put((byte) 0x82).put((byte) 126).putShort((short) payload.length).put(payload);
        buf.flip();

        final FrameDecoder d = new FrameDecoder(4096);
        assertTrue(d.decode(buf));
        assertEquals(WsOpcode.BINARY, d.opcode());
        assertEquals(300, d.payload().remaining());
    }

    @Test
    void incomplete_frame_consumes_nothing() throws Exception {
        final ByteBuffer buf = ByteBuffer.allocate(4);
        buf.put((byte) 0x81).put((byte) 5).put((byte) 'h').put((byte) 'e');
        buf.flip();

        final FrameDecoder d = new FrameDecoder(1024);
        assertFalse(d.decode(buf));
        assertEquals(0, buf.position());
    }

    @Test
    void masked_server_frame_is_rejected() {
        final ByteBuffer buf = ByteBuffer.allocate(6);
        buf.put((byte) 0x81).put((byte) 0x80).putInt(0x11223344);
        buf.flip();

        final WsProtocolException ex = assertThrows(WsProtocolException.class, () -> new FrameDecoder(1024).decode(buf));
        assertEquals(1002, ex.getCloseCode());
    }

    @Test
    void rsv_bits_and_reserved_opcodes_are_rejected() {
        assertThrows(WsProtocolException.class, () -> new FrameDecoder(1024).decode(frame(0xC1, new byte[0])));
        assertThrows(WsProtocolException.class, () -> new FrameDecoder(1024).decode(frame(0x83, new byte[0])));
        assertThrows(WsProtocolException.class, () -> new FrameDecoder(1024).decode(frame(0x8B, new byte[0])));
    }

    @Test
    void invalid_control_frames_are_rejected() {
        // fragmented ping
        assertThrows(WsProtocolException.class, () -> new FrameDecoder(1024).decode(frame(0x09, new byte[0])));
        // close with a one byte payload
        assertThrows(WsProtocolException.class, () -> new FrameDecoder(1024).decode(frame(0x88, new byte[1])));

        final ByteBuffer bigPing = ByteBuffer.allocate(4 + 126);
        bigPing.put((byte) 0x89).put((byte) 126).putShort((short) 126).put(new byte[126]);
        bigPing.flip();
        assertThrows(WsProtocolException.class, () -> new FrameDecoder(1024).decode(bigPing));
    }

    @Test
    void frame_above_limit_is_rejected_with_1009() {
        final WsProtocolException ex = assertThrows(WsProtocolException.class,
                () -> new FrameDecoder(8).decode(frame(0x81, new byte[9])));
        assertEquals(1009, ex.getCloseCode());
    }

    @Test
    void close_payload_is_read() throws Exception {
        final byte[] reason = "bye".getBytes(StandardCharsets.UTF_8);
        final byte[] payload = new byte[2 + reason.length];
        payload[0] = (byte) 0x03;
        payload[1] = (byte) 0xE9;
        System.arraycopy(reason, 0, payload, 2, reason.length);

        final FrameDecoder d = new FrameDecoder(1024);
        assertTrue(d.decode(frame(0x88, payload)));
        final ByteBuffer p = d.payload();
        assertEquals(1001, CloseCodec.readCloseCode(p));
        assertEquals("bye", CloseCodec.readCloseReason(p));
        assertEquals(CloseCodec.NO_STATUS, CloseCodec.readCloseCode(ByteBuffer.allocate(0)));
    }

}
