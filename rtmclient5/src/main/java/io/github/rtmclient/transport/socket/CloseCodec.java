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
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Helpers for RFC 6455 close frame payloads.
 */
final class CloseCodec {

    static final int NO_STATUS = 1005;

    private CloseCodec() {
    }

    static int readCloseCode(final ByteBuffer p) {
        if (p.remaining() >= 2) {
            final int b1 = p.get() & 0xFF;
            final int b2 = p.get() & 0xFF;
            return b1 << 8 | b2;
        }
        return NO_STATUS;
    }

    /**
     * Reads the remaining bytes as the close reason; invalid UTF-8 yields an empty reason.
     */
    static String readCloseReason(final ByteBuffer p) {
        if (!p.hasRemaining()) {
            return "";
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(p.slice())
                    .toString();
        } catch (final CharacterCodingException ex) {
            return "";
        }
    }

}
