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

import org.apache.hc.core5.util.Args;

/**
 * Result of one {@link RtmTransport#receive} call. The payload bytes are in the buffer
 * passed to {@code receive}, starting at offset zero.
 *
 * @since 1.0
 */
public final class IncomingFrame {

    private final FrameOpcode opcode;
    private final int count;
    private final boolean endOfMessage;
    private final int closeStatus;
    private final String closeReason;

    private IncomingFrame(
            final FrameOpcode opcode,
            final int count,
            final boolean endOfMessage,
            final int closeStatus,
            final String closeReason) {
        this.opcode = opcode;
        this.count = count;
        this.endOfMessage = endOfMessage;
        this.closeStatus = closeStatus;
        this.closeReason = closeReason;
    }

    public static IncomingFrame data(final FrameOpcode opcode, final int count, final boolean endOfMessage) {
        Args.notNull(opcode, "Opcode");
        Args.check(opcode != FrameOpcode.CLOSE, "Data frame opcode must be TEXT or BINARY");
        Args.notNegative(count, "Count");
        return new IncomingFrame(opcode, count, endOfMessage, 0, null);
    }

    public static IncomingFrame close(final int closeStatus, final String closeReason) {
        return new IncomingFrame(FrameOpcode.CLOSE, 0, true, closeStatus, closeReason != null ? closeReason : "");
    }

    public FrameOpcode getOpcode() {
        return opcode;
    }

    /**
     * Number of payload bytes written to the receive buffer.
     */
    public int getCount() {
        return count;
    }

    /**
     * {@code true} if these bytes complete a logical message.
     */
    public boolean isEndOfMessage() {
        return endOfMessage;
    }

    /**
     * RFC 6455 status code of a close frame, 1005 if the peer sent none.
     */
    public int getCloseStatus() {
        return closeStatus;
    }

    public String getCloseReason() {
        return closeReason;
    }

    @Override
    public String toString() {
        if (opcode == FrameOpcode.CLOSE) {
            return "CLOSE(" + closeStatus + (closeReason.isEmpty() ? "" : ", " + closeReason) + ")";
        }
        return opcode + "(" + count + (endOfMessage ? ", fin" : "") + ")";
    }

}
