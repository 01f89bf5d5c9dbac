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
package io.github.rtmclient.api;

import org.apache.hc.core5.util.Args;

/**
 * Result of {@code RtmClient#connect}: a {@link RtmConnectResultType} plus a case-dependent payload.
 * <ul>
 *   <li>{@link RtmConnectResultType#SUCCESS}: no payload</li>
 *   <li>{@link RtmConnectResultType#INVALID_RUNNING_STATE}: the {@link RunState} observed</li>
 *   <li>{@link RtmConnectResultType#HANDSHAKE_TIMEOUT}, {@link RtmConnectResultType#HANDSHAKE_FAILED}:
 *   the exception that ended the handshake</li>
 * </ul>
 *
 * @since 1.0
 */
public final class RtmConnectResult {

    private static final RtmConnectResult SUCCESS = new RtmConnectResult(RtmConnectResultType.SUCCESS, null);

    private final RtmConnectResultType resultType;
    private final Object payload;

    private RtmConnectResult(final RtmConnectResultType resultType, final Object payload) {
        this.resultType = resultType;
        this.payload = payload;
    }

    public static RtmConnectResult success() {
        return SUCCESS;
    }

    public static RtmConnectResult invalidRunningState(final RunState observed) {
        return new RtmConnectResult(RtmConnectResultType.INVALID_RUNNING_STATE, Args.notNull(observed, "Run state"));
    }

    public static RtmConnectResult handshakeTimeout(final Exception cause) {
        return new RtmConnectResult(RtmConnectResultType.HANDSHAKE_TIMEOUT, Args.notNull(cause, "Cause"));
    }

    public static RtmConnectResult handshakeFailed(final Exception cause) {
        return new RtmConnectResult(RtmConnectResultType.HANDSHAKE_FAILED, Args.notNull(cause, "Cause"));
    }

    public RtmConnectResultType getResultType() {
        return resultType;
    }

    public Object getPayload() {
        return payload;
    }

    public boolean isSuccess() {
        return resultType == RtmConnectResultType.SUCCESS;
    }

    @Override
    public String toString() {
        return payload != null ? resultType + " (" + payload + ")" : resultType.toString();
    }

}
