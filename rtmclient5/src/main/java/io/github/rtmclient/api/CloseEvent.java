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
 * End of a connection. Produced exactly once per connection, when its receive loop exits.
 *
 * @since 1.0
 */
public final class CloseEvent {

    private final CloseReason reason;
    private final Throwable cause;

    public CloseEvent(final CloseReason reason, final Throwable cause) {
        this.reason = Args.notNull(reason, "Reason");
        this.cause = cause;
    }

    public CloseReason getReason() {
        return reason;
    }

    /**
     * The error that ended the connection; {@code null} unless the reason is {@link CloseReason#FAULT}.
     */
    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return "CloseEvent{reason=" + reason + (cause != null ? ", cause=" + cause : "") + "}";
    }

}
