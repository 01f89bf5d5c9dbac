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
 * A message of a recognized type whose payload could not be mapped to its event class.
 * The message is dropped and the connection keeps running.
 *
 * @since 1.0
 */
public final class ParseErrorEvent {

    private final String type;
    private final String fullMessage;
    private final Exception cause;

    public ParseErrorEvent(final String type, final String fullMessage, final Exception cause) {
        this.type = Args.notNull(type, "Type");
        this.fullMessage = Args.notNull(fullMessage, "Message");
        this.cause = Args.notNull(cause, "Cause");
    }

    public String getType() {
        return type;
    }

    public String getFullMessage() {
        return fullMessage;
    }

    public Exception getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return "ParseErrorEvent{type=" + type + ", cause=" + cause + "}";
    }

}
