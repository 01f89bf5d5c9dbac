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
 * A complete text message as received, together with its type discriminator.
 *
 * @since 1.0
 */
public final class RawMessage {

    private final String type;
    private final String fullMessage;

    public RawMessage(final String type, final String fullMessage) {
        this.type = type;
        this.fullMessage = Args.notNull(fullMessage, "Message");
    }

    /**
     * Value of the top-level {@code type} field, or {@code null} if it could not be determined.
     */
    public String getType() {
        return type;
    }

    public String getFullMessage() {
        return fullMessage;
    }

    @Override
    public String toString() {
        return "RawMessage{type=" + type + ", length=" + fullMessage.length() + "}";
    }

}
