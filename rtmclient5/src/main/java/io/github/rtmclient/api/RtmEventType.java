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
 * Typed key of the event surface. Each constant names one kind of notification and the
 * payload class its listeners receive.
 *
 * @param <T> event payload type
 * @since 1.0
 */
public final class RtmEventType<T> {

    /**
     * Every complete text message, published before any type-specific event.
     */
    public static final RtmEventType<RawMessage> RAW_MESSAGE = new RtmEventType<>("raw-message", RawMessage.class);

    /**
     * The {@code hello} notice sent by the service once the connection is ready.
     */
    public static final RtmEventType<HelloEvent> HELLO = new RtmEventType<>("hello", HelloEvent.class);

    /**
     * A chat message.
     */
    public static final RtmEventType<MessageEvent> MESSAGE = new RtmEventType<>("message", MessageEvent.class);

    /**
     * A reaction added to a message, file or file comment.
     */
    public static final RtmEventType<ReactionAddedEvent> REACTION_ADDED =
            new RtmEventType<>("reaction_added", ReactionAddedEvent.class);

    /**
     * A recognized message whose payload could not be mapped.
     */
    public static final RtmEventType<ParseErrorEvent> PARSE_ERROR = new RtmEventType<>("parse-error", ParseErrorEvent.class);

    /**
     * End of a connection. Published exactly once per connection.
     */
    public static final RtmEventType<CloseEvent> CLOSED = new RtmEventType<>("closed", CloseEvent.class);

    /**
     * Every lifecycle transition of the client.
     */
    public static final RtmEventType<RunStateChange> RUN_STATE_CHANGED =
            new RtmEventType<>("run-state-changed", RunStateChange.class);

    private final String name;
    private final Class<T> payloadType;

    private RtmEventType(final String name, final Class<T> payloadType) {
        this.name = Args.notBlank(name, "Name");
        this.payloadType = Args.notNull(payloadType, "Payload type");
    }

    public String getName() {
        return name;
    }

    public Class<T> getPayloadType() {
        return payloadType;
    }

    @Override
    public String toString() {
        return name;
    }

}
