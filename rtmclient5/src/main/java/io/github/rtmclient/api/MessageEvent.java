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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.apache.hc.core5.util.Args;

/**
 * A chat message posted to a channel, private group or direct conversation.
 *
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MessageEvent {

    private final String channel;
    private final String user;
    private final String text;
    private final String threadTimestamp;
    private final String timestamp;

    @JsonCreator
    public MessageEvent(
            @JsonProperty("channel") final String channel,
            @JsonProperty("user") final String user,
            @JsonProperty("text") final String text,
            @JsonProperty("thread_ts") final String threadTimestamp,
            @JsonProperty("ts") final String timestamp) {
        this.channel = Args.notNull(channel, "Channel");
        this.user = user;
        this.text = text;
        this.threadTimestamp = threadTimestamp;
        this.timestamp = Args.notNull(timestamp, "Timestamp");
    }

    /**
     * Channel, private group or IM identifier the message was posted to.
     */
    public String getChannel() {
        return channel;
    }

    /**
     * Identifier of the author; absent for some bot and system messages.
     */
    public String getUser() {
        return user;
    }

    public String getText() {
        return text;
    }

    /**
     * Timestamp of the parent message when this message is a thread reply.
     */
    public String getThreadTimestamp() {
        return threadTimestamp;
    }

    public String getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "MessageEvent{channel=" + channel + ", user=" + user + ", ts=" + timestamp + "}";
    }

}
