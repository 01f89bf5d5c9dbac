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
 * A reaction added by a user to a message, file or file comment.
 *
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ReactionAddedEvent {

    private final String user;
    private final String reaction;
    private final String itemUser;
    private final ReactionItem item;
    private final String eventTimestamp;

    @JsonCreator
    public ReactionAddedEvent(
            @JsonProperty("user") final String user,
            @JsonProperty("reaction") final String reaction,
            @JsonProperty("item_user") final String itemUser,
            @JsonProperty("item") final ReactionItem item,
            @JsonProperty("event_ts") final String eventTimestamp) {
        this.user = Args.notNull(user, "User");
        this.reaction = Args.notNull(reaction, "Reaction");
        this.itemUser = itemUser;
        this.item = Args.notNull(item, "Item");
        this.eventTimestamp = eventTimestamp;
    }

    /**
     * Identifier of the user who added the reaction.
     */
    public String getUser() {
        return user;
    }

    /**
     * Reaction (emoji) name, without colons.
     */
    public String getReaction() {
        return reaction;
    }

    /**
     * Identifier of the user who created the item that was reacted to.
     */
    public String getItemUser() {
        return itemUser;
    }

    public ReactionItem getItem() {
        return item;
    }

    public String getEventTimestamp() {
        return eventTimestamp;
    }

    @Override
    public String toString() {
        return "ReactionAddedEvent{user=" + user + ", reaction=" + reaction + ", item=" + item + "}";
    }

}
