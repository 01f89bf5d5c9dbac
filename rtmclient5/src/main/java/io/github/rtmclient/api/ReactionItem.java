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
 * The item a reaction was added to. Which identifiers are set depends on {@link #getType()}:
 * channel and timestamp for messages, file for files, file and file comment for comments.
 *
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ReactionItem {

    private final ReactionItemType type;
    private final String channel;
    private final String timestamp;
    private final String file;
    private final String fileComment;

    @JsonCreator
    public ReactionItem(
            @JsonProperty("type") final ReactionItemType type,
            @JsonProperty("channel") final String channel,
            @JsonProperty("ts") final String timestamp,
            @JsonProperty("file") final String file,
            @JsonProperty("file_comment") final String fileComment) {
        this.type = Args.notNull(type, "Item type");
        this.channel = channel;
        this.timestamp = timestamp;
        this.file = file;
        this.fileComment = fileComment;
    }

    public ReactionItemType getType() {
        return type;
    }

    public String getChannel() {
        return channel;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getFile() {
        return file;
    }

    public String getFileComment() {
        return fileComment;
    }

    @Override
    public String toString() {
        return "ReactionItem{type=" + type + ", channel=" + channel + ", ts=" + timestamp
                + ", file=" + file + ", fileComment=" + fileComment + "}";
    }

}
