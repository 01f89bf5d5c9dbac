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

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Kind of item a reaction was added to.
 *
 * @since 1.0
 */
public enum ReactionItemType {

    MESSAGE("message"),
    FILE("file"),
    FILE_COMMENT("file_comment");

    private final String wireName;

    ReactionItemType(final String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Case-insensitive lookup of the wire value.
     *
     * @throws IllegalArgumentException if the value is not one of the known item types
     */
    @JsonCreator
    public static ReactionItemType fromWireName(final String value) {
        if (value != null) {
            final String lower = value.toLowerCase(Locale.ROOT);
            for (final ReactionItemType type : values()) {
                if (type.wireName.equals(lower)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Invalid reaction item type '" + value + "'");
    }

}
