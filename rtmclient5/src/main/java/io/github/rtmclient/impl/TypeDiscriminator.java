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
package io.github.rtmclient.impl;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts the top-level {@code "type"} discriminator of an RTM message without building
 * a tree. Nested objects and arrays are skipped, so a {@code type} key inside a nested
 * value is never taken for the message type.
 */
public final class TypeDiscriminator {

    private static final Logger LOG = LoggerFactory.getLogger(TypeDiscriminator.class);

    static final String TYPE_FIELD = "type";

    private final JsonFactory jsonFactory;

    public TypeDiscriminator(final JsonFactory jsonFactory) {
        this.jsonFactory = jsonFactory;
    }

    /**
     * @return the string value of the top-level {@code type} key, or {@code null} if the
     * message is not a JSON object, has no such key, its value is not a string, or the
     * message is malformed before the key is reached.
     */
    public String discriminate(final String message) {
        if (message == null) {
            return null;
        }
        try (JsonParser parser = jsonFactory.createParser(message)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                return null;
            }
            JsonToken token = parser.nextToken();
            while (token == JsonToken.FIELD_NAME) {
                final String name = parser.currentName();
                final JsonToken value = parser.nextToken();
                if (TYPE_FIELD.equals(name)) {
                    return value == JsonToken.VALUE_STRING ? parser.getText() : null;
                }
                parser.skipChildren();
                token = parser.nextToken();
            }
            return null;
        } catch (final IOException ex) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Malformed message, no type: {}", ex.getMessage());
            }
            return null;
        }
    }

}
