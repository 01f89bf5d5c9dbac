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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.rtmclient.api.HelloEvent;
import io.github.rtmclient.api.ParseErrorEvent;
import io.github.rtmclient.api.RawMessage;
import io.github.rtmclient.api.RtmEventType;

import org.apache.hc.core5.util.Args;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one complete text message into events: always {@link RtmEventType#RAW_MESSAGE}
 * first, then at most one typed event selected by the message {@code type}.
 */
public final class MessageRouter {

    private static final Logger LOG = LoggerFactory.getLogger(MessageRouter.class);

    private static final Map<String, RtmEventType<?>> TYPED_EVENTS;

    static {
        final Map<String, RtmEventType<?>> map = new HashMap<>();
        map.put("message", RtmEventType.MESSAGE);
        map.put("reaction_added", RtmEventType.REACTION_ADDED);
        TYPED_EVENTS = Collections.unmodifiableMap(map);
    }

    private final SubscriptionRegistry registry;
    private final ObjectMapper mapper;
    private final TypeDiscriminator discriminator;

    public MessageRouter(final SubscriptionRegistry registry) {
        this(registry, new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public MessageRouter(final SubscriptionRegistry registry, final ObjectMapper mapper) {
        this.registry = Args.notNull(registry, "Subscription registry");
        this.mapper = Args.notNull(mapper, "Object mapper");
        this.discriminator = new TypeDiscriminator(mapper.getFactory());
    }

    public void route(final String fullMessage) {
        final String type = discriminator.discriminate(fullMessage);
        if (LOG.isTraceEnabled()) {
            LOG.trace("Message received, type {}: {}", type, fullMessage);
        }
        registry.publish(RtmEventType.RAW_MESSAGE, new RawMessage(type, fullMessage));

        if ("hello".equals(type)) {
            registry.publish(RtmEventType.HELLO, HelloEvent.INSTANCE);
            return;
        }
        final RtmEventType<?> eventType = type != null ? TYPED_EVENTS.get(type) : null;
        if (eventType == null) {
            LOG.warn("Message type \"{}\" not supported yet", type);
            return;
        }
        if (!registry.hasListeners(eventType) && !registry.hasListeners(RtmEventType.PARSE_ERROR)) {
            return;
        }
        publishTyped(eventType, type, fullMessage);
    }

    private <T> void publishTyped(final RtmEventType<T> eventType, final String type, final String fullMessage) {
        final T event;
        try {
            event = mapper.readValue(fullMessage, eventType.getPayloadType());
        } catch (final JsonProcessingException ex) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Could not parse \"{}\" message: {}", type, ex.getOriginalMessage());
            }
            registry.publish(RtmEventType.PARSE_ERROR, new ParseErrorEvent(type, fullMessage, ex));
            return;
        }
        registry.publish(eventType, event);
    }

}
