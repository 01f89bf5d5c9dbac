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
package io.github.rtmclient.client;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import io.github.rtmclient.api.RtmConnectResult;
import io.github.rtmclient.api.RtmEventListener;
import io.github.rtmclient.api.RtmEventType;
import io.github.rtmclient.api.RunState;
import io.github.rtmclient.api.Subscription;
import io.github.rtmclient.gateway.RtmConnectGateway;
import io.github.rtmclient.gateway.RtmConnectResponse;

import org.apache.hc.core5.util.Args;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the gateway for a connection endpoint and connects a {@link RtmClient} to it.
 * <p>
 * Subscriptions made through the session are cancelled when the session is closed.
 */
public class RtmSession implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(RtmSession.class);

    private final RtmConnectGateway gateway;
    private final RtmClient client;
    private final List<Subscription> subscriptions;

    private volatile RtmConnectResponse lastConnect;

    public RtmSession(final RtmConnectGateway gateway, final RtmClient client) {
        this.gateway = Args.notNull(gateway, "Gateway");
        this.client = Args.notNull(client, "Client");
        this.subscriptions = new ArrayList<>();
    }

    public RtmClient getClient() {
        return client;
    }

    /**
     * @return the response of the last successful {@code rtm.connect} call, or {@code null}.
     */
    public RtmConnectResponse getLastConnect() {
        return lastConnect;
    }

    public <T> Subscription subscribe(final RtmEventType<T> type, final RtmEventListener<? super T> listener) {
        final Subscription subscription = client.subscribe(type, listener);
        synchronized (subscriptions) {
            subscriptions.add(subscription);
        }
        return subscription;
    }

    /**
     * Calls {@code rtm.connect} and connects to the returned URL.
     *
     * @return {@code true} if the client is now connected.
     */
    public boolean start(final int timeoutMillis) {
        final RunState state = client.getRunState();
        if (state != RunState.STOPPED) {
            LOG.warn("Client is {}, not requesting a new endpoint", state);
            return false;
        }
        final RtmConnectResponse response;
        try {
            response = gateway.rtmConnect();
        } catch (final IOException ex) {
            LOG.error("rtm.connect failed: {}", ex.getMessage());
            return false;
        }
        lastConnect = response;
        final RtmConnectResult result = client.connect(response.getUri(), timeoutMillis);
        if (!result.isSuccess()) {
            LOG.error("Connect to {} failed: {}", response.getUrl(), result);
            return false;
        }
        return true;
    }

    public boolean start() {
        return start(client.defaultTimeoutMillis());
    }

    public boolean stop() {
        return client.disconnect();
    }

    @Override
    public void close() {
        client.disconnect();
        synchronized (subscriptions) {
            for (final Subscription subscription : subscriptions) {
                subscription.cancel();
            }
            subscriptions.clear();
        }
    }

}
