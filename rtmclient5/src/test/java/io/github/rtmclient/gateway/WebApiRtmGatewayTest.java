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
package io.github.rtmclient.gateway;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.impl.bootstrap.HttpServer;
import org.apache.hc.core5.http.impl.bootstrap.ServerBootstrap;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.util.Timeout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebApiRtmGatewayTest {

    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private final AtomicReference<String> requestMethod = new AtomicReference<>();
    private final AtomicReference<String> responseBody = new AtomicReference<>();
    private final AtomicReference<Integer> responseCode = new AtomicReference<>(200);

    private HttpServer server;
    private WebApiRtmGateway gateway;

    @BeforeEach
    void startServer() throws Exception {
        server = ServerBootstrap.bootstrap()
                .setListenerPort(0)
                .register("/api/rtm.connect", (request, response, context) -> {
                    requestMethod.set(request.getMethod());
                    requestBody.set(EntityUtils.toString(request.getEntity(), StandardCharsets.UTF_8));
                    response.setCode(responseCode.get());
                    response.setEntity(new StringEntity(responseBody.get(), ContentType.APPLICATION_JSON));
                })
                .create();
        server.start();
        gateway = WebApiRtmGateway.custom()
                .setToken("xoxb-test")
                .setBaseUri(URI.create("http://localhost:" + server.getLocalPort() + "/api"))
                .setRequestTimeout(Timeout.ofSeconds(5))
                .build();
    }

    @AfterEach
    void stopServer() throws Exception {
        gateway.close();
        server.close(CloseMode.IMMEDIATE);
    }

    @Test
    void rtm_connect_returns_url_and_identity() throws Exception {
        responseBody.set("{\"ok\":true,\"url\":\"wss://example.com/websocket/abc\","
                + "\"team\":{\"id\":\"T024BE7LD\",\"name\":\"Example\",\"domain\":\"example\"},"
                + "\"self\":{\"id\":\"W123456\",\"name\":\"bot\"},\"extra\":1}");

        final RtmConnectResponse response = gateway.rtmConnect();

        assertTrue(response.isOk());
        assertEquals(URI.create("wss://example.com/websocket/abc"), response.getUri());
        assertEquals("T024BE7LD", response.getTeam().getId());
        assertEquals("example", response.getTeam().getDomain());
        assertEquals("W123456", response.getSelf().getId());
        assertEquals("bot", response.getSelf().getName());
        assertNull(response.getError());
        assertEquals("POST", requestMethod.get());
        assertEquals("token=xoxb-test", requestBody.get());
    }

    @Test
    void presence_options_are_sent() throws Exception {
        responseBody.set("{\"ok\":true,\"url\":\"wss://example.com/ws\"}");

        gateway.rtmConnect(true, true);

        assertEquals("token=xoxb-test&batch_presence_aware=true&presence_sub=true", requestBody.get());
    }

    @Test
    void api_error_is_raised() {
        responseBody.set("{\"ok\":false,\"error\":\"invalid_auth\"}");

        final RtmGatewayException ex = assertThrows(RtmGatewayException.class, () -> gateway.rtmConnect());
        assertEquals("invalid_auth", ex.getError());
        assertEquals("rtm.connect", ex.getMethod());
    }

    @Test
    void http_error_is_raised() {
        responseCode.set(500);
        responseBody.set("oops");

        final RtmGatewayException ex = assertThrows(RtmGatewayException.class, () -> gateway.rtmConnect());
        assertEquals("HTTP 500", ex.getError());
    }

    @Test
    void malformed_body_is_raised() {
        responseBody.set("<html>");

        assertThrows(RtmGatewayException.class, () -> gateway.rtmConnect());
    }

    @Test
    void missing_token_is_rejected() {
        assertThrows(NullPointerException.class, () -> WebApiRtmGateway.custom().build());
        assertThrows(IllegalArgumentException.class, () -> WebApiRtmGateway.custom().setToken("  ").build());
    }

}
