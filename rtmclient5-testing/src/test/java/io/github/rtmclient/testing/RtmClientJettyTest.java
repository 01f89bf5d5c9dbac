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
package io.github.rtmclient.testing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import io.github.rtmclient.api.CloseEvent;
import io.github.rtmclient.api.CloseReason;
import io.github.rtmclient.api.MessageEvent;
import io.github.rtmclient.api.RawMessage;
import io.github.rtmclient.api.RtmConnectResult;
import io.github.rtmclient.api.RtmConnectResultType;
import io.github.rtmclient.api.RtmEventType;
import io.github.rtmclient.api.RunState;
import io.github.rtmclient.client.RtmClient;
import io.github.rtmclient.client.RtmClientConfig;
import org.apache.hc.core5.util.Timeout;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.StatusCode;
import org.eclipse.jetty.websocket.api.WebSocketAdapter;
import org.eclipse.jetty.websocket.servlet.WebSocketServlet;
import org.eclipse.jetty.websocket.servlet.WebSocketServletFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class RtmClientJettyTest {

    static final String MESSAGE_F1 = "{\"type\":\"mes";
    static final String MESSAGE_F2 = "sage\",\"channel\":\"C2147483705\",\"user\":\"U2147483697\",";
    static final String MESSAGE_F3 = "\"text\":\"Hello world\",\"ts\":\"1355517523.000005\"}";

    private static final AtomicInteger SERVER_CLOSE_CODE = new AtomicInteger();
    private static volatile CountDownLatch serverClosed;

    private Server server;
    private int port;
    private RtmClient client;

    @BeforeEach
    void startServer() throws Exception {
        SERVER_CLOSE_CODE.set(0);
        serverClosed = new CountDownLatch(1);

        server = new Server();
        final ServerConnector connector = new ServerConnector(server);
        connector.setPort(0); // auto-bind free port
        server.addConnector(connector);

        final ServletContextHandler ctx = new ServletContextHandler();
        ctx.setContextPath("/");
        ctx.addServlet(new ServletHolder(new RtmServlet(HelloSocket::new)), "/rtm");
        ctx.addServlet(new ServletHolder(new RtmServlet(FragmentSocket::new)), "/fragments");
        ctx.addServlet(new ServletHolder(new RtmServlet(ClosingSocket::new)), "/close");
        ctx.addServlet(new ServletHolder(new RtmServlet(LargeSocket::new)), "/large");
        server.setHandler(ctx);

        server.start();
        port = connector.getLocalPort();

        client = new RtmClient(RtmClientConfig.custom()
                .setReceivePollInterval(Timeout.ofMilliseconds(50))
                .build());
    }

    @AfterEach
    void stopServer() throws Exception {
        client.disconnect();
        if (server != null) {
            server.stop();
        }
    }

    private URI uri(final String path) {
        return URI.create("ws://localhost:" + port + path);
    }

    @Test
    void hello_and_message_are_dispatched() throws Exception {
        final CountDownLatch hello = new CountDownLatch(1);
        final AtomicReference<MessageEvent> message = new AtomicReference<>();
        final CountDownLatch gotMessage = new CountDownLatch(1);
        client.subscribe(RtmEventType.HELLO, h -> hello.countDown());
        client.subscribe(RtmEventType.MESSAGE, m -> {
            message.set(m);
            gotMessage.countDown();
        });

        final RtmConnectResult result = client.connect(uri("/rtm"), 5000);
        assertTrue(result.isSuccess(), result.toString());
        assertTrue(hello.await(10, TimeUnit.SECONDS));
        assertTrue(gotMessage.await(10, TimeUnit.SECONDS));

        assertEquals("C2147483705", message.get().getChannel());
        assertEquals("Hello world", message.get().getText());
        assertEquals(RunState.STARTED, client.getRunState());
    }

    @Test
    void fragmented_message_is_reassembled() throws Exception {
        final List<RawMessage> raw = new CopyOnWriteArrayList<>();
        final CountDownLatch gotMessage = new CountDownLatch(1);
        client.subscribe(RtmEventType.RAW_MESSAGE, raw::add);
        client.subscribe(RtmEventType.MESSAGE, m -> gotMessage.countDown());

        assertTrue(client.connect(uri("/fragments"), 5000).isSuccess());
        assertTrue(gotMessage.await(10, TimeUnit.SECONDS));

        assertEquals(1, raw.size());
        assertEquals(MESSAGE_F1 + MESSAGE_F2 + MESSAGE_F3, raw.get(0).getFullMessage());
    }

    @Test
    void message_larger_than_read_buffer() throws Exception {
        final AtomicReference<String> raw = new AtomicReference<>();
        final CountDownLatch received = new CountDownLatch(1);
        client.subscribe(RtmEventType.RAW_MESSAGE, m -> {
            raw.set(m.getFullMessage());
            received.countDown();
        });

        assertTrue(client.connect(uri("/large"), 5000).isSuccess());
        assertTrue(received.await(10, TimeUnit.SECONDS));

        assertEquals(LargeSocket.payload(), raw.get());
    }

    @Test
    void server_close_stops_the_client() throws Exception {
        final List<CloseEvent> closes = new CopyOnWriteArrayList<>();
        final CountDownLatch stopped = new CountDownLatch(1);
        client.subscribe(RtmEventType.CLOSED, closes::add);
        client.subscribe(RtmEventType.RUN_STATE_CHANGED, c -> {
            if (c.getTo() == RunState.STOPPED) {
                stopped.countDown();
            }
        });

        assertTrue(client.connect(uri("/close"), 5000).isSuccess());
        assertTrue(stopped.await(10, TimeUnit.SECONDS));

        assertEquals(1, closes.size());
        assertEquals(CloseReason.REMOTE_CLOSE, closes.get(0).getReason());
        assertTrue(serverClosed.await(10, TimeUnit.SECONDS));
        assertEquals(StatusCode.NORMAL, SERVER_CLOSE_CODE.get());
    }

    @Test
    void disconnect_sends_normal_closure() throws Exception {
        final CountDownLatch hello = new CountDownLatch(1);
        final List<CloseEvent> closes = new CopyOnWriteArrayList<>();
        client.subscribe(RtmEventType.HELLO, h -> hello.countDown());
        client.subscribe(RtmEventType.CLOSED, closes::add);

        assertTrue(client.connect(uri("/rtm"), 5000).isSuccess());
        assertTrue(hello.await(10, TimeUnit.SECONDS));
        assertTrue(client.disconnect());

        assertEquals(RunState.STOPPED, client.getRunState());
        assertEquals(1, closes.size());
        assertEquals(CloseReason.USER_REQUESTED, closes.get(0).getReason());
        assertTrue(serverClosed.await(10, TimeUnit.SECONDS));
        assertEquals(StatusCode.NORMAL, SERVER_CLOSE_CODE.get());
    }

    @Test
    void reconnect_after_disconnect() throws Exception {
        final CountDownLatch firstHello = new CountDownLatch(1);
        final CountDownLatch hellos = new CountDownLatch(2);
        client.subscribe(RtmEventType.HELLO, h -> {
            firstHello.countDown();
            hellos.countDown();
        });

        assertTrue(client.connect(uri("/rtm"), 5000).isSuccess());
        assertTrue(firstHello.await(10, TimeUnit.SECONDS));
        assertTrue(client.disconnect());
        assertTrue(client.connect(uri("/rtm"), 5000).isSuccess());

        assertTrue(hellos.await(10, TimeUnit.SECONDS));
    }

    @Test
    void unknown_path_fails_the_handshake() {
        final RtmConnectResult result = client.connect(uri("/missing"), 5000);

        assertEquals(RtmConnectResultType.HANDSHAKE_FAILED, result.getResultType());
        assertEquals(RunState.STOPPED, client.getRunState());
    }

    @Test
    void silent_endpoint_times_out() throws Exception {
        try (ServerSocket silent = new ServerSocket(0)) {
            final RtmConnectResult result = client.connect(
                    URI.create("ws://localhost:" + silent.getLocalPort() + "/rtm"), 300);

            assertEquals(RtmConnectResultType.HANDSHAKE_TIMEOUT, result.getResultType());
            assertEquals(RunState.STOPPED, client.getRunState());
        }
    }

    static final class RtmServlet extends WebSocketServlet {

        private static final long serialVersionUID = 1L;

        private final transient Supplier<WebSocketAdapter> sockets;

        RtmServlet(final Supplier<WebSocketAdapter> sockets) {
            this.sockets = sockets;
        }

        @Override
        public void configure(final WebSocketServletFactory factory) {
            factory.getPolicy().setIdleTimeout(30000);
            factory.setCreator((req, resp) -> sockets.get());
        }

    }

    public abstract static class RecordingSocket extends WebSocketAdapter {

        @Override
        public void onWebSocketClose(final int statusCode, final String reason) {
            super.onWebSocketClose(statusCode, reason);
            SERVER_CLOSE_CODE.set(statusCode);
            serverClosed.countDown();
        }

    }

    public static final class HelloSocket extends RecordingSocket {

        @Override
        public void onWebSocketConnect(final Session sess) {
            super.onWebSocketConnect(sess);
            try {
                sess.getRemote().sendString("{\"type\":\"hello\"}");
                sess.getRemote().sendString("{\"type\":\"user_typing\",\"channel\":\"C1\"}");
                sess.getRemote().sendString(MESSAGE_F1 + MESSAGE_F2 + MESSAGE_F3);
            } catch (final IOException ex) {
                throw new IllegalStateException(ex);
            }
        }

    }

    public static final class FragmentSocket extends RecordingSocket {

        @Override
        public void onWebSocketConnect(final Session sess) {
            super.onWebSocketConnect(sess);
            try {
                sess.getRemote().sendPartialString(MESSAGE_F1, false);
                sess.getRemote().sendPartialString(MESSAGE_F2, false);
                sess.getRemote().sendPartialString(MESSAGE_F3, true);
            } catch (final IOException ex) {
                throw new IllegalStateException(ex);
            }
        }

    }

    public static final class ClosingSocket extends RecordingSocket {

        @Override
        public void onWebSocketConnect(final Session sess) {
            super.onWebSocketConnect(sess);
            try {
                sess.getRemote().sendString("{\"type\":\"hello\"}");
            } catch (final IOException ex) {
                throw new IllegalStateException(ex);
            }
            sess.close(StatusCode.NORMAL, "bye");
        }

    }

    public static final class LargeSocket extends RecordingSocket {

        static String payload() {
            final StringBuilder sb = new StringBuilder("{\"type\":\"message\",\"channel\":\"C1\",\"ts\":\"1.0\",\"text\":\"");
            for (int i = 0; i < 2000; i++) {
                sb.append("0123456789");
            }
            return sb.append("\"}").toString();
        }

        @Override
        public void onWebSocketConnect(final Session sess) {
            super.onWebSocketConnect(sess);
            try {
                sess.getRemote().sendString(payload());
            } catch (final IOException ex) {
                throw new IllegalStateException(ex);
            }
        }

    }

}
