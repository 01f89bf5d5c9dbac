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
package io.github.rtmclient.transport.socket;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.hc.core5.http.ProtocolException;
import org.apache.hc.core5.util.ByteArrayBuffer;

/**
 * Blocking HTTP/1.1 Upgrade exchange (RFC 6455 section 4): writes the request, reads the
 * response head up to CRLFCRLF, validates the 101 response.
 */
final class UpgradeHandshake {

    static final String SEC_WS_VERSION = "13";

    private static final String ACCEPT_GUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";
    private static final byte[] CRLFCRLF = "\r\n\r\n".getBytes(StandardCharsets.ISO_8859_1);
    private static final int MAX_HEAD_SIZE = 16 * 1024;
    private static final SecureRandom RANDOM = new SecureRandom();

    private UpgradeHandshake() {
    }

    static final class Response {

        private final String statusLine;
        private final Map<String, List<String>> headers;
        private final byte[] remaining;

        Response(final String statusLine, final Map<String, List<String>> headers, final byte[] remaining) {
            this.statusLine = statusLine;
            this.headers = headers;
            this.remaining = remaining;
        }

        String getStatusLine() {
            return statusLine;
        }

        Map<String, List<String>> getHeaders() {
            return headers;
        }

        /**
         * Bytes read past the response head; the start of the frame stream.
         */
        byte[] getRemaining() {
            return remaining;
        }

    }

    static Response execute(final Socket socket,
                            final URI uri,
                            final HandshakeDeadline deadline) throws IOException, ProtocolException {
        final String secKey = randomKey();
        final OutputStream os = socket.getOutputStream();
        os.write(encodeRequest(uri, secKey));
        os.flush();

        final Response response = readResponse(socket, deadline);
        validate101(response.getStatusLine(), response.getHeaders(), secKey);
        return response;
    }

    static byte[] encodeRequest(final URI uri, final String secKey) {
        final boolean secure = "wss".equalsIgnoreCase(uri.getScheme());
        final int defaultPort = secure ? 443 : 80;
        final String host = uri.getPort() > 0 && uri.getPort() != defaultPort
                ? uri.getHost() + ":" + uri.getPort()
                : uri.getHost();
        final String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        final String query = uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery();

        final StringBuilder sb = new StringBuilder(256);
        sb.append("GET ").append(path).append(query).append(" HTTP/1.1\r\n");
        sb.append("Host: ").append(host).append("\r\n");
        sb.append("Upgrade: websocket\r\n");
        sb.append("Connection: Upgrade\r\n");
        sb.append("Sec-WebSocket-Key: ").append(secKey).append("\r\n");
        sb.append("Sec-WebSocket-Version: ").append(SEC_WS_VERSION).append("\r\n");
        sb.append("\r\n");
        return sb.toString().getBytes(StandardCharsets.ISO_8859_1);
    }

    static Response readResponse(final Socket socket, final HandshakeDeadline deadline) throws IOException, ProtocolException {
        final InputStream is = socket.getInputStream();
        final byte[] chunk = new byte[1024];
        final ByteArrayBuffer head = new ByteArrayBuffer(1024);
        int searchFrom = 0;
        while (true) {
            socket.setSoTimeout(deadline.remainingMillis());
            final int n;
            try {
                n = is.read(chunk);
            } catch (final SocketTimeoutException ex) {
                throw deadline.expired(ex);
            }
            if (n < 0) {
                throw new IOException("EOF during handshake");
            }
            head.append(chunk, 0, n);
            final int end = indexOf(head.array(), head.length(), CRLFCRLF, searchFrom);
            if (end >= 0) {
                final int headEnd = end + CRLFCRLF.length;
                final byte[] remaining = Arrays.copyOfRange(head.array(), headEnd, head.length());
                return parseHead(new String(head.array(), 0, end, StandardCharsets.ISO_8859_1), remaining);
            }
            if (head.length() > MAX_HEAD_SIZE) {
                throw new ProtocolException("Handshake response head exceeds " + MAX_HEAD_SIZE + " bytes");
            }
            searchFrom = Math.max(0, head.length() - CRLFCRLF.length + 1);
        }
    }

    static void validate101(final String statusLine,
                            final Map<String, List<String>> headers,
                            final String secKey) throws ProtocolException {
        if (statusLine == null || !statusLine.startsWith("HTTP/1.1 101")) {
            throw new ProtocolException("Expected 101 Switching Protocols, got: " + statusLine);
        }
        final String upgrade = first(headers, "Upgrade");
        final String connection = first(headers, "Connection");
        final String accept = first(headers, "Sec-WebSocket-Accept");
        if (upgrade == null || !"websocket".equalsIgnoreCase(upgrade.trim())) {
            throw new ProtocolException("Missing/invalid Upgrade header: " + upgrade);
        }
        if (connection == null || !connection.toLowerCase(Locale.ROOT).contains("upgrade")) {
            throw new ProtocolException("Missing/invalid Connection header: " + connection);
        }
        if (accept == null || !computeAccept(secKey).equals(accept.trim())) {
            throw new ProtocolException("Bad Sec-WebSocket-Accept");
        }
        final String extensions = first(headers, "Sec-WebSocket-Extensions");
        if (extensions != null && !extensions.trim().isEmpty()) {
            throw new ProtocolException("Server negotiated extensions that were not offered: " + extensions);
        }
    }

    static String computeAccept(final String secKey) {
        try {
            final MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            sha1.update((secKey + ACCEPT_GUID).getBytes(StandardCharsets.ISO_8859_1));
            return Base64.getEncoder().encodeToString(sha1.digest());
        } catch (final NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-1 not available", ex);
        }
    }

    static String randomKey() {
        final byte[] nonce = new byte[16];
        RANDOM.nextBytes(nonce);
        return Base64.getEncoder().encodeToString(nonce);
    }

    private static Response parseHead(final String head, final byte[] remaining) {
        final String[] lines = head.split("\r\n");
        final String status = lines.length > 0 ? lines[0] : null;
        final Map<String, List<String>> headers = new LinkedHashMap<>();
        for (int i = 1; i < lines.length; i++) {
            final int c = lines[i].indexOf(':');
            if (c > 0) {
                final String name = lines[i].substring(0, c).trim();
                final String value = lines[i].substring(c + 1).trim();
                headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            }
        }
        return new Response(status, headers, remaining);
    }

    private static String first(final Map<String, List<String>> map, final String name) {
        for (final Map.Entry<String, List<String>> e : map.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name)) {
                return e.getValue().isEmpty() ? null : e.getValue().get(0);
            }
        }
        return null;
    }

    private static int indexOf(final byte[] hay, final int len, final byte[] needle, final int from) {
        outer:
        for (int i = from; i <= len - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (hay[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

}
