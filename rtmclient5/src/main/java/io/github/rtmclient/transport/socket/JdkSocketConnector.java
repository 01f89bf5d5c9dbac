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
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.util.Collections;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;

import org.apache.hc.core5.ssl.SSLContexts;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Timeout;

/**
 * JSSE connector: direct TCP connect and, for {@code wss}, TLS with SNI and hostname verification.
 *
 * @since 1.0
 */
public final class JdkSocketConnector implements WebSocketConnector {

    private final SSLContext sslContext;
    private final boolean verifyHostname;

    /**
     * System default trust material, hostname verification enabled.
     */
    public JdkSocketConnector() {
        this(SSLContexts.createSystemDefault(), true);
    }

    public JdkSocketConnector(final SSLContext sslContext, final boolean verifyHostname) {
        this.sslContext = Args.notNull(sslContext, "SSL context");
        this.verifyHostname = verifyHostname;
    }

    @Override
    public Socket connect(final URI uri, final Timeout timeout) throws IOException {
        final boolean secure = "wss".equalsIgnoreCase(uri.getScheme());
        final String host = Args.notNull(uri.getHost(), "URI host");
        final int port = uri.getPort() > 0 ? uri.getPort() : (secure ? 443 : 80);
        final int timeoutMs = toMillisInt(timeout);

        final Socket s = new Socket();
        try {
            s.connect(new InetSocketAddress(host, port), timeoutMs);
            s.setTcpNoDelay(true);
            if (!secure) {
                return s;
            }

            final SSLSocket ssl = (SSLSocket) sslContext.getSocketFactory().createSocket(s, host, port, true);
            final SSLParameters params = ssl.getSSLParameters();
            try {
                params.setServerNames(Collections.singletonList(new SNIHostName(host)));
            } catch (final IllegalArgumentException ex) {
                // IP literal, SNI not applicable
                params.setServerNames(Collections.emptyList());
            }
            if (verifyHostname) {
                params.setEndpointIdentificationAlgorithm("HTTPS");
            }
            ssl.setSSLParameters(params);
            ssl.setSoTimeout(timeoutMs);
            ssl.startHandshake();
            return ssl;
        } catch (final IOException | RuntimeException ex) {
            s.close();
            throw ex;
        }
    }

    private static int toMillisInt(final Timeout t) {
        if (t == null) {
            return 0;
        }
        final long ms = t.toMilliseconds();
        if (ms <= 0L) {
            return 0; // infinite per Socket#connect
        }
        return ms > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) ms;
    }

}
