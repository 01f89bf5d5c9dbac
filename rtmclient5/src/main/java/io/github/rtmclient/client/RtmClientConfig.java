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

import io.github.rtmclient.transport.socket.SocketTransportFactory;

import org.apache.hc.core5.function.Callback;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Timeout;

/**
 * Immutable client settings.
 * <p>
 * {@code readBufferSize} and {@code maxMessageSize} are initial values; a client copies
 * them and they can later be changed on the client while it is stopped.
 */
public final class RtmClientConfig {

    public static final RtmClientConfig DEFAULT = custom().build();

    private final int readBufferSize;
    private final Timeout connectTimeout;
    private final long maxMessageSize;
    private final int maxFrameSize;
    private final Timeout receivePollInterval;
    private final String threadNamePrefix;
    private final Callback<Exception> listenerExceptionCallback;

    private RtmClientConfig(
            final int readBufferSize,
            final Timeout connectTimeout,
            final long maxMessageSize,
            final int maxFrameSize,
            final Timeout receivePollInterval,
            final String threadNamePrefix,
            final Callback<Exception> listenerExceptionCallback) {
        this.readBufferSize = readBufferSize;
        this.connectTimeout = connectTimeout;
        this.maxMessageSize = maxMessageSize;
        this.maxFrameSize = maxFrameSize;
        this.receivePollInterval = receivePollInterval;
        this.threadNamePrefix = threadNamePrefix;
        this.listenerExceptionCallback = listenerExceptionCallback;
    }

    public int getReadBufferSize() {
        return readBufferSize;
    }

    /**
     * Handshake bound used by {@code connect(URI)}; {@link Timeout#DISABLED} means unbounded.
     */
    public Timeout getConnectTimeout() {
        return connectTimeout;
    }

    public long getMaxMessageSize() {
        return maxMessageSize;
    }

    public int getMaxFrameSize() {
        return maxFrameSize;
    }

    public Timeout getReceivePollInterval() {
        return receivePollInterval;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public Callback<Exception> getListenerExceptionCallback() {
        return listenerExceptionCallback;
    }

    public static Builder custom() {
        return new Builder();
    }

    public static Builder copy(final RtmClientConfig config) {
        Args.notNull(config, "Config");
        return new Builder()
                .setReadBufferSize(config.getReadBufferSize())
                .setConnectTimeout(config.getConnectTimeout())
                .setMaxMessageSize(config.getMaxMessageSize())
                .setMaxFrameSize(config.getMaxFrameSize())
                .setReceivePollInterval(config.getReceivePollInterval())
                .setThreadNamePrefix(config.getThreadNamePrefix())
                .setListenerExceptionCallback(config.getListenerExceptionCallback());
    }

    @Override
    public String toString() {
        return "RtmClientConfig{readBufferSize=" + readBufferSize
                + ", connectTimeout=" + connectTimeout
                + ", maxMessageSize=" + maxMessageSize
                + ", maxFrameSize=" + maxFrameSize
                + ", receivePollInterval=" + receivePollInterval
                + ", threadNamePrefix=" + threadNamePrefix + "}";
    }

    public static final class Builder {

        private int readBufferSize = 4096;
        private Timeout connectTimeout = Timeout.ofSeconds(5);
        private long maxMessageSize = 0L;
        private int maxFrameSize = SocketTransportFactory.DEFAULT_MAX_FRAME_SIZE;
        private Timeout receivePollInterval = SocketTransportFactory.DEFAULT_POLL_INTERVAL;
        private String threadNamePrefix = "rtm-receiver";
        private Callback<Exception> listenerExceptionCallback = RtmLoggingExceptionCallback.INSTANCE;

        Builder() {
        }

        public Builder setReadBufferSize(final int v) {
            this.readBufferSize = v;
            return this;
        }

        public Builder setConnectTimeout(final Timeout v) {
            this.connectTimeout = v;
            return this;
        }

        public Builder setMaxMessageSize(final long v) {
            this.maxMessageSize = v;
            return this;
        }

        public Builder setMaxFrameSize(final int v) {
            this.maxFrameSize = v;
            return this;
        }

        public Builder setReceivePollInterval(final Timeout v) {
            this.receivePollInterval = v;
            return this;
        }

        public Builder setThreadNamePrefix(final String v) {
            this.threadNamePrefix = v;
            return this;
        }

        public Builder setListenerExceptionCallback(final Callback<Exception> v) {
            this.listenerExceptionCallback = v;
            return this;
        }

        public RtmClientConfig build() {
            Args.positive(readBufferSize, "Read buffer size");
            Args.notNull(connectTimeout, "Connect timeout");
            Args.notNegative(maxMessageSize, "Max message size");
            Args.positive(maxFrameSize, "Max frame size");
            Args.notNull(receivePollInterval, "Receive poll interval");
            Args.check(receivePollInterval.toMilliseconds() > 0, "Receive poll interval must be positive");
            Args.notBlank(threadNamePrefix, "Thread name prefix");
            Args.notNull(listenerExceptionCallback, "Listener exception callback");
            return new RtmClientConfig(
                    readBufferSize, connectTimeout, maxMessageSize, maxFrameSize,
                    receivePollInterval, threadNamePrefix, listenerExceptionCallback);
        }

    }

}
