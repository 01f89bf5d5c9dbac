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

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.entity.UrlEncodedFormEntity;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RtmConnectGateway} backed by the Web API over HTTP.
 * <p>
 * Requests are form-encoded POSTs against {@code baseUri + method}. A gateway built without
 * an explicit HTTP client creates and owns one; {@link #close()} releases it.
 */
public final class WebApiRtmGateway implements RtmConnectGateway, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(WebApiRtmGateway.class);

    public static final URI DEFAULT_BASE_URI = URI.create("https://slack.com/api/");

    static final String RTM_CONNECT = "rtm.connect";

    private final String token;
    private final URI baseUri;
    private final RequestConfig requestConfig;
    private final CloseableHttpClient httpClient;
    private final boolean ownsClient;
    private final ObjectMapper mapper;

    private WebApiRtmGateway(final Builder builder) {
        this.token = builder.token;
        this.baseUri = builder.baseUri;
        this.requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(builder.requestTimeout)
                .setResponseTimeout(builder.requestTimeout)
                .build();
        this.ownsClient = builder.httpClient == null;
        this.httpClient = ownsClient ? HttpClients.createSystem() : builder.httpClient;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static Builder custom() {
        return new Builder();
    }

    public URI getBaseUri() {
        return baseUri;
    }

    @Override
    public RtmConnectResponse rtmConnect(final boolean batchPresenceAware, final boolean presenceSub) throws IOException {
        final List<NameValuePair> params = new ArrayList<>();
        params.add(new BasicNameValuePair("token", token));
        if (batchPresenceAware) {
            params.add(new BasicNameValuePair("batch_presence_aware", "true"));
        }
        if (presenceSub) {
            params.add(new BasicNameValuePair("presence_sub", "true"));
        }
        final URI uri = baseUri.resolve(RTM_CONNECT);
        final HttpPost post = new HttpPost(uri);
        post.setConfig(requestConfig);
        post.setEntity(new UrlEncodedFormEntity(params, StandardCharsets.UTF_8));

        if (LOG.isDebugEnabled()) {
            LOG.debug("Calling {}", uri);
        }
        final RtmConnectResponse response = httpClient.execute(post, httpResponse -> {
            final int status = httpResponse.getCode();
            final String body = httpResponse.getEntity() != null
                    ? EntityUtils.toString(httpResponse.getEntity(), StandardCharsets.UTF_8)
                    : null;
            if (status != HttpStatus.SC_OK) {
                throw new RtmGatewayException(RTM_CONNECT, "HTTP " + status);
            }
            if (body == null) {
                throw new RtmGatewayException(RTM_CONNECT, "empty response");
            }
            try {
                return mapper.readValue(body, RtmConnectResponse.class);
            } catch (final JsonProcessingException ex) {
                throw new RtmGatewayException(RTM_CONNECT, "malformed response", ex);
            }
        });
        if (!response.isOk()) {
            throw new RtmGatewayException(RTM_CONNECT, response.getError() != null ? response.getError() : "unknown_error");
        }
        if (response.getUrl() == null) {
            throw new RtmGatewayException(RTM_CONNECT, "no url in response");
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} succeeded: {}", RTM_CONNECT, response);
        }
        return response;
    }

    @Override
    public void close() throws IOException {
        if (ownsClient) {
            httpClient.close();
        }
    }

    public static final class Builder {

        private String token;
        private URI baseUri = DEFAULT_BASE_URI;
        private Timeout requestTimeout = Timeout.ofSeconds(30);
        private CloseableHttpClient httpClient;

        Builder() {
        }

        public Builder setToken(final String token) {
            this.token = token;
            return this;
        }

        /**
         * Base of the Web API method URIs; a missing trailing slash is added.
         */
        public Builder setBaseUri(final URI baseUri) {
            this.baseUri = baseUri;
            return this;
        }

        /**
         * Bound on connection lease and response wait; {@link Timeout#DISABLED} for none.
         */
        public Builder setRequestTimeout(final Timeout requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        /**
         * HTTP client to use; the gateway does not close a client supplied here.
         */
        public Builder setHttpClient(final CloseableHttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public WebApiRtmGateway build() {
            Args.notBlank(token, "Token");
            Args.notNull(baseUri, "Base URI");
            Args.notNull(requestTimeout, "Request timeout");
            final String s = baseUri.toString();
            if (!s.endsWith("/")) {
                baseUri = URI.create(s + "/");
            }
            return new WebApiRtmGateway(this);
        }

    }

}
