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

import java.io.IOException;

/**
 * Signals a Web API call that completed but was rejected ({@code "ok": false}) or
 * returned an unusable response.
 */
public class RtmGatewayException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String method;
    private final String error;

    public RtmGatewayException(final String method, final String error) {
        super(method + " failed: " + error);
        this.method = method;
        this.error = error;
    }

    public RtmGatewayException(final String method, final String message, final Throwable cause) {
        super(method + " failed: " + message, cause);
        this.method = method;
        this.error = null;
    }

    public String getMethod() {
        return method;
    }

    /**
     * @return the API error code, such as {@code invalid_auth}, or {@code null}.
     */
    public String getError() {
        return error;
    }

}
