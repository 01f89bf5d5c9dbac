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
 * Obtains the endpoint of a real-time messaging connection.
 */
public interface RtmConnectGateway {

    /**
     * Calls {@code rtm.connect}.
     *
     * @param batchPresenceAware only deliver presence events when subscribed.
     * @param presenceSub        subscribe to presence events with {@code presence_sub} messages.
     * @return a successful response with a connection URL.
     * @throws RtmGatewayException if the call was rejected.
     * @throws IOException         in case of an I/O error.
     */
    RtmConnectResponse rtmConnect(boolean batchPresenceAware, boolean presenceSub) throws IOException;

    default RtmConnectResponse rtmConnect() throws IOException {
        return rtmConnect(false, false);
    }

}
