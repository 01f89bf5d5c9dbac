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
package io.github.rtmclient.api;

/**
 * Receives events of one {@link RtmEventType}.
 * <p>
 * Events of a connection are delivered one at a time, in arrival order, on the
 * connection's receive thread. Implementations should return quickly; a listener that
 * blocks holds back every later message of the same connection. Exceptions thrown by a
 * listener are reported to the client's listener exception callback and do not prevent
 * delivery to the remaining listeners.
 *
 * @param <T> event payload type
 * @since 1.0
 */
@FunctionalInterface
public interface RtmEventListener<T> {

    void onEvent(T event);

}
