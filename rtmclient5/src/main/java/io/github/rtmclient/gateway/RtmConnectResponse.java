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

import java.net.URI;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of an {@code rtm.connect} response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RtmConnectResponse {

    private final boolean ok;
    private final String error;
    private final String url;
    private final Team team;
    private final Self self;

    @JsonCreator
    public RtmConnectResponse(
            @JsonProperty("ok") final boolean ok,
            @JsonProperty("error") final String error,
            @JsonProperty("url") final String url,
            @JsonProperty("team") final Team team,
            @JsonProperty("self") final Self self) {
        this.ok = ok;
        this.error = error;
        this.url = url;
        this.team = team;
        this.self = self;
    }

    public boolean isOk() {
        return ok;
    }

    public String getError() {
        return error;
    }

    public String getUrl() {
        return url;
    }

    public URI getUri() {
        return url != null ? URI.create(url) : null;
    }

    public Team getTeam() {
        return team;
    }

    public Self getSelf() {
        return self;
    }

    @Override
    public String toString() {
        return "RtmConnectResponse{ok=" + ok + ", error=" + error + ", team=" + team + ", self=" + self + "}";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Team {

        private final String id;
        private final String name;
        private final String domain;

        @JsonCreator
        public Team(
                @JsonProperty("id") final String id,
                @JsonProperty("name") final String name,
                @JsonProperty("domain") final String domain) {
            this.id = id;
            this.name = name;
            this.domain = domain;
        }

        public String getId() {
            return id;
        }

        public String getName() {
            return name;
        }

        public String getDomain() {
            return domain;
        }

        @Override
        public String toString() {
            return id + "/" + domain;
        }

    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Self {

        private final String id;
        private final String name;

        @JsonCreator
        public Self(
                @JsonProperty("id") final String id,
                @JsonProperty("name") final String name) {
            this.id = id;
            this.name = name;
        }

        public String getId() {
            return id;
        }

        public String getName() {
            return name;
        }

        @Override
        public String toString() {
            return id + "/" + name;
        }

    }

}
