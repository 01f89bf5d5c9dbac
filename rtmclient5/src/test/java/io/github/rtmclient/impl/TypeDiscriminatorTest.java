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
package io.github.rtmclient.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.fasterxml.jackson.core.JsonFactory;
import org.junit.jupiter.api.Test;

class TypeDiscriminatorTest {

    private final TypeDiscriminator discriminator = new TypeDiscriminator(new JsonFactory());

    @Test
    void type_as_first_key() {
        assertEquals("hello", discriminator.discriminate("{\"type\":\"hello\"}"));
    }

    @Test
    void type_after_nested_values() {
        assertEquals("message", discriminator.discriminate(
                "{\"item\":{\"type\":\"file\"},\"list\":[{\"type\":\"x\"}],\"n\":1,\"type\":\"message\"}"));
    }

    @Test
    void nested_type_only_is_not_a_discriminator() {
        assertNull(discriminator.discriminate("{\"item\":{\"type\":\"file\"}}"));
    }

    @Test
    void malformed_tail_still_classifies() {
        assertEquals("reaction_added", discriminator.discriminate("{\"type\":\"reaction_added\", \"item\": {oops"));
    }

    @Test
    void non_object_and_malformed_inputs_yield_null() {
        assertNull(discriminator.discriminate(null));
        assertNull(discriminator.discriminate(""));
        assertNull(discriminator.discriminate("[\"type\",\"hello\"]"));
        assertNull(discriminator.discriminate("\"hello\""));
        assertNull(discriminator.discriminate("{\"a\": tru"));
        assertNull(discriminator.discriminate("{}"));
    }

    @Test
    void non_string_type_yields_null() {
        assertNull(discriminator.discriminate("{\"type\":42}"));
        assertNull(discriminator.discriminate("{\"type\":null}"));
        assertNull(discriminator.discriminate("{\"type\":{\"name\":\"hello\"}}"));
    }

}
