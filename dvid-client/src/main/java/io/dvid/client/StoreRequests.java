package io.dvid.client;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.dvid.client.throttle.ThrottleGate;
import io.dvid.client.transport.Connection;
import io.dvid.client.transport.ConnectionMethod;
import io.dvid.client.transport.ConnectionResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/// Request plumbing shared by the node and server services: maps I/O failures and
/// non-2xx statuses to [TransportException] and runs throttled transfers through a gate.
final class StoreRequests {

    private static final int MAX_ERROR_DETAIL = 256;

    private final Connection connection;

    StoreRequests(Connection connection) {
        this.connection = connection;
    }

    Connection connection() {
        return connection;
    }

    /// Sends a request and returns the response whatever its status.
    ConnectionResponse exchange(String endpoint, ConnectionMethod method, byte[] payload) {
        try {
            return connection.request(endpoint, method, payload);
        } catch (IOException e) {
            throw new TransportException(method, endpoint, e);
        }
    }

    /// Sends a request and requires a 2xx status.
    ConnectionResponse send(String endpoint, ConnectionMethod method, byte[] payload) {
        ConnectionResponse response = exchange(endpoint, method, payload);
        if (!response.isSuccess()) {
            throw new TransportException(method, endpoint, response.status(), errorDetail(response));
        }
        return response;
    }

    /// Sends a request, holding the gate for its duration when `throttle` is set.
    ConnectionResponse send(ThrottleGate gate, boolean throttle, String endpoint, ConnectionMethod method,
                            byte[] payload) {
        if (!throttle) {
            return send(endpoint, method, payload);
        }
        try {
            return gate.call(() -> send(endpoint, method, payload));
        } catch (IOException e) {
            throw new TransportException(method, endpoint, e);
        }
    }

    static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    static JsonElement parseJson(ConnectionResponse response, String endpoint) {
        try {
            return JsonParser.parseString(response.bodyAsString());
        } catch (JsonParseException e) {
            throw new DvidException("Response from " + endpoint + " is not valid JSON", e);
        }
    }

    static JsonObject parseJsonObject(ConnectionResponse response, String endpoint) {
        JsonElement element = parseJson(response, endpoint);
        if (!element.isJsonObject()) {
            throw new DvidException("Response from " + endpoint + " is not a JSON object: " + element);
        }
        return element.getAsJsonObject();
    }

    private static String errorDetail(ConnectionResponse response) {
        String body = response.bodyAsString();
        return body.length() > MAX_ERROR_DETAIL ? body.substring(0, MAX_ERROR_DETAIL) + "..." : body;
    }
}
