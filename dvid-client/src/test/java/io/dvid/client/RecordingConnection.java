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

import io.dvid.client.transport.Connection;
import io.dvid.client.transport.ConnectionMethod;
import io.dvid.client.transport.ConnectionResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/// In-process [Connection] that records every request and answers from a queue of
/// canned responses, defaulting to an empty 200.
class RecordingConnection implements Connection {

    record Recorded(ConnectionMethod method, String endpoint, byte[] payload) {
    }

    private final List<Recorded> requests = Collections.synchronizedList(new ArrayList<>());
    private final Deque<ConnectionResponse> responses = new ArrayDeque<>();
    private IOException failure;

    synchronized RecordingConnection respond(int status, byte[] body) {
        responses.add(new ConnectionResponse(status, body));
        return this;
    }

    synchronized RecordingConnection respond(int status, String body) {
        return respond(status, body.getBytes(StandardCharsets.UTF_8));
    }

    synchronized RecordingConnection failWith(IOException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public synchronized ConnectionResponse request(String endpoint, ConnectionMethod method, byte[] payload)
        throws IOException {
        requests.add(new Recorded(method, endpoint, payload));
        if (failure != null) {
            throw failure;
        }
        ConnectionResponse next = responses.poll();
        return next == null ? new ConnectionResponse(200, new byte[0]) : next;
    }

    @Override
    public String getAddress() {
        return "recording:0";
    }

    List<Recorded> requests() {
        return List.copyOf(requests);
    }

    Recorded last() {
        return requests.get(requests.size() - 1);
    }
}
