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

import io.dvid.client.transport.ConnectionMethod;

/// Thrown when a request fails at the HTTP layer, either with a non-2xx status or
/// without any response at all.
public class TransportException extends DvidException {

    /// Status used when no HTTP response was received.
    public static final int NO_RESPONSE = -1;

    private final int status;
    private final ConnectionMethod method;
    private final String endpoint;

    public TransportException(ConnectionMethod method, String endpoint, int status, String detail) {
        super(describe(method, endpoint, status, detail));
        this.status = status;
        this.method = method;
        this.endpoint = endpoint;
    }

    public TransportException(ConnectionMethod method, String endpoint, Throwable cause) {
        super(describe(method, endpoint, NO_RESPONSE, cause.getMessage()), cause);
        this.status = NO_RESPONSE;
        this.method = method;
        this.endpoint = endpoint;
    }

    public int getStatus() {
        return status;
    }

    public ConnectionMethod getMethod() {
        return method;
    }

    public String getEndpoint() {
        return endpoint;
    }

    private static String describe(ConnectionMethod method, String endpoint, int status, String detail) {
        StringBuilder sb = new StringBuilder();
        sb.append(method).append(' ').append(endpoint);
        if (status == NO_RESPONSE) {
            sb.append(" failed without a response");
        } else {
            sb.append(" failed with status ").append(status);
        }
        if (detail != null && !detail.isBlank()) {
            sb.append(": ").append(detail.strip());
        }
        return sb.toString();
    }
}
