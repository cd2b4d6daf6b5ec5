package io.dvid.client.transport;

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

import java.io.IOException;

/// Issues requests against one store address.
///
/// Implementations return whatever status the store sent; interpreting
/// non-2xx statuses is left to the caller. Implementations must be safe
/// for concurrent use and must not retry on their own.
public interface Connection extends AutoCloseable {

    /// Sends a request.
    /// @param endpoint store endpoint starting with `/`, e.g. `/node/abc/grayscale/info`
    /// @param method HTTP verb
    /// @param payload request body, or null for none
    /// @return the response
    /// @throws IOException if no response could be obtained
    ConnectionResponse request(String endpoint, ConnectionMethod method, byte[] payload) throws IOException;

    /// @return the store address this connection talks to
    String getAddress();

    @Override
    default void close() throws IOException {
    }
}
