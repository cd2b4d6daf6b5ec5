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

import io.dvid.client.config.DvidClientConfig;
import io.dvid.testserver.DvidTestServerExtension;
import io.dvid.testserver.FakeDvidStore;

import java.io.IOException;

/// Creates fresh repositories on the shared test server, so test classes never see each other's data.
final class TestNodes {

    private TestNodes() {
    }

    static DvidClientConfig config() {
        return DvidClientConfig.defaults(DvidTestServerExtension.getAddress());
    }

    static String newRepo(String alias) throws IOException {
        try (DvidServerService server = new DvidServerService(config())) {
            return server.createNewRepo(alias, "created by " + alias);
        }
    }

    static FakeDvidStore store() {
        return DvidTestServerExtension.getServer().getStore();
    }
}
