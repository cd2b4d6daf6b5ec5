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

import com.google.gson.JsonObject;
import io.dvid.client.config.DvidClientConfig;
import io.dvid.client.throttle.ThrottleGate;
import io.dvid.client.transport.Connection;
import io.dvid.client.transport.ConnectionMethod;
import io.dvid.client.transport.DvidConnection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/// Server-level calls that are not scoped to a version node.
public class DvidServerService implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(DvidServerService.class);

    private final StoreRequests requests;
    private final DvidClientConfig config;
    private final boolean ownsConnection;

    /// Opens a connection of its own to the configured server.
    public DvidServerService(DvidClientConfig config) {
        this(new DvidConnection(config), config, true);
    }

    /// Uses an existing connection, which stays open when this service is closed.
    public DvidServerService(Connection connection, DvidClientConfig config) {
        this(connection, config, false);
    }

    private DvidServerService(Connection connection, DvidClientConfig config, boolean ownsConnection) {
        this.requests = new StoreRequests(connection);
        this.config = config;
        this.ownsConnection = ownsConnection;
    }

    /// Creates a repository.
    /// @param alias short name of the repository
    /// @param description free-text description
    /// @return uuid of the repository's root node
    public String createNewRepo(String alias, String description) {
        JsonObject request = new JsonObject();
        request.addProperty("alias", alias);
        request.addProperty("description", description);
        String endpoint = "/repos";
        JsonObject response = StoreRequests.parseJsonObject(
            requests.send(endpoint, ConnectionMethod.POST, StoreRequests.utf8(request.toString())), endpoint);
        if (!response.has("root")) {
            throw new DvidException("Repository creation response has no root uuid: " + response);
        }
        String uuid = response.get("root").getAsString();
        logger.info("created repository '{}' with root {}", alias, uuid);
        return uuid;
    }

    /// @return the server's self-description
    public JsonObject getServerInfo() {
        String endpoint = "/server/info";
        return StoreRequests.parseJsonObject(requests.send(endpoint, ConnectionMethod.GET, null), endpoint);
    }

    /// A node service sharing this service's connection and the process-wide throttle gate.
    /// @param uuid node uuid
    /// @return the node service; closing it leaves the connection open
    public DvidNodeService openNode(String uuid) {
        return new DvidNodeService(requests.connection(), uuid, ThrottleGate.processWide(), config);
    }

    @Override
    public void close() throws IOException {
        if (ownsConnection) {
            requests.connection().close();
        }
    }
}
