package io.dvid.client.config;

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

import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/// Client settings for talking to one DVID server.
///
/// Settings can be built in code with [#defaults(String)] and the `with*`
/// methods, or loaded from a YAML file such as:
///
/// ```yaml
/// server: emdata.example.org:8000
/// api-prefix: /api
/// connect-timeout-ms: 10000
/// response-timeout-ms: 300000
/// max-connections: 50
/// throttle: true
/// label-block-writes: false
/// ```
/// @param serverAddress
///     host and port of the server, with or without an `http://` scheme
/// @param apiPrefix
///     path prefix of the REST interface on the server
/// @param connectTimeout
///     time allowed to establish a connection
/// @param responseTimeout
///     time allowed between response bytes; volume reads can be slow
/// @param maxConnections
///     size of the connection pool
/// @param throttleByDefault
///     whether volume transfers pass through the throttle gate when the caller does not say
/// @param labelBlockWrites
///     enables the label block write path, which not every store version accepts
public record DvidClientConfig(
    String serverAddress,
    String apiPrefix,
    Duration connectTimeout,
    Duration responseTimeout,
    int maxConnections,
    boolean throttleByDefault,
    boolean labelBlockWrites
) {

    public static final String DEFAULT_API_PREFIX = "/api";
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_CONNECTIONS = 50;

    public DvidClientConfig {
        if (serverAddress == null || serverAddress.isBlank()) {
            throw new IllegalArgumentException("Server address cannot be null or empty");
        }
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("max connections must be positive: " + maxConnections);
        }
        apiPrefix = apiPrefix == null ? "" : apiPrefix;
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
        responseTimeout = responseTimeout == null ? DEFAULT_RESPONSE_TIMEOUT : responseTimeout;
    }

    /// Default settings for a server address.
    /// @param serverAddress host and port, with or without scheme
    /// @return the configuration
    public static DvidClientConfig defaults(String serverAddress) {
        return new DvidClientConfig(serverAddress, DEFAULT_API_PREFIX, DEFAULT_CONNECT_TIMEOUT,
            DEFAULT_RESPONSE_TIMEOUT, DEFAULT_MAX_CONNECTIONS, true, false);
    }

    /// Loads settings from a YAML file. Only `server` is required.
    /// @param yamlFile the configuration file
    /// @return the configuration
    /// @throws RuntimeException if the file cannot be read or is not a YAML map
    public static DvidClientConfig load(Path yamlFile) {
        String content;
        try {
            content = Files.readString(yamlFile);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read client configuration: " + yamlFile, e);
        }
        return parse(content, yamlFile.toString());
    }

    /// Parses settings from YAML text.
    /// @param yaml YAML content
    /// @param origin description of where the content came from, for error messages
    /// @return the configuration
    public static DvidClientConfig parse(String yaml, String origin) {
        Load loader = new Load(LoadSettings.builder().build());
        Object loaded = loader.loadFromString(yaml);
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new RuntimeException("Client configuration must be a YAML map: " + origin);
        }
        Object server = map.get("server");
        if (server == null) {
            throw new RuntimeException("Client configuration has no 'server' entry: " + origin);
        }
        DvidClientConfig config = defaults(server.toString());
        if (map.containsKey("api-prefix")) {
            config = config.withApiPrefix(String.valueOf(map.get("api-prefix")));
        }
        if (map.containsKey("connect-timeout-ms")) {
            config = config.withConnectTimeout(Duration.ofMillis(asLong(map, "connect-timeout-ms", origin)));
        }
        if (map.containsKey("response-timeout-ms")) {
            config = config.withResponseTimeout(Duration.ofMillis(asLong(map, "response-timeout-ms", origin)));
        }
        if (map.containsKey("max-connections")) {
            config = config.withMaxConnections((int) asLong(map, "max-connections", origin));
        }
        if (map.containsKey("throttle")) {
            config = config.withThrottleByDefault(asBoolean(map, "throttle", origin));
        }
        if (map.containsKey("label-block-writes")) {
            config = config.withLabelBlockWrites(asBoolean(map, "label-block-writes", origin));
        }
        return config;
    }

    /// The server's base URL, scheme included, without a trailing slash.
    public String baseUrl() {
        String address = serverAddress.strip();
        String lower = address.toLowerCase();
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            address = "http://" + address;
        }
        while (address.endsWith("/")) {
            address = address.substring(0, address.length() - 1);
        }
        return address + apiPrefix;
    }

    public DvidClientConfig withApiPrefix(String apiPrefix) {
        return new DvidClientConfig(serverAddress, apiPrefix, connectTimeout, responseTimeout,
            maxConnections, throttleByDefault, labelBlockWrites);
    }

    public DvidClientConfig withConnectTimeout(Duration connectTimeout) {
        return new DvidClientConfig(serverAddress, apiPrefix, connectTimeout, responseTimeout,
            maxConnections, throttleByDefault, labelBlockWrites);
    }

    public DvidClientConfig withResponseTimeout(Duration responseTimeout) {
        return new DvidClientConfig(serverAddress, apiPrefix, connectTimeout, responseTimeout,
            maxConnections, throttleByDefault, labelBlockWrites);
    }

    public DvidClientConfig withMaxConnections(int maxConnections) {
        return new DvidClientConfig(serverAddress, apiPrefix, connectTimeout, responseTimeout,
            maxConnections, throttleByDefault, labelBlockWrites);
    }

    public DvidClientConfig withThrottleByDefault(boolean throttleByDefault) {
        return new DvidClientConfig(serverAddress, apiPrefix, connectTimeout, responseTimeout,
            maxConnections, throttleByDefault, labelBlockWrites);
    }

    public DvidClientConfig withLabelBlockWrites(boolean labelBlockWrites) {
        return new DvidClientConfig(serverAddress, apiPrefix, connectTimeout, responseTimeout,
            maxConnections, throttleByDefault, labelBlockWrites);
    }

    private static long asLong(Map<?, ?> map, String key, String origin) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new RuntimeException("'" + key + "' must be a number in " + origin + ": " + value, e);
        }
    }

    private static boolean asBoolean(Map<?, ?> map, String key, String origin) {
        Object value = map.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = String.valueOf(value).trim().toLowerCase();
        if (text.equals("true") || text.equals("on") || text.equals("yes")) {
            return true;
        }
        if (text.equals("false") || text.equals("off") || text.equals("no")) {
            return false;
        }
        throw new RuntimeException("'" + key + "' must be a boolean in " + origin + ": " + value);
    }
}
