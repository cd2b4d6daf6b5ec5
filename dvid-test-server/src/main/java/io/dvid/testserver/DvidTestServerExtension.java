package io.dvid.testserver;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.io.IOException;

/// A JUnit Jupiter extension that shares one [DvidTestServerFixture] across a test run.
///
/// The server is started the first time any test class using the extension runs
/// and stopped when the JVM exits. Tests that need isolation create their own
/// repository with [FakeDvidStore#createRepo(String, String)] or through the client,
/// so they never see each other's instances.
///
/// Example usage:
///
/// ```java
/// @ExtendWith(DvidTestServerExtension.class)
/// public class MyTest {
///     // DvidTestServerExtension.getAddress()
/// }
/// ```
public class DvidTestServerExtension implements BeforeAllCallback {
    private static final Logger logger = LogManager.getLogger(DvidTestServerExtension.class);
    private static final Object lock = new Object();
    private static DvidTestServerFixture server;

    /**
     * Starts the shared server if it is not running yet. Thread-safe and idempotent.
     */
    public static void initialize() {
        synchronized (lock) {
            if (server != null) {
                return;
            }
            try {
                logger.info("Starting shared DVID test server");
                DvidTestServerFixture fixture = new DvidTestServerFixture();
                fixture.start();
                server = fixture;
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    synchronized (lock) {
                        if (server != null) {
                            logger.info("Stopping shared DVID test server (shutdown hook)");
                            server.close();
                            server = null;
                        }
                    }
                }));
            } catch (IOException e) {
                logger.error("Failed to start DVID test server", e);
                throw new RuntimeException("Failed to start DVID test server", e);
            }
        }
    }

    /// @return host and port of the shared server
    public static String getAddress() {
        initialize();
        return server.getAddress();
    }

    /// @return the shared server
    public static DvidTestServerFixture getServer() {
        initialize();
        return server;
    }

    @Override
    public void beforeAll(ExtensionContext context) {
        initialize();
        logger.debug("DvidTestServerExtension beforeAll called for {}", context.getDisplayName());
    }
}
