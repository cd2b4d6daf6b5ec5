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
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;

/**
 * A test fixture that hosts an in-memory DVID store in an embedded Jetty server.
 * <p>
 * The server listens on 127.0.0.1 on a port chosen by the operating system and
 * answers the REST interface under {@code /api}. Tests talk to it with the real
 * client transport and can inspect the backing {@link FakeDvidStore} directly.
 * <p>
 * Example usage:
 * ```java
 * try (DvidTestServerFixture server = new DvidTestServerFixture()) {
 *     server.start();
 *     String address = server.getAddress();
 *     // point a client at address
 * }
 * ```
 */
public class DvidTestServerFixture implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(DvidTestServerFixture.class);

    private final FakeDvidStore store;
    private final FakeDvidServlet servlet;
    private Server server;
    private int port;

    /**
     * Creates a fixture over an empty store.
     */
    public DvidTestServerFixture() {
        this(new FakeDvidStore());
    }

    /**
     * Creates a fixture over an existing store.
     *
     * @param store The store to serve
     */
    public DvidTestServerFixture(FakeDvidStore store) {
        this.store = store;
        this.servlet = new FakeDvidServlet(store);
    }

    /**
     * Starts the server on a free port.
     *
     * @throws IOException If the server cannot be started
     */
    public void start() throws IOException {
        server = new Server();

        ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(0);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.addServlet(new ServletHolder("dvid", servlet), "/api/*");
        server.setHandler(context);

        try {
            server.start();
            port = connector.getLocalPort();
            logger.info("DVID test server started on port {}", port);
        } catch (Exception e) {
            throw new IOException("Failed to start DVID test server", e);
        }
    }

    /**
     * Gets the server address in the form clients are configured with.
     *
     * @return host and port, e.g. {@code 127.0.0.1:41234}
     */
    public String getAddress() {
        return "127.0.0.1:" + port;
    }

    public int getPort() {
        return port;
    }

    public FakeDvidStore getStore() {
        return store;
    }

    /**
     * Holds every throttled volume transfer open for at least the given time.
     *
     * @param millis delay in milliseconds, 0 to disable
     */
    public void setThrottledDelayMillis(long millis) {
        servlet.setThrottledDelayMillis(millis);
    }

    /**
     * Stops the server.
     */
    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger.info("DVID test server stopped");
            } catch (Exception e) {
                logger.error("Error stopping DVID test server", e);
            }
            server = null;
        }
    }
}
