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

import io.dvid.client.config.DvidClientConfig;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.atomic.AtomicBoolean;

/// [Connection] backed by a pooled Apache HttpClient.
///
/// Every endpoint is resolved against [DvidClientConfig#baseUrl()]. Request
/// bodies are sent on any verb, GET included, because several store read
/// endpoints take their query in the body. Nothing is retried here.
public class DvidConnection implements Connection {

    private static final Logger logger = LogManager.getLogger(DvidConnection.class);

    private final CloseableHttpClient httpClient;
    private final String baseUrl;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /// Creates a connection for the configured server.
    /// @param config client settings
    public DvidConnection(DvidClientConfig config) {
        this.baseUrl = config.baseUrl();
        this.httpClient = createHttpClient(config);
    }

    private static CloseableHttpClient createHttpClient(DvidClientConfig config) {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
            .setConnectTimeout(Timeout.of(config.connectTimeout()))
            .setSocketTimeout(Timeout.of(config.responseTimeout()))
            .build();
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(connectionConfig)
            .setMaxConnTotal(config.maxConnections())
            .setMaxConnPerRoute(config.maxConnections())
            .build();
        RequestConfig requestConfig = RequestConfig.custom()
            .setResponseTimeout(Timeout.of(config.responseTimeout()))
            .build();
        return HttpClients.custom()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(requestConfig)
            .disableAutomaticRetries()
            .build();
    }

    @Override
    public ConnectionResponse request(String endpoint, ConnectionMethod method, byte[] payload) throws IOException {
        if (closed.get()) {
            throw new IOException("DvidConnection to " + baseUrl + " has been closed");
        }
        if (endpoint == null || !endpoint.startsWith("/")) {
            throw new IllegalArgumentException("Endpoint must start with '/': " + endpoint);
        }
        HttpUriRequestBase request = new HttpUriRequestBase(method.name(), URI.create(baseUrl + endpoint));
        if (payload != null) {
            request.setEntity(new ByteArrayEntity(payload, ContentType.APPLICATION_OCTET_STREAM));
        }
        logger.debug("{} {} ({} bytes)", method, endpoint, payload == null ? 0 : payload.length);
        return httpClient.execute(request, response -> {
            HttpEntity entity = response.getEntity();
            byte[] body = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
            return new ConnectionResponse(response.getCode(), body);
        });
    }

    @Override
    public String getAddress() {
        return baseUrl;
    }

    @Override
    public void close() throws IOException {
        if (closed.compareAndSet(false, true)) {
            httpClient.close();
        }
    }
}
