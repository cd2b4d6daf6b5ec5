package io.dvid.client.graph;

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

import io.dvid.client.ShapeMismatchException;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Binary payloads of the property transaction endpoints. All integers are
/// little-endian unsigned 64-bit.
///
/// - vertex read request: `count, id...`
/// - vertex read response: `count, (id, token, size, bytes)...`
/// - edge read request: `count, (id1, id2)...`
/// - edge read response: `tokenCount, (vertex, token)..., count, (id1, id2, size, bytes)...`
/// - vertex write request: `count, (id, token, size, bytes)...`
/// - edge write request: `tokenCount, (vertex, token)..., count, (id1, id2, size, bytes)...`
/// - write response: `failedCount, vertex...`
///
/// A property of size zero is an absent property.
public final class PropertyCodec {

    private PropertyCodec() {
    }

    /// A write request along with the items that could not be guarded by a token and
    /// were therefore left out of it.
    /// @param payload request body
    /// @param sent items included in the request
    /// @param unguarded items with no token for at least one vertex
    /// @param <T> [Vertex] or [Edge]
    public record WritePlan<T>(byte[] payload, List<T> sent, List<T> unguarded) {
    }

    public static byte[] encodeVertexQuery(List<Vertex> vertices) {
        ByteBuffer buffer = allocate(8 + 8L * vertices.size());
        buffer.putLong(vertices.size());
        for (Vertex vertex : vertices) {
            buffer.putLong(vertex.id());
        }
        return buffer.array();
    }

    public static byte[] encodeEdgeQuery(List<Edge> edges) {
        ByteBuffer buffer = allocate(8 + 16L * edges.size());
        buffer.putLong(edges.size());
        for (Edge edge : edges) {
            buffer.putLong(edge.id1());
            buffer.putLong(edge.id2());
        }
        return buffer.array();
    }

    /// @param response vertex read response
    /// @param requested vertices in request order
    /// @return values in request order and the tokens of every returned vertex
    /// @throws ShapeMismatchException if the payload is truncated or omits a requested vertex
    public static PropertyBatch decodeVertexProperties(byte[] response, List<Vertex> requested) {
        Reader reader = new Reader(response);
        long count = reader.count(24);
        Map<Long, TransactionToken> tokens = new LinkedHashMap<>();
        Map<Long, byte[]> values = new HashMap<>();
        for (long i = 0; i < count; i++) {
            long id = reader.u64();
            tokens.put(id, new TransactionToken(reader.u64()));
            values.put(id, reader.blob());
        }
        reader.expectEnd();
        List<Optional<byte[]>> ordered = new ArrayList<>(requested.size());
        for (Vertex vertex : requested) {
            if (!tokens.containsKey(vertex.id())) {
                throw new ShapeMismatchException("Property response omits vertex "
                    + Long.toUnsignedString(vertex.id()), requested.size(), count);
            }
            ordered.add(present(values.get(vertex.id())));
        }
        return new PropertyBatch(ordered, new VertexTransactions(tokens));
    }

    /// @param response edge read response
    /// @param requested edges in request order
    /// @return values in request order and the tokens of every endpoint vertex
    public static PropertyBatch decodeEdgeProperties(byte[] response, List<Edge> requested) {
        Reader reader = new Reader(response);
        long tokenCount = reader.count(16);
        Map<Long, TransactionToken> tokens = new LinkedHashMap<>();
        for (long i = 0; i < tokenCount; i++) {
            long id = reader.u64();
            tokens.put(id, new TransactionToken(reader.u64()));
        }
        long count = reader.count(24);
        Map<Edge, byte[]> values = new HashMap<>();
        for (long i = 0; i < count; i++) {
            long id1 = reader.u64();
            long id2 = reader.u64();
            values.put(new Edge(id1, id2), reader.blob());
        }
        reader.expectEnd();
        List<Optional<byte[]>> ordered = new ArrayList<>(requested.size());
        for (Edge edge : requested) {
            if (!values.containsKey(edge)) {
                throw new ShapeMismatchException("Property response omits " + edge, requested.size(), count);
            }
            ordered.add(present(values.get(edge)));
        }
        return new PropertyBatch(ordered, new VertexTransactions(tokens));
    }

    public static WritePlan<Vertex> encodeVertexWrite(List<Vertex> vertices, List<byte[]> properties,
                                                      VertexTransactions transactions) {
        requireSameSize(vertices.size(), properties.size());
        List<Vertex> sent = new ArrayList<>();
        List<Vertex> unguarded = new ArrayList<>();
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        for (int i = 0; i < vertices.size(); i++) {
            Vertex vertex = vertices.get(i);
            Optional<TransactionToken> token = transactions.tokenFor(vertex.id());
            if (token.isEmpty()) {
                unguarded.add(vertex);
                continue;
            }
            byte[] value = requireValue(properties.get(i));
            writeLong(body, vertex.id());
            writeLong(body, token.get().value());
            writeLong(body, value.length);
            body.writeBytes(value);
            sent.add(vertex);
        }
        ByteArrayOutputStream payload = new ByteArrayOutputStream(8 + body.size());
        writeLong(payload, sent.size());
        payload.writeBytes(body.toByteArray());
        return new WritePlan<>(payload.toByteArray(), sent, unguarded);
    }

    public static WritePlan<Edge> encodeEdgeWrite(List<Edge> edges, List<byte[]> properties,
                                                  VertexTransactions transactions) {
        requireSameSize(edges.size(), properties.size());
        List<Edge> sent = new ArrayList<>();
        List<Edge> unguarded = new ArrayList<>();
        Set<Long> guardedVertices = new LinkedHashSet<>();
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        for (int i = 0; i < edges.size(); i++) {
            Edge edge = edges.get(i);
            if (!transactions.contains(edge.id1()) || !transactions.contains(edge.id2())) {
                unguarded.add(edge);
                continue;
            }
            byte[] value = requireValue(properties.get(i));
            guardedVertices.add(edge.id1());
            guardedVertices.add(edge.id2());
            writeLong(body, edge.id1());
            writeLong(body, edge.id2());
            writeLong(body, value.length);
            body.writeBytes(value);
            sent.add(edge);
        }
        ByteArrayOutputStream payload = new ByteArrayOutputStream();
        writeLong(payload, guardedVertices.size());
        for (long vertexId : guardedVertices) {
            writeLong(payload, vertexId);
            writeLong(payload, transactions.tokenFor(vertexId).orElseThrow().value());
        }
        writeLong(payload, sent.size());
        payload.writeBytes(body.toByteArray());
        return new WritePlan<>(payload.toByteArray(), sent, unguarded);
    }

    /// @return ids of vertices whose tokens were stale
    public static Set<Long> decodeFailedVertices(byte[] response) {
        Reader reader = new Reader(response);
        long count = reader.count(8);
        Set<Long> failed = new HashSet<>();
        for (long i = 0; i < count; i++) {
            failed.add(reader.u64());
        }
        reader.expectEnd();
        return failed;
    }

    private static Optional<byte[]> present(byte[] value) {
        return value == null || value.length == 0 ? Optional.empty() : Optional.of(value);
    }

    private static byte[] requireValue(byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("Property values cannot be null");
        }
        return value;
    }

    private static void requireSameSize(int items, int values) {
        if (items != values) {
            throw new IllegalArgumentException("Got " + values + " property values for " + items + " items");
        }
    }

    private static ByteBuffer allocate(long size) {
        if (size > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Property request too large: " + size + " bytes");
        }
        return ByteBuffer.allocate((int) size).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static void writeLong(ByteArrayOutputStream out, long value) {
        for (int i = 0; i < 8; i++) {
            out.write((int) (value >>> (8 * i)) & 0xFF);
        }
    }

    /// Bounds-checked little-endian reader; every short read is a shape mismatch.
    private static final class Reader {
        private final ByteBuffer buffer;

        Reader(byte[] payload) {
            this.buffer = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        }

        long u64() {
            require(8);
            return buffer.getLong();
        }

        /// Reads an element count and checks that the remaining bytes could hold that many
        /// elements of at least `minElementBytes` each.
        long count(int minElementBytes) {
            long count = u64();
            if (count < 0 || count > buffer.remaining() / minElementBytes) {
                throw new ShapeMismatchException("Property payload declares " + Long.toUnsignedString(count)
                    + " entries but holds " + buffer.remaining() + " bytes", count * minElementBytes, buffer.remaining());
            }
            return count;
        }

        byte[] blob() {
            long size = u64();
            if (size < 0 || size > buffer.remaining()) {
                throw new ShapeMismatchException("Property value truncated", size, buffer.remaining());
            }
            byte[] value = new byte[(int) size];
            buffer.get(value);
            return value;
        }

        void expectEnd() {
            if (buffer.hasRemaining()) {
                throw new ShapeMismatchException("Trailing bytes after property payload",
                    buffer.position(), buffer.limit());
            }
        }

        private void require(int bytes) {
            if (buffer.remaining() < bytes) {
                throw new ShapeMismatchException("Property payload truncated", buffer.position() + bytes, buffer.limit());
            }
        }
    }
}
