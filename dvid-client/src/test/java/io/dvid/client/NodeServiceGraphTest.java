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

import io.dvid.client.graph.Edge;
import io.dvid.client.graph.Graph;
import io.dvid.client.graph.PropertyBatch;
import io.dvid.client.graph.PropertyWriteResult;
import io.dvid.client.graph.Vertex;
import io.dvid.client.graph.VertexTransactions;
import io.dvid.testserver.DvidTestServerExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(DvidTestServerExtension.class)
class NodeServiceGraphTest {

    private String uuid;
    private DvidNodeService node;

    @BeforeEach
    void setUp() throws IOException {
        uuid = TestNodes.newRepo("graph-test");
        node = new DvidNodeService(TestNodes.config(), uuid);
        assertThat(node.createGraph("graph")).isTrue();
        node.updateVertices("graph", List.of(new Vertex(1, 1.0), new Vertex(2, 2.0), new Vertex(3, 0.5)));
    }

    @AfterEach
    void tearDown() throws IOException {
        node.close();
    }

    @Test
    void testWeightUpdatesAccumulate() {
        node.updateVertices("graph", List.of(new Vertex(1, 1.0), new Vertex(2, 2.0)));
        node.updateEdges("graph", List.of(new Edge(1, 2, 0.5)));
        node.updateEdges("graph", List.of(new Edge(2, 1, 0.25)));

        Graph graph = node.getSubgraph("graph", List.of());
        assertThat(graph.vertices()).containsExactlyInAnyOrder(new Vertex(1), new Vertex(2), new Vertex(3));
        assertThat(weightOf(graph, 1)).isEqualTo(2.0);
        assertThat(weightOf(graph, 2)).isEqualTo(4.0);
        assertThat(graph.edges()).containsExactly(new Edge(1, 2));
        assertThat(graph.edges().get(0).weight()).isEqualTo(0.75);
    }

    @Test
    void testSubgraphAndNeighbors() {
        node.updateEdges("graph", List.of(new Edge(1, 2, 1.0), new Edge(2, 3, 1.0)));

        Graph sub = node.getSubgraph("graph", List.of(new Vertex(1), new Vertex(2)));
        assertThat(sub.vertices()).containsExactlyInAnyOrder(new Vertex(1), new Vertex(2));
        assertThat(sub.edges()).containsExactly(new Edge(1, 2));

        Graph neighbors = node.getVertexNeighbors("graph", new Vertex(3));
        assertThat(neighbors.vertices()).containsExactlyInAnyOrder(new Vertex(3), new Vertex(2));
        assertThat(neighbors.edges()).containsExactly(new Edge(2, 3));
    }

    @Test
    void testEdgesNeedTheirVertices() {
        assertThatThrownBy(() -> node.updateEdges("graph", List.of(new Edge(1, 99, 1.0))))
            .isInstanceOf(StructuralPreconditionException.class);
        assertThat(node.getSubgraph("graph", List.of()).edges()).isEmpty();
    }

    @Test
    void testLargeEdgeUpdates() {
        List<Vertex> vertices = new ArrayList<>();
        for (long id = 1; id <= 50; id++) {
            vertices.add(new Vertex(id, 1.0));
        }
        node.updateVertices("graph", vertices);
        List<Edge> edges = new ArrayList<>();
        for (long a = 1; a <= 50; a++) {
            for (long b = a + 1; b <= 50; b++) {
                edges.add(new Edge(a, b, 1.0));
            }
        }
        assertThat(edges.size()).isGreaterThan(DvidNodeService.GRAPH_TRANSACTION_LIMIT);

        List<Edge> withMissing = new ArrayList<>(edges);
        withMissing.add(new Edge(1, 999, 1.0));
        assertThatThrownBy(() -> node.updateEdges("graph", withMissing))
            .isInstanceOf(StructuralPreconditionException.class);
        assertThat(node.getSubgraph("graph", List.of()).edges()).isEmpty();

        node.updateEdges("graph", edges);
        assertThat(node.getSubgraph("graph", List.of()).edges()).hasSize(edges.size());
    }

    @Test
    void testConcurrentWeightUpdates() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                futures.add(pool.submit(() -> node.updateVertices("graph", List.of(new Vertex(7, 1.0)))));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(weightOf(node.getSubgraph("graph", List.of(new Vertex(7))), 7)).isEqualTo(20.0);
    }

    @Test
    void testVertexPropertiesWithTokens() {
        List<Vertex> vertices = List.of(new Vertex(1), new Vertex(2));
        PropertyBatch before = node.getVertexProperties("graph", vertices, "size");
        assertThat(before.value(0)).isEmpty();
        assertThat(before.value(1)).isEmpty();

        PropertyWriteResult<Vertex> result = node.setVertexProperties("graph", vertices, "size",
            List.of(new byte[]{10}, new byte[]{20}), before.transactions());
        assertThat(result.isComplete()).isTrue();
        assertThat(result.written()).containsExactly(new Vertex(1), new Vertex(2));

        PropertyBatch after = node.getVertexProperties("graph", vertices, "size");
        assertThat(after.value(0)).hasValueSatisfying(v -> assertThat(v).containsExactly(10));
        assertThat(after.value(1)).hasValueSatisfying(v -> assertThat(v).containsExactly(20));
        assertThat(after.transactions()).isNotEqualTo(before.transactions());
    }

    @Test
    void testStaleTokenBecomesLeftover() {
        List<Vertex> vertices = List.of(new Vertex(1), new Vertex(2));
        PropertyBatch read = node.getVertexProperties("graph", vertices, "size");
        TestNodes.store().bumpToken(uuid, "graph", 2);

        PropertyWriteResult<Vertex> result = node.setVertexProperties("graph", vertices, "size",
            List.of(new byte[]{1}, new byte[]{2}), read.transactions());
        assertThat(result.written()).containsExactly(new Vertex(1));
        assertThat(result.leftovers()).containsExactly(new Vertex(2));
        assertThat(node.getVertexProperties("graph", List.of(new Vertex(2)), "size").value(0)).isEmpty();

        PropertyBatch retry = node.getVertexProperties("graph", result.leftovers(), "size");
        VertexTransactions merged = read.transactions().merge(retry.transactions());
        PropertyWriteResult<Vertex> second = node.setVertexProperties("graph", result.leftovers(), "size",
            List.of(new byte[]{2}), merged);
        assertThat(second.isComplete()).isTrue();
        assertThat(node.getVertexProperties("graph", List.of(new Vertex(2)), "size").value(0))
            .hasValueSatisfying(v -> assertThat(v).containsExactly(2));
    }

    @Test
    void testRacingWritersWithSameTokens() throws Exception {
        List<Vertex> vertices = List.of(new Vertex(1));
        PropertyBatch read = node.getVertexProperties("graph", vertices, "size");

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<PropertyWriteResult<Vertex>>> writers = new ArrayList<>();
            for (int w = 0; w < 2; w++) {
                byte value = (byte) (w + 1);
                writers.add(pool.submit(() -> {
                    try (DvidNodeService writer = new DvidNodeService(TestNodes.config(), uuid)) {
                        return writer.setVertexProperties("graph", vertices, "size",
                            List.of(new byte[]{value}), read.transactions());
                    }
                }));
            }
            int complete = 0;
            int stale = 0;
            for (Future<PropertyWriteResult<Vertex>> writer : writers) {
                PropertyWriteResult<Vertex> result = writer.get(30, TimeUnit.SECONDS);
                if (result.isComplete()) {
                    complete++;
                } else {
                    assertThat(result.leftovers()).containsExactly(new Vertex(1));
                    stale++;
                }
            }
            assertThat(complete).isEqualTo(1);
            assertThat(stale).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testEdgeProperties() {
        node.updateEdges("graph", List.of(new Edge(1, 2, 1.0), new Edge(2, 3, 1.0)));
        List<Edge> edges = List.of(new Edge(1, 2), new Edge(2, 3));
        PropertyBatch read = node.getEdgeProperties("graph", edges, "affinity");
        assertThat(read.transactions().vertexIds()).containsExactlyInAnyOrder(1L, 2L, 3L);
        TestNodes.store().bumpToken(uuid, "graph", 3);

        PropertyWriteResult<Edge> result = node.setEdgeProperties("graph", edges, "affinity",
            List.of(new byte[]{5}, new byte[]{6}), read.transactions());
        assertThat(result.leftovers()).containsExactly(new Edge(2, 3));
        assertThat(result.written()).containsExactly(new Edge(1, 2));

        PropertyBatch after = node.getEdgeProperties("graph", edges, "affinity");
        assertThat(after.value(0)).hasValueSatisfying(v -> assertThat(v).containsExactly(5));
        assertThat(after.value(1)).isEmpty();
    }

    private static double weightOf(Graph graph, long id) {
        return graph.vertices().stream().filter(v -> v.id() == id).findFirst().orElseThrow().weight();
    }
}
