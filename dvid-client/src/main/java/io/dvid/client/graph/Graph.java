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

import java.util.List;

/// A graph or subgraph as returned by the store.
/// @param vertices vertices with their weights
/// @param edges edges with their weights
public record Graph(List<Vertex> vertices, List<Edge> edges) {

    public Graph {
        vertices = List.copyOf(vertices);
        edges = List.copyOf(edges);
    }
}
