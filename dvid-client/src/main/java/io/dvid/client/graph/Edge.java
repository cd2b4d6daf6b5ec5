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

/// An undirected labelgraph edge. Identity is the unordered vertex pair.
/// @param id1 first vertex id
/// @param id2 second vertex id
/// @param weight edge weight
public record Edge(long id1, long id2, double weight) {

    public Edge(long id1, long id2) {
        this(id1, id2, 0.0);
    }

    /// @return true if either endpoint is the given vertex
    public boolean touches(long vertexId) {
        return id1 == vertexId || id2 == vertexId;
    }

    private long low() {
        return Long.compareUnsigned(id1, id2) <= 0 ? id1 : id2;
    }

    private long high() {
        return Long.compareUnsigned(id1, id2) <= 0 ? id2 : id1;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Edge other && other.low() == low() && other.high() == high();
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(low()) + Long.hashCode(high());
    }

    @Override
    public String toString() {
        return "Edge[" + Long.toUnsignedString(id1) + "-" + Long.toUnsignedString(id2) + ", " + weight + "]";
    }
}
