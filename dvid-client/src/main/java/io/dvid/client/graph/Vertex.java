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

/// A labelgraph vertex. Identity is the id alone; two vertices with the same id and
/// different weights are equal.
/// @param id unsigned 64-bit vertex id
/// @param weight vertex weight
public record Vertex(long id, double weight) {

    public Vertex(long id) {
        this(id, 0.0);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Vertex other && other.id == id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Vertex[" + Long.toUnsignedString(id) + ", " + weight + "]";
    }
}
