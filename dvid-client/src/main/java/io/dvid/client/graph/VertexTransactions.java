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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Transaction tokens per vertex id, as fetched by a property read.
///
/// A token stays valid until the store sees any write to its vertex.
/// Instances are immutable; use [#merge(VertexTransactions)] to combine a
/// re-fetch for leftover vertices with an earlier fetch.
public final class VertexTransactions {

    private static final VertexTransactions EMPTY = new VertexTransactions(Map.of());

    private final Map<Long, TransactionToken> tokens;

    VertexTransactions(Map<Long, TransactionToken> tokens) {
        this.tokens = Collections.unmodifiableMap(new LinkedHashMap<>(tokens));
    }

    public static VertexTransactions empty() {
        return EMPTY;
    }

    public Optional<TransactionToken> tokenFor(long vertexId) {
        return Optional.ofNullable(tokens.get(vertexId));
    }

    public boolean contains(long vertexId) {
        return tokens.containsKey(vertexId);
    }

    public Set<Long> vertexIds() {
        return tokens.keySet();
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    /// @param newer tokens that take precedence
    /// @return the union of both, with `newer` winning on shared vertices
    public VertexTransactions merge(VertexTransactions newer) {
        Map<Long, TransactionToken> merged = new LinkedHashMap<>(tokens);
        merged.putAll(newer.tokens);
        return new VertexTransactions(merged);
    }

    Map<Long, TransactionToken> asMap() {
        return tokens;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VertexTransactions other && other.tokens.equals(tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return "VertexTransactions[" + tokens.size() + " vertices]";
    }
}
