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
import java.util.Optional;

/// Result of a property read.
/// @param values one entry per requested vertex or edge, in request order; empty where no property is stored
/// @param transactions tokens for every vertex involved, to be echoed on the following write
public record PropertyBatch(List<Optional<byte[]>> values, VertexTransactions transactions) {

    public PropertyBatch {
        values = List.copyOf(values);
    }

    public int size() {
        return values.size();
    }

    public Optional<byte[]> value(int index) {
        return values.get(index);
    }
}
