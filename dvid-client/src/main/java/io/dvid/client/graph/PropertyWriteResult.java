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

/// Outcome of a guarded property write.
///
/// Items whose tokens were stale, or that had no token at all, are returned as
/// leftovers and were not written. Callers re-read the leftovers and retry only those.
/// @param written items whose properties were stored
/// @param leftovers items that must be re-read and retried
/// @param <T> [Vertex] or [Edge]
public record PropertyWriteResult<T>(List<T> written, List<T> leftovers) {

    public PropertyWriteResult {
        written = List.copyOf(written);
        leftovers = List.copyOf(leftovers);
    }

    public boolean isComplete() {
        return leftovers.isEmpty();
    }
}
