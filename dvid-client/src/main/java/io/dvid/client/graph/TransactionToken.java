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

/// Store-issued version stamp of a vertex, echoed back on property writes.
///
/// Tokens are only created from store responses and can only be compared;
/// their value is not exposed.
public final class TransactionToken {

    private final long value;

    TransactionToken(long value) {
        this.value = value;
    }

    long value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TransactionToken other && other.value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "TransactionToken@" + Integer.toHexString(hashCode());
    }
}
