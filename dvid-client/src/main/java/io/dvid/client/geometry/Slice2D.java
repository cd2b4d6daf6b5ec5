package io.dvid.client.geometry;

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

/// Orthogonal cut plane of a pre-computed tile.
public enum Slice2D {
    XY("xy"),
    XZ("xz"),
    YZ("yz");

    private final String endpointName;

    Slice2D(String endpointName) {
        this.endpointName = endpointName;
    }

    public String endpointName() {
        return endpointName;
    }
}
