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

/// A voxel coordinate.
/// @param x voxel column
/// @param y voxel row
/// @param z voxel plane
public record PointXYZ(int x, int y, int z) {

    public String toEndpointSegment() {
        return x + "_" + y + "_" + z;
    }
}
