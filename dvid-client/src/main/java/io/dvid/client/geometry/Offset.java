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

import java.util.Arrays;
import java.util.StringJoiner;

/// Signed voxel offset of a volume request, listed in the same channel order as its [Dims].
public final class Offset {

    private final int[] coords;

    private Offset(int[] coords) {
        this.coords = coords;
    }

    /// @param coords voxel coordinate per axis
    /// @return the offset
    /// @throws IllegalArgumentException if the rank is not 2 or 3
    public static Offset of(int... coords) {
        if (coords == null || coords.length < 2 || coords.length > 3) {
            throw new IllegalArgumentException("Offset must have 2 or 3 coordinates: " + Arrays.toString(coords));
        }
        return new Offset(coords.clone());
    }

    public static Offset origin() {
        return new Offset(new int[3]);
    }

    public static Offset of(PointXYZ point) {
        return new Offset(new int[]{point.x(), point.y(), point.z()});
    }

    public int rank() {
        return coords.length;
    }

    public int get(int axis) {
        return coords[axis];
    }

    public int[] toArray() {
        return coords.clone();
    }

    /// Endpoint form, e.g. `0_-32_64`.
    public String toEndpointSegment() {
        StringJoiner joiner = new StringJoiner("_");
        for (int coord : coords) {
            joiner.add(Integer.toString(coord));
        }
        return joiner.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Offset)) {
            return false;
        }
        return Arrays.equals(coords, ((Offset) o).coords);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(coords);
    }

    @Override
    public String toString() {
        return "Offset" + Arrays.toString(coords);
    }
}
