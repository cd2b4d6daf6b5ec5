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

/// Extents of a dense volume, one per axis, listed in channel order.
///
/// The first listed axis varies fastest in the wire layout, so a volume
/// requested as `Dims.of(64, 32, 16)` in the default channel order has
/// X as the matrix column and Z as the slowest axis. Seen as a row-major
/// array, the shape is the reverse of the listing ([#shape()]).
///
/// Only rank 2 (tiles) and rank 3 (volumes) are supported.
public final class Dims {

    private final int[] extents;

    private Dims(int[] extents) {
        this.extents = extents;
    }

    /// Creates a dimension vector.
    /// @param extents extent per axis, each greater than zero
    /// @return the dimension vector
    /// @throws IllegalArgumentException if the rank is not 2 or 3, or an extent is not positive
    public static Dims of(int... extents) {
        if (extents == null || extents.length < 2 || extents.length > 3) {
            throw new IllegalArgumentException("Dims must have 2 or 3 extents: " + Arrays.toString(extents));
        }
        for (int extent : extents) {
            if (extent <= 0) {
                throw new IllegalArgumentException("Every extent must be positive: " + Arrays.toString(extents));
            }
        }
        return new Dims(extents.clone());
    }

    /// A cube of the given edge length.
    /// @param edge edge length in voxels
    /// @return the dimension vector
    public static Dims cube(int edge) {
        return of(edge, edge, edge);
    }

    public int rank() {
        return extents.length;
    }

    public int get(int axis) {
        return extents[axis];
    }

    /// Number of voxels covered. Saturates at `Long.MAX_VALUE` when the product
    /// does not fit in 64 bits.
    public long voxelCount() {
        long count = 1;
        for (int extent : extents) {
            try {
                count = Math.multiplyExact(count, extent);
            } catch (ArithmeticException e) {
                return Long.MAX_VALUE;
            }
        }
        return count;
    }

    public int[] toArray() {
        return extents.clone();
    }

    /// The row-major array shape, slowest axis first.
    public int[] shape() {
        int[] shape = new int[extents.length];
        for (int i = 0; i < extents.length; i++) {
            shape[i] = extents[extents.length - 1 - i];
        }
        return shape;
    }

    /// Endpoint form, e.g. `64_64_32`.
    public String toEndpointSegment() {
        StringJoiner joiner = new StringJoiner("_");
        for (int extent : extents) {
            joiner.add(Integer.toString(extent));
        }
        return joiner.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dims)) {
            return false;
        }
        return Arrays.equals(extents, ((Dims) o).extents);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(extents);
    }

    @Override
    public String toString() {
        return "Dims" + Arrays.toString(extents);
    }
}
