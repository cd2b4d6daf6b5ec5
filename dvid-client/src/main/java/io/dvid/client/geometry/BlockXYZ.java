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

import java.util.Comparator;

/// A block coordinate. One block unit spans [#BLOCK_SIZE] voxels along each axis.
///
/// The natural order is ascending Z, then Y, then X, which is the order the
/// store enumerates ROIs and coarse volumes in.
/// @param x block column
/// @param y block row
/// @param z block plane
public record BlockXYZ(int x, int y, int z) implements Comparable<BlockXYZ> {

    /// Edge length of a block in voxels. Fixed by the store at repository creation.
    public static final int BLOCK_SIZE = 32;

    /// Ascending (Z, Y, X).
    public static final Comparator<BlockXYZ> ZYX_ORDER =
        Comparator.comparingInt(BlockXYZ::z).thenComparingInt(BlockXYZ::y).thenComparingInt(BlockXYZ::x);

    /// The block containing a voxel, with floor semantics for negative coordinates.
    public static BlockXYZ containing(PointXYZ point) {
        return new BlockXYZ(
            Math.floorDiv(point.x(), BLOCK_SIZE),
            Math.floorDiv(point.y(), BLOCK_SIZE),
            Math.floorDiv(point.z(), BLOCK_SIZE));
    }

    /// The voxel at the center of this block.
    public PointXYZ center() {
        int half = BLOCK_SIZE / 2;
        return new PointXYZ(x * BLOCK_SIZE + half, y * BLOCK_SIZE + half, z * BLOCK_SIZE + half);
    }

    /// Endpoint form, e.g. `3_0_12`.
    public String toEndpointSegment() {
        return x + "_" + y + "_" + z;
    }

    @Override
    public int compareTo(BlockXYZ other) {
        return ZYX_ORDER.compare(this, other);
    }
}
