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
import java.util.Objects;

/// A cubic substack of `size` blocks on a side, addressed in substack units on a
/// grid whose origin is the `anchor` block.
///
/// Substack `(i, j, k)` of size `s` covers blocks `[anchor.x + i*s, anchor.x + (i+1)*s)`
/// along X and likewise for Y and Z.
/// @param x substack column
/// @param y substack row
/// @param z substack plane
/// @param size edge length in blocks
/// @param anchor block at which substack `(0, 0, 0)` starts
public record SubstackXYZ(int x, int y, int z, int size, BlockXYZ anchor) implements Comparable<SubstackXYZ> {

    private static final BlockXYZ ORIGIN = new BlockXYZ(0, 0, 0);

    public static final Comparator<SubstackXYZ> ZYX_ORDER =
        Comparator.comparingInt(SubstackXYZ::z).thenComparingInt(SubstackXYZ::y).thenComparingInt(SubstackXYZ::x)
            .thenComparingInt(SubstackXYZ::size).thenComparing(SubstackXYZ::anchor);

    public SubstackXYZ {
        if (size <= 0) {
            throw new IllegalArgumentException("Substack size must be positive: " + size);
        }
        Objects.requireNonNull(anchor, "anchor");
    }

    /// A substack on the grid anchored at block `(0, 0, 0)`.
    public SubstackXYZ(int x, int y, int z, int size) {
        this(x, y, z, size, ORIGIN);
    }

    /// The substack of the given size containing a block, on the grid anchored at block `(0, 0, 0)`.
    public static SubstackXYZ containing(BlockXYZ block, int size) {
        return containing(block, size, ORIGIN);
    }

    /// The substack of the given size containing a block, on the grid anchored at `anchor`.
    public static SubstackXYZ containing(BlockXYZ block, int size, BlockXYZ anchor) {
        return new SubstackXYZ(
            Math.floorDiv(block.x() - anchor.x(), size),
            Math.floorDiv(block.y() - anchor.y(), size),
            Math.floorDiv(block.z() - anchor.z(), size),
            size,
            anchor);
    }

    /// The lowest-coordinate block covered by this substack.
    public BlockXYZ firstBlock() {
        return new BlockXYZ(anchor.x() + x * size, anchor.y() + y * size, anchor.z() + z * size);
    }

    /// Voxel coordinate of the substack's lowest corner.
    public PointXYZ voxelOrigin() {
        BlockXYZ first = firstBlock();
        return new PointXYZ(
            first.x() * BlockXYZ.BLOCK_SIZE,
            first.y() * BlockXYZ.BLOCK_SIZE,
            first.z() * BlockXYZ.BLOCK_SIZE);
    }

    /// Number of blocks covered.
    public long blockCount() {
        return (long) size * size * size;
    }

    @Override
    public int compareTo(SubstackXYZ other) {
        return ZYX_ORDER.compare(this, other);
    }
}
