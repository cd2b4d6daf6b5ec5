package io.dvid.client.roi;

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

import io.dvid.client.geometry.BlockXYZ;
import io.dvid.client.geometry.SubstackXYZ;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/// Tiles an ROI's blocks with cubic substacks.
///
/// The tiling grid starts at the lowest corner of the ROI's bounding box, so an
/// ROI that is an exact union of aligned cubes packs fully wherever it sits. A
/// substack is kept if it contains at least one ROI block.
public final class RoiPartitioner {

    private RoiPartitioner() {
    }

    /// @param blocks ROI blocks in any order; duplicates are ignored
    /// @param partitionSize substack edge length in blocks
    /// @return the covering and its packing factor. An empty ROI yields no
    ///     substacks and a packing factor of 1.0.
    public static RoiPartition partition(Collection<BlockXYZ> blocks, int partitionSize) {
        if (partitionSize <= 0) {
            throw new IllegalArgumentException("Partition size must be positive: " + partitionSize);
        }
        TreeSet<BlockXYZ> distinct = new TreeSet<>(blocks);
        if (distinct.isEmpty()) {
            return new RoiPartition(List.of(), 1.0);
        }
        BlockXYZ anchor = lowestCorner(distinct);
        TreeSet<SubstackXYZ> substacks = new TreeSet<>();
        for (BlockXYZ block : distinct) {
            substacks.add(SubstackXYZ.containing(block, partitionSize, anchor));
        }
        long covered = 0;
        for (SubstackXYZ substack : substacks) {
            covered += substack.blockCount();
        }
        double packing = (double) distinct.size() / covered;
        return new RoiPartition(substacks.stream().toList(), packing);
    }

    private static BlockXYZ lowestCorner(Collection<BlockXYZ> blocks) {
        int x = Integer.MAX_VALUE;
        int y = Integer.MAX_VALUE;
        int z = Integer.MAX_VALUE;
        for (BlockXYZ block : blocks) {
            x = Math.min(x, block.x());
            y = Math.min(y, block.y());
            z = Math.min(z, block.z());
        }
        return new BlockXYZ(x, y, z);
    }
}
