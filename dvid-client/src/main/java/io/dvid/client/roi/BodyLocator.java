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
import io.dvid.client.geometry.PointXYZ;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/// Picks a representative voxel for a body from its coarse volume.
///
/// The centroid of the block centers is computed and the block whose center
/// is nearest to it is chosen, so the answer always lies in a block the body
/// occupies. Ties go to the block that comes first in (Z, Y, X) order. When a
/// Z plane is requested and the body has blocks in that plane, only those
/// blocks are considered, the distance is measured in X and Y, and the
/// returned point carries the requested Z. Otherwise the unconstrained
/// answer is returned.
public final class BodyLocator {

    private BodyLocator() {
    }

    /// @param blocks the body's coarse blocks
    /// @param zplane optional voxel Z plane to stay within
    /// @return the chosen voxel, or empty for a body with no blocks
    public static Optional<PointXYZ> locate(List<BlockXYZ> blocks, OptionalInt zplane) {
        if (blocks.isEmpty()) {
            return Optional.empty();
        }
        if (zplane.isPresent()) {
            int z = zplane.getAsInt();
            int blockZ = Math.floorDiv(z, BlockXYZ.BLOCK_SIZE);
            List<BlockXYZ> inPlane = new ArrayList<>();
            for (BlockXYZ block : blocks) {
                if (block.z() == blockZ) {
                    inPlane.add(block);
                }
            }
            if (!inPlane.isEmpty()) {
                PointXYZ center = nearestToCentroid(inPlane, false).center();
                return Optional.of(new PointXYZ(center.x(), center.y(), z));
            }
        }
        return Optional.of(nearestToCentroid(blocks, true).center());
    }

    private static BlockXYZ nearestToCentroid(List<BlockXYZ> blocks, boolean useZ) {
        List<BlockXYZ> ordered = RoiCodec.canonical(blocks);
        double cx = 0;
        double cy = 0;
        double cz = 0;
        for (BlockXYZ block : ordered) {
            cx += block.x();
            cy += block.y();
            cz += block.z();
        }
        cx /= ordered.size();
        cy /= ordered.size();
        cz /= ordered.size();

        BlockXYZ best = null;
        double bestDistance = Double.MAX_VALUE;
        for (BlockXYZ block : ordered) {
            double dx = block.x() - cx;
            double dy = block.y() - cy;
            double dz = useZ ? block.z() - cz : 0;
            double distance = dx * dx + dy * dy + dz * dz;
            if (distance < bestDistance) {
                bestDistance = distance;
                best = block;
            }
        }
        return best;
    }
}
