package io.dvid.client.blocks;

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

import io.dvid.client.SizeLimitExceededException;
import io.dvid.client.geometry.BlockXYZ;
import io.dvid.client.transport.PathSegments;
import io.dvid.client.volume.VolumeCodec;
import io.dvid.client.volume.VoxelType;

/// Endpoints and payload checks for block-addressed transfers.
///
/// Blocks live under `/node/{uuid}/{instance}/blocks/{x_y_z}/{span}`, where the
/// coordinate is the first block of the span in block units. No compression or
/// throttling is applied at this layer.
public final class BlockCodec {

    private BlockCodec() {
    }

    public static String blocksEndpoint(String uuid, String instance, BlockXYZ start, int span) {
        if (span <= 0) {
            throw new IllegalArgumentException("Span must be positive: " + span);
        }
        return "/node/" + PathSegments.encode(uuid) + "/" + PathSegments.encode(instance)
            + "/blocks/" + start.toEndpointSegment() + "/" + span;
    }

    /// @throws SizeLimitExceededException if the span covers more voxels than one transfer allows
    public static void checkSpanLimit(int span) {
        long voxels = (long) span * BlockXYZ.BLOCK_SIZE * BlockXYZ.BLOCK_SIZE * BlockXYZ.BLOCK_SIZE;
        if (voxels > VolumeCodec.MAX_VOXELS) {
            throw new SizeLimitExceededException(voxels, VolumeCodec.MAX_VOXELS);
        }
    }

    /// Wraps a response body, validating its length against the span.
    public static BlockSpan decode(byte[] body, VoxelType voxelType, int span) {
        return new BlockSpan(voxelType, span, body);
    }
}
