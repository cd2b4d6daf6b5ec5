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

import io.dvid.client.ShapeMismatchException;
import io.dvid.client.geometry.BlockXYZ;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/// Decodes the coarse sparse-volume encoding of a body.
///
/// Layout, little-endian:
///
/// | bytes | content |
/// |-------|---------|
/// | 1 | payload descriptor (0 = binary) |
/// | 1 | number of dimensions (3) |
/// | 1 | run dimension (0 = X) |
/// | 1 | reserved |
/// | 4 | voxel count (0 for coarse volumes) |
/// | 4 | span count N |
/// | N x 16 | spans of int32 `x, y, z, length` in block units |
public final class CoarseVolumeDecoder {

    static final int HEADER_BYTES = 12;
    static final int SPAN_BYTES = 16;

    /// Most blocks one decoded body may expand to.
    public static final long MAX_BLOCKS = 1L << 24;

    private CoarseVolumeDecoder() {
    }

    /// @param payload encoded coarse volume
    /// @return the body's blocks, ascending (Z, Y, X)
    /// @throws ShapeMismatchException if the payload is truncated, not a 3D X-run encoding, has a
    ///     span that runs past the coordinate range, or expands to more than [#MAX_BLOCKS] blocks
    public static List<BlockXYZ> decode(byte[] payload) {
        if (payload.length < HEADER_BYTES) {
            throw new ShapeMismatchException("Coarse volume header truncated", HEADER_BYTES, payload.length);
        }
        ByteBuffer buffer = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        buffer.get();
        int dimensions = buffer.get();
        int runDimension = buffer.get();
        buffer.get();
        if (dimensions != 3 || runDimension != 0) {
            throw new ShapeMismatchException("Coarse volume must be 3D with runs along X, got " + dimensions
                + " dims along axis " + runDimension, 3, dimensions);
        }
        buffer.getInt();
        long spans = Integer.toUnsignedLong(buffer.getInt());
        long expected = HEADER_BYTES + spans * SPAN_BYTES;
        if (payload.length != expected) {
            throw new ShapeMismatchException("Coarse volume span table does not match span count " + spans,
                expected, payload.length);
        }
        TreeSet<BlockXYZ> blocks = new TreeSet<>();
        long total = 0;
        for (long i = 0; i < spans; i++) {
            int x = buffer.getInt();
            int y = buffer.getInt();
            int z = buffer.getInt();
            int length = buffer.getInt();
            if (length < 0 || (long) x + length - 1 > Integer.MAX_VALUE) {
                throw new ShapeMismatchException("Coarse volume span " + i + " at x=" + x + " has invalid length "
                    + length, Integer.MAX_VALUE - (long) x + 1, length);
            }
            total += length;
            if (total > MAX_BLOCKS) {
                throw new ShapeMismatchException("Coarse volume expands to more than " + MAX_BLOCKS + " blocks",
                    MAX_BLOCKS, total);
            }
            for (int dx = 0; dx < length; dx++) {
                blocks.add(new BlockXYZ(x + dx, y, z));
            }
        }
        return new ArrayList<>(blocks);
    }

    /// Encodes blocks as maximal X-runs. The inverse of [#decode(byte[])].
    public static byte[] encode(List<BlockXYZ> blocks) {
        List<int[]> spans = new ArrayList<>();
        int[] current = null;
        for (BlockXYZ block : RoiCodec.canonical(blocks)) {
            if (current != null && current[1] == block.y() && current[2] == block.z()
                && current[0] + current[3] == block.x()) {
                current[3]++;
            } else {
                current = new int[]{block.x(), block.y(), block.z(), 1};
                spans.add(current);
            }
        }
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + spans.size() * SPAN_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.put((byte) 0).put((byte) 3).put((byte) 0).put((byte) 0);
        buffer.putInt(0);
        buffer.putInt(spans.size());
        for (int[] span : spans) {
            buffer.putInt(span[0]).putInt(span[1]).putInt(span[2]).putInt(span[3]);
        }
        return buffer.array();
    }
}
