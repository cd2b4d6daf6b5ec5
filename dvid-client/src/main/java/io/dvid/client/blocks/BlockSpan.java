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

import io.dvid.client.ShapeMismatchException;
import io.dvid.client.geometry.BlockXYZ;
import io.dvid.client.geometry.Dims;
import io.dvid.client.volume.Volume;
import io.dvid.client.volume.VoxelType;

import java.util.Arrays;

/// A run of `span` contiguous blocks along X, as raw voxel bytes.
///
/// Block `i` of the span occupies bytes `[i * blockBytes, (i + 1) * blockBytes)`,
/// each block laid out with X fastest.
public final class BlockSpan {

    private final VoxelType voxelType;
    private final int span;
    private final byte[] data;

    /// @param voxelType voxel encoding of every block
    /// @param span number of blocks
    /// @param data raw block bytes
    /// @throws ShapeMismatchException if `data` is not exactly `span` blocks long
    public BlockSpan(VoxelType voxelType, int span, byte[] data) {
        if (span <= 0) {
            throw new IllegalArgumentException("Span must be positive: " + span);
        }
        long expected = (long) span * blockBytes(voxelType);
        if (data == null || data.length != expected) {
            throw new ShapeMismatchException("Block buffer does not hold " + span + " " + voxelType + " blocks",
                expected, data == null ? 0 : data.length);
        }
        this.voxelType = voxelType;
        this.span = span;
        this.data = data;
    }

    /// Bytes in one block of the given voxel type.
    public static int blockBytes(VoxelType voxelType) {
        return BlockXYZ.BLOCK_SIZE * BlockXYZ.BLOCK_SIZE * BlockXYZ.BLOCK_SIZE * voxelType.width();
    }

    public VoxelType getVoxelType() {
        return voxelType;
    }

    public int getSpan() {
        return span;
    }

    /// @return the backing buffer
    public byte[] getData() {
        return data;
    }

    /// Copies one block out as a cubic volume.
    /// @param index position within the span
    /// @return the block's voxels
    public Volume block(int index) {
        if (index < 0 || index >= span) {
            throw new IndexOutOfBoundsException("Block " + index + " outside span of " + span);
        }
        int size = blockBytes(voxelType);
        byte[] copy = Arrays.copyOfRange(data, index * size, (index + 1) * size);
        return new Volume(Dims.cube(BlockXYZ.BLOCK_SIZE), voxelType, copy);
    }

    @Override
    public String toString() {
        return "BlockSpan[" + voxelType + " x" + span + "]";
    }
}
