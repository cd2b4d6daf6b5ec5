package io.dvid.client.volume;

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
import io.dvid.client.geometry.ChannelOrder;
import io.dvid.client.geometry.Dims;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/// A dense grayscale or label volume of rank 2 or 3.
///
/// The buffer holds exactly `dims.voxelCount() * type.width()` bytes with the
/// first listed axis varying fastest, which is the store's wire layout. Read
/// as a row-major array of shape [Dims#shape()], the last axis varies fastest.
/// Label voxels are little-endian.
///
/// The buffer is not copied on construction; callers that keep writing to it
/// after handing it over see their writes reflected here.
public final class Volume {

    private final Dims dims;
    private final VoxelType voxelType;
    private final byte[] data;

    /// @param dims extents in channel order
    /// @param voxelType voxel encoding
    /// @param data voxel bytes
    /// @throws ShapeMismatchException if the buffer length does not match the shape
    public Volume(Dims dims, VoxelType voxelType, byte[] data) {
        if (dims == null || voxelType == null || data == null) {
            throw new IllegalArgumentException("dims, voxel type and data are required");
        }
        long expected = dims.voxelCount() * voxelType.width();
        if (expected != data.length) {
            throw new ShapeMismatchException("Buffer does not match " + dims + " of " + voxelType, expected, data.length);
        }
        this.dims = dims;
        this.voxelType = voxelType;
        this.data = data;
    }

    public static Volume grayscale(Dims dims, byte[] data) {
        return new Volume(dims, VoxelType.GRAYSCALE8, data);
    }

    public static Volume labels(Dims dims, byte[] data) {
        return new Volume(dims, VoxelType.LABELS64, data);
    }

    /// Wraps label ids into a label volume.
    /// @param dims extents in channel order
    /// @param labels label ids, first axis fastest
    /// @return the volume
    public static Volume labels(Dims dims, long[] labels) {
        if (labels.length != dims.voxelCount()) {
            throw new ShapeMismatchException("Label array does not match " + dims,
                dims.voxelCount() * VoxelType.LABELS64.width(), (long) labels.length * VoxelType.LABELS64.width());
        }
        ByteBuffer buffer = ByteBuffer.allocate(labels.length * VoxelType.LABELS64.width()).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asLongBuffer().put(labels);
        return labels(dims, buffer.array());
    }

    /// An all-zero volume.
    public static Volume zeros(Dims dims, VoxelType voxelType) {
        long size = dims.voxelCount() * voxelType.width();
        if (size > Integer.MAX_VALUE - 8) {
            throw new ShapeMismatchException("Volume too large for a single buffer", size, Integer.MAX_VALUE - 8);
        }
        return new Volume(dims, voxelType, new byte[(int) size]);
    }

    public Dims getDims() {
        return dims;
    }

    public VoxelType getVoxelType() {
        return voxelType;
    }

    /// @return the backing buffer
    public byte[] getData() {
        return data;
    }

    public long voxelCount() {
        return dims.voxelCount();
    }

    /// Index of a voxel in voxel units (not bytes).
    /// @param coords one coordinate per axis, in channel order
    /// @return the linear voxel index
    public int linearIndex(int... coords) {
        if (coords.length != dims.rank()) {
            throw new IllegalArgumentException("Expected " + dims.rank() + " coordinates, got " + coords.length);
        }
        long index = 0;
        long stride = 1;
        for (int axis = 0; axis < coords.length; axis++) {
            int c = coords[axis];
            if (c < 0 || c >= dims.get(axis)) {
                throw new IndexOutOfBoundsException("Coordinate " + c + " outside axis " + axis + " of " + dims);
            }
            index += c * stride;
            stride *= dims.get(axis);
        }
        return (int) index;
    }

    /// Reads one voxel. Grayscale values are returned unsigned.
    public long get(int... coords) {
        return readVoxel(linearIndex(coords));
    }

    /// Writes one voxel. Grayscale volumes keep only the low byte.
    public void set(long value, int... coords) {
        writeVoxel(linearIndex(coords), value);
    }

    /// Copies label ids out of a label volume.
    public long[] toLabelArray() {
        if (voxelType != VoxelType.LABELS64) {
            throw new IllegalStateException("Not a label volume: " + voxelType);
        }
        long[] labels = new long[(int) dims.voxelCount()];
        ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN).asLongBuffer().get(labels);
        return labels;
    }

    /// Reorders the axes of this volume.
    ///
    /// Axis `i` of the result is axis `order.axisAt(i)` of this volume, so
    /// transposing an XYZ volume by `(1, 0, 2)` yields a YXZ volume in which Y
    /// is the matrix column.
    /// @param order permutation of this volume's axes
    /// @return a new volume with its own buffer
    public Volume transpose(ChannelOrder order) {
        int rank = dims.rank();
        if (order.rank() != rank) {
            throw new IllegalArgumentException("Channel order " + order + " does not match rank of " + dims);
        }
        int[] source = dims.toArray();
        int[] target = new int[rank];
        for (int i = 0; i < rank; i++) {
            target[i] = source[order.axisAt(i)];
        }
        Volume result = zeros(Dims.of(target), voxelType);
        int[] sourceStrides = new int[rank];
        int stride = 1;
        for (int axis = 0; axis < rank; axis++) {
            sourceStrides[axis] = stride;
            stride *= source[axis];
        }
        int width = voxelType.width();
        int[] coord = new int[rank];
        long total = dims.voxelCount();
        for (int targetIndex = 0; targetIndex < total; targetIndex++) {
            int sourceIndex = 0;
            for (int i = 0; i < rank; i++) {
                sourceIndex += coord[i] * sourceStrides[order.axisAt(i)];
            }
            System.arraycopy(data, sourceIndex * width, result.data, targetIndex * width, width);
            for (int i = 0; i < rank; i++) {
                if (++coord[i] < target[i]) {
                    break;
                }
                coord[i] = 0;
            }
        }
        return result;
    }

    private long readVoxel(int index) {
        if (voxelType == VoxelType.GRAYSCALE8) {
            return data[index] & 0xFFL;
        }
        return ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN).getLong(index * VoxelType.LABELS64.width());
    }

    private void writeVoxel(int index, long value) {
        if (voxelType == VoxelType.GRAYSCALE8) {
            data[index] = (byte) value;
        } else {
            ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN).putLong(index * VoxelType.LABELS64.width(), value);
        }
    }

    @Override
    public String toString() {
        return "Volume[" + voxelType + " " + dims + "]";
    }
}
