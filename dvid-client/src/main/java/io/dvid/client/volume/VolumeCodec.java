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

import io.dvid.client.AlignmentViolationException;
import io.dvid.client.ShapeMismatchException;
import io.dvid.client.SizeLimitExceededException;
import io.dvid.client.geometry.BlockXYZ;
import io.dvid.client.geometry.ChannelOrder;
import io.dvid.client.geometry.Dims;
import io.dvid.client.geometry.Offset;
import io.dvid.client.transport.PathSegments;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.StringJoiner;

/// Endpoint construction and payload encoding for voxel-addressed volume transfers.
///
/// Endpoints have the form
/// `/node/{uuid}/{instance}/{raw|isotropic}/{channels}/{dims}/{offset}` followed by
/// `throttle=on`, `compress=lz4` and `roi={name}` query flags, each present only
/// when set, so a request with default flags has the shortest endpoint.
public final class VolumeCodec {

    /// Largest number of voxels one request may carry.
    public static final long MAX_VOXELS = Integer.MAX_VALUE / 8;

    private VolumeCodec() {
    }

    /// @throws SizeLimitExceededException if the request covers more than [#MAX_VOXELS] voxels
    public static void checkSizeLimit(Dims dims) {
        long voxels = dims.voxelCount();
        if (voxels > MAX_VOXELS) {
            throw new SizeLimitExceededException(voxels, MAX_VOXELS);
        }
    }

    /// Builds a volume endpoint.
    /// @param uuid node uuid
    /// @param instance data instance name
    /// @param dims extents in channel order
    /// @param offset voxel offset in channel order
    /// @param channels channel order, or null for the identity
    /// @param options transfer flags
    /// @return the endpoint
    /// @throws SizeLimitExceededException if the shape is over the transfer limit
    public static String volumeEndpoint(String uuid, String instance, Dims dims, Offset offset,
                                        ChannelOrder channels, VolumeOptions options) {
        requireName(uuid, "uuid");
        requireName(instance, "instance");
        checkSizeLimit(dims);
        ChannelOrder order = channels == null ? ChannelOrder.identity(dims.rank()) : channels;
        if (offset.rank() != dims.rank() || order.rank() != dims.rank()) {
            throw new IllegalArgumentException("Rank mismatch between " + dims + ", " + offset + " and " + order);
        }

        StringBuilder endpoint = new StringBuilder();
        endpoint.append("/node/").append(PathSegments.encode(uuid))
            .append('/').append(PathSegments.encode(instance))
            .append('/').append(options.view().endpointName())
            .append('/').append(order.toEndpointSegment())
            .append('/').append(dims.toEndpointSegment())
            .append('/').append(offset.toEndpointSegment());

        StringJoiner query = new StringJoiner("&", "?", "").setEmptyValue("");
        if (options.throttle()) {
            query.add("throttle=on");
        }
        if (options.compress()) {
            query.add("compress=lz4");
        }
        if (options.hasRoi()) {
            query.add("roi=" + URLEncoder.encode(options.roi(), StandardCharsets.UTF_8));
        }
        return endpoint.append(query).toString();
    }

    /// Decodes a volume response.
    /// @param body response body
    /// @param dims requested extents
    /// @param voxelType voxel encoding
    /// @param compressed whether the body is LZ4-compressed
    /// @return the volume
    /// @throws CompressionException if a compressed body cannot be decompressed
    /// @throws ShapeMismatchException if the body length does not match the request
    public static Volume decode(byte[] body, Dims dims, VoxelType voxelType, boolean compressed) {
        checkSizeLimit(dims);
        int expected = (int) (dims.voxelCount() * voxelType.width());
        byte[] raw = compressed ? Lz4Compression.decompress(body, expected) : body;
        if (raw.length != expected) {
            throw new ShapeMismatchException("Volume response does not match " + dims, expected, raw.length);
        }
        return new Volume(dims, voxelType, raw);
    }

    /// Encodes a volume for a write.
    /// @param volume the voxels to send
    /// @param compress whether to LZ4-compress the payload
    /// @return the request body
    public static byte[] encode(Volume volume, boolean compress) {
        checkSizeLimit(volume.getDims());
        return compress ? Lz4Compression.compress(volume.getData()) : volume.getData();
    }

    /// @throws AlignmentViolationException unless every offset and extent is a multiple of the block size
    public static void checkBlockAligned(Dims dims, Offset offset) {
        for (int axis = 0; axis < dims.rank(); axis++) {
            if (Math.floorMod(offset.get(axis), BlockXYZ.BLOCK_SIZE) != 0) {
                throw new AlignmentViolationException("Offset " + offset + " is not aligned to blocks of "
                    + BlockXYZ.BLOCK_SIZE + " voxels on axis " + axis);
            }
            if (dims.get(axis) % BlockXYZ.BLOCK_SIZE != 0) {
                throw new AlignmentViolationException("Extent " + dims + " is not a multiple of "
                    + BlockXYZ.BLOCK_SIZE + " voxels on axis " + axis);
            }
        }
    }

    private static void requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " cannot be null or empty");
        }
    }
}
