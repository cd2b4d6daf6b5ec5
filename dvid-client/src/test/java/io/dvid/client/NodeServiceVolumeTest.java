package io.dvid.client;

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

import io.dvid.client.blocks.BlockSpan;
import io.dvid.client.geometry.BlockXYZ;
import io.dvid.client.geometry.ChannelOrder;
import io.dvid.client.geometry.Dims;
import io.dvid.client.geometry.Offset;
import io.dvid.client.geometry.PointXYZ;
import io.dvid.client.geometry.Slice2D;
import io.dvid.client.volume.Volume;
import io.dvid.client.volume.VolumeOptions;
import io.dvid.client.volume.VolumeView;
import io.dvid.client.volume.VoxelType;
import io.dvid.testserver.DvidTestServerExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(DvidTestServerExtension.class)
class NodeServiceVolumeTest {

    private DvidNodeService node;

    @BeforeEach
    void setUp() throws IOException {
        node = new DvidNodeService(TestNodes.config(), TestNodes.newRepo("volume-test"));
        assertThat(node.createGrayscale8("grayscale")).isTrue();
        assertThat(node.createLabelblk("labels")).isTrue();
    }

    @AfterEach
    void tearDown() throws IOException {
        node.close();
    }

    @Test
    void testGrayscaleRoundTrip() {
        Volume volume = Volume.zeros(Dims.of(64, 32, 32), VoxelType.GRAYSCALE8);
        volume.set(255, 63, 0, 0);
        volume.set(17, 5, 6, 7);
        node.putGray3D("grayscale", volume, Offset.of(32, 0, 64));

        Volume read = node.getGray3D("grayscale", Dims.of(64, 32, 32), Offset.of(32, 0, 64));
        assertThat(read.getData()).isEqualTo(volume.getData());
        assertThat(read.get(63, 0, 0)).isEqualTo(255L);

        Volume corner = node.getGray3D("grayscale", Dims.of(2, 1, 1), Offset.of(37, 6, 71));
        assertThat(corner.get(0, 0, 0)).isEqualTo(17L);
        assertThat(corner.get(1, 0, 0)).isZero();
    }

    @Test
    void testLabelsRoundTripWithEveryFlagCombination() {
        Volume volume = pattern();
        node.putLabels3D("labels", volume, Offset.origin());

        for (boolean throttle : new boolean[]{true, false}) {
            for (boolean compress : new boolean[]{true, false}) {
                VolumeOptions options = new VolumeOptions(throttle, compress, null, VolumeView.RAW);
                Volume read = node.getLabels3D("labels", Dims.cube(32), Offset.origin(), options);
                assertThat(read.getData()).isEqualTo(volume.getData());
            }
        }
        Volume isotropic = node.getLabels3D("labels", Dims.cube(32), Offset.origin(),
            VolumeOptions.labelDefaults().withView(VolumeView.ISOTROPIC));
        assertThat(isotropic.getData()).isEqualTo(volume.getData());
    }

    @Test
    void testChannelOrderRead() {
        Volume volume = pattern();
        node.putLabels3D("labels", volume, Offset.origin(), VolumeOptions.labelDefaults().withCompress(false));

        ChannelOrder zyx = ChannelOrder.of(2, 1, 0);
        Volume read = node.getLabels3D("labels", Dims.of(4, 8, 16), Offset.of(1, 2, 3), zyx,
            VolumeOptions.labelDefaults());
        assertThat(read.getDims()).isEqualTo(Dims.of(4, 8, 16));
        // channel 0 is Z, channel 2 is X
        assertThat(read.get(2, 5, 7)).isEqualTo(label(3 + 7, 2 + 5, 1 + 2));

        Volume xyz = node.getLabels3D("labels", Dims.of(16, 8, 4), Offset.of(3, 2, 1));
        assertThat(xyz.transpose(zyx).getData()).isEqualTo(read.getData());
    }

    @Test
    void testLabelByLocation() {
        node.putLabels3D("labels", pattern(), Offset.of(32, 32, 32));
        assertThat(node.getLabelByLocation("labels", 33, 34, 35)).isEqualTo(label(1, 2, 3));
        assertThat(node.getLabelByLocation("labels", 0, 0, 0)).isZero();
        assertThat(node.getLabelByLocation("labels", -5, 1000, 7)).isZero();
    }

    @Test
    void testRoiMaskedWrite() {
        node.createRoi("mask");
        node.postRoi("mask", List.of(new BlockXYZ(1, 0, 0)));
        long[] fives = new long[64 * 32 * 32];
        Arrays.fill(fives, 5L);
        node.putLabels3D("labels", Volume.labels(Dims.of(64, 32, 32), fives), Offset.origin(),
            VolumeOptions.labelDefaults().withRoi("mask"));

        assertThat(node.getLabelByLocation("labels", 0, 0, 0)).isZero();
        assertThat(node.getLabelByLocation("labels", 40, 0, 0)).isEqualTo(5L);

        node.putLabels3D("labels", Volume.labels(Dims.of(64, 32, 32), fives), Offset.origin());
        Volume masked = node.getLabels3D("labels", Dims.of(64, 32, 32), Offset.origin(),
            VolumeOptions.labelDefaults().withRoi("mask"));
        assertThat(masked.get(0, 0, 0)).isZero();
        assertThat(masked.get(40, 0, 0)).isEqualTo(5L);
    }

    @Test
    void testBlocksRoundTrip() {
        byte[] data = new byte[2 * BlockSpan.blockBytes(VoxelType.GRAYSCALE8)];
        data[BlockSpan.blockBytes(VoxelType.GRAYSCALE8) + 3] = 42;
        node.putGrayBlocks("grayscale", new BlockSpan(VoxelType.GRAYSCALE8, 2, data), new BlockXYZ(1, 0, 0));

        BlockSpan read = node.getGrayBlocks("grayscale", new BlockXYZ(0, 0, 0), 3);
        assertThat(read.getSpan()).isEqualTo(3);
        assertThat(read.block(0).get(3, 0, 0)).isZero();
        assertThat(read.block(2).get(3, 0, 0)).isEqualTo(42L);

        Volume voxels = node.getGray3D("grayscale", Dims.of(1, 1, 1), Offset.of(67, 0, 0));
        assertThat(voxels.get(0, 0, 0)).isEqualTo(42L);

        BlockSpan labelBlocks = node.getLabelBlocks("labels", new BlockXYZ(0, 0, 0), 1);
        assertThat(labelBlocks.getData()).hasSize(BlockSpan.blockBytes(VoxelType.LABELS64));
    }

    @Test
    void testTileSlice() {
        Volume volume = Volume.zeros(Dims.of(64, 64, 32), VoxelType.GRAYSCALE8);
        for (int y = 0; y < 64; y++) {
            for (int x = 0; x < 64; x++) {
                volume.set(x + 2 * y, x, y, 5);
            }
        }
        node.putGray3D("grayscale", volume, Offset.origin());

        Volume tile = node.getTileSlice("grayscale", Slice2D.XY, 0, new PointXYZ(0, 0, 5));
        assertThat(tile.getDims()).isEqualTo(Dims.of(64, 64));
        assertThat(tile.get(10, 3)).isEqualTo(16L);
        assertThat(tile.get(63, 63)).isEqualTo((63 + 126) & 0xFFL);
        assertThat(node.getTileSliceBinary("grayscale", Slice2D.XY, 0, new PointXYZ(0, 0, 6))).isNotEmpty();
    }

    @Test
    void testWrongVoxelTypeIsRejected() {
        Volume gray = Volume.zeros(Dims.cube(32), VoxelType.GRAYSCALE8);
        assertThatThrownBy(() -> node.putLabels3D("labels", gray, Offset.origin()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> node.getGray3D("grayscale", Dims.of(32, 32), Offset.of(0, 0)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static Volume pattern() {
        Volume volume = Volume.zeros(Dims.cube(32), VoxelType.LABELS64);
        for (int z = 0; z < 32; z++) {
            for (int y = 0; y < 32; y++) {
                for (int x = 0; x < 32; x++) {
                    volume.set(label(x, y, z), x, y, z);
                }
            }
        }
        return volume;
    }

    private static long label(int x, int y, int z) {
        return x + 100L * y + 10_000L * z + 1;
    }
}
