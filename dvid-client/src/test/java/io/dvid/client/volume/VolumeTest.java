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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VolumeTest {

    @Test
    void testFirstAxisVariesFastest() {
        Volume volume = Volume.zeros(Dims.of(4, 3, 2), VoxelType.GRAYSCALE8);
        volume.set(200, 1, 2, 1);
        assertThat(volume.linearIndex(1, 2, 1)).isEqualTo(1 + 2 * 4 + 4 * 3);
        assertThat(volume.getData()[volume.linearIndex(1, 2, 1)]).isEqualTo((byte) 200);
        assertThat(volume.get(1, 2, 1)).isEqualTo(200L);
    }

    @Test
    void testLabelsAreLittleEndian() {
        Volume volume = Volume.labels(Dims.of(2, 1, 1), new long[]{0x0102030405060708L, -1L});
        assertThat(volume.getData()[0]).isEqualTo((byte) 0x08);
        assertThat(volume.getData()[7]).isEqualTo((byte) 0x01);
        assertThat(volume.get(1, 0, 0)).isEqualTo(-1L);
        assertThat(volume.toLabelArray()).containsExactly(0x0102030405060708L, -1L);
    }

    @Test
    void testTransposeSwapsAxes() {
        Volume xyz = Volume.zeros(Dims.of(3, 2, 1), VoxelType.LABELS64);
        xyz.set(42, 2, 1, 0);
        Volume yxz = xyz.transpose(ChannelOrder.of(1, 0, 2));
        assertThat(yxz.getDims()).isEqualTo(Dims.of(2, 3, 1));
        assertThat(yxz.get(1, 2, 0)).isEqualTo(42L);
        assertThat(yxz.transpose(ChannelOrder.of(1, 0, 2)).getData()).isEqualTo(xyz.getData());
    }

    @Test
    void testBufferMustMatchShape() {
        assertThatThrownBy(() -> Volume.grayscale(Dims.of(4, 4, 4), new byte[63]))
            .isInstanceOf(ShapeMismatchException.class)
            .satisfies(e -> {
                ShapeMismatchException mismatch = (ShapeMismatchException) e;
                assertThat(mismatch.getExpectedBytes()).isEqualTo(64);
                assertThat(mismatch.getActualBytes()).isEqualTo(63);
            });
    }

    @Test
    void testCoordinatesAreBoundsChecked() {
        Volume volume = Volume.zeros(Dims.of(2, 2, 2), VoxelType.GRAYSCALE8);
        assertThatThrownBy(() -> volume.get(2, 0, 0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> volume.get(0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
