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
import io.dvid.client.SizeLimitExceededException;
import io.dvid.client.geometry.BlockXYZ;
import io.dvid.client.geometry.Dims;
import io.dvid.client.volume.Volume;
import io.dvid.client.volume.VoxelType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlockSpanTest {

    @Test
    void testBlocksAreConcatenatedCubes() {
        int blockBytes = BlockSpan.blockBytes(VoxelType.GRAYSCALE8);
        assertThat(blockBytes).isEqualTo(32 * 32 * 32);
        byte[] data = new byte[2 * blockBytes];
        data[blockBytes + 1 + 32] = 7;

        BlockSpan span = BlockCodec.decode(data, VoxelType.GRAYSCALE8, 2);
        Volume second = span.block(1);
        assertThat(second.getDims()).isEqualTo(Dims.cube(32));
        assertThat(second.get(1, 1, 0)).isEqualTo(7L);
        assertThat(span.block(0).get(1, 1, 0)).isEqualTo(0L);
    }

    @Test
    void testLengthMustMatchSpan() {
        assertThatThrownBy(() -> BlockCodec.decode(new byte[BlockSpan.blockBytes(VoxelType.LABELS64)],
            VoxelType.LABELS64, 2)).isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void testEndpointAndLimit() {
        assertThat(BlockCodec.blocksEndpoint("abc", "labels", new BlockXYZ(3, 0, 12), 4))
            .isEqualTo("/node/abc/labels/blocks/3_0_12/4");
        assertThatThrownBy(() -> BlockCodec.checkSpanLimit(9000)).isInstanceOf(SizeLimitExceededException.class);
    }
}
