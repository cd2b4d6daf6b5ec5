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
import io.dvid.client.geometry.PointXYZ;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoiCodecTest {

    @Test
    void testMixedOrderBecomesSortedRuns() {
        List<BlockXYZ> blocks = List.of(new BlockXYZ(1, 0, 0), new BlockXYZ(0, 1, 0), new BlockXYZ(0, 0, 0));
        assertThat(RoiCodec.encodeRuns(blocks)).isEqualTo("[[0,0,0,1],[0,1,0,0]]");
        assertThat(RoiCodec.canonical(blocks))
            .containsExactly(new BlockXYZ(0, 0, 0), new BlockXYZ(1, 0, 0), new BlockXYZ(0, 1, 0));
    }

    @Test
    void testDuplicatesCollapse() {
        List<BlockXYZ> blocks = List.of(new BlockXYZ(2, 0, 0), new BlockXYZ(2, 0, 0), new BlockXYZ(3, 0, 0));
        assertThat(RoiCodec.encodeRuns(blocks)).isEqualTo("[[0,0,2,3]]");
    }

    @Test
    void testDecodeExpandsRuns() {
        List<BlockXYZ> blocks = RoiCodec.decodeRuns("[[1,0,5,6],[0,2,0,0]]");
        assertThat(blocks).containsExactly(new BlockXYZ(0, 2, 0), new BlockXYZ(5, 0, 1), new BlockXYZ(6, 0, 1));
        assertThat(RoiCodec.decodeRuns("[]")).isEmpty();
        assertThat(RoiCodec.decodeRuns("null")).isEmpty();
    }

    @Test
    void testMalformedRuns() {
        assertThatThrownBy(() -> RoiCodec.decodeRuns("[[1,2,3]]")).isInstanceOf(ShapeMismatchException.class);
        assertThatThrownBy(() -> RoiCodec.decodeRuns("[[0,0,5,4]]")).isInstanceOf(ShapeMismatchException.class);
        assertThatThrownBy(() -> RoiCodec.decodeRuns("{\"a\":1}")).isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void testPointQueryPayloads() {
        assertThat(RoiCodec.encodePoints(List.of(new PointXYZ(1, 2, 3), new PointXYZ(0, 0, 0))))
            .isEqualTo("[[1,2,3],[0,0,0]]");
        assertThat(RoiCodec.decodeMembership("[true,false]", 2)).containsExactly(true, false);
        assertThatThrownBy(() -> RoiCodec.decodeMembership("[true]", 2)).isInstanceOf(ShapeMismatchException.class);
    }
}
