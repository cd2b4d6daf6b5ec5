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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;

class BodyLocatorTest {

    @Test
    void testPicksBlockNearestCentroid() {
        List<BlockXYZ> blocks = List.of(new BlockXYZ(0, 0, 0), new BlockXYZ(1, 0, 0), new BlockXYZ(2, 0, 0));
        assertThat(BodyLocator.locate(blocks, OptionalInt.empty())).contains(new PointXYZ(48, 16, 16));
    }

    @Test
    void testAnswerLiesInsideConcaveBody() {
        List<BlockXYZ> ring = List.of(
            new BlockXYZ(0, 0, 0), new BlockXYZ(1, 0, 0), new BlockXYZ(2, 0, 0),
            new BlockXYZ(0, 1, 0), new BlockXYZ(2, 1, 0),
            new BlockXYZ(0, 2, 0), new BlockXYZ(1, 2, 0), new BlockXYZ(2, 2, 0));
        PointXYZ point = BodyLocator.locate(ring, OptionalInt.empty()).orElseThrow();
        assertThat(ring).contains(BlockXYZ.containing(point));
        assertThat(point).isEqualTo(new PointXYZ(48, 16, 16));
    }

    @Test
    void testZPlaneConstraint() {
        List<BlockXYZ> blocks = List.of(new BlockXYZ(0, 0, 0), new BlockXYZ(5, 5, 3));
        assertThat(BodyLocator.locate(blocks, OptionalInt.of(100))).contains(new PointXYZ(176, 176, 100));
        assertThat(BodyLocator.locate(blocks, OptionalInt.of(40)))
            .isEqualTo(BodyLocator.locate(blocks, OptionalInt.empty()));
    }

    @Test
    void testEmptyBody() {
        assertThat(BodyLocator.locate(List.of(), OptionalInt.empty())).isEmpty();
    }
}
