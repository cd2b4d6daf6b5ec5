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

import io.dvid.client.geometry.BlockXYZ;
import io.dvid.client.geometry.PointXYZ;
import io.dvid.client.geometry.SubstackXYZ;
import io.dvid.client.roi.RoiPartition;
import io.dvid.testserver.DvidTestServerExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(DvidTestServerExtension.class)
class NodeServiceRoiTest {

    private DvidNodeService node;

    @BeforeEach
    void setUp() throws IOException {
        node = new DvidNodeService(TestNodes.config(), TestNodes.newRepo("roi-test"));
        assertThat(node.createRoi("roi")).isTrue();
    }

    @AfterEach
    void tearDown() throws IOException {
        node.close();
    }

    @Test
    void testBlocksComeBackSorted() {
        node.postRoi("roi", List.of(new BlockXYZ(1, 0, 0), new BlockXYZ(0, 1, 0), new BlockXYZ(0, 0, 0)));
        assertThat(node.getRoi("roi"))
            .containsExactly(new BlockXYZ(0, 0, 0), new BlockXYZ(1, 0, 0), new BlockXYZ(0, 1, 0));
    }

    @Test
    void testPostingAddsToExistingRoi() {
        node.postRoi("roi", List.of(new BlockXYZ(0, 0, 0)));
        node.postRoi("roi", List.of(new BlockXYZ(0, 0, 0), new BlockXYZ(0, 0, 2)));
        assertThat(node.getRoi("roi")).containsExactly(new BlockXYZ(0, 0, 0), new BlockXYZ(0, 0, 2));
    }

    @Test
    void testEmptyRoi() {
        assertThat(node.getRoi("roi")).isEmpty();
        RoiPartition partition = node.getRoiPartition("roi", 4);
        assertThat(partition.substacks()).isEmpty();
        assertThat(partition.packingFactor()).isEqualTo(1.0);
    }

    @Test
    void testPartition() {
        node.postRoi("roi", List.of(new BlockXYZ(0, 0, 0), new BlockXYZ(1, 0, 0), new BlockXYZ(9, 0, 0)));
        RoiPartition partition = node.getRoiPartition("roi", 2);
        assertThat(partition.substacks()).containsExactly(new SubstackXYZ(0, 0, 0, 2), new SubstackXYZ(4, 0, 0, 2));
        assertThat(partition.packingFactor()).isEqualTo(3.0 / 16);
        assertThat(partition.packingFactor()).isGreaterThan(0).isLessThanOrEqualTo(1);
    }

    @Test
    void testShiftedCubePacksFully() {
        List<BlockXYZ> cube = new ArrayList<>();
        for (int z = 3; z <= 4; z++) {
            for (int y = 3; y <= 4; y++) {
                for (int x = 3; x <= 4; x++) {
                    cube.add(new BlockXYZ(x, y, z));
                }
            }
        }
        node.postRoi("roi", cube);
        RoiPartition partition = node.getRoiPartition("roi", 2);
        assertThat(partition.substacks()).hasSize(1);
        assertThat(partition.substacks().get(0).voxelOrigin()).isEqualTo(new PointXYZ(96, 96, 96));
        assertThat(partition.packingFactor()).isEqualTo(1.0);
    }

    @Test
    void testPointQueryKeepsOrder() {
        node.postRoi("roi", List.of(new BlockXYZ(1, 0, 0)));
        List<Boolean> inside = node.roiPtQuery("roi", List.of(
            new PointXYZ(40, 1, 1), new PointXYZ(0, 0, 0), new PointXYZ(63, 31, 31), new PointXYZ(64, 0, 0)));
        assertThat(inside).containsExactly(true, false, true, false);
    }

    @Test
    void testPointQueryAllInside() {
        node.postRoi("roi", List.of(new BlockXYZ(1, 0, 0), new BlockXYZ(0, 2, 1)));
        List<Boolean> inside = node.roiPtQuery("roi", List.of(
            new PointXYZ(63, 0, 0), new PointXYZ(10, 70, 40), new PointXYZ(32, 31, 31)));
        assertThat(inside).containsExactly(true, true, true);
    }

    @Test
    void testPointQueryAllOutside() {
        node.postRoi("roi", List.of(new BlockXYZ(1, 0, 0)));
        List<Boolean> inside = node.roiPtQuery("roi", List.of(
            new PointXYZ(31, 0, 0), new PointXYZ(64, 0, 0), new PointXYZ(40, -1, 0), new PointXYZ(40, 0, 32)));
        assertThat(inside).containsExactly(false, false, false, false);
    }
}
