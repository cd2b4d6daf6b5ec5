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

import io.dvid.client.geometry.Dims;
import io.dvid.client.geometry.Offset;
import io.dvid.client.throttle.ThrottleGate;
import io.dvid.client.transport.DvidConnection;
import io.dvid.client.volume.Volume;
import io.dvid.client.volume.VolumeOptions;
import io.dvid.client.volume.VolumeView;
import io.dvid.client.volume.VoxelType;
import io.dvid.testserver.DvidTestServerExtension;
import io.dvid.testserver.DvidTestServerFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Throttled volume transfers from many threads and many service instances reach the
/// store one at a time.
@ExtendWith(DvidTestServerExtension.class)
class ThrottledTransferTest {

    private static final int THREADS = 6;

    private DvidTestServerFixture server;
    private String uuid;

    @BeforeEach
    void setUp() throws IOException {
        server = DvidTestServerExtension.getServer();
        uuid = TestNodes.newRepo("throttle-test");
        try (DvidNodeService node = new DvidNodeService(TestNodes.config(), uuid)) {
            node.createGrayscale8("grayscale");
            node.putGray3D("grayscale", Volume.zeros(Dims.cube(32), VoxelType.GRAYSCALE8),
                Offset.origin());
        }
        server.setThrottledDelayMillis(25);
        server.getStore().resetThrottleStatistics();
    }

    @AfterEach
    void tearDown() {
        server.setThrottledDelayMillis(0);
    }

    @Test
    void testSharedGateSerializesServices() throws Exception {
        runConcurrently(() -> new DvidNodeService(TestNodes.config(), uuid), VolumeOptions.grayscaleDefaults());
        assertThat(server.getStore().getMaxThrottledInFlight()).isEqualTo(1);
    }

    @Test
    void testUnthrottledTransfersBypassGate() throws Exception {
        ThrottleGate gate = ThrottleGate.processWide();
        long admitted = gate.getAdmittedCount();
        runConcurrently(() -> new DvidNodeService(TestNodes.config(), uuid),
            new VolumeOptions(false, false, null, VolumeView.RAW));
        assertThat(gate.getAdmittedCount()).isEqualTo(admitted);
    }

    @Test
    void testFailedTransferReleasesGate() throws IOException {
        ThrottleGate gate = new ThrottleGate("failing");
        try (DvidConnection connection = new DvidConnection(TestNodes.config());
             DvidNodeService node = new DvidNodeService(connection, uuid, gate, TestNodes.config())) {
            assertThatThrownBy(() -> node.getGray3D("missing", Dims.cube(32), Offset.origin()))
                .isInstanceOf(TransportException.class);
            assertThat(gate.isHeld()).isFalse();
            Volume read = node.getGray3D("grayscale", Dims.cube(32), Offset.origin());
            assertThat(read.voxelCount()).isEqualTo(32 * 32 * 32);
        }
    }

    @FunctionalInterface
    private interface ServiceFactory {
        DvidNodeService open();
    }

    private void runConcurrently(ServiceFactory factory, VolumeOptions options) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                futures.add(pool.submit(() -> {
                    try (DvidNodeService node = factory.open()) {
                        start.await();
                        long voxels = 0;
                        for (int i = 0; i < 3; i++) {
                            Volume read = node.getGray3D("grayscale", Dims.cube(32), Offset.origin(), options);
                            voxels += read.voxelCount();
                        }
                        return voxels;
                    }
                }));
            }
            start.countDown();
            for (Future<Long> future : futures) {
                assertThat(future.get(60, TimeUnit.SECONDS)).isEqualTo(3L * 32 * 32 * 32);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
