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

import com.google.gson.JsonObject;
import io.dvid.testserver.DvidTestServerExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(DvidTestServerExtension.class)
class DvidServerServiceTest {

    @Test
    void testCreateRepoAndOpenNode() throws IOException {
        try (DvidServerService server = new DvidServerService(TestNodes.config())) {
            String uuid = server.createNewRepo("server-test", "a repo");
            assertThat(uuid).isNotBlank();
            assertThat(TestNodes.store().hasRepo(uuid)).isTrue();

            DvidNodeService node = server.openNode(uuid);
            assertThat(node.getUuid()).isEqualTo(uuid);
            assertThat(node.createKeyvalue("kv")).isTrue();
        }
    }

    @Test
    void testServerInfo() throws IOException {
        try (DvidServerService server = new DvidServerService(TestNodes.config())) {
            JsonObject info = server.getServerInfo();
            assertThat(info.has("DVID Version")).isTrue();
        }
    }

    @Test
    void testUnknownNodeFailsOnOpen() {
        assertThatThrownBy(() -> new DvidNodeService(TestNodes.config(), "feedface"))
            .isInstanceOf(TransportException.class)
            .satisfies(e -> assertThat(((TransportException) e).getStatus()).isEqualTo(404));
    }

    @Test
    void testVerifiedNodeOwnsItsConnection() throws IOException {
        String uuid = TestNodes.newRepo("owned");
        DvidNodeService node = new DvidNodeService(TestNodes.config(), uuid);
        assertThat(node.createKeyvalue("kv")).isTrue();
        node.close();
        assertThatThrownBy(() -> node.exists("kv")).isInstanceOf(TransportException.class);
    }
}
