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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.dvid.client.transport.ConnectionMethod;
import io.dvid.testserver.DvidTestServerExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(DvidTestServerExtension.class)
class NodeServiceKeyValueTest {

    private DvidNodeService node;

    @BeforeEach
    void setUp() throws IOException {
        node = new DvidNodeService(TestNodes.config(), TestNodes.newRepo("kv-test"));
        node.createKeyvalue("kv");
    }

    @AfterEach
    void tearDown() throws IOException {
        node.close();
    }

    @Test
    void testBytesRoundTrip() {
        node.put("kv", "greeting", "hello".getBytes(StandardCharsets.UTF_8));
        assertThat(new String(node.get("kv", "greeting"), StandardCharsets.UTF_8)).isEqualTo("hello");

        node.put("kv", "greeting", new byte[]{1, 2});
        assertThat(node.get("kv", "greeting")).containsExactly(1, 2);
    }

    @Test
    void testKeysWithReservedCharacters() {
        node.put("kv", "a b?c", new byte[]{1});
        node.put("kv", "a b", new byte[]{2});
        node.put("kv", "x+y#z", new byte[]{3});

        assertThat(node.get("kv", "a b?c")).containsExactly(1);
        assertThat(node.get("kv", "a b")).containsExactly(2);
        assertThat(node.get("kv", "x+y#z")).containsExactly(3);
        assertThat(TestNodes.store().getValue(node.getUuid(), "kv", "a b?c")).hasValueSatisfying(
            v -> assertThat(v).containsExactly(1));
    }

    @Test
    void testJsonValues() {
        JsonObject value = new JsonObject();
        value.addProperty("name", "synapse");
        value.addProperty("count", 3);
        node.putJson("kv", "meta", value);

        JsonElement read = node.getJson("kv", "meta");
        assertThat(read).isEqualTo(value);
    }

    @Test
    void testFileContents(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("payload.bin");
        Files.write(file, new byte[]{7, 8, 9});
        node.put("kv", "file", file);
        assertThat(node.get("kv", "file")).containsExactly(7, 8, 9);
    }

    @Test
    void testMissingKey() {
        assertThatThrownBy(() -> node.get("kv", "absent"))
            .isInstanceOf(TransportException.class)
            .satisfies(e -> assertThat(((TransportException) e).getStatus()).isEqualTo(404));
        assertThatThrownBy(() -> node.get("kv", "")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testInstanceAdministration() {
        assertThat(node.exists("kv")).isTrue();
        assertThat(node.exists("other")).isFalse();
        assertThat(node.createKeyvalue("kv")).isFalse();
        assertThat(node.getTypeInfo("kv").getAsJsonObject("Base").get("TypeName").getAsString())
            .isEqualTo("keyvalue");

        node.customRequest("/kv/key/raw", new byte[]{4}, ConnectionMethod.POST);
        assertThat(node.customRequest("kv/key/raw", null, ConnectionMethod.GET))
            .containsExactly(4);
    }
}
