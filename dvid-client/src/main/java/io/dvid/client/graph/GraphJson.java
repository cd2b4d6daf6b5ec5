package io.dvid.client.graph;

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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import io.dvid.client.ShapeMismatchException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/// JSON encoding of labelgraph vertices and edges:
/// `{"Vertices": [{"Id": 1, "Weight": 2.0}], "Edges": [{"Id1": 1, "Id2": 2, "Weight": 0.5}]}`.
///
/// Ids are unsigned 64-bit and are written as unsigned decimal numbers.
public final class GraphJson {

    static final String VERTICES = "Vertices";
    static final String EDGES = "Edges";

    private GraphJson() {
    }

    public static String encode(List<Vertex> vertices, List<Edge> edges) {
        JsonObject root = new JsonObject();
        JsonArray vertexArray = new JsonArray();
        for (Vertex vertex : vertices) {
            JsonObject v = new JsonObject();
            v.add("Id", unsigned(vertex.id()));
            v.addProperty("Weight", vertex.weight());
            vertexArray.add(v);
        }
        JsonArray edgeArray = new JsonArray();
        for (Edge edge : edges) {
            JsonObject e = new JsonObject();
            e.add("Id1", unsigned(edge.id1()));
            e.add("Id2", unsigned(edge.id2()));
            e.addProperty("Weight", edge.weight());
            edgeArray.add(e);
        }
        root.add(VERTICES, vertexArray);
        root.add(EDGES, edgeArray);
        return root.toString();
    }

    /// @throws ShapeMismatchException if the payload is not a graph document
    public static Graph decode(String json) {
        JsonObject root;
        try {
            JsonElement parsed = JsonParser.parseString(json);
            if (!parsed.isJsonObject()) {
                throw new JsonParseException("expected a JSON object");
            }
            root = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new ShapeMismatchException("Malformed graph payload: " + e.getMessage(), 0, json.length());
        }
        List<Vertex> vertices = new ArrayList<>();
        if (root.has(VERTICES) && root.get(VERTICES).isJsonArray()) {
            for (JsonElement element : root.getAsJsonArray(VERTICES)) {
                JsonObject v = element.getAsJsonObject();
                vertices.add(new Vertex(idOf(v, "Id"), weightOf(v)));
            }
        }
        List<Edge> edges = new ArrayList<>();
        if (root.has(EDGES) && root.get(EDGES).isJsonArray()) {
            for (JsonElement element : root.getAsJsonArray(EDGES)) {
                JsonObject e = element.getAsJsonObject();
                edges.add(new Edge(idOf(e, "Id1"), idOf(e, "Id2"), weightOf(e)));
            }
        }
        return new Graph(vertices, edges);
    }

    static JsonPrimitive unsigned(long id) {
        return new JsonPrimitive(new BigInteger(Long.toUnsignedString(id)));
    }

    private static long idOf(JsonObject object, String field) {
        if (!object.has(field)) {
            throw new ShapeMismatchException("Graph element is missing '" + field + "': " + object, 1, 0);
        }
        return object.get(field).getAsBigInteger().longValue();
    }

    private static double weightOf(JsonObject object) {
        return object.has("Weight") ? object.get("Weight").getAsDouble() : 0.0;
    }
}
