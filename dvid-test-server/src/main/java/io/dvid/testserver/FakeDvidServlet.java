package io.dvid.testserver;

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
import io.dvid.testserver.FakeDvidStore.Block;
import io.dvid.testserver.FakeDvidStore.EdgeKey;
import io.dvid.testserver.FakeDvidStore.Instance;
import io.dvid.testserver.FakeDvidStore.NotFound;
import io.dvid.testserver.FakeDvidStore.StoreRejection;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.util.URIUtil;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/// Serves the DVID REST interface from a [FakeDvidStore].
///
/// Mounted at `/api/*`. Unknown repositories, instances, keys and bodies answer
/// 404; requests the store refuses or cannot parse answer 400 with a plain-text
/// reason.
public class FakeDvidServlet extends HttpServlet {

    private static final Logger logger = LogManager.getLogger(FakeDvidServlet.class);

    /// Edge length of a rendered tile in pixels.
    public static final int TILE_SIZE = 64;

    private static final LZ4Factory LZ4 = LZ4Factory.fastestInstance();

    private final FakeDvidStore store;
    private volatile long throttledDelayMillis;

    public FakeDvidServlet(FakeDvidStore store) {
        this.store = store;
    }

    /// Holds every throttled transfer open for at least this long, so overlapping transfers are observable.
    public void setThrottledDelayMillis(long throttledDelayMillis) {
        this.throttledDelayMillis = throttledDelayMillis;
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        String path = req.getRequestURI().substring(req.getContextPath().length() + req.getServletPath().length());
        String[] parts = Arrays.stream(path.split("/")).filter(s -> !s.isEmpty())
            .map(URIUtil::decodePath).toArray(String[]::new);
        String method = req.getMethod();
        try {
            byte[] body = readBody(req);
            Reply reply = route(method, parts, body, req);
            resp.setStatus(reply.status);
            resp.setContentType(reply.contentType);
            resp.setContentLength(reply.body.length);
            resp.getOutputStream().write(reply.body);
        } catch (NotFound e) {
            logger.debug("404 {} {}: {}", method, path, e.getMessage());
            resp.sendError(HttpServletResponse.SC_NOT_FOUND, e.getMessage());
        } catch (StoreRejection | IllegalArgumentException | JsonParseException | IllegalStateException
                 | ArithmeticException | LZ4Exception | IndexOutOfBoundsException | BufferUnderflowException e) {
            logger.debug("400 {} {}: {}", method, path, e.getMessage());
            resp.sendError(HttpServletResponse.SC_BAD_REQUEST, String.valueOf(e.getMessage()));
        }
    }

    private record Reply(int status, String contentType, byte[] body) {
        static Reply ok() {
            return new Reply(200, "text/plain", new byte[0]);
        }

        static Reply json(JsonElement json) {
            return new Reply(200, "application/json", json.toString().getBytes(StandardCharsets.UTF_8));
        }

        static Reply binary(byte[] body) {
            return new Reply(200, "application/octet-stream", body);
        }
    }

    private Reply route(String method, String[] parts, byte[] body, HttpServletRequest req) throws IOException {
        if (parts.length == 1 && parts[0].equals("repos") && method.equals("POST")) {
            return createRepo(body);
        }
        if (parts.length == 2 && parts[0].equals("server") && parts[1].equals("info")) {
            JsonObject info = new JsonObject();
            info.addProperty("DVID Version", "in-memory");
            info.addProperty("Cores", Runtime.getRuntime().availableProcessors());
            return Reply.json(info);
        }
        if (parts.length == 3 && parts[0].equals("repo") && parts[2].equals("info")) {
            String[] repo = store.repoInfo(parts[1]).orElseThrow(() -> new NotFound("unknown repo " + parts[1]));
            JsonObject info = new JsonObject();
            info.addProperty("Root", parts[1]);
            info.addProperty("Alias", repo[0]);
            info.addProperty("Description", repo[1]);
            return Reply.json(info);
        }
        if (parts.length == 3 && parts[0].equals("repo") && parts[2].equals("instance") && method.equals("POST")) {
            return createInstance(parts[1], body);
        }
        if (parts.length >= 4 && parts[0].equals("node")) {
            String uuid = parts[1];
            String name = parts[2];
            Instance instance = store.findInstance(uuid, name)
                .orElseThrow(() -> new NotFound("no data instance '" + name + "' in " + uuid));
            String[] rest = Arrays.copyOfRange(parts, 3, parts.length);
            return routeInstance(method, uuid, instance, rest, body, req);
        }
        throw new NotFound("no route for " + method + " /" + String.join("/", parts));
    }

    private Reply routeInstance(String method, String uuid, Instance instance, String[] rest, byte[] body,
                                HttpServletRequest req) throws IOException {
        String name = instance.getName();
        String op = rest[0];
        switch (op) {
            case "info":
                return Reply.json(instanceInfo(instance));
            case "raw":
            case "isotropic":
                requireParts(rest, 4);
                return throttled(req, () -> volume(method, uuid, name, rest, body, req));
            case "blocks":
                requireParts(rest, 3);
                Block start = parseBlock(rest[1]);
                int span = Integer.parseInt(rest[2]);
                if (method.equals("GET")) {
                    return Reply.binary(store.readBlocks(uuid, name, start, span));
                }
                store.writeBlocks(uuid, name, start, span, body);
                return Reply.ok();
            case "tile":
                requireParts(rest, 4);
                return Reply.binary(tile(uuid, name, rest[1], Integer.parseInt(rest[2]), parseInts(rest[3], 3)));
            case "key":
                requireParts(rest, 2);
                String key = String.join("/", Arrays.copyOfRange(rest, 1, rest.length));
                if (method.equals("GET")) {
                    return Reply.binary(store.getValue(uuid, name, key)
                        .orElseThrow(() -> new NotFound("no key '" + key + "' in " + name)));
                }
                store.putValue(uuid, name, key, body);
                return Reply.ok();
            case "roi":
                if (method.equals("GET")) {
                    return Reply.json(encodeRuns(store.roiBlocks(uuid, name)));
                }
                store.addRoiBlocks(uuid, name, decodeRuns(body));
                return Reply.ok();
            case "ptquery":
                return Reply.json(pointQuery(uuid, name, body));
            case "sparsevol-coarse":
                requireParts(rest, 2);
                List<Block> blocks = store.bodyBlocks(uuid, name, new BigInteger(rest[1]).longValue());
                if (blocks.isEmpty()) {
                    throw new NotFound("no body " + rest[1] + " in " + name);
                }
                return Reply.binary(encodeCoarse(blocks));
            case "weight":
                return updateWeights(uuid, name, body);
            case "subgraph":
                return Reply.json(subgraph(uuid, name, body));
            case "neighbors":
                requireParts(rest, 2);
                return Reply.json(neighbors(uuid, name, new BigInteger(rest[1]).longValue()));
            case "propertytransaction":
                requireParts(rest, 3);
                return Reply.binary(propertyTransaction(method, uuid, name, rest[1], rest[2], body));
            default:
                throw new NotFound("unsupported endpoint '" + op + "' on " + instance.getTypeName());
        }
    }

    // ---------------------------------------------------------------- administrative

    private Reply createRepo(byte[] body) {
        JsonObject request = body.length == 0 ? new JsonObject() : parseObject(body);
        String alias = request.has("alias") ? request.get("alias").getAsString() : "";
        String description = request.has("description") ? request.get("description").getAsString() : "";
        String uuid = store.createRepo(alias, description);
        logger.debug("created repo '{}' with root {}", alias, uuid);
        JsonObject response = new JsonObject();
        response.addProperty("root", uuid);
        return Reply.json(response);
    }

    private Reply createInstance(String uuid, byte[] body) {
        if (!store.hasRepo(uuid)) {
            throw new NotFound("unknown repo " + uuid);
        }
        JsonObject request = parseObject(body);
        String typeName = request.get("typename").getAsString();
        String name = request.get("dataname").getAsString();
        String sync = request.has("sync") ? request.get("sync").getAsString() : null;
        store.createInstance(uuid, typeName, name, sync);
        return Reply.ok();
    }

    private static JsonObject instanceInfo(Instance instance) {
        JsonObject base = new JsonObject();
        base.addProperty("TypeName", instance.getTypeName());
        base.addProperty("Name", instance.getName());
        JsonArray syncs = new JsonArray();
        instance.getSync().ifPresent(syncs::add);
        base.add("Syncs", syncs);
        JsonObject extended = new JsonObject();
        if (instance.getVoxelWidth() > 0) {
            JsonArray blockSize = new JsonArray();
            for (int i = 0; i < 3; i++) {
                blockSize.add(FakeDvidStore.BLOCK_SIZE);
            }
            extended.add("BlockSize", blockSize);
        }
        JsonObject info = new JsonObject();
        info.add("Base", base);
        info.add("Extended", extended);
        return info;
    }

    // ---------------------------------------------------------------- volumes

    @FunctionalInterface
    private interface Handler {
        Reply handle() throws IOException;
    }

    private Reply throttled(HttpServletRequest req, Handler handler) throws IOException {
        if (!"on".equals(req.getParameter("throttle"))) {
            return handler.handle();
        }
        store.throttledStarted();
        try {
            long delay = throttledDelayMillis;
            if (delay > 0) {
                Thread.sleep(delay);
            }
            return handler.handle();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while holding a throttled transfer", e);
        } finally {
            store.throttledFinished();
        }
    }

    private Reply volume(String method, String uuid, String name, String[] rest, byte[] body,
                         HttpServletRequest req) {
        int[] channels = parseInts(rest[1], 3);
        int[] dims = parseInts(rest[2], 3);
        int[] offset = parseInts(rest[3], 3);
        checkPermutation(channels);
        int[] size = new int[3];
        int[] origin = new int[3];
        for (int i = 0; i < 3; i++) {
            if (dims[i] <= 0) {
                throw new IllegalArgumentException("extents must be positive: " + rest[2]);
            }
            size[channels[i]] = dims[i];
            origin[channels[i]] = offset[i];
        }
        boolean compress = "lz4".equals(req.getParameter("compress"));
        String roi = req.getParameter("roi");
        Predicate<Block> mask = roi == null || roi.isEmpty() ? null : store.roiMask(uuid, roi);
        int width = store.findInstance(uuid, name).orElseThrow().getVoxelWidth();
        int expected = Math.multiplyExact(Math.multiplyExact(size[0], size[1]), size[2] * width);

        if (method.equals("GET")) {
            byte[] xyz = store.readVoxels(uuid, name, origin, size, mask);
            byte[] ordered = toChannelOrder(xyz, size, channels, width);
            return Reply.binary(compress ? LZ4.fastCompressor().compress(ordered) : ordered);
        }
        if (!Arrays.equals(channels, new int[]{0, 1, 2})) {
            throw new StoreRejection("volume writes must use channel order 0_1_2");
        }
        byte[] raw = compress ? LZ4.safeDecompressor().decompress(body, expected) : body;
        if (raw.length != expected) {
            throw new StoreRejection("expected " + expected + " bytes of voxel data, got " + raw.length);
        }
        for (int axis = 0; axis < 3; axis++) {
            if (Math.floorMod(origin[axis], FakeDvidStore.BLOCK_SIZE) != 0 || size[axis] % FakeDvidStore.BLOCK_SIZE != 0) {
                throw new StoreRejection("volume writes must be block aligned");
            }
        }
        store.writeVoxels(uuid, name, origin, size, raw, mask);
        return Reply.ok();
    }

    private static byte[] toChannelOrder(byte[] xyz, int[] size, int[] channels, int width) {
        if (channels[0] == 0 && channels[1] == 1 && channels[2] == 2) {
            return xyz;
        }
        int[] extents = {size[channels[0]], size[channels[1]], size[channels[2]]};
        byte[] out = new byte[xyz.length];
        int[] spatial = new int[3];
        int target = 0;
        for (int c2 = 0; c2 < extents[2]; c2++) {
            for (int c1 = 0; c1 < extents[1]; c1++) {
                for (int c0 = 0; c0 < extents[0]; c0++) {
                    spatial[channels[0]] = c0;
                    spatial[channels[1]] = c1;
                    spatial[channels[2]] = c2;
                    int source = (spatial[2] * size[1] + spatial[1]) * size[0] + spatial[0];
                    System.arraycopy(xyz, source * width, out, target * width, width);
                    target++;
                }
            }
        }
        return out;
    }

    private byte[] tile(String uuid, String name, String plane, int scaling, int[] location) throws IOException {
        int[] inPlane;
        switch (plane) {
            case "xy" -> inPlane = new int[]{0, 1, 2};
            case "xz" -> inPlane = new int[]{0, 2, 1};
            case "yz" -> inPlane = new int[]{1, 2, 0};
            default -> throw new IllegalArgumentException("unknown tile plane '" + plane + "'");
        }
        int step = 1 << scaling;
        int span = TILE_SIZE * step;
        int[] origin = new int[3];
        int[] size = {1, 1, 1};
        origin[inPlane[0]] = location[inPlane[0]] * span;
        origin[inPlane[1]] = location[inPlane[1]] * span;
        origin[inPlane[2]] = location[inPlane[2]];
        size[inPlane[0]] = span;
        size[inPlane[1]] = span;
        byte[] voxels = store.readVoxels(uuid, name, origin, size, null);
        if (voxels.length != (long) span * span) {
            throw new StoreRejection("tiles are only rendered from grayscale instances");
        }
        BufferedImage image = new BufferedImage(TILE_SIZE, TILE_SIZE, BufferedImage.TYPE_BYTE_GRAY);
        int[] voxel = new int[3];
        for (int row = 0; row < TILE_SIZE; row++) {
            for (int col = 0; col < TILE_SIZE; col++) {
                voxel[inPlane[0]] = col * step;
                voxel[inPlane[1]] = row * step;
                voxel[inPlane[2]] = 0;
                int index = (voxel[2] * size[1] + voxel[1]) * size[0] + voxel[0];
                image.getRaster().setSample(col, row, 0, voxels[index] & 0xFF);
            }
        }
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        ImageIO.write(image, "png", png);
        return png.toByteArray();
    }

    // ---------------------------------------------------------------- ROI and bodies

    private static JsonArray encodeRuns(List<Block> sorted) {
        JsonArray runs = new JsonArray();
        Block start = null;
        Block last = null;
        for (Block block : sorted) {
            if (last != null && block.z() == last.z() && block.y() == last.y() && block.x() == last.x() + 1) {
                last = block;
                continue;
            }
            if (start != null) {
                runs.add(run(start, last));
            }
            start = block;
            last = block;
        }
        if (start != null) {
            runs.add(run(start, last));
        }
        return runs;
    }

    private static JsonArray run(Block start, Block end) {
        JsonArray run = new JsonArray();
        run.add(start.z());
        run.add(start.y());
        run.add(start.x());
        run.add(end.x());
        return run;
    }

    private static List<Block> decodeRuns(byte[] body) {
        List<Block> blocks = new ArrayList<>();
        for (JsonElement element : parseArray(body)) {
            JsonArray run = element.getAsJsonArray();
            if (run.size() != 4) {
                throw new IllegalArgumentException("ROI runs have four entries: " + run);
            }
            int z = run.get(0).getAsInt();
            int y = run.get(1).getAsInt();
            for (int x = run.get(2).getAsInt(); x <= run.get(3).getAsInt(); x++) {
                blocks.add(new Block(x, y, z));
            }
        }
        return blocks;
    }

    private JsonArray pointQuery(String uuid, String name, byte[] body) {
        Set<Block> roi = new HashSet<>(store.roiBlocks(uuid, name));
        JsonArray answer = new JsonArray();
        for (JsonElement element : parseArray(body)) {
            JsonArray point = element.getAsJsonArray();
            answer.add(roi.contains(Block.containing(point.get(0).getAsInt(), point.get(1).getAsInt(),
                point.get(2).getAsInt())));
        }
        return answer;
    }

    private static byte[] encodeCoarse(List<Block> sorted) {
        List<int[]> spans = new ArrayList<>();
        int[] current = null;
        for (Block block : sorted) {
            if (current != null && current[1] == block.y() && current[2] == block.z()
                && current[0] + current[3] == block.x()) {
                current[3]++;
            } else {
                current = new int[]{block.x(), block.y(), block.z(), 1};
                spans.add(current);
            }
        }
        ByteBuffer buffer = ByteBuffer.allocate(12 + 16 * spans.size()).order(ByteOrder.LITTLE_ENDIAN);
        buffer.put((byte) 0).put((byte) 3).put((byte) 0).put((byte) 0);
        buffer.putInt(0);
        buffer.putInt(spans.size());
        for (int[] span : spans) {
            buffer.putInt(span[0]).putInt(span[1]).putInt(span[2]).putInt(span[3]);
        }
        return buffer.array();
    }

    // ---------------------------------------------------------------- graph

    private Reply updateWeights(String uuid, String name, byte[] body) {
        JsonObject request = parseObject(body);
        Map<Long, Double> vertices = new LinkedHashMap<>();
        if (request.has("Vertices") && request.get("Vertices").isJsonArray()) {
            for (JsonElement element : request.getAsJsonArray("Vertices")) {
                JsonObject vertex = element.getAsJsonObject();
                vertices.merge(id(vertex, "Id"), weight(vertex), Double::sum);
            }
        }
        Map<EdgeKey, Double> edges = new LinkedHashMap<>();
        if (request.has("Edges") && request.get("Edges").isJsonArray()) {
            for (JsonElement element : request.getAsJsonArray("Edges")) {
                JsonObject edge = element.getAsJsonObject();
                edges.merge(EdgeKey.of(id(edge, "Id1"), id(edge, "Id2")), weight(edge), Double::sum);
            }
        }
        store.addVertexWeights(uuid, name, vertices);
        store.addEdgeWeights(uuid, name, edges);
        return Reply.ok();
    }

    private JsonObject subgraph(String uuid, String name, byte[] body) {
        List<Long> requested = new ArrayList<>();
        if (body.length > 0) {
            JsonObject request = parseObject(body);
            if (request.has("Vertices") && request.get("Vertices").isJsonArray()) {
                for (JsonElement element : request.getAsJsonArray("Vertices")) {
                    requested.add(id(element.getAsJsonObject(), "Id"));
                }
            }
        }
        Map<Long, Double> vertices = store.vertices(uuid, name, requested);
        return graphJson(vertices, store.edgesAmong(uuid, name, vertices.keySet()));
    }

    private JsonObject neighbors(String uuid, String name, long id) {
        Map<Long, Double> center = store.vertices(uuid, name, List.of(id));
        if (center.isEmpty()) {
            throw new NotFound("vertex " + Long.toUnsignedString(id) + " does not exist");
        }
        Map<EdgeKey, Double> edges = store.edgesOf(uuid, name, id);
        List<Long> ids = new ArrayList<>(center.keySet());
        for (EdgeKey edge : edges.keySet()) {
            ids.add(edge.low() == id ? edge.high() : edge.low());
        }
        return graphJson(store.vertices(uuid, name, ids), edges);
    }

    private static JsonObject graphJson(Map<Long, Double> vertices, Map<EdgeKey, Double> edges) {
        JsonArray vertexArray = new JsonArray();
        vertices.forEach((id, weight) -> {
            JsonObject vertex = new JsonObject();
            vertex.add("Id", unsigned(id));
            vertex.addProperty("Weight", weight);
            vertexArray.add(vertex);
        });
        JsonArray edgeArray = new JsonArray();
        edges.forEach((key, weight) -> {
            JsonObject edge = new JsonObject();
            edge.add("Id1", unsigned(key.low()));
            edge.add("Id2", unsigned(key.high()));
            edge.addProperty("Weight", weight);
            edgeArray.add(edge);
        });
        JsonObject graph = new JsonObject();
        graph.add("Vertices", vertexArray);
        graph.add("Edges", edgeArray);
        return graph;
    }

    private byte[] propertyTransaction(String method, String uuid, String name, String kind, String key,
                                       byte[] body) {
        ByteBuffer in = ByteBuffer.wrap(body).order(ByteOrder.LITTLE_ENDIAN);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        boolean vertices = kind.equals("vertices");
        if (!vertices && !kind.equals("edges")) {
            throw new NotFound("unknown property transaction kind '" + kind + "'");
        }
        if (method.equals("GET") && vertices) {
            long count = in.getLong();
            writeLong(out, count);
            for (long i = 0; i < count; i++) {
                long id = in.getLong();
                byte[] value = store.vertexProperty(uuid, name, key, id);
                writeLong(out, id);
                writeLong(out, store.vertexToken(uuid, name, id));
                writeLong(out, value.length);
                out.writeBytes(value);
            }
            return out.toByteArray();
        }
        if (method.equals("GET")) {
            long count = in.getLong();
            List<EdgeKey> edges = new ArrayList<>();
            Set<Long> endpoints = new LinkedHashSet<>();
            for (long i = 0; i < count; i++) {
                EdgeKey edge = EdgeKey.of(in.getLong(), in.getLong());
                edges.add(edge);
                endpoints.add(edge.low());
                endpoints.add(edge.high());
            }
            writeLong(out, endpoints.size());
            for (long id : endpoints) {
                writeLong(out, id);
                writeLong(out, store.vertexToken(uuid, name, id));
            }
            writeLong(out, edges.size());
            for (EdgeKey edge : edges) {
                byte[] value = store.edgeProperty(uuid, name, key, edge);
                writeLong(out, edge.low());
                writeLong(out, edge.high());
                writeLong(out, value.length);
                out.writeBytes(value);
            }
            return out.toByteArray();
        }

        List<Long> failed;
        if (vertices) {
            long count = in.getLong();
            Map<Long, Long> tokens = new LinkedHashMap<>();
            Map<Long, byte[]> values = new LinkedHashMap<>();
            for (long i = 0; i < count; i++) {
                long id = in.getLong();
                tokens.put(id, in.getLong());
                values.put(id, blob(in));
            }
            failed = store.writeVertexProperties(uuid, name, key, tokens, values);
        } else {
            long tokenCount = in.getLong();
            Map<Long, Long> tokens = new LinkedHashMap<>();
            for (long i = 0; i < tokenCount; i++) {
                tokens.put(in.getLong(), in.getLong());
            }
            long count = in.getLong();
            Map<EdgeKey, byte[]> values = new LinkedHashMap<>();
            for (long i = 0; i < count; i++) {
                values.put(EdgeKey.of(in.getLong(), in.getLong()), blob(in));
            }
            failed = store.writeEdgeProperties(uuid, name, key, tokens, values);
        }
        if (in.hasRemaining()) {
            throw new IllegalArgumentException("trailing bytes in property transaction");
        }
        writeLong(out, failed.size());
        failed.forEach(id -> writeLong(out, id));
        return out.toByteArray();
    }

    // ----------------------------------------------------------------

    private static byte[] blob(ByteBuffer in) {
        long size = in.getLong();
        if (size < 0 || size > in.remaining()) {
            throw new IllegalArgumentException("property value of " + size + " bytes is truncated");
        }
        byte[] value = new byte[(int) size];
        in.get(value);
        return value;
    }

    private static void writeLong(ByteArrayOutputStream out, long value) {
        byte[] bytes = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(value).array();
        out.writeBytes(bytes);
    }

    private static JsonPrimitive unsigned(long id) {
        return new JsonPrimitive(new BigInteger(Long.toUnsignedString(id)));
    }

    private static long id(JsonObject object, String field) {
        return object.get(field).getAsBigInteger().longValue();
    }

    private static double weight(JsonObject object) {
        return object.has("Weight") ? object.get("Weight").getAsDouble() : 0.0;
    }

    private static JsonObject parseObject(byte[] body) {
        return JsonParser.parseString(new String(body, StandardCharsets.UTF_8)).getAsJsonObject();
    }

    private static JsonArray parseArray(byte[] body) {
        return JsonParser.parseString(new String(body, StandardCharsets.UTF_8)).getAsJsonArray();
    }

    private static Block parseBlock(String segment) {
        int[] coords = parseInts(segment, 3);
        return new Block(coords[0], coords[1], coords[2]);
    }

    private static int[] parseInts(String segment, int expected) {
        String[] fields = segment.split("_");
        if (fields.length != expected) {
            throw new IllegalArgumentException("expected " + expected + " values in '" + segment + "'");
        }
        int[] values = new int[expected];
        for (int i = 0; i < expected; i++) {
            values[i] = Integer.parseInt(fields[i]);
        }
        return values;
    }

    private static void checkPermutation(int[] channels) {
        boolean[] seen = new boolean[channels.length];
        for (int channel : channels) {
            if (channel < 0 || channel >= channels.length || seen[channel]) {
                throw new IllegalArgumentException("channels must be a permutation: " + Arrays.toString(channels));
            }
            seen[channel] = true;
        }
    }

    private static void requireParts(String[] rest, int minimum) {
        if (rest.length < minimum) {
            throw new NotFound("incomplete endpoint /" + String.join("/", rest));
        }
    }

    private static byte[] readBody(HttpServletRequest req) throws IOException {
        try (InputStream in = req.getInputStream()) {
            return in.readAllBytes();
        }
    }
}
