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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/// In-memory model of a DVID store: repositories, typed data instances, and their contents.
///
/// Each repository has a single version node whose uuid is the repository's root.
/// Voxel instances keep their contents as 32-voxel cubic blocks with X varying
/// fastest; unwritten blocks read as zeros. All methods are synchronized, so the
/// servlet threads see a consistent store.
public class FakeDvidStore {

    /// Edge length of a storage block in voxels.
    public static final int BLOCK_SIZE = 32;

    public static final String GRAYSCALE = "uint8blk";
    public static final String LABELBLK = "labelblk";
    public static final String LABELVOL = "labelvol";
    public static final String KEYVALUE = "keyvalue";
    public static final String LABELGRAPH = "labelgraph";
    public static final String ROI = "roi";

    private static final Set<String> TYPE_NAMES = Set.of(GRAYSCALE, LABELBLK, LABELVOL, KEYVALUE, LABELGRAPH, ROI);

    private final Map<String, Repo> repos = new LinkedHashMap<>();
    private final AtomicInteger throttledInFlight = new AtomicInteger();
    private final AtomicInteger maxThrottledInFlight = new AtomicInteger();

    /// Block coordinates in block units, ordered (Z, Y, X).
    public record Block(int x, int y, int z) implements Comparable<Block> {
        @Override
        public int compareTo(Block o) {
            if (z != o.z) {
                return Integer.compare(z, o.z);
            }
            if (y != o.y) {
                return Integer.compare(y, o.y);
            }
            return Integer.compare(x, o.x);
        }

        public static Block containing(int x, int y, int z) {
            return new Block(Math.floorDiv(x, BLOCK_SIZE), Math.floorDiv(y, BLOCK_SIZE), Math.floorDiv(z, BLOCK_SIZE));
        }
    }

    /// Unordered vertex pair.
    public record EdgeKey(long low, long high) {
        public static EdgeKey of(long id1, long id2) {
            return Long.compareUnsigned(id1, id2) <= 0 ? new EdgeKey(id1, id2) : new EdgeKey(id2, id1);
        }
    }

    /// Thrown for requests the store refuses; the servlet maps it to a 400.
    public static class StoreRejection extends RuntimeException {
        public StoreRejection(String message) {
            super(message);
        }
    }

    private static final class Repo {
        final String alias;
        final String description;
        final Map<String, Instance> instances = new LinkedHashMap<>();

        Repo(String alias, String description) {
            this.alias = alias;
            this.description = description;
        }
    }

    /// A named data instance of one of the supported types.
    public static class Instance {
        final String typeName;
        final String name;
        final String sync;
        final int voxelWidth;
        final Map<Block, byte[]> blocks = new HashMap<>();
        final Map<String, byte[]> values = new TreeMap<>();
        final TreeSet<Block> roiBlocks = new TreeSet<>();
        final Map<Long, Double> vertices = new LinkedHashMap<>();
        final Map<EdgeKey, Double> edges = new LinkedHashMap<>();
        final Map<Long, Long> tokens = new HashMap<>();
        final Map<String, Map<Long, byte[]>> vertexProperties = new HashMap<>();
        final Map<String, Map<EdgeKey, byte[]>> edgeProperties = new HashMap<>();
        long nextToken = 1;

        Instance(String typeName, String name, String sync) {
            this.typeName = typeName;
            this.name = name;
            this.sync = sync;
            this.voxelWidth = GRAYSCALE.equals(typeName) ? 1 : LABELBLK.equals(typeName) ? 8 : 0;
        }

        public String getTypeName() {
            return typeName;
        }

        public String getName() {
            return name;
        }

        public Optional<String> getSync() {
            return Optional.ofNullable(sync);
        }

        public int getVoxelWidth() {
            return voxelWidth;
        }

        void touch(long vertexId) {
            tokens.put(vertexId, nextToken++);
        }

        long tokenOf(long vertexId) {
            return tokens.computeIfAbsent(vertexId, id -> nextToken++);
        }
    }

    // ---------------------------------------------------------------- repos and instances

    /// @return the uuid of the new repository's root node
    public synchronized String createRepo(String alias, String description) {
        String uuid = UUID.randomUUID().toString().replace("-", "");
        repos.put(uuid, new Repo(alias, description));
        return uuid;
    }

    public synchronized boolean hasRepo(String uuid) {
        return repos.containsKey(uuid);
    }

    /// @return alias and description of a repository
    public synchronized Optional<String[]> repoInfo(String uuid) {
        Repo repo = repos.get(uuid);
        return repo == null ? Optional.empty() : Optional.of(new String[]{repo.alias, repo.description});
    }

    /// @throws StoreRejection for unknown repos or types, and for duplicate names
    public synchronized Instance createInstance(String uuid, String typeName, String name, String sync) {
        Repo repo = requireRepo(uuid);
        if (!TYPE_NAMES.contains(typeName)) {
            throw new StoreRejection("unknown data type '" + typeName + "'");
        }
        if (name == null || name.isBlank()) {
            throw new StoreRejection("instance name is required");
        }
        if (repo.instances.containsKey(name)) {
            throw new StoreRejection("instance '" + name + "' already exists in " + uuid);
        }
        Instance instance = new Instance(typeName, name, sync == null || sync.isBlank() ? null : sync);
        repo.instances.put(name, instance);
        return instance;
    }

    public synchronized Optional<Instance> findInstance(String uuid, String name) {
        Repo repo = repos.get(uuid);
        return repo == null ? Optional.empty() : Optional.ofNullable(repo.instances.get(name));
    }

    // ---------------------------------------------------------------- voxels

    /// Reads a box of voxels in X, Y, Z order with X fastest.
    /// @param mask blocks outside the mask read as zeros; null reads everything
    public synchronized byte[] readVoxels(String uuid, String name, int[] offset, int[] size, Predicate<Block> mask) {
        Instance instance = requireVoxels(uuid, name);
        int width = instance.voxelWidth;
        byte[] out = new byte[Math.multiplyExact(Math.multiplyExact(size[0], size[1]), size[2] * width)];
        for (int z = 0; z < size[2]; z++) {
            for (int y = 0; y < size[1]; y++) {
                for (int x = 0; x < size[0]; x++) {
                    int gx = offset[0] + x;
                    int gy = offset[1] + y;
                    int gz = offset[2] + z;
                    Block block = Block.containing(gx, gy, gz);
                    if (mask != null && !mask.test(block)) {
                        continue;
                    }
                    byte[] stored = instance.blocks.get(block);
                    if (stored == null) {
                        continue;
                    }
                    int source = voxelIndexInBlock(gx, gy, gz) * width;
                    int target = ((z * size[1] + y) * size[0] + x) * width;
                    System.arraycopy(stored, source, out, target, width);
                }
            }
        }
        return out;
    }

    /// Writes a box of voxels given in X, Y, Z order with X fastest.
    /// @param mask voxels in blocks outside the mask are left unchanged; null writes everything
    public synchronized void writeVoxels(String uuid, String name, int[] offset, int[] size, byte[] data,
                                         Predicate<Block> mask) {
        Instance instance = requireVoxels(uuid, name);
        int width = instance.voxelWidth;
        long expected = (long) size[0] * size[1] * size[2] * width;
        if (data.length != expected) {
            throw new StoreRejection("expected " + expected + " bytes of voxel data, got " + data.length);
        }
        for (int z = 0; z < size[2]; z++) {
            for (int y = 0; y < size[1]; y++) {
                for (int x = 0; x < size[0]; x++) {
                    int gx = offset[0] + x;
                    int gy = offset[1] + y;
                    int gz = offset[2] + z;
                    Block block = Block.containing(gx, gy, gz);
                    if (mask != null && !mask.test(block)) {
                        continue;
                    }
                    byte[] stored = instance.blocks.computeIfAbsent(block,
                        b -> new byte[BLOCK_SIZE * BLOCK_SIZE * BLOCK_SIZE * width]);
                    int source = ((z * size[1] + y) * size[0] + x) * width;
                    System.arraycopy(data, source, stored, voxelIndexInBlock(gx, gy, gz) * width, width);
                }
            }
        }
    }

    /// Reads `span` whole blocks along X, concatenated.
    public synchronized byte[] readBlocks(String uuid, String name, Block start, int span) {
        Instance instance = requireVoxels(uuid, name);
        int blockBytes = BLOCK_SIZE * BLOCK_SIZE * BLOCK_SIZE * instance.voxelWidth;
        byte[] out = new byte[Math.multiplyExact(span, blockBytes)];
        for (int i = 0; i < span; i++) {
            byte[] stored = instance.blocks.get(new Block(start.x() + i, start.y(), start.z()));
            if (stored != null) {
                System.arraycopy(stored, 0, out, i * blockBytes, blockBytes);
            }
        }
        return out;
    }

    /// Stores `span` whole blocks along X from a concatenated payload.
    public synchronized void writeBlocks(String uuid, String name, Block start, int span, byte[] data) {
        Instance instance = requireVoxels(uuid, name);
        int blockBytes = BLOCK_SIZE * BLOCK_SIZE * BLOCK_SIZE * instance.voxelWidth;
        if ((long) span * blockBytes != data.length) {
            throw new StoreRejection("expected " + span + " blocks of " + blockBytes + " bytes, got " + data.length);
        }
        for (int i = 0; i < span; i++) {
            instance.blocks.put(new Block(start.x() + i, start.y(), start.z()),
                Arrays.copyOfRange(data, i * blockBytes, (i + 1) * blockBytes));
        }
    }

    /// Blocks of the label volume's synced label instance that contain `bodyId`.
    /// @return the blocks in (Z, Y, X) order, empty if the body has no voxels
    public synchronized List<Block> bodyBlocks(String uuid, String labelvol, long bodyId) {
        Instance volume = requireType(uuid, labelvol, LABELVOL);
        if (volume.sync == null) {
            throw new StoreRejection("label volume '" + labelvol + "' is not synced with a label instance");
        }
        Instance labels = requireType(uuid, volume.sync, LABELBLK);
        TreeSet<Block> found = new TreeSet<>();
        for (Map.Entry<Block, byte[]> entry : labels.blocks.entrySet()) {
            byte[] data = entry.getValue();
            for (int i = 0; i < data.length; i += 8) {
                if (littleEndianLong(data, i) == bodyId) {
                    found.add(entry.getKey());
                    break;
                }
            }
        }
        return new ArrayList<>(found);
    }

    // ---------------------------------------------------------------- key-value

    public synchronized void putValue(String uuid, String name, String key, byte[] value) {
        requireType(uuid, name, KEYVALUE).values.put(key, value.clone());
    }

    public synchronized Optional<byte[]> getValue(String uuid, String name, String key) {
        byte[] value = requireType(uuid, name, KEYVALUE).values.get(key);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    // ---------------------------------------------------------------- ROI

    public synchronized void addRoiBlocks(String uuid, String name, Collection<Block> blocks) {
        requireType(uuid, name, ROI).roiBlocks.addAll(blocks);
    }

    /// @return the ROI's blocks in (Z, Y, X) order
    public synchronized List<Block> roiBlocks(String uuid, String name) {
        return new ArrayList<>(requireType(uuid, name, ROI).roiBlocks);
    }

    /// @return a snapshot predicate testing ROI membership of a block
    public synchronized Predicate<Block> roiMask(String uuid, String name) {
        Set<Block> snapshot = new HashSet<>(requireType(uuid, name, ROI).roiBlocks);
        return snapshot::contains;
    }

    // ---------------------------------------------------------------- graph

    /// Adds vertex weights, creating missing vertices.
    public synchronized void addVertexWeights(String uuid, String name, Map<Long, Double> weights) {
        Instance graph = requireType(uuid, name, LABELGRAPH);
        for (Map.Entry<Long, Double> entry : weights.entrySet()) {
            graph.vertices.merge(entry.getKey(), entry.getValue(), Double::sum);
            graph.touch(entry.getKey());
        }
    }

    /// Adds edge weights, creating missing edges. Either every edge is applied or none is.
    /// @throws StoreRejection if an endpoint vertex does not exist
    public synchronized void addEdgeWeights(String uuid, String name, Map<EdgeKey, Double> weights) {
        Instance graph = requireType(uuid, name, LABELGRAPH);
        for (EdgeKey edge : weights.keySet()) {
            if (!graph.vertices.containsKey(edge.low()) || !graph.vertices.containsKey(edge.high())) {
                throw new StoreRejection("edge " + Long.toUnsignedString(edge.low()) + "-"
                    + Long.toUnsignedString(edge.high()) + " references a missing vertex");
            }
        }
        for (Map.Entry<EdgeKey, Double> entry : weights.entrySet()) {
            graph.edges.merge(entry.getKey(), entry.getValue(), Double::sum);
            graph.touch(entry.getKey().low());
            graph.touch(entry.getKey().high());
        }
    }

    /// @return vertex weights of the requested vertices that exist, or of all vertices when none are requested
    public synchronized Map<Long, Double> vertices(String uuid, String name, Collection<Long> ids) {
        Instance graph = requireType(uuid, name, LABELGRAPH);
        if (ids.isEmpty()) {
            return new LinkedHashMap<>(graph.vertices);
        }
        Map<Long, Double> found = new LinkedHashMap<>();
        for (long id : ids) {
            Double weight = graph.vertices.get(id);
            if (weight != null) {
                found.put(id, weight);
            }
        }
        return found;
    }

    /// @return edges with both endpoints in `ids`
    public synchronized Map<EdgeKey, Double> edgesAmong(String uuid, String name, Set<Long> ids) {
        Instance graph = requireType(uuid, name, LABELGRAPH);
        Map<EdgeKey, Double> found = new LinkedHashMap<>();
        graph.edges.forEach((edge, weight) -> {
            if (ids.contains(edge.low()) && ids.contains(edge.high())) {
                found.put(edge, weight);
            }
        });
        return found;
    }

    /// @return edges touching a vertex
    public synchronized Map<EdgeKey, Double> edgesOf(String uuid, String name, long id) {
        Instance graph = requireType(uuid, name, LABELGRAPH);
        Map<EdgeKey, Double> found = new LinkedHashMap<>();
        graph.edges.forEach((edge, weight) -> {
            if (edge.low() == id || edge.high() == id) {
                found.put(edge, weight);
            }
        });
        return found;
    }

    /// @throws StoreRejection if the vertex does not exist
    public synchronized long vertexToken(String uuid, String name, long id) {
        Instance graph = requireType(uuid, name, LABELGRAPH);
        requireVertex(graph, id);
        return graph.tokenOf(id);
    }

    /// @return the stored property, or an empty array when unset
    public synchronized byte[] vertexProperty(String uuid, String name, String key, long id) {
        Instance graph = requireType(uuid, name, LABELGRAPH);
        requireVertex(graph, id);
        return graph.vertexProperties.getOrDefault(key, Map.of()).getOrDefault(id, new byte[0]).clone();
    }

    /// @throws StoreRejection if the edge does not exist
    public synchronized byte[] edgeProperty(String uuid, String name, String key, EdgeKey edge) {
        Instance graph = requireType(uuid, name, LABELGRAPH);
        if (!graph.edges.containsKey(edge)) {
            throw new StoreRejection("edge " + edge + " does not exist");
        }
        return graph.edgeProperties.getOrDefault(key, Map.of()).getOrDefault(edge, new byte[0]).clone();
    }

    /// Writes vertex properties whose tokens are current.
    /// @param tokens token presented for each vertex
    /// @param values value for each vertex
    /// @return vertices whose tokens were stale
    public synchronized List<Long> writeVertexProperties(String uuid, String name, String key,
                                                         Map<Long, Long> tokens, Map<Long, byte[]> values) {
        Instance graph = requireType(uuid, name, LABELGRAPH);
        List<Long> failed = new ArrayList<>();
        for (Map.Entry<Long, Long> entry : tokens.entrySet()) {
            long id = entry.getKey();
            if (!graph.vertices.containsKey(id) || graph.tokenOf(id) != entry.getValue()) {
                failed.add(id);
                continue;
            }
            graph.vertexProperties.computeIfAbsent(key, k -> new HashMap<>()).put(id, values.get(id).clone());
            graph.touch(id);
        }
        return failed;
    }

    /// Writes edge properties where both endpoint tokens are current.
    /// @return vertices whose tokens were stale
    public synchronized List<Long> writeEdgeProperties(String uuid, String name, String key,
                                                       Map<Long, Long> tokens, Map<EdgeKey, byte[]> values) {
        Instance graph = requireType(uuid, name, LABELGRAPH);
        List<Long> failed = new ArrayList<>();
        for (Map.Entry<Long, Long> entry : tokens.entrySet()) {
            long id = entry.getKey();
            if (!graph.vertices.containsKey(id) || graph.tokenOf(id) != entry.getValue()) {
                failed.add(id);
            }
        }
        Set<Long> touched = new HashSet<>();
        for (Map.Entry<EdgeKey, byte[]> entry : values.entrySet()) {
            EdgeKey edge = entry.getKey();
            if (!tokens.containsKey(edge.low()) || !tokens.containsKey(edge.high())
                || failed.contains(edge.low()) || failed.contains(edge.high())) {
                continue;
            }
            if (!graph.edges.containsKey(edge)) {
                throw new StoreRejection("edge " + edge + " does not exist");
            }
            graph.edgeProperties.computeIfAbsent(key, k -> new HashMap<>()).put(edge, entry.getValue().clone());
            touched.add(edge.low());
            touched.add(edge.high());
        }
        touched.forEach(graph::touch);
        return failed;
    }

    /// Changes a vertex's token as any concurrent writer would.
    public synchronized void bumpToken(String uuid, String name, long id) {
        Instance graph = requireType(uuid, name, LABELGRAPH);
        requireVertex(graph, id);
        graph.touch(id);
    }

    // ---------------------------------------------------------------- throttling

    /// Marks the start of a throttled transfer.
    public void throttledStarted() {
        int now = throttledInFlight.incrementAndGet();
        maxThrottledInFlight.accumulateAndGet(now, Math::max);
    }

    public void throttledFinished() {
        throttledInFlight.decrementAndGet();
    }

    /// @return the most throttled transfers seen in flight at once
    public int getMaxThrottledInFlight() {
        return maxThrottledInFlight.get();
    }

    public void resetThrottleStatistics() {
        maxThrottledInFlight.set(throttledInFlight.get());
    }

    // ----------------------------------------------------------------

    private Repo requireRepo(String uuid) {
        Repo repo = repos.get(uuid);
        if (repo == null) {
            throw new NotFound("unknown node " + uuid);
        }
        return repo;
    }

    private Instance requireType(String uuid, String name, String typeName) {
        Instance instance = requireRepo(uuid).instances.get(name);
        if (instance == null) {
            throw new NotFound("no data instance '" + name + "' in " + uuid);
        }
        if (!instance.typeName.equals(typeName)) {
            throw new StoreRejection("'" + name + "' is a " + instance.typeName + ", not a " + typeName);
        }
        return instance;
    }

    private Instance requireVoxels(String uuid, String name) {
        Instance instance = requireRepo(uuid).instances.get(name);
        if (instance == null) {
            throw new NotFound("no data instance '" + name + "' in " + uuid);
        }
        if (instance.voxelWidth == 0) {
            throw new StoreRejection("'" + name + "' is a " + instance.typeName + " and holds no voxels");
        }
        return instance;
    }

    private static void requireVertex(Instance graph, long id) {
        if (!graph.vertices.containsKey(id)) {
            throw new StoreRejection("vertex " + Long.toUnsignedString(id) + " does not exist");
        }
    }

    private static int voxelIndexInBlock(int x, int y, int z) {
        int bx = Math.floorMod(x, BLOCK_SIZE);
        int by = Math.floorMod(y, BLOCK_SIZE);
        int bz = Math.floorMod(z, BLOCK_SIZE);
        return (bz * BLOCK_SIZE + by) * BLOCK_SIZE + bx;
    }

    static long littleEndianLong(byte[] data, int offset) {
        long value = 0;
        for (int i = 7; i >= 0; i--) {
            value = (value << 8) | (data[offset + i] & 0xFFL);
        }
        return value;
    }

    /// Thrown for unknown repositories, instances or keys; the servlet maps it to a 404.
    public static class NotFound extends RuntimeException {
        public NotFound(String message) {
            super(message);
        }
    }
}
