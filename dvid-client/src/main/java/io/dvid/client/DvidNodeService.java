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
import io.dvid.client.blocks.BlockCodec;
import io.dvid.client.blocks.BlockSpan;
import io.dvid.client.config.DvidClientConfig;
import io.dvid.client.geometry.BlockXYZ;
import io.dvid.client.geometry.ChannelOrder;
import io.dvid.client.geometry.Dims;
import io.dvid.client.geometry.Offset;
import io.dvid.client.geometry.PointXYZ;
import io.dvid.client.geometry.Slice2D;
import io.dvid.client.graph.Edge;
import io.dvid.client.graph.Graph;
import io.dvid.client.graph.GraphJson;
import io.dvid.client.graph.PropertyBatch;
import io.dvid.client.graph.PropertyCodec;
import io.dvid.client.graph.PropertyWriteResult;
import io.dvid.client.graph.Vertex;
import io.dvid.client.graph.VertexTransactions;
import io.dvid.client.roi.BodyLocator;
import io.dvid.client.roi.CoarseVolumeDecoder;
import io.dvid.client.roi.RoiCodec;
import io.dvid.client.roi.RoiPartition;
import io.dvid.client.roi.RoiPartitioner;
import io.dvid.client.throttle.ThrottleGate;
import io.dvid.client.transport.Connection;
import io.dvid.client.transport.ConnectionMethod;
import io.dvid.client.transport.ConnectionResponse;
import io.dvid.client.transport.DvidConnection;
import io.dvid.client.transport.PathSegments;
import io.dvid.client.volume.TileDecoder;
import io.dvid.client.volume.Volume;
import io.dvid.client.volume.VolumeCodec;
import io.dvid.client.volume.VolumeOptions;
import io.dvid.client.volume.VoxelType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/// Access to the data instances of one version node.
///
/// Every call is a self-contained request over the service's [Connection].
/// The service holds no mutable state of its own, so one instance may be used
/// from several threads; the only state shared between instances is the
/// [ThrottleGate] that serializes throttled volume transfers.
///
/// Validation errors ([SizeLimitExceededException], [ShapeMismatchException],
/// [AlignmentViolationException], [UnsupportedCapabilityException]) are raised
/// before any request is sent. Store failures surface as [TransportException].
/// Absence is reported through `Optional`, `boolean` or a zero label, never
/// through an exception.
public class DvidNodeService implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(DvidNodeService.class);

    /// Largest number of vertices or edges sent in one weight update.
    public static final int GRAPH_TRANSACTION_LIMIT = 1000;

    private final StoreRequests requests;
    private final String uuid;
    private final ThrottleGate throttleGate;
    private final DvidClientConfig config;
    private final boolean ownsConnection;

    /// Connects to the configured server and checks that the node exists.
    /// @param config client settings
    /// @param uuid node uuid
    /// @throws TransportException if the node cannot be found
    public DvidNodeService(DvidClientConfig config, String uuid) {
        this(new DvidConnection(config), uuid, ThrottleGate.processWide(), config, true);
        try {
            verifyNode();
        } catch (RuntimeException e) {
            closeQuietly();
            throw e;
        }
    }

    /// Uses an existing connection and the process-wide throttle gate. The node is not checked.
    public DvidNodeService(Connection connection, String uuid) {
        this(connection, uuid, ThrottleGate.processWide(), DvidClientConfig.defaults(connection.getAddress()), false);
    }

    /// Uses an existing connection and an explicit throttle gate. The node is not checked.
    /// @param connection connection to the store; left open on [#close()]
    /// @param uuid node uuid
    /// @param throttleGate gate for throttled transfers
    /// @param config settings for defaults and capability flags
    public DvidNodeService(Connection connection, String uuid, ThrottleGate throttleGate, DvidClientConfig config) {
        this(connection, uuid, throttleGate, config, false);
    }

    private DvidNodeService(Connection connection, String uuid, ThrottleGate throttleGate, DvidClientConfig config,
                            boolean ownsConnection) {
        if (uuid == null || uuid.isBlank()) {
            throw new IllegalArgumentException("uuid cannot be null or empty");
        }
        this.requests = new StoreRequests(connection);
        this.uuid = uuid;
        this.throttleGate = throttleGate;
        this.config = config;
        this.ownsConnection = ownsConnection;
    }

    public String getUuid() {
        return uuid;
    }

    public ThrottleGate getThrottleGate() {
        return throttleGate;
    }

    /// Checks that the node's repository is known to the store.
    /// @throws TransportException if it is not
    public void verifyNode() {
        requests.send("/repo/" + uuid + "/info", ConnectionMethod.GET, null);
    }

    // ---------------------------------------------------------------- administrative

    /// Sends a request to an endpoint under this node.
    /// @param endpoint path below `/node/{uuid}`, starting with `/`
    /// @param payload request body, or null
    /// @param method HTTP verb
    /// @return the response body
    public byte[] customRequest(String endpoint, byte[] payload, ConnectionMethod method) {
        String path = endpoint.startsWith("/") ? endpoint : "/" + endpoint;
        return requests.send("/node/" + uuid + path, method, payload).body();
    }

    /// @return the metadata of a data instance
    public JsonObject getTypeInfo(String instance) {
        String endpoint = nodePath(instance, "/info");
        return StoreRequests.parseJsonObject(requests.send(endpoint, ConnectionMethod.GET, null), endpoint);
    }

    /// @return true if the data instance exists under this node
    public boolean exists(String instance) {
        return requests.exchange(nodePath(instance, "/info"), ConnectionMethod.GET, null).isSuccess();
    }

    /// @return true if created, false if it already existed
    public boolean createGrayscale8(String name) {
        return createDatatype("uint8blk", name, null);
    }

    /// @return true if created, false if it already existed
    public boolean createLabelblk(String name) {
        return createDatatype("labelblk", name, null);
    }

    /// Creates a label block instance and a label volume synced with it.
    /// @param name label block instance name
    /// @param labelvolName label volume instance name
    /// @return true if both were created, false if either already existed
    public boolean createLabelblk(String name, String labelvolName) {
        boolean blocks = createDatatype("labelblk", name, labelvolName);
        boolean volume = createDatatype("labelvol", labelvolName, name);
        return blocks && volume;
    }

    /// @return true if created, false if it already existed
    public boolean createKeyvalue(String name) {
        return createDatatype("keyvalue", name, null);
    }

    /// @return true if created, false if it already existed
    public boolean createGraph(String name) {
        return createDatatype("labelgraph", name, null);
    }

    /// @return true if created, false if it already existed
    public boolean createRoi(String name) {
        return createDatatype("roi", name, null);
    }

    private boolean createDatatype(String typename, String name, String syncName) {
        if (exists(name)) {
            return false;
        }
        JsonObject request = new JsonObject();
        request.addProperty("typename", typename);
        request.addProperty("dataname", name);
        if (syncName != null && !syncName.isBlank()) {
            request.addProperty("sync", syncName);
        }
        requests.send("/repo/" + uuid + "/instance", ConnectionMethod.POST, StoreRequests.utf8(request.toString()));
        logger.info("created {} instance '{}' in {}", typename, name, uuid);
        return true;
    }

    // ---------------------------------------------------------------- volumes

    /// Reads grayscale voxels in XYZ order with the configured defaults.
    public Volume getGray3D(String instance, Dims dims, Offset offset) {
        return getGray3D(instance, dims, offset, null, grayscaleDefaults());
    }

    public Volume getGray3D(String instance, Dims dims, Offset offset, VolumeOptions options) {
        return getGray3D(instance, dims, offset, null, options);
    }

    /// Reads grayscale voxels.
    /// @param instance grayscale instance
    /// @param dims extents in channel order
    /// @param offset voxel offset in channel order
    /// @param channels channel order, or null for XYZ
    /// @param options transfer flags
    /// @return the voxels, first listed channel fastest
    public Volume getGray3D(String instance, Dims dims, Offset offset, ChannelOrder channels, VolumeOptions options) {
        return getVolume(instance, dims, offset, channels, options, VoxelType.GRAYSCALE8);
    }

    /// Reads label voxels in XYZ order with the configured defaults.
    public Volume getLabels3D(String instance, Dims dims, Offset offset) {
        return getLabels3D(instance, dims, offset, null, labelDefaults());
    }

    public Volume getLabels3D(String instance, Dims dims, Offset offset, VolumeOptions options) {
        return getLabels3D(instance, dims, offset, null, options);
    }

    public Volume getLabels3D(String instance, Dims dims, Offset offset, ChannelOrder channels, VolumeOptions options) {
        return getVolume(instance, dims, offset, channels, options, VoxelType.LABELS64);
    }

    /// @return the label at a voxel, or 0 where nothing is labeled
    public long getLabelByLocation(String instance, int x, int y, int z) {
        Volume single = getLabels3D(instance, Dims.cube(1), Offset.of(x, y, z), null,
            new VolumeOptions(false, false, null, null));
        return single.get(0, 0, 0);
    }

    public void putGray3D(String instance, Volume volume, Offset offset) {
        putGray3D(instance, volume, offset, grayscaleDefaults());
    }

    /// Writes grayscale voxels in XYZ order. Offset and extents must be block aligned.
    public void putGray3D(String instance, Volume volume, Offset offset, VolumeOptions options) {
        putVolume(instance, volume, offset, options, VoxelType.GRAYSCALE8);
    }

    public void putLabels3D(String instance, Volume volume, Offset offset) {
        putLabels3D(instance, volume, offset, labelDefaults());
    }

    /// Writes label voxels in XYZ order. Offset and extents must be block aligned; an
    /// ROI in `options` restricts the write to voxels inside it.
    public void putLabels3D(String instance, Volume volume, Offset offset, VolumeOptions options) {
        putVolume(instance, volume, offset, options, VoxelType.LABELS64);
    }

    private Volume getVolume(String instance, Dims dims, Offset offset, ChannelOrder channels,
                             VolumeOptions options, VoxelType voxelType) {
        if (dims.rank() != 3) {
            throw new IllegalArgumentException("Volume reads are 3D; request a slice as X x Y x 1: " + dims);
        }
        String endpoint = VolumeCodec.volumeEndpoint(uuid, instance, dims, offset, channels, options);
        ConnectionResponse response = requests.send(throttleGate, options.throttle(), endpoint,
            ConnectionMethod.GET, null);
        return VolumeCodec.decode(response.body(), dims, voxelType, options.compress());
    }

    private void putVolume(String instance, Volume volume, Offset offset, VolumeOptions options,
                           VoxelType voxelType) {
        if (volume.getVoxelType() != voxelType) {
            throw new IllegalArgumentException("Expected a " + voxelType + " volume, got " + volume.getVoxelType());
        }
        Dims dims = volume.getDims();
        if (dims.rank() != 3 || offset.rank() != 3) {
            throw new IllegalArgumentException("Volume writes are 3D: " + dims + " at " + offset);
        }
        VolumeCodec.checkBlockAligned(dims, offset);
        String endpoint = VolumeCodec.volumeEndpoint(uuid, instance, dims, offset, ChannelOrder.XYZ, options);
        byte[] payload = VolumeCodec.encode(volume, options.compress());
        requests.send(throttleGate, options.throttle(), endpoint, ConnectionMethod.POST, payload);
    }

    private VolumeOptions grayscaleDefaults() {
        return VolumeOptions.grayscaleDefaults().withThrottle(config.throttleByDefault());
    }

    private VolumeOptions labelDefaults() {
        return VolumeOptions.labelDefaults().withThrottle(config.throttleByDefault());
    }

    // ---------------------------------------------------------------- tiles

    /// Reads a stored tile as encoded by the store (PNG or JPEG).
    /// @param instance tile instance
    /// @param slice cut plane
    /// @param scaling zoom level, 0 for full resolution
    /// @param tileLoc tile location; the in-plane coordinates are in tile units, the third in voxels
    /// @return the encoded tile
    public byte[] getTileSliceBinary(String instance, Slice2D slice, int scaling, PointXYZ tileLoc) {
        String endpoint = nodePath(instance, "/tile/" + slice.endpointName() + "/" + scaling + "/"
            + tileLoc.toEndpointSegment());
        return requests.send(endpoint, ConnectionMethod.GET, null).body();
    }

    /// Reads a stored tile and decodes it into a 2D grayscale volume.
    public Volume getTileSlice(String instance, Slice2D slice, int scaling, PointXYZ tileLoc) {
        return TileDecoder.decodeGrayscale(getTileSliceBinary(instance, slice, scaling, tileLoc));
    }

    // ---------------------------------------------------------------- blocks

    /// Reads `span` grayscale blocks along X starting at `start`.
    public BlockSpan getGrayBlocks(String instance, BlockXYZ start, int span) {
        return getBlocks(instance, start, span, VoxelType.GRAYSCALE8);
    }

    /// Reads `span` label blocks along X starting at `start`.
    public BlockSpan getLabelBlocks(String instance, BlockXYZ start, int span) {
        return getBlocks(instance, start, span, VoxelType.LABELS64);
    }

    public void putGrayBlocks(String instance, BlockSpan blocks, BlockXYZ start) {
        putBlocks(instance, blocks, start, VoxelType.GRAYSCALE8);
    }

    /// Writes label blocks. Not every store version accepts this, so it must be enabled
    /// with [DvidClientConfig#labelBlockWrites()].
    /// @throws UnsupportedCapabilityException if label block writes are disabled
    public void putLabelBlocks(String instance, BlockSpan blocks, BlockXYZ start) {
        if (!config.labelBlockWrites()) {
            throw new UnsupportedCapabilityException(
                "Label block writes are disabled; enable label-block-writes for stores that accept them");
        }
        logger.warn("writing {} label blocks to '{}' through the unverified label block endpoint",
            blocks.getSpan(), instance);
        putBlocks(instance, blocks, start, VoxelType.LABELS64);
    }

    private BlockSpan getBlocks(String instance, BlockXYZ start, int span, VoxelType voxelType) {
        BlockCodec.checkSpanLimit(span);
        String endpoint = BlockCodec.blocksEndpoint(uuid, instance, start, span);
        byte[] body = requests.send(endpoint, ConnectionMethod.GET, null).body();
        return BlockCodec.decode(body, voxelType, span);
    }

    private void putBlocks(String instance, BlockSpan blocks, BlockXYZ start, VoxelType voxelType) {
        if (blocks.getVoxelType() != voxelType) {
            throw new IllegalArgumentException("Expected " + voxelType + " blocks, got " + blocks.getVoxelType());
        }
        BlockCodec.checkSpanLimit(blocks.getSpan());
        String endpoint = BlockCodec.blocksEndpoint(uuid, instance, start, blocks.getSpan());
        requests.send(endpoint, ConnectionMethod.POST, blocks.getData());
    }

    // ---------------------------------------------------------------- key-value

    /// Stores a value, replacing whatever the key held in this node.
    public void put(String keyvalue, String key, byte[] value) {
        requests.send(keyPath(keyvalue, key), ConnectionMethod.POST, value);
    }

    /// Stores the contents of a file.
    /// @throws IOException if the file cannot be read
    public void put(String keyvalue, String key, Path file) throws IOException {
        put(keyvalue, key, Files.readAllBytes(file));
    }

    public void putJson(String keyvalue, String key, JsonElement value) {
        put(keyvalue, key, StoreRequests.utf8(value.toString()));
    }

    /// @return the value at a key
    /// @throws TransportException if the key holds nothing
    public byte[] get(String keyvalue, String key) {
        return requests.send(keyPath(keyvalue, key), ConnectionMethod.GET, null).body();
    }

    public JsonElement getJson(String keyvalue, String key) {
        String endpoint = keyPath(keyvalue, key);
        return StoreRequests.parseJson(requests.send(endpoint, ConnectionMethod.GET, null), endpoint);
    }

    private String keyPath(String keyvalue, String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }
        return nodePath(keyvalue, "/key/" + PathSegments.encode(key));
    }

    // ---------------------------------------------------------------- graph

    /// Reads the subgraph induced by `vertices`, or the whole graph for an empty list.
    public Graph getSubgraph(String graph, List<Vertex> vertices) {
        String endpoint = nodePath(graph, "/subgraph");
        byte[] query = StoreRequests.utf8(GraphJson.encode(vertices, List.of()));
        return GraphJson.decode(requests.send(endpoint, ConnectionMethod.GET, query).bodyAsString());
    }

    /// Reads a vertex and its direct neighbors, with the connecting edges.
    public Graph getVertexNeighbors(String graph, Vertex vertex) {
        String endpoint = nodePath(graph, "/neighbors/" + Long.toUnsignedString(vertex.id()));
        return GraphJson.decode(requests.send(endpoint, ConnectionMethod.GET, null).bodyAsString());
    }

    /// Creates vertices, or adds to the weight of those that exist. Safe to call concurrently.
    public void updateVertices(String graph, List<Vertex> vertices) {
        String endpoint = nodePath(graph, "/weight");
        for (int start = 0; start < vertices.size(); start += GRAPH_TRANSACTION_LIMIT) {
            List<Vertex> batch = vertices.subList(start, Math.min(vertices.size(), start + GRAPH_TRANSACTION_LIMIT));
            requests.send(endpoint, ConnectionMethod.POST, StoreRequests.utf8(GraphJson.encode(batch, List.of())));
        }
    }

    /// Creates edges, or adds to the weight of those that exist. Safe to call concurrently.
    ///
    /// Every endpoint vertex must already exist. When the edges span several
    /// batches, existence is checked up front so a missing vertex fails the call
    /// before any batch is written.
    /// @throws StructuralPreconditionException if an endpoint vertex does not exist
    public void updateEdges(String graph, List<Edge> edges) {
        String endpoint = nodePath(graph, "/weight");
        if (edges.size() > GRAPH_TRANSACTION_LIMIT) {
            requireVertices(graph, edges);
        }
        for (int start = 0; start < edges.size(); start += GRAPH_TRANSACTION_LIMIT) {
            List<Edge> batch = edges.subList(start, Math.min(edges.size(), start + GRAPH_TRANSACTION_LIMIT));
            try {
                requests.send(endpoint, ConnectionMethod.POST, StoreRequests.utf8(GraphJson.encode(List.of(), batch)));
            } catch (TransportException e) {
                if (e.getStatus() == 400) {
                    throw new StructuralPreconditionException(
                        "Edge update rejected; every endpoint vertex must exist before its edges", e);
                }
                throw e;
            }
        }
    }

    private void requireVertices(String graph, List<Edge> edges) {
        Set<Vertex> endpoints = new LinkedHashSet<>();
        for (Edge edge : edges) {
            endpoints.add(new Vertex(edge.id1()));
            endpoints.add(new Vertex(edge.id2()));
        }
        Set<Vertex> present = new HashSet<>(getSubgraph(graph, new ArrayList<>(endpoints)).vertices());
        for (Vertex vertex : endpoints) {
            if (!present.contains(vertex)) {
                throw new StructuralPreconditionException(
                    "Edge update references missing vertex " + Long.toUnsignedString(vertex.id()), null);
            }
        }
    }

    /// Reads a property of each vertex together with the vertices' current transaction tokens.
    /// @param graph labelgraph instance
    /// @param vertices vertices to read
    /// @param key property name
    /// @return values in request order, empty where unset, plus tokens for the following write
    public PropertyBatch getVertexProperties(String graph, List<Vertex> vertices, String key) {
        String endpoint = propertyPath(graph, "vertices", key);
        byte[] body = requests.send(endpoint, ConnectionMethod.GET, PropertyCodec.encodeVertexQuery(vertices)).body();
        return PropertyCodec.decodeVertexProperties(body, vertices);
    }

    /// Reads a property of each edge together with the tokens of every endpoint vertex.
    public PropertyBatch getEdgeProperties(String graph, List<Edge> edges, String key) {
        String endpoint = propertyPath(graph, "edges", key);
        byte[] body = requests.send(endpoint, ConnectionMethod.GET, PropertyCodec.encodeEdgeQuery(edges)).body();
        return PropertyCodec.decodeEdgeProperties(body, edges);
    }

    /// Writes vertex properties guarded by transaction tokens.
    ///
    /// Each vertex is decided on its own: the store writes it only if its token
    /// is still current. Vertices with stale or missing tokens come back as
    /// leftovers and keep their old values.
    /// @param graph labelgraph instance
    /// @param vertices vertices to write
    /// @param key property name
    /// @param values one value per vertex
    /// @param transactions tokens from the preceding read
    /// @return written vertices and leftovers
    public PropertyWriteResult<Vertex> setVertexProperties(String graph, List<Vertex> vertices, String key,
                                                           List<byte[]> values, VertexTransactions transactions) {
        PropertyCodec.WritePlan<Vertex> plan = PropertyCodec.encodeVertexWrite(vertices, values, transactions);
        Set<Long> failed = sendPropertyWrite(propertyPath(graph, "vertices", key), plan.sent().isEmpty(),
            plan.payload());
        List<Vertex> written = new ArrayList<>();
        List<Vertex> leftovers = new ArrayList<>(plan.unguarded());
        for (Vertex vertex : plan.sent()) {
            if (failed.contains(vertex.id())) {
                leftovers.add(vertex);
            } else {
                written.add(vertex);
            }
        }
        reportLeftovers(graph, key, leftovers.size(), vertices.size());
        return new PropertyWriteResult<>(written, leftovers);
    }

    /// Writes edge properties guarded by the tokens of their endpoint vertices. An edge is
    /// a leftover if either endpoint's token is stale or missing.
    public PropertyWriteResult<Edge> setEdgeProperties(String graph, List<Edge> edges, String key,
                                                       List<byte[]> values, VertexTransactions transactions) {
        PropertyCodec.WritePlan<Edge> plan = PropertyCodec.encodeEdgeWrite(edges, values, transactions);
        Set<Long> failed = sendPropertyWrite(propertyPath(graph, "edges", key), plan.sent().isEmpty(),
            plan.payload());
        List<Edge> written = new ArrayList<>();
        List<Edge> leftovers = new ArrayList<>(plan.unguarded());
        for (Edge edge : plan.sent()) {
            if (failed.contains(edge.id1()) || failed.contains(edge.id2())) {
                leftovers.add(edge);
            } else {
                written.add(edge);
            }
        }
        reportLeftovers(graph, key, leftovers.size(), edges.size());
        return new PropertyWriteResult<>(written, leftovers);
    }

    private Set<Long> sendPropertyWrite(String endpoint, boolean nothingToSend, byte[] payload) {
        if (nothingToSend) {
            return Set.of();
        }
        byte[] body = requests.send(endpoint, ConnectionMethod.POST, payload).body();
        return PropertyCodec.decodeFailedVertices(body);
    }

    private void reportLeftovers(String graph, String key, int leftovers, int total) {
        if (leftovers > 0) {
            logger.warn("{} of {} '{}' property writes on graph '{}' were stale and must be retried",
                leftovers, total, key, graph);
        }
    }

    private String propertyPath(String graph, String kind, String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Property key cannot be null or empty");
        }
        return nodePath(graph, "/propertytransaction/" + kind + "/" + PathSegments.encode(key) + "/");
    }

    // ---------------------------------------------------------------- ROI

    /// Adds blocks to an ROI. Blocks may come in any order; blocks already in the ROI are unaffected.
    public void postRoi(String roi, Collection<BlockXYZ> blocks) {
        requests.send(nodePath(roi, "/roi"), ConnectionMethod.POST, StoreRequests.utf8(RoiCodec.encodeRuns(blocks)));
    }

    /// @return the ROI's blocks, ascending (Z, Y, X)
    public List<BlockXYZ> getRoi(String roi) {
        return RoiCodec.decodeRuns(requests.send(nodePath(roi, "/roi"), ConnectionMethod.GET, null).bodyAsString());
    }

    /// Covers the ROI with cubic substacks of `partitionSize` blocks on a side.
    /// @return substacks ascending (Z, Y, X) and the packing factor
    public RoiPartition getRoiPartition(String roi, int partitionSize) {
        if (partitionSize <= 0) {
            throw new IllegalArgumentException("Partition size must be positive: " + partitionSize);
        }
        return RoiPartitioner.partition(getRoi(roi), partitionSize);
    }

    /// @return for each point, in input order, whether it lies in the ROI
    public List<Boolean> roiPtQuery(String roi, List<PointXYZ> points) {
        if (points.isEmpty()) {
            return List.of();
        }
        String endpoint = nodePath(roi, "/ptquery");
        ConnectionResponse response = requests.send(endpoint, ConnectionMethod.POST,
            StoreRequests.utf8(RoiCodec.encodePoints(points)));
        return RoiCodec.decodeMembership(response.bodyAsString(), points.size());
    }

    // ---------------------------------------------------------------- sparse bodies

    /// Reads the blocks a body occupies.
    /// @param labelvol label volume instance
    /// @param bodyId body id
    /// @return blocks ascending (Z, Y, X), or empty if the body does not exist
    public Optional<List<BlockXYZ>> getCoarseBody(String labelvol, long bodyId) {
        String endpoint = nodePath(labelvol, "/sparsevol-coarse/" + Long.toUnsignedString(bodyId));
        ConnectionResponse response = requests.exchange(endpoint, ConnectionMethod.GET, null);
        if (response.status() == 404 || response.status() == 204) {
            return Optional.empty();
        }
        if (!response.isSuccess()) {
            throw new TransportException(ConnectionMethod.GET, endpoint, response.status(), response.bodyAsString());
        }
        List<BlockXYZ> blocks = CoarseVolumeDecoder.decode(response.body());
        return blocks.isEmpty() ? Optional.empty() : Optional.of(blocks);
    }

    public boolean bodyExists(String labelvol, long bodyId) {
        return getCoarseBody(labelvol, bodyId).isPresent();
    }

    /// @return an approximate central voxel of the body, or empty if it does not exist
    public Optional<PointXYZ> getBodyLocation(String labelvol, long bodyId) {
        return getCoarseBody(labelvol, bodyId).flatMap(blocks -> BodyLocator.locate(blocks, OptionalInt.empty()));
    }

    /// Like [#getBodyLocation(String, long)] but stays in the given Z plane when the body reaches it.
    public Optional<PointXYZ> getBodyLocation(String labelvol, long bodyId, int zplane) {
        return getCoarseBody(labelvol, bodyId).flatMap(blocks -> BodyLocator.locate(blocks, OptionalInt.of(zplane)));
    }

    // ----------------------------------------------------------------

    private String nodePath(String instance, String suffix) {
        if (instance == null || instance.isBlank()) {
            throw new IllegalArgumentException("Instance name cannot be null or empty");
        }
        return "/node/" + PathSegments.encode(uuid) + "/" + PathSegments.encode(instance) + suffix;
    }

    private void closeQuietly() {
        try {
            close();
        } catch (IOException e) {
            logger.debug("failed to close connection after node check failed", e);
        }
    }

    @Override
    public void close() throws IOException {
        if (ownsConnection) {
            requests.connection().close();
        }
    }
}
