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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.dvid.client.ShapeMismatchException;
import io.dvid.client.geometry.BlockXYZ;
import io.dvid.client.geometry.PointXYZ;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/// JSON encodings used by ROI instances.
///
/// Block sets travel as run-length lists `[[z, y, x0, x1], ...]` where each run
/// covers blocks `x0..x1` inclusive on row `(y, z)`. Encoding sorts and
/// de-duplicates its input, so callers may pass blocks in any order.
public final class RoiCodec {

    private RoiCodec() {
    }

    /// Encodes a block set as sorted, maximal runs.
    public static String encodeRuns(Collection<BlockXYZ> blocks) {
        JsonArray runs = new JsonArray();
        BlockXYZ runStart = null;
        BlockXYZ previous = null;
        for (BlockXYZ block : canonical(blocks)) {
            if (previous != null && block.z() == previous.z() && block.y() == previous.y()
                && block.x() == previous.x() + 1) {
                previous = block;
                continue;
            }
            if (runStart != null) {
                runs.add(run(runStart, previous));
            }
            runStart = block;
            previous = block;
        }
        if (runStart != null) {
            runs.add(run(runStart, previous));
        }
        return runs.toString();
    }

    /// Decodes a run-length list into blocks in ascending (Z, Y, X) order.
    /// @throws ShapeMismatchException if a run is not four integers or ends before it starts
    public static List<BlockXYZ> decodeRuns(String json) {
        TreeSet<BlockXYZ> blocks = new TreeSet<>();
        for (JsonElement element : parseArray(json, "ROI runs")) {
            JsonArray run = element.getAsJsonArray();
            if (run.size() != 4) {
                throw new ShapeMismatchException("ROI run must have 4 entries: " + run, 4, run.size());
            }
            int z = run.get(0).getAsInt();
            int y = run.get(1).getAsInt();
            int x0 = run.get(2).getAsInt();
            int x1 = run.get(3).getAsInt();
            if (x1 < x0) {
                throw new ShapeMismatchException("ROI run ends before it starts: " + run, x0, x1);
            }
            for (int x = x0; x <= x1; x++) {
                blocks.add(new BlockXYZ(x, y, z));
            }
        }
        return new ArrayList<>(blocks);
    }

    /// Encodes voxel points as `[[x, y, z], ...]`, preserving order.
    public static String encodePoints(List<PointXYZ> points) {
        JsonArray array = new JsonArray();
        for (PointXYZ point : points) {
            JsonArray coords = new JsonArray();
            coords.add(point.x());
            coords.add(point.y());
            coords.add(point.z());
            array.add(coords);
        }
        return array.toString();
    }

    /// Decodes a point-query answer.
    /// @param json array of booleans
    /// @param expected number of points that were queried
    /// @return membership flags in query order
    /// @throws ShapeMismatchException if the answer does not have one flag per point
    public static List<Boolean> decodeMembership(String json, int expected) {
        JsonArray array = parseArray(json, "point query");
        if (array.size() != expected) {
            throw new ShapeMismatchException("Point query answered " + array.size() + " of " + expected + " points",
                expected, array.size());
        }
        List<Boolean> inside = new ArrayList<>(expected);
        for (JsonElement element : array) {
            inside.add(element.getAsBoolean());
        }
        return inside;
    }

    /// The distinct blocks of a collection in ascending (Z, Y, X) order.
    public static List<BlockXYZ> canonical(Collection<BlockXYZ> blocks) {
        return new ArrayList<>(new TreeSet<>(blocks));
    }

    private static JsonArray run(BlockXYZ start, BlockXYZ end) {
        JsonArray run = new JsonArray();
        run.add(start.z());
        run.add(start.y());
        run.add(start.x());
        run.add(end.x());
        return run;
    }

    private static JsonArray parseArray(String json, String what) {
        try {
            JsonElement parsed = JsonParser.parseString(json);
            if (parsed.isJsonNull()) {
                return new JsonArray();
            }
            if (!parsed.isJsonArray()) {
                throw new JsonParseException("expected a JSON array");
            }
            return parsed.getAsJsonArray();
        } catch (JsonParseException | IllegalStateException e) {
            throw new ShapeMismatchException("Malformed " + what + " payload: " + e.getMessage(), 0, json.length());
        }
    }
}
