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

import io.dvid.client.geometry.SubstackXYZ;

import java.util.List;

/// A covering of an ROI by equal-sized substacks.
/// @param substacks substacks intersecting the ROI, ascending (Z, Y, X)
/// @param packingFactor ROI blocks divided by blocks covered by the substacks
public record RoiPartition(List<SubstackXYZ> substacks, double packingFactor) {

    public RoiPartition {
        substacks = List.copyOf(substacks);
    }
}
