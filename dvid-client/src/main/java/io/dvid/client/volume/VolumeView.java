package io.dvid.client.volume;

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

/// Which voxel space a volume request addresses.
public enum VolumeView {
    /// Voxels as stored.
    RAW("raw"),
    /// Voxels resampled to isotropic resolution by the store.
    ISOTROPIC("isotropic");

    private final String endpointName;

    VolumeView(String endpointName) {
        this.endpointName = endpointName;
    }

    public String endpointName() {
        return endpointName;
    }
}
