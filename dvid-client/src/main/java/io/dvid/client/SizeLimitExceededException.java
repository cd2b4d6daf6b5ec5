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

/// Thrown when a single transfer would exceed the protocol's voxel ceiling.
public class SizeLimitExceededException extends DvidException {

    private final long requestedVoxels;
    private final long limit;

    public SizeLimitExceededException(long requestedVoxels, long limit) {
        super("Requested " + requestedVoxels + " voxels, which exceeds the transfer limit of " + limit);
        this.requestedVoxels = requestedVoxels;
        this.limit = limit;
    }

    public long getRequestedVoxels() {
        return requestedVoxels;
    }

    public long getLimit() {
        return limit;
    }
}
