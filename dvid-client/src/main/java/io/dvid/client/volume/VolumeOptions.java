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

/// Per-request flags of a volume transfer.
/// @param throttle pass the transfer through the throttle gate and ask the store to throttle it
/// @param compress send or receive the payload LZ4-compressed
/// @param roi name of an ROI masking the transfer, or null for none
/// @param view voxel space to address
public record VolumeOptions(boolean throttle, boolean compress, String roi, VolumeView view) {

    public VolumeOptions {
        if (roi != null && roi.isBlank()) {
            roi = null;
        }
        view = view == null ? VolumeView.RAW : view;
    }

    /// Grayscale default: throttled, uncompressed, unmasked.
    public static VolumeOptions grayscaleDefaults() {
        return new VolumeOptions(true, false, null, VolumeView.RAW);
    }

    /// Label default: throttled, compressed, unmasked.
    public static VolumeOptions labelDefaults() {
        return new VolumeOptions(true, true, null, VolumeView.RAW);
    }

    public boolean hasRoi() {
        return roi != null;
    }

    public VolumeOptions withThrottle(boolean throttle) {
        return new VolumeOptions(throttle, compress, roi, view);
    }

    public VolumeOptions withCompress(boolean compress) {
        return new VolumeOptions(throttle, compress, roi, view);
    }

    public VolumeOptions withRoi(String roi) {
        return new VolumeOptions(throttle, compress, roi, view);
    }

    public VolumeOptions withView(VolumeView view) {
        return new VolumeOptions(throttle, compress, roi, view);
    }
}
