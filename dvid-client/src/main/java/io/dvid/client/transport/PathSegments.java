package io.dvid.client.transport;

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

import org.apache.hc.core5.net.URIBuilder;

import java.net.URISyntaxException;

/// Percent-encodes caller-supplied names (instances, keys, property names) so
/// they land in exactly one endpoint path segment.
public final class PathSegments {

    private PathSegments() {
    }

    /// @param segment raw segment text, never empty
    /// @return the segment with every reserved character percent-encoded, without a leading `/`
    public static String encode(String segment) {
        if (segment == null || segment.isEmpty()) {
            throw new IllegalArgumentException("Path segment cannot be null or empty");
        }
        try {
            return new URIBuilder().setPathSegments(segment).build().getRawPath().substring(1);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Cannot encode path segment '" + segment + "'", e);
        }
    }
}
