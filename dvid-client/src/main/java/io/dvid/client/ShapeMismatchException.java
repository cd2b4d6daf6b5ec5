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

/// Thrown when a buffer's length disagrees with the shape it is declared to hold.
public class ShapeMismatchException extends DvidException {

    private final long expectedBytes;
    private final long actualBytes;

    public ShapeMismatchException(String message, long expectedBytes, long actualBytes) {
        super(message + " (expected " + expectedBytes + " bytes, got " + actualBytes + ")");
        this.expectedBytes = expectedBytes;
        this.actualBytes = actualBytes;
    }

    public long getExpectedBytes() {
        return expectedBytes;
    }

    public long getActualBytes() {
        return actualBytes;
    }
}
