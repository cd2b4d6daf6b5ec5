package io.dvid.client.geometry;

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

import java.util.Arrays;
import java.util.StringJoiner;

/// Axis permutation used when requesting a volume. Entry `i` names the
/// store axis (0 = X, 1 = Y, 2 = Z) that appears at position `i` of the
/// requested [Dims] and [Offset].
public final class ChannelOrder {

    /// The store's native X, Y, Z order.
    public static final ChannelOrder XYZ = new ChannelOrder(new int[]{0, 1, 2});

    private final int[] axes;

    private ChannelOrder(int[] axes) {
        this.axes = axes;
    }

    /// @param axes a permutation of `0..n-1` with n of 2 or 3
    /// @return the channel order
    /// @throws IllegalArgumentException if `axes` is not a permutation
    public static ChannelOrder of(int... axes) {
        if (axes == null || axes.length < 2 || axes.length > 3) {
            throw new IllegalArgumentException("Channel order must list 2 or 3 axes: " + Arrays.toString(axes));
        }
        boolean[] seen = new boolean[axes.length];
        for (int axis : axes) {
            if (axis < 0 || axis >= axes.length || seen[axis]) {
                throw new IllegalArgumentException("Channel order is not a permutation: " + Arrays.toString(axes));
            }
            seen[axis] = true;
        }
        return new ChannelOrder(axes.clone());
    }

    /// The identity order of the given rank.
    public static ChannelOrder identity(int rank) {
        if (rank == 3) {
            return XYZ;
        }
        int[] axes = new int[rank];
        for (int i = 0; i < rank; i++) {
            axes[i] = i;
        }
        return of(axes);
    }

    public int rank() {
        return axes.length;
    }

    public int axisAt(int position) {
        return axes[position];
    }

    public boolean isIdentity() {
        for (int i = 0; i < axes.length; i++) {
            if (axes[i] != i) {
                return false;
            }
        }
        return true;
    }

    public int[] toArray() {
        return axes.clone();
    }

    /// Endpoint form, e.g. `0_1_2`.
    public String toEndpointSegment() {
        StringJoiner joiner = new StringJoiner("_");
        for (int axis : axes) {
            joiner.add(Integer.toString(axis));
        }
        return joiner.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChannelOrder)) {
            return false;
        }
        return Arrays.equals(axes, ((ChannelOrder) o).axes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(axes);
    }

    @Override
    public String toString() {
        return "ChannelOrder" + Arrays.toString(axes);
    }
}
