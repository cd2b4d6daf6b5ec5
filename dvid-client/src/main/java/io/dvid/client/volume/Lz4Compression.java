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

import io.dvid.client.CompressionException;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4SafeDecompressor;

/// Whole-payload LZ4 block compression as used by the store's `compress=lz4` flag.
///
/// The stream carries no header; the decompressed length is known from the
/// request shape and must be supplied when decompressing.
public final class Lz4Compression {

    private static final LZ4Factory FACTORY = LZ4Factory.fastestInstance();

    private Lz4Compression() {
    }

    public static byte[] compress(byte[] raw) {
        return FACTORY.fastCompressor().compress(raw);
    }

    /// @param compressed LZ4 block
    /// @param expectedLength exact decompressed length
    /// @return the decompressed bytes
    /// @throws CompressionException if the block is corrupt, truncated, or decodes to a different length
    public static byte[] decompress(byte[] compressed, int expectedLength) {
        LZ4SafeDecompressor decompressor = FACTORY.safeDecompressor();
        byte[] restored = new byte[expectedLength];
        int produced;
        try {
            produced = decompressor.decompress(compressed, 0, compressed.length, restored, 0, expectedLength);
        } catch (LZ4Exception e) {
            throw new CompressionException("Corrupt LZ4 payload of " + compressed.length
                + " bytes (expected " + expectedLength + " bytes decompressed)", e);
        }
        if (produced != expectedLength) {
            throw new CompressionException("LZ4 payload decompressed to " + produced
                + " bytes, expected " + expectedLength);
        }
        return restored;
    }
}
