/*
 * Copyright (c) 2025 Martin Paljak
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.pgpcard.openpgp.data;

import net.pgpcard.openpgp.OpenPGPDataException;

import java.util.Arrays;

import static net.pgpcard.openpgp.OpenPGPDataException.Reason.NOT_FOUND;

// Describes a byte or inclusive byte range inside a data object, 1-based like the tables in the card specification
public sealed interface ByteLocation permits ByteLocation.Single, ByteLocation.Range {
    record Single(int position) implements ByteLocation {
        public byte get(byte[] bytes) {
            return ByteLocation.extract(bytes, this)[0];
        }
    }

    record Range(int start, int end) implements ByteLocation {
    }

    static Single at(int position) {
        return new Single(position);
    }

    static Range range(int start, int end) {
        return new Range(start, end);
    }

    // "byte n" of the data object
    static byte at(byte[] bytes, int position) {
        return at(position).get(bytes);
    }

    // "bytes start - end" of the data object
    static byte[] range(byte[] bytes, int start, int end) {
        return extract(bytes, range(start, end));
    }

    static byte[] extract(byte[] bytes, ByteLocation location) {
        final int start;
        final int end;
        if (location instanceof Single s) {
            start = s.position();
            end = s.position();
        } else if (location instanceof Range r) {
            start = r.start();
            end = r.end();
        } else {
            throw new IllegalArgumentException("Unknown ByteLocation type");
        }
        if (bytes == null || start < 1 || end < start || end > bytes.length) {
            throw new OpenPGPDataException(NOT_FOUND, "%s not available in %d bytes".formatted(location, bytes == null ? 0 : bytes.length));
        }
        return Arrays.copyOfRange(bytes, start - 1, end);
    }

    // Big-endian unsigned value of 1 to 4 bytes
    static long unsigned(byte[] bytes) {
        if (bytes.length == 0 || bytes.length > 4) {
            throw new IllegalArgumentException("Can not convert " + bytes.length + " bytes");
        }
        long v = 0;
        for (byte b : bytes) {
            v = (v << 8) | (b & 0xFF);
        }
        return v;
    }
}
