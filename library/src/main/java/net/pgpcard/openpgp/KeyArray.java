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
package net.pgpcard.openpgp;

import net.pgpcard.tlv.TagMap;

import java.util.Arrays;

import static net.pgpcard.openpgp.OpenPGPDataException.Reason.NO_SUCH_TAG;
import static net.pgpcard.openpgp.OpenPGPDataException.Reason.TOO_SHORT;

// Data object holding fixed width entries for consecutive key slots (fingerprints, dates, key information)
record KeyArray(String path, byte[] data, int width) {

    static KeyArray of(TagMap tags, String path, int width) {
        var data = tags.get(path).orElseThrow(() -> new OpenPGPDataException(NO_SUCH_TAG, "No tag " + path));
        return new KeyArray(path, data, width);
    }

    byte[] slot(KeyType keyType) {
        var offset = keyType.offset() * width;
        if (data.length < offset + width) {
            throw new OpenPGPDataException(TOO_SHORT, "%s has no %d bytes for %s at offset %d".formatted(path, width, keyType, offset), data);
        }
        return Arrays.copyOfRange(data, offset, offset + width);
    }
}
