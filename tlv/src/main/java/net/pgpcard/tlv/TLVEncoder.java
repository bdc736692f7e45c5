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
package net.pgpcard.tlv;

import java.io.ByteArrayOutputStream;

// Stateless BER-TLV encoder, always using the shortest length form
public final class TLVEncoder {
    private TLVEncoder() {
    }

    public static byte[] encode(TLV tlv) {
        var valueBytes = tlv.value();
        var out = new ByteArrayOutputStream();
        out.writeBytes(tlv.tag().bytes());
        out.writeBytes(Len.ber(valueBytes.length));
        out.writeBytes(valueBytes);
        return out.toByteArray();
    }

    public static byte[] encode(Iterable<TLV> tlvs) {
        var out = new ByteArrayOutputStream();
        for (var tlv : tlvs) {
            out.writeBytes(encode(tlv));
        }
        return out.toByteArray();
    }
}
