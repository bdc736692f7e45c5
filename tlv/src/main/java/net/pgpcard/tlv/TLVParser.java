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

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

// Stateless BER-TLV parser
public final class TLVParser {
    private TLVParser() {}

    public static List<TLV> parse(byte[] data) {
        return parse(ByteBuffer.wrap(data));
    }

    public static List<TLV> parse(ByteBuffer buf) {
        var result = new ArrayList<TLV>();
        while (buf.hasRemaining()) {
            result.add(parseOne(buf));
        }
        return List.copyOf(result);
    }

    public static TLV parseOne(ByteBuffer buf) {
        var start = buf.position();
        try {
            var tag = BERTag.parse(buf);
            var length = Len.ber(buf);
            if (length > buf.remaining()) {
                throw new TLVParseException("Tag " + tag + " declares " + length + " bytes, only " + buf.remaining() + " available", start);
            }
            var value = new byte[length];
            buf.get(value);

            if (tag.isConstructed()) {
                try {
                    return new TLV(tag, null, new ArrayList<>(parse(value)));
                } catch (TLVParseException e) {
                    throw new TLVParseException("Invalid content of " + tag + ": " + e.getMessage(), start, e);
                }
            }
            return new TLV(tag, value, null);
        } catch (BufferUnderflowException | IndexOutOfBoundsException e) {
            throw new TLVParseException("Insufficient data to parse TLV", start, e);
        } catch (TLVParseException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new TLVParseException(e.getMessage(), start, e);
        }
    }
}
