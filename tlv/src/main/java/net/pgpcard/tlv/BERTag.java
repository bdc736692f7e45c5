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

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

// BER-TLV tag (ISO 7816-4), 1 to 4 bytes
public record BERTag(byte[] bytes) {

    public BERTag {
        bytes = validate(bytes).clone();
    }

    public static BERTag of(String hex) {
        return new BERTag(HexFormat.of().parseHex(hex.replaceAll("\\s", "")));
    }

    public static BERTag of(int... values) {
        var bytes = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            bytes[i] = (byte) values[i];
        }
        return new BERTag(bytes);
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    static byte[] validate(byte[] value) {
        Objects.requireNonNull(value, "tag cannot be null");

        if (value.length == 0 || value.length > 4) {
            throw new IllegalArgumentException("Invalid tag length: " + value.length);
        }

        if (value.length == 1 && (value[0] & 0x1F) == 0x1F) {
            throw new IllegalArgumentException("Tag with first byte 0x1F needs subsequent bytes");
        }

        if (value.length > 1 && (value[0] & 0x1F) != 0x1F) {
            throw new IllegalArgumentException("Multi-byte tag must have first byte with 0x1F");
        }

        for (int i = 1; i < value.length - 1; i++) {
            if ((value[i] & 0x80) == 0) {
                throw new IllegalArgumentException("Tag continuation byte missing 0x80 bit");
            }
        }

        if (value.length > 1 && (value[value.length - 1] & 0x80) != 0) {
            throw new IllegalArgumentException("Tag last byte should not have 0x80 bit");
        }
        return value;
    }

    public boolean isConstructed() {
        return (bytes[0] & 0x20) == 0x20;
    }

    // Reads a tag from the current position of the buffer
    static BERTag parse(ByteBuffer buffer) {
        var start = buffer.position();
        var b = buffer.get();
        if ((b & 0x1F) != 0x1F) {
            return new BERTag(new byte[]{b});
        }
        var len = 1;
        do {
            if (len == 4) {
                throw new TLVParseException("Tag longer than 4 bytes", start);
            }
            b = buffer.get();
            len++;
        } while ((b & 0x80) == 0x80);

        var tag = new byte[len];
        buffer.get(start, tag);
        return new BERTag(tag);
    }

    // Uppercase hex without separators, as used in tag paths
    public String toHex() {
        return HexFormat.of().withUpperCase().formatHex(bytes);
    }

    @Override
    public String toString() {
        return "[" + toHex() + "]";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof BERTag other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }
}
