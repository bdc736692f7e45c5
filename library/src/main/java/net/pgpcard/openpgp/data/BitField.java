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

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

// Enums describing flags packed into a byte array
public interface BitField<T extends Enum<T> & BitField<T>> {

    static boolean has(Def f, byte[] bytes) {
        for (var bit : f.bits()) {
            if ((bit >> 3) >= bytes.length || !get_bit(bytes, bit)) {
                return false;
            }
        }
        return true;
    }

    static <T extends Enum<T> & BitField<T>> Set<T> parse(Class<T> base, byte[] bytes) {
        var result = EnumSet.noneOf(base);
        for (var e : base.getEnumConstants()) {
            if (has(e.def(), bytes)) {
                result.add(e);
            }
        }
        return result;
    }

    // bit 0 is the leftmost bit of the first byte
    static boolean get_bit(byte[] buffer, int bit) {
        return ((buffer[bit >> 3] >> (7 - (bit & 7))) & 1) == 1;
    }

    // 1 based byte, bits are numbered b8..b1 from the left as in the card specification
    static Def byte_bit_rl(int nthByte, int bit) {
        return new Def(List.of((nthByte - 1) * 8 + (8 - bit)));
    }

    Def def();

    // Present, if all bits are present
    record Def(List<Integer> bits) {
        public Def {
            bits = List.copyOf(bits);
        }
    }
}
