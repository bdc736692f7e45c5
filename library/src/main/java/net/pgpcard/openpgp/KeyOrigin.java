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

import static net.pgpcard.openpgp.OpenPGPDataException.Reason.UNKNOWN_KEY_ORIGIN;

// Provenance of a key, one byte per key in the key information data object
public enum KeyOrigin {
    NOT_PRESENT("not present"),
    EMPTY("empty"),
    GENERATED("generated"),
    IMPORTED("imported");

    private final String description;

    KeyOrigin(String description) {
        this.description = description;
    }

    public static KeyOrigin fromCode(int code) {
        var values = values();
        if (code < 0 || code >= values.length) {
            throw new OpenPGPDataException(UNKNOWN_KEY_ORIGIN, "Key origin %d > %d".formatted(code, values.length - 1));
        }
        return values[code];
    }

    public String description() {
        return description;
    }
}
