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

import java.nio.charset.StandardCharsets;

// Name (5B) uses '<' as filler and "<<" between surname and forename, as in ISO/IEC 7501-1
public final class CardHolderName {
    public static final String NOT_SET = "[not set]";
    static final String SEPARATOR = "<<";

    private CardHolderName() {}

    // "DOE<<JOHN" becomes "JOHN\nDOE"
    public static String parse(byte[] name) {
        if (name == null || name.length == 0) {
            return NOT_SET;
        }
        var s = new String(name, StandardCharsets.UTF_8);
        var builder = new StringBuilder();
        var i = s.indexOf(SEPARATOR);
        if (i >= 0) {
            var forename = s.substring(i + SEPARATOR.length());
            builder.append(forename);
            if (!forename.isEmpty()) {
                builder.append('\n');
            }
        } else {
            i = s.length();
        }
        builder.append(s.substring(0, i).replace('<', ' '));
        return builder.toString();
    }
}
