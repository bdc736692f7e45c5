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
package net.pgpcard.tool;

import net.pgpcard.openpgp.KeyType;
import net.pgpcard.openpgp.OpenPGPCard;
import net.pgpcard.openpgp.OpenPGPDataException;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.function.Supplier;

// One line per key slot: label, algorithm, key ID, fingerprint, generation date and origin
final class KeySummary {
    static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private KeySummary() {}

    static String line(OpenPGPCard card, KeyType keyType) {
        return "  %s  %-8s  %s  %-40s  %s  %s".formatted(
                keyType.label(),
                field(() -> card.algorithm(keyType)),
                field(() -> card.id(keyType)),
                field(() -> card.fingerprint(keyType)),
                field(() -> date(card.date(keyType))),
                field(() -> card.origin(keyType).description()));
    }

    static String date(Instant instant) {
        return instant.equals(Instant.EPOCH) ? "-" : DATE_FORMAT.format(instant);
    }

    // Undecodable fields are shown by their reason, so that other slots and fields are still listed
    private static String field(Supplier<String> s) {
        try {
            return s.get();
        } catch (OpenPGPDataException e) {
            return "<" + e.getReason() + ">";
        }
    }
}
