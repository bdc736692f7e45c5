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

import java.time.Instant;
import java.util.Optional;

import static net.pgpcard.openpgp.OpenPGPDataException.Reason.KEY_NOT_PRESENT;

/**
 * Card data as seen by presentation code: either a decoded {@link OpenPGPCard} or {@link Absent} when
 * no card data has been decoded yet.
 * <p>
 * Plain getters return an empty string on absent data, key accessors fail with
 * {@link OpenPGPDataException.Reason#KEY_NOT_PRESENT}.
 */
public sealed interface CardData permits OpenPGPCard, CardData.Absent {

    static CardData absent() {
        return Absent.INSTANCE;
    }

    static CardData of(Optional<OpenPGPCard> card) {
        return card.<CardData>map(c -> c).orElse(Absent.INSTANCE);
    }

    boolean isPresent();

    String cardHolder();

    String version();

    String appletVersion();

    String algorithm(KeyType keyType);

    String fingerprint(KeyType keyType);

    String id(KeyType keyType);

    Instant date(KeyType keyType);

    KeyOrigin origin(KeyType keyType);

    String toPrettyString();

    record Absent() implements CardData {
        static final Absent INSTANCE = new Absent();

        private static OpenPGPDataException missing(String operation) {
            return new OpenPGPDataException(KEY_NOT_PRESENT, "No card data for " + operation);
        }

        @Override
        public boolean isPresent() {
            return false;
        }

        @Override
        public String cardHolder() {
            return "";
        }

        @Override
        public String version() {
            return "";
        }

        @Override
        public String appletVersion() {
            return "";
        }

        @Override
        public String algorithm(KeyType keyType) {
            throw missing("algorithm(" + keyType + ")");
        }

        @Override
        public String fingerprint(KeyType keyType) {
            throw missing("fingerprint(" + keyType + ")");
        }

        @Override
        public String id(KeyType keyType) {
            throw missing("id(" + keyType + ")");
        }

        @Override
        public Instant date(KeyType keyType) {
            throw missing("date(" + keyType + ")");
        }

        @Override
        public KeyOrigin origin(KeyType keyType) {
            throw missing("origin(" + keyType + ")");
        }

        @Override
        public String toPrettyString() {
            throw missing("toPrettyString()");
        }
    }
}
