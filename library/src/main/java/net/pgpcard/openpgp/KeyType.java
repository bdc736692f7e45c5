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

import java.util.Optional;

/**
 * Key slots of the OpenPGP card application.
 * <p>
 * The ordinal is the index into data objects that pack one entry per key (fingerprints, generation dates, key information).
 */
public enum KeyType {
    SIGNATURE("Sig", OpenPGPTags.SIGNATURE_ALGORITHM_ATTRIBUTES),
    DECRYPTION("Dec", OpenPGPTags.DECRYPTION_ALGORITHM_ATTRIBUTES),
    AUTHENTICATION("Aut", OpenPGPTags.AUTHENTICATION_ALGORITHM_ATTRIBUTES),
    ATTESTATION("Att", null);

    private final String label;
    private final String algorithmAttributesTag;

    KeyType(String label, String algorithmAttributesTag) {
        this.label = label;
        this.algorithmAttributesTag = algorithmAttributesTag;
    }

    public String label() {
        return label;
    }

    // Index of this key in packed per-key data objects
    public int offset() {
        return ordinal();
    }

    public Optional<String> algorithmAttributesTag() {
        return Optional.ofNullable(algorithmAttributesTag);
    }
}
