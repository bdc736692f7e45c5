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

import net.pgpcard.openpgp.data.BitField;

import static net.pgpcard.openpgp.data.BitField.byte_bit_rl;

// Byte 1 of Extended Capabilities (4.4.3.7)
public enum ExtendedCapability implements BitField<ExtendedCapability> {
    SecureMessaging(byte_bit_rl(1, 8)),
    GetChallenge(byte_bit_rl(1, 7)),
    KeyImport(byte_bit_rl(1, 6)),
    PWStatusChangeable(byte_bit_rl(1, 5)),
    PrivateUseDOs(byte_bit_rl(1, 4)),
    AlgorithmAttributesChangeable(byte_bit_rl(1, 3)),
    PSODecEncWithAES(byte_bit_rl(1, 2)),
    KDF(byte_bit_rl(1, 1));

    private final Def def;

    ExtendedCapability(Def def) {
        this.def = def;
    }

    @Override
    public Def def() {
        return def;
    }
}
