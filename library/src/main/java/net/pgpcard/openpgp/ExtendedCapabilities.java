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
import net.pgpcard.openpgp.data.ByteLocation;
import net.pgpcard.tlv.TagMap;
import org.slf4j.Logger;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Decoded Extended Capabilities data object ({@code 6E.73.C0}).
 * <p>
 * Cards that predate the data object simply do not have it, in which case {@link #NONE} applies.
 *
 * @param flags                               capabilities announced in byte 1
 * @param secureMessaging                     algorithm from byte 2, {@link SecureMessagingAlgorithm#NONE} unless secure messaging is announced
 * @param maximumChallengeLength              bytes 3-4, 0 unless GET CHALLENGE is announced
 * @param maximumCardholderCertificatesLength bytes 5-6
 * @param maximumSpecialDOsLength             bytes 7-8
 * @param pinBlock2Supported                  byte 9, bit 1
 * @param mseCommandSupported                 byte 10, bit 1
 */
public record ExtendedCapabilities(Set<ExtendedCapability> flags,
                                   SecureMessagingAlgorithm secureMessaging,
                                   int maximumChallengeLength,
                                   int maximumCardholderCertificatesLength,
                                   int maximumSpecialDOsLength,
                                   boolean pinBlock2Supported,
                                   boolean mseCommandSupported) {

    public static final ExtendedCapabilities NONE = new ExtendedCapabilities(Set.of(), SecureMessagingAlgorithm.NONE, 0, 0, 0, false, false);

    public ExtendedCapabilities {
        flags = flags.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public static ExtendedCapabilities fromTags(TagMap tags, Logger logger) {
        var value = tags.get(OpenPGPTags.EXTENDED_CAPABILITIES);
        if (value.isEmpty()) {
            logger.debug("No Extended Capabilities ({}), using defaults", OpenPGPTags.EXTENDED_CAPABILITIES);
            return NONE;
        }
        return parse(value.get());
    }

    public static ExtendedCapabilities parse(byte[] tag) {
        final byte capabilities = field("capabilities", () -> ByteLocation.at(tag, 1));
        final var flags = BitField.parse(ExtendedCapability.class, new byte[]{capabilities});

        var secureMessaging = SecureMessagingAlgorithm.NONE;
        if (flags.contains(ExtendedCapability.SecureMessaging)) {
            secureMessaging = field("secure messaging", () -> SecureMessagingAlgorithm.fromCode(ByteLocation.at(tag, 2) & 0xFF));
        }

        var challengeLength = 0;
        if (flags.contains(ExtendedCapability.GetChallenge)) {
            challengeLength = field("get challenge", () -> uint16(ByteLocation.range(tag, 3, 4)));
        }

        int certificatesLength = field("maximum cardholder certificates length", () -> uint16(ByteLocation.range(tag, 5, 6)));
        int specialDOsLength = field("maximum special DOs length", () -> uint16(ByteLocation.range(tag, 7, 8)));

        boolean pinBlock2 = field("PIN block 2 format", () -> (ByteLocation.at(tag, 9) & 0x01) == 0x01);
        boolean mse = field("MSE command", () -> (ByteLocation.at(tag, 10) & 0x01) == 0x01);

        return new ExtendedCapabilities(flags, secureMessaging, challengeLength, certificatesLength, specialDOsLength, pinBlock2, mse);
    }

    // ByteLocation.range returns exactly the requested 2 bytes or fails with NOT_FOUND
    private static int uint16(byte[] bytes) {
        return (int) ByteLocation.unsigned(bytes);
    }

    private static <T> T field(String name, Supplier<T> f) {
        try {
            return f.get();
        } catch (OpenPGPDataException e) {
            throw new OpenPGPDataException("Extended Capabilities (" + name + ")", e);
        }
    }

    public boolean secureMessagingSupported() {
        return flags.contains(ExtendedCapability.SecureMessaging);
    }

    public boolean getChallengeSupported() {
        return flags.contains(ExtendedCapability.GetChallenge);
    }

    public boolean keyImportSupported() {
        return flags.contains(ExtendedCapability.KeyImport);
    }

    public boolean pwStatusChangeable() {
        return flags.contains(ExtendedCapability.PWStatusChangeable);
    }

    public boolean privateUseDOsSupported() {
        return flags.contains(ExtendedCapability.PrivateUseDOs);
    }

    public boolean algorithmAttributesChangeable() {
        return flags.contains(ExtendedCapability.AlgorithmAttributesChangeable);
    }

    public boolean supportsPSODecryptionEncryptionWithAES() {
        return flags.contains(ExtendedCapability.PSODecEncWithAES);
    }

    public boolean kdfSupported() {
        return flags.contains(ExtendedCapability.KDF);
    }
}
