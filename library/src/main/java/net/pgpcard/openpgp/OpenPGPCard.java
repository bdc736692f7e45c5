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

import net.pgpcard.tlv.TagMap;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x9.ECNamedCurveTable;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static net.pgpcard.openpgp.OpenPGPDataException.Reason.*;

/**
 * Snapshot of the OpenPGP application data of one card, decoded from the responses to GET DATA.
 * <p>
 * Identity and capabilities are decoded once, when the snapshot is created. Per-key data is decoded
 * from the retained tags on every call. Instances are immutable and must be recreated after the card
 * contents change.
 */
public final class OpenPGPCard implements CardData {
    private static final Logger defaultLogger = LoggerFactory.getLogger(OpenPGPCard.class);

    static final int RSA_FIRST = 0x01;
    static final int RSA_LAST = 0x03;
    static final int ECDH = 0x12;
    static final int ECDSA = 0x13;
    static final int EDDSA = 0x16;

    // Curve names as used by OpenPGP, preferred over the X9/SEC/NIST tables
    private static final Map<String, String> OPENPGP_CURVES = Map.of(
            "1.3.6.1.4.1.11591.15.1", "ed25519",
            "1.3.6.1.4.1.3029.1.5.1", "cv25519",
            "1.3.101.112", "ed25519",
            "1.3.101.110", "x25519");

    private final Logger logger;
    private final String reader;
    private final TagMap tags;
    private final ApplicationIdentifier aid;
    private final String longName;
    private final String cardHolder;
    private final ExtendedCapabilities capabilities;
    private final String appletVersion;

    private OpenPGPCard(String reader, TagMap tags, String appletVersion, Logger logger) {
        this.logger = logger;
        this.reader = reader;
        this.tags = tags;
        this.appletVersion = appletVersion;

        var aidBytes = require(OpenPGPTags.APPLICATION_IDENTIFIER, ApplicationIdentifier.MINIMUM_LENGTH, "application identifier");
        this.aid = ApplicationIdentifier.parse(aidBytes);
        this.longName = "%s SN %s OpenPGP %s".formatted(reader, aid.serial(), aid.version());

        var name = tags.get(OpenPGPTags.CARDHOLDER_NAME);
        if (name.isEmpty()) {
            logger.debug("No cardholder name ({}) on {}", OpenPGPTags.CARDHOLDER_NAME, aid.serial());
        }
        this.cardHolder = CardHolderName.parse(name.orElse(new byte[0]));
        this.capabilities = ExtendedCapabilities.fromTags(tags, logger);
        logger.trace("Decoded {} with {}", longName, capabilities);
    }

    /**
     * Decodes the card identity from the merged GET DATA responses.
     *
     * @param reader name of the reader the card is in, used for {@link #longName()}
     * @param tags   flattened responses, at least Application Related Data (6E)
     * @throws OpenPGPDataException if the application identifier is missing or any present data object is malformed
     */
    public static OpenPGPCard fromTags(String reader, TagMap tags) {
        return fromTags(reader, tags, "", defaultLogger);
    }

    public static OpenPGPCard fromTags(String reader, TagMap tags, String appletVersion, Logger logger) {
        Objects.requireNonNull(reader, "reader");
        Objects.requireNonNull(tags, "tags");
        Objects.requireNonNull(appletVersion, "appletVersion");
        Objects.requireNonNull(logger, "logger");
        return new OpenPGPCard(reader, tags, appletVersion, logger);
    }

    private byte[] require(String path, int minimumLength, String context) {
        var value = tags.get(path).orElseThrow(() -> new OpenPGPDataException(NO_SUCH_TAG, "%s: no tag %s".formatted(context, path)));
        if (value.length < minimumLength) {
            throw new OpenPGPDataException(TOO_SHORT, "%s: tag %s shorter than %d bytes".formatted(context, path, minimumLength), value);
        }
        return value;
    }

    private byte[] slot(String path, int width, KeyType keyType, String context) {
        try {
            return KeyArray.of(tags, path, width).slot(keyType);
        } catch (OpenPGPDataException e) {
            throw new OpenPGPDataException(context, e);
        }
    }

    @Override
    public boolean isPresent() {
        return true;
    }

    public String reader() {
        return reader;
    }

    public TagMap tags() {
        return tags;
    }

    public ApplicationIdentifier applicationIdentifier() {
        return aid;
    }

    public String serial() {
        return aid.serial();
    }

    public long serialInt() {
        return aid.serialInt();
    }

    public String rid() {
        return aid.rid();
    }

    public String application() {
        return aid.application();
    }

    @Override
    public String version() {
        return aid.version();
    }

    public String manufacturer() {
        return aid.manufacturer();
    }

    public String longName() {
        return longName;
    }

    @Override
    public String cardHolder() {
        return cardHolder;
    }

    @Override
    public String appletVersion() {
        return appletVersion;
    }

    public ExtendedCapabilities capabilities() {
        return capabilities;
    }

    private byte[] algorithmAttributes(KeyType keyType, String context) {
        var tag = keyType.algorithmAttributesTag()
                .orElseThrow(() -> new OpenPGPDataException(NO_SUCH_TAG, "%s: no algorithm attributes for %s keys".formatted(context, keyType)));
        return require(tag, 1, context);
    }

    /**
     * Algorithm of the key, "RSA 2048" for RSA keys, "Alg=19  " (left aligned in 4 characters) otherwise.
     */
    @Override
    public String algorithm(KeyType keyType) {
        var context = "algorithm(" + keyType + ")";
        var data = algorithmAttributes(keyType, context);

        var code = data[0] & 0xFF;
        if (code >= RSA_FIRST && code <= RSA_LAST) {
            if (data.length < 3) {
                throw new OpenPGPDataException(NO_SUCH_ALGORITHM, "%s: RSA attributes shorter than 3 bytes".formatted(context), data);
            }
            var modulusBits = ((data[1] & 0xFF) << 8) | (data[2] & 0xFF);
            return "RSA " + modulusBits;
        }
        return "Alg=%-4d".formatted(code);
    }

    // Named curve of an ECDH/ECDSA/EdDSA key, or the OID if the curve has no known name. Empty for other algorithms.
    public Optional<String> curve(KeyType keyType) {
        var context = "curve(" + keyType + ")";
        var data = algorithmAttributes(keyType, context);

        var code = data[0] & 0xFF;
        if (code != ECDH && code != ECDSA && code != EDDSA) {
            return Optional.empty();
        }
        // OID follows the algorithm byte, optionally followed by 0xFF for the import format
        var end = data[data.length - 1] == (byte) 0xFF ? data.length - 1 : data.length;
        if (end < 2) {
            throw new OpenPGPDataException(NO_SUCH_ALGORITHM, context + ": no curve OID", data);
        }
        var content = Arrays.copyOfRange(data, 1, end);
        final ASN1ObjectIdentifier oid;
        try {
            oid = ASN1ObjectIdentifier.getInstance(concat(new byte[]{0x06, (byte) content.length}, content));
        } catch (IllegalArgumentException e) {
            throw new OpenPGPDataException(NO_SUCH_ALGORITHM, context + ": invalid curve OID " + Hex.toHexString(content));
        }
        // OpenPGP names first, Bouncy Castle calls cv25519 "curve25519"
        var name = OPENPGP_CURVES.get(oid.getId());
        if (name == null) {
            name = ECNamedCurveTable.getName(oid);
        }
        return Optional.of(name == null ? oid.getId() : name);
    }

    // 20 byte fingerprint as uppercase hex
    @Override
    public String fingerprint(KeyType keyType) {
        var fp = slot(OpenPGPTags.FINGERPRINTS, OpenPGPTags.FINGERPRINT_LENGTH, keyType, "fingerprint(" + keyType + ")");
        return Hex.toHexString(fp).toUpperCase();
    }

    // Fingerprint of the certification authority key for the given slot
    public String caFingerprint(KeyType keyType) {
        var fp = slot(OpenPGPTags.CA_FINGERPRINTS, OpenPGPTags.FINGERPRINT_LENGTH, keyType, "caFingerprint(" + keyType + ")");
        return Hex.toHexString(fp).toUpperCase();
    }

    // Key ID: the last 8 bytes of the fingerprint
    @Override
    public String id(KeyType keyType) {
        var fp = slot(OpenPGPTags.FINGERPRINTS, OpenPGPTags.FINGERPRINT_LENGTH, keyType, "id(" + keyType + ")");
        return Hex.toHexString(fp, fp.length - 8, 8).toUpperCase();
    }

    /**
     * Key generation date. The card uses 0 for "not specified", which is returned as the epoch.
     */
    @Override
    public Instant date(KeyType keyType) {
        var d = slot(OpenPGPTags.GENERATION_DATES, OpenPGPTags.DATE_LENGTH, keyType, "date(" + keyType + ")");
        var seconds = ((long) (d[0] & 0xFF) << 24) | ((d[1] & 0xFF) << 16) | ((d[2] & 0xFF) << 8) | (d[3] & 0xFF);
        return Instant.ofEpochSecond(seconds);
    }

    /**
     * Origin of the key.
     *
     * @throws OpenPGPDataException with {@link OpenPGPDataException.Reason#KEY_NOT_PRESENT} if the card has no
     *                              key information, {@link OpenPGPDataException.Reason#UNKNOWN_KEY_ORIGIN} for unknown codes
     */
    @Override
    public KeyOrigin origin(KeyType keyType) {
        var context = "origin(" + keyType + ")";
        var length = tags.length(OpenPGPTags.KEY_INFORMATION);
        if (length.isEmpty() || length.getAsInt() == 0) {
            logger.debug("No key information ({}) on {}", OpenPGPTags.KEY_INFORMATION, aid.serial());
            throw new OpenPGPDataException(KEY_NOT_PRESENT, "%s: key type %s not present".formatted(context, keyType));
        }
        var code = slot(OpenPGPTags.KEY_INFORMATION, 1, keyType, context)[0] & 0xFF;
        try {
            return KeyOrigin.fromCode(code);
        } catch (OpenPGPDataException e) {
            throw new OpenPGPDataException(context, e);
        }
    }

    public PasswordStatus passwordStatus() {
        return PasswordStatus.parse(require(OpenPGPTags.PW_STATUS_BYTES, PasswordStatus.LENGTH, "passwordStatus()"));
    }

    // Digital signature counter, from Security Support Template (7A)
    public long signatureCounter() {
        var counter = require(OpenPGPTags.SIGNATURE_COUNTER, 3, "signatureCounter()");
        return ((counter[0] & 0xFF) << 16) | ((counter[1] & 0xFF) << 8) | (counter[2] & 0xFF);
    }

    // Language preferences (5F2D), ISO 639-1 codes
    public Optional<String> language() {
        return tags.get(OpenPGPTags.LANGUAGE_PREFERENCES)
                .filter(v -> v.length > 0)
                .map(v -> new String(v, StandardCharsets.US_ASCII));
    }

    @Override
    public String toPrettyString() {
        return "\n"
                + "  Card:            " + longName + "\n"
                + "  RID:             " + aid.rid() + "\n"
                + "  Application:     " + aid.application() + "\n"
                + "  Version:         " + aid.version() + "\n"
                + "  Manufacturer:    " + aid.manufacturer() + "\n"
                + "  Serial Number:   " + aid.serial() + "\n"
                + "  Cardholder Name: " + cardHolder + "\n";
    }

    @Override
    public String toString() {
        return "OpenPGPCard[" + longName + "]";
    }

    private static byte[] concat(byte[] a, byte[] b) {
        var result = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }
}
