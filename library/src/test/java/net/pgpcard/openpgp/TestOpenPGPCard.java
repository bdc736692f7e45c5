package net.pgpcard.openpgp;

import net.pgpcard.tlv.TLV;
import net.pgpcard.tlv.TagMap;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.time.Instant;
import java.util.Optional;

import static net.pgpcard.openpgp.OpenPGPDataException.Reason.*;

public class TestOpenPGPCard {
    static {
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "trace");
    }

    final static Logger logger = LoggerFactory.getLogger(TestOpenPGPCard.class);

    static OpenPGPCard card() {
        return OpenPGPCard.fromTags(CardFixtures.READER, CardFixtures.tags(), "5.4.3", logger);
    }

    static OpenPGPCard card(TLV discretionary) {
        return OpenPGPCard.fromTags(CardFixtures.READER, TagMap.parse(CardFixtures.applicationRelatedData(discretionary)));
    }

    @Test
    public void testIdentity() {
        var card = card();
        Assert.assertEquals(card.rid(), "D276000124");
        Assert.assertEquals(card.application(), "01 (OpenPGP)");
        Assert.assertEquals(card.version(), "3.4");
        Assert.assertEquals(card.manufacturer(), "0006 (YubiCo)");
        Assert.assertEquals(card.serial(), "12345678");
        Assert.assertEquals(card.serialInt(), 0x12345678L);
        Assert.assertEquals(card.longName(), "Yubico YubiKey OTP+FIDO+CCID SN 12345678 OpenPGP 3.4");
        Assert.assertEquals(card.cardHolder(), "JOHN\nDOE");
        Assert.assertEquals(card.appletVersion(), "5.4.3");
        Assert.assertTrue(card.isPresent());
    }

    @Test
    public void testOtherVendor() {
        var aid = ApplicationIdentifier.parse(Hex.decode("D27600012402000000050A0B0C0D0000"));
        Assert.assertEquals(aid.application(), "02");
        Assert.assertEquals(aid.version(), "0.0");
        Assert.assertEquals(aid.manufacturer(), "0005");
        Assert.assertEquals(aid.serial(), "A0B0C0D");
        Assert.assertEquals(aid.serialInt(), 0x0A0B0C0DL);

        var high = ApplicationIdentifier.parse(Hex.decode("D276000124010304000FFFFFFFFF0000"));
        Assert.assertEquals(high.serialInt(), 0xFFFFFFFFL);
    }

    @Test
    public void testMissingAID() {
        var e = Assert.expectThrows(OpenPGPDataException.class, () -> OpenPGPCard.fromTags("r", TagMap.parse(CardFixtures.cardholderRelatedData("X"))));
        Assert.assertEquals(e.getReason(), NO_SUCH_TAG);
    }

    @Test
    public void testShortAID() {
        var tags = TagMap.parse(TLV.build("6E").add("4F", Hex.decode("D27600012401030400061234")).encode());
        var e = Assert.expectThrows(OpenPGPDataException.class, () -> OpenPGPCard.fromTags("r", tags));
        Assert.assertEquals(e.getReason(), TOO_SHORT);
    }

    @Test
    public void testNoCardholderName() {
        var card = card(CardFixtures.discretionaryData());
        Assert.assertEquals(card.cardHolder(), CardHolderName.NOT_SET);
        Assert.assertEquals(card.language(), Optional.empty());
    }

    @Test
    public void testPrettyString() {
        var expected = "\n"
                + "  Card:            Yubico YubiKey OTP+FIDO+CCID SN 12345678 OpenPGP 3.4\n"
                + "  RID:             D276000124\n"
                + "  Application:     01 (OpenPGP)\n"
                + "  Version:         3.4\n"
                + "  Manufacturer:    0006 (YubiCo)\n"
                + "  Serial Number:   12345678\n"
                + "  Cardholder Name: JOHN\nDOE\n";
        Assert.assertEquals(card().toPrettyString(), expected);
    }

    @Test
    public void testAlgorithm() {
        var card = card();
        Assert.assertEquals(card.algorithm(KeyType.SIGNATURE), "RSA 2048");
        Assert.assertEquals(card.algorithm(KeyType.DECRYPTION), "Alg=18  ");
        Assert.assertEquals(card.algorithm(KeyType.AUTHENTICATION), "Alg=22  ");
        var e = Assert.expectThrows(OpenPGPDataException.class, () -> card.algorithm(KeyType.ATTESTATION));
        Assert.assertEquals(e.getReason(), NO_SUCH_TAG);
    }

    @Test
    public void testAlgorithmRange() {
        var rsaSignOnly = card(TLV.build("73").add("C1", Hex.decode("03100000")));
        Assert.assertEquals(rsaSignOnly.algorithm(KeyType.SIGNATURE), "RSA 4096");

        var wide = card(TLV.build("73").add("C1", Hex.decode("FF")));
        Assert.assertEquals(wide.algorithm(KeyType.SIGNATURE), "Alg=255 ");

        var shortRsa = card(TLV.build("73").add("C1", Hex.decode("0108")));
        var e = Assert.expectThrows(OpenPGPDataException.class, () -> shortRsa.algorithm(KeyType.SIGNATURE));
        Assert.assertEquals(e.getReason(), NO_SUCH_ALGORITHM);

        var empty = card(TLV.build("73").add("C1", new byte[0]));
        e = Assert.expectThrows(OpenPGPDataException.class, () -> empty.algorithm(KeyType.SIGNATURE));
        Assert.assertEquals(e.getReason(), TOO_SHORT);

        e = Assert.expectThrows(OpenPGPDataException.class, () -> empty.algorithm(KeyType.DECRYPTION));
        Assert.assertEquals(e.getReason(), NO_SUCH_TAG);
    }

    @Test
    public void testCurve() {
        var card = card();
        Assert.assertEquals(card.curve(KeyType.SIGNATURE), Optional.empty());
        Assert.assertEquals(card.curve(KeyType.DECRYPTION), Optional.of("secp384r1"));
        Assert.assertEquals(card.curve(KeyType.AUTHENTICATION), Optional.of("ed25519"));

        // Trailing import format byte
        var imported = card(TLV.build("73").add("C1", Hex.decode("132B81040022FF")));
        Assert.assertEquals(imported.curve(KeyType.SIGNATURE), Optional.of("secp384r1"));
    }

    @Test
    public void testCurve25519() {
        var card = card(TLV.build("73")
                .add("C2", Hex.decode("122B060104019755010501"))
                .add("C3", Hex.decode("162B06010401DA470F01")));
        Assert.assertEquals(card.curve(KeyType.DECRYPTION), Optional.of("cv25519"));
        Assert.assertEquals(card.curve(KeyType.AUTHENTICATION), Optional.of("ed25519"));
    }

    @Test
    public void testFingerprintAndId() {
        var card = card();
        Assert.assertEquals(card.fingerprint(KeyType.SIGNATURE), "000102030405060708090A0B0C0D0E0F10111213");
        Assert.assertEquals(card.fingerprint(KeyType.DECRYPTION), "202122232425262728292A2B2C2D2E2F30313233");
        Assert.assertEquals(card.fingerprint(KeyType.AUTHENTICATION), "404142434445464748494A4B4C4D4E4F50515253");
        Assert.assertEquals(card.id(KeyType.AUTHENTICATION), "4C4D4E4F50515253");
        Assert.assertEquals(card.id(KeyType.SIGNATURE), "0C0D0E0F10111213");
        Assert.assertEquals(card.caFingerprint(KeyType.DECRYPTION), "0".repeat(40));

        var e = Assert.expectThrows(OpenPGPDataException.class, () -> card.fingerprint(KeyType.ATTESTATION));
        Assert.assertEquals(e.getReason(), TOO_SHORT);
    }

    @Test
    public void testFingerprintMissing() {
        var card = card(TLV.build("73").add("C5", CardFixtures.fingerprint(0x10)));
        Assert.assertEquals(card.id(KeyType.SIGNATURE), "1C1D1E1F20212223");
        var e = Assert.expectThrows(OpenPGPDataException.class, () -> card.id(KeyType.DECRYPTION));
        Assert.assertEquals(e.getReason(), TOO_SHORT);
        Assert.assertTrue(e.getMessage().startsWith("id(DECRYPTION)"));

        var none = card(TLV.build("73"));
        e = Assert.expectThrows(OpenPGPDataException.class, () -> none.fingerprint(KeyType.SIGNATURE));
        Assert.assertEquals(e.getReason(), NO_SUCH_TAG);
    }

    @Test
    public void testDate() {
        var card = card();
        Assert.assertEquals(card.date(KeyType.SIGNATURE), Instant.ofEpochSecond(1600000000L));
        Assert.assertEquals(card.date(KeyType.DECRYPTION), Instant.EPOCH);
        Assert.assertEquals(card.date(KeyType.AUTHENTICATION), Instant.ofEpochSecond(0x65000000L));

        var high = card(TLV.build("73").add("CD", Hex.decode("FFFFFFFF")));
        Assert.assertEquals(high.date(KeyType.SIGNATURE), Instant.ofEpochSecond(0xFFFFFFFFL));
    }

    @Test
    public void testOrigin() {
        var card = card();
        Assert.assertEquals(card.origin(KeyType.SIGNATURE), KeyOrigin.GENERATED);
        Assert.assertEquals(card.origin(KeyType.DECRYPTION), KeyOrigin.IMPORTED);
        Assert.assertEquals(card.origin(KeyType.AUTHENTICATION), KeyOrigin.EMPTY);
        Assert.assertEquals(card.origin(KeyType.ATTESTATION), KeyOrigin.NOT_PRESENT);
    }

    @Test
    public void testOriginMissVersusMalformed() {
        var empty = card(TLV.build("73").add("DE", new byte[0]));
        var e = Assert.expectThrows(OpenPGPDataException.class, () -> empty.origin(KeyType.SIGNATURE));
        Assert.assertEquals(e.getReason(), KEY_NOT_PRESENT);

        var absent = card(TLV.build("73"));
        e = Assert.expectThrows(OpenPGPDataException.class, () -> absent.origin(KeyType.SIGNATURE));
        Assert.assertEquals(e.getReason(), KEY_NOT_PRESENT);

        var unknown = card(TLV.build("73").add("DE", Hex.decode("0104")));
        Assert.assertEquals(unknown.origin(KeyType.SIGNATURE), KeyOrigin.EMPTY);
        e = Assert.expectThrows(OpenPGPDataException.class, () -> unknown.origin(KeyType.DECRYPTION));
        Assert.assertEquals(e.getReason(), UNKNOWN_KEY_ORIGIN);
    }

    @Test
    public void testPasswordStatus() {
        var status = card().passwordStatus();
        Assert.assertEquals(status, new PasswordStatus(true, 127, 127, 127, 3, 0, 3));

        var shortStatus = card(TLV.build("73").add("C4", Hex.decode("00202020")));
        var e = Assert.expectThrows(OpenPGPDataException.class, shortStatus::passwordStatus);
        Assert.assertEquals(e.getReason(), TOO_SHORT);
    }

    @Test
    public void testSignatureCounterAndLanguage() {
        var card = card();
        Assert.assertEquals(card.signatureCounter(), 258L);
        Assert.assertEquals(card.language(), Optional.of("en"));

        var e = Assert.expectThrows(OpenPGPDataException.class, () -> card(TLV.build("73")).signatureCounter());
        Assert.assertEquals(e.getReason(), NO_SUCH_TAG);
    }

    @Test
    public void testMalformedCapabilitiesFailConstruction() {
        var e = Assert.expectThrows(OpenPGPDataException.class, () -> card(TLV.build("73").add("C0", Hex.decode("80"))));
        Assert.assertEquals(e.getReason(), NOT_FOUND);
    }

    @Test
    public void testCapabilities() {
        var caps = card().capabilities();
        Assert.assertFalse(caps.secureMessagingSupported());
        Assert.assertTrue(caps.getChallengeSupported());
        Assert.assertEquals(caps.maximumChallengeLength(), 0x0BFE);
        Assert.assertEquals(caps.maximumCardholderCertificatesLength(), 2048);
        Assert.assertEquals(caps.maximumSpecialDOsLength(), 255);
        Assert.assertTrue(caps.kdfSupported());
        Assert.assertFalse(caps.supportsPSODecryptionEncryptionWithAES());
    }
}
