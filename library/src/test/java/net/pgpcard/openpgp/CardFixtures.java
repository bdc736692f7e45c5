package net.pgpcard.openpgp;

import net.pgpcard.tlv.TLV;
import net.pgpcard.tlv.TagMap;
import org.bouncycastle.util.encoders.Hex;

// GET DATA responses of a YubiKey-like card with three keys
final class CardFixtures {
    static final String READER = "Yubico YubiKey OTP+FIDO+CCID";
    static final String AID = "D2760001240103040006123456780000";
    static final String EXTENDED_CAPABILITIES = "7D000BFE080000FF0000";
    static final String PW_STATUS = "017F7F7F030003";
    static final String DATES = "5F5E1000" + "00000000" + "65000000";
    static final String KEY_INFORMATION = "02030100";

    private CardFixtures() {}

    // 20 consecutive byte values starting with first
    static byte[] fingerprint(int first) {
        var fp = new byte[20];
        for (int i = 0; i < fp.length; i++) {
            fp[i] = (byte) (first + i);
        }
        return fp;
    }

    static byte[] fingerprints() {
        var all = new byte[60];
        System.arraycopy(fingerprint(0x00), 0, all, 0, 20);
        System.arraycopy(fingerprint(0x20), 0, all, 20, 20);
        System.arraycopy(fingerprint(0x40), 0, all, 40, 20);
        return all;
    }

    static TLV discretionaryData() {
        return TLV.build("73")
                .add("C0", Hex.decode(EXTENDED_CAPABILITIES))
                .add("C1", Hex.decode("010800002000"))
                .add("C2", Hex.decode("122B81040022"))
                .add("C3", Hex.decode("162B06010401DA470F01"))
                .add("C4", Hex.decode(PW_STATUS))
                .add("C5", fingerprints())
                .add("C6", new byte[60])
                .add("CD", Hex.decode(DATES))
                .add("DE", Hex.decode(KEY_INFORMATION));
    }

    static byte[] applicationRelatedData(TLV discretionary) {
        return TLV.build("6E")
                .add("4F", Hex.decode(AID))
                .add("5F52", Hex.decode("0073000080059000"))
                .add(discretionary)
                .encode();
    }

    static byte[] cardholderRelatedData(String name) {
        return TLV.build("65")
                .add("5B", name.getBytes())
                .add("5F2D", "en".getBytes())
                .add("5F35", Hex.decode("39"))
                .encode();
    }

    static byte[] securitySupportTemplate() {
        return TLV.build("7A").add("93", Hex.decode("000102")).encode();
    }

    static TagMap tags() {
        return TagMap.parse(applicationRelatedData(discretionaryData()))
                .merge(TagMap.parse(cardholderRelatedData("DOE<<JOHN")))
                .merge(TagMap.parse(securitySupportTemplate()));
    }
}
