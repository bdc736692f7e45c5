package net.pgpcard.openpgp;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Optional;

import static net.pgpcard.openpgp.OpenPGPDataException.Reason.KEY_NOT_PRESENT;

public class TestCardData {

    @Test
    public void testAbsentGetters() {
        var absent = CardData.absent();
        Assert.assertFalse(absent.isPresent());
        Assert.assertEquals(absent.cardHolder(), "");
        Assert.assertEquals(absent.version(), "");
        Assert.assertEquals(absent.appletVersion(), "");
    }

    @Test
    public void testAbsentAccessorsFail() {
        var absent = CardData.of(Optional.empty());
        for (var keyType : KeyType.values()) {
            Assert.assertEquals(Assert.expectThrows(OpenPGPDataException.class, () -> absent.algorithm(keyType)).getReason(), KEY_NOT_PRESENT);
            Assert.assertEquals(Assert.expectThrows(OpenPGPDataException.class, () -> absent.fingerprint(keyType)).getReason(), KEY_NOT_PRESENT);
            Assert.assertEquals(Assert.expectThrows(OpenPGPDataException.class, () -> absent.id(keyType)).getReason(), KEY_NOT_PRESENT);
            Assert.assertEquals(Assert.expectThrows(OpenPGPDataException.class, () -> absent.date(keyType)).getReason(), KEY_NOT_PRESENT);
            Assert.assertEquals(Assert.expectThrows(OpenPGPDataException.class, () -> absent.origin(keyType)).getReason(), KEY_NOT_PRESENT);
        }
        Assert.assertEquals(Assert.expectThrows(OpenPGPDataException.class, absent::toPrettyString).getReason(), KEY_NOT_PRESENT);
    }

    @Test
    public void testPresent() {
        CardData data = CardData.of(Optional.of(TestOpenPGPCard.card()));
        Assert.assertTrue(data.isPresent());
        Assert.assertEquals(data.version(), "3.4");
        Assert.assertEquals(data.fingerprint(KeyType.SIGNATURE), "000102030405060708090A0B0C0D0E0F10111213");
    }
}
