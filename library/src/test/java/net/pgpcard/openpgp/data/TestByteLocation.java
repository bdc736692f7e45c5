package net.pgpcard.openpgp.data;

import net.pgpcard.openpgp.OpenPGPDataException;
import org.testng.Assert;
import org.testng.annotations.Test;

import static net.pgpcard.openpgp.OpenPGPDataException.Reason.NOT_FOUND;

public class TestByteLocation {
    static final byte[] DATA = {0x01, 0x02, 0x03, 0x04};

    static void assertNotFound(Runnable r) {
        var e = Assert.expectThrows(OpenPGPDataException.class, r::run);
        Assert.assertEquals(e.getReason(), NOT_FOUND);
    }

    @Test
    public void testSingle() {
        Assert.assertEquals(ByteLocation.at(DATA, 1), (byte) 0x01);
        Assert.assertEquals(ByteLocation.at(DATA, 4), (byte) 0x04);
        Assert.assertEquals(ByteLocation.at(2).get(DATA), (byte) 0x02);
        assertNotFound(() -> ByteLocation.at(DATA, 5));
        assertNotFound(() -> ByteLocation.at(DATA, 0));
    }

    @Test
    public void testRange() {
        Assert.assertEquals(ByteLocation.range(DATA, 2, 3), new byte[]{0x02, 0x03});
        Assert.assertEquals(ByteLocation.range(DATA, 4, 4), new byte[]{0x04});
        Assert.assertEquals(ByteLocation.range(DATA, 1, 4), DATA);
        assertNotFound(() -> ByteLocation.range(DATA, 1, 5));
        assertNotFound(() -> ByteLocation.range(DATA, 3, 2));
    }

    @Test
    public void testMissingData() {
        assertNotFound(() -> ByteLocation.at(null, 1));
        assertNotFound(() -> ByteLocation.at(new byte[0], 1));
    }

    @Test
    public void testUnsigned() {
        Assert.assertEquals(ByteLocation.unsigned(new byte[]{(byte) 0xFF}), 255);
        Assert.assertEquals(ByteLocation.unsigned(new byte[]{0x01, 0x00}), 256);
        Assert.assertEquals(ByteLocation.unsigned(new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF}), 0xFFFFFFFFL);
        Assert.expectThrows(IllegalArgumentException.class, () -> ByteLocation.unsigned(new byte[5]));
    }
}
