package net.pgpcard.tool;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.List;

public class TestDumpFile {

    @Test
    public void testCommentsAndWhitespace() {
        var responses = DumpFile.parse(List.of("# header", "", "  6E 03 4F 01 01  # trailing", "7a0593030000ff"));
        Assert.assertEquals(responses.size(), 2);
        Assert.assertEquals(responses.get(0), new byte[]{0x6E, 0x03, 0x4F, 0x01, 0x01});
        Assert.assertEquals(responses.get(1)[6], (byte) 0xFF);
    }

    @Test
    public void testInvalidLine() {
        var e = Assert.expectThrows(IllegalArgumentException.class, () -> DumpFile.parse(List.of("# ok", "6E0", "00")));
        Assert.assertTrue(e.getMessage().startsWith("Invalid hex on line 2"), e.getMessage());
    }
}
