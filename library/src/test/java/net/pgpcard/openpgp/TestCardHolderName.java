package net.pgpcard.openpgp;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.charset.StandardCharsets;

public class TestCardHolderName {

    static String parse(String s) {
        return CardHolderName.parse(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testSurnameForename() {
        Assert.assertEquals(parse("DOE<<JOHN"), "JOHN\nDOE");
        Assert.assertEquals(parse("VAN<DER<BERG<<ANNA"), "ANNA\nVAN DER BERG");
    }

    @Test
    public void testNoSeparator() {
        Assert.assertEquals(parse("DOE"), "DOE");
        Assert.assertEquals(parse("MARY<ANN<SMITH"), "MARY ANN SMITH");
    }

    @Test
    public void testEmptyForename() {
        Assert.assertEquals(parse("DOE<<"), "DOE");
    }

    @Test
    public void testFirstSeparatorOnly() {
        Assert.assertEquals(parse("DOE<<JOHN<<X"), "JOHN<<X\nDOE");
    }

    @Test
    public void testUTF8() {
        Assert.assertEquals(parse("MÄGI<<JÜRI"), "JÜRI\nMÄGI");
    }

    @Test
    public void testNotSet() {
        Assert.assertEquals(CardHolderName.parse(new byte[0]), "[not set]");
        Assert.assertEquals(CardHolderName.parse(null), CardHolderName.NOT_SET);
    }
}
