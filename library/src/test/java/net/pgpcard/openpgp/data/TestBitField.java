package net.pgpcard.openpgp.data;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.EnumSet;

public class TestBitField {

    enum Sample implements BitField<Sample> {
        First(BitField.byte_bit_rl(1, 8)),
        Last(BitField.byte_bit_rl(1, 1)),
        Second(BitField.byte_bit_rl(2, 8)),
        Pair(new Def(java.util.List.of(0, 15)));

        private final Def def;

        Sample(Def def) {
            this.def = def;
        }

        @Override
        public Def def() {
            return def;
        }
    }

    @Test
    public void testBitNumbering() {
        Assert.assertEquals(BitField.byte_bit_rl(1, 8).bits(), java.util.List.of(0));
        Assert.assertEquals(BitField.byte_bit_rl(1, 1).bits(), java.util.List.of(7));
        Assert.assertEquals(BitField.byte_bit_rl(2, 8).bits(), java.util.List.of(8));
    }

    @Test
    public void testParse() {
        Assert.assertEquals(BitField.parse(Sample.class, new byte[]{(byte) 0x81}), EnumSet.of(Sample.First, Sample.Last));
        Assert.assertEquals(BitField.parse(Sample.class, new byte[]{(byte) 0x80, 0x01}), EnumSet.of(Sample.First, Sample.Pair));
        Assert.assertEquals(BitField.parse(Sample.class, new byte[]{0x00, (byte) 0x8C}), EnumSet.of(Sample.Second));
        Assert.assertEquals(BitField.parse(Sample.class, new byte[]{0x00, 0x04}), EnumSet.noneOf(Sample.class));
    }

    @Test
    public void testShortInput() {
        // bits beyond the data are not set
        Assert.assertEquals(BitField.parse(Sample.class, new byte[]{(byte) 0xFF}), EnumSet.of(Sample.First, Sample.Last));
        Assert.assertTrue(BitField.parse(Sample.class, new byte[0]).isEmpty());
    }
}
