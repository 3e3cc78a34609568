package io.bptree.collections.test.bplustree;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import io.bptree.collections.bplustree.Lexicographic;
import org.junit.Test;

public class LexicographicTest {
    @Test
    public void testCompare() {
        assertThat(Lexicographic.INSTANCE.compare(new byte[]{}, new byte[]{}), is(0));
        assertThat(Lexicographic.INSTANCE.compare(new byte[]{}, new byte[]{1}), is(-1));
        assertThat(Lexicographic.INSTANCE.compare(new byte[]{0}, new byte[]{1}), is(-1));
        assertThat(Lexicographic.INSTANCE.compare(new byte[]{0}, new byte[]{0, 0}), is(-1));
        assertThat(Lexicographic.INSTANCE.compare(new byte[]{0}, new byte[]{}), is(1));
        assertThat(Lexicographic.INSTANCE.compare(new byte[]{1}, new byte[]{0}), is(1));
    }

    @Test
    public void testBytesCompareUnsigned() {
        assertThat(Lexicographic.INSTANCE.compare(new byte[]{(byte) 0x80}, new byte[]{0x7f}), is(1));
        assertThat(Lexicographic.INSTANCE.compare(new byte[]{(byte) 0xff}, new byte[]{(byte) 0xfe, 0}), is(1));
        assertThat(Lexicographic.INSTANCE.compare(new byte[]{1, (byte) 0xff}, new byte[]{1, (byte) 0xff}), is(0));
    }
}
