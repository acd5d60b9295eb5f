package ru.mail.polis.maglev.hash;

import net.openhft.hashing.LongHashFunction;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class XxHash3StrategyTest {

    private static byte[] seededString(int seed, String value) {
        byte[] text = value.getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[Integer.BYTES + text.length + 1];
        bytes[0] = (byte) seed;
        bytes[1] = (byte) (seed >>> 8);
        bytes[2] = (byte) (seed >>> 16);
        bytes[3] = (byte) (seed >>> 24);
        System.arraycopy(text, 0, bytes, Integer.BYTES, text.length);
        bytes[bytes.length - 1] = (byte) 0xFF;
        return bytes;
    }

    @Test
    void hashesFedBytes() {
        long expected = LongHashFunction.xx3().hashBytes(seededString(0xDEADBABE, "alice"));

        assertEquals(expected, new XxHash3Strategy().digest(0xDEADBABE, "alice", KeyFunnels.string()));
    }

    @Test
    void seededFunction() {
        long expected = LongHashFunction.xx3(42L).hashBytes(seededString(7, "bob"));

        assertEquals(expected, new XxHash3Strategy(42L).digest(7, "bob", KeyFunnels.string()));
        assertNotEquals(expected, new XxHash3Strategy().digest(7, "bob", KeyFunnels.string()));
    }
}
