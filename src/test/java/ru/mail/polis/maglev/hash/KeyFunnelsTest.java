package ru.mail.polis.maglev.hash;

import com.google.common.hash.Funnel;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class KeyFunnelsTest {
    private static final HashFunction SHA256 = Hashing.sha256();

    @Test
    void stringIsTerminatedUtf8() {
        assertEquals(
                SHA256.newHasher().putBytes("ключ".getBytes(StandardCharsets.UTF_8)).putByte((byte) 0xFF).hash(),
                SHA256.hashObject("ключ", KeyFunnels.string()));
    }

    @Test
    void stringEncodingIsPrefixFree() {
        Funnel<String[]> pair = (from, into) -> {
            KeyFunnels.string().funnel(from[0], into);
            KeyFunnels.string().funnel(from[1], into);
        };

        assertNotEquals(
                SHA256.hashObject(new String[]{"ab", "c"}, pair),
                SHA256.hashObject(new String[]{"a", "bc"}, pair));
    }

    @Test
    void numbersAreLittleEndian() {
        assertEquals(SHA256.hashBytes(new byte[]{1, 0, 0, 0}), SHA256.hashObject(1, KeyFunnels.integer()));
        assertEquals(SHA256.hashBytes(new byte[]{1, 0, 0, 0, 0, 0, 0, 0}), SHA256.hashObject(1L, KeyFunnels.longValue()));
    }

    @Test
    void strategiesAgreeOnStringAndCharSequence() {
        HashStrategy strategy = GuavaHashStrategy.murmur3();

        assertEquals(
                strategy.digest(1, "node", KeyFunnels.string()),
                strategy.digest(1, new StringBuilder("node"), KeyFunnels.string()));
    }
}
