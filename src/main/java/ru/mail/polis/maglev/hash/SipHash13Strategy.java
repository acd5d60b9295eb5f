package ru.mail.polis.maglev.hash;

import com.google.common.base.MoreObjects;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;

import javax.annotation.Nonnull;

/**
 * SipHash-1-3: one compression round per 8-byte block, three finalization rounds.
 * <p>
 * With the default zero key and {@link KeyFunnels#string()} this yields the same digests as
 * the standard hasher of the Rust collections library, which the reference routing of the
 * weekday example depends on.
 */
public final class SipHash13Strategy implements HashStrategy {
    private static final SipHash13Strategy ZERO_KEY = new SipHash13Strategy(0L, 0L);

    private final long k0;
    private final long k1;

    public SipHash13Strategy(long k0, long k1) {
        this.k0 = k0;
        this.k1 = k1;
    }

    public static SipHash13Strategy zeroKey() {
        return ZERO_KEY;
    }

    @Nonnull
    @Override
    public Hasher newHasher() {
        return new SipHash13Hasher(k0, k1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SipHash13Strategy)) {
            return false;
        }
        SipHash13Strategy that = (SipHash13Strategy) o;
        return k0 == that.k0 && k1 == that.k1;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(k0) * 31 + Long.hashCode(k1);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("k0", k0)
                .add("k1", k1)
                .toString();
    }

    private static final class SipHash13Hasher extends LittleEndianHasher {
        private long v0;
        private long v1;
        private long v2;
        private long v3;

        // pending bytes of the current block, least significant first
        private long tail;
        private int tailLength;
        private long length;

        SipHash13Hasher(long k0, long k1) {
            this.v0 = k0 ^ 0x736f6d6570736575L;
            this.v1 = k1 ^ 0x646f72616e646f6dL;
            this.v2 = k0 ^ 0x6c7967656e657261L;
            this.v3 = k1 ^ 0x7465646279746573L;
        }

        @Override
        protected void update(byte b) {
            tail |= (b & 0xFFL) << (tailLength * Byte.SIZE);
            tailLength++;
            length++;
            if (tailLength == Long.BYTES) {
                compress(tail);
                tail = 0;
                tailLength = 0;
            }
        }

        @Nonnull
        @Override
        protected HashCode makeHash() {
            compress(tail | (length & 0xFFL) << 56);
            v2 ^= 0xFFL;
            sipRound();
            sipRound();
            sipRound();
            return HashCode.fromLong(v0 ^ v1 ^ v2 ^ v3);
        }

        private void compress(long m) {
            v3 ^= m;
            sipRound();
            v0 ^= m;
        }

        private void sipRound() {
            v0 += v1;
            v1 = Long.rotateLeft(v1, 13);
            v1 ^= v0;
            v0 = Long.rotateLeft(v0, 32);
            v2 += v3;
            v3 = Long.rotateLeft(v3, 16);
            v3 ^= v2;
            v0 += v3;
            v3 = Long.rotateLeft(v3, 21);
            v3 ^= v0;
            v2 += v1;
            v1 = Long.rotateLeft(v1, 17);
            v1 ^= v2;
            v2 = Long.rotateLeft(v2, 32);
        }
    }
}
