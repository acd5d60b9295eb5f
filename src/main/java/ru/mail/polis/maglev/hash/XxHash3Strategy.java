package ru.mail.polis.maglev.hash;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;
import net.openhft.hashing.LongHashFunction;

import javax.annotation.Nonnull;
import java.io.ByteArrayOutputStream;

/**
 * XXH3 from zero-allocation-hashing. The function is not streaming,
 * so the fed bytes are buffered until {@link Hasher#hash()}.
 */
public final class XxHash3Strategy implements HashStrategy {
    private final LongHashFunction instance;

    public XxHash3Strategy() {
        this.instance = LongHashFunction.xx3();
    }

    public XxHash3Strategy(long seed) {
        this.instance = LongHashFunction.xx3(seed);
    }

    @Nonnull
    @Override
    public Hasher newHasher() {
        return new BufferingHasher(instance);
    }

    private static final class BufferingHasher extends LittleEndianHasher {
        private static final int INITIAL_BUFFER_SIZE = 32;

        private final LongHashFunction function;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream(INITIAL_BUFFER_SIZE);

        BufferingHasher(LongHashFunction function) {
            this.function = function;
        }

        @Override
        protected void update(byte b) {
            buffer.write(b);
        }

        @Override
        protected void update(byte[] bytes, int off, int len) {
            buffer.write(bytes, off, len);
        }

        @Nonnull
        @Override
        protected HashCode makeHash() {
            return HashCode.fromLong(function.hashBytes(buffer.toByteArray()));
        }
    }
}
