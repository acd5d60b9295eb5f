package ru.mail.polis.maglev.hash;

import com.google.common.hash.Funnel;
import com.google.common.hash.PrimitiveSink;

import java.nio.charset.StandardCharsets;

/**
 * Funnels for common node and key types.
 */
public final class KeyFunnels {
    private static final byte STRING_TERMINATOR = (byte) 0xFF;

    private KeyFunnels() {
    }

    /**
     * UTF-8 bytes followed by a {@code 0xFF} terminator, which never occurs in UTF-8,
     * so the encoding stays prefix-free inside composite funnels.
     */
    public static Funnel<CharSequence> string() {
        return StringFunnel.INSTANCE;
    }

    public static Funnel<Integer> integer() {
        return IntegerFunnel.INSTANCE;
    }

    public static Funnel<Long> longValue() {
        return LongFunnel.INSTANCE;
    }

    private enum StringFunnel implements Funnel<CharSequence> {
        INSTANCE;

        @Override
        public void funnel(CharSequence from, PrimitiveSink into) {
            into.putString(from, StandardCharsets.UTF_8)
                    .putByte(STRING_TERMINATOR);
        }

        @Override
        public String toString() {
            return "KeyFunnels.string()";
        }
    }

    private enum IntegerFunnel implements Funnel<Integer> {
        INSTANCE;

        @Override
        public void funnel(Integer from, PrimitiveSink into) {
            into.putInt(from);
        }

        @Override
        public String toString() {
            return "KeyFunnels.integer()";
        }
    }

    private enum LongFunnel implements Funnel<Long> {
        INSTANCE;

        @Override
        public void funnel(Long from, PrimitiveSink into) {
            into.putLong(from);
        }

        @Override
        public String toString() {
            return "KeyFunnels.longValue()";
        }
    }
}
