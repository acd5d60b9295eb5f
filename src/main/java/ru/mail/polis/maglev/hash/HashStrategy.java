package ru.mail.polis.maglev.hash;

import com.google.common.hash.Funnel;
import com.google.common.hash.Hasher;

import javax.annotation.Nonnull;

/**
 * Keyed hash used by a Maglev table both to place nodes and to route keys.
 * <p>
 * Implementations must be deterministic for equal inputs and must hand out a fresh
 * {@link Hasher} on every call, so a single strategy can be shared between threads.
 */
public interface HashStrategy {

    @Nonnull
    Hasher newHasher();

    /**
     * Seeds a fresh hasher with {@code seed} and feeds it {@code value}.
     *
     * @return the first 64 bits of the digest, zero-padded for narrower functions
     */
    default <T> long digest(int seed, @Nonnull T value, @Nonnull Funnel<? super T> funnel) {
        return newHasher()
                .putInt(seed)
                .putObject(value, funnel)
                .hash()
                .padToLong();
    }
}
