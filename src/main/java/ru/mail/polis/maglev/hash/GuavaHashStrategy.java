package ru.mail.polis.maglev.hash;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import javax.annotation.Nonnull;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Adapts a Guava {@link HashFunction}. Functions narrower than 64 bits are zero-padded.
 */
public final class GuavaHashStrategy implements HashStrategy {
    private final HashFunction hashFunction;

    public GuavaHashStrategy(@Nonnull HashFunction hashFunction) {
        this.hashFunction = checkNotNull(hashFunction, "hashFunction");
    }

    public static GuavaHashStrategy murmur3() {
        return new GuavaHashStrategy(Hashing.murmur3_128());
    }

    public static GuavaHashStrategy sipHash24() {
        return new GuavaHashStrategy(Hashing.sipHash24());
    }

    @Nonnull
    @Override
    public Hasher newHasher() {
        return hashFunction.newHasher();
    }

    @Override
    public String toString() {
        return "GuavaHashStrategy[" + hashFunction + "]";
    }
}
