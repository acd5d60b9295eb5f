package ru.mail.polis.maglev;

import com.google.common.hash.Funnel;
import com.google.common.primitives.UnsignedLongs;
import ru.mail.polis.maglev.hash.HashStrategy;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * Preference order of one node over the slots of a table of prime size:
 * {@code slot(k) = (offset + k * skip) mod size}. Slots are computed on demand.
 */
final class Permutation {
    static final int OFFSET_SEED = 0xDEADBABE;
    static final int SKIP_SEED = 0xDEADBEEF;

    private final int offset;
    private final int skip;
    private final int size;

    Permutation(int offset, int skip, int size) {
        checkArgument(size >= 2, "table size must be at least 2: %s", size);
        checkElementIndex(offset, size, "offset");
        checkArgument(skip >= 1 && skip < size, "skip must be in [1, %s): %s", size, skip);
        this.offset = offset;
        this.skip = skip;
        this.size = size;
    }

    static <N> Permutation of(N node, Funnel<? super N> funnel, HashStrategy hashStrategy, int size) {
        checkArgument(size >= 2, "table size must be at least 2: %s", size);
        long offsetHash = hashStrategy.digest(OFFSET_SEED, node, funnel);
        long skipHash = hashStrategy.digest(SKIP_SEED, node, funnel);
        int offset = (int) UnsignedLongs.remainder(offsetHash, size);
        int skip = (int) UnsignedLongs.remainder(skipHash, size - 1) + 1;
        return new Permutation(offset, skip, size);
    }

    int slot(int k) {
        return (int) ((offset + (long) k * skip) % size);
    }

    int offset() {
        return offset;
    }

    int skip() {
        return skip;
    }

    int size() {
        return size;
    }
}
