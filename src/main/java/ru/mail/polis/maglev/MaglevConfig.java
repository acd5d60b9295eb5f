package ru.mail.polis.maglev;

import com.google.common.base.MoreObjects;
import ru.mail.polis.maglev.hash.HashStrategy;
import ru.mail.polis.maglev.hash.SipHash13Strategy;

import javax.annotation.Nonnull;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

public class MaglevConfig {
    /**
     * Zero means "derive from the node count".
     */
    public static final int DEFAULT_CAPACITY = 0;
    public static final int DEFAULT_CAPACITY_FACTOR = 100;

    public static final MaglevConfig DEFAULT = new MaglevConfig(DEFAULT_CAPACITY);

    public final int capacity;
    public final int capacityFactor;
    public final HashStrategy hashStrategy;

    public MaglevConfig(int capacity) {
        this(capacity, SipHash13Strategy.zeroKey());
    }

    public MaglevConfig(int capacity, @Nonnull HashStrategy hashStrategy) {
        this(capacity, DEFAULT_CAPACITY_FACTOR, hashStrategy);
    }

    public MaglevConfig(int capacity, int capacityFactor, @Nonnull HashStrategy hashStrategy) {
        checkArgument(capacity >= 0, "capacity must not be negative: %s", capacity);
        checkArgument(capacityFactor >= 1, "capacityFactor must be positive: %s", capacityFactor);
        this.capacity = capacity;
        this.capacityFactor = capacityFactor;
        this.hashStrategy = checkNotNull(hashStrategy, "hashStrategy");
    }

    public MaglevConfig withCapacity(int newCapacity) {
        return new MaglevConfig(newCapacity, capacityFactor, hashStrategy);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("capacity", capacity)
                .add("capacityFactor", capacityFactor)
                .add("hashStrategy", hashStrategy)
                .toString();
    }
}
