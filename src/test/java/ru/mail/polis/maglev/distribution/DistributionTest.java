package ru.mail.polis.maglev.distribution;

import ru.mail.polis.maglev.MaglevConfig;
import ru.mail.polis.maglev.MaglevTable;
import ru.mail.polis.maglev.TestBase;
import ru.mail.polis.maglev.hash.HashStrategy;
import ru.mail.polis.maglev.hash.KeyFunnels;

import java.util.List;

public abstract class DistributionTest extends TestBase {
    protected static final int COUNT_OF_KEYS = 100000;

    protected abstract HashStrategy getHashStrategy();

    protected MaglevTable<String> createTable(List<String> nodes) {
        return createTable(nodes, MaglevConfig.DEFAULT_CAPACITY);
    }

    protected MaglevTable<String> createTable(List<String> nodes, int capacity) {
        return MaglevTable.create(nodes, KeyFunnels.string(), new MaglevConfig(capacity, getHashStrategy()));
    }
}
