package ru.mail.polis.maglev.distribution.error;

import ru.mail.polis.maglev.hash.HashStrategy;
import ru.mail.polis.maglev.hash.SipHash13Strategy;

public class SipHash13ErrorTest extends DistributionErrorTest {
    @Override
    protected HashStrategy getHashStrategy() {
        return SipHash13Strategy.zeroKey();
    }
}
