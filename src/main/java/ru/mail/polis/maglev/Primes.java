package ru.mail.polis.maglev;

import com.google.common.math.IntMath;

import static com.google.common.base.Preconditions.checkArgument;

final class Primes {

    private Primes() {
    }

    /**
     * Smallest prime {@code >= num}; 2 for anything below it.
     * Never overflows since {@link Integer#MAX_VALUE} is itself prime.
     */
    static int nextPrime(int num) {
        checkArgument(num >= 0, "num must not be negative: %s", num);
        if (num <= 2) {
            return 2;
        }
        int candidate = num % 2 == 0 ? num + 1 : num;
        while (!IntMath.isPrime(candidate)) {
            candidate += 2;
        }
        return candidate;
    }
}
