package ru.mail.polis.maglev;

import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

final class TablePopulator {
    static final int UNFILLED = -1;

    private TablePopulator() {
    }

    /**
     * Round-robin fill: in every round each node, in index order, claims the first free slot
     * of its permutation. Stops as soon as all {@code size} slots are taken, which may be mid-round.
     *
     * @return slot to node index; empty when there are no permutations
     */
    static int[] populate(List<Permutation> permutations, int size) {
        int n = permutations.size();
        if (n == 0) {
            return new int[0];
        }
        for (Permutation permutation : permutations) {
            checkArgument(permutation.size() == size,
                    "permutation over %s slots for a table of %s", permutation.size(), size);
        }

        int[] next = new int[n];
        int[] lookup = new int[size];
        Arrays.fill(lookup, UNFILLED);

        int filled = 0;
        while (filled < size) {
            for (int i = 0; i < n && filled < size; i++) {
                Permutation permutation = permutations.get(i);
                int slot = permutation.slot(next[i]);
                while (lookup[slot] != UNFILLED) {
                    next[i]++;
                    slot = permutation.slot(next[i]);
                }
                lookup[slot] = i;
                next[i]++;
                filled++;
            }
        }
        return lookup;
    }
}
