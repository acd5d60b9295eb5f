package ru.mail.polis.maglev.distribution.error;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import ru.mail.polis.maglev.MaglevTable;
import ru.mail.polis.maglev.distribution.DistributionTest;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public abstract class DistributionErrorTest extends DistributionTest {
    @ParameterizedTest(name = "Distribution accuracy for {0} nodes with error less then {1}")
    @MethodSource("provideParameters")
    public void distributionAccuracyForNumberOfNodes(int numberOfNodes, double allowedError) {
        List<String> topology = getRandomNodes(numberOfNodes);
        MaglevTable<String> table = createTable(topology);
        Map<String, Integer> numberOfEachNode = new HashMap<>();
        for (int j = 0; j < COUNT_OF_KEYS; j++) {
            final String node = table.route(randomId());
            numberOfEachNode.merge(node, 1, Integer::sum);
        }
        assertEquals(topology.size(), numberOfEachNode.size(), "some nodes got no keys");

        final double average = (double) COUNT_OF_KEYS / topology.size();
        final double distributionError = calculateDistributionError(average, numberOfEachNode);
        assertTrue(distributionError < allowedError, "distribution error " + distributionError);
    }

    @ParameterizedTest(name = "Slot balance for {0} nodes")
    @ValueSource(ints = {5, 25, 100, 500})
    public void slotsPerNodeDifferByAtMostOne(int numberOfNodes) {
        MaglevTable<String> table = createTable(getRandomNodes(numberOfNodes));
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int count : table.slotCounts()) {
            min = Math.min(min, count);
            max = Math.max(max, count);
        }
        // round-robin hands out one slot per node per round
        assertTrue(max - min <= 1, "slot counts range from " + min + " to " + max);
    }

    @SuppressWarnings("unused")
    private static Stream<Arguments> provideParameters() {
        return Stream.of(
                Arguments.of(5, 0.1),
                Arguments.of(5, 0.05),

                Arguments.of(25, 0.1),
                Arguments.of(25, 0.05),

                Arguments.of(100, 0.2),
                Arguments.of(100, 0.1),

                Arguments.of(500, 0.3),
                Arguments.of(500, 0.2)
        );
    }

    private static double calculateDistributionError(final double average, final Map<String, Integer> numberOfEachNode) {
        return numberOfEachNode.values()
                .stream()
                .mapToDouble(count -> Math.abs(average - count))
                .average()
                .orElse(0.0) / average;
    }
}
