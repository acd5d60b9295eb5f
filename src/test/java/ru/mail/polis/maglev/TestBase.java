package ru.mail.polis.maglev;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

public abstract class TestBase {
    private static final int MIN_ALLOWED_PORT = 1;
    private static final int MAX_ALLOWED_PORT = 65535;

    protected static final List<String> WEEKDAYS = List.of(
            "Monday",
            "Tuesday",
            "Wednesday",
            "Thursday",
            "Friday",
            "Saturday",
            "Sunday"
    );

    protected static int randomPort() {
        return ThreadLocalRandom.current().nextInt(MIN_ALLOWED_PORT, MAX_ALLOWED_PORT);
    }

    protected static String randomId() {
        return Long.toHexString(ThreadLocalRandom.current().nextLong());
    }

    protected static String endpoint(final int port) {
        return "http://localhost:" + port;
    }

    protected static List<String> getRandomNodes(final int size) {
        Set<String> endpoints = new LinkedHashSet<>();
        while (endpoints.size() < size) {
            endpoints.add(endpoint(randomPort()));
        }
        return new ArrayList<>(endpoints);
    }

    protected static List<String> without(List<String> nodes, String... removed) {
        List<String> result = new ArrayList<>(nodes);
        result.removeAll(List.of(removed));
        return result;
    }
}
