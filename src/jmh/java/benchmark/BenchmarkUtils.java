package benchmark;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

public final class BenchmarkUtils {
    private static final int MIN_ALLOWED_PORT = 1;
    private static final int MAX_ALLOWED_PORT = 65535;

    private BenchmarkUtils() {
    }

    public static List<String> getRandomNodes(final int size) {
        List<Integer> ports = new ArrayList<>(size);
        int port;
        for (int i = 0; i < size; i++) {
            do {
                port = randomPort();
            } while (ports.contains(port));
            ports.add(port);
        }
        return ports
                .stream()
                .map(BenchmarkUtils::endpoint)
                .collect(Collectors.toList());
    }

    public static int randomPort() {
        return ThreadLocalRandom.current().nextInt(MIN_ALLOWED_PORT, MAX_ALLOWED_PORT);
    }

    public static String randomId() {
        return Long.toHexString(ThreadLocalRandom.current().nextLong());
    }

    public static String endpoint(final int port) {
        return "http://localhost:" + port;
    }
}
