package benchmark;

import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import ru.mail.polis.maglev.MaglevConfig;
import ru.mail.polis.maglev.MaglevTable;
import ru.mail.polis.maglev.hash.GuavaHashStrategy;
import ru.mail.polis.maglev.hash.KeyFunnels;
import ru.mail.polis.maglev.hash.XxHash3Strategy;

import java.util.List;

@State(Scope.Benchmark)
public class BenchmarkState {
    @SuppressWarnings("unused")
    @Param({"4", "16", "64", "256", "1024"})
    private int topologySize;

    public MaglevTable<String> sipHashTable;
    public MaglevTable<String> murmur3Table;
    public MaglevTable<String> xxHash3Table;

    public List<String> topology;

    @Setup
    public void setup() {
        topology = BenchmarkUtils.getRandomNodes(topologySize);
        sipHashTable = MaglevTable.forStrings(topology);
        murmur3Table = MaglevTable.create(topology, KeyFunnels.string(),
                new MaglevConfig(0, GuavaHashStrategy.murmur3()));
        xxHash3Table = MaglevTable.create(topology, KeyFunnels.string(),
                new MaglevConfig(0, new XxHash3Strategy()));
    }
}
