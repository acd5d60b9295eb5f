package benchmark;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import ru.mail.polis.maglev.MaglevTable;

import java.util.concurrent.TimeUnit;

@Fork(value = 1, jvmArgs = {"-Xmx512m"})
@Warmup(iterations = 3)
@Measurement(iterations = 10)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@BenchmarkMode(Mode.AverageTime)
public class BuildTableBenchmark {

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(BuildTableBenchmark.class.getSimpleName())
                .forks(1)
                .build();

        new Runner(opt).run();
    }

    @Benchmark
    public MaglevTable<String> build(BenchmarkState state) {
        return MaglevTable.forStrings(state.topology);
    }

    @Benchmark
    public MaglevTable<String> rebuildWithoutFirstNode(BenchmarkState state) {
        return state.sipHashTable.rebuild(state.topology.subList(1, state.topology.size()));
    }
}
