package benchmark;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

@Fork(value = 1, jvmArgs = {"-Xmx128m"})
@Warmup(iterations = 3)
@State(Scope.Benchmark)
@Measurement(iterations = 15)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@BenchmarkMode(Mode.AverageTime)
public class GetNodeBenchmark {
    private String randomRequestId;

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(GetNodeBenchmark.class.getSimpleName())
                .forks(1)
                .build();

        new Runner(opt).run();
    }

    @Setup(Level.Iteration)
    public void setup() {
        randomRequestId = BenchmarkUtils.randomId();
    }

    @Benchmark
    public String sipHashGetNode(BenchmarkState state) {
        return state.sipHashTable.route(randomRequestId);
    }

    @Benchmark
    public String murmur3GetNode(BenchmarkState state) {
        return state.murmur3Table.route(randomRequestId);
    }

    @Benchmark
    public String xxHash3GetNode(BenchmarkState state) {
        return state.xxHash3Table.route(randomRequestId);
    }
}
