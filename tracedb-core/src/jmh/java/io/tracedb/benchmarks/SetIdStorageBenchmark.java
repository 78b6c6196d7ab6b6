package io.tracedb.benchmarks;

import io.tracedb.kernel.FilterOp;
import io.tracedb.kernel.RangeOrPositions;
import io.tracedb.kernel.RowRange;
import io.tracedb.kernel.SqlValue;
import io.tracedb.storage.heap.SetIdColumnBuilder;
import io.tracedb.storage.setid.SetIdStorage;

import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 3, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@BenchmarkMode(Mode.AverageTime)
public class SetIdStorageBenchmark {

    @Param({"100000", "1000000"})
    int rowCount;

    private SetIdStorage storage;
    private RowRange allRows;
    private int[] rows;
    private long midSetId;

    @Setup(Level.Trial)
    public void setup() {
        var builder = new SetIdColumnBuilder();
        var random = new Random(42);
        while (builder.rowCount() < rowCount) {
            builder.addSet(Math.min(1 + random.nextInt(64), rowCount - builder.rowCount()));
        }
        storage = new SetIdStorage(builder.build().view());
        allRows = RowRange.of(0, storage.size());
        midSetId = builder.rowCount() / 2;
        rows = new int[10_000];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = random.nextInt(rowCount);
        }
    }

    @Benchmark
    public void searchEq(Blackhole blackhole) {
        RangeOrPositions result = storage.search(FilterOp.EQ, SqlValue.ofLong(midSetId), allRows);
        blackhole.consume(result);
    }

    @Benchmark
    public void searchGe(Blackhole blackhole) {
        RangeOrPositions result = storage.search(FilterOp.GE, SqlValue.ofLong(midSetId), allRows);
        blackhole.consume(result);
    }

    @Benchmark
    public void indexSearchUnsorted(Blackhole blackhole) {
        RangeOrPositions result = storage.indexSearch(FilterOp.LT, SqlValue.ofLong(midSetId), rows, false);
        blackhole.consume(result);
    }

    @Benchmark
    public void sort(Blackhole blackhole) {
        int[] buffer = rows.clone();
        storage.sort(buffer);
        blackhole.consume(buffer);
    }

    @Benchmark
    public void stableSort(Blackhole blackhole) {
        int[] buffer = rows.clone();
        storage.stableSort(buffer);
        blackhole.consume(buffer);
    }
}
