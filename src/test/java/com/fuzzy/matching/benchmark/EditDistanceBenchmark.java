package com.fuzzy.matching.benchmark;

import com.fuzzy.matching.core.model.CodePointSequence;
import com.fuzzy.matching.editops.EditOpsFinder;
import com.fuzzy.matching.median.MedianEngine;
import com.fuzzy.matching.similarity.Levenshtein;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks for distance, edit-operation and median computations
 * over random strings of varying length.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class EditDistanceBenchmark {

    @Param({"16", "256"})
    private int length;

    private CodePointSequence first;
    private CodePointSequence second;
    private List<CodePointSequence> medianInput;
    private final MedianEngine<CodePointSequence> engine = MedianEngine.forCodePoints();

    @Setup(Level.Trial)
    public void setUp() {
        Random random = new Random(42);
        first = CodePointSequence.of(randomWord(random, length));
        second = CodePointSequence.of(mutate(random, first.toString()));
        medianInput = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            medianInput.add(CodePointSequence.of(mutate(random, first.toString())));
        }
    }

    @Benchmark
    public void distance(Blackhole bh) {
        bh.consume(Levenshtein.distance(first, second));
    }

    @Benchmark
    public void editOps(Blackhole bh) {
        bh.consume(EditOpsFinder.find(first, second));
    }

    @Benchmark
    public void greedyMedian(Blackhole bh) {
        bh.consume(engine.greedyMedian(medianInput));
    }

    @Benchmark
    public void quickMedian(Blackhole bh) {
        bh.consume(engine.quickMedian(medianInput));
    }

    private static String randomWord(Random random, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append((char) ('a' + random.nextInt(8)));
        }
        return sb.toString();
    }

    // Replaces roughly one symbol in ten
    private static String mutate(Random random, String word) {
        StringBuilder sb = new StringBuilder(word);
        for (int i = 0; i < sb.length(); i++) {
            if (random.nextInt(10) == 0) {
                sb.setCharAt(i, (char) ('a' + random.nextInt(8)));
            }
        }
        return sb.toString();
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(EditDistanceBenchmark.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
