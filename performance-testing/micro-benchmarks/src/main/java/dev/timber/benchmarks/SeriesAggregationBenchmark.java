/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.benchmarks;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import dev.timber.series.Series;

/**
 * Whole-series aggregations over a long arange.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms512m", "-Xmx512m" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class SeriesAggregationBenchmark {

    @Param({ "10000", "1000000" })
    private int size;

    private Series<Long> series;

    @Setup
    public void setup() {
        series = Series.arange(0L, size);
    }

    @Benchmark
    public void sum(Blackhole blackhole) {
        blackhole.consume(series.sum());
    }

    @Benchmark
    public void min(Blackhole blackhole) {
        blackhole.consume(series.min());
    }

    @Benchmark
    public void max(Blackhole blackhole) {
        blackhole.consume(series.max());
    }

    @Benchmark
    public void mean(Blackhole blackhole) {
        blackhole.consume(series.mean());
    }

    @Benchmark
    public void median(Blackhole blackhole) {
        blackhole.consume(series.median());
    }
}
