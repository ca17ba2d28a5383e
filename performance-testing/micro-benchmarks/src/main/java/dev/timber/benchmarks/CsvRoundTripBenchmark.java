/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.benchmarks;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
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
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import dev.timber.TimberContext;
import dev.timber.frame.DataFrame;
import dev.timber.io.CsvReader;
import dev.timber.io.CsvWriter;
import dev.timber.series.Series;

/**
 * Reads and writes a generated frame of numeric and text columns, plain and gzipped.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms1g", "-Xmx1g" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class CsvRoundTripBenchmark {

    @Param({ "100000" })
    private int rows;

    @Param({ "csv", "csv.gz" })
    private String extension;

    private Path dir;
    private Path input;
    private Path output;
    private DataFrame frame;
    private TimberContext context;

    @Setup
    public void setup() throws IOException {
        dir = Files.createTempDirectory("timber-bench");
        input = dir.resolve("input." + extension);
        output = dir.resolve("output." + extension);
        context = TimberContext.create();

        List<String> labels = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            labels.add("label-" + (i % 97));
        }
        frame = new DataFrame();
        frame.addColumn(Series.arange(0L, rows).named("id"));
        frame.addColumn(Series.arange(0, rows).multiply(0.5).named("value"));
        frame.addColumn(Series.of(labels).named("label"));

        CsvWriter.of(input).withContext(context).write(frame);
    }

    @TearDown
    public void tearDown() throws IOException {
        context.close();
        Files.deleteIfExists(input);
        Files.deleteIfExists(output);
        Files.deleteIfExists(dir);
    }

    @Benchmark
    public void read(Blackhole blackhole) throws IOException {
        blackhole.consume(CsvReader.of(input).withContext(context).read());
    }

    @Benchmark
    public void write() throws IOException {
        CsvWriter.of(output).withContext(context).write(frame);
    }
}
