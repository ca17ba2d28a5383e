/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import dev.timber.TimberContext;
import dev.timber.frame.DataFrame;
import dev.timber.internal.ParallelTasks;
import dev.timber.internal.compression.StreamCodecFactory;
import dev.timber.internal.csv.CsvRecordWriter;

/**
 * Writes a {@link DataFrame} as delimited text, one record per row.
 *
 * <pre>{@code
 * CsvWriter.of(Path.of("out.csv.gz")).write(frame);  // GZIP inferred from the name
 * }</pre>
 *
 * <p>Values are written in their text form. A header record with the column
 * names comes first unless the options say otherwise; supplied header names
 * are ignored.</p>
 */
public final class CsvWriter {

    private static final System.Logger LOG = System.getLogger(CsvWriter.class.getName());

    private final Path path;
    private final CsvOptions options;
    private final TimberContext context;

    private CsvWriter(Path path, CsvOptions options, TimberContext context) {
        this.path = path;
        this.options = options;
        this.context = context;
    }

    /**
     * Create a writer with default options.
     */
    public static CsvWriter of(Path path) {
        return new CsvWriter(path, CsvOptions.defaults(), null);
    }

    public CsvWriter withOptions(CsvOptions options) {
        return new CsvWriter(path, options, context);
    }

    /**
     * Use a shared context. The context is NOT closed by this writer.
     */
    public CsvWriter withContext(TimberContext context) {
        return new CsvWriter(path, options, context);
    }

    /**
     * Write the frame, creating or truncating the file.
     *
     * @throws IOException if the file cannot be written
     */
    public void write(DataFrame frame) throws IOException {
        List<String> names = frame.columns();
        List<List<String>> columns = formatColumns(frame, names);

        try (Writer out = new BufferedWriter(new OutputStreamWriter(StreamCodecFactory.openOutput(path), StandardCharsets.UTF_8))) {
            CsvRecordWriter records = new CsvRecordWriter(out, options.delimiter(), options.quote(), options.terminator());
            if (options.hasHeaders() && !names.isEmpty()) {
                records.writeRecord(names);
            }
            List<String> row = new ArrayList<>(names.size());
            for (int rowIndex = 0; rowIndex < frame.size(); rowIndex++) {
                row.clear();
                for (List<String> column : columns) {
                    row.add(column.get(rowIndex));
                }
                records.writeRecord(row);
            }
        }

        LOG.log(System.Logger.Level.DEBUG, "Wrote {0} rows and {1} columns to ''{2}''", frame.size(), names.size(), path);
    }

    private List<List<String>> formatColumns(DataFrame frame, List<String> names) {
        List<Supplier<List<String>>> tasks = new ArrayList<>(names.size());
        for (String name : names) {
            tasks.add(() -> frame.column(name).toStrings());
        }
        if (tasks.isEmpty()) {
            return List.of();
        }
        if (context != null) {
            return ParallelTasks.invokeAll(tasks, context);
        }
        try (TimberContext owned = TimberContext.create(Math.min(tasks.size(), Runtime.getRuntime().availableProcessors()))) {
            return ParallelTasks.invokeAll(tasks, owned);
        }
    }
}
