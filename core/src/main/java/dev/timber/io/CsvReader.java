/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.io;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import dev.timber.TimberContext;
import dev.timber.error.HeaderParseException;
import dev.timber.error.ValueException;
import dev.timber.frame.DataFrame;
import dev.timber.internal.ParallelTasks;
import dev.timber.internal.compression.StreamCodecFactory;
import dev.timber.internal.csv.ColumnInference;
import dev.timber.internal.csv.CsvTokenizer;
import dev.timber.series.Series;

/**
 * Reads a delimited text file into a {@link DataFrame}, inferring the element type of each column.
 *
 * <pre>{@code
 * DataFrame frame = CsvReader.of(Path.of("data.csv.gz"))
 *         .withOptions(CsvOptions.builder().delimiter(';').build())
 *         .read();
 * }</pre>
 *
 * <p>Files whose name ends in {@code .gz} are decompressed transparently.
 * Records with a different number of fields than the header are skipped and
 * logged. Column types are inferred on the worker pool of the context passed
 * with {@link #withContext(TimberContext)}, or of a private context that is
 * closed when reading completes.</p>
 */
public final class CsvReader {

    private static final System.Logger LOG = System.getLogger(CsvReader.class.getName());

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final Path path;
    private final CsvOptions options;
    private final TimberContext context;

    private CsvReader(Path path, CsvOptions options, TimberContext context) {
        this.path = path;
        this.options = options;
        this.context = context;
    }

    /**
     * Create a reader with default options.
     */
    public static CsvReader of(Path path) {
        return new CsvReader(path, CsvOptions.defaults(), null);
    }

    public CsvReader withOptions(CsvOptions options) {
        return new CsvReader(path, options, context);
    }

    /**
     * Use a shared context. The context is NOT closed by this reader.
     */
    public CsvReader withContext(TimberContext context) {
        return new CsvReader(path, options, context);
    }

    /**
     * Read the file into a new frame.
     *
     * @throws IOException if the file cannot be read or is not valid UTF-8
     * @throws HeaderParseException if the header record is missing or has duplicate names
     * @throws ValueException if the options declare no header row and supply no column names
     */
    public DataFrame read() throws IOException {
        return readWithReport().frame();
    }

    /**
     * Read the file into a new frame, reporting how many malformed records were skipped.
     *
     * @see #read()
     */
    public CsvReadResult readWithReport() throws IOException {
        List<String> headers;
        List<List<String>> columns;
        int skipped = 0;

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try (Reader in = new InputStreamReader(StreamCodecFactory.openInput(path), decoder)) {
            CsvTokenizer tokenizer = new CsvTokenizer(in, options.delimiter(), options.quote(), options.terminator());
            headers = readHeaders(tokenizer);

            columns = new ArrayList<>(headers.size());
            for (int i = 0; i < headers.size(); i++) {
                columns.add(new ArrayList<>());
            }

            List<String> record;
            while ((record = tokenizer.nextRecord()) != null) {
                if (record.size() != headers.size()) {
                    skipped++;
                    LOG.log(System.Logger.Level.WARNING, "Skipping record {0} of ''{1}'': expected {2} fields but found {3}",
                            tokenizer.recordCount(), path, headers.size(), record.size());
                    continue;
                }
                for (int i = 0; i < record.size(); i++) {
                    columns.get(i).add(record.get(i));
                }
            }
        }

        DataFrame frame = new DataFrame();
        for (Series<?> column : inferColumns(headers, columns)) {
            frame.addColumn(column);
        }

        LOG.log(System.Logger.Level.DEBUG, "Read {0} rows and {1} columns from ''{2}'', skipped {3} records",
                frame.size(), frame.nColumns(), path, skipped);
        return new CsvReadResult(frame, skipped);
    }

    private List<String> readHeaders(CsvTokenizer tokenizer) throws IOException {
        List<String> headers;
        if (options.hasHeaders()) {
            headers = tokenizer.nextRecord();
            if (headers == null) {
                throw new HeaderParseException("No header record in '" + path + "'");
            }
            if (!headers.isEmpty() && !headers.get(0).isEmpty() && headers.get(0).charAt(0) == BYTE_ORDER_MARK) {
                headers.set(0, headers.get(0).substring(1));
            }
        }
        else {
            headers = options.headers();
            if (headers == null) {
                throw new ValueException("Options declare no header row in '" + path + "' but supply no column names");
            }
        }

        Set<String> seen = new HashSet<>();
        for (String header : headers) {
            if (!seen.add(header)) {
                throw new HeaderParseException("Duplicate column name '" + header + "' in '" + path + "'");
            }
        }
        return headers;
    }

    private List<Series<?>> inferColumns(List<String> headers, List<List<String>> columns) {
        List<Supplier<Series<?>>> tasks = new ArrayList<>(headers.size());
        for (int i = 0; i < headers.size(); i++) {
            String name = headers.get(i);
            List<String> raw = columns.get(i);
            tasks.add(() -> ColumnInference.infer(name, raw));
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
