/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.io;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.timber.frame.DataFrame;
import dev.timber.metadata.DType;
import dev.timber.series.ElementTypes;
import dev.timber.series.Series;

import static org.assertj.core.api.Assertions.assertThat;

public class CsvWriterTest {

    @TempDir
    Path tempDir;

    private static DataFrame people() {
        DataFrame frame = new DataFrame();
        frame.addColumn(Series.of(1L, 2L, 3L).named("id"));
        frame.addColumn(Series.of("Ada", "Smith, John", "O\"Neil").named("name"));
        frame.addColumn(Series.of(1.5, -2.0, 1e-3).named("score"));
        return frame;
    }

    @Test
    void testWriteQuotesWhereNeeded() throws Exception {
        Path file = tempDir.resolve("people.csv");

        CsvWriter.of(file).write(people());

        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(
                "id,name,score\r\n"
                        + "1,Ada,1.5\r\n"
                        + "2,\"Smith, John\",-2.0\r\n"
                        + "3,\"O\"\"Neil\",0.001\r\n");
    }

    @Test
    void testWriteThenReadGivesSameFrame() throws Exception {
        Path file = tempDir.resolve("people.csv");
        DataFrame frame = people();

        CsvWriter.of(file).write(frame);
        DataFrame read = CsvReader.of(file).read();

        assertThat(read.metas()).isEqualTo(frame.metas());
        for (String column : frame.columns()) {
            assertThat(read.column(column).series().values()).isEqualTo(frame.column(column).series().values());
        }
    }

    @Test
    void testGzipRoundTrip() throws Exception {
        Path file = tempDir.resolve("people.csv.gz");

        CsvWriter.of(file).write(people());
        DataFrame read = CsvReader.of(file).read();

        assertThat(Files.readAllBytes(file)).startsWith((byte) 0x1f, (byte) 0x8b);
        assertThat(read.getColumn("name", ElementTypes.TEXT).values()).containsExactly("Ada", "Smith, John", "O\"Neil");
    }

    @Test
    void testCustomOptionsRoundTrip() throws Exception {
        Path file = tempDir.resolve("people.tsv");
        CsvOptions options = CsvOptions.builder()
                .delimiter('\t')
                .quote('\'')
                .terminator(Terminator.of(';'))
                .build();

        CsvWriter.of(file).withOptions(options).write(people());
        DataFrame read = CsvReader.of(file).withOptions(options).read();

        assertThat(read.size()).isEqualTo(3);
        assertThat(read.getColumn("score", ElementTypes.FLOAT64).values()).containsExactly(1.5, -2.0, 1e-3);
    }

    @Test
    void testWriteWithoutHeaders() throws Exception {
        Path file = tempDir.resolve("no_header.csv");
        CsvOptions options = CsvOptions.builder().hasHeaders(false).build();

        CsvWriter.of(file).withOptions(options).write(people());

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo("1,Ada,1.5");
    }

    @Test
    void testSingleEmptyFieldSurvivesRoundTrip() throws Exception {
        Path file = tempDir.resolve("blank.csv");
        DataFrame frame = new DataFrame();
        frame.addColumn(Series.of("x", "", "y").named("only"));

        CsvWriter.of(file).write(frame);
        DataFrame read = CsvReader.of(file).read();

        assertThat(read.meta("only").dtype()).isEqualTo(DType.TEXT);
        assertThat(read.getColumn("only", ElementTypes.TEXT).values()).containsExactly("x", "", "y");
    }

    @Test
    void testIntegerColumnsReadBackAsInt64() throws Exception {
        Path file = tempDir.resolve("ints.csv");
        DataFrame frame = new DataFrame();
        frame.addColumn(Series.arange(0, 3).named("n"));

        CsvWriter.of(file).write(frame);

        assertThat(CsvReader.of(file).read().getColumn("n", ElementTypes.INT64).values()).containsExactly(0L, 1L, 2L);
    }
}
