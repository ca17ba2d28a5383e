/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.internal.csv;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import dev.timber.io.Terminator;

/**
 * Splits delimited text into records of fields.
 * <p>
 * A field starting with the quote character extends to the matching closing
 * quote and may contain delimiters, terminators and doubled quotes, which
 * stand for one quote. Empty lines are skipped. An unterminated quoted field
 * runs to the end of input.
 * </p>
 */
public final class CsvTokenizer {

    private static final int NONE = -2;

    private final Reader in;
    private final char delimiter;
    private final char quote;
    private final Terminator terminator;

    private int pending = NONE;
    private long recordCount;

    public CsvTokenizer(Reader in, char delimiter, char quote, Terminator terminator) {
        this.in = in;
        this.delimiter = delimiter;
        this.quote = quote;
        this.terminator = terminator;
    }

    /**
     * Read the next record.
     *
     * @return the fields of the record, or null at the end of input
     */
    public List<String> nextRecord() throws IOException {
        int c = read();
        while (c != -1 && isTerminator(c)) {
            skipLineFeedAfter(c);
            c = read();
        }
        if (c == -1) {
            return null;
        }

        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean fieldStart = true;
        boolean inQuotes = false;
        while (true) {
            if (inQuotes) {
                if (c == -1) {
                    return finish(fields, field);
                }
                if (c == quote) {
                    int next = read();
                    if (next == quote) {
                        field.append(quote);
                        c = read();
                    }
                    else {
                        inQuotes = false;
                        c = next;
                    }
                    continue;
                }
                field.append((char) c);
                c = read();
                continue;
            }
            if (c == -1 || isTerminator(c)) {
                if (c != -1) {
                    skipLineFeedAfter(c);
                }
                return finish(fields, field);
            }
            if (c == delimiter) {
                fields.add(field.toString());
                field.setLength(0);
                fieldStart = true;
            }
            else if (c == quote && fieldStart) {
                inQuotes = true;
                fieldStart = false;
            }
            else {
                field.append((char) c);
                fieldStart = false;
            }
            c = read();
        }
    }

    /**
     * Number of records returned so far.
     */
    public long recordCount() {
        return recordCount;
    }

    private List<String> finish(List<String> fields, StringBuilder field) {
        fields.add(field.toString());
        recordCount++;
        return fields;
    }

    private boolean isTerminator(int c) {
        if (terminator.isAny()) {
            return c == '\r' || c == '\n';
        }
        return c == terminator.custom();
    }

    // CRLF counts as one terminator
    private void skipLineFeedAfter(int c) throws IOException {
        if (terminator.isAny() && c == '\r') {
            int next = read();
            if (next != '\n') {
                pending = next;
            }
        }
    }

    private int read() throws IOException {
        if (pending != NONE) {
            int c = pending;
            pending = NONE;
            return c;
        }
        return in.read();
    }
}
