/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.internal.csv;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

import dev.timber.io.Terminator;

/**
 * Writes records of fields as delimited text.
 * <p>
 * A field is quoted when it contains the delimiter, the quote character, CR
 * or LF, or a custom terminator; quotes inside it are doubled. A record made
 * of a single empty field is written as an empty quoted field so that it is
 * not read back as an empty line.
 * </p>
 */
public final class CsvRecordWriter {

    private final Writer out;
    private final char delimiter;
    private final char quote;
    private final Terminator terminator;
    private final String quoteText;
    private final String escapedQuote;

    public CsvRecordWriter(Writer out, char delimiter, char quote, Terminator terminator) {
        this.out = out;
        this.delimiter = delimiter;
        this.quote = quote;
        this.terminator = terminator;
        this.quoteText = String.valueOf(quote);
        this.escapedQuote = quoteText + quoteText;
    }

    public void writeRecord(List<String> fields) throws IOException {
        if (fields.size() == 1 && fields.get(0).isEmpty()) {
            out.write(escapedQuote);
        }
        else {
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) {
                    out.write(delimiter);
                }
                writeField(fields.get(i));
            }
        }
        out.write(terminator.sequence());
    }

    private void writeField(String field) throws IOException {
        if (!needsQuotes(field)) {
            out.write(field);
            return;
        }
        out.write(quote);
        out.write(field.replace(quoteText, escapedQuote));
        out.write(quote);
    }

    private boolean needsQuotes(String field) {
        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);
            if (c == delimiter || c == quote || c == '\r' || c == '\n') {
                return true;
            }
            if (!terminator.isAny() && c == terminator.custom()) {
                return true;
            }
        }
        return false;
    }
}
