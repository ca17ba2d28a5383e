/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.io;

import java.util.List;

/**
 * Dialect of delimited text read by {@link CsvReader} and written by {@link CsvWriter}.
 *
 * <pre>{@code
 * CsvOptions options = CsvOptions.builder()
 *         .delimiter(';')
 *         .hasHeaders(false)
 *         .headers(List.of("id", "name"))
 *         .build();
 * }</pre>
 */
public final class CsvOptions {

    private static final CsvOptions DEFAULTS = builder().build();

    private final char delimiter;
    private final char quote;
    private final Terminator terminator;
    private final boolean hasHeaders;
    private final List<String> headers;

    private CsvOptions(Builder builder) {
        this.delimiter = builder.delimiter;
        this.quote = builder.quote;
        this.terminator = builder.terminator;
        this.hasHeaders = builder.hasHeaders;
        this.headers = builder.headers;
    }

    /**
     * Comma delimited, double quotes, any line terminator, header row present.
     */
    public static CsvOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public char delimiter() {
        return delimiter;
    }

    public char quote() {
        return quote;
    }

    public Terminator terminator() {
        return terminator;
    }

    public boolean hasHeaders() {
        return hasHeaders;
    }

    /**
     * Column names to use for a source without a header row, or null.
     */
    public List<String> headers() {
        return headers;
    }

    @Override
    public String toString() {
        return "CsvOptions(delimiter=" + (int) delimiter + ", quote=" + (int) quote + ", " + terminator
                + ", hasHeaders=" + hasHeaders + ", headers=" + headers + ")";
    }

    public static final class Builder {

        private char delimiter = ',';
        private char quote = '"';
        private Terminator terminator = Terminator.any();
        private boolean hasHeaders = true;
        private List<String> headers;

        private Builder() {
        }

        /**
         * Set the field delimiter, default is {@code ','}.
         */
        public Builder delimiter(char delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        /**
         * Set the quote character, default is {@code '"'}.
         */
        public Builder quote(char quote) {
            this.quote = quote;
            return this;
        }

        /**
         * Set the record terminator, default accepts any of CR, LF and CRLF.
         */
        public Builder terminator(Terminator terminator) {
            this.terminator = terminator;
            return this;
        }

        /**
         * Whether the first record holds the column names, default is true.
         */
        public Builder hasHeaders(boolean hasHeaders) {
            this.hasHeaders = hasHeaders;
            return this;
        }

        /**
         * Column names for a source without a header row. Ignored when reading a source with one.
         */
        public Builder headers(List<String> headers) {
            this.headers = headers == null ? null : List.copyOf(headers);
            return this;
        }

        /**
         * @throws IllegalArgumentException if the delimiter, quote and terminator are not distinct
         */
        public CsvOptions build() {
            if (delimiter == quote) {
                throw new IllegalArgumentException("Delimiter and quote must differ");
            }
            if (isTerminatorChar(delimiter) || isTerminatorChar(quote)) {
                throw new IllegalArgumentException("Delimiter and quote must not be record terminators");
            }
            return new CsvOptions(this);
        }

        private boolean isTerminatorChar(char c) {
            if (terminator.isAny()) {
                return c == '\r' || c == '\n';
            }
            return c == terminator.custom();
        }
    }
}
