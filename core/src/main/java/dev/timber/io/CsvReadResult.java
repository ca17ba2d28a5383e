/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.io;

import dev.timber.frame.DataFrame;

/**
 * Frame read by {@link CsvReader#readWithReport()} and the number of
 * records skipped because their field count did not match the header.
 */
public record CsvReadResult(DataFrame frame, int skippedRows) {
}
