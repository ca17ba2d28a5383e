/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.internal.compression;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Interface for the framing applied to a file stream when reading or writing delimited text.
 */
public interface StreamCodec {

    /**
     * Wrap a raw file stream so that reads return decompressed bytes.
     *
     * @param in the raw stream, closed when the returned stream is closed
     * @return the decompressing stream
     * @throws IOException if the stream header is invalid
     */
    InputStream wrapInput(InputStream in) throws IOException;

    /**
     * Wrap a raw file stream so that writes are compressed.
     *
     * @param out the raw stream, closed when the returned stream is closed
     * @return the compressing stream
     * @throws IOException if the stream header cannot be written
     */
    OutputStream wrapOutput(OutputStream out) throws IOException;

    /**
     * Get the name of this codec.
     */
    String getName();
}
