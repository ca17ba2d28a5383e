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
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GZIP framing using the JDK's streams. Concatenated GZIP members are read as one stream.
 */
public class GzipStreamCodec implements StreamCodec {

    private static final int BUFFER_SIZE = 64 * 1024;

    @Override
    public InputStream wrapInput(InputStream in) throws IOException {
        return new GZIPInputStream(in, BUFFER_SIZE);
    }

    @Override
    public OutputStream wrapOutput(OutputStream out) throws IOException {
        return new GZIPOutputStream(out, BUFFER_SIZE);
    }

    @Override
    public String getName() {
        return "GZIP";
    }
}
