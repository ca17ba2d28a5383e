/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.internal.compression;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Selects the stream codec for a file by its name alone: a {@code .gz} suffix,
 * in any case, selects GZIP, everything else is read and written as is.
 * File contents are never inspected.
 */
public final class StreamCodecFactory {

    private static final Logger LOG = System.getLogger(StreamCodecFactory.class.getName());

    private static final String GZIP_SUFFIX = ".gz";

    private StreamCodecFactory() {
    }

    /**
     * Get the codec for the given file.
     */
    public static StreamCodec forPath(Path path) {
        Path fileName = path.getFileName();
        if (fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(GZIP_SUFFIX)) {
            return new GzipStreamCodec();
        }
        return new UncompressedStreamCodec();
    }

    /**
     * Open a file for reading through the codec its name selects.
     */
    public static InputStream openInput(Path path) throws IOException {
        StreamCodec codec = forPath(path);
        LOG.log(Level.DEBUG, "Reading ''{0}'' with codec {1}", path, codec.getName());
        InputStream raw = new BufferedInputStream(Files.newInputStream(path));
        try {
            return codec.wrapInput(raw);
        }
        catch (IOException e) {
            try {
                raw.close();
            }
            catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    /**
     * Create or truncate a file for writing through the codec its name selects.
     */
    public static OutputStream openOutput(Path path) throws IOException {
        StreamCodec codec = forPath(path);
        LOG.log(Level.DEBUG, "Writing ''{0}'' with codec {1}", path, codec.getName());
        OutputStream raw = new BufferedOutputStream(Files.newOutputStream(path));
        try {
            return codec.wrapOutput(raw);
        }
        catch (IOException e) {
            try {
                raw.close();
            }
            catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }
}
