/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.internal.serialization;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import dev.timber.error.ValueException;
import dev.timber.metadata.DType;
import dev.timber.series.ElementTypes;
import dev.timber.series.Series;

/**
 * Binary snapshot of a single series.
 * <p>
 * Layout, all multi-byte values big-endian:
 * </p>
 * <pre>
 * boolean  named
 * UTF      name            (only if named)
 * byte     dtype tag
 * int      length
 * payload  length values   (8 bytes for FLOAT64 and INT64, 4 bytes for FLOAT32 and INT32,
 *                           int byte count plus UTF-8 bytes for TEXT)
 * </pre>
 * <p>
 * The format is a cache format and carries no version.
 * </p>
 */
public final class SeriesCodec {

    private SeriesCodec() {
    }

    public static byte[] encode(Series<?> series) {
        DType dtype = series.dtype();
        if (dtype == null) {
            throw new ValueException("Cannot encode series " + series.name() + " of unknown dtype");
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(16 + series.size() * 8);
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeBoolean(series.name() != null);
            if (series.name() != null) {
                out.writeUTF(series.name());
            }
            out.writeByte(dtype.getTag());
            out.writeInt(series.size());
            for (Object value : series) {
                writeValue(out, dtype, value);
            }
        }
        catch (IOException e) {
            // ByteArrayOutputStream does not fail
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    /**
     * Decode a snapshot, selecting the payload layout by its dtype tag.
     *
     * @throws ValueException if the snapshot is truncated or corrupt
     */
    public static Series<?> decode(byte[] snapshot) {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(snapshot))) {
            String name = in.readBoolean() ? in.readUTF() : null;
            DType dtype = DType.fromTag(in.readByte());
            int length = in.readInt();
            if (length < 0) {
                throw new ValueException("Corrupt series snapshot: negative length " + length);
            }
            Series<?> series = switch (dtype) {
                case FLOAT64 -> Series.of(ElementTypes.FLOAT64, readDoubles(in, length));
                case INT64 -> Series.of(ElementTypes.INT64, readLongs(in, length));
                case FLOAT32 -> Series.of(ElementTypes.FLOAT32, readFloats(in, length));
                case INT32 -> Series.of(ElementTypes.INT32, readInts(in, length));
                case TEXT -> Series.of(ElementTypes.TEXT, readStrings(in, length));
            };
            series.setName(name);
            return series;
        }
        catch (IllegalArgumentException e) {
            throw new ValueException("Corrupt series snapshot", e);
        }
        catch (IOException e) {
            throw new ValueException("Truncated series snapshot", e);
        }
    }

    private static void writeValue(DataOutputStream out, DType dtype, Object value) throws IOException {
        switch (dtype) {
            case FLOAT64 -> out.writeDouble((Double) value);
            case INT64 -> out.writeLong((Long) value);
            case FLOAT32 -> out.writeFloat((Float) value);
            case INT32 -> out.writeInt((Integer) value);
            case TEXT -> {
                byte[] utf8 = ((String) value).getBytes(StandardCharsets.UTF_8);
                out.writeInt(utf8.length);
                out.write(utf8);
            }
        }
    }

    private static List<Double> readDoubles(DataInputStream in, int length) throws IOException {
        List<Double> values = new ArrayList<>(Math.min(length, 1 << 16));
        for (int i = 0; i < length; i++) {
            values.add(in.readDouble());
        }
        return values;
    }

    private static List<Long> readLongs(DataInputStream in, int length) throws IOException {
        List<Long> values = new ArrayList<>(Math.min(length, 1 << 16));
        for (int i = 0; i < length; i++) {
            values.add(in.readLong());
        }
        return values;
    }

    private static List<Float> readFloats(DataInputStream in, int length) throws IOException {
        List<Float> values = new ArrayList<>(Math.min(length, 1 << 16));
        for (int i = 0; i < length; i++) {
            values.add(in.readFloat());
        }
        return values;
    }

    private static List<Integer> readInts(DataInputStream in, int length) throws IOException {
        List<Integer> values = new ArrayList<>(Math.min(length, 1 << 16));
        for (int i = 0; i < length; i++) {
            values.add(in.readInt());
        }
        return values;
    }

    private static List<String> readStrings(DataInputStream in, int length) throws IOException {
        List<String> values = new ArrayList<>(Math.min(length, 1 << 16));
        for (int i = 0; i < length; i++) {
            int byteCount = in.readInt();
            if (byteCount < 0) {
                throw new ValueException("Corrupt series snapshot: negative string length " + byteCount);
            }
            byte[] utf8 = in.readNBytes(byteCount);
            if (utf8.length != byteCount) {
                throw new EOFException("Expected " + byteCount + " string bytes but found " + utf8.length);
            }
            values.add(new String(utf8, StandardCharsets.UTF_8));
        }
        return values;
    }
}
