/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.frame;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

import dev.timber.error.ColumnNotFoundException;
import dev.timber.error.LengthMismatchException;
import dev.timber.error.ValueException;
import dev.timber.internal.Positions;
import dev.timber.internal.frame.RowView;
import dev.timber.metadata.SeriesMeta;
import dev.timber.row.Row;
import dev.timber.series.ElementType;
import dev.timber.series.ElementTypes;
import dev.timber.series.Series;

/**
 * A named collection of equal-length columns of possibly different element types
 * sharing one row index.
 *
 * <pre>{@code
 * DataFrame frame = new DataFrame();
 * frame.addColumn(Series.arange(0, 3).named("id"));
 * frame.addColumn(Series.of("a", "b", "c").named("label"));
 *
 * Series<Integer> ids = frame.getColumn("id", ElementTypes.INT32);
 * for (Row row : frame) {
 *     String label = row.getString("label");
 * }
 * }</pre>
 *
 * <p>The first column added fixes the frame length and creates the index
 * {@code 0..length-1}. The frame owns copies of the series added to it.
 * Instances are not thread-safe.</p>
 */
public class DataFrame implements Iterable<Row> {

    private static final System.Logger LOG = System.getLogger(DataFrame.class.getName());

    private final List<SeriesMeta> registry = new ArrayList<>();
    private final Map<String, AnyColumn> store = new HashMap<>();
    private Series<Long> index = Series.empty(ElementTypes.INT64);

    // ==================== Columns ====================

    /**
     * Add a copy of the series as the last column. An unnamed series is named
     * {@code col_N} where N is the current number of columns.
     *
     * An empty series whose element type is still unknown is added as a TEXT column.
     *
     * @throws LengthMismatchException if the frame has columns of a different length
     * @throws ValueException if the name is already taken
     */
    public void addColumn(Series<?> series) {
        if (!registry.isEmpty() && series.size() != size()) {
            throw new LengthMismatchException("Column " + series.name(), size(), series.size());
        }
        Series<?> column = series.dtype() == null
                ? Series.empty(ElementTypes.TEXT).named(series.name())
                : series.copy();
        if (column.name() == null) {
            column.setName("col_" + registry.size());
        }
        if (store.containsKey(column.name())) {
            throw new ValueException("Column already exists: " + column.name());
        }
        AnyColumn wrapped = AnyColumn.of(column);
        if (registry.isEmpty()) {
            index = Series.arange(0L, column.size()).named("index");
        }
        store.put(column.name(), wrapped);
        registry.add(metaOf(column));
    }

    /**
     * Get a column by name with its element type.
     * Consult {@link #meta(String)} first when the type is not known.
     * The returned series is a read-only view of the frame's column.
     *
     * @throws ColumnNotFoundException if there is no such column
     * @throws IllegalArgumentException if the column holds another element type
     */
    @SuppressWarnings("unchecked")
    public <T> Series<T> getColumn(String name, ElementType<T> type) {
        AnyColumn column = column(name);
        if (column.dtype() != type.dtype()) {
            throw new IllegalArgumentException("Column " + name + " is " + column.dtype() + ", not " + type.dtype());
        }
        return (Series<T>) column.series();
    }

    /**
     * Get a column by name without knowing its element type.
     *
     * @throws ColumnNotFoundException if there is no such column
     */
    public AnyColumn column(String name) {
        return AnyColumn.of(owned(name).unmodifiableView());
    }

    private Series<?> owned(String name) {
        AnyColumn column = store.get(name);
        if (column == null) {
            throw new ColumnNotFoundException(name);
        }
        return column.series();
    }

    public boolean hasColumn(String name) {
        return store.containsKey(name);
    }

    /**
     * @throws ColumnNotFoundException if there is no such column
     */
    public SeriesMeta meta(String name) {
        for (SeriesMeta meta : registry) {
            if (meta.name().equals(name)) {
                return meta;
            }
        }
        throw new ColumnNotFoundException(name);
    }

    /**
     * Column metadata in insertion order.
     */
    public List<SeriesMeta> metas() {
        return Collections.unmodifiableList(registry);
    }

    /**
     * Column names in insertion order.
     */
    public List<String> columns() {
        List<String> names = new ArrayList<>(registry.size());
        for (SeriesMeta meta : registry) {
            names.add(meta.name());
        }
        return names;
    }

    public int nColumns() {
        return registry.size();
    }

    /**
     * Number of rows.
     */
    public int size() {
        return index.size();
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }

    /**
     * Copy of the row index.
     */
    public Series<Long> index() {
        return index.copy();
    }

    /**
     * Index value of the row at a position.
     *
     * @throws IndexOutOfBoundsException if the position is outside the frame
     */
    public long indexAt(int position) {
        return index.get(position);
    }

    // ==================== Rows ====================

    /**
     * Remove the given row positions from every column and the index.
     * All positions are validated before anything is removed.
     *
     * @throws IndexOutOfBoundsException if a position is outside the frame
     */
    public void dropPositions(Collection<Integer> positions) {
        TreeSet<Integer> sorted = Positions.validate(positions, size());
        if (sorted.isEmpty()) {
            return;
        }
        for (int i = 0; i < registry.size(); i++) {
            SeriesMeta meta = registry.get(i);
            Series<?> series = owned(meta.name());
            series.dropPositions(sorted);
            registry.set(i, new SeriesMeta(meta.name(), series.size(), meta.dtype()));
        }
        index.dropPositions(sorted);
        LOG.log(System.Logger.Level.DEBUG, "Dropped {0} rows, {1} remaining", sorted.size(), size());
    }

    /**
     * Remove the rows with the given index values.
     *
     * @throws ValueException if a value is not in the index; nothing is removed in that case
     */
    public void dropIndices(Collection<Long> indexValues) {
        dropPositions(positionsOf(indexValues));
    }

    /**
     * Row views for the given index values, in the order requested.
     *
     * @throws ValueException if a value is not in the index
     */
    public List<Row> loc(Collection<Long> indexValues) {
        List<Row> rows = new ArrayList<>(indexValues.size());
        for (int position : positionsOf(indexValues)) {
            rows.add(new RowView(this, position));
        }
        return rows;
    }

    private List<Integer> positionsOf(Collection<Long> indexValues) {
        Map<Long, Integer> positions = new HashMap<>();
        for (int i = 0; i < index.size(); i++) {
            positions.put(index.get(i), i);
        }
        List<Integer> selected = new ArrayList<>(indexValues.size());
        for (Long value : indexValues) {
            Integer position = positions.get(value);
            if (position == null) {
                throw new ValueException("Index value not found: " + value);
            }
            selected.add(position);
        }
        return selected;
    }

    /**
     * Read-only view of the row at a position.
     *
     * @throws IndexOutOfBoundsException if the position is outside the frame
     */
    public Row row(int position) {
        return new RowView(this, Objects.checkIndex(position, size()));
    }

    /**
     * Row views, one per position, created on access.
     */
    public List<Row> rows() {
        return new AbstractList<>() {
            @Override
            public Row get(int position) {
                return row(position);
            }

            @Override
            public int size() {
                return DataFrame.this.size();
            }
        };
    }

    @Override
    public Iterator<Row> iterator() {
        return rows().iterator();
    }

    // ==================== Grouping ====================

    /**
     * Split every column by a parallel key series.
     *
     * @throws LengthMismatchException if the keys have a different length than the frame
     */
    public DataFrameGroupBy groupby(Series<?> keys) {
        if (!registry.isEmpty() && keys.size() != size()) {
            throw new LengthMismatchException("Group keys", size(), keys.size());
        }
        return DataFrameGroupBy.split(this, keys);
    }

    // ==================== Snapshots ====================

    /**
     * Encode the index and every column as one binary snapshot.
     */
    public byte[] toSnapshot() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            writeChunk(out, index.encode());
            out.writeInt(registry.size());
            for (SeriesMeta meta : registry) {
                writeChunk(out, owned(meta.name()).encode());
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    /**
     * Rebuild a frame from {@link #toSnapshot()} output.
     *
     * @throws ValueException if the snapshot is truncated or corrupt
     */
    @SuppressWarnings("unchecked")
    public static DataFrame fromSnapshot(byte[] snapshot) {
        DataFrame frame = new DataFrame();
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(snapshot))) {
            Series<?> index = Series.decode(readChunk(in));
            if (index.dtype() != ElementTypes.INT64.dtype()) {
                throw new ValueException("Corrupt frame snapshot: index is " + index.dtype());
            }
            int columns = in.readInt();
            for (int i = 0; i < columns; i++) {
                frame.addColumn(Series.decode(readChunk(in)));
            }
            if (columns > 0) {
                if (index.size() != frame.size()) {
                    throw new LengthMismatchException("Frame snapshot index", frame.size(), index.size());
                }
                frame.index = (Series<Long>) index;
            }
        }
        catch (IOException e) {
            throw new ValueException("Truncated frame snapshot", e);
        }
        return frame;
    }

    private static void writeChunk(DataOutputStream out, byte[] chunk) throws IOException {
        out.writeInt(chunk.length);
        out.write(chunk);
    }

    private static byte[] readChunk(DataInputStream in) throws IOException {
        int length = in.readInt();
        if (length < 0) {
            throw new ValueException("Corrupt frame snapshot: negative chunk length " + length);
        }
        byte[] chunk = in.readNBytes(length);
        if (chunk.length != length) {
            throw new ValueException("Truncated frame snapshot");
        }
        return chunk;
    }

    private static SeriesMeta metaOf(Series<?> series) {
        return new SeriesMeta(series.name(), series.size(), series.dtype());
    }

    @Override
    public String toString() {
        return "DataFrame(" + size() + " rows, columns=" + registry + ")";
    }
}
