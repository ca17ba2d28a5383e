/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.internal.frame;

import java.util.List;

import dev.timber.frame.AnyColumn;
import dev.timber.frame.DataFrame;
import dev.timber.row.Datum;
import dev.timber.row.Row;
import dev.timber.series.ElementTypes;

/**
 * {@link Row} implementation reading through to the frame's columns.
 */
public final class RowView implements Row {

    private final DataFrame frame;
    private final int position;

    public RowView(DataFrame frame, int position) {
        this.frame = frame;
        this.position = position;
    }

    @Override
    public int position() {
        return position;
    }

    @Override
    public long index() {
        return frame.indexAt(position);
    }

    @Override
    public List<String> columns() {
        return frame.columns();
    }

    @Override
    public Datum get(String name) {
        AnyColumn column = frame.column(name);
        return new Datum(name, column.dtype(), column.getValue(position));
    }

    @Override
    public Object getValue(String name) {
        return frame.column(name).getValue(position);
    }

    @Override
    public long getLong(String name) {
        return frame.getColumn(name, ElementTypes.INT64).get(position);
    }

    @Override
    public int getInt(String name) {
        return frame.getColumn(name, ElementTypes.INT32).get(position);
    }

    @Override
    public double getDouble(String name) {
        return frame.getColumn(name, ElementTypes.FLOAT64).get(position);
    }

    @Override
    public float getFloat(String name) {
        return frame.getColumn(name, ElementTypes.FLOAT32).get(position);
    }

    @Override
    public String getString(String name) {
        return frame.getColumn(name, ElementTypes.TEXT).get(position);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Row(").append(position).append(")[");
        List<String> columns = frame.columns();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(columns.get(i)).append('=').append(getValue(columns.get(i)));
        }
        return sb.append(']').toString();
    }
}
