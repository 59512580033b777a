/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.common.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * An immutable, columnar chunk of rows sharing one {@link Schema}. A batch may have zero rows.
 * Cells hold raw java values (see {@link DataType#accepts(Object)}), null for null cells.
 */
public final class RowBatch {
    private final Schema _schema;
    private final List<List<Object>> _columns;
    private final int _numRows;

    /**
     * Constructor.
     * @param schema the schema of the batch
     * @param columns one column per schema field, all of the same length
     * @throws IllegalArgumentException if the columns do not match the schema
     */
    public RowBatch(final Schema schema, final List<? extends List<?>> columns) {
        Preconditions.checkNotNull(schema, "schema");
        Preconditions.checkArgument(columns.size() == schema.size(),
                "Expected %s columns but got %s", schema.size(), columns.size());
        final List<List<Object>> copy = new ArrayList<>(columns.size());
        int numRows = -1;
        for (int i = 0; i < columns.size(); i++) {
            final Field field = schema.getField(i);
            final List<?> column = columns.get(i);
            if (numRows < 0) {
                numRows = column.size();
            }
            Preconditions.checkArgument(column.size() == numRows,
                    "Column %s has %s rows, expected %s", field.getName(), column.size(), numRows);
            for (final Object value : column) {
                Preconditions.checkArgument(field.getType().accepts(value),
                        "Value %s does not fit column %s", value, field);
                Preconditions.checkArgument(value != null || field.isNullable(),
                        "Null value in non-nullable column %s", field.getName());
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(column)));
        }
        _schema = schema;
        _columns = Collections.unmodifiableList(copy);
        _numRows = Math.max(numRows, 0);
    }

    /**
     * Create a batch without rows.
     */
    public static RowBatch empty(final Schema schema) {
        final List<List<Object>> columns = new ArrayList<>();
        for (int i = 0; i < schema.size(); i++) {
            columns.add(Collections.emptyList());
        }
        return new RowBatch(schema, columns);
    }

    public Schema getSchema() {
        return _schema;
    }

    public int getNumRows() {
        return _numRows;
    }

    public boolean isEmpty() {
        return _numRows == 0;
    }

    public List<Object> getColumn(final int index) {
        return _columns.get(index);
    }

    /**
     * @throws IllegalArgumentException if the schema has no such column
     */
    public List<Object> getColumn(final String name) {
        final int index = _schema.indexOf(name);
        Preconditions.checkArgument(index >= 0, "No column named %s", name);
        return _columns.get(index);
    }

    public Object getValue(final int row, final int column) {
        return _columns.get(column).get(row);
    }

    @Override
    public String toString() {
        return "RowBatch(rows=" + _numRows + ", " + _schema + ")";
    }

    /**
     * Builder that collects a batch row by row.
     */
    public static class Builder {
        private final Schema _schema;
        private final List<List<Object>> _columns = new ArrayList<>();

        public Builder(final Schema schema) {
            _schema = schema;
            for (int i = 0; i < schema.size(); i++) {
                _columns.add(new ArrayList<>());
            }
        }

        /**
         * Append a row; values are given in schema order.
         */
        public Builder addRow(final Object... values) {
            Preconditions.checkArgument(values.length == _schema.size(),
                    "Expected %s values but got %s", _schema.size(), values.length);
            for (int i = 0; i < values.length; i++) {
                _columns.get(i).add(values[i]);
            }
            return this;
        }

        public RowBatch build() {
            return new RowBatch(_schema, _columns);
        }
    }
}
