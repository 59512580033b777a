/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.accumulators;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;

import com.wayfair.streamsql.common.types.DataType;
import com.wayfair.streamsql.common.types.ScalarValue;
import com.wayfair.streamsql.server.api.aggregate.Accumulator;
import com.wayfair.streamsql.server.api.aggregate.AggregateKind;

/**
 * Keeps the smallest or the largest non-null input. Floating point values are ordered like
 * {@link Double#compare(double, double)}.
 */
public class MinMaxAccumulator implements Accumulator {

    private static final Set<DataType.TypeId> ORDERABLE_TYPES = EnumSet.of(
            DataType.TypeId.BOOLEAN,
            DataType.TypeId.INT8,
            DataType.TypeId.INT16,
            DataType.TypeId.INT32,
            DataType.TypeId.INT64,
            DataType.TypeId.FLOAT32,
            DataType.TypeId.FLOAT64,
            DataType.TypeId.UTF8);

    private final AggregateKind _kind;
    private final DataType _dataType;
    private ScalarValue _current;

    public MinMaxAccumulator(final AggregateKind kind, final DataType dataType) {
        Preconditions.checkArgument(kind == AggregateKind.MIN || kind == AggregateKind.MAX, "Not min or max: %s", kind);
        Preconditions.checkArgument(ORDERABLE_TYPES.contains(dataType.getTypeId()), "%s is not defined for %s",
                kind.getFunctionName(), dataType);
        _kind = kind;
        _dataType = dataType;
    }

    @Override
    public AggregateKind kind() {
        return _kind;
    }

    @Override
    public DataType dataType() {
        return _dataType;
    }

    @Override
    public void update(final List<?> values) {
        for (final Object value : values) {
            Preconditions.checkArgument(_dataType.accepts(value), "Value %s does not fit %s", value, _dataType);
        }
        for (final Object value : values) {
            if (value != null) {
                fold(ScalarValue.fromRaw(_dataType, value));
            }
        }
    }

    private void fold(final ScalarValue candidate) {
        if (_current == null) {
            _current = candidate;
            return;
        }
        final int cmp = compare(candidate.getValue(), _current.getValue());
        if ((_kind == AggregateKind.MIN && cmp < 0) || (_kind == AggregateKind.MAX && cmp > 0)) {
            _current = candidate;
        }
    }

    private int compare(final Object left, final Object right) {
        switch (_dataType.getTypeId()) {
            case BOOLEAN:
                return Boolean.compare((Boolean) left, (Boolean) right);
            case INT8:
            case INT16:
            case INT32:
            case INT64:
                return Long.compare(((Number) left).longValue(), ((Number) right).longValue());
            case FLOAT32:
            case FLOAT64:
                return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
            case UTF8:
                return ((String) left).compareTo((String) right);
            default:
                throw new IllegalStateException("Unsupported type: " + _dataType);
        }
    }

    @Override
    public List<ScalarValue> state() {
        return _current == null ? Collections.emptyList() : Collections.singletonList(_current);
    }

    @Override
    public void merge(final List<ScalarValue> states) {
        for (final ScalarValue state : states) {
            Preconditions.checkArgument(_dataType.equals(state.getType()),
                    "Cannot merge %s into %s of %s", state.getType(), _kind.getFunctionName(), _dataType);
        }
        for (final ScalarValue state : states) {
            if (!state.isNull()) {
                fold(state);
            }
        }
    }

    @Override
    public ScalarValue evaluate() {
        return _current == null ? ScalarValue.nullOf(_dataType) : _current;
    }

    @Override
    public String toString() {
        return "MinMaxAccumulator(" + _kind + ", " + _dataType + ", current=" + _current + ")";
    }
}
