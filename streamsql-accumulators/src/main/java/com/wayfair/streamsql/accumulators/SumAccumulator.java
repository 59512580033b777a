/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.accumulators;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

import com.wayfair.streamsql.common.types.DataType;
import com.wayfair.streamsql.common.types.ScalarValue;
import com.wayfair.streamsql.server.api.aggregate.Accumulator;
import com.wayfair.streamsql.server.api.aggregate.AggregateKind;

/**
 * Sums non-null numeric inputs. Integer inputs are summed as Int64, floating point inputs as Float64.
 * Any input of the same numeric family is accepted, so an accumulator created for the sum type
 * (as restored accumulators are) keeps accepting the original inputs.
 */
public class SumAccumulator implements Accumulator {

    private final DataType _dataType;
    private final DataType _sumType;

    private boolean _seen;
    private long _longSum;
    // -0.0 is the additive identity, a sum of negative zeros stays negative
    private double _doubleSum = -0.0;

    public SumAccumulator(final DataType dataType) {
        Preconditions.checkArgument(dataType.isNumeric(), "sum is not defined for %s", dataType);
        _dataType = dataType;
        _sumType = sumType(dataType);
    }

    /**
     * @return the type sums over the given input type are computed in
     */
    public static DataType sumType(final DataType dataType) {
        return dataType.isInteger() ? DataType.INT64 : DataType.FLOAT64;
    }

    @Override
    public AggregateKind kind() {
        return AggregateKind.SUM;
    }

    @Override
    public DataType dataType() {
        return _dataType;
    }

    @Override
    public void update(final List<?> values) {
        for (final Object value : values) {
            Preconditions.checkArgument(value == null || accepts(value), "Value %s does not fit sum of %s", value, _dataType);
        }
        for (final Object value : values) {
            if (value != null) {
                add((Number) value);
            }
        }
    }

    private boolean accepts(final Object value) {
        if (_sumType.equals(DataType.INT64)) {
            return value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long;
        }
        return value instanceof Float || value instanceof Double;
    }

    private void add(final Number value) {
        if (_sumType.equals(DataType.INT64)) {
            _longSum = Math.addExact(_longSum, value.longValue());
        } else {
            _doubleSum += value.doubleValue();
        }
        _seen = true;
    }

    @Override
    public List<ScalarValue> state() {
        return _seen ? Collections.singletonList(evaluate()) : Collections.emptyList();
    }

    @Override
    public void merge(final List<ScalarValue> states) {
        for (final ScalarValue state : states) {
            Preconditions.checkArgument(_sumType.equals(state.getType()),
                    "Cannot merge %s into sum of %s", state.getType(), _sumType);
        }
        for (final ScalarValue state : states) {
            if (!state.isNull()) {
                add((Number) state.getValue());
            }
        }
    }

    @Override
    public ScalarValue evaluate() {
        if (!_seen) {
            return ScalarValue.nullOf(_sumType);
        }
        return _sumType.equals(DataType.INT64) ? ScalarValue.ofInt64(_longSum) : ScalarValue.ofFloat64(_doubleSum);
    }

    @Override
    public String toString() {
        return "SumAccumulator(" + _dataType + ", sum=" + evaluate() + ")";
    }
}
