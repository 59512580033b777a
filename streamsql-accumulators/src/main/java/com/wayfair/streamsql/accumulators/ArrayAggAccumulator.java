/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.accumulators;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

import com.wayfair.streamsql.common.types.DataType;
import com.wayfair.streamsql.common.types.ScalarValue;
import com.wayfair.streamsql.server.api.aggregate.Accumulator;
import com.wayfair.streamsql.server.api.aggregate.AggregateKind;

/**
 * Collects every input value, nulls included, into a list.
 * The state is a single list value holding everything collected so far.
 */
public class ArrayAggAccumulator implements Accumulator {

    private final DataType _dataType;
    private final DataType _listType;
    private final List<ScalarValue> _values = new ArrayList<>();

    public ArrayAggAccumulator(final DataType dataType) {
        _dataType = Preconditions.checkNotNull(dataType, "dataType");
        _listType = DataType.list(dataType);
    }

    @Override
    public AggregateKind kind() {
        return AggregateKind.ARRAY_AGG;
    }

    @Override
    public DataType dataType() {
        return _dataType;
    }

    @Override
    public void update(final List<?> values) {
        final List<ScalarValue> converted = new ArrayList<>(values.size());
        for (final Object value : values) {
            converted.add(ScalarValue.fromRaw(_dataType, value));
        }
        _values.addAll(converted);
    }

    @Override
    public List<ScalarValue> state() {
        if (_values.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.singletonList(ScalarValue.ofList(_dataType, _values));
    }

    @Override
    public void merge(final List<ScalarValue> states) {
        for (final ScalarValue state : states) {
            Preconditions.checkArgument(_listType.equals(state.getType()),
                    "Cannot merge %s into array_agg of %s", state.getType(), _dataType);
        }
        for (final ScalarValue state : states) {
            if (!state.isNull()) {
                _values.addAll(state.getList());
            }
        }
    }

    @Override
    public ScalarValue evaluate() {
        return _values.isEmpty() ? ScalarValue.nullOf(_listType) : ScalarValue.ofList(_dataType, _values);
    }

    @Override
    public String toString() {
        return "ArrayAggAccumulator(" + _dataType + ", values=" + _values.size() + ")";
    }
}
