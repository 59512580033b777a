/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.accumulators;

import com.google.common.base.Preconditions;

import com.wayfair.streamsql.common.types.DataType;
import com.wayfair.streamsql.common.types.ScalarValue;
import com.wayfair.streamsql.server.api.aggregate.Accumulator;
import com.wayfair.streamsql.server.api.aggregate.AggregateKind;

/**
 * A factory to construct Accumulator instances.
 */
public final class Accumulators {

    private Accumulators() {
    }

    /**
     * Factory method to create an empty Accumulator based on the AggregateKind
     * @param kind the aggregate function
     * @param dataType the input type
     * @return the Accumulator
     * @throws IllegalArgumentException if the function is not defined for the type
     */
    public static Accumulator create(final AggregateKind kind, final DataType dataType) {
        final Accumulator accumulator;
        switch (kind) {
            case ARRAY_AGG:
                accumulator = new ArrayAggAccumulator(dataType);
                break;
            case SUM:
                accumulator = new SumAccumulator(dataType);
                break;
            case MIN:
            case MAX:
                accumulator = new MinMaxAccumulator(kind, dataType);
                break;
            default:
                throw new IllegalStateException("Unsupported AggregateKind: " + kind);
        }
        return accumulator;
    }

    /**
     * Infer the input type of the accumulator a state element was extracted from.
     * @param kind the aggregate function
     * @param state one element of the accumulator state
     * @throws IllegalArgumentException if the state element cannot come from an accumulator of that kind
     */
    public static DataType inferDataType(final AggregateKind kind, final ScalarValue state) {
        final DataType stateType = state.getType();
        switch (kind) {
            case ARRAY_AGG:
                Preconditions.checkArgument(stateType.isList(), "array_agg state must be a list, got %s", stateType);
                return stateType.getElementType();
            case SUM:
            case MIN:
            case MAX:
                return stateType;
            default:
                throw new IllegalStateException("Unsupported AggregateKind: " + kind);
        }
    }
}
