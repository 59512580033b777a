/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.server.api.aggregate;

import java.util.List;

import com.wayfair.streamsql.common.types.DataType;
import com.wayfair.streamsql.common.types.ScalarValue;

/**
 * An incrementally updated aggregation operator.
 * <p>
 * The state returned by {@link #state()} is everything the accumulator needs to continue: feeding it to
 * {@link #merge(List)} of a fresh accumulator of the same kind and type yields an accumulator that is
 * indistinguishable from this one. Merging the states of accumulators that saw disjoint inputs is the same
 * as updating one accumulator with all of the inputs.
 * <p>
 * Implementations are not thread safe.
 */
public interface Accumulator {

    /**
     * @return the aggregate function this accumulator computes
     */
    AggregateKind kind();

    /**
     * @return the type of the input values
     */
    DataType dataType();

    /**
     * Consume a column of raw input values. Nulls are allowed.
     * @throws IllegalArgumentException if a value does not fit {@link #dataType()}
     */
    void update(List<?> values);

    /**
     * Extract the intermediate state.
     */
    List<ScalarValue> state();

    /**
     * Merge the intermediate state of another accumulator of the same kind and type into this one.
     * @throws IllegalArgumentException if the state does not have the expected shape
     */
    void merge(List<ScalarValue> states);

    /**
     * @return the final aggregate value
     */
    ScalarValue evaluate();
}
