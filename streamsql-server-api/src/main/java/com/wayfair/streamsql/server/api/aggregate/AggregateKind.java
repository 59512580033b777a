/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.server.api.aggregate;

import java.util.Optional;

/**
 * An enumeration of aggregate functions whose accumulators can be checkpointed.
 */
public enum AggregateKind {
    ARRAY_AGG("array_agg"),
    SUM("sum"),
    MIN("min"),
    MAX("max");

    private final String _functionName;

    AggregateKind(final String functionName) {
        this._functionName = functionName;
    }

    public String getFunctionName() {
        return _functionName;
    }

    /**
     * Look up a kind by its SQL function name.
     */
    public static Optional<AggregateKind> fromFunctionName(final String functionName) {
        for (final AggregateKind kind : values()) {
            if (kind._functionName.equalsIgnoreCase(functionName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
