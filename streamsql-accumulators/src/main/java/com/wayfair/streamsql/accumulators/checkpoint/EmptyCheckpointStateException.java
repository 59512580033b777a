/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.accumulators.checkpoint;

import com.wayfair.streamsql.common.StreamSqlRuntimeException;

/**
 * An exception raised when a well formed checkpoint holds no state, so there is nothing to restore
 * an accumulator from. Unlike {@link CheckpointDecodeException} the checkpoint is not corrupt.
 */
public class EmptyCheckpointStateException extends StreamSqlRuntimeException {
    private static final long serialVersionUID = 1;

    public EmptyCheckpointStateException(final String message) {
        super(message);
    }
}
