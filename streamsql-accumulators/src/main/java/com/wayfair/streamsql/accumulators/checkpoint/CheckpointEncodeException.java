/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.accumulators.checkpoint;

import com.wayfair.streamsql.common.StreamSqlRuntimeException;

/**
 * An exception raised when the state of an accumulator cannot be captured into a checkpoint.
 */
public class CheckpointEncodeException extends StreamSqlRuntimeException {
    private static final long serialVersionUID = 1;

    public CheckpointEncodeException(final String message) {
        super(message);
    }

    public CheckpointEncodeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
