/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.accumulators.checkpoint;

import com.wayfair.streamsql.common.StreamSqlRuntimeException;

/**
 * An exception raised when a checkpoint is malformed and cannot be restored.
 */
public class CheckpointDecodeException extends StreamSqlRuntimeException {
    private static final long serialVersionUID = 1;

    public CheckpointDecodeException(final String message) {
        super(message);
    }

    public CheckpointDecodeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
