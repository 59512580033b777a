/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.server.api.destination;

import com.wayfair.streamsql.common.StreamSqlRuntimeException;

/**
 * An exception raised when a destination is asked for an operation it does not implement,
 * e.g. reading from a write-only destination.
 */
public class UnsupportedDestinationOperationException extends StreamSqlRuntimeException {
    private static final long serialVersionUID = 1;

    public UnsupportedDestinationOperationException(final String message) {
        super(message);
    }
}
