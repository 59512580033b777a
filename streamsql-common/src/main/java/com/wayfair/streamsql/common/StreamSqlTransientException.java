/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.common;

/**
 * An exception for failures that may succeed when the operation is attempted again,
 * e.g. a broker that is temporarily unreachable.
 */
public class StreamSqlTransientException extends StreamSqlRuntimeException {
    private static final long serialVersionUID = 1;

    public StreamSqlTransientException(final String message) {
        super(message);
    }

    public StreamSqlTransientException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public StreamSqlTransientException(final Throwable cause) {
        super(cause);
    }
}
