/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.common;

/**
 * Base class of all unchecked exceptions raised by streamsql components.
 */
public class StreamSqlRuntimeException extends RuntimeException {
    private static final long serialVersionUID = 1;

    public StreamSqlRuntimeException() {
        super();
    }

    public StreamSqlRuntimeException(final String message) {
        super(message);
    }

    public StreamSqlRuntimeException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public StreamSqlRuntimeException(final Throwable cause) {
        super(cause);
    }
}
