/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.server.api.destination;

import com.wayfair.streamsql.common.StreamSqlRuntimeException;

/**
 * An exception raised by a {@link BatchStream} when its producer failed.
 */
public class BatchStreamException extends StreamSqlRuntimeException {
    private static final long serialVersionUID = 1;

    public BatchStreamException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
