/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.kafka;

import com.wayfair.streamsql.common.StreamSqlTransientException;

/**
 * A StreamSqlTransientException that is thrown when a batch could not be published to Kafka.
 * Batches published before the failure are not rolled back.
 */
public class DeliveryException extends StreamSqlTransientException {
    private static final long serialVersionUID = 1;

    private final long _rowsWritten;

    /**
     * Constructor.
     * @param message a String
     * @param rowsWritten number of rows published before the failure
     * @param cause the last delivery failure
     */
    public DeliveryException(final String message, final long rowsWritten, final Throwable cause) {
        super(message, cause);
        _rowsWritten = rowsWritten;
    }

    /**
     * @return number of rows that were published before the failure
     */
    public long getRowsWritten() {
        return _rowsWritten;
    }
}
