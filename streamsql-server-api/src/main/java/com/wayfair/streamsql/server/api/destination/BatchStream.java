/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.server.api.destination;

import java.util.Optional;

import com.wayfair.streamsql.common.types.RowBatch;
import com.wayfair.streamsql.common.types.Schema;

/**
 * A pull based source of row batches produced by query execution. The stream may be unbounded.
 */
public interface BatchStream extends AutoCloseable {

    /**
     * @return the schema every batch of this stream has
     */
    Schema schema();

    /**
     * Wait for the next batch.
     * @return the next batch, or empty once the stream is exhausted
     * @throws BatchStreamException if the upstream producer failed
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    Optional<RowBatch> next() throws InterruptedException;

    @Override
    default void close() {
    }
}
