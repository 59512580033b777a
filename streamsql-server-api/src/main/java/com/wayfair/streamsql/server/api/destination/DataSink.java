/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.server.api.destination;

import com.wayfair.streamsql.server.api.TaskContext;

/**
 * The write side of a {@link WriteDestination}: consumes a stream of batches and reports how many rows it wrote.
 */
public interface DataSink extends AutoCloseable {

    /**
     * Write every batch of the stream to the destination, sequentially and in order.
     * Returns early with the rows written so far when the task is cancelled.
     *
     * @param data the batches to write
     * @param context context of the task that owns the write
     * @return total number of rows written
     * @throws BatchStreamException if the upstream producer failed
     */
    long writeAll(BatchStream data, TaskContext context);

    @Override
    void close();
}
