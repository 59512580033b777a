/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.server.api.destination;

import java.util.List;

import com.wayfair.streamsql.common.types.Schema;

/**
 * A named destination that query output can be inserted into.
 */
public interface WriteDestination {

    /**
     * @return the fixed schema of rows this destination accepts
     */
    Schema schema();

    /**
     * Read the destination.
     * @param projection indices of the columns to read, null for all
     * @param limit maximum number of rows, negative for no limit
     * @throws UnsupportedDestinationOperationException if the destination cannot be read
     */
    BatchStream scan(List<Integer> projection, long limit);

    /**
     * Plan an insert of the input stream.
     * @param input batches to insert
     * @param overwrite true to replace the existing content instead of appending
     * @throws UnsupportedDestinationOperationException if the requested insert mode is not supported
     */
    DataSinkExec insertInto(BatchStream input, boolean overwrite);
}
