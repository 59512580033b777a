/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.server.api.destination;

import java.util.Arrays;
import java.util.Iterator;
import java.util.Optional;

import com.google.common.base.Preconditions;

import com.wayfair.streamsql.common.types.RowBatch;
import com.wayfair.streamsql.common.types.Schema;

/**
 * Factory methods for {@link BatchStream}s over batches that are already materialized.
 */
public final class BatchStreams {

    private BatchStreams() {
    }

    public static BatchStream of(final Schema schema, final RowBatch... batches) {
        return fromIterable(schema, Arrays.asList(batches));
    }

    /**
     * Create a stream that yields the batches of an iterable in order.
     * @throws IllegalArgumentException on {@link BatchStream#next()} if a batch has a different schema
     */
    public static BatchStream fromIterable(final Schema schema, final Iterable<RowBatch> batches) {
        final Iterator<RowBatch> iterator = batches.iterator();
        return new BatchStream() {
            @Override
            public Schema schema() {
                return schema;
            }

            @Override
            public Optional<RowBatch> next() {
                if (!iterator.hasNext()) {
                    return Optional.empty();
                }
                final RowBatch batch = iterator.next();
                Preconditions.checkArgument(schema.equals(batch.getSchema()),
                        "Batch schema %s does not match stream schema %s", batch.getSchema(), schema);
                return Optional.of(batch);
            }
        };
    }
}
