/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.server.api.destination;

import java.util.Collections;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import com.wayfair.streamsql.common.types.DataType;
import com.wayfair.streamsql.common.types.Field;
import com.wayfair.streamsql.common.types.RowBatch;
import com.wayfair.streamsql.common.types.Schema;
import com.wayfair.streamsql.server.api.TaskContext;

/**
 * An executable insert: drains the input into the sink and produces a single row holding the number of
 * rows written.
 */
public class DataSinkExec {
    private static final Logger LOG = LoggerFactory.getLogger(DataSinkExec.class.getName());

    public static final String COUNT_COLUMN = "count";
    public static final Schema COUNT_SCHEMA = Schema.of(new Field(COUNT_COLUMN, DataType.INT64, false));

    private final BatchStream _input;
    private final DataSink _sink;
    private final Schema _sinkSchema;

    /**
     * Constructor.
     * @param input batches to insert
     * @param sink sink the batches are written to; closed after execution
     * @param sinkSchema schema the destination accepts
     * @throws IllegalArgumentException if the input schema differs from the sink schema
     */
    public DataSinkExec(final BatchStream input, final DataSink sink, final Schema sinkSchema) {
        Preconditions.checkArgument(sinkSchema.equals(input.schema()),
                "Input schema %s does not match destination schema %s", input.schema(), sinkSchema);
        _input = input;
        _sink = sink;
        _sinkSchema = sinkSchema;
    }

    public Schema getSinkSchema() {
        return _sinkSchema;
    }

    public DataSink getSink() {
        return _sink;
    }

    /**
     * Run the insert to completion.
     * @return a single row batch with the {@value #COUNT_COLUMN} column
     */
    public RowBatch execute(final TaskContext context) {
        try (BatchStream input = _input; DataSink sink = _sink) {
            final long rowCount = sink.writeAll(input, context);
            LOG.info("Task {} inserted {} rows into {}", context.getTaskId(), rowCount, sink);
            return new RowBatch(COUNT_SCHEMA, Collections.singletonList(Collections.singletonList(rowCount)));
        }
    }
}
