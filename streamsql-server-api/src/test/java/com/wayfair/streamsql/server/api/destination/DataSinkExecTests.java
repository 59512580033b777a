/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.server.api.destination;

import org.testng.annotations.Test;

import com.wayfair.streamsql.common.types.DataType;
import com.wayfair.streamsql.common.types.Field;
import com.wayfair.streamsql.common.types.RowBatch;
import com.wayfair.streamsql.common.types.Schema;
import com.wayfair.streamsql.server.api.TaskContext;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;

public class DataSinkExecTests {

    private static final Schema SCHEMA = Schema.of(new Field("id", DataType.INT32));

    @Test
    public void testExecuteReportsRowCountAndClosesSink() {
        final BatchStream input = BatchStreams.of(SCHEMA);
        final DataSink sink = mock(DataSink.class);
        final TaskContext context = new TaskContext("test");
        when(sink.writeAll(eq(input), any(TaskContext.class))).thenReturn(5L);

        final RowBatch result = new DataSinkExec(input, sink, SCHEMA).execute(context);

        assertEquals(result.getSchema(), DataSinkExec.COUNT_SCHEMA);
        assertEquals(result.getNumRows(), 1);
        assertEquals(result.getValue(0, 0), 5L);
        verify(sink).writeAll(input, context);
        verify(sink).close();
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRejectsSchemaMismatch() {
        final Schema other = Schema.of(new Field("name", DataType.UTF8));
        new DataSinkExec(BatchStreams.of(other), mock(DataSink.class), SCHEMA);
    }
}
