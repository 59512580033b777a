/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.common.types;

import java.util.Arrays;
import java.util.Collections;

import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class RowBatchTests {

    private static final Schema SCHEMA = Schema.of(
            new Field("id", DataType.INT32, false),
            new Field("score", DataType.FLOAT64));

    @Test
    public void testBuilder() {
        final RowBatch batch = new RowBatch.Builder(SCHEMA)
                .addRow(1, 0.5)
                .addRow(2, null)
                .build();
        assertEquals(batch.getNumRows(), 2);
        assertEquals(batch.getColumn("id"), Arrays.asList(1, 2));
        assertEquals(batch.getValue(1, 1), null);
    }

    @Test
    public void testEmpty() {
        final RowBatch batch = RowBatch.empty(SCHEMA);
        assertTrue(batch.isEmpty());
        assertEquals(batch.getNumRows(), 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRejectsWrongValueType() {
        new RowBatch.Builder(SCHEMA).addRow("1", 0.5).build();
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRejectsNullInNonNullableColumn() {
        new RowBatch.Builder(SCHEMA).addRow(null, 0.5).build();
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRejectsRaggedColumns() {
        new RowBatch(SCHEMA, Arrays.asList(Arrays.asList(1, 2), Collections.singletonList(1.0)));
    }
}
