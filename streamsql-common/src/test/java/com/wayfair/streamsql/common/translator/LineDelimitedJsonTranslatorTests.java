/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.common.translator;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.testng.annotations.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.wayfair.streamsql.common.types.DataType;
import com.wayfair.streamsql.common.types.Field;
import com.wayfair.streamsql.common.types.RowBatch;
import com.wayfair.streamsql.common.types.Schema;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class LineDelimitedJsonTranslatorTests {

    private static final Schema SCHEMA = Schema.of(
            new Field("id", DataType.INT64),
            new Field("name", DataType.UTF8),
            new Field("tags", DataType.list(DataType.UTF8)));

    private final LineDelimitedJsonTranslator translator = new LineDelimitedJsonTranslator();

    @Test
    public void testOneLinePerRow() throws Exception {
        final RowBatch batch = new RowBatch.Builder(SCHEMA)
                .addRow(1L, "first", Arrays.asList("a", "b"))
                .addRow(2L, "line\nbreak", null)
                .addRow(Long.MIN_VALUE, null, Arrays.asList("c", null))
                .build();

        final String payload = new String(translator.translateFromInternalFormat(batch), StandardCharsets.UTF_8);
        assertTrue(payload.endsWith("\n"));
        final String[] lines = payload.split("\n");
        assertEquals(lines.length, 3);

        final ObjectMapper mapper = new ObjectMapper();
        final JsonNode first = mapper.readTree(lines[0]);
        assertEquals(first.get("id").asLong(), 1L);
        assertEquals(first.get("name").asText(), "first");
        assertEquals(first.get("tags").size(), 2);

        final JsonNode second = mapper.readTree(lines[1]);
        assertEquals(second.get("name").asText(), "line\nbreak");
        assertTrue(second.get("tags").isNull());

        final JsonNode third = mapper.readTree(lines[2]);
        assertEquals(third.get("id").asLong(), Long.MIN_VALUE);
        assertTrue(third.has("name"));
        assertTrue(third.get("name").isNull());
        assertTrue(third.get("tags").get(1).isNull());
    }

    @Test
    public void testEmptyBatchTranslatesToNothing() {
        assertEquals(translator.translateFromInternalFormat(RowBatch.empty(SCHEMA)).length, 0);
    }
}
