/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.accumulators.checkpoint;

import java.util.Arrays;
import java.util.Collections;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.wayfair.streamsql.common.types.DataType;
import com.wayfair.streamsql.common.types.ScalarValue;

import static org.testng.Assert.assertEquals;

public class SerializableScalarValueTests {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @DataProvider
    public Object[][] values() {
        final DataType intList = DataType.list(DataType.INT32);
        return new Object[][] {
            {ScalarValue.nullOf(DataType.INT32)},
            {ScalarValue.nullOf(DataType.NULL)},
            {ScalarValue.nullOf(intList)},
            {ScalarValue.ofBoolean(false)},
            {ScalarValue.ofInt8(Byte.MIN_VALUE)},
            {ScalarValue.ofInt16((short) -300)},
            {ScalarValue.ofInt32(-1)},
            {ScalarValue.ofInt64(Long.MAX_VALUE)},
            {ScalarValue.ofInt64(Long.MIN_VALUE)},
            {ScalarValue.ofFloat32(-0.0f)},
            {ScalarValue.ofFloat32(Float.MIN_VALUE)},
            {ScalarValue.ofFloat64(-0.0)},
            {ScalarValue.ofFloat64(0.1 + 0.2)},
            {ScalarValue.ofFloat64(Double.NaN)},
            {ScalarValue.ofFloat64(Double.NEGATIVE_INFINITY)},
            {ScalarValue.ofUtf8("")},
            {ScalarValue.ofUtf8("a,b\n{\"type\":\"Utf8\"}\u0000é")},
            {ScalarValue.ofBinary(new byte[] {0, -1, 127})},
            {ScalarValue.ofList(DataType.INT32, Collections.emptyList())},
            {ScalarValue.fromRaw(intList, Arrays.asList(1, null, -3))},
            {ScalarValue.fromRaw(DataType.list(intList), Arrays.asList(Arrays.asList(1, 2), null, Collections.emptyList()))},
        };
    }

    @Test(dataProvider = "values")
    public void testRoundTripThroughText(final ScalarValue value) throws Exception {
        final String text = OBJECT_MAPPER.writeValueAsString(SerializableScalarValue.toJson(value));
        assertEquals(SerializableScalarValue.fromJson(OBJECT_MAPPER.readTree(text)), value);
    }

    @Test
    public void testListFormat() throws Exception {
        final JsonNode node = SerializableScalarValue.toJson(ScalarValue.fromRaw(DataType.list(DataType.INT32), Arrays.asList(1, null)));
        assertEquals(node, OBJECT_MAPPER.readTree("{\"type\":{\"List\":\"Int32\"},\"value\":[1,null]}"));
    }

    @DataProvider
    public Object[][] invalidValues() {
        return new Object[][] {
            {"[]"},
            {"{\"type\":\"Int32\"}"},
            {"{\"type\":\"Decimal\",\"value\":1}"},
            {"{\"type\":\"List\",\"value\":[]}"},
            {"{\"type\":\"Int32\",\"value\":\"1\"}"},
            {"{\"type\":\"Int32\",\"value\":2147483648}"},
            {"{\"type\":\"Int64\",\"value\":9223372036854775808}"},
            {"{\"type\":\"Int8\",\"value\":1.5}"},
            {"{\"type\":\"Float64\",\"value\":1.5}"},
            {"{\"type\":\"Float64\",\"value\":\"0x1p3\"}"},
            {"{\"type\":\"Boolean\",\"value\":\"true\"}"},
            {"{\"type\":\"Null\",\"value\":0}"},
            {"{\"type\":{\"List\":\"Int32\"},\"value\":[\"a\"]}"},
        };
    }

    @Test(dataProvider = "invalidValues", expectedExceptions = CheckpointDecodeException.class)
    public void testRejectsInvalidValues(final String json) throws Exception {
        SerializableScalarValue.fromJson(OBJECT_MAPPER.readTree(json));
    }
}
