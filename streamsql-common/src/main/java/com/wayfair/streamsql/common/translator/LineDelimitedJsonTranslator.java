/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.common.translator;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.wayfair.streamsql.common.types.DataType;
import com.wayfair.streamsql.common.types.Field;
import com.wayfair.streamsql.common.types.RowBatch;

/**
 * Translates a {@link RowBatch} into newline-delimited JSON: one object per row, keyed by column name,
 * with every row terminated by a newline. Null cells are written as an explicit JSON null.
 */
public class LineDelimitedJsonTranslator implements RecordTranslator<RowBatch, byte[]> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODE_FACTORY = JsonNodeFactory.instance;
    private static final byte NEWLINE = '\n';

    @Override
    public byte[] translateFromInternalFormat(final RowBatch batch) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final List<Field> fields = batch.getSchema().getFields();
        try {
            for (int row = 0; row < batch.getNumRows(); row++) {
                final ObjectNode rowNode = NODE_FACTORY.objectNode();
                for (int column = 0; column < fields.size(); column++) {
                    final Field field = fields.get(column);
                    rowNode.set(field.getName(), toJson(field.getType(), batch.getValue(row, column)));
                }
                out.write(OBJECT_MAPPER.writeValueAsBytes(rowNode));
                out.write(NEWLINE);
            }
        } catch (final IOException e) {
            throw new RecordTranslationException("Unable to write " + batch + " as JSON", e);
        }
        return out.toByteArray();
    }

    private static JsonNode toJson(final DataType type, final Object value) {
        if (value == null) {
            return NODE_FACTORY.nullNode();
        }
        switch (type.getTypeId()) {
            case BOOLEAN:
                return NODE_FACTORY.booleanNode((Boolean) value);
            case INT8:
                return NODE_FACTORY.numberNode((Byte) value);
            case INT16:
                return NODE_FACTORY.numberNode((Short) value);
            case INT32:
                return NODE_FACTORY.numberNode((Integer) value);
            case INT64:
                return NODE_FACTORY.numberNode((Long) value);
            case FLOAT32:
                return NODE_FACTORY.numberNode((Float) value);
            case FLOAT64:
                return NODE_FACTORY.numberNode((Double) value);
            case UTF8:
                return NODE_FACTORY.textNode((String) value);
            case BINARY:
                return NODE_FACTORY.binaryNode((byte[]) value);
            case LIST:
                final ArrayNode arrayNode = NODE_FACTORY.arrayNode();
                for (final Object element : (List<?>) value) {
                    arrayNode.add(toJson(type.getElementType(), element));
                }
                return arrayNode;
            default:
                throw new IllegalStateException("Unsupported type: " + type);
        }
    }
}
