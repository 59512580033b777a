/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.accumulators.checkpoint;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.wayfair.streamsql.common.types.DataType;
import com.wayfair.streamsql.common.types.ScalarValue;

/**
 * Converts {@link ScalarValue}s to and from self describing JSON:
 * <pre>
 *   {"type": "Int32", "value": 1}
 *   {"type": {"List": "Utf8"}, "value": ["a", null]}
 *   {"type": "Float64", "value": "-0.0"}
 * </pre>
 * Floating point content is written as the decimal string of {@link Double#toString(double)} so that
 * negative zero, NaN and infinities survive exactly. Binary content is base64.
 */
public final class SerializableScalarValue {

    public static final String TYPE_FIELD_NAME = "type";
    public static final String VALUE_FIELD_NAME = "value";

    private static final JsonNodeFactory NODE_FACTORY = JsonNodeFactory.instance;

    private SerializableScalarValue() {
    }

    /**
     * Translates a value into its self describing JSON form.
     */
    public static ObjectNode toJson(final ScalarValue value) {
        final ObjectNode node = NODE_FACTORY.objectNode();
        node.set(TYPE_FIELD_NAME, typeToJson(value.getType()));
        node.set(VALUE_FIELD_NAME, contentToJson(value));
        return node;
    }

    /**
     * Translates self describing JSON back into a value.
     * @throws CheckpointDecodeException if the JSON is not a valid self describing value
     */
    public static ScalarValue fromJson(final JsonNode node) {
        if (node == null || !node.isObject() || !node.has(TYPE_FIELD_NAME) || !node.has(VALUE_FIELD_NAME)) {
            throw new CheckpointDecodeException("Expected an object with '" + TYPE_FIELD_NAME + "' and '"
                    + VALUE_FIELD_NAME + "' fields but got " + node);
        }
        final DataType type = typeFromJson(node.get(TYPE_FIELD_NAME));
        return contentFromJson(type, node.get(VALUE_FIELD_NAME));
    }

    static JsonNode typeToJson(final DataType type) {
        if (type.isList()) {
            final ObjectNode node = NODE_FACTORY.objectNode();
            node.set(DataType.TypeId.LIST.getTypeName(), typeToJson(type.getElementType()));
            return node;
        }
        return NODE_FACTORY.textNode(type.getTypeId().getTypeName());
    }

    static DataType typeFromJson(final JsonNode node) {
        if (node.isTextual()) {
            final DataType.TypeId typeId = DataType.TypeId.fromTypeName(node.textValue())
                    .orElseThrow(() -> new CheckpointDecodeException("Unknown type " + node));
            if (typeId == DataType.TypeId.LIST) {
                throw new CheckpointDecodeException("List type without element type");
            }
            return DataType.primitive(typeId);
        }
        if (node.isObject() && node.size() == 1 && node.has(DataType.TypeId.LIST.getTypeName())) {
            return DataType.list(typeFromJson(node.get(DataType.TypeId.LIST.getTypeName())));
        }
        throw new CheckpointDecodeException("Invalid type descriptor " + node);
    }

    private static JsonNode contentToJson(final ScalarValue value) {
        if (value.isNull()) {
            return NODE_FACTORY.nullNode();
        }
        final Object content = value.getValue();
        switch (value.getType().getTypeId()) {
            case BOOLEAN:
                return NODE_FACTORY.booleanNode((Boolean) content);
            case INT8:
                return NODE_FACTORY.numberNode((Byte) content);
            case INT16:
                return NODE_FACTORY.numberNode((Short) content);
            case INT32:
                return NODE_FACTORY.numberNode((Integer) content);
            case INT64:
                return NODE_FACTORY.numberNode((Long) content);
            case FLOAT32:
                return NODE_FACTORY.textNode(Float.toString((Float) content));
            case FLOAT64:
                return NODE_FACTORY.textNode(Double.toString((Double) content));
            case UTF8:
                return NODE_FACTORY.textNode((String) content);
            case BINARY:
                return NODE_FACTORY.binaryNode((byte[]) content);
            case LIST:
                final ArrayNode elements = NODE_FACTORY.arrayNode();
                for (final ScalarValue element : value.getList()) {
                    elements.add(contentToJson(element));
                }
                return elements;
            default:
                throw new IllegalStateException("Unsupported type: " + value.getType());
        }
    }

    private static ScalarValue contentFromJson(final DataType type, final JsonNode node) {
        if (node.isNull()) {
            return ScalarValue.nullOf(type);
        }
        switch (type.getTypeId()) {
            case NULL:
                throw invalidContent(type, node);
            case BOOLEAN:
                if (!node.isBoolean()) {
                    throw invalidContent(type, node);
                }
                return ScalarValue.ofBoolean(node.booleanValue());
            case INT8:
                return ScalarValue.ofInt8((byte) integerInRange(type, node, Byte.MIN_VALUE, Byte.MAX_VALUE));
            case INT16:
                return ScalarValue.ofInt16((short) integerInRange(type, node, Short.MIN_VALUE, Short.MAX_VALUE));
            case INT32:
                return ScalarValue.ofInt32((int) integerInRange(type, node, Integer.MIN_VALUE, Integer.MAX_VALUE));
            case INT64:
                return ScalarValue.ofInt64(integerInRange(type, node, Long.MIN_VALUE, Long.MAX_VALUE));
            case FLOAT32:
                return ScalarValue.ofFloat32(Float.parseFloat(floatingPointText(type, node)));
            case FLOAT64:
                return ScalarValue.ofFloat64(Double.parseDouble(floatingPointText(type, node)));
            case UTF8:
                if (!node.isTextual()) {
                    throw invalidContent(type, node);
                }
                return ScalarValue.ofUtf8(node.textValue());
            case BINARY:
                if (!node.isTextual()) {
                    throw invalidContent(type, node);
                }
                try {
                    return ScalarValue.ofBinary(node.binaryValue());
                } catch (final IOException e) {
                    throw new CheckpointDecodeException("Invalid base64 content for " + type, e);
                }
            case LIST:
                if (!node.isArray()) {
                    throw invalidContent(type, node);
                }
                final List<ScalarValue> elements = new ArrayList<>(node.size());
                for (final JsonNode element : node) {
                    elements.add(contentFromJson(type.getElementType(), element));
                }
                return ScalarValue.ofList(type.getElementType(), elements);
            default:
                throw new IllegalStateException("Unsupported type: " + type);
        }
    }

    private static long integerInRange(final DataType type, final JsonNode node, final long min, final long max) {
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw invalidContent(type, node);
        }
        final long value = node.longValue();
        if (value < min || value > max) {
            throw invalidContent(type, node);
        }
        return value;
    }

    private static String floatingPointText(final DataType type, final JsonNode node) {
        if (!node.isTextual()) {
            throw invalidContent(type, node);
        }
        final String text = node.textValue();
        // parseDouble also accepts hex floats and type suffixes, which toString never produces
        if (!text.matches("NaN|-?Infinity|-?\\d+\\.\\d+(E-?\\d+)?")) {
            throw invalidContent(type, node);
        }
        return text;
    }

    private static CheckpointDecodeException invalidContent(final DataType type, final JsonNode node) {
        return new CheckpointDecodeException("Invalid content for " + type + ": " + node);
    }
}
