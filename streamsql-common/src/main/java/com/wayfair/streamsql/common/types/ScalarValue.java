/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.common.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;

/**
 * A single typed value. The value may be null, in which case the type is still known.
 * <p>
 * For list types the content is an immutable {@code List<ScalarValue>} whose elements all have the
 * list's element type. Other types hold the boxed java value given by {@link DataType.TypeId#getJavaClass()}.
 * <p>
 * Equality is observational: floating point values compare by bit pattern (so {@code -0.0 != 0.0} and
 * {@code NaN == NaN}) and binary values compare by content.
 */
public final class ScalarValue {

    private final DataType _type;
    private final Object _value;

    private ScalarValue(final DataType type, final Object value) {
        _type = type;
        _value = value;
    }

    /**
     * Create a typed null.
     */
    public static ScalarValue nullOf(final DataType type) {
        return new ScalarValue(Preconditions.checkNotNull(type, "type"), null);
    }

    /**
     * Create a list value from already typed elements.
     * @param elementType type every element must have
     * @param elements the elements, null for a null list
     */
    public static ScalarValue ofList(final DataType elementType, final List<ScalarValue> elements) {
        final DataType listType = DataType.list(elementType);
        if (elements == null) {
            return nullOf(listType);
        }
        for (final ScalarValue element : elements) {
            Preconditions.checkArgument(element != null && element.getType().equals(elementType),
                    "List element %s does not have type %s", element, elementType);
        }
        return new ScalarValue(listType, Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    /**
     * Wrap a raw java value, e.g. a cell of a {@link RowBatch}. Raw list values are lists of raw elements.
     * @throws IllegalArgumentException if the raw value does not fit the type
     */
    public static ScalarValue fromRaw(final DataType type, final Object raw) {
        Preconditions.checkNotNull(type, "type");
        if (raw == null) {
            return nullOf(type);
        }
        Preconditions.checkArgument(type.accepts(raw), "Value %s of class %s does not fit type %s",
                raw, raw.getClass().getSimpleName(), type);
        if (type.isList()) {
            final DataType elementType = type.getElementType();
            return ofList(elementType, ((List<?>) raw).stream()
                    .map(element -> fromRaw(elementType, element))
                    .collect(Collectors.toList()));
        }
        if (raw instanceof byte[]) {
            return new ScalarValue(type, ((byte[]) raw).clone());
        }
        return new ScalarValue(type, raw);
    }

    public static ScalarValue ofBoolean(final boolean value) {
        return new ScalarValue(DataType.BOOLEAN, value);
    }

    public static ScalarValue ofInt8(final byte value) {
        return new ScalarValue(DataType.INT8, value);
    }

    public static ScalarValue ofInt16(final short value) {
        return new ScalarValue(DataType.INT16, value);
    }

    public static ScalarValue ofInt32(final int value) {
        return new ScalarValue(DataType.INT32, value);
    }

    public static ScalarValue ofInt64(final long value) {
        return new ScalarValue(DataType.INT64, value);
    }

    public static ScalarValue ofFloat32(final float value) {
        return new ScalarValue(DataType.FLOAT32, value);
    }

    public static ScalarValue ofFloat64(final double value) {
        return new ScalarValue(DataType.FLOAT64, value);
    }

    public static ScalarValue ofUtf8(final String value) {
        return value == null ? nullOf(DataType.UTF8) : new ScalarValue(DataType.UTF8, value);
    }

    public static ScalarValue ofBinary(final byte[] value) {
        return fromRaw(DataType.BINARY, value);
    }

    public DataType getType() {
        return _type;
    }

    public boolean isNull() {
        return _value == null;
    }

    /**
     * @return the boxed content, null for a null value
     */
    public Object getValue() {
        return _value instanceof byte[] ? ((byte[]) _value).clone() : _value;
    }

    /**
     * @return the elements of a non-null list value
     */
    @SuppressWarnings("unchecked")
    public List<ScalarValue> getList() {
        Preconditions.checkState(_type.isList(), "%s is not a list", this);
        Preconditions.checkState(_value != null, "list value is null");
        return (List<ScalarValue>) _value;
    }

    /**
     * Unwrap into a raw java value; lists become lists of raw elements.
     */
    public Object toRaw() {
        if (_value == null) {
            return null;
        }
        if (_type.isList()) {
            final List<Object> raw = new ArrayList<>();
            for (final ScalarValue element : getList()) {
                raw.add(element.toRaw());
            }
            return raw;
        }
        return getValue();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final ScalarValue that = (ScalarValue) o;
        if (!_type.equals(that._type)) {
            return false;
        }
        if (_value instanceof byte[] && that._value instanceof byte[]) {
            return Arrays.equals((byte[]) _value, (byte[]) that._value);
        }
        // Float/Double equals compare bit patterns
        return Objects.equals(_value, that._value);
    }

    @Override
    public int hashCode() {
        return 31 * _type.hashCode() + (_value instanceof byte[] ? Arrays.hashCode((byte[]) _value) : Objects.hashCode(_value));
    }

    @Override
    public String toString() {
        final String content;
        if (_value == null) {
            content = "null";
        } else if (_value instanceof byte[]) {
            content = Arrays.toString((byte[]) _value);
        } else {
            content = String.valueOf(_value);
        }
        return _type + "(" + content + ")";
    }
}
