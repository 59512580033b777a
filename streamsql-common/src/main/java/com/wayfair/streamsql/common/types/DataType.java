/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.common.types;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * The logical type of a column or a {@link ScalarValue}. Primitive types are singletons,
 * list types carry the type of their elements.
 */
public final class DataType {

    /**
     * An enumeration of supported type ids.
     */
    public enum TypeId {
        NULL("Null", Void.class),
        BOOLEAN("Boolean", Boolean.class),
        INT8("Int8", Byte.class),
        INT16("Int16", Short.class),
        INT32("Int32", Integer.class),
        INT64("Int64", Long.class),
        FLOAT32("Float32", Float.class),
        FLOAT64("Float64", Double.class),
        UTF8("Utf8", String.class),
        BINARY("Binary", byte[].class),
        LIST("List", List.class);

        private final String _typeName;
        private final Class<?> _javaClass;

        TypeId(final String typeName, final Class<?> javaClass) {
            _typeName = typeName;
            _javaClass = javaClass;
        }

        public String getTypeName() {
            return _typeName;
        }

        public Class<?> getJavaClass() {
            return _javaClass;
        }

        /**
         * Look up a type id by its type name, e.g. "Int32".
         * @return the matching TypeId, or empty if there is none
         */
        public static Optional<TypeId> fromTypeName(final String typeName) {
            for (final TypeId typeId : values()) {
                if (typeId._typeName.equals(typeName)) {
                    return Optional.of(typeId);
                }
            }
            return Optional.empty();
        }
    }

    public static final DataType NULL = new DataType(TypeId.NULL, null);
    public static final DataType BOOLEAN = new DataType(TypeId.BOOLEAN, null);
    public static final DataType INT8 = new DataType(TypeId.INT8, null);
    public static final DataType INT16 = new DataType(TypeId.INT16, null);
    public static final DataType INT32 = new DataType(TypeId.INT32, null);
    public static final DataType INT64 = new DataType(TypeId.INT64, null);
    public static final DataType FLOAT32 = new DataType(TypeId.FLOAT32, null);
    public static final DataType FLOAT64 = new DataType(TypeId.FLOAT64, null);
    public static final DataType UTF8 = new DataType(TypeId.UTF8, null);
    public static final DataType BINARY = new DataType(TypeId.BINARY, null);

    private final TypeId _typeId;
    private final DataType _elementType;

    private DataType(final TypeId typeId, final DataType elementType) {
        _typeId = typeId;
        _elementType = elementType;
    }

    /**
     * Create a list type.
     * @param elementType the type of the list elements
     */
    public static DataType list(final DataType elementType) {
        return new DataType(TypeId.LIST, Preconditions.checkNotNull(elementType, "elementType"));
    }

    /**
     * Get the primitive type for a type id.
     * @throws IllegalArgumentException for {@link TypeId#LIST}, which needs an element type
     */
    public static DataType primitive(final TypeId typeId) {
        switch (typeId) {
            case NULL:
                return NULL;
            case BOOLEAN:
                return BOOLEAN;
            case INT8:
                return INT8;
            case INT16:
                return INT16;
            case INT32:
                return INT32;
            case INT64:
                return INT64;
            case FLOAT32:
                return FLOAT32;
            case FLOAT64:
                return FLOAT64;
            case UTF8:
                return UTF8;
            case BINARY:
                return BINARY;
            default:
                throw new IllegalArgumentException("Not a primitive type: " + typeId);
        }
    }

    public TypeId getTypeId() {
        return _typeId;
    }

    /**
     * @return the element type of a list type
     * @throws IllegalStateException if this is not a list type
     */
    public DataType getElementType() {
        Preconditions.checkState(_typeId == TypeId.LIST, "%s is not a list type", this);
        return _elementType;
    }

    public boolean isList() {
        return _typeId == TypeId.LIST;
    }

    public boolean isInteger() {
        return _typeId == TypeId.INT8 || _typeId == TypeId.INT16 || _typeId == TypeId.INT32 || _typeId == TypeId.INT64;
    }

    public boolean isFloatingPoint() {
        return _typeId == TypeId.FLOAT32 || _typeId == TypeId.FLOAT64;
    }

    public boolean isNumeric() {
        return isInteger() || isFloatingPoint();
    }

    /**
     * Check whether a raw java value can be stored in a column of this type.
     * Null is accepted by every type. List values must hold acceptable elements.
     */
    public boolean accepts(final Object value) {
        if (value == null) {
            return true;
        }
        if (_typeId == TypeId.LIST) {
            if (!(value instanceof List)) {
                return false;
            }
            for (final Object element : (List<?>) value) {
                if (!_elementType.accepts(element)) {
                    return false;
                }
            }
            return true;
        }
        return _typeId != TypeId.NULL && _typeId.getJavaClass().isInstance(value);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final DataType that = (DataType) o;
        return _typeId == that._typeId && Objects.equals(_elementType, that._elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_typeId, _elementType);
    }

    @Override
    public String toString() {
        return _typeId == TypeId.LIST ? "List<" + _elementType + ">" : _typeId.getTypeName();
    }
}
