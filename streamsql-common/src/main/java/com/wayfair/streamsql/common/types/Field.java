/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.common.types;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * A named, typed column of a {@link Schema}.
 */
public final class Field {
    private final String _name;
    private final DataType _type;
    private final boolean _nullable;

    public Field(final String name, final DataType type, final boolean nullable) {
        _name = Preconditions.checkNotNull(name, "name");
        _type = Preconditions.checkNotNull(type, "type");
        _nullable = nullable;
    }

    public Field(final String name, final DataType type) {
        this(name, type, true);
    }

    public String getName() {
        return _name;
    }

    public DataType getType() {
        return _type;
    }

    public boolean isNullable() {
        return _nullable;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Field field = (Field) o;
        return _nullable == field._nullable && _name.equals(field._name) && _type.equals(field._type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_name, _type, _nullable);
    }

    @Override
    public String toString() {
        return _name + ": " + _type + (_nullable ? "" : " NOT NULL");
    }
}
