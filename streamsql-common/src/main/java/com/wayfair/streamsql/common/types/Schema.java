/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.common.types;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * An ordered list of uniquely named fields.
 */
public final class Schema {
    private final ImmutableList<Field> _fields;

    public Schema(final List<Field> fields) {
        _fields = ImmutableList.copyOf(fields);
        final long distinctNames = _fields.stream().map(Field::getName).distinct().count();
        Preconditions.checkArgument(distinctNames == _fields.size(), "Duplicate field names in %s", _fields);
    }

    public static Schema of(final Field... fields) {
        return new Schema(Arrays.asList(fields));
    }

    public List<Field> getFields() {
        return _fields;
    }

    public Field getField(final int index) {
        return _fields.get(index);
    }

    public int size() {
        return _fields.size();
    }

    /**
     * @return the index of the named field, or -1 if it does not exist
     */
    public int indexOf(final String name) {
        for (int i = 0; i < _fields.size(); i++) {
            if (_fields.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public boolean equals(final Object o) {
        return this == o || (o instanceof Schema && _fields.equals(((Schema) o)._fields));
    }

    @Override
    public int hashCode() {
        return _fields.hashCode();
    }

    @Override
    public String toString() {
        return _fields.stream().map(Field::toString).collect(Collectors.joining(", ", "Schema(", ")"));
    }
}
