/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.common;

import java.util.HashSet;
import java.util.Properties;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A wrapper around {@link Properties} with typed, validated accessors. Every property that is read
 * is remembered so that unused (likely misspelled) properties can be reported.
 */
public class VerifiableProperties {

    private static final Logger LOG = LoggerFactory.getLogger(VerifiableProperties.class.getName());

    private final Properties _props;
    private final Set<String> _referencedNames = new HashSet<>();

    public VerifiableProperties(final Properties props) {
        _props = props;
    }

    /**
     * @return true if the property is present
     */
    public boolean containsKey(final String name) {
        return _props.containsKey(name);
    }

    /**
     * Read a property, returning null if it is not set.
     */
    public String getProperty(final String name) {
        final String value = _props.getProperty(name);
        _referencedNames.add(name);
        return value == null ? null : value.trim();
    }

    /**
     * Read a required string property.
     * @throws IllegalArgumentException if the property is missing or blank
     */
    public String getString(final String name) {
        final String value = getProperty(name);
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException("Missing required property '" + name + "'");
        }
        return value;
    }

    public String getString(final String name, final String defaultValue) {
        return containsKey(name) ? getString(name) : defaultValue;
    }

    public int getInt(final String name, final int defaultValue) {
        return getIntInRange(name, defaultValue, Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    /**
     * Read an integer property that must lie in [start, end].
     */
    public int getIntInRange(final String name, final int defaultValue, final int start, final int end) {
        final int value;
        if (containsKey(name)) {
            try {
                value = Integer.parseInt(getProperty(name));
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException("Property '" + name + "' is not an integer: " + _props.getProperty(name), e);
            }
        } else {
            value = defaultValue;
        }
        if (value < start || value > end) {
            throw new IllegalArgumentException(String.format("%s has value %d which is not in the range [%d, %d]",
                    name, value, start, end));
        }
        return value;
    }

    public long getLong(final String name, final long defaultValue) {
        if (!containsKey(name)) {
            return defaultValue;
        }
        try {
            return Long.parseLong(getProperty(name));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Property '" + name + "' is not a long: " + _props.getProperty(name), e);
        }
    }

    public boolean getBoolean(final String name, final boolean defaultValue) {
        return containsKey(name) ? Boolean.parseBoolean(getProperty(name)) : defaultValue;
    }

    /**
     * Get all properties under the given domain prefix, with the prefix stripped.
     * e.g. for the domain "producer", "producer.bootstrap.servers" is returned as "bootstrap.servers".
     */
    public Properties getDomainProperties(final String domain) {
        final String prefix = domain.endsWith(".") ? domain : domain + ".";
        final Properties domainProps = new Properties();
        for (final String name : _props.stringPropertyNames()) {
            if (name.startsWith(prefix)) {
                _referencedNames.add(name);
                domainProps.put(name.substring(prefix.length()), _props.getProperty(name));
            }
        }
        return domainProps;
    }

    /**
     * Log a warning for every property that has not been read so far.
     */
    public void verify() {
        for (final String name : _props.stringPropertyNames()) {
            if (!_referencedNames.contains(name)) {
                LOG.warn("Property {} is not valid", name);
            }
        }
    }

    @Override
    public String toString() {
        return _props.toString();
    }
}
