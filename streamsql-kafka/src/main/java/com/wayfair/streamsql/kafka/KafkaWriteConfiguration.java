/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.kafka;

import java.time.Duration;
import java.util.Objects;

import com.google.common.base.Preconditions;

import com.wayfair.streamsql.common.types.Schema;

/**
 * A class to hold the configuration of a Kafka write destination.
 */
public class KafkaWriteConfiguration {

    public static final Duration DEFAULT_DELIVERY_TIMEOUT = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_DELIVERY_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(100);

    private final String _topic;
    private final Schema _schema;
    private final Duration _deliveryTimeout;
    private final int _maxDeliveryAttempts;
    private final Duration _retryBackoff;

    private KafkaWriteConfiguration(final Builder builder) {
        _topic = builder._topic;
        _schema = builder._schema;
        _deliveryTimeout = builder._deliveryTimeout;
        _maxDeliveryAttempts = builder._maxDeliveryAttempts;
        _retryBackoff = builder._retryBackoff;
    }

    public String getTopic() {
        return _topic;
    }

    public Schema getSchema() {
        return _schema;
    }

    /**
     * @return how long a single publish attempt is awaited
     */
    public Duration getDeliveryTimeout() {
        return _deliveryTimeout;
    }

    public int getMaxDeliveryAttempts() {
        return _maxDeliveryAttempts;
    }

    public Duration getRetryBackoff() {
        return _retryBackoff;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final KafkaWriteConfiguration that = (KafkaWriteConfiguration) o;
        return _maxDeliveryAttempts == that._maxDeliveryAttempts && _topic.equals(that._topic)
                && _schema.equals(that._schema) && _deliveryTimeout.equals(that._deliveryTimeout)
                && _retryBackoff.equals(that._retryBackoff);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_topic, _schema, _deliveryTimeout, _maxDeliveryAttempts, _retryBackoff);
    }

    @Override
    public String toString() {
        return "KafkaWriteConfiguration(topic=" + _topic + ", deliveryTimeout=" + _deliveryTimeout
                + ", maxDeliveryAttempts=" + _maxDeliveryAttempts + ", retryBackoff=" + _retryBackoff + ")";
    }

    /**
     * Builder for KafkaWriteConfiguration.
     */
    public static class Builder {
        private final String _topic;
        private final Schema _schema;

        private Duration _deliveryTimeout = DEFAULT_DELIVERY_TIMEOUT;
        private int _maxDeliveryAttempts = DEFAULT_MAX_DELIVERY_ATTEMPTS;
        private Duration _retryBackoff = DEFAULT_RETRY_BACKOFF;

        /**
         * Constructor.
         * @param topic the destination topic
         * @param schema the schema of the rows written to the topic
         */
        public Builder(final String topic, final Schema schema) {
            Preconditions.checkArgument(topic != null && !topic.isEmpty(), "topic must not be empty");
            _topic = topic;
            _schema = Preconditions.checkNotNull(schema, "schema");
        }

        public Builder setDeliveryTimeout(final Duration deliveryTimeout) {
            Preconditions.checkArgument(!deliveryTimeout.isNegative() && !deliveryTimeout.isZero(),
                    "deliveryTimeout must be positive");
            _deliveryTimeout = deliveryTimeout;
            return this;
        }

        public Builder setMaxDeliveryAttempts(final int maxDeliveryAttempts) {
            Preconditions.checkArgument(maxDeliveryAttempts >= 1, "maxDeliveryAttempts must be at least 1");
            _maxDeliveryAttempts = maxDeliveryAttempts;
            return this;
        }

        public Builder setRetryBackoff(final Duration retryBackoff) {
            Preconditions.checkArgument(!retryBackoff.isNegative(), "retryBackoff must not be negative");
            _retryBackoff = retryBackoff;
            return this;
        }

        public KafkaWriteConfiguration build() {
            return new KafkaWriteConfiguration(this);
        }
    }
}
