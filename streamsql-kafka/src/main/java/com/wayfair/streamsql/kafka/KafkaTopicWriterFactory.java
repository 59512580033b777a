/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.kafka;

import java.time.Duration;
import java.util.Properties;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.MetricRegistry;

import com.wayfair.streamsql.common.VerifiableProperties;
import com.wayfair.streamsql.common.types.Schema;

/**
 * Creates {@link KafkaTopicWriter}s from properties.
 */
public class KafkaTopicWriterFactory {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaTopicWriterFactory.class.getName());

    static final String CONFIG_TOPIC = "topic";
    static final String CONFIG_DELIVERY_TIMEOUT_MS = "deliveryTimeoutMs";
    static final String CONFIG_MAX_DELIVERY_ATTEMPTS = "maxDeliveryAttempts";
    static final String CONFIG_RETRY_BACKOFF_MS = "retryBackoffMs";

    static final String CONFIG_PRODUCER_DOMAIN_PREFIX = "producer";

    private final MetricRegistry _metricRegistry;

    public KafkaTopicWriterFactory(final MetricRegistry metricRegistry) {
        _metricRegistry = metricRegistry;
    }

    public KafkaTopicWriterFactory() {
        this(new MetricRegistry());
    }

    /**
     * Create a writer.
     * @param name name the destination is registered under
     * @param properties writer properties, producer settings under the {@value #CONFIG_PRODUCER_DOMAIN_PREFIX} domain
     * @param schema schema of the rows written
     * @throws IllegalArgumentException if a required property is missing or a value is invalid
     */
    public KafkaTopicWriter createTopicWriter(final String name, final Properties properties, final Schema schema) {
        final VerifiableProperties writerProperties = new VerifiableProperties(properties);
        final KafkaWriteConfiguration config = createConfiguration(writerProperties, schema);
        final Properties producerProperties = createProducerProperties(writerProperties);
        writerProperties.verify();

        LOG.info("Creating Kafka topic writer {} with {}", name, config);
        return new KafkaTopicWriter(name, config,
                () -> new KafkaProducer<>(producerProperties, new ByteArraySerializer(), new ByteArraySerializer()),
                _metricRegistry);
    }

    static KafkaWriteConfiguration createConfiguration(final VerifiableProperties properties, final Schema schema) {
        final KafkaWriteConfiguration.Builder builder = new KafkaWriteConfiguration.Builder(
                properties.getString(CONFIG_TOPIC), schema);
        builder.setDeliveryTimeout(Duration.ofMillis(properties.getLong(CONFIG_DELIVERY_TIMEOUT_MS,
                KafkaWriteConfiguration.DEFAULT_DELIVERY_TIMEOUT.toMillis())));
        builder.setMaxDeliveryAttempts(properties.getInt(CONFIG_MAX_DELIVERY_ATTEMPTS,
                KafkaWriteConfiguration.DEFAULT_MAX_DELIVERY_ATTEMPTS));
        builder.setRetryBackoff(Duration.ofMillis(properties.getLong(CONFIG_RETRY_BACKOFF_MS,
                KafkaWriteConfiguration.DEFAULT_RETRY_BACKOFF.toMillis())));
        return builder.build();
    }

    static Properties createProducerProperties(final VerifiableProperties properties) {
        final Properties producerProperties = properties.getDomainProperties(CONFIG_PRODUCER_DOMAIN_PREFIX);
        if (!producerProperties.containsKey(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG)) {
            throw new IllegalArgumentException("Missing required property " + CONFIG_PRODUCER_DOMAIN_PREFIX
                    + "." + ProducerConfig.BOOTSTRAP_SERVERS_CONFIG);
        }
        // serializers are passed to the producer directly
        producerProperties.remove(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG);
        producerProperties.remove(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG);
        return producerProperties;
    }
}
