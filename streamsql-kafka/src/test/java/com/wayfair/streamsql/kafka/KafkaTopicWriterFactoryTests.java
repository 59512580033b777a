/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.kafka;

import java.time.Duration;
import java.util.Properties;

import org.testng.annotations.Test;

import com.wayfair.streamsql.common.VerifiableProperties;
import com.wayfair.streamsql.common.types.DataType;
import com.wayfair.streamsql.common.types.Field;
import com.wayfair.streamsql.common.types.Schema;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;

public class KafkaTopicWriterFactoryTests {

    private static final Schema SCHEMA = Schema.of(new Field("id", DataType.INT64));

    private static Properties properties(final String... keyValues) {
        final Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    @Test
    public void testDefaults() {
        final KafkaWriteConfiguration config = KafkaTopicWriterFactory.createConfiguration(
                new VerifiableProperties(properties("topic", "events")), SCHEMA);

        assertEquals(config.getTopic(), "events");
        assertEquals(config.getSchema(), SCHEMA);
        assertEquals(config.getDeliveryTimeout(), Duration.ofSeconds(5));
        assertEquals(config.getMaxDeliveryAttempts(), 3);
        assertEquals(config.getRetryBackoff(), Duration.ofMillis(100));
    }

    @Test
    public void testOverrides() {
        final KafkaWriteConfiguration config = KafkaTopicWriterFactory.createConfiguration(
                new VerifiableProperties(properties("topic", "events", "deliveryTimeoutMs", "250",
                        "maxDeliveryAttempts", "7", "retryBackoffMs", "0")), SCHEMA);

        assertEquals(config.getDeliveryTimeout(), Duration.ofMillis(250));
        assertEquals(config.getMaxDeliveryAttempts(), 7);
        assertEquals(config.getRetryBackoff(), Duration.ZERO);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testTopicIsRequired() {
        KafkaTopicWriterFactory.createConfiguration(new VerifiableProperties(properties("maxDeliveryAttempts", "2")), SCHEMA);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testAttemptsMustBePositive() {
        KafkaTopicWriterFactory.createConfiguration(
                new VerifiableProperties(properties("topic", "events", "maxDeliveryAttempts", "0")), SCHEMA);
    }

    @Test
    public void testProducerPropertiesAreStripped() {
        final Properties producerProperties = KafkaTopicWriterFactory.createProducerProperties(new VerifiableProperties(
                properties("topic", "events", "producer.bootstrap.servers", "broker:9092", "producer.acks", "all",
                        "producer.value.serializer", "org.apache.kafka.common.serialization.StringSerializer")));

        assertEquals(producerProperties.getProperty("bootstrap.servers"), "broker:9092");
        assertEquals(producerProperties.getProperty("acks"), "all");
        assertFalse(producerProperties.containsKey("value.serializer"));
        assertFalse(producerProperties.containsKey("topic"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testBootstrapServersAreRequired() {
        KafkaTopicWriterFactory.createProducerProperties(new VerifiableProperties(properties("topic", "events")));
    }

    @Test
    public void testCreateTopicWriter() {
        final KafkaTopicWriter writer = new KafkaTopicWriterFactory().createTopicWriter("output",
                properties("topic", "events", "producer.bootstrap.servers", "localhost:9092"), SCHEMA);

        assertEquals(writer.getName(), "output");
        assertEquals(writer.getConfiguration().getTopic(), "events");
        assertEquals(writer.schema(), SCHEMA);
    }
}
