/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.kafka;

import java.util.List;
import java.util.function.Supplier;

import org.apache.kafka.clients.producer.Producer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.MetricRegistry;
import com.google.common.base.Preconditions;

import com.wayfair.streamsql.common.types.Schema;
import com.wayfair.streamsql.server.api.destination.BatchStream;
import com.wayfair.streamsql.server.api.destination.DataSinkExec;
import com.wayfair.streamsql.server.api.destination.UnsupportedDestinationOperationException;
import com.wayfair.streamsql.server.api.destination.WriteDestination;

/**
 * A write-only destination backed by a Kafka topic. Every insert gets its own {@link KafkaSink} and producer.
 */
public class KafkaTopicWriter implements WriteDestination {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaTopicWriter.class.getName());

    private final String _name;
    private final KafkaWriteConfiguration _config;
    private final Supplier<Producer<byte[], byte[]>> _producerSupplier;
    private final MetricRegistry _metricRegistry;

    /**
     * Constructor.
     * @param name name the destination is registered under
     * @param config the write configuration
     * @param producerSupplier creates the producer of each insert
     * @param metricRegistry registry for sink metrics
     */
    public KafkaTopicWriter(final String name, final KafkaWriteConfiguration config,
                            final Supplier<Producer<byte[], byte[]>> producerSupplier,
                            final MetricRegistry metricRegistry) {
        _name = name;
        _config = config;
        _producerSupplier = producerSupplier;
        _metricRegistry = metricRegistry;
    }

    public String getName() {
        return _name;
    }

    public KafkaWriteConfiguration getConfiguration() {
        return _config;
    }

    @Override
    public Schema schema() {
        return _config.getSchema();
    }

    @Override
    public BatchStream scan(final List<Integer> projection, final long limit) {
        throw new UnsupportedDestinationOperationException(
                "Reading not implemented for KafkaTopicWriter, please use KafkaTopicReader");
    }

    @Override
    public DataSinkExec insertInto(final BatchStream input, final boolean overwrite) {
        if (overwrite) {
            throw new UnsupportedDestinationOperationException("Overwrite not implemented for KafkaTopicWriter");
        }
        // checked before the producer exists so a rejected insert leaks nothing
        Preconditions.checkArgument(schema().equals(input.schema()),
                "Input schema %s does not match destination schema %s", input.schema(), schema());
        LOG.info("Planning insert into {} (topic {})", _name, _config.getTopic());
        final KafkaSink sink = new KafkaSink(_producerSupplier.get(), _config, _metricRegistry);
        return new DataSinkExec(input, sink, schema());
    }

    @Override
    public String toString() {
        return "KafkaTopicWriter(name=" + _name + ", topic=" + _config.getTopic() + ")";
    }
}
