/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.kafka;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;

import com.wayfair.streamsql.common.translator.LineDelimitedJsonTranslator;
import com.wayfair.streamsql.common.translator.RecordTranslator;
import com.wayfair.streamsql.common.types.RowBatch;
import com.wayfair.streamsql.server.api.TaskContext;
import com.wayfair.streamsql.server.api.destination.BatchStream;
import com.wayfair.streamsql.server.api.destination.BatchStreamException;
import com.wayfair.streamsql.server.api.destination.DataSink;

/**
 * Publishes every non-empty batch of a stream as one Kafka record. The record value is the batch encoded
 * as newline-delimited JSON, the record has no key.
 * <p>
 * Batches are pulled and published strictly one at a time and in order: the next batch is not pulled until
 * the previous publish has been acknowledged, so a slow broker throttles the upstream producer.
 * Cancelling the task interrupts the writing thread, so a write blocked on an idle stream or on an
 * acknowledgement returns promptly with the rows acknowledged so far.
 * Delivery is at-least-once; a batch whose acknowledgement timed out may have been written anyway.
 * <p>
 * The sink owns its producer and closes it in {@link #close()}.
 */
public class KafkaSink implements DataSink {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaSink.class.getName());

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final Producer<byte[], byte[]> _producer;
    private final KafkaWriteConfiguration _config;
    private final RecordTranslator<RowBatch, byte[]> _translator;

    private final Meter _rowsWritten;
    private final Meter _messagesSent;
    private final Counter _emptyBatchesSkipped;
    private final Counter _deliveryFailures;

    /**
     * Constructor.
     * @param producer the producer, owned by this sink from now on
     * @param config configuration of the destination
     * @param metricRegistry registry the sink metrics are added to
     */
    public KafkaSink(final Producer<byte[], byte[]> producer, final KafkaWriteConfiguration config,
                     final MetricRegistry metricRegistry) {
        _producer = producer;
        _config = config;
        _translator = new LineDelimitedJsonTranslator();

        final String prefix = MetricRegistry.name(KafkaSink.class.getSimpleName(), config.getTopic());
        _rowsWritten = metricRegistry.meter(MetricRegistry.name(prefix, "rowsWritten"));
        _messagesSent = metricRegistry.meter(MetricRegistry.name(prefix, "messagesSent"));
        _emptyBatchesSkipped = metricRegistry.counter(MetricRegistry.name(prefix, "emptyBatchesSkipped"));
        _deliveryFailures = metricRegistry.counter(MetricRegistry.name(prefix, "deliveryFailures"));
    }

    /**
     * {@inheritDoc}
     *
     * @throws DeliveryException if a batch could not be published within the configured attempts
     */
    @Override
    public long writeAll(final BatchStream data, final TaskContext context) {
        final String topic = _config.getTopic();
        final Thread writer = Thread.currentThread();
        final AtomicBoolean interruptedOnCancel = new AtomicBoolean();
        final Runnable cancelListener = () -> {
            interruptedOnCancel.set(true);
            writer.interrupt();
        };
        context.addCancelListener(cancelListener);

        long rowCount = 0;
        try {
            while (!isStopped(context)) {
                final Optional<RowBatch> next = data.next();
                if (!next.isPresent()) {
                    LOG.info("Task {} wrote {} rows to topic {}", context.getTaskId(), rowCount, topic);
                    return rowCount;
                }
                final RowBatch batch = next.get();
                if (batch.isEmpty()) {
                    _emptyBatchesSkipped.inc();
                    continue;
                }

                final byte[] payload = _translator.translateFromInternalFormat(batch);
                if (!publish(payload, batch.getNumRows(), rowCount, context)) {
                    break;
                }
                rowCount += batch.getNumRows();
                _rowsWritten.mark(batch.getNumRows());
                _messagesSent.mark();
                LOG.debug("Published {} rows ({} bytes) to topic {}", batch.getNumRows(), payload.length, topic);
            }
            LOG.info("Task {} was stopped after writing {} rows to topic {}", context.getTaskId(), rowCount, topic);
            return rowCount;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            if (context.isCancelled()) {
                LOG.info("Task {} was cancelled after writing {} rows to topic {}", context.getTaskId(), rowCount, topic);
            } else {
                LOG.warn("Task {} was interrupted after writing {} rows to topic {}", context.getTaskId(), rowCount, topic);
            }
            return rowCount;
        } catch (final BatchStreamException e) {
            LOG.error("Upstream failure in task {} after writing {} rows to topic {}", context.getTaskId(), rowCount, topic, e);
            throw e;
        } finally {
            context.removeCancelListener(cancelListener);
            if (interruptedOnCancel.get()) {
                // the interrupt only woke this write, the cancellation is reported by the returned count
                Thread.interrupted();
            }
        }
    }

    /**
     * Publish one payload, retrying up to the configured number of attempts.
     * @return true once the payload is acknowledged, false if the task was cancelled before that
     * @throws DeliveryException if every attempt failed
     */
    private boolean publish(final byte[] payload, final int rows, final long rowsWritten, final TaskContext context)
            throws InterruptedException {
        final String topic = _config.getTopic();
        final int maxAttempts = _config.getMaxDeliveryAttempts();
        final ProducerRecord<byte[], byte[]> record = new ProducerRecord<>(topic, payload);
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (isStopped(context)) {
                return false;
            }
            if (attempt > 1) {
                TimeUnit.MILLISECONDS.sleep(_config.getRetryBackoff().toMillis());
            }
            try {
                _producer.send(record).get(_config.getDeliveryTimeout().toMillis(), TimeUnit.MILLISECONDS);
                return true;
            } catch (final ExecutionException e) {
                lastFailure = e.getCause() instanceof Exception ? (Exception) e.getCause() : e;
            } catch (final TimeoutException | KafkaException e) {
                lastFailure = e;
            }
            _deliveryFailures.inc();
            LOG.warn("Attempt {} of {} to publish {} rows to topic {} failed", attempt, maxAttempts, rows, topic, lastFailure);
        }
        LOG.error("Unable to publish {} rows to topic {}, {} rows were published before", rows, topic, rowsWritten);
        throw new DeliveryException(String.format("Unable to publish %d rows to topic %s after %d attempts",
                rows, topic, maxAttempts), rowsWritten, lastFailure);
    }

    private static boolean isStopped(final TaskContext context) {
        return context.isCancelled() || Thread.currentThread().isInterrupted();
    }

    public KafkaWriteConfiguration getConfiguration() {
        return _config;
    }

    @Override
    public void close() {
        LOG.info("Closing the producer of {}", this);
        _producer.close(CLOSE_TIMEOUT);
    }

    @Override
    public String toString() {
        return "KafkaSink(topic=" + _config.getTopic() + ")";
    }
}
