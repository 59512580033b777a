/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.kafka;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.errors.NetworkException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.codahale.metrics.MetricRegistry;

import com.wayfair.streamsql.common.types.DataType;
import com.wayfair.streamsql.common.types.Field;
import com.wayfair.streamsql.common.types.RowBatch;
import com.wayfair.streamsql.common.types.Schema;
import com.wayfair.streamsql.server.api.TaskContext;
import com.wayfair.streamsql.server.api.destination.BatchStream;
import com.wayfair.streamsql.server.api.destination.BatchStreamException;
import com.wayfair.streamsql.server.api.destination.BatchStreams;
import com.wayfair.streamsql.server.api.destination.QueueBatchStream;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

public class KafkaSinkTests {

    private static final String TOPIC = "query-output";
    private static final Schema SCHEMA = Schema.of(new Field("id", DataType.INT32), new Field("name", DataType.UTF8));

    private MetricRegistry _metricRegistry;

    @BeforeMethod
    public void setup() {
        _metricRegistry = new MetricRegistry();
    }

    private static RowBatch batch(final int firstId, final int rows) {
        final RowBatch.Builder builder = new RowBatch.Builder(SCHEMA);
        for (int i = 0; i < rows; i++) {
            builder.addRow(firstId + i, "row" + (firstId + i));
        }
        return builder.build();
    }

    private static KafkaWriteConfiguration config(final int maxAttempts) {
        return new KafkaWriteConfiguration.Builder(TOPIC, SCHEMA)
                .setDeliveryTimeout(Duration.ofMillis(50))
                .setMaxDeliveryAttempts(maxAttempts)
                .setRetryBackoff(Duration.ofMillis(1))
                .build();
    }

    private static MockProducer<byte[], byte[]> mockProducer(final boolean autoComplete) {
        return new MockProducer<>(autoComplete, new ByteArraySerializer(), new ByteArraySerializer());
    }

    private static Future<RecordMetadata> failedSend() {
        final CompletableFuture<RecordMetadata> future = new CompletableFuture<>();
        future.completeExceptionally(new NetworkException("broker unavailable"));
        return future;
    }

    private static Future<RecordMetadata> successfulSend() {
        return CompletableFuture.completedFuture(null);
    }

    @SuppressWarnings("unchecked")
    private static Producer<byte[], byte[]> mockedProducer() {
        return (Producer<byte[], byte[]>) mock(Producer.class);
    }

    private long counter(final String name) {
        return _metricRegistry.counter(MetricRegistry.name("KafkaSink", TOPIC, name)).getCount();
    }

    private long meter(final String name) {
        return _metricRegistry.meter(MetricRegistry.name("KafkaSink", TOPIC, name)).getCount();
    }

    @Test
    public void testEmptyBatchesAreSkipped() {
        final MockProducer<byte[], byte[]> producer = mockProducer(true);
        final KafkaSink sink = new KafkaSink(producer, config(3), _metricRegistry);

        final long rows = sink.writeAll(BatchStreams.of(SCHEMA, RowBatch.empty(SCHEMA), RowBatch.empty(SCHEMA)),
                new TaskContext("empty"));

        assertEquals(rows, 0L);
        assertTrue(producer.history().isEmpty());
        assertEquals(counter("emptyBatchesSkipped"), 2L);
    }

    @Test
    public void testOneMessagePerBatchInOrder() {
        final MockProducer<byte[], byte[]> producer = mockProducer(true);
        final KafkaSink sink = new KafkaSink(producer, config(3), _metricRegistry);

        final long rows = sink.writeAll(BatchStreams.of(SCHEMA, batch(1, 3), RowBatch.empty(SCHEMA), batch(4, 2)),
                new TaskContext("ordered"));

        assertEquals(rows, 5L);
        final List<ProducerRecord<byte[], byte[]>> history = producer.history();
        assertEquals(history.size(), 2);
        for (final ProducerRecord<byte[], byte[]> record : history) {
            assertEquals(record.topic(), TOPIC);
            assertNull(record.key());
        }
        assertEquals(new String(history.get(0).value(), StandardCharsets.UTF_8),
                "{\"id\":1,\"name\":\"row1\"}\n{\"id\":2,\"name\":\"row2\"}\n{\"id\":3,\"name\":\"row3\"}\n");
        assertEquals(new String(history.get(1).value(), StandardCharsets.UTF_8),
                "{\"id\":4,\"name\":\"row4\"}\n{\"id\":5,\"name\":\"row5\"}\n");
        assertEquals(meter("rowsWritten"), 5L);
        assertEquals(meter("messagesSent"), 2L);
        assertEquals(counter("emptyBatchesSkipped"), 1L);
    }

    @Test
    public void testFailedDeliveryIsRetried() {
        final Producer<byte[], byte[]> producer = mockedProducer();
        when(producer.send(any())).thenReturn(failedSend(), successfulSend());
        final KafkaSink sink = new KafkaSink(producer, config(3), _metricRegistry);

        assertEquals(sink.writeAll(BatchStreams.of(SCHEMA, batch(1, 2)), new TaskContext("retry")), 2L);

        verify(producer, times(2)).send(any());
        assertEquals(counter("deliveryFailures"), 1L);
        assertEquals(meter("messagesSent"), 1L);
    }

    @Test
    public void testExhaustedRetriesReportRowsWritten() {
        final Producer<byte[], byte[]> producer = mockedProducer();
        when(producer.send(any())).thenReturn(successfulSend(), failedSend());
        final KafkaSink sink = new KafkaSink(producer, config(2), _metricRegistry);

        try {
            sink.writeAll(BatchStreams.of(SCHEMA, batch(1, 3), batch(4, 2), batch(6, 1)), new TaskContext("exhausted"));
            fail("Expected DeliveryException");
        } catch (final DeliveryException e) {
            assertEquals(e.getRowsWritten(), 3L);
            assertTrue(e.getCause() instanceof NetworkException);
        }
        // one successful send plus two failed attempts for the second batch, the third batch is never sent
        verify(producer, times(3)).send(any());
        assertEquals(counter("deliveryFailures"), 2L);
    }

    @Test
    public void testUnacknowledgedSendTimesOut() {
        final MockProducer<byte[], byte[]> producer = mockProducer(false);
        final KafkaSink sink = new KafkaSink(producer, config(1), _metricRegistry);

        try {
            sink.writeAll(BatchStreams.of(SCHEMA, batch(1, 1)), new TaskContext("timeout"));
            fail("Expected DeliveryException");
        } catch (final DeliveryException e) {
            assertEquals(e.getRowsWritten(), 0L);
            assertTrue(e.getCause() instanceof TimeoutException);
        }
    }

    @Test
    public void testCancelledTaskStopsPulling() throws Exception {
        final MockProducer<byte[], byte[]> producer = mockProducer(true);
        final KafkaSink sink = new KafkaSink(producer, config(3), _metricRegistry);
        final TaskContext context = new TaskContext("cancel");
        final BatchStream stream = mock(BatchStream.class);
        when(stream.next()).thenReturn(Optional.of(batch(1, 2))).thenAnswer(invocation -> {
            context.cancel();
            return Optional.of(batch(3, 2));
        });

        assertEquals(sink.writeAll(stream, context), 2L);

        verify(stream, times(2)).next();
        assertEquals(producer.history().size(), 1);
    }

    @Test
    public void testCancelWakesWriteBlockedOnIdleStream() throws Exception {
        final MockProducer<byte[], byte[]> producer = mockProducer(true);
        final KafkaSink sink = new KafkaSink(producer, config(3), _metricRegistry);
        final TaskContext context = new TaskContext("idle");
        final QueueBatchStream stream = new QueueBatchStream(SCHEMA, 4);
        stream.put(batch(1, 3));

        final AtomicLong rows = new AtomicLong(-1);
        final AtomicBoolean interruptLeaked = new AtomicBoolean();
        final Thread writer = new Thread(() -> {
            rows.set(sink.writeAll(stream, context));
            interruptLeaked.set(Thread.currentThread().isInterrupted());
        });
        writer.start();

        final long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(5);
        while (producer.history().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(producer.history().size(), 1);

        // the writer is now waiting on an empty queue that is never finished
        context.cancel();
        writer.join(TimeUnit.SECONDS.toMillis(5));

        assertFalse(writer.isAlive());
        assertEquals(rows.get(), 3L);
        assertFalse(interruptLeaked.get());
        assertEquals(producer.history().size(), 1);
    }

    @Test
    public void testCancelledBeforeStartWritesNothing() throws Exception {
        final MockProducer<byte[], byte[]> producer = mockProducer(true);
        final KafkaSink sink = new KafkaSink(producer, config(3), _metricRegistry);
        final TaskContext context = new TaskContext("cancelled");
        context.cancel();
        final BatchStream stream = mock(BatchStream.class);

        assertEquals(sink.writeAll(stream, context), 0L);
        verify(stream, never()).next();
        assertFalse(Thread.currentThread().isInterrupted());
    }

    @Test
    public void testUpstreamFailurePropagates() throws Exception {
        final MockProducer<byte[], byte[]> producer = mockProducer(true);
        final KafkaSink sink = new KafkaSink(producer, config(3), _metricRegistry);
        final QueueBatchStream stream = new QueueBatchStream(SCHEMA, 4);
        stream.put(batch(1, 2));
        stream.fail(new IllegalStateException("upstream"));

        try {
            sink.writeAll(stream, new TaskContext("upstream"));
            fail("Expected BatchStreamException");
        } catch (final BatchStreamException e) {
            assertEquals(producer.history().size(), 1);
        }
    }

    @Test
    public void testCloseClosesProducer() {
        final MockProducer<byte[], byte[]> producer = mockProducer(true);
        new KafkaSink(producer, config(3), _metricRegistry).close();
        assertTrue(producer.closed());
    }
}
