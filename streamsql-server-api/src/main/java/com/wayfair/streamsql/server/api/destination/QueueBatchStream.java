/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.server.api.destination;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import com.wayfair.streamsql.common.types.RowBatch;
import com.wayfair.streamsql.common.types.Schema;

/**
 * A {@link BatchStream} fed by another thread through a bounded queue. The producer blocks in
 * {@link #put(RowBatch)} while the queue is full, so a slow consumer throttles the producer.
 */
public class QueueBatchStream implements BatchStream {
    private static final Logger LOG = LoggerFactory.getLogger(QueueBatchStream.class.getName());

    private static final class Element {
        private static final Element END = new Element(null, null);

        private final RowBatch _batch;
        private final Throwable _error;

        private Element(final RowBatch batch, final Throwable error) {
            _batch = batch;
            _error = error;
        }
    }

    private final Schema _schema;
    private final BlockingQueue<Element> _queue;
    private volatile boolean _finished;

    public QueueBatchStream(final Schema schema, final int capacity) {
        _schema = schema;
        _queue = new LinkedBlockingQueue<>(capacity);
    }

    @Override
    public Schema schema() {
        return _schema;
    }

    /**
     * Submits a batch, waiting for room in the queue.
     * @throws IllegalStateException if the stream was already finished
     */
    public void put(final RowBatch batch) throws InterruptedException {
        Preconditions.checkState(!_finished, "Stream is already finished");
        Preconditions.checkArgument(_schema.equals(batch.getSchema()),
                "Batch schema %s does not match stream schema %s", batch.getSchema(), _schema);
        _queue.put(new Element(batch, null));
    }

    /**
     * Ends the stream with an error; the consumer sees it after all batches submitted before.
     */
    public void fail(final Throwable error) throws InterruptedException {
        end(new Element(null, error));
    }

    /**
     * Ends the stream normally.
     */
    public void finish() throws InterruptedException {
        end(Element.END);
    }

    private void end(final Element element) throws InterruptedException {
        if (_finished) {
            LOG.warn("Stream is already finished");
            return;
        }
        _finished = true;
        _queue.put(element);
    }

    @Override
    public Optional<RowBatch> next() throws InterruptedException {
        final Element element = _queue.take();
        if (element == Element.END) {
            // Keep the marker so that later calls also see the end of the stream
            _queue.offer(element);
            return Optional.empty();
        }
        if (element._error != null) {
            _queue.offer(element);
            throw new BatchStreamException("Upstream batch producer failed", element._error);
        }
        return Optional.of(element._batch);
    }
}
