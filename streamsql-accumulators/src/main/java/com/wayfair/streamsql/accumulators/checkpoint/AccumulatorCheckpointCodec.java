/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.accumulators.checkpoint;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wayfair.streamsql.accumulators.Accumulators;
import com.wayfair.streamsql.common.types.DataType;
import com.wayfair.streamsql.common.types.ScalarValue;
import com.wayfair.streamsql.server.api.aggregate.Accumulator;
import com.wayfair.streamsql.server.api.aggregate.AggregateKind;

/**
 * Captures the state of an {@link Accumulator} into a checkpoint string and restores live accumulators
 * from such strings.
 * <p>
 * Restoring never assigns state directly: a fresh accumulator is created for the type inferred from the
 * first state element and the state is fed through {@link Accumulator#merge(List)}. The restored accumulator
 * therefore behaves like one that saw the original inputs, including when it is merged with further
 * partial states.
 * <p>
 * The codec holds no state and may be shared between threads. A single accumulator must not be updated
 * while it is being captured.
 */
public class AccumulatorCheckpointCodec {

    private static final Logger LOG = LoggerFactory.getLogger(AccumulatorCheckpointCodec.class.getName());

    private final AccumulatorCheckpoint.Deserializer _deserializer = new AccumulatorCheckpoint.Deserializer();

    /**
     * Capture the state of an accumulator.
     * @param accumulator the accumulator, not modified
     * @return the serialized checkpoint
     * @throws CheckpointEncodeException if the state cannot be extracted or serialized
     */
    public String capture(final Accumulator accumulator) {
        final List<ScalarValue> state;
        try {
            state = accumulator.state();
        } catch (final RuntimeException e) {
            throw new CheckpointEncodeException("Unable to extract state of " + accumulator, e);
        }
        final String checkpoint = new AccumulatorCheckpoint(accumulator.kind(), state).serialize();
        LOG.debug("Captured {} state elements of {}", state.size(), accumulator);
        return checkpoint;
    }

    /**
     * Restore an accumulator from a checkpoint.
     * @param checkpoint a string produced by {@link #capture(Accumulator)}
     * @return a new accumulator holding the captured state
     * @throws EmptyCheckpointStateException if the checkpoint holds no state
     * @throws CheckpointDecodeException if the checkpoint is malformed
     */
    public Accumulator restore(final String checkpoint) {
        return restore(_deserializer.deserialize(checkpoint));
    }

    /**
     * Restore an accumulator from a checkpoint that must have been captured from an accumulator of the given kind.
     * @throws CheckpointDecodeException if the checkpoint is malformed or was captured from another kind
     * @throws EmptyCheckpointStateException if the checkpoint holds no state
     */
    public Accumulator restore(final String checkpoint, final AggregateKind expectedKind) {
        final AccumulatorCheckpoint accumulatorCheckpoint = _deserializer.deserialize(checkpoint);
        if (accumulatorCheckpoint.getKind() != expectedKind) {
            throw new CheckpointDecodeException("Expected a " + expectedKind + " checkpoint but got "
                    + accumulatorCheckpoint.getKind());
        }
        return restore(accumulatorCheckpoint);
    }

    private Accumulator restore(final AccumulatorCheckpoint checkpoint) {
        final List<ScalarValue> state = checkpoint.getState();
        if (state.isEmpty()) {
            throw new EmptyCheckpointStateException("Empty state in " + checkpoint.getKind()
                    + " checkpoint, there is no type information to restore an accumulator from");
        }

        final ScalarValue first = state.get(0);
        for (final ScalarValue element : state) {
            if (!first.getType().equals(element.getType())) {
                throw new CheckpointDecodeException("Heterogeneous state: " + element.getType()
                        + " does not match " + first.getType());
            }
        }

        final Accumulator accumulator;
        try {
            final DataType dataType = Accumulators.inferDataType(checkpoint.getKind(), first);
            accumulator = Accumulators.create(checkpoint.getKind(), dataType);
            accumulator.merge(state);
        } catch (final IllegalArgumentException | ArithmeticException e) {
            throw new CheckpointDecodeException("State does not fit a " + checkpoint.getKind() + " accumulator", e);
        }
        LOG.debug("Restored {} from {} state elements", accumulator, state.size());
        return accumulator;
    }
}
