/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.accumulators.checkpoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.wayfair.streamsql.common.types.ScalarValue;
import com.wayfair.streamsql.server.api.aggregate.AggregateKind;
import com.wayfair.streamsql.server.api.checkpoint.PersistableCheckpoint;

/**
 * The captured state of an accumulator.
 * <p>
 * Serialized format: {@code {"version": 1, "kind": "ARRAY_AGG", "state": [<self describing value>, ...]}},
 * see {@link SerializableScalarValue} for the element format.
 */
public class AccumulatorCheckpoint implements PersistableCheckpoint {

    public static final int VERSION = 1;

    static final String VERSION_FIELD_NAME = "version";
    static final String KIND_FIELD_NAME = "kind";
    static final String STATE_FIELD_NAME = "state";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final AggregateKind _kind;
    private final List<ScalarValue> _state;

    public AccumulatorCheckpoint(final AggregateKind kind, final List<ScalarValue> state) {
        _kind = kind;
        _state = Collections.unmodifiableList(new ArrayList<>(state));
    }

    public AggregateKind getKind() {
        return _kind;
    }

    public List<ScalarValue> getState() {
        return _state;
    }

    /**
     * Serialize the checkpoint to JSON.
     * @throws CheckpointEncodeException if the state cannot be written
     */
    @Override
    public String serialize() {
        final ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(VERSION_FIELD_NAME, VERSION);
        node.put(KIND_FIELD_NAME, _kind.name());
        final ArrayNode stateNode = node.putArray(STATE_FIELD_NAME);
        try {
            for (final ScalarValue value : _state) {
                stateNode.add(SerializableScalarValue.toJson(value));
            }
            return OBJECT_MAPPER.writeValueAsString(node);
        } catch (final JsonProcessingException | RuntimeException e) {
            throw new CheckpointEncodeException("Unable to serialize " + _kind + " checkpoint", e);
        }
    }

    @Override
    public String toString() {
        return _kind + ":" + _state;
    }

    /**
     * Deserializer of AccumulatorCheckpoint.
     */
    public static class Deserializer implements PersistableCheckpoint.Deserializer<AccumulatorCheckpoint> {

        /**
         * @throws CheckpointDecodeException if the value is not a valid checkpoint
         */
        @Override
        public AccumulatorCheckpoint deserialize(final String value) {
            if (value == null) {
                throw new CheckpointDecodeException("Checkpoint is null");
            }
            final JsonNode node;
            try {
                node = OBJECT_MAPPER.readTree(value);
            } catch (final JsonProcessingException e) {
                throw new CheckpointDecodeException("Checkpoint is not valid JSON", e);
            }
            if (node == null || !node.isObject()) {
                throw new CheckpointDecodeException("Checkpoint is not a JSON object: " + value);
            }

            final JsonNode versionNode = node.get(VERSION_FIELD_NAME);
            if (versionNode == null || !versionNode.isInt() || versionNode.intValue() != VERSION) {
                throw new CheckpointDecodeException("Unsupported checkpoint version " + versionNode);
            }

            final JsonNode kindNode = node.get(KIND_FIELD_NAME);
            final AggregateKind kind;
            try {
                kind = AggregateKind.valueOf(kindNode == null ? "" : kindNode.asText());
            } catch (final IllegalArgumentException e) {
                throw new CheckpointDecodeException("Unknown aggregate kind " + kindNode, e);
            }

            final JsonNode stateNode = node.get(STATE_FIELD_NAME);
            if (stateNode == null || !stateNode.isArray()) {
                throw new CheckpointDecodeException("Checkpoint has no state array");
            }
            final List<ScalarValue> state = new ArrayList<>(stateNode.size());
            for (final JsonNode element : stateNode) {
                state.add(SerializableScalarValue.fromJson(element));
            }
            return new AccumulatorCheckpoint(kind, state);
        }
    }
}
