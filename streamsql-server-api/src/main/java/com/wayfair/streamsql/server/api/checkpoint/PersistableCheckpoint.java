/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.server.api.checkpoint;

/**
 * A checkpoint that can be stored outside of the process, e.g. in Kafka or a state store.
 */
public interface PersistableCheckpoint {
    /**
     * Serialize a checkpoint into its String representation so it can be stored somewhere like Kafka
     * @return the serialized checkpoint
     */
    String serialize();

    /**
     * Deserializer of Checkpoint
     *
     * @param <T> checkpoint type
     */
    interface Deserializer<T extends PersistableCheckpoint> {

        /**
         * Deserialize a value represented as String and return an instance of the checkpoint
         * @param value serialized checkpoint
         * @return the checkpoint
         */
        T deserialize(String value);
    }
}
