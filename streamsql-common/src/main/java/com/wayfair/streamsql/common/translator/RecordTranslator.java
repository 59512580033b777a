/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.common.translator;

/**
 * Translates records from the internal format into an external representation.
 *
 * @param <I> internal record type
 * @param <O> external record type
 */
public interface RecordTranslator<I, O> {

    /**
     * Translates a record from the internal format.
     *
     * @param record the record in the internal format
     * @return the translated record
     * @throws RecordTranslationException if the record cannot be translated
     */
    O translateFromInternalFormat(I record);
}
