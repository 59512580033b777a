/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.common.translator;

import com.wayfair.streamsql.common.StreamSqlRuntimeException;

/**
 * An exception raised when a record cannot be translated to or from the internal format.
 */
public class RecordTranslationException extends StreamSqlRuntimeException {
    private static final long serialVersionUID = 1;

    public RecordTranslationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
