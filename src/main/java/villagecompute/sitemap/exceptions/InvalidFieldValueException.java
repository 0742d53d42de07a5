/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.exceptions;

/**
 * Exception thrown when a sitemap URL field is assigned a value it cannot hold (relative location, negative count,
 * rating outside the allowed range, list given to a scalar field).
 *
 * <p>
 * Raised by setters at assignment time so that serialization never has to deal with malformed input.
 */
public class InvalidFieldValueException extends RuntimeException {

    private final String fieldName;

    public InvalidFieldValueException(String fieldName, String reason) {
        super("Invalid value for field " + fieldName + ": " + reason);
        this.fieldName = fieldName;
    }

    public InvalidFieldValueException(String fieldName, String reason, Throwable cause) {
        super("Invalid value for field " + fieldName + ": " + reason, cause);
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
