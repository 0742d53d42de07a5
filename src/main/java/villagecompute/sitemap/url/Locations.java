/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.url;

import java.net.URI;
import java.net.URISyntaxException;

import villagecompute.sitemap.exceptions.InvalidFieldValueException;

/**
 * Parsing and validation of the absolute locations carried by sitemap entries.
 */
public final class Locations {

    private Locations() {
        // Utility class, no instantiation
    }

    /**
     * Parses a location string.
     *
     * @param fieldName
     *            field reported in the exception
     * @param value
     *            location text
     * @return the validated absolute URI
     * @throws InvalidFieldValueException
     *             if the text is blank, malformed, relative, or not http(s)
     */
    public static URI parse(String fieldName, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidFieldValueException(fieldName, "location must not be blank");
        }
        try {
            return requireAbsoluteHttp(fieldName, new URI(value.trim()));
        } catch (URISyntaxException e) {
            throw new InvalidFieldValueException(fieldName, "malformed URI '" + value + "'", e);
        }
    }

    /**
     * Ensures a location is absolute and uses http or https.
     */
    public static URI requireAbsoluteHttp(String fieldName, URI value) {
        if (value == null) {
            throw new InvalidFieldValueException(fieldName, "location must not be null");
        }
        String scheme = value.getScheme();
        if (!value.isAbsolute() || value.getHost() == null
                || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new InvalidFieldValueException(fieldName, "expected an absolute http(s) URI, got '" + value + "'");
        }
        return value;
    }
}
