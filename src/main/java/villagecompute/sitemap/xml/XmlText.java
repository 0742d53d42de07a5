/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.xml;

import java.util.Objects;

/**
 * Text content destined for a single XML element.
 *
 * @param value
 *            the character data
 * @param preEscaped
 *            {@code true} when {@code value} is already safe for direct inclusion and must be written verbatim
 */
public record XmlText(String value, boolean preEscaped) {

    public XmlText {
        Objects.requireNonNull(value, "value");
    }

    /**
     * Text that the serializer escapes as usual.
     */
    public static XmlText escaped(String value) {
        return new XmlText(value, false);
    }

    /**
     * Text that is already entity-escaped and bypasses the serializer's escaping step.
     */
    public static XmlText preEscaped(String value) {
        return new XmlText(value, true);
    }
}
