/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.url.video;

import villagecompute.sitemap.xml.XmlText;

/**
 * Custom rendering of a video field's stored value.
 */
@FunctionalInterface
public interface VideoFieldEncoder {

    /**
     * @param value
     *            the field's stored value, never {@code null}
     * @return the text of the element, or {@code null} to emit no element for this field
     */
    XmlText encode(Object value);
}
