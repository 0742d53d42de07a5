/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.url.video;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import villagecompute.sitemap.xml.XmlTreeBuilder;

/**
 * Attributes of Google's video sitemap extension, declared in their default output order.
 */
public enum VideoField {
    PLAYER_LOC, CONTENT_LOC, THUMBNAIL_LOC, TITLE, DESCRIPTION, EXPIRATION_DATE, DURATION, RATING, VIEW_COUNT,
    PUBLICATION_DATE, TAG, CATEGORY, FAMILY_FRIENDLY;

    /**
     * Field names in declaration order, used when no explicit field order is configured.
     */
    public static final List<String> DEFAULT_ORDER = Arrays.stream(values()).map(VideoField::fieldName).toList();

    /**
     * Name used in field order lists and in the element name, e.g. {@code player_loc}.
     */
    public String fieldName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Qualified element name, e.g. {@code video:player_loc}.
     */
    public String elementName() {
        return XmlTreeBuilder.VIDEO_PREFIX + ":" + fieldName();
    }

    /**
     * Whether the field holds a list, each entry producing its own element.
     */
    public boolean isList() {
        return this == TAG || this == CATEGORY;
    }

    /**
     * Looks up a field by its name.
     *
     * @param fieldName
     *            name such as {@code view_count}
     * @return the field, or empty for unknown names
     */
    public static Optional<VideoField> fromName(String fieldName) {
        if (fieldName == null) {
            return Optional.empty();
        }
        String normalized = fieldName.trim();
        for (VideoField field : values()) {
            if (field.fieldName().equals(normalized)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
