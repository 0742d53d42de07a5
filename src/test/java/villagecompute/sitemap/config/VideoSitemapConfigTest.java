/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import villagecompute.sitemap.config.VideoSitemapConfig.SitemapConfigurationException;
import villagecompute.sitemap.url.video.VideoField;

/**
 * Unit tests for {@link VideoSitemapConfig} validation logic.
 *
 * <p>
 * <b>Note:</b> These are lightweight unit tests that don't require Quarkus context.
 */
class VideoSitemapConfigTest {

    @Test
    void testValidationSucceedsWithDefaultOrder() {
        VideoSitemapConfig config = new VideoSitemapConfig();
        config.fieldOrder = VideoField.DEFAULT_ORDER;

        assertDoesNotThrow(config::validateConfiguration);
        assertEquals(VideoField.DEFAULT_ORDER, config.fieldOrder());
    }

    @Test
    void testValidationToleratesUnknownFieldNames() {
        VideoSitemapConfig config = new VideoSitemapConfig();
        config.fieldOrder = List.of("title", "gallery_loc");

        assertDoesNotThrow(config::validateConfiguration, "Unknown names only produce a warning");
        assertEquals(List.of("title", "gallery_loc"), config.fieldOrder());
    }

    @Test
    void testValidationFailsWithNullFieldOrder() {
        VideoSitemapConfig config = new VideoSitemapConfig();
        config.fieldOrder = null;

        assertThrows(SitemapConfigurationException.class, config::validateConfiguration);
    }

    @Test
    void testValidationFailsWithEmptyFieldOrder() {
        VideoSitemapConfig config = new VideoSitemapConfig();
        config.fieldOrder = List.of();

        assertThrows(SitemapConfigurationException.class, config::validateConfiguration);
    }
}
