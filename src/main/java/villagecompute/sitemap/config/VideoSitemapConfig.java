/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.config;

import java.util.List;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.sitemap.url.video.VideoField;

/**
 * Configuration for sitemap rendering.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code villagecompute.sitemap.video.field-order} - comma-separated video field names, in output order (default:
 * the 13 fields of the video extension in schema order)</li>
 * <li>{@code villagecompute.sitemap.pretty-print} - indent generated XML (default: false)</li>
 * </ul>
 *
 * <p>
 * Unknown field names are accepted with a warning; they never produce an element.
 */
@ApplicationScoped
@Startup
public class VideoSitemapConfig {

    private static final Logger LOG = Logger.getLogger(VideoSitemapConfig.class);

    @ConfigProperty(
            name = "villagecompute.sitemap.video.field-order",
            defaultValue = "player_loc,content_loc,thumbnail_loc,title,description,expiration_date,duration,rating,"
                    + "view_count,publication_date,tag,category,family_friendly")
    List<String> fieldOrder;

    @ConfigProperty(
            name = "villagecompute.sitemap.pretty-print",
            defaultValue = "false")
    boolean prettyPrint;

    /**
     * Validates the configured field order at startup.
     *
     * @throws SitemapConfigurationException
     *             if the field order is missing or empty
     */
    @PostConstruct
    public void validateConfiguration() {
        if (fieldOrder == null || fieldOrder.isEmpty()) {
            String errorMessage = "villagecompute.sitemap.video.field-order must list at least one video field";
            LOG.fatal(errorMessage);
            throw new SitemapConfigurationException(errorMessage);
        }
        for (String name : fieldOrder) {
            if (VideoField.fromName(name).isEmpty()) {
                LOG.warnf("Unknown video field '%s' in villagecompute.sitemap.video.field-order will be ignored",
                        name);
            }
        }
        LOG.infof("Video sitemap configured with field order %s (prettyPrint=%s)", fieldOrder, prettyPrint);
    }

    public List<String> fieldOrder() {
        return List.copyOf(fieldOrder);
    }

    public boolean prettyPrint() {
        return prettyPrint;
    }

    /**
     * Exception thrown when sitemap configuration is invalid or incomplete.
     */
    public static class SitemapConfigurationException extends RuntimeException {

        public SitemapConfigurationException(String message) {
            super(message);
        }
    }
}
