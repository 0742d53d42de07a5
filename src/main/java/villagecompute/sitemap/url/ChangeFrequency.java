/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.url;

import java.util.Locale;

import villagecompute.sitemap.exceptions.InvalidFieldValueException;

/**
 * Expected change frequency of a page, as defined by the sitemaps.org protocol.
 */
public enum ChangeFrequency {
    ALWAYS, HOURLY, DAILY, WEEKLY, MONTHLY, YEARLY, NEVER;

    /**
     * Protocol token written into {@code <changefreq>}.
     */
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ChangeFrequency fromToken(String token) {
        if (token != null) {
            for (ChangeFrequency frequency : values()) {
                if (frequency.token().equalsIgnoreCase(token.trim())) {
                    return frequency;
                }
            }
        }
        throw new InvalidFieldValueException("changefreq", "unknown change frequency '" + token + "'");
    }
}
