/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.exceptions;

/**
 * Exception thrown when the underlying XML layer cannot create or serialize a sitemap tree.
 *
 * <p>
 * Treated as fatal: a sitemap fragment is never emitted partially.
 */
public class SitemapXmlException extends RuntimeException {

    public SitemapXmlException(String message) {
        super(message);
    }

    public SitemapXmlException(String message, Throwable cause) {
        super(message, cause);
    }
}
