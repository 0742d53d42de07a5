/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.url;

import java.net.URI;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

import org.w3c.dom.Element;

import villagecompute.sitemap.exceptions.InvalidFieldValueException;
import villagecompute.sitemap.xml.XmlTreeBuilder;

/**
 * A single {@code <url>} entry of a sitemaps.org sitemap.
 *
 * <p>
 * Only the location is required. Optional fields are {@code null} until set and are omitted from the output when
 * unset.
 *
 * <p>
 * Subclasses extend {@link #asElement(XmlTreeBuilder)} to add extension blocks (see
 * {@link villagecompute.sitemap.url.video.VideoSitemapUrl}).
 */
public class SitemapUrl {

    private static final DateTimeFormatter ISO_DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd")
            .withZone(ZoneId.of("UTC"));

    private URI location;
    private Instant lastModified;
    private ChangeFrequency changeFrequency;
    private Double priority;

    public SitemapUrl(URI location) {
        setLocation(location);
    }

    public SitemapUrl(String location) {
        this(Locations.parse("loc", location));
    }

    public URI getLocation() {
        return location;
    }

    public void setLocation(URI location) {
        this.location = Locations.requireAbsoluteHttp("loc", location);
    }

    public Instant getLastModified() {
        return lastModified;
    }

    public void setLastModified(Instant lastModified) {
        this.lastModified = Objects.requireNonNull(lastModified, "lastModified");
    }

    public boolean hasLastModified() {
        return lastModified != null;
    }

    public void clearLastModified() {
        this.lastModified = null;
    }

    public ChangeFrequency getChangeFrequency() {
        return changeFrequency;
    }

    public void setChangeFrequency(ChangeFrequency changeFrequency) {
        this.changeFrequency = Objects.requireNonNull(changeFrequency, "changeFrequency");
    }

    public boolean hasChangeFrequency() {
        return changeFrequency != null;
    }

    public void clearChangeFrequency() {
        this.changeFrequency = null;
    }

    public Double getPriority() {
        return priority;
    }

    /**
     * @param priority
     *            page importance between 0.0 and 1.0
     */
    public void setPriority(double priority) {
        if (Double.isNaN(priority) || priority < 0.0 || priority > 1.0) {
            throw new InvalidFieldValueException("priority", "must be between 0.0 and 1.0, got " + priority);
        }
        this.priority = priority;
    }

    public boolean hasPriority() {
        return priority != null;
    }

    public void clearPriority() {
        this.priority = null;
    }

    /**
     * Renders this entry as a {@code <url>} element with {@code loc}, {@code lastmod}, {@code changefreq} and
     * {@code priority} children, in that order.
     *
     * @param xml
     *            builder owning the target document
     * @return the detached {@code <url>} element
     */
    public Element asElement(XmlTreeBuilder xml) {
        Element url = xml.element("url");
        url.appendChild(xml.element("loc", location.toString()));
        if (lastModified != null) {
            url.appendChild(xml.element("lastmod", ISO_DATE_FORMATTER.format(lastModified)));
        }
        if (changeFrequency != null) {
            url.appendChild(xml.element("changefreq", changeFrequency.token()));
        }
        if (priority != null) {
            url.appendChild(xml.element("priority", priority.toString()));
        }
        return url;
    }
}
