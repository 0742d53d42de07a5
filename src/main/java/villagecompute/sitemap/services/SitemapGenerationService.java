/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.services;

import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import villagecompute.sitemap.config.VideoSitemapConfig;
import villagecompute.sitemap.exceptions.SitemapXmlException;
import villagecompute.sitemap.url.SitemapUrl;
import villagecompute.sitemap.url.video.VideoSitemapUrl;
import villagecompute.sitemap.xml.XmlSerializer;
import villagecompute.sitemap.xml.XmlTreeBuilder;

import java.util.List;

/**
 * Service for assembling sitemap XML documents from URL entries.
 * <p>
 * Produces sitemaps.org-compliant {@code <urlset>} documents. Entries that are {@link VideoSitemapUrl}s with a content
 * or player location contribute a {@code video:video} block, and the {@code video} namespace is declared on the root
 * whenever at least one entry does.
 * <p>
 * <b>Telemetry:</b>
 * <ul>
 * <li>{@code sitemap.generate} (Span) - document assembly and serialization</li>
 * <li>{@code sitemap.urls.total} (Counter) - URL entries written</li>
 * <li>{@code sitemap.urls.video} (Counter) - URL entries carrying a video block</li>
 * </ul>
 *
 * @see VideoSitemapUrl
 */
@ApplicationScoped
public class SitemapGenerationService {

    private static final Logger LOG = Logger.getLogger(SitemapGenerationService.class);

    static final int MAX_URLS_PER_SITEMAP = 50000;

    @Inject
    VideoSitemapConfig config;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    Tracer tracer;

    /**
     * Creates a video URL entry whose field order comes from configuration.
     *
     * @param location
     *            absolute page URL
     * @return a new entry without video attributes set
     */
    public VideoSitemapUrl newVideoUrl(String location) {
        VideoSitemapUrl url = new VideoSitemapUrl(location);
        url.video().setFieldOrder(config.fieldOrder());
        return url;
    }

    /**
     * Builds the sitemap DOM for a list of URL entries, preserving their order.
     *
     * @param urls
     *            entries to include (max 50,000)
     * @return document whose root is {@code <urlset>}
     */
    public Document buildSitemapDocument(List<? extends SitemapUrl> urls) {
        if (urls.size() > MAX_URLS_PER_SITEMAP) {
            throw new IllegalArgumentException(
                    "URL count exceeds sitemap limit: " + urls.size() + " > " + MAX_URLS_PER_SITEMAP);
        }

        long videoCount = urls.stream().filter(SitemapGenerationService::hasVideo).count();

        XmlTreeBuilder xml = new XmlTreeBuilder();
        Element urlset = xml.urlset(videoCount > 0);
        for (SitemapUrl url : urls) {
            urlset.appendChild(url.asElement(xml));
        }

        meterRegistry.counter("sitemap.urls.total").increment(urls.size());
        meterRegistry.counter("sitemap.urls.video").increment(videoCount);

        return xml.document();
    }

    /**
     * Generates a single sitemap XML file from a list of URL entries.
     *
     * @param urls
     *            entries to include (max 50,000)
     * @return sitemap XML string
     */
    public String generateSitemap(List<? extends SitemapUrl> urls) {
        Span span = tracer.spanBuilder("sitemap.generate").setAttribute("url_count", urls.size()).startSpan();

        try (var scope = span.makeCurrent()) {
            Document document = buildSitemapDocument(urls);
            String xml = new XmlSerializer(config.prettyPrint()).serialize(document);

            LOG.infof("Generated sitemap XML with %d URLs (%d bytes)", urls.size(), xml.length());

            return xml;

        } catch (IllegalArgumentException | SitemapXmlException e) {
            span.recordException(e);
            LOG.errorf(e, "Failed to generate sitemap XML: %s", e.getMessage());
            throw e;

        } catch (Exception e) {
            span.recordException(e);
            LOG.errorf(e, "Failed to generate sitemap XML: %s", e.getMessage());
            throw new SitemapXmlException("Failed to generate sitemap XML", e);

        } finally {
            span.end();
        }
    }

    /**
     * Renders a single entry as a standalone {@code <url>} fragment, without XML declaration.
     *
     * @param url
     *            entry to render
     * @return XML text of the {@code <url>} element
     */
    public String renderUrl(SitemapUrl url) {
        XmlTreeBuilder xml = new XmlTreeBuilder();
        return new XmlSerializer(config.prettyPrint()).serializeFragment(url.asElement(xml));
    }

    private static boolean hasVideo(SitemapUrl url) {
        return url instanceof VideoSitemapUrl video && video.hasVideo();
    }
}
