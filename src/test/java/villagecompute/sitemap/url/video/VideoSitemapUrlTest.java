/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.url.video;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import villagecompute.sitemap.url.ChangeFrequency;
import villagecompute.sitemap.xml.XmlSerializer;
import villagecompute.sitemap.xml.XmlTreeBuilder;

/**
 * Unit tests for {@link VideoSitemapUrl}: the {@code video:video} block is appended to the base {@code <url>} element
 * only when a content or player location is set.
 */
class VideoSitemapUrlTest {

    private XmlTreeBuilder xml;

    @BeforeEach
    void setUp() {
        xml = new XmlTreeBuilder();
    }

    /**
     * Test: Without any video attributes the base element is returned unchanged.
     */
    @Test
    void testAsElement_noVideo_returnsBaseElement() {
        VideoSitemapUrl url = new VideoSitemapUrl("http://example.com/watch/1");
        url.setChangeFrequency(ChangeFrequency.WEEKLY);

        Element element = url.asElement(xml);

        assertFalse(url.hasVideo());
        assertEquals(List.of("loc", "changefreq"), childNames(element));
    }

    /**
     * Test: Metadata without a location never yields an empty container.
     */
    @Test
    void testAsElement_metadataWithoutLocation_noContainer() {
        VideoSitemapUrl url = new VideoSitemapUrl("http://example.com/watch/1");
        url.video().setTitle("Grilling steaks");
        url.video().setTag(List.of("steak"));

        Element element = url.asElement(xml);

        assertFalse(url.hasVideo());
        assertEquals(0, element.getElementsByTagNameNS(XmlTreeBuilder.VIDEO_NAMESPACE, "video").getLength());
        assertEquals(List.of("loc"), childNames(element));
    }

    /**
     * Test: Content and player locations only - the container holds player_loc and content_loc in field order,
     * followed by the family-friendly default.
     */
    @Test
    void testAsElement_contentAndPlayerLocations() {
        VideoSitemapUrl url = new VideoSitemapUrl("http://example.com/watch/1");
        url.video().setContentLoc("http://example.com/video.flv");
        url.video().setPlayerLoc("http://example.com/player.swf");

        Element element = url.asElement(xml);

        assertTrue(url.hasVideo());
        NodeList containers = element.getElementsByTagNameNS(XmlTreeBuilder.VIDEO_NAMESPACE, "video");
        assertEquals(1, containers.getLength(), "Exactly one video:video container");

        Element container = (Element) containers.item(0);
        assertEquals("video:video", container.getTagName());
        assertEquals(0, container.getAttributes().getLength(), "Container carries no attributes");
        assertEquals(container, element.getLastChild(), "Container is the last child of <url>");
        assertEquals(List.of("video:player_loc", "video:content_loc", "video:family_friendly"),
                childNames(container));

        String out = new XmlSerializer(false).serializeFragment(element);
        assertTrue(out.contains("<video:player_loc>http://example.com/player.swf</video:player_loc>"
                + "<video:content_loc>http://example.com/video.flv</video:content_loc>"), out);
    }

    /**
     * Test: The video block follows every base child, including lastmod and priority.
     */
    @Test
    void testAsElement_videoBlockAfterBaseFields() {
        VideoSitemapUrl url = new VideoSitemapUrl(URI.create("https://example.com/watch/7"));
        url.setLastModified(Instant.parse("2024-03-15T10:00:00Z"));
        url.setChangeFrequency(ChangeFrequency.DAILY);
        url.setPriority(0.6);
        url.video().setPlayerLoc("https://example.com/embed/7");
        url.video().setFamilyFriendly(false);

        Element element = url.asElement(xml);

        assertEquals(List.of("loc", "lastmod", "changefreq", "priority", "video:video"), childNames(element));
        Element container = (Element) element.getLastChild();
        assertEquals("No", ((Element) container.getLastChild()).getTextContent());
    }

    /**
     * Test: Attributes passed at construction are used as-is.
     */
    @Test
    void testConstructor_withAttributes() {
        VideoAttributes video = new VideoAttributes();
        video.setContentLoc("http://example.com/video.mp4");
        video.setExpirationDate(OffsetDateTime.of(2030, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC));
        video.setFieldOrder(List.of("expiration_date", "content_loc"));

        VideoSitemapUrl url = new VideoSitemapUrl(URI.create("http://example.com/page"), video);
        Element container = (Element) url.asElement(xml).getLastChild();

        assertEquals(video, url.video());
        assertEquals(List.of("video:expiration_date", "video:content_loc"), childNames(container));
        assertEquals("2030-01-01T00:00:00+0000", container.getFirstChild().getTextContent());
    }

    /**
     * Test: Serializing the same entry twice yields identical text.
     */
    @Test
    void testAsElement_repeatedSerializationIsIdentical() {
        VideoSitemapUrl url = new VideoSitemapUrl("http://example.com/watch/1");
        url.video().setContentLoc("http://example.com/video.flv?a=1&b=2");
        url.video().setTag(List.of("x", "y"));
        XmlSerializer serializer = new XmlSerializer(false);

        String first = serializer.serializeFragment(url.asElement(new XmlTreeBuilder()));
        String second = serializer.serializeFragment(url.asElement(new XmlTreeBuilder()));

        assertEquals(first, second);
    }

    private static List<String> childNames(Element element) {
        List<String> names = new ArrayList<>();
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                names.add(((Element) child).getTagName());
            }
        }
        return names;
    }
}
