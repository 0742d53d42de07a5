/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.url;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import villagecompute.sitemap.exceptions.InvalidFieldValueException;
import villagecompute.sitemap.xml.XmlSerializer;
import villagecompute.sitemap.xml.XmlTreeBuilder;

/**
 * Unit tests for {@link SitemapUrl} rendering and validation.
 */
class SitemapUrlTest {

    @Test
    void testAsElement_locationOnly() {
        SitemapUrl url = new SitemapUrl("https://example.com/");

        Element element = url.asElement(new XmlTreeBuilder());

        assertEquals("url", element.getTagName());
        assertEquals(XmlTreeBuilder.SITEMAP_NAMESPACE, element.getNamespaceURI());
        assertEquals(1, element.getChildNodes().getLength());
        assertEquals("https://example.com/", element.getFirstChild().getTextContent());
    }

    @Test
    void testAsElement_allFieldsInProtocolOrder() {
        SitemapUrl url = new SitemapUrl("https://example.com/directory/tools?sort=a&page=2");
        url.setPriority(0.8);
        url.setChangeFrequency(ChangeFrequency.fromToken("Weekly"));
        url.setLastModified(Instant.parse("2024-12-31T23:59:59Z"));

        String out = new XmlSerializer(false).serializeFragment(url.asElement(new XmlTreeBuilder()));

        assertTrue(out.contains("<loc>https://example.com/directory/tools?sort=a&amp;page=2</loc>"
                + "<lastmod>2024-12-31</lastmod><changefreq>weekly</changefreq><priority>0.8</priority>"), out);
    }

    @Test
    void testClearers_removeOptionalFields() {
        SitemapUrl url = new SitemapUrl("https://example.com/");
        url.setPriority(1.0);
        url.setChangeFrequency(ChangeFrequency.DAILY);
        url.setLastModified(Instant.now());

        url.clearPriority();
        url.clearChangeFrequency();
        url.clearLastModified();

        assertFalse(url.hasPriority());
        assertFalse(url.hasChangeFrequency());
        assertFalse(url.hasLastModified());
    }

    @Test
    void testValidation_rejectsInvalidValues() {
        assertThrows(InvalidFieldValueException.class, () -> new SitemapUrl("relative/path"));
        assertThrows(InvalidFieldValueException.class, () -> new SitemapUrl("mailto:someone@example.com"));
        assertThrows(InvalidFieldValueException.class, () -> new SitemapUrl("   "));

        SitemapUrl url = new SitemapUrl("https://example.com/");
        assertThrows(InvalidFieldValueException.class, () -> url.setPriority(1.5));
        assertThrows(InvalidFieldValueException.class, () -> url.setPriority(-0.1));
        assertThrows(InvalidFieldValueException.class, () -> ChangeFrequency.fromToken("fortnightly"));
    }
}
