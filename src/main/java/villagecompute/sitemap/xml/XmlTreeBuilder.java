/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.xml;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.Result;

import org.w3c.dom.Document;
import org.w3c.dom.DocumentFragment;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import villagecompute.sitemap.exceptions.SitemapXmlException;

/**
 * Builds the DOM nodes that make up a sitemap document.
 *
 * <p>
 * Element names are qualified names as they appear in the output: unprefixed names ({@code url}, {@code loc}) belong
 * to the sitemaps.org namespace, {@code video:}-prefixed names to Google's video extension. All nodes created by one
 * builder share the same owner {@link Document}, so they can be freely moved between containers.
 *
 * <p>
 * Pre-escaped text is surrounded by the JAXP {@link Result#PI_DISABLE_OUTPUT_ESCAPING} /
 * {@link Result#PI_ENABLE_OUTPUT_ESCAPING} processing instructions, which {@link XmlSerializer} honours and never
 * writes out.
 */
public class XmlTreeBuilder {

    public static final String SITEMAP_NAMESPACE = "http://www.sitemaps.org/schemas/sitemap/0.9";
    public static final String VIDEO_NAMESPACE = "http://www.google.com/schemas/sitemap-video/1.1";
    public static final String VIDEO_PREFIX = "video";

    private final Document document;

    public XmlTreeBuilder() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        try {
            this.document = factory.newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new SitemapXmlException("Unable to create XML document", e);
        }
        this.document.setXmlStandalone(true);
    }

    public Document document() {
        return document;
    }

    /**
     * Creates the {@code urlset} root element and attaches it to the document.
     *
     * @param declareVideoNamespace
     *            whether to declare the {@code video} prefix on the root
     * @return the root element
     */
    public Element urlset(boolean declareVideoNamespace) {
        Element root = element("urlset");
        root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, XMLConstants.XMLNS_ATTRIBUTE, SITEMAP_NAMESPACE);
        if (declareVideoNamespace) {
            root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, XMLConstants.XMLNS_ATTRIBUTE + ":" + VIDEO_PREFIX,
                    VIDEO_NAMESPACE);
        }
        document.appendChild(root);
        return root;
    }

    /**
     * Creates an empty element.
     *
     * @param qualifiedName
     *            name such as {@code url} or {@code video:title}
     * @return the detached element
     * @throws SitemapXmlException
     *             if the name carries a prefix other than {@code video}
     */
    public Element element(String qualifiedName) {
        return document.createElementNS(namespaceFor(qualifiedName), qualifiedName);
    }

    /**
     * Creates an element holding escaped text.
     */
    public Element element(String qualifiedName, String text) {
        return wrapIn(text(XmlText.escaped(text)), qualifiedName);
    }

    /**
     * Converts text into a node: a plain text node for escaped text, or a fragment that switches output escaping off
     * around the text for pre-escaped content.
     */
    public Node text(XmlText text) {
        if (!text.preEscaped()) {
            return document.createTextNode(text.value());
        }
        DocumentFragment fragment = document.createDocumentFragment();
        fragment.appendChild(document.createProcessingInstruction(Result.PI_DISABLE_OUTPUT_ESCAPING, ""));
        fragment.appendChild(document.createTextNode(text.value()));
        fragment.appendChild(document.createProcessingInstruction(Result.PI_ENABLE_OUTPUT_ESCAPING, ""));
        return fragment;
    }

    /**
     * Wraps a node in a new container element.
     *
     * @param content
     *            node to wrap; a document fragment contributes all of its children
     * @param qualifiedName
     *            name of the container
     * @return the container
     */
    public Element wrapIn(Node content, String qualifiedName) {
        Element container = element(qualifiedName);
        container.appendChild(content);
        return container;
    }

    private static String namespaceFor(String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        if (colon < 0) {
            return SITEMAP_NAMESPACE;
        }
        String prefix = qualifiedName.substring(0, colon);
        if (VIDEO_PREFIX.equals(prefix)) {
            return VIDEO_NAMESPACE;
        }
        throw new SitemapXmlException("Unknown namespace prefix: " + prefix);
    }
}
