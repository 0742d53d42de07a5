/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.sitemap.xml;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import villagecompute.sitemap.exceptions.SitemapXmlException;

/**
 * Serializes DOM trees produced by {@link XmlTreeBuilder} to strings using the JAXP identity transformer.
 *
 * <p>
 * Pretty printing indents a copy of the tree before it is written: whitespace is only inserted between the children
 * of elements that contain nothing but elements. Leaf content, including pre-escaped text and its escaping
 * instructions, is never touched. The transformer's own indenter is not used because it splits such leaves.
 */
public class XmlSerializer {

    private static final String INDENT = "  ";

    private final TransformerFactory transformerFactory = TransformerFactory.newInstance();
    private final boolean prettyPrint;

    public XmlSerializer(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    /**
     * Serializes a complete document, including the XML declaration.
     *
     * @param document
     *            the document to write
     * @return UTF-8 XML text
     */
    public String serialize(Document document) {
        return transform(document, false);
    }

    /**
     * Serializes a single node without an XML declaration.
     */
    public String serializeFragment(Node node) {
        return transform(node, true);
    }

    private String transform(Node node, boolean omitDeclaration) {
        Node source = prettyPrint ? indented(node) : node;
        try {
            Transformer transformer = transformerFactory.newTransformer();
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, omitDeclaration ? "yes" : "no");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");

            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(source), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new SitemapXmlException("Failed to serialize sitemap XML: " + e.getMessage(), e);
        }
    }

    private static Node indented(Node node) {
        Node copy = node.cloneNode(true);
        Element root = null;
        if (copy instanceof Document document) {
            root = document.getDocumentElement();
        } else if (copy instanceof Element element) {
            root = element;
        }
        if (root != null) {
            indent(root, 0);
        }
        return copy;
    }

    private static void indent(Element element, int depth) {
        List<Element> children = new ArrayList<>();
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() != Node.ELEMENT_NODE) {
                // text, mixed or pre-escaped content stays as written
                return;
            }
            children.add((Element) child);
        }
        if (children.isEmpty()) {
            return;
        }

        Document owner = element.getOwnerDocument();
        String childIndent = "\n" + INDENT.repeat(depth + 1);
        for (Element child : children) {
            element.insertBefore(owner.createTextNode(childIndent), child);
            indent(child, depth + 1);
        }
        element.appendChild(owner.createTextNode("\n" + INDENT.repeat(depth)));
    }
}
