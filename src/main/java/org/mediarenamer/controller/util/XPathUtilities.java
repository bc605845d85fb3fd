package org.mediarenamer.controller.util;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpression;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

public class XPathUtilities {

    private static final XPathFactory XPATH_FACTORY =
        XPathFactory.newInstance();

    // XPath instances are not thread-safe.
    private static final ThreadLocal<XPath> XPATH = ThreadLocal.withInitial(
        () -> XPATH_FACTORY.newXPath()
    );

    private static final ThreadLocal<Map<String, XPathExpression>> EXPR_CACHE =
        ThreadLocal.withInitial(HashMap::new);

    private XPathUtilities() {
        // utility class
    }

    private static XPathExpression compile(String expression)
        throws XPathExpressionException {
        Map<String, XPathExpression> cache = EXPR_CACHE.get();
        XPathExpression compiled = cache.get(expression);
        if (compiled == null) {
            compiled = XPATH.get().compile(expression);
            cache.put(expression, compiled);
        }
        return compiled;
    }

    /**
     * Parse an XML document held in a string.  The parser is not namespace
     * aware, so element names can be addressed without prefixes even when the
     * document declares a default namespace.  DTDs and external entities are
     * refused.
     *
     * @param xml the document text
     * @return the parsed document
     * @throws IOException if the text is not well-formed XML
     */
    public static Document parse(final String xml) throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature(
                "http://apache.org/xml/features/disallow-doctype-decl",
                true
            );
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(
                new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8))
            );
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("could not parse XML document", e);
        }
    }

    public static String nodeTextValue(String name, Node eNode)
        throws XPathExpressionException {
        Node node = (Node) compile(name).evaluate(eNode, XPathConstants.NODE);
        if (node == null) {
            return null;
        }
        return node.getTextContent();
    }
}
