package io.entryrender.core.engine;

import io.entryrender.core.error.SourceParseException;
import io.entryrender.core.model.NodeKind;
import io.entryrender.core.model.SourceNode;
import io.entryrender.core.model.SourceTree;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Parses entry XML into an immutable {@link SourceTree}.
 *
 * <p>
 * Namespace declarations and element prefixes are stripped before parsing, so {@code <lift:entry>}
 * and {@code <entry>} produce the same tree. DOCTYPE declarations and external entities are
 * rejected. Stateless and thread-safe.
 */
public final class SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(SourceParser.class);

    private static final Pattern NAMESPACE_DECLARATION =
            Pattern.compile("\\s+xmlns(?::[A-Za-z_][\\w.-]*)?\\s*=\\s*(?:\"[^\"]*\"|'[^']*')");
    private static final Pattern ELEMENT_PREFIX = Pattern.compile("(</?)[A-Za-z_][\\w.-]*:");

    /** Removes namespace declarations and element name prefixes. */
    static String normalize(String xml) {
        String withoutDeclarations = NAMESPACE_DECLARATION.matcher(xml).replaceAll("");
        return ELEMENT_PREFIX.matcher(withoutDeclarations).replaceAll("$1");
    }

    /**
     * Parses one entry document.
     *
     * @throws SourceParseException if the input is not well-formed
     */
    public SourceTree parse(String xml) {
        Document document;
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            builder.setErrorHandler(new ThrowingErrorHandler());
            document = builder.parse(new InputSource(new StringReader(normalize(xml))));
        } catch (SAXException e) {
            throw new SourceParseException("Entry is not well-formed XML: " + e.getMessage(), e);
        } catch (IOException | ParserConfigurationException e) {
            throw new SourceParseException("Failed to read entry: " + e.getMessage(), e);
        }
        int[] counter = {0};
        SourceNode root = toNode(document.getDocumentElement(), counter);
        return new SourceTree(root, counter[0]);
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        factory.setExpandEntityReferences(false);
        factory.setXIncludeAware(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        return factory;
    }

    private static SourceNode toNode(Element element, int[] counter) {
        int index = counter[0]++;
        String tag = localName(element.getTagName());
        NodeKind kind = NodeKind.forTag(tag);

        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Node attr = attrs.item(i);
            String name = attr.getNodeName();
            if (name.equals("xmlns") || name.startsWith("xmlns:")) {
                continue;
            }
            // unprefixed attributes win over prefixed ones with the same local name
            if (name.indexOf(':') < 0) {
                attributes.put(name, attr.getNodeValue());
            } else {
                attributes.putIfAbsent(localName(name), attr.getNodeValue());
            }
        }

        List<SourceNode> children = new ArrayList<>();
        StringBuilder directText = new StringBuilder();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node child = nodes.item(i);
            switch (child.getNodeType()) {
                case Node.ELEMENT_NODE -> children.add(toNode((Element) child, counter));
                case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> directText.append(child.getNodeValue());
                default -> {
                    // comments and processing instructions carry no content
                }
            }
        }

        String text = kind == NodeKind.TEXT ? element.getTextContent() : directText.toString();
        return new SourceNode(index, tag, kind, attributes, children, Markup.collapse(text));
    }

    private static String localName(String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        return colon >= 0 ? qualifiedName.substring(colon + 1) : qualifiedName;
    }

    private static final class ThrowingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            LOG.debug("XML warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
