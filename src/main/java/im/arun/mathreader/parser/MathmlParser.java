package im.arun.mathreader.parser;

import im.arun.mathreader.model.NodeType;
import im.arun.mathreader.model.SemanticNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Walks a MathML DOM and builds the semantic tree. {@code math} and unknown
 * elements are transparent; {@code mrow} becomes a Group.
 */
public class MathmlParser {
    private static final Logger logger = LoggerFactory.getLogger(MathmlParser.class);

    private static final Pattern NAMESPACE_DECLARATION = Pattern.compile("\\sxmlns(:[\\w.-]+)?=\"[^\"]*\"");
    private static final Set<String> RELATION_SYMBOLS = Set.of("=", "<", ">", "≤", "≥", "≠");

    private final int maxNestingDepth;

    public MathmlParser(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    public SemanticNode parse(String mathml) {
        String stripped = NAMESPACE_DECLARATION.matcher(mathml == null ? "" : mathml.strip()).replaceAll("");
        Document document = readDocument(stripped);

        SemanticNode root = new SemanticNode(NodeType.ROOT, "", Map.of(SemanticNode.SOURCE, stripped));
        element(document.getDocumentElement(), root, 0);
        logger.debug("Parsed MathML into {} top-level nodes", root.childCount());
        return root;
    }

    private Document readDocument(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            // Default handler prints fatal errors to stderr; stay quiet and let the exception carry it
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException e) {
            throw new MathParseException("Invalid MathML: " + e.getMessage(), e);
        } catch (ParserConfigurationException | IOException e) {
            throw new MathParseException("Unable to read MathML: " + e.getMessage(), e);
        }
    }

    private void element(Element elem, SemanticNode parent, int depth) {
        if (depth > maxNestingDepth) {
            throw new MathParseException("Maximum nesting depth exceeded");
        }
        String tag = localName(elem);

        switch (tag) {
            case "mrow": {
                SemanticNode group = new SemanticNode(NodeType.GROUP);
                children(elem, group, depth);
                parent.addChild(group);
                break;
            }
            case "mfrac":
                parent.addChild(pair(elem, NodeType.FRACTION,
                    SemanticNode.ROLE_NUMERATOR, SemanticNode.ROLE_DENOMINATOR, depth));
                break;
            case "msup":
                parent.addChild(pair(elem, NodeType.SUPERSCRIPT,
                    SemanticNode.ROLE_BASE, SemanticNode.ROLE_EXPONENT, depth));
                break;
            case "msub":
                parent.addChild(pair(elem, NodeType.SUBSCRIPT,
                    SemanticNode.ROLE_BASE, SemanticNode.ROLE_SUBSCRIPT, depth));
                break;
            case "msqrt": {
                if (childElements(elem).isEmpty()) {
                    throw new MathParseException("msqrt requires at least 1 child element, found 0");
                }
                SemanticNode sqrt = new SemanticNode(NodeType.SQRT);
                SemanticNode radicand = SemanticNode.roleGroup(SemanticNode.ROLE_RADICAND);
                children(elem, radicand, depth);
                sqrt.addChild(radicand);
                parent.addChild(sqrt);
                break;
            }
            case "mi":
                parent.addChild(new SemanticNode(NodeType.IDENTIFIER, text(elem)));
                break;
            case "mn":
                parent.addChild(new SemanticNode(NodeType.NUMBER, text(elem)));
                break;
            case "mo": {
                String symbol = text(elem);
                NodeType type = RELATION_SYMBOLS.contains(symbol) ? NodeType.RELATION : NodeType.OPERATOR;
                parent.addChild(new SemanticNode(type, symbol));
                break;
            }
            case "mtext":
                parent.addChild(new SemanticNode(NodeType.TEXT, text(elem)));
                break;
            default:
                // math and anything unrecognised contribute only their children
                children(elem, parent, depth);
        }
    }

    private SemanticNode pair(Element elem, NodeType type, String firstRole, String secondRole, int depth) {
        List<Element> parts = childElements(elem);
        if (parts.size() != 2) {
            throw new MathParseException(localName(elem) + " requires exactly 2 child elements, found " + parts.size());
        }
        SemanticNode node = new SemanticNode(type);

        SemanticNode first = SemanticNode.roleGroup(firstRole);
        element(parts.get(0), first, depth + 1);
        node.addChild(first);

        SemanticNode second = SemanticNode.roleGroup(secondRole);
        element(parts.get(1), second, depth + 1);
        node.addChild(second);
        return node;
    }

    private void children(Element elem, SemanticNode parent, int depth) {
        for (Element child : childElements(elem)) {
            element(child, parent, depth + 1);
        }
    }

    private static List<Element> childElements(Element elem) {
        List<Element> elements = new ArrayList<>();
        NodeList nodes = elem.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) node);
            }
        }
        return elements;
    }

    private static String localName(Element elem) {
        String tag = elem.getTagName();
        int colon = tag.indexOf(':');
        return colon >= 0 ? tag.substring(colon + 1) : tag;
    }

    private static String text(Element elem) {
        return elem.getTextContent().strip();
    }
}
