package info.isaksson.erland.niemtograph.document;

import info.isaksson.erland.niemtograph.error.DocumentParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * NIEM XML to {@link ElementNode}.
 *
 * <p>Parsing is namespace aware with DOCTYPE declarations rejected, so no external entity is ever
 * expanded. Element and attribute names keep the prefix declared in the document; an element in a
 * default namespace is given the first prefix bound to that namespace, or {@code ns}.</p>
 */
public final class XmlTreeNormalizer implements TreeNormalizer {

    private static final Logger log = LoggerFactory.getLogger(XmlTreeNormalizer.class);

    private static final String XMLNS_NS = XMLConstants.XMLNS_ATTRIBUTE_NS_URI;

    @Override
    public DocumentFormat format() {
        return DocumentFormat.XML;
    }

    @Override
    public ElementNode normalize(byte[] content, String rootName) {
        if (content == null) throw new IllegalArgumentException("content is null");
        Document doc = parse(content);
        Element root = doc.getDocumentElement();
        QualifiedName rootQn = qname(root);
        if (rootName != null && !rootName.isBlank() && !rootQn.matches(rootName.trim())) {
            throw new DocumentParseException(
                    "Root element " + rootQn + " does not match declared root " + rootName.trim(), "/" + rootQn);
        }
        ElementNode tree = convert(root, "/" + rootQn, 0);
        log.debug("Normalized XML document with root {}", rootQn);
        return tree;
    }

    private static Document parse(byte[] content) {
        try {
            DocumentBuilder db = newFactory().newDocumentBuilder();
            // Keep the default handler from printing "[Fatal Error]" lines to stderr.
            db.setErrorHandler(new DefaultHandler() {
                @Override
                public void fatalError(SAXParseException e) throws SAXException {
                    throw e;
                }
            });
            return db.parse(new ByteArrayInputStream(content));
        } catch (SAXParseException e) {
            throw new DocumentParseException(
                    "Malformed XML: " + e.getMessage(),
                    "line " + e.getLineNumber() + ", column " + e.getColumnNumber(),
                    e);
        } catch (SAXException | IOException e) {
            throw new DocumentParseException("Malformed XML: " + e.getMessage(), null, e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser configuration failed", e);
        }
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        dbf.setIgnoringComments(true);
        dbf.setCoalescing(true);
        dbf.setExpandEntityReferences(false);
        dbf.setXIncludeAware(false);
        dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        dbf.setFeature("http://xml.org/sax/features/external-general-entities", false);
        dbf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        return dbf;
    }

    private static ElementNode convert(Element el, String path, int depth) {
        if (depth > MAX_DEPTH) {
            throw new DocumentParseException("Document nesting exceeds " + MAX_DEPTH + " levels", path);
        }
        ElementNode.Builder b = ElementNode.builder(qname(el));

        NamedNodeMap attrs = el.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr a = (Attr) attrs.item(i);
            if (XMLNS_NS.equals(a.getNamespaceURI())) continue;
            b.attribute(attrName(a), a.getValue());
        }

        StringBuilder text = new StringBuilder();
        boolean hasElementChildren = false;
        NodeList kids = el.getChildNodes();
        for (int i = 0; i < kids.getLength(); i++) {
            Node k = kids.item(i);
            if (k.getNodeType() == Node.ELEMENT_NODE) {
                hasElementChildren = true;
                Element child = (Element) k;
                b.child(convert(child, path + "/" + qname(child), depth + 1));
            } else if (k.getNodeType() == Node.TEXT_NODE || k.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(k.getNodeValue());
            }
        }
        // Mixed content is not NIEM conformant; text next to element children is dropped.
        if (!hasElementChildren) b.text(text.toString());
        return b.build();
    }

    private static QualifiedName qname(Element el) {
        String local = el.getLocalName() != null ? el.getLocalName() : el.getNodeName();
        String uri = el.getNamespaceURI();
        String prefix = el.getPrefix();
        if ((prefix == null || prefix.isEmpty()) && uri != null) {
            String bound = el.lookupPrefix(uri);
            prefix = bound != null ? bound : "ns";
        }
        return new QualifiedName(uri, prefix, local);
    }

    private static QualifiedName attrName(Attr a) {
        String local = a.getLocalName() != null ? a.getLocalName() : a.getName();
        return new QualifiedName(a.getNamespaceURI(), a.getPrefix(), local);
    }
}
