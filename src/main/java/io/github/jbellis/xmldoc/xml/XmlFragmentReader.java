package io.github.jbellis.xmldoc.xml;

import com.ctc.wstx.stax.WstxInputFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.ParseSettings;
import org.jsoup.parser.Tag;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Strict, whitespace-preserving XML reader that builds a jsoup node tree.
 * <p>
 * jsoup's own XML parser recovers from malformed input, so well-formedness is enforced by streaming
 * the text through Woodstox and materializing elements and text as jsoup nodes. Element and attribute
 * names keep their case. jsoup's {@code Element.attr}/{@code hasAttr} ignore case, so read attributes
 * through {@link org.jsoup.nodes.Attributes#hasKey} and {@link org.jsoup.nodes.Attributes#get}.
 * Text and CDATA sections both become {@link TextNode}s; comments and processing instructions are
 * dropped. DTDs and external entities are disabled.
 */
public final class XmlFragmentReader {
    private static final Logger logger = LogManager.getLogger(XmlFragmentReader.class);

    private static final XMLInputFactory2 FACTORY = createFactory();

    private XmlFragmentReader() {}

    private static XMLInputFactory2 createFactory() {
        var factory = new WstxInputFactory();
        factory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_REPLACING_ENTITY_REFERENCES, Boolean.TRUE);
        return factory;
    }

    /**
     * Parses a single-rooted XML string.
     *
     * @param xml well-formed XML with exactly one root element
     * @return the root element, detached from any document
     * @throws XMLStreamException if the text is not well-formed
     */
    public static Element read(String xml) throws XMLStreamException {
        var reader = (XMLStreamReader2) FACTORY.createXMLStreamReader(new StringReader(xml));
        try {
            return buildTree(reader);
        } finally {
            reader.closeCompletely();
        }
    }

    private static Element buildTree(XMLStreamReader2 reader) throws XMLStreamException {
        Deque<Element> stack = new ArrayDeque<>();
        Element root = null;

        while (reader.hasNext()) {
            switch (reader.next()) {
                case XMLStreamConstants.START_ELEMENT -> {
                    var element = new Element(Tag.valueOf(reader.getLocalName(), ParseSettings.preserveCase), "");
                    // Attributes.put keeps the key as given; Element.attr would lower-case it
                    var attributes = element.attributes();
                    for (int i = 0; i < reader.getAttributeCount(); i++) {
                        attributes.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
                    }
                    if (stack.isEmpty()) {
                        root = element;
                    } else {
                        stack.peek().appendChild(element);
                    }
                    stack.push(element);
                }
                case XMLStreamConstants.END_ELEMENT -> stack.pop();
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE -> {
                    // text outside the root element can only be whitespace, which has nowhere to go
                    if (!stack.isEmpty()) {
                        stack.peek().appendChild(new TextNode(reader.getText()));
                    }
                }
                default -> {
                    // comments, processing instructions and the document events carry no content
                }
            }
        }

        if (root == null) {
            throw new XMLStreamException("No root element");
        }
        logger.trace("Read XML tree rooted at <{}> with {} child nodes", root.tagName(), root.childNodeSize());
        return root;
    }
}
