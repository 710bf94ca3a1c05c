/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.markup;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

/**
 * {@code MarkupElement} backed by a DOM {@code Element}.
 * <p>
 * Parsing is not namespace-aware: prefixed attribute names like {@code
 * xlink:href} are reported as written.  External entities and the DTD
 * external subset are never loaded &ndash; they resolve to empty content.</p>
 */
public final class DomMarkup implements MarkupElement {

    static final Logger log = Logger.getLogger(DomMarkup.class.getName());

    private static final ThreadLocal<DocumentBuilder>
            localBuilder = ThreadLocal.withInitial(DomMarkup::newDocumentBuilder);

    private final Element element;

    private List<MarkupElement> children;
    private List<MarkupContent> content;

    private DomMarkup(Element element) {
        this.element = Objects.requireNonNull(element, "null element");
    }

    public static DomMarkup of(Element element) {
        return new DomMarkup(element);
    }

    public static DomMarkup of(Document document) {
        return new DomMarkup(document.getDocumentElement());
    }

    /**
     * Parses the given markup text.
     *
     * @param   text  the complete document text
     * @return  the document root element
     * @throws  MarkupException  if the text is not well-formed XML
     */
    public static DomMarkup parse(String text) throws MarkupException {
        try {
            return parse(new InputSource(new StringReader(text)));
        } catch (MarkupException e) {
            throw e;
        } catch (IOException e) {
            // StringReader doesn't do I/O
            throw new IllegalStateException(e);
        }
    }

    /**
     * @param   source  the input source to parse
     * @return  the document root element
     * @throws  MarkupException  if the input is not well-formed XML
     * @throws  IOException  if I/O error occurs
     */
    public static DomMarkup parse(InputSource source) throws IOException {
        DocumentBuilder builder = localBuilder.get();
        try {
            return of(builder.parse(source));
        } catch (SAXParseException e) {
            throw new MarkupException("Malformed markup (line " + e.getLineNumber()
                    + ", column " + e.getColumnNumber() + "): " + e.getMessage(), e);
        } catch (SAXException e) {
            throw new MarkupException(e.getMessage(), e);
        } finally {
            builder.reset();
            initialize(builder);
        }
    }

    private static DocumentBuilder newDocumentBuilder() {
        DocumentBuilder builder;
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(false);
            dbf.setValidating(false);
            dbf.setExpandEntityReferences(false);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            builder = dbf.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException(e);
        }
        initialize(builder);
        return builder;
    }

    private static void initialize(DocumentBuilder builder) {
        builder.setEntityResolver((publicId, systemId) -> {
            log.log(Level.FINE, "Not resolving external entity: {0}", systemId);
            return new InputSource(new StringReader(""));
        });
        builder.setErrorHandler(StrictErrorHandler.INSTANCE);
    }

    /**
     * {@return the backing DOM element}
     */
    public Element element() {
        return element;
    }

    @Override
    public String name() {
        String qName = element.getTagName();
        int colonIndex = qName.lastIndexOf(':');
        return colonIndex < 0 ? qName : qName.substring(colonIndex + 1);
    }

    @Override
    public Optional<String> attribute(String name) {
        Attr attr = element.getAttributeNode(name);
        return (attr == null) ? Optional.empty()
                              : Optional.of(attr.getValue());
    }

    @Override
    public Map<String, String> attributes() {
        NamedNodeMap attrs = element.getAttributes();
        Map<String, String> map = new HashMap<>(attrs.getLength() * 2);
        for (int i = 0, len = attrs.getLength(); i < len; i++) {
            Node attr = attrs.item(i);
            map.put(attr.getNodeName(), attr.getNodeValue());
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public List<MarkupElement> children() {
        List<MarkupElement> list = children;
        if (list == null) {
            list = new ArrayList<>();
            for (Node node = element.getFirstChild();
                    node != null; node = node.getNextSibling()) {
                if (node instanceof Element) {
                    list.add(new DomMarkup((Element) node));
                }
            }
            children = list = Collections.unmodifiableList(list);
        }
        return list;
    }

    @Override
    public List<MarkupContent> content() {
        List<MarkupContent> list = content;
        if (list == null) {
            list = new ArrayList<>();
            StringBuilder text = new StringBuilder();
            int childIndex = 0;
            for (Node node = element.getFirstChild();
                    node != null; node = node.getNextSibling()) {
                switch (node.getNodeType()) {
                case Node.TEXT_NODE:
                case Node.CDATA_SECTION_NODE:
                    text.append(node.getNodeValue());
                    break;

                case Node.ELEMENT_NODE:
                    if (text.length() > 0) {
                        list.add(MarkupContent.text(text.toString()));
                        text.setLength(0);
                    }
                    list.add(MarkupContent.element(children().get(childIndex++)));
                    break;

                default:
                    // Comments, processing instructions
                }
            }
            if (text.length() > 0) {
                list.add(MarkupContent.text(text.toString()));
            }
            content = list = Collections.unmodifiableList(list);
        }
        return list;
    }

    @Override
    public Optional<String> text() {
        StringBuilder text = null;
        for (Node node = element.getFirstChild();
                node != null; node = node.getNextSibling()) {
            short type = node.getNodeType();
            if (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) {
                if (text == null) {
                    text = new StringBuilder();
                }
                text.append(node.getNodeValue());
            }
        }
        return (text == null) ? Optional.empty()
                              : Optional.of(text.toString());
    }

    @Override
    public String toString() {
        return "<" + element.getTagName() + ">";
    }


    private static class StrictErrorHandler implements ErrorHandler {

        static final StrictErrorHandler INSTANCE = new StrictErrorHandler();

        @Override
        public void warning(SAXParseException exception) {
            log.fine(exception::toString);
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }

    } // class StrictErrorHandler


} // class DomMarkup
