package io.markuptemplate.core.markup;

import io.markuptemplate.core.error.TemplateSyntaxException;
import io.markuptemplate.core.model.Attribute;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.Position;
import io.markuptemplate.core.model.QName;
import io.markuptemplate.core.spi.MarkupParser;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParserFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.SAXNotRecognizedException;
import org.xml.sax.SAXNotSupportedException;
import org.xml.sax.SAXParseException;
import org.xml.sax.XMLReader;
import org.xml.sax.ext.DefaultHandler2;

/**
 * {@link MarkupParser} for well-formed XML, built on the JDK's namespace-aware SAX parser with a
 * lexical handler so that comments and the doctype are reported too.
 *
 * <p>Adjacent character chunks are coalesced into one TEXT event positioned at the first chunk.
 * External DTDs and external entities are never fetched.
 *
 * <p>Thread-safe: every call uses its own SAX parser.
 */
public final class XmlMarkupParser implements MarkupParser {

    private static final Logger LOG = LoggerFactory.getLogger(XmlMarkupParser.class);
    private static final String LEXICAL_HANDLER = "http://xml.org/sax/properties/lexical-handler";

    @Override
    public List<Event> parse(Reader source, String filename) {
        String name = filename != null ? filename : Position.STRING_SOURCE;
        EventCollector collector = new EventCollector(name);
        try {
            XMLReader reader = newReader();
            reader.setContentHandler(collector);
            reader.setEntityResolver(collector);
            reader.setErrorHandler(collector);
            reader.setProperty(LEXICAL_HANDLER, collector);
            reader.parse(new InputSource(source));
        } catch (SAXParseException e) {
            throw new TemplateSyntaxException(
                    e.getMessage(), e, new Position(name, e.getLineNumber(), e.getColumnNumber()));
        } catch (SAXException | IOException | ParserConfigurationException e) {
            throw new TemplateSyntaxException("Failed to parse markup: " + e.getMessage(), e, new Position(name, -1, -1));
        }
        return collector.events;
    }

    private static XMLReader newReader() throws ParserConfigurationException, SAXException {
        SAXParserFactory factory = SAXParserFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setValidating(false);
        XMLReader reader = factory.newSAXParser().getXMLReader();
        disable(reader, "http://xml.org/sax/features/external-general-entities");
        disable(reader, "http://xml.org/sax/features/external-parameter-entities");
        disable(reader, "http://apache.org/xml/features/nonvalidating/load-external-dtd");
        return reader;
    }

    private static void disable(XMLReader reader, String feature) {
        try {
            reader.setFeature(feature, false);
        } catch (SAXNotRecognizedException | SAXNotSupportedException e) {
            LOG.debug("SAX parser does not support feature {}: {}", feature, e.getMessage());
        }
    }

    private static String prefixOf(String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        return colon > 0 ? qualifiedName.substring(0, colon) : "";
    }

    /** SAX callbacks collecting events. */
    private static final class EventCollector extends DefaultHandler2 {

        private final String filename;
        private final List<Event> events = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();
        private Position textPosition;
        private Locator locator;
        private boolean inDtd;

        EventCollector(String filename) {
            this.filename = filename;
        }

        private Position position() {
            if (locator == null) {
                return new Position(filename, -1, -1);
            }
            return new Position(filename, locator.getLineNumber(), locator.getColumnNumber());
        }

        private void flushText() {
            if (text.length() > 0) {
                events.add(Event.text(text.toString(), textPosition));
                text.setLength(0);
                textPosition = null;
            }
        }

        @Override
        public void setDocumentLocator(Locator locator) {
            this.locator = locator;
        }

        @Override
        public void startPrefixMapping(String prefix, String uri) {
            flushText();
            events.add(Event.startNs(prefix, uri, position()));
        }

        @Override
        public void endPrefixMapping(String prefix) {
            flushText();
            events.add(Event.endNs(prefix != null ? prefix : "", position()));
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes atts) {
            flushText();
            Position pos = position();
            List<Attribute> attributes = new ArrayList<>(atts.getLength());
            for (int i = 0; i < atts.getLength(); i++) {
                QName name = new QName(atts.getURI(i), atts.getLocalName(i), prefixOf(atts.getQName(i)));
                attributes.add(Attribute.literal(name, atts.getValue(i), pos));
            }
            QName tag = new QName(uri, localName, prefixOf(qName));
            events.add(Event.start(tag, new io.markuptemplate.core.model.Attributes(attributes), pos));
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            flushText();
            events.add(Event.end(new QName(uri, localName, prefixOf(qName)), position()));
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            if (inDtd) {
                return;
            }
            if (text.length() == 0) {
                textPosition = position();
            }
            text.append(ch, start, length);
        }

        @Override
        public void ignorableWhitespace(char[] ch, int start, int length) {
            characters(ch, start, length);
        }

        @Override
        public void processingInstruction(String target, String data) {
            flushText();
            events.add(Event.pi(target, data, position()));
        }

        @Override
        public void comment(char[] ch, int start, int length) {
            if (inDtd) {
                return;
            }
            flushText();
            events.add(Event.comment(new String(ch, start, length), position()));
        }

        @Override
        public void startDTD(String name, String publicId, String systemId) {
            flushText();
            events.add(Event.doctype(name, publicId, systemId, position()));
            inDtd = true;
        }

        @Override
        public void endDTD() {
            inDtd = false;
        }

        @Override
        public void endDocument() {
            flushText();
        }

        @Override
        public InputSource resolveEntity(String name, String publicId, String baseURI, String systemId) {
            return new InputSource(new StringReader(""));
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
