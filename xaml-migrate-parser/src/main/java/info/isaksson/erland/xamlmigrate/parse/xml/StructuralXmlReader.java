package info.isaksson.erland.xamlmigrate.parse.xml;

import com.ctc.wstx.stax.WstxInputFactory;
import info.isaksson.erland.xamlmigrate.parse.PositionIndex;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Streaming reader producing the generic structural tree with exact source offsets.
 *
 * <p>Woodstox checks well-formedness and decodes names, namespaces and values. Offsets are tracked with a
 * cursor over the raw text that advances past every construct in event order; the character offset Woodstox
 * reports for an event is used when it agrees with the cursor.</p>
 *
 * <p>Processing instructions and a DOCTYPE are skipped. Instances are stateless and thread-safe.</p>
 */
public final class StructuralXmlReader {

    private static final Logger LOG = LoggerFactory.getLogger(StructuralXmlReader.class);

    private static final XMLInputFactory2 FACTORY = createFactory();

    public XmlDocumentNode read(String source) throws XmlSyntaxException {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        return new Pass(source).run();
    }

    private static XMLInputFactory2 createFactory() {
        XMLInputFactory2 f = new WstxInputFactory();
        f.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.TRUE);
        f.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
        f.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        f.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        f.setProperty(XMLInputFactory2.P_LAZY_PARSING, Boolean.FALSE);
        f.setProperty(XMLInputFactory2.P_REPORT_PROLOG_WHITESPACE, Boolean.FALSE);
        return f;
    }

    /** One read over one source text. */
    private static final class Pass {
        private final String source;
        private final PositionIndex index;
        private final XmlDocumentNode document;
        private final Deque<XmlElementNode> stack = new ArrayDeque<>();
        private int cursor;

        Pass(String source) {
            this.source = source;
            this.index = new PositionIndex(source);
            this.document = new XmlDocumentNode(source);
        }

        XmlDocumentNode run() throws XmlSyntaxException {
            XMLStreamReader2 r = null;
            try {
                r = (XMLStreamReader2) FACTORY.createXMLStreamReader(new StringReader(source));
                readDeclaration(r);
                while (r.hasNext()) {
                    int event = r.next();
                    switch (event) {
                        case XMLStreamConstants.START_ELEMENT -> onStart(r);
                        case XMLStreamConstants.END_ELEMENT -> onEnd(r);
                        case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE -> onText(r);
                        case XMLStreamConstants.COMMENT -> onComment(r);
                        case XMLStreamConstants.PROCESSING_INSTRUCTION -> skipProcessingInstruction();
                        case XMLStreamConstants.DTD -> skipDoctype();
                        default -> {
                            // entity references are replaced; other events carry no text
                        }
                    }
                }
            } catch (XMLStreamException e) {
                Location loc = e.getLocation();
                int line = loc == null ? -1 : loc.getLineNumber();
                int column = loc == null ? -1 : loc.getColumnNumber();
                throw new XmlSyntaxException(cleanMessage(e), line, column, e);
            } finally {
                closeQuietly(r);
            }
            if (document.getRoot() == null) {
                throw new XmlSyntaxException("no root element", -1, -1, null);
            }
            return document;
        }

        private void readDeclaration(XMLStreamReader2 r) {
            if (!source.startsWith("<?xml") || source.length() < 6 || !MarkupScanner.isXmlWhitespace(source.charAt(5))) {
                return;
            }
            int end = source.indexOf("?>");
            if (end < 0) return;
            Boolean standalone = r.standaloneSet() ? r.isStandalone() : null;
            document.setDeclaration(source.substring(0, end + 2), r.getVersion(), r.getCharacterEncodingScheme(), standalone);
            cursor = end + 2;
        }

        private void onStart(XMLStreamReader2 r) throws XMLStreamException {
            int lt = alignedOffset(r, '<');
            if (lt < 0 || source.charAt(lt) != '<' || lt < cursor) {
                lt = MarkupScanner.nextElementStart(source, cursor);
            }
            if (lt < 0) throw new XMLStreamException("cannot locate start tag of <" + r.getLocalName() + ">", r.getLocation());
            int gt = MarkupScanner.findTagEnd(source, lt);
            if (gt < 0) throw new XMLStreamException("unterminated start tag <" + r.getLocalName(), r.getLocation());
            boolean selfClosing = source.charAt(gt - 1) == '/';

            XmlElementNode e = new XmlElementNode(r.getPrefix(), r.getLocalName(), r.getNamespaceURI(),
                    lt, gt + 1, selfClosing, index.lineOf(lt), index.tagNameColumnOf(lt));

            for (int i = 0; i < r.getNamespaceCount(); i++) {
                String p = r.getNamespacePrefix(i);
                String written = p == null || p.isEmpty() ? "xmlns" : "xmlns:" + p;
                e.addAttribute(XmlAttributeNode.namespaceDeclaration(p, r.getNamespaceURI(i),
                        MarkupScanner.findAttribute(source, lt, gt, written)));
            }
            for (int i = 0; i < r.getAttributeCount(); i++) {
                String p = r.getAttributePrefix(i);
                String local = r.getAttributeLocalName(i);
                String written = p == null || p.isEmpty() ? local : p + ":" + local;
                e.addAttribute(new XmlAttributeNode(p, local, r.getAttributeNamespace(i), r.getAttributeValue(i),
                        false, MarkupScanner.findAttribute(source, lt, gt, written)));
            }
            e.sortAttributesBySource();

            XmlElementNode parent = stack.peek();
            if (parent == null) {
                document.setRoot(e);
            } else {
                parent.addContent(e);
            }
            stack.push(e);
            cursor = gt + 1;
        }

        private void onEnd(XMLStreamReader2 r) throws XMLStreamException {
            XmlElementNode e = stack.pop();
            if (e.isSelfClosing()) {
                e.close(-1, e.getOpenTagEnd());
                return;
            }
            int endStart = alignedOffset(r, '<');
            if (endStart < cursor || !source.startsWith("</", endStart)) {
                endStart = source.indexOf("</", cursor);
            }
            if (endStart < 0) throw new XMLStreamException("cannot locate end tag of <" + e.getQualifiedName() + ">", r.getLocation());
            int gt = source.indexOf('>', endStart);
            if (gt < 0) throw new XMLStreamException("unterminated end tag </" + e.getQualifiedName(), r.getLocation());
            e.close(endStart, gt + 1);
            cursor = gt + 1;
        }

        private void onText(XMLStreamReader2 r) {
            XmlElementNode parent = stack.peek();
            if (parent == null) {
                cursor = MarkupScanner.textEnd(source, cursor);
                return;
            }
            String text = r.getText();
            int start = cursor;
            int end = MarkupScanner.textEnd(source, cursor);
            XmlNode last = parent.lastContent();
            if (last instanceof XmlTextNode && last.getEndOffset() == start) {
                ((XmlTextNode) last).append(text, end);
            } else {
                parent.addContent(new XmlTextNode(text, start, end));
            }
            cursor = end;
        }

        private void onComment(XMLStreamReader2 r) {
            int lt = source.indexOf("<!--", cursor);
            if (lt < 0) return;
            int close = source.indexOf("-->", lt + 4);
            int end = close < 0 ? source.length() : close + 3;
            XmlCommentNode c = new XmlCommentNode(r.getText(), lt, end, index.lineOf(lt), index.columnOf(lt));
            XmlElementNode parent = stack.peek();
            if (parent != null) {
                parent.addContent(c);
            } else if (document.getRoot() == null) {
                document.addPrologComment(c);
            } else {
                document.addEpilogComment(c);
            }
            cursor = end;
        }

        private void skipProcessingInstruction() {
            int lt = source.indexOf("<?", cursor);
            if (lt < 0) return;
            int close = source.indexOf("?>", lt + 2);
            LOG.debug("Skipping processing instruction at offset {}", lt);
            cursor = close < 0 ? source.length() : close + 2;
        }

        private void skipDoctype() {
            int lt = source.indexOf("<!DOCTYPE", cursor);
            if (lt < 0) return;
            LOG.debug("Skipping DOCTYPE at offset {}", lt);
            cursor = MarkupScanner.doctypeEnd(source, lt);
        }

        private int alignedOffset(XMLStreamReader2 r, char expected) {
            Location loc = r.getLocation();
            if (loc == null) return -1;
            int off = loc.getCharacterOffset();
            if (off < 0 || off >= source.length()) return -1;
            return source.charAt(off) == expected ? off : -1;
        }

        private static void closeQuietly(XMLStreamReader2 r) {
            if (r == null) return;
            try {
                r.closeCompletely();
            } catch (XMLStreamException e) {
                LOG.debug("Failed to close stream reader", e);
            }
        }

        private static String cleanMessage(XMLStreamException e) {
            String msg = e.getMessage();
            if (msg == null) return "malformed markup";
            int idx = msg.indexOf("Message: ");
            if (idx >= 0) msg = msg.substring(idx + "Message: ".length());
            int nl = msg.indexOf('\n');
            if (nl >= 0) msg = msg.substring(0, nl);
            return msg.trim();
        }
    }
}
