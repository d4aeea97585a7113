package info.isaksson.erland.xamlmigrate.parse.structural;

import info.isaksson.erland.xamlmigrate.ast.FormattingHints;
import info.isaksson.erland.xamlmigrate.ast.SourceLocation;
import info.isaksson.erland.xamlmigrate.ast.SymbolTable;
import info.isaksson.erland.xamlmigrate.ast.XamlComment;
import info.isaksson.erland.xamlmigrate.ast.XamlDeclaration;
import info.isaksson.erland.xamlmigrate.ast.XamlDirective;
import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;
import info.isaksson.erland.xamlmigrate.ast.XamlNamespaces;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;
import info.isaksson.erland.xamlmigrate.ast.markup.MarkupExtensionParser;
import info.isaksson.erland.xamlmigrate.ast.markup.MarkupSyntaxException;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticSink;
import info.isaksson.erland.xamlmigrate.parse.PositionIndex;
import info.isaksson.erland.xamlmigrate.parse.WhitespaceExtractor;
import info.isaksson.erland.xamlmigrate.parse.xml.XmlAttributeNode;
import info.isaksson.erland.xamlmigrate.parse.xml.XmlCommentNode;
import info.isaksson.erland.xamlmigrate.parse.xml.XmlDocumentNode;
import info.isaksson.erland.xamlmigrate.parse.xml.XmlElementNode;
import info.isaksson.erland.xamlmigrate.parse.xml.XmlNode;
import info.isaksson.erland.xamlmigrate.parse.xml.XmlTextNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts the generic structural tree into the unified tree.
 *
 * <p>Namespace declarations and directive attributes are taken out of the property list and recorded as
 * header attributes so the writer can keep their source order. {@code Owner.Name} attributes become attached
 * properties, {@code <Owner.Name>} child elements become property elements, and brace-delimited values are
 * parsed as markup extensions. Every node gets formatting hints from the {@link WhitespaceExtractor}.</p>
 *
 * <p>The symbol table is built in one pass over the finished tree.</p>
 */
public final class StructuralConverter {

    public XamlDocument convert(XmlDocumentNode xml, WhitespaceExtractor whitespace, String filePath) {
        if (xml == null) throw new IllegalArgumentException("xml must not be null");
        if (whitespace == null) throw new IllegalArgumentException("whitespace must not be null");

        XamlDocument doc = new XamlDocument(filePath);
        new Conversion(doc, whitespace, filePath).run(xml);
        return doc;
    }

    /** State of one conversion. */
    private static final class Conversion {
        private final XamlDocument doc;
        private final WhitespaceExtractor whitespace;
        private final PositionIndex index;
        private final String filePath;
        private final DiagnosticSink diagnostics;

        Conversion(XamlDocument doc, WhitespaceExtractor whitespace, String filePath) {
            this.doc = doc;
            this.whitespace = whitespace;
            this.index = whitespace.getIndex();
            this.filePath = filePath;
            this.diagnostics = doc.getDiagnostics();
        }

        void run(XmlDocumentNode xml) {
            if (xml.getDeclarationText() != null) {
                doc.setDeclaration(new XamlDeclaration(xml.getVersion(), xml.getEncoding(), xml.getStandalone(),
                        xml.getDeclarationText()));
            }
            for (XmlCommentNode c : xml.getPrologComments()) {
                doc.addLeadingComment(comment(c));
            }
            doc.setRoot(element(xml.getRoot()));
            for (XmlCommentNode c : xml.getEpilogComments()) {
                doc.addTrailingComment(comment(c));
            }
            doc.setTrailingWhitespace(whitespace.trailingWhitespace(xml.contentEnd()));

            SymbolTable symbols = doc.rebuildSymbolTable();
            for (String dup : symbols.getDuplicateNames()) {
                SourceLocation first = symbols.findNamed(dup).getLocation();
                diagnostics.addWarning(DiagnosticCodes.DUPLICATE_NAME,
                        "Name '" + dup + "' is declared more than once (first at line " + first.line + ")",
                        filePath, first.line, first.column);
            }
        }

        private XamlElement element(XmlElementNode x) {
            XamlElement e = new XamlElement(x.getLocalName(), x.getNamespaceUri());
            e.setPrefix(x.getPrefix());
            e.setLocation(location(x.getLine(), x.getColumn()));
            FormattingHints hints = whitespace.elementHints(x);
            e.setHints(hints);

            for (XmlAttributeNode a : x.getAttributes()) {
                attribute(e, a, x);
            }

            int slot = 0;
            boolean hasMarkup = false;
            boolean hasPropertyElements = false;
            boolean hasChildElements = false;
            StringBuilder text = new StringBuilder();
            for (XmlNode n : x.getContent()) {
                if (n instanceof XmlTextNode) {
                    text.append(((XmlTextNode) n).getText());
                } else if (n instanceof XmlCommentNode) {
                    XamlComment c = comment((XmlCommentNode) n);
                    c.setAnchorIndex(slot);
                    e.addComment(c);
                    hasMarkup = true;
                } else if (n instanceof XmlElementNode) {
                    XmlElementNode child = (XmlElementNode) n;
                    if (child.isPropertyElement()) {
                        e.addProperty(propertyElement(child));
                        hasPropertyElements = true;
                    } else {
                        e.addChild(element(child));
                        hasChildElements = true;
                    }
                    slot++;
                    hasMarkup = true;
                }
            }

            if (!isBlank(text)) {
                if (!hasMarkup) {
                    e.setTextContent(text.toString());
                    hints.originalText = whitespace.innerText(x);
                    hints.originalValue = text.toString();
                    hints.closingWhitespace = null;
                } else {
                    // mixed content keeps only the text, written before the child nodes
                    e.setTextContent(text.toString().trim());
                    if (hasPropertyElements) {
                        diagnostics.addWarning(DiagnosticCodes.CONTENT_AMBIGUOUS,
                                "<" + x.getQualifiedName() + "> has both text content and property elements; text is kept as content",
                                filePath, x.getLine(), x.getColumn());
                    } else if (hasChildElements) {
                        diagnostics.addInfo(DiagnosticCodes.CONTENT_AMBIGUOUS,
                                "<" + x.getQualifiedName() + "> mixes text and child elements; text is written before the children",
                                filePath, x.getLine(), x.getColumn());
                    }
                }
            }
            return e;
        }

        private void attribute(XamlElement e, XmlAttributeNode a, XmlElementNode owner) {
            FormattingHints hints = whitespace.attributeHints(a, owner);
            String written = a.getQualifiedName();

            if (a.isNamespaceDeclaration()) {
                e.declareNamespace(a.declaredPrefix(), a.getValue());
                hints.originalValue = a.getValue();
                e.recordHeaderAttribute(written, hints);
                return;
            }
            XamlDirective directive = XamlNamespaces.isLanguageNamespace(a.getNamespaceUri())
                    ? XamlDirective.fromLocalName(a.getLocalName()) : null;
            if (directive != null) {
                e.setDirective(directive, a.getValue());
                hints.originalValue = a.getValue();
                e.recordHeaderAttribute(written, hints);
                return;
            }

            XamlProperty p = XamlProperty.parseAttribute(a.getLocalName(), null);
            p.setPrefix(a.getPrefix());
            p.setNamespaceUri(a.getNamespaceUri());
            p.setLocation(a.getSourceOffset() < 0 ? e.getLocation()
                    : location(index.lineOf(a.getSourceOffset()), index.columnOf(a.getSourceOffset())));

            String value = a.getValue();
            if (MarkupExtensionParser.isMarkupExtension(value)) {
                try {
                    XamlMarkupExtension ext = MarkupExtensionParser.parse(value);
                    ext.setLocation(p.getLocation());
                    p.setMarkupExtension(ext);
                    hints.originalValue = ext.toMarkupString();
                } catch (MarkupSyntaxException ex) {
                    diagnostics.addWarning(DiagnosticCodes.MARKUP_EXTENSION_SYNTAX,
                            "Invalid markup extension in " + written + " at offset " + ex.getPosition() + ": " + ex.getMessage()
                                    + "; value kept as literal",
                            filePath, p.getLocation().line, p.getLocation().column);
                    p.setLiteralValue(value);
                    hints.originalValue = value;
                }
            } else {
                p.setLiteralValue(value);
                hints.originalValue = value;
            }
            p.setHints(hints);
            e.addProperty(p);
        }

        private XamlProperty propertyElement(XmlElementNode x) {
            String local = x.getLocalName();
            int dot = local.indexOf('.');
            String ownerType = local.substring(0, dot);
            String name = local.substring(dot + 1);

            XamlProperty p = XamlProperty.propertyElement(ownerType, name);
            p.setPrefix(x.getPrefix());
            p.setNamespaceUri(x.getNamespaceUri());
            p.setLocation(location(x.getLine(), x.getColumn()));
            FormattingHints hints = whitespace.elementHints(x);
            p.setHints(hints);

            if (!x.getAttributes().isEmpty()) {
                diagnostics.addWarning(DiagnosticCodes.CONTENT_AMBIGUOUS,
                        "Attributes on property element <" + x.getQualifiedName() + "> are ignored",
                        filePath, x.getLine(), x.getColumn());
            }

            List<XmlElementNode> elements = new ArrayList<>();
            List<XmlCommentNode> comments = new ArrayList<>();
            StringBuilder text = new StringBuilder();
            for (XmlNode n : x.getContent()) {
                if (n instanceof XmlElementNode) elements.add((XmlElementNode) n);
                else if (n instanceof XmlCommentNode) comments.add((XmlCommentNode) n);
                else if (n instanceof XmlTextNode) text.append(((XmlTextNode) n).getText());
            }

            if (elements.isEmpty() && comments.isEmpty()) {
                if (!isBlank(text)) {
                    p.setLiteralValue(text.toString());
                    hints.originalText = whitespace.innerText(x);
                    hints.originalValue = text.toString();
                    hints.closingWhitespace = null;
                }
                return p;
            }
            if (!isBlank(text)) {
                diagnostics.addWarning(DiagnosticCodes.CONTENT_AMBIGUOUS,
                        "Text inside property element <" + x.getQualifiedName() + "> next to elements is ignored",
                        filePath, x.getLine(), x.getColumn());
            }
            if (elements.size() == 1 && comments.isEmpty()) {
                p.setElementValue(element(elements.get(0)));
                return p;
            }

            // several values, or comments between them: keep them in a synthetic container
            XamlElement collection = XamlElement.syntheticCollection(name);
            collection.setLocation(p.getLocation());
            for (XmlNode n : x.getContent()) {
                if (n instanceof XmlElementNode) {
                    collection.addChild(element((XmlElementNode) n));
                } else if (n instanceof XmlCommentNode) {
                    XamlComment c = comment((XmlCommentNode) n);
                    c.setAnchorIndex(collection.getChildren().size());
                    collection.addComment(c);
                }
            }
            p.setElementValue(collection);
            return p;
        }

        private XamlComment comment(XmlCommentNode c) {
            XamlComment comment = XamlComment.preserved(c.getText());
            comment.setLocation(location(c.getLine(), c.getColumn()));
            comment.setHints(whitespace.commentHints(c));
            return comment;
        }

        private SourceLocation location(int line, int column) {
            return new SourceLocation(filePath, line, column);
        }

        private static boolean isBlank(CharSequence s) {
            for (int i = 0; i < s.length(); i++) {
                if (!Character.isWhitespace(s.charAt(i))) return false;
            }
            return true;
        }
    }
}
