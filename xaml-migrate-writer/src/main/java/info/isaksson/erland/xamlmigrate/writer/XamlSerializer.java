package info.isaksson.erland.xamlmigrate.writer;

import info.isaksson.erland.xamlmigrate.ast.FormattingHints;
import info.isaksson.erland.xamlmigrate.ast.PropertyValueKind;
import info.isaksson.erland.xamlmigrate.ast.XamlComment;
import info.isaksson.erland.xamlmigrate.ast.XamlDeclaration;
import info.isaksson.erland.xamlmigrate.ast.XamlDirective;
import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlNamespaces;
import info.isaksson.erland.xamlmigrate.ast.XamlNode;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the output tree of a document.
 *
 * <p>With {@code preserveFormatting} every node carries its recorded leading whitespace and unchanged
 * literals keep their raw source text, so an untouched document renders byte for byte. Without it,
 * indentation follows tree depth and all values are escaped.</p>
 *
 * <p>Opening tags list namespace declarations and directives first, then ordinary attributes. Content is
 * written property elements first, then children; element comments sit before the content slot they are
 * anchored to.</p>
 */
public final class XamlSerializer {

    private final XamlWriterOptions options;

    public XamlSerializer(XamlWriterOptions options) {
        this.options = options == null ? new XamlWriterOptions() : options;
    }

    public OutputDocument serialize(XamlDocument document) {
        return serialize(document, List.of());
    }

    /**
     * @param notes transformation notes for the diagnostic banner; ignored unless diagnostic comments are on
     */
    public OutputDocument serialize(XamlDocument document, List<String> notes) {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        return new Run(document).document(notes == null ? List.of() : notes);
    }

    /** Checks an element or attribute name before it is written. */
    static String checkName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalStateException("Empty XML name");
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean ok = i == 0
                    ? Character.isLetter(c) || c == '_'
                    : Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == ':';
            if (!ok) {
                throw new IllegalStateException("Invalid XML name '" + name + "'");
            }
        }
        return name;
    }

    /** State of one serialization. */
    private final class Run {
        private final XamlDocument doc;
        private final boolean preserve;
        private final String languagePrefix;

        Run(XamlDocument doc) {
            this.doc = doc;
            this.preserve = options.preserveFormatting;
            this.languagePrefix = doc.languagePrefix();
        }

        OutputDocument document(List<String> notes) {
            OutputDocument out = new OutputDocument();

            // 1) declaration
            XamlDeclaration decl = doc.getDeclaration();
            if (decl != null) {
                out.declaration = preserve
                        ? decl.toMarkup()
                        : new XamlDeclaration(decl.version, decl.encoding, decl.standalone, null).toMarkup();
            } else if (options.emitDeclaration) {
                out.declaration = new XamlDeclaration("1.0", "utf-8", null, null).toMarkup();
            }
            boolean first = out.declaration == null;

            // 2) comments before the root
            for (XamlComment c : doc.getLeadingComments()) {
                if (!emits(c)) continue;
                out.prolog.add(comment(c, 0, first));
                first = false;
            }

            // 3) root
            if (doc.getRoot() != null) {
                out.root = element(doc.getRoot(), 0, first, null, true);
                first = false;
            }

            // 4) comments after the root, then the banner
            for (XamlComment c : doc.getTrailingComments()) {
                if (!emits(c)) continue;
                out.epilog.add(comment(c, 0, first));
                first = false;
            }
            if (options.includeDiagnosticComments) {
                String banner = DiagnosticBanner.build(doc.getDiagnostics().toDeterministicList(), notes, options);
                if (banner != null) {
                    OutputComment c = new OutputComment(banner);
                    c.leadingWhitespace = first ? "" : options.newline;
                    out.epilog.add(c);
                    first = false;
                }
            }

            if (preserve) {
                out.trailingWhitespace = nz(doc.getTrailingWhitespace());
            } else {
                out.trailingWhitespace = first ? "" : options.newline;
            }
            return out;
        }

        // ---- elements ----

        private OutputElement element(XamlElement e, int depth, boolean firstInDocument, String inheritedDefault,
                                      boolean root) {
            OutputElement out = new OutputElement(checkName(elementName(e)));
            FormattingHints hints = e.getHints();
            out.leadingWhitespace = leading(e, depth, firstInDocument);

            Map<String, String> declarations = declarationsOf(e, root);
            String scopeDefault = declarations.containsKey("") ? declarations.get("") : inheritedDefault;
            String override = e.getOverrideNamespace();
            if (!options.useTargetNamespace && override != null && e.getPrefix() == null
                    && !declarations.containsKey("") && !override.equals(inheritedDefault)) {
                Map<String, String> withDefault = new LinkedHashMap<>();
                withDefault.put("", override);
                withDefault.putAll(declarations);
                declarations = withDefault;
                scopeDefault = override;
            }

            headers(e, declarations, out);

            List<XamlProperty> attributes = new ArrayList<>();
            List<XamlNode> slots = new ArrayList<>();
            for (XamlProperty p : e.getProperties()) {
                if (p.isPropertyElement() || p.valueKind() == PropertyValueKind.ELEMENT) {
                    slots.add(p);
                } else {
                    attributes.add(p);
                }
            }
            if (options.sortAttributes) {
                attributes.sort(Comparator.comparing(XamlProperty::writtenName));
            }
            for (XamlProperty p : attributes) {
                out.attributes.add(attribute(p.writtenName(), attributeValue(p), p.getHints()));
            }
            if (preserve && hints.tagCloseWhitespace != null) {
                out.tagCloseWhitespace = hints.tagCloseWhitespace;
            }

            slots.addAll(e.getChildren());
            List<XamlComment> comments = emittedComments(e);
            String text = e.getTextContent();
            if (text != null && text.isBlank()) text = null;

            if (slots.isEmpty() && comments.isEmpty()) {
                if (text == null) {
                    out.selfClosing = !preserve || hints.selfClosing || hints.isEmpty();
                    out.closingWhitespace = preserve ? nz(hints.closingWhitespace) : "";
                } else {
                    out.content.add(text(text, hints));
                }
                return out;
            }

            // mixed content: the text goes first
            if (text != null) {
                OutputText t = new OutputText(text, null);
                t.leadingWhitespace = preserve && hints.innerWhitespace != null
                        ? hints.innerWhitespace : computed(depth + 1);
                out.content.add(t);
            }
            slots(out, e, slots, comments, depth + 1, scopeDefault);
            out.closingWhitespace = closing(hints, depth);
            return out;
        }

        private void slots(OutputElement out, XamlElement owner, List<XamlNode> slots, List<XamlComment> comments,
                           int depth, String scopeDefault) {
            for (int i = 0; i < slots.size(); i++) {
                for (XamlComment c : comments) {
                    if (Math.max(0, c.getAnchorIndex()) == i) out.content.add(comment(c, depth, false));
                }
                XamlNode n = slots.get(i);
                if (n instanceof XamlElement) {
                    out.content.add(element((XamlElement) n, depth, false, scopeDefault, false));
                } else {
                    out.content.add(propertyElement((XamlProperty) n, owner, depth, scopeDefault));
                }
            }
            for (XamlComment c : comments) {
                if (c.getAnchorIndex() >= slots.size()) out.content.add(comment(c, depth, false));
            }
        }

        private OutputElement propertyElement(XamlProperty p, XamlElement owner, int depth, String scopeDefault) {
            String name = p.isPropertyElement() || p.isAttached()
                    ? p.writtenName()
                    : elementName(owner) + "." + p.getName();
            OutputElement out = new OutputElement(checkName(name));
            FormattingHints hints = p.getHints();
            out.leadingWhitespace = leading(p, depth, false);
            if (preserve && hints.tagCloseWhitespace != null) {
                out.tagCloseWhitespace = hints.tagCloseWhitespace;
            }

            switch (p.valueKind()) {
                case LITERAL:
                    out.content.add(text(p.getLiteralValue(), hints));
                    return out;
                case MARKUP_EXTENSION:
                    out.content.add(new OutputText(p.getMarkupExtension().toMarkupString(), null));
                    return out;
                case ELEMENT: {
                    XamlElement value = p.getElementValue();
                    if (value.isSynthetic()) {
                        slots(out, value, new ArrayList<>(value.getChildren()), emittedComments(value), depth + 1,
                                scopeDefault);
                    } else {
                        out.content.add(element(value, depth + 1, false, scopeDefault, false));
                    }
                    break;
                }
                default:
                    break;
            }
            if (out.content.isEmpty()) {
                out.selfClosing = !preserve || hints.selfClosing || hints.isEmpty();
                out.closingWhitespace = preserve ? nz(hints.closingWhitespace) : "";
            } else {
                out.closingWhitespace = closing(hints, depth);
            }
            return out;
        }

        // ---- opening tag ----

        private void headers(XamlElement e, Map<String, String> declarations, OutputElement out) {
            Set<String> written = new HashSet<>();
            Set<XamlDirective> directives = EnumSet.noneOf(XamlDirective.class);

            // 1) recorded source order
            if (preserve) {
                for (String h : e.getHeaderOrder()) {
                    String value;
                    if (isNamespaceDeclaration(h)) {
                        value = declarations.get(declaredPrefix(h));
                    } else {
                        XamlDirective d = directiveOf(h);
                        value = d == null ? null : e.getDirective(d);
                        if (value != null) directives.add(d);
                    }
                    if (value == null || !written.add(h)) continue;
                    out.attributes.add(attribute(h, value, e.getHeaderHints(h)));
                }
            }

            // 2) declarations without recorded position
            for (Map.Entry<String, String> d : declarations.entrySet()) {
                String h = d.getKey().isEmpty() ? "xmlns" : "xmlns:" + d.getKey();
                if (written.add(h)) {
                    out.attributes.add(attribute(h, d.getValue(), null));
                }
            }

            // 3) directives without recorded position, in declaration order
            for (XamlDirective d : XamlDirective.values()) {
                String value = e.getDirective(d);
                if (value == null || directives.contains(d)) continue;
                out.attributes.add(attribute(languagePrefix + ":" + d.localName(), value, null));
            }
        }

        private Map<String, String> declarationsOf(XamlElement e, boolean root) {
            Map<String, String> own = e.getNamespaceDeclarations();
            if (!root || !options.useTargetNamespace) return own;
            Map<String, String> out = new LinkedHashMap<>();
            out.put("", options.targetNamespace);
            out.put(languagePrefix, XamlNamespaces.XAML_LANGUAGE);
            for (Map.Entry<String, String> d : own.entrySet()) {
                if (d.getKey().isEmpty() || XamlNamespaces.isLanguageNamespace(d.getValue())) continue;
                out.putIfAbsent(d.getKey(), d.getValue());
            }
            return out;
        }

        private OutputAttribute attribute(String name, String value, FormattingHints hints) {
            checkName(name);
            if (!preserve || hints == null) {
                return new OutputAttribute(name, value);
            }
            String raw = hints.originalText != null && value.equals(hints.originalValue) ? hints.originalText : null;
            return new OutputAttribute(hints.leadingWhitespace, name, value, raw, hints.quoteChar,
                    hints.separatorText);
        }

        private String attributeValue(XamlProperty p) {
            switch (p.valueKind()) {
                case LITERAL:
                    return p.getLiteralValue();
                case MARKUP_EXTENSION:
                    return p.getMarkupExtension().toMarkupString();
                default:
                    return "";
            }
        }

        private String elementName(XamlElement e) {
            if (options.useTargetNamespace
                    && (e.getPrefix() == null || options.targetNamespace.equals(e.getNamespaceUri()))) {
                return e.getTypeName();
            }
            return e.qualifiedName();
        }

        private XamlDirective directiveOf(String writtenName) {
            int colon = writtenName.indexOf(':');
            if (colon <= 0) return null;
            return XamlDirective.fromLocalName(writtenName.substring(colon + 1));
        }

        // ---- text, comments, whitespace ----

        private OutputText text(String value, FormattingHints hints) {
            String raw = preserve && hints.originalText != null && value.equals(hints.originalValue)
                    ? hints.originalText : null;
            return new OutputText(value, raw);
        }

        private OutputComment comment(XamlComment c, int depth, boolean firstInDocument) {
            OutputComment out = new OutputComment(c.isPreserve() ? c.getText() : DiagnosticBanner.sanitize(c.getText()));
            out.leadingWhitespace = leading(c, depth, firstInDocument);
            return out;
        }

        private boolean emits(XamlComment c) {
            return c.isPreserve() ? options.preserveComments : options.includeDiagnosticComments;
        }

        private List<XamlComment> emittedComments(XamlElement e) {
            List<XamlComment> out = new ArrayList<>();
            for (XamlComment c : e.getComments()) {
                if (emits(c)) out.add(c);
            }
            return out;
        }

        private String leading(XamlNode node, int depth, boolean firstInDocument) {
            if (preserve && node.getHints().leadingWhitespace != null) {
                return node.getHints().leadingWhitespace;
            }
            return firstInDocument ? "" : computed(depth);
        }

        private String closing(FormattingHints hints, int depth) {
            if (preserve && hints.closingWhitespace != null) return hints.closingWhitespace;
            return computed(depth);
        }

        private String computed(int depth) {
            return options.newline + options.indent.repeat(Math.max(0, depth));
        }
    }

    private static boolean isNamespaceDeclaration(String writtenName) {
        return writtenName.equals("xmlns") || writtenName.startsWith("xmlns:");
    }

    private static String declaredPrefix(String writtenName) {
        return writtenName.equals("xmlns") ? "" : writtenName.substring("xmlns:".length());
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
