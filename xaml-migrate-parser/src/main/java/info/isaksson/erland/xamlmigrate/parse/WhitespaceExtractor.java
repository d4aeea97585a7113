package info.isaksson.erland.xamlmigrate.parse;

import info.isaksson.erland.xamlmigrate.ast.FormattingHints;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticSink;
import info.isaksson.erland.xamlmigrate.parse.xml.MarkupScanner;
import info.isaksson.erland.xamlmigrate.parse.xml.XmlAttributeNode;
import info.isaksson.erland.xamlmigrate.parse.xml.XmlCommentNode;
import info.isaksson.erland.xamlmigrate.parse.xml.XmlElementNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers whitespace and literal source fragments around structural nodes, working only from the raw
 * text and node positions.
 *
 * <p>Leading whitespace is normalized: when it spans more than one line break only the last line break and
 * the indentation after it are kept. Trailing whitespace is returned as found. An internal failure yields
 * empty hints and an informational diagnostic; formatting is lost, the parse goes on.</p>
 */
public final class WhitespaceExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(WhitespaceExtractor.class);

    private final String source;
    private final PositionIndex index;
    private final DiagnosticSink diagnostics;
    private final String filePath;

    public WhitespaceExtractor(PositionIndex index) {
        this(index, null, null);
    }

    public WhitespaceExtractor(PositionIndex index, DiagnosticSink diagnostics, String filePath) {
        if (index == null) throw new IllegalArgumentException("index must not be null");
        this.index = index;
        this.source = index.text();
        this.diagnostics = diagnostics;
        this.filePath = filePath;
    }

    public PositionIndex getIndex() {
        return index;
    }

    /** Whitespace between the previous non-whitespace character and {@code position}, normalized. */
    public String leadingWhitespace(int position) {
        if (position <= 0 || position > source.length()) return "";
        int start = position;
        while (start > 0 && MarkupScanner.isXmlWhitespace(source.charAt(start - 1))) {
            start--;
        }
        return normalizeLeadingWhitespace(source.substring(start, position));
    }

    /** Whitespace from {@code position} up to the next non-whitespace character, as found. */
    public String trailingWhitespace(int position) {
        if (position < 0 || position >= source.length()) return "";
        int end = position;
        while (end < source.length() && MarkupScanner.isXmlWhitespace(source.charAt(end))) {
            end++;
        }
        return source.substring(position, end);
    }

    /**
     * Keep only the final line break and its indentation when {@code ws} holds more than one line break.
     * Applying it twice gives the same result as applying it once.
     */
    public static String normalizeLeadingWhitespace(String ws) {
        if (ws == null || ws.isEmpty()) return ws;
        int breaks = 0;
        int lastBreak = -1;
        for (int i = 0; i < ws.length(); i++) {
            char c = ws.charAt(i);
            if (c == '\n' || c == '\r') {
                if (c == '\r' && i + 1 < ws.length() && ws.charAt(i + 1) == '\n') {
                    lastBreak = i;
                    i++;
                } else {
                    lastBreak = i;
                }
                breaks++;
            }
        }
        if (breaks <= 1) return ws;
        return ws.substring(lastBreak);
    }

    /** Hints for an element or property element: surrounding whitespace, tag-close spacing and tag form. */
    public FormattingHints elementHints(XmlElementNode element) {
        FormattingHints hints = new FormattingHints();
        try {
            int start = index.characterPosition(element.getLine(), element.getColumn());
            hints.leadingWhitespace = leadingWhitespace(start);
            hints.hasNewlineBefore = containsLineBreak(hints.leadingWhitespace);
            hints.selfClosing = element.isSelfClosing();

            int close = element.getOpenTagEnd() - (element.isSelfClosing() ? 2 : 1);
            hints.tagCloseWhitespace = rawWhitespaceBefore(close, start);

            if (!element.isSelfClosing()) {
                hints.innerWhitespace = trailingWhitespace(element.getOpenTagEnd());
                hints.closingWhitespace = leadingWhitespace(element.getEndTagStart());
            }
            hints.trailingWhitespace = trailingWhitespace(element.getEndOffset());
            hints.hasNewlineAfter = containsLineBreak(hints.trailingWhitespace);
        } catch (RuntimeException e) {
            return failed("element <" + element.getQualifiedName() + ">", element.getLine(), e);
        }
        return hints;
    }

    /** Hints for an attribute of {@code parent}; see {@link #attributeLeadingWhitespace(String, XmlElementNode)}. */
    public FormattingHints attributeHints(XmlAttributeNode attribute, XmlElementNode parent) {
        return attributeLeadingWhitespace(attribute.getQualifiedName(), parent);
    }

    /**
     * Locate {@code name\s*=} inside the parent's opening tag and return the whitespace before it, the quote
     * character, the text around {@code =} and the raw text between the quotes. {@code preserveLineBreak} is set when the attribute
     * starts on a new line.
     */
    public FormattingHints attributeLeadingWhitespace(String attributeName, XmlElementNode parent) {
        FormattingHints hints = new FormattingHints();
        try {
            int tagStart = index.characterPosition(parent.getLine(), parent.getColumn());
            int tagEnd = parent.getOpenTagEnd();
            int at = MarkupScanner.findAttribute(source, tagStart, tagEnd, attributeName);
            if (at < 0) return hints;

            hints.leadingWhitespace = rawWhitespaceBefore(at, tagStart);
            hints.preserveLineBreak = containsLineBreak(hints.leadingWhitespace);
            hints.hasNewlineBefore = hints.preserveLineBreak;

            int eq = source.indexOf('=', at + attributeName.length());
            int q = eq + 1;
            while (q < tagEnd && MarkupScanner.isXmlWhitespace(source.charAt(q))) q++;
            char quote = source.charAt(q);
            if (quote == '"' || quote == '\'') {
                int closing = source.indexOf(quote, q + 1);
                if (closing > q && closing < tagEnd) {
                    hints.quoteChar = quote;
                    hints.separatorText = source.substring(at + attributeName.length(), q);
                    hints.originalText = source.substring(q + 1, closing);
                }
            }
        } catch (RuntimeException e) {
            return failed("attribute " + attributeName, parent.getLine(), e);
        }
        return hints;
    }

    public FormattingHints commentHints(XmlCommentNode comment) {
        FormattingHints hints = new FormattingHints();
        try {
            hints.leadingWhitespace = leadingWhitespace(comment.getStartOffset());
            hints.hasNewlineBefore = containsLineBreak(hints.leadingWhitespace);
            hints.trailingWhitespace = trailingWhitespace(comment.getEndOffset());
            hints.hasNewlineAfter = containsLineBreak(hints.trailingWhitespace);
        } catch (RuntimeException e) {
            return failed("comment", comment.getLine(), e);
        }
        return hints;
    }

    /** Raw text between the opening and closing tag of a non-self-closing element, or null. */
    public String innerText(XmlElementNode element) {
        if (element.isSelfClosing() || element.getEndTagStart() < element.getOpenTagEnd()) return null;
        return source.substring(element.getOpenTagEnd(), element.getEndTagStart());
    }

    private String rawWhitespaceBefore(int position, int floor) {
        int start = position;
        while (start > floor && MarkupScanner.isXmlWhitespace(source.charAt(start - 1))) {
            start--;
        }
        return source.substring(start, position);
    }

    private static boolean containsLineBreak(String s) {
        return s != null && (s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0);
    }

    private FormattingHints failed(String what, int line, RuntimeException e) {
        LOG.debug("Whitespace extraction failed for {} at line {}", what, line, e);
        if (diagnostics != null) {
            diagnostics.addInfo(DiagnosticCodes.WHITESPACE_EXTRACTION_FAILED,
                    "Formatting of " + what + " could not be recovered: " + e.getMessage(),
                    filePath, line > 0 ? line : null, null);
        }
        return new FormattingHints();
    }
}
