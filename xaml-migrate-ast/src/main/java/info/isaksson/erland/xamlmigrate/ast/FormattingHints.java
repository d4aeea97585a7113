package info.isaksson.erland.xamlmigrate.ast;

/**
 * Whitespace and literal fragments recorded from the source so a node can be re-emitted byte for byte.
 *
 * <p>A {@code null} string means "not recorded"; the writer then falls back to computed formatting.
 * Hints are owned by exactly one node, use {@link #copy()} when cloning.</p>
 */
public final class FormattingHints {

    /** Whitespace between the previous token and this node's first character. */
    public String leadingWhitespace;

    /** Whitespace between this node's last character and the next token. */
    public String trailingWhitespace;

    /** Whitespace between an element's opening tag and its first child or text. */
    public String innerWhitespace;

    /** Whitespace between an element's last child and its closing tag. */
    public String closingWhitespace;

    /** Whitespace between the last attribute and {@code >} or {@code />} of an opening tag. */
    public String tagCloseWhitespace;

    /** Raw source text of the node's literal value (attribute value between quotes, or element text). */
    public String originalText;

    /** Decoded value that {@link #originalText} represents; used to detect whether a rule changed it. */
    public String originalValue;

    /** Raw text between an attribute's name and its opening quote, {@code =} plus any whitespace around it. */
    public String separatorText;

    /** Quote character used around an attribute value. */
    public char quoteChar = '"';

    /** Leading whitespace of an attribute contains a line break. */
    public boolean preserveLineBreak;

    public boolean hasNewlineBefore;
    public boolean hasNewlineAfter;

    /** Element was written as {@code <Tag/>}. */
    public boolean selfClosing;

    public boolean isEmpty() {
        return leadingWhitespace == null
                && trailingWhitespace == null
                && innerWhitespace == null
                && closingWhitespace == null
                && tagCloseWhitespace == null
                && originalText == null;
    }

    public FormattingHints copy() {
        FormattingHints c = new FormattingHints();
        c.leadingWhitespace = leadingWhitespace;
        c.trailingWhitespace = trailingWhitespace;
        c.innerWhitespace = innerWhitespace;
        c.closingWhitespace = closingWhitespace;
        c.tagCloseWhitespace = tagCloseWhitespace;
        c.originalText = originalText;
        c.originalValue = originalValue;
        c.separatorText = separatorText;
        c.quoteChar = quoteChar;
        c.preserveLineBreak = preserveLineBreak;
        c.hasNewlineBefore = hasNewlineBefore;
        c.hasNewlineAfter = hasNewlineAfter;
        c.selfClosing = selfClosing;
        return c;
    }
}
