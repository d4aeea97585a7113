package info.isaksson.erland.xamlmigrate.parse.xml;

/** Character data between markup. CDATA sections are merged into the surrounding text. */
public final class XmlTextNode extends XmlNode {

    private final StringBuilder text = new StringBuilder();

    XmlTextNode(String text, int startOffset, int endOffset) {
        super(startOffset, endOffset);
        this.text.append(text);
    }

    void append(String more, int newEndOffset) {
        text.append(more);
        setEndOffset(newEndOffset);
    }

    /** Decoded text (entities replaced). */
    public String getText() {
        return text.toString();
    }

    public boolean isWhitespaceOnly() {
        for (int i = 0; i < text.length(); i++) {
            if (!MarkupScanner.isXmlWhitespace(text.charAt(i))) return false;
        }
        return true;
    }
}
