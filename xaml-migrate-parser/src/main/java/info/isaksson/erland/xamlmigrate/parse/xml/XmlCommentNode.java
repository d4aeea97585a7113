package info.isaksson.erland.xamlmigrate.parse.xml;

public final class XmlCommentNode extends XmlNode {

    private final String text;
    private final int line;
    private final int column;

    XmlCommentNode(String text, int startOffset, int endOffset, int line, int column) {
        super(startOffset, endOffset);
        this.text = text == null ? "" : text;
        this.line = line;
        this.column = column;
    }

    /** Text between {@code <!--} and {@code -->}. */
    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
