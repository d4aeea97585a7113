package info.isaksson.erland.xamlmigrate.parse.xml;

/** Source text is not well-formed markup. Line and column are 1-based, or -1 when unknown. */
public class XmlSyntaxException extends Exception {

    private final int line;
    private final int column;

    public XmlSyntaxException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasLocation() {
        return line > 0;
    }
}
