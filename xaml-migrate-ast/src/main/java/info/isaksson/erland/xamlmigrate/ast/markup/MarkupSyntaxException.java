package info.isaksson.erland.xamlmigrate.ast.markup;

/** Thrown when a brace-delimited attribute value is not a well-formed markup extension. */
public class MarkupSyntaxException extends RuntimeException {

    private final int position;

    public MarkupSyntaxException(String message, int position) {
        super(message + " (at offset " + position + ")");
        this.position = position;
    }

    /** Offset into the parsed text where the problem was detected. */
    public int getPosition() {
        return position;
    }
}
