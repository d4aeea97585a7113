package info.isaksson.erland.xamlmigrate.ast;

import java.util.Objects;

/**
 * Value of a markup-extension argument: either a literal string or a nested extension.
 *
 * <p>A literal remembers whether it was quoted so it can be written back unchanged.</p>
 */
public final class MarkupParameter {

    private final String literal;
    private final char quote;
    private final XamlMarkupExtension extension;

    private MarkupParameter(String literal, char quote, XamlMarkupExtension extension) {
        this.literal = literal;
        this.quote = quote;
        this.extension = extension;
    }

    public static MarkupParameter literal(String value) {
        return new MarkupParameter(Objects.requireNonNull(value, "value must not be null"), '\0', null);
    }

    public static MarkupParameter quoted(String value, char quote) {
        if (quote != '\'' && quote != '"') throw new IllegalArgumentException("unsupported quote: " + quote);
        return new MarkupParameter(Objects.requireNonNull(value, "value must not be null"), quote, null);
    }

    public static MarkupParameter extension(XamlMarkupExtension extension) {
        return new MarkupParameter(null, '\0', Objects.requireNonNull(extension, "extension must not be null"));
    }

    public boolean isExtension() {
        return extension != null;
    }

    public boolean isQuoted() {
        return quote != '\0';
    }

    public char getQuote() {
        return quote;
    }

    public String getLiteral() {
        return literal;
    }

    public XamlMarkupExtension getExtension() {
        return extension;
    }

    /** Literal text, or the markup form of the nested extension. */
    public String asText() {
        return extension != null ? extension.toMarkupString() : literal;
    }

    @Override
    public String toString() {
        return asText();
    }
}
