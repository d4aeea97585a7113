package info.isaksson.erland.xamlmigrate.writer;

import java.util.Objects;

/** One attribute of an opening tag. */
public final class OutputAttribute {

    /** Whitespace before the name, at least one character. */
    public final String leadingWhitespace;
    public final String name;

    /** Decoded value. */
    public final String value;

    /** Source text between the quotes, written verbatim when set. */
    public final String rawValue;

    public final char quote;

    /** Text between the name and the opening quote; plain {@code =} unless the source spaced it. */
    public final String separator;

    public OutputAttribute(String leadingWhitespace, String name, String value, String rawValue, char quote) {
        this(leadingWhitespace, name, value, rawValue, quote, null);
    }

    public OutputAttribute(String leadingWhitespace, String name, String value, String rawValue, char quote,
                           String separator) {
        this.leadingWhitespace = leadingWhitespace == null || leadingWhitespace.isEmpty() ? " " : leadingWhitespace;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.value = value == null ? "" : value;
        this.rawValue = rawValue;
        this.quote = quote == '\'' ? '\'' : '"';
        this.separator = separator == null || !separator.strip().equals("=") ? "=" : separator;
    }

    public OutputAttribute(String name, String value) {
        this(" ", name, value, null, '"');
    }
}
