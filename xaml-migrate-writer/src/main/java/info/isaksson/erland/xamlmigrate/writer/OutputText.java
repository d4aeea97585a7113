package info.isaksson.erland.xamlmigrate.writer;

public final class OutputText extends OutputNode {

    /** Decoded character data. */
    public final String text;

    /** Source text to write verbatim instead of escaping {@link #text}, or null. */
    public final String rawText;

    public OutputText(String text, String rawText) {
        this.text = text == null ? "" : text;
        this.rawText = rawText;
    }
}
