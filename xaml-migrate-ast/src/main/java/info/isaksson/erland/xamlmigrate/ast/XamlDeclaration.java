package info.isaksson.erland.xamlmigrate.ast;

/** XML declaration ({@code <?xml ...?>}) as found at the start of the source. */
public final class XamlDeclaration {

    public final String version;
    public final String encoding;
    public final Boolean standalone;

    /** Exact declaration text, or null when synthesized. */
    public final String rawText;

    public XamlDeclaration(String version, String encoding, Boolean standalone, String rawText) {
        this.version = version == null ? "1.0" : version;
        this.encoding = encoding;
        this.standalone = standalone;
        this.rawText = rawText;
    }

    /** Declaration text: the recorded raw text, or one built from the fields. */
    public String toMarkup() {
        if (rawText != null) return rawText;
        StringBuilder sb = new StringBuilder("<?xml version=\"").append(version).append('"');
        if (encoding != null) sb.append(" encoding=\"").append(encoding).append('"');
        if (standalone != null) sb.append(" standalone=\"").append(standalone ? "yes" : "no").append('"');
        return sb.append("?>").toString();
    }
}
