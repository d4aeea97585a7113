package info.isaksson.erland.xamlmigrate.writer;

/** Renders an output tree to text. Values without raw source text are escaped here. */
public final class XamlTextRenderer {

    private XamlTextRenderer() {}

    public static String render(OutputDocument document) {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        StringBuilder sb = new StringBuilder();
        if (document.declaration != null) {
            sb.append(document.declaration);
        }
        for (OutputNode n : document.prolog) {
            node(sb, n);
        }
        if (document.root != null) {
            node(sb, document.root);
        }
        for (OutputNode n : document.epilog) {
            node(sb, n);
        }
        sb.append(document.trailingWhitespace);
        return sb.toString();
    }

    private static void node(StringBuilder sb, OutputNode n) {
        sb.append(n.leadingWhitespace);
        if (n instanceof OutputElement) {
            element(sb, (OutputElement) n);
        } else if (n instanceof OutputText) {
            OutputText t = (OutputText) n;
            sb.append(t.rawText != null ? t.rawText : escapeText(t.text));
        } else if (n instanceof OutputComment) {
            sb.append("<!--").append(((OutputComment) n).text).append("-->");
        } else {
            throw new IllegalStateException("Unknown output node " + n.getClass().getName());
        }
    }

    private static void element(StringBuilder sb, OutputElement e) {
        sb.append('<').append(e.name);
        for (OutputAttribute a : e.attributes) {
            sb.append(a.leadingWhitespace).append(a.name).append(a.separator).append(a.quote);
            sb.append(a.rawValue != null ? a.rawValue : escapeAttribute(a.value, a.quote));
            sb.append(a.quote);
        }
        sb.append(e.tagCloseWhitespace);
        if (e.content.isEmpty() && e.selfClosing) {
            sb.append("/>");
            return;
        }
        sb.append('>');
        for (OutputNode n : e.content) {
            node(sb, n);
        }
        sb.append(e.closingWhitespace);
        sb.append("</").append(e.name).append('>');
    }

    /** Escape {@code & < > "} and the quote in use; line breaks and tabs become character references. */
    public static String escapeAttribute(String value, char quote) {
        if (value == null) return "";
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&': sb.append("&amp;"); break;
                case '<': sb.append("&lt;"); break;
                case '>': sb.append("&gt;"); break;
                case '"': sb.append("&quot;"); break;
                case '\'': sb.append(quote == '\'' ? "&apos;" : "'"); break;
                case '\n': sb.append("&#10;"); break;
                case '\r': sb.append("&#13;"); break;
                case '\t': sb.append("&#9;"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String escapeText(String text) {
        if (text == null) return "";
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&': sb.append("&amp;"); break;
                case '<': sb.append("&lt;"); break;
                case '>': sb.append("&gt;"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }
}
