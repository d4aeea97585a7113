package info.isaksson.erland.xamlmigrate.ast.markup;

import info.isaksson.erland.xamlmigrate.ast.MarkupParameter;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;

import java.util.Map;

/** Writes a {@link XamlMarkupExtension} back to its {@code {Name args}} form. */
public final class MarkupExtensionPrinter {

    private MarkupExtensionPrinter() {}

    public static String print(XamlMarkupExtension ext) {
        StringBuilder sb = new StringBuilder();
        append(sb, ext);
        return sb.toString();
    }

    private static void append(StringBuilder sb, XamlMarkupExtension ext) {
        sb.append('{').append(ext.getName());
        boolean first = true;
        MarkupParameter positional = ext.getPositionalArgument();
        if (positional != null) {
            sb.append(' ');
            appendValue(sb, positional, !ext.getNamedParameters().isEmpty());
            first = false;
        }
        for (Map.Entry<String, MarkupParameter> e : ext.getNamedParameters().entrySet()) {
            sb.append(first ? " " : ", ");
            sb.append(e.getKey()).append('=');
            appendValue(sb, e.getValue(), true);
            first = false;
        }
        sb.append('}');
    }

    private static void appendValue(StringBuilder sb, MarkupParameter value, boolean inList) {
        if (value.isExtension()) {
            append(sb, value.getExtension());
        } else if (value.isQuoted()) {
            appendQuoted(sb, value.getLiteral(), value.getQuote());
        } else if (needsQuoting(value.getLiteral(), inList)) {
            appendQuoted(sb, value.getLiteral(), '\'');
        } else {
            sb.append(value.getLiteral());
        }
    }

    private static void appendQuoted(StringBuilder sb, String literal, char quote) {
        sb.append(quote);
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (c == quote || c == '\\') sb.append('\\');
            sb.append(c);
        }
        sb.append(quote);
    }

    static boolean needsQuoting(String literal, boolean inList) {
        if (literal.isEmpty()) return false;
        char first = literal.charAt(0);
        if (first == '\'' || first == '"' || Character.isWhitespace(first)
                || Character.isWhitespace(literal.charAt(literal.length() - 1))) {
            return true;
        }
        if (first == '{' && !literal.startsWith("{}")) return true;
        int depth = 0;
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (c == '\\') return true;
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) return true;
                depth--;
            } else if (c == ',' && depth == 0 && inList) {
                return true;
            }
        }
        return depth != 0;
    }
}
