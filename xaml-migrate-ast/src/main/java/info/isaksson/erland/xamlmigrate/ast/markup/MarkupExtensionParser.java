package info.isaksson.erland.xamlmigrate.ast.markup;

import info.isaksson.erland.xamlmigrate.ast.MarkupParameter;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;

/**
 * Recursive-descent parser for {@code {Name args}} attribute values.
 *
 * <p>Grammar, informally:</p>
 * <pre>
 * extension  := '{' name ( ws arguments )? '}'
 * arguments  := positional                       when no top-level '=' occurs
 *             | ( positional ',' )? named ( ',' named )*
 * named      := key '=' value
 * value      := extension | quoted | raw
 * </pre>
 * <p>Braces and quotes are balanced before commas are considered, so nested extensions and quoted
 * literals such as {@code '{0}'} never split an argument.</p>
 */
public final class MarkupExtensionParser {

    private final String text;
    private int pos;

    private MarkupExtensionParser(String text) {
        this.text = text;
    }

    /** True for values that start with a brace and are not escaped with a leading {@code {}}. */
    public static boolean isMarkupExtension(String value) {
        if (value == null || value.length() < 2) return false;
        if (value.charAt(0) != '{' || isEscaped(value)) return false;
        return value.trim().endsWith("}");
    }

    /** {@code {}} prefix marks a literal that merely starts with a brace. */
    public static boolean isEscaped(String value) {
        return value != null && value.startsWith("{}");
    }

    public static String unescape(String value) {
        return isEscaped(value) ? value.substring(2) : value;
    }

    public static XamlMarkupExtension parse(String text) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        MarkupExtensionParser p = new MarkupExtensionParser(text.trim());
        XamlMarkupExtension ext = p.parseExtension();
        p.skipWhitespace();
        if (p.pos != p.text.length()) {
            throw new MarkupSyntaxException("unexpected text after markup extension", p.pos);
        }
        return ext;
    }

    private XamlMarkupExtension parseExtension() {
        expect('{');
        skipWhitespace();
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c) || c == '}' || c == ',') break;
            pos++;
        }
        if (start == pos) {
            throw new MarkupSyntaxException("missing markup extension name", pos);
        }
        XamlMarkupExtension ext = new XamlMarkupExtension(text.substring(start, pos));
        skipWhitespace();
        if (peek() == '}') {
            pos++;
            return ext;
        }
        if (hasTopLevelEquals()) {
            parseArguments(ext);
        } else {
            ext.setPositionalArgument(parseValue(false));
        }
        skipWhitespace();
        expect('}');
        return ext;
    }

    private void parseArguments(XamlMarkupExtension ext) {
        boolean first = true;
        while (true) {
            skipWhitespace();
            String key = tryReadKey();
            MarkupParameter value = parseValue(true);
            if (key == null) {
                if (!first) {
                    throw new MarkupSyntaxException("positional argument after named arguments", pos);
                }
                ext.setPositionalArgument(value);
            } else {
                if (ext.getNamedParameter(key) != null) {
                    throw new MarkupSyntaxException("duplicate argument '" + key + "'", pos);
                }
                ext.setNamedParameter(key, value);
            }
            first = false;
            skipWhitespace();
            if (peek() == ',') {
                pos++;
                continue;
            }
            return;
        }
    }

    private String tryReadKey() {
        int start = pos;
        while (pos < text.length() && isKeyChar(text.charAt(pos))) {
            pos++;
        }
        int end = pos;
        skipWhitespace();
        if (end > start && peek() == '=') {
            pos++;
            return text.substring(start, end);
        }
        pos = start;
        return null;
    }

    private MarkupParameter parseValue(boolean stopAtComma) {
        skipWhitespace();
        char c = peek();
        if (c == '{' && !text.startsWith("{}", pos)) {
            return MarkupParameter.extension(parseExtension());
        }
        if (c == '\'' || c == '"') {
            return MarkupParameter.quoted(readQuoted(c), c);
        }
        return MarkupParameter.literal(readRaw(stopAtComma));
    }

    private String readQuoted(char quote) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < text.length()) {
                sb.append(text.charAt(pos + 1));
                pos += 2;
            } else if (c == quote) {
                pos++;
                return sb.toString();
            } else {
                sb.append(c);
                pos++;
            }
        }
        throw new MarkupSyntaxException("unterminated quoted value", start);
    }

    private String readRaw(boolean stopAtComma) {
        StringBuilder sb = new StringBuilder();
        int depth = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < text.length()) {
                sb.append(text.charAt(pos + 1));
                pos += 2;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) break;
                depth--;
            } else if (c == ',' && depth == 0 && stopAtComma) {
                break;
            }
            sb.append(c);
            pos++;
        }
        if (depth != 0) {
            throw new MarkupSyntaxException("unbalanced braces in value", pos);
        }
        return sb.toString().trim();
    }

    /** Scans the current argument list, up to its closing brace, for an '=' outside nesting and quotes. */
    private boolean hasTopLevelEquals() {
        int depth = 0;
        char quote = 0;
        for (int i = pos; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) return false;
                depth--;
            } else if (c == '=' && depth == 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean isKeyChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == ':';
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private char peek() {
        return pos < text.length() ? text.charAt(pos) : '\0';
    }

    private void expect(char c) {
        if (peek() != c) {
            throw new MarkupSyntaxException("expected '" + c + "'", pos);
        }
        pos++;
    }
}
