package info.isaksson.erland.xamlmigrate.parse.xml;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Quote-aware scanning helpers over raw markup text. */
public final class MarkupScanner {

    private static final String CDATA_OPEN = "<![CDATA[";
    private static final String CDATA_CLOSE = "]]>";

    private MarkupScanner() {}

    public static boolean isXmlWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    public static boolean isLineBreak(char c) {
        return c == '\r' || c == '\n';
    }

    /** Index of the {@code >} closing the tag that opens at {@code lt}, skipping quoted values; -1 if missing. */
    public static int findTagEnd(String s, int lt) {
        char quote = 0;
        for (int i = lt + 1; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '>') {
                return i;
            }
        }
        return -1;
    }

    /**
     * Offset of an attribute name inside the opening tag {@code [tagStart, tagEnd)}: a whitespace-preceded
     * {@code name\s*=} outside quoted values. Returns -1 when not found.
     */
    public static int findAttribute(String s, int tagStart, int tagEnd, String qualifiedName) {
        if (tagStart < 0 || tagEnd > s.length() || tagStart >= tagEnd) return -1;
        Pattern p = Pattern.compile("(?<=\\s)" + Pattern.quote(qualifiedName) + "\\s*=");
        Matcher m = p.matcher(s);
        m.region(tagStart, tagEnd);
        m.useTransparentBounds(true);
        while (m.find()) {
            if (!insideQuotes(s, tagStart, m.start())) {
                return m.start();
            }
        }
        return -1;
    }

    /** True when {@code pos} lies inside a quoted attribute value of the tag starting at {@code tagStart}. */
    public static boolean insideQuotes(String s, int tagStart, int pos) {
        char quote = 0;
        for (int i = tagStart; i < pos; i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            }
        }
        return quote != 0;
    }

    /** Next {@code <} that opens an element (not a comment, declaration, PI or end tag). */
    public static int nextElementStart(String s, int from) {
        int i = s.indexOf('<', Math.max(0, from));
        while (i >= 0 && i + 1 < s.length()) {
            char n = s.charAt(i + 1);
            if (n != '!' && n != '?' && n != '/') return i;
            i = s.indexOf('<', i + 1);
        }
        return -1;
    }

    /** End of a run of character data starting at {@code from}: the next {@code <} outside CDATA sections. */
    public static int textEnd(String s, int from) {
        int pos = from;
        while (true) {
            int lt = s.indexOf('<', pos);
            if (lt < 0) return s.length();
            if (s.startsWith(CDATA_OPEN, lt)) {
                int close = s.indexOf(CDATA_CLOSE, lt + CDATA_OPEN.length());
                if (close < 0) return s.length();
                pos = close + CDATA_CLOSE.length();
                continue;
            }
            return lt;
        }
    }

    /** Offset just past a {@code <!DOCTYPE ...>} starting at {@code lt}, skipping an internal subset. */
    public static int doctypeEnd(String s, int lt) {
        int depth = 0;
        char quote = 0;
        for (int i = lt + 2; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
            } else if (c == '>' && depth <= 0) {
                return i + 1;
            }
        }
        return s.length();
    }
}
