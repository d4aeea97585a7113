package info.isaksson.erland.xamlmigrate.writer;

import info.isaksson.erland.xamlmigrate.diagnostics.Diagnostic;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticSeverity;

import java.util.ArrayList;
import java.util.List;

/**
 * Text of the aggregated review comment: a title, a rule of {@code =}, an ERRORS section, a WARNINGS
 * section, optional transformation notes and a closing rule. Each section is capped with an
 * {@code ... and N more} line.
 */
public final class DiagnosticBanner {

    static final String RULE = "=".repeat(70);

    private DiagnosticBanner() {}

    /**
     * @param diagnostics diagnostics in output order; info entries are ignored
     * @param notes       transformation notes, may be empty
     * @return the comment text, or null when there is nothing to report
     */
    public static String build(List<Diagnostic> diagnostics, List<String> notes, XamlWriterOptions options) {
        List<Diagnostic> errors = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (d.severity == DiagnosticSeverity.ERROR) errors.add(d);
            else if (d.severity == DiagnosticSeverity.WARNING) warnings.add(d);
        }
        if (errors.isEmpty() && warnings.isEmpty() && (notes == null || notes.isEmpty())) {
            return null;
        }

        String nl = options.newline;
        int cap = Math.max(0, options.diagnosticCap);
        StringBuilder sb = new StringBuilder();
        sb.append(nl).append(options.bannerTitle).append(nl).append(RULE).append(nl);
        section(sb, "ERRORS", "errors", entries(errors), cap, nl);
        section(sb, "WARNINGS", "warnings", entries(warnings), cap, nl);
        if (notes != null) {
            section(sb, "TRANSFORMATIONS", "transformations", notes, cap, nl);
        }
        sb.append(nl).append("Please review and address these issues manually.").append(nl);
        sb.append(RULE).append(nl);
        return sanitize(sb.toString());
    }

    private static List<String> entries(List<Diagnostic> diagnostics) {
        List<String> out = new ArrayList<>(diagnostics.size());
        for (Diagnostic d : diagnostics) {
            out.add(d.line == null
                    ? "[" + d.code + "] " + d.message
                    : "[" + d.code + "] Line " + d.line + ": " + d.message);
        }
        return out;
    }

    private static void section(StringBuilder sb, String title, String noun, List<String> entries, int cap, String nl) {
        if (entries.isEmpty()) return;
        sb.append(nl).append(title).append(" (").append(entries.size()).append("):").append(nl);
        int shown = Math.min(cap, entries.size());
        for (int i = 0; i < shown; i++) {
            sb.append("  ").append(entries.get(i)).append(nl);
        }
        if (entries.size() > shown) {
            sb.append("  ... and ").append(entries.size() - shown).append(" more ").append(noun).append(nl);
        }
    }

    /** A comment must not contain {@code --}. */
    static String sanitize(String text) {
        String s = text;
        while (s.contains("--")) {
            s = s.replace("--", "- -");
        }
        return s;
    }
}
