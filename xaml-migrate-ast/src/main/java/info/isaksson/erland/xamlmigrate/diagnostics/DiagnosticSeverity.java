package info.isaksson.erland.xamlmigrate.diagnostics;

/** Severity of a {@link Diagnostic}. Declared from most to least severe. */
public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    INFO
}
