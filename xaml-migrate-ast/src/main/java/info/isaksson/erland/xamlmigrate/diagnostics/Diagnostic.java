package info.isaksson.erland.xamlmigrate.diagnostics;

import java.util.Objects;

/**
 * A single finding produced while parsing, transforming or writing a document.
 *
 * <p>Location fields are optional: {@code filePath}, {@code line} and {@code column} may each be null.</p>
 */
public final class Diagnostic {

    public final DiagnosticSeverity severity;

    /** Code stable across versions, see {@link DiagnosticCodes}. */
    public final String code;

    /** Human-readable message. */
    public final String message;

    public final String filePath;
    public final Integer line;
    public final Integer column;

    public Diagnostic(DiagnosticSeverity severity, String code, String message, String filePath, Integer line, Integer column) {
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.filePath = filePath;
        this.line = line;
        this.column = column;
    }

    public boolean isError() {
        return severity == DiagnosticSeverity.ERROR;
    }

    public boolean hasLocation() {
        return line != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return severity == that.severity
                && code.equals(that.code)
                && message.equals(that.message)
                && Objects.equals(filePath, that.filePath)
                && Objects.equals(line, that.line)
                && Objects.equals(column, that.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, code, message, filePath, line, column);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity).append(' ').append(code);
        if (filePath != null || line != null) {
            sb.append(" [");
            if (filePath != null) sb.append(filePath);
            if (line != null) {
                if (filePath != null) sb.append(':');
                sb.append(line);
                if (column != null) sb.append(':').append(column);
            }
            sb.append(']');
        }
        sb.append(": ").append(message);
        return sb.toString();
    }
}
