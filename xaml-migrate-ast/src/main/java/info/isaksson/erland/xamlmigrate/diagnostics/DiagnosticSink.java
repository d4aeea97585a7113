package info.isaksson.erland.xamlmigrate.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Append-only collector of diagnostics, queryable by severity and by file.
 *
 * <p>Implementations decide whether concurrent appends are allowed; see {@link ConcurrentDiagnosticBag}.</p>
 */
public interface DiagnosticSink {

    Comparator<Diagnostic> DETERMINISTIC_ORDER = Comparator
            .comparing((Diagnostic d) -> d.filePath == null ? "" : d.filePath)
            .thenComparing(d -> d.line == null ? 0 : d.line)
            .thenComparing(d -> d.column == null ? 0 : d.column)
            .thenComparing(d -> d.code)
            .thenComparing(d -> d.message);

    void add(Diagnostic diagnostic);

    /** Snapshot of all diagnostics in insertion order. */
    List<Diagnostic> all();

    default void addError(String code, String message) {
        addError(code, message, null, null, null);
    }

    default void addError(String code, String message, String filePath, Integer line, Integer column) {
        add(new Diagnostic(DiagnosticSeverity.ERROR, code, message, filePath, line, column));
    }

    default void addWarning(String code, String message) {
        addWarning(code, message, null, null, null);
    }

    default void addWarning(String code, String message, String filePath, Integer line, Integer column) {
        add(new Diagnostic(DiagnosticSeverity.WARNING, code, message, filePath, line, column));
    }

    default void addInfo(String code, String message) {
        addInfo(code, message, null, null, null);
    }

    default void addInfo(String code, String message, String filePath, Integer line, Integer column) {
        add(new Diagnostic(DiagnosticSeverity.INFO, code, message, filePath, line, column));
    }

    default void mergeFrom(DiagnosticSink other) {
        if (other == null || other == this) return;
        for (Diagnostic d : other.all()) {
            add(d);
        }
    }

    default List<Diagnostic> bySeverity(DiagnosticSeverity severity) {
        List<Diagnostic> out = new ArrayList<>();
        for (Diagnostic d : all()) {
            if (d.severity == severity) out.add(d);
        }
        return Collections.unmodifiableList(out);
    }

    default List<Diagnostic> forFile(String filePath) {
        List<Diagnostic> out = new ArrayList<>();
        for (Diagnostic d : all()) {
            if (Objects.equals(d.filePath, filePath)) out.add(d);
        }
        return Collections.unmodifiableList(out);
    }

    default List<Diagnostic> byCode(String code) {
        List<Diagnostic> out = new ArrayList<>();
        for (Diagnostic d : all()) {
            if (d.code.equals(code)) out.add(d);
        }
        return Collections.unmodifiableList(out);
    }

    default boolean hasErrors() {
        for (Diagnostic d : all()) {
            if (d.isError()) return true;
        }
        return false;
    }

    default boolean isEmpty() {
        return all().isEmpty();
    }

    /** Sorted by (file, line, column, code, message) so output does not depend on append order. */
    default List<Diagnostic> toDeterministicList() {
        List<Diagnostic> out = new ArrayList<>(all());
        out.sort(DETERMINISTIC_ORDER);
        return Collections.unmodifiableList(out);
    }
}
