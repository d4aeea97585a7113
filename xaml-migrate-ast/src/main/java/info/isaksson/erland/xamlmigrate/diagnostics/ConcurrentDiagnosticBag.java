package info.isaksson.erland.xamlmigrate.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Thread-safe append-only diagnostic collector, shared by per-document pipelines running in parallel.
 *
 * <p>{@link #all()} returns a snapshot; order between concurrent writers is unspecified, use
 * {@link #toDeterministicList()} for stable output.</p>
 */
public final class ConcurrentDiagnosticBag implements DiagnosticSink {

    private final ConcurrentLinkedQueue<Diagnostic> diagnostics = new ConcurrentLinkedQueue<>();

    @Override
    public void add(Diagnostic diagnostic) {
        diagnostics.add(Objects.requireNonNull(diagnostic, "diagnostic must not be null"));
    }

    @Override
    public List<Diagnostic> all() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }
}
