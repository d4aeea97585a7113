package info.isaksson.erland.xamlmigrate.semantic;

import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticBag;

import java.util.Objects;

/** Result of a type-aware parse: the root object and the diagnostics raised while resolving types. */
public final class SemanticDocument {

    private final String filePath;
    private final SemanticObject root;
    private final DiagnosticBag diagnostics;

    public SemanticDocument(String filePath, SemanticObject root, DiagnosticBag diagnostics) {
        this.filePath = filePath;
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.diagnostics = diagnostics == null ? new DiagnosticBag() : diagnostics;
    }

    public String getFilePath() {
        return filePath;
    }

    public SemanticObject getRoot() {
        return root;
    }

    public DiagnosticBag getDiagnostics() {
        return diagnostics;
    }
}
