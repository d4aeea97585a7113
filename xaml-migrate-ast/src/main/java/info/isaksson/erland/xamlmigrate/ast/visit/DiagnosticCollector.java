package info.isaksson.erland.xamlmigrate.ast.visit;

import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.diagnostics.Diagnostic;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticSeverity;

import java.util.List;

/**
 * Gathers document-level diagnostics followed by element-local ones in document order, optionally
 * filtered to a minimum severity.
 */
public final class DiagnosticCollector extends CollectingVisitor<Diagnostic> {

    private final DiagnosticSeverity minimumSeverity;

    public DiagnosticCollector() {
        this(DiagnosticSeverity.INFO);
    }

    public DiagnosticCollector(DiagnosticSeverity minimumSeverity) {
        this.minimumSeverity = minimumSeverity == null ? DiagnosticSeverity.INFO : minimumSeverity;
    }

    @Override
    public List<Diagnostic> collect(XamlDocument document) {
        results.clear();
        for (Diagnostic d : document.getDiagnostics().all()) {
            accept(d);
        }
        XamlWalker.walk(document, this);
        return results();
    }

    @Override
    public VisitResult visitElement(XamlElement element) {
        for (Diagnostic d : element.getDiagnostics()) {
            accept(d);
        }
        return VisitResult.CONTINUE;
    }

    private void accept(Diagnostic d) {
        // enum order runs ERROR, WARNING, INFO
        if (d.severity.ordinal() <= minimumSeverity.ordinal()) {
            results.add(d);
        }
    }
}
