package info.isaksson.erland.xamlmigrate.core;

import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticSink;

import java.util.List;

/** Results of {@link XamlMigrationService#migrateBatch}, in input order. */
public final class XamlBatchResult {

    public final List<XamlMigrationResult> results;

    /** Diagnostics of all documents. */
    public final DiagnosticSink diagnostics;

    XamlBatchResult(List<XamlMigrationResult> results, DiagnosticSink diagnostics) {
        this.results = List.copyOf(results);
        this.diagnostics = diagnostics;
    }

    public int successCount() {
        int n = 0;
        for (XamlMigrationResult r : results) {
            if (r.success && r.outputText != null) n++;
        }
        return n;
    }

    public XamlMigrationResult forFile(String filePath) {
        for (XamlMigrationResult r : results) {
            if (filePath == null ? r.filePath == null : filePath.equals(r.filePath)) return r;
        }
        return null;
    }
}
