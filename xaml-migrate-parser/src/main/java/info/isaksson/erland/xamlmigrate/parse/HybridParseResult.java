package info.isaksson.erland.xamlmigrate.parse;

import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticSink;

/** Outcome of one hybrid parse. */
public final class HybridParseResult {

    /** Unified tree, or null when the structural parse failed. */
    public final XamlDocument document;

    public final ParseState state;

    /** The document's own diagnostics, or the parse diagnostics when there is no document. */
    public final DiagnosticSink diagnostics;

    HybridParseResult(XamlDocument document, ParseState state, DiagnosticSink diagnostics) {
        this.document = document;
        this.state = state;
        this.diagnostics = document != null ? document.getDiagnostics() : diagnostics;
    }

    /** True when a document was produced, regardless of warnings. */
    public boolean isSuccess() {
        return document != null;
    }

    public boolean isSemanticallyEnriched() {
        return state == ParseState.DONE;
    }
}
