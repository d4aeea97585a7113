package info.isaksson.erland.xamlmigrate.core;

import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.companion.CompanionUnit;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticSink;
import info.isaksson.erland.xamlmigrate.parse.ParseState;
import info.isaksson.erland.xamlmigrate.transform.TransformationRecord;

import java.util.List;

/** Outcome of migrating one document. */
public final class XamlMigrationResult {

    public final String filePath;

    /** True when the structural parse produced a document. */
    public final boolean success;

    /** Migrated XAML, or null when parsing or serialization failed. */
    public final String outputText;

    /** Transformed document; null when the structural parse failed. */
    public final XamlDocument document;

    public final ParseState parseState;

    /** All diagnostics of this document, from every stage. */
    public final DiagnosticSink diagnostics;

    public final List<TransformationRecord> trace;

    /** Linked companion unit, when an index was given and x:Class matched. */
    public final CompanionUnit companionUnit;

    XamlMigrationResult(String filePath, String outputText, XamlDocument document, ParseState parseState,
                        DiagnosticSink diagnostics, List<TransformationRecord> trace, CompanionUnit companionUnit) {
        this.filePath = filePath;
        this.success = document != null;
        this.outputText = outputText;
        this.document = document;
        this.parseState = parseState;
        this.diagnostics = diagnostics;
        this.trace = trace == null ? List.of() : List.copyOf(trace);
        this.companionUnit = companionUnit;
    }

    public boolean hasErrors() {
        return diagnostics.hasErrors();
    }
}
