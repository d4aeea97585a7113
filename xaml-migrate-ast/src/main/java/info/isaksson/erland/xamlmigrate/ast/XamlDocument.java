package info.isaksson.erland.xamlmigrate.ast;

import info.isaksson.erland.xamlmigrate.ast.visit.SymbolTableBuilder;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticBag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of one parsed markup unit.
 *
 * <p>Created once per parse, mutated in place by enrichment and transformation rules and consumed by the
 * writer. The root element is null only for a document built by hand before a root is assigned.</p>
 */
public final class XamlDocument {

    private final String filePath;
    private XamlDeclaration declaration;
    private XamlElement root;
    private final List<XamlComment> leadingComments = new ArrayList<>();
    private final List<XamlComment> trailingComments = new ArrayList<>();
    private SymbolTable symbolTable = new SymbolTable();
    private final NodeMetadata metadata = new NodeMetadata();
    private final DiagnosticBag diagnostics = new DiagnosticBag();
    private String trailingWhitespace;

    public XamlDocument(String filePath) {
        this.filePath = filePath;
    }

    public String getFilePath() {
        return filePath;
    }

    public XamlDeclaration getDeclaration() {
        return declaration;
    }

    public void setDeclaration(XamlDeclaration declaration) {
        this.declaration = declaration;
    }

    public boolean hasDeclaration() {
        return declaration != null;
    }

    public XamlElement getRoot() {
        return root;
    }

    public void setRoot(XamlElement root) {
        if (root != null) {
            XamlNode.requireDetached(root);
        }
        this.root = root;
    }

    public List<XamlComment> getLeadingComments() {
        return Collections.unmodifiableList(leadingComments);
    }

    public void addLeadingComment(XamlComment comment) {
        leadingComments.add(XamlNode.requireDetached(comment));
    }

    public List<XamlComment> getTrailingComments() {
        return Collections.unmodifiableList(trailingComments);
    }

    public void addTrailingComment(XamlComment comment) {
        trailingComments.add(XamlNode.requireDetached(comment));
    }

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    /** Re-derive the symbol table from the current tree and return it. */
    public SymbolTable rebuildSymbolTable() {
        this.symbolTable = SymbolTableBuilder.build(root);
        return symbolTable;
    }

    public void setSymbolTable(SymbolTable symbolTable) {
        this.symbolTable = symbolTable == null ? new SymbolTable() : symbolTable;
    }

    public NodeMetadata getMetadata() {
        return metadata;
    }

    public DiagnosticBag getDiagnostics() {
        return diagnostics;
    }

    /** Whitespace after the last top-level node (typically the final line break). */
    public String getTrailingWhitespace() {
        return trailingWhitespace;
    }

    public void setTrailingWhitespace(String trailingWhitespace) {
        this.trailingWhitespace = trailingWhitespace;
    }

    /** Prefix declared for the XAML language namespace on the root, defaulting to {@code x}. */
    public String languagePrefix() {
        if (root != null) {
            for (var e : root.getNamespaceDeclarations().entrySet()) {
                if (XamlNamespaces.isLanguageNamespace(e.getValue()) && !e.getKey().isEmpty()) {
                    return e.getKey();
                }
            }
        }
        String p = symbolTable.prefixForNamespace(XamlNamespaces.XAML_LANGUAGE);
        return p == null || p.isEmpty() ? XamlNamespaces.DEFAULT_LANGUAGE_PREFIX : p;
    }
}
