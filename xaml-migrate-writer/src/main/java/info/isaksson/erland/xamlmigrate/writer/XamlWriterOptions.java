package info.isaksson.erland.xamlmigrate.writer;

import info.isaksson.erland.xamlmigrate.ast.XamlNamespaces;

/**
 * Options for {@link XamlWriter}.
 *
 * <p>Public mutable fields, documented defaults.</p>
 */
public final class XamlWriterOptions {

    /** Re-emit recorded whitespace and raw literals; when off, indentation is computed from tree depth. */
    public boolean preserveFormatting = true;

    /** Emit comments taken from the source. */
    public boolean preserveComments = true;

    /**
     * Write unprefixed elements in {@link #targetNamespace} and replace the root's default and language
     * namespace declarations. Prefixed declarations such as {@code clr-namespace:} are kept.
     */
    public boolean useTargetNamespace = false;

    /** Default namespace used by {@link #useTargetNamespace}. */
    public String targetNamespace = XamlNamespaces.AVALONIA;

    /** Order ordinary attributes by written name; namespace declarations and directives stay first. */
    public boolean sortAttributes = false;

    /** Indent unit for computed formatting. */
    public String indent = "    ";

    /** Line break for computed formatting and the diagnostic banner. */
    public String newline = "\n";

    /** Append a comment summarizing errors and warnings (and transformation notes, if given). */
    public boolean includeDiagnosticComments = false;

    /** Entries per banner section before the "... and N more" line. */
    public int diagnosticCap = 10;

    /** First line of the diagnostic banner. */
    public String bannerTitle = "XAML migration - manual review required:";

    /** Write an XML declaration when the source had none. */
    public boolean emitDeclaration = false;

    public static XamlWriterOptions compact() {
        XamlWriterOptions o = new XamlWriterOptions();
        o.preserveFormatting = false;
        return o;
    }
}
