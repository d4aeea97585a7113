package info.isaksson.erland.xamlmigrate.parse;

import info.isaksson.erland.xamlmigrate.types.TypeResolutionPolicy;
import info.isaksson.erland.xamlmigrate.types.XamlTypeSystem;

/** Options for {@link HybridXamlParser}. */
public final class HybridParserOptions {

    /** Run the type-aware parse and enrich the structural tree with its results. */
    public boolean enableSemanticLayer = true;

    public TypeResolutionPolicy typeResolutionPolicy = TypeResolutionPolicy.LENIENT;

    /** Type system for the semantic layer; null selects the bundled catalog. */
    public XamlTypeSystem typeSystem;

    /** Report members the type system does not know as Info diagnostics. */
    public boolean reportUnresolvedProperties = false;
}
