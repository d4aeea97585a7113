package info.isaksson.erland.xamlmigrate.parse;

import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticBag;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.parse.structural.StructuralConverter;
import info.isaksson.erland.xamlmigrate.parse.xml.StructuralXmlReader;
import info.isaksson.erland.xamlmigrate.parse.xml.XmlDocumentNode;
import info.isaksson.erland.xamlmigrate.parse.xml.XmlSyntaxException;
import info.isaksson.erland.xamlmigrate.semantic.SemanticConverter;
import info.isaksson.erland.xamlmigrate.semantic.SemanticDocument;
import info.isaksson.erland.xamlmigrate.semantic.SemanticParseException;
import info.isaksson.erland.xamlmigrate.semantic.SemanticParser;
import info.isaksson.erland.xamlmigrate.types.CatalogTypeSystem;
import info.isaksson.erland.xamlmigrate.types.XamlTypeSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses markup text into the unified tree.
 *
 * <p>Pipeline per document:</p>
 * <ol>
 *   <li>structural parse with exact positions; failure is fatal and yields no document</li>
 *   <li>type-aware semantic parse; failure degrades to a structural-only tree with a Warning</li>
 *   <li>merge: the semantic view enriches the structural tree in place</li>
 * </ol>
 *
 * <p>Instances hold no per-document state and may be shared between threads.</p>
 */
public final class HybridXamlParser {

    private static final Logger LOG = LoggerFactory.getLogger(HybridXamlParser.class);

    private final HybridParserOptions options;
    private final XamlTypeSystem typeSystem;
    private final StructuralXmlReader reader = new StructuralXmlReader();
    private final StructuralConverter structuralConverter = new StructuralConverter();
    private final SemanticConverter semanticConverter = new SemanticConverter();

    public HybridXamlParser() {
        this(new HybridParserOptions());
    }

    public HybridXamlParser(HybridParserOptions options) {
        this.options = options == null ? new HybridParserOptions() : options;
        this.typeSystem = this.options.typeSystem != null ? this.options.typeSystem
                : this.options.enableSemanticLayer ? CatalogTypeSystem.defaults() : null;
    }

    public HybridParseResult parse(String text, String filePath) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        DiagnosticBag early = new DiagnosticBag();
        ParseState state = ParseState.IDLE;

        // 1) Structural layer
        if (text.isBlank()) {
            early.addError(DiagnosticCodes.XML_EMPTY, "Markup text is empty", filePath, null, null);
            return new HybridParseResult(null, ParseState.FAILED, early);
        }
        state = transition(filePath, state, ParseState.STRUCTURAL_PARSING);
        XmlDocumentNode xml;
        try {
            xml = reader.read(text);
        } catch (XmlSyntaxException e) {
            LOG.debug("Structural parse of {} failed: {}", filePath, e.getMessage());
            early.addError(DiagnosticCodes.XML_PARSE_ERROR, "Markup is not well-formed: " + e.getMessage(),
                    filePath, e.hasLocation() ? e.getLine() : null, e.hasLocation() ? e.getColumn() : null);
            return new HybridParseResult(null, ParseState.FAILED, early);
        }
        WhitespaceExtractor whitespace = new WhitespaceExtractor(new PositionIndex(text), early, filePath);
        XamlDocument doc = structuralConverter.convert(xml, whitespace, filePath);
        doc.getDiagnostics().mergeFrom(early);

        if (!options.enableSemanticLayer) {
            doc.getDiagnostics().addInfo(DiagnosticCodes.STRUCTURAL_ONLY,
                    "Semantic layer disabled; types and members are not resolved", filePath, null, null);
            return new HybridParseResult(doc, transition(filePath, state, ParseState.STRUCTURAL_ONLY), null);
        }

        // 2) Semantic layer
        state = transition(filePath, state, ParseState.SEMANTIC_PARSING);
        SemanticDocument sem;
        try {
            sem = new SemanticParser(typeSystem, options.typeResolutionPolicy, options.reportUnresolvedProperties)
                    .parse(text, filePath);
        } catch (SemanticParseException e) {
            LOG.warn("Semantic parse of {} failed, continuing with the structural tree: {}", filePath, e.getMessage());
            doc.getDiagnostics().addWarning(DiagnosticCodes.SEMANTIC_PARSE_FAILED,
                    "Semantic parse failed, types are not resolved: " + e.getMessage(), filePath, null, null);
            return new HybridParseResult(doc, transition(filePath, state, ParseState.STRUCTURAL_ONLY), null);
        }
        doc.getDiagnostics().mergeFrom(sem.getDiagnostics());

        // 3) Merge
        state = transition(filePath, state, ParseState.MERGING);
        try {
            semanticConverter.enrich(doc, sem);
        } catch (RuntimeException e) {
            LOG.warn("Enrichment of {} failed, keeping the structural tree: {}", filePath, e.toString());
            doc.getDiagnostics().addWarning(DiagnosticCodes.ENRICHMENT_FAILED,
                    "Semantic enrichment failed: " + e, filePath, null, null);
            return new HybridParseResult(doc, transition(filePath, state, ParseState.STRUCTURAL_ONLY), null);
        }
        return new HybridParseResult(doc, transition(filePath, state, ParseState.DONE), null);
    }

    /**
     * Parse several documents independently, keeping the input order. Used by callers that resolve
     * resources across documents.
     */
    public Map<String, HybridParseResult> parseBatch(Map<String, String> textsByPath) {
        if (textsByPath == null) throw new IllegalArgumentException("textsByPath must not be null");
        Map<String, HybridParseResult> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : textsByPath.entrySet()) {
            out.put(e.getKey(), parse(e.getValue(), e.getKey()));
        }
        return out;
    }

    public HybridParserOptions getOptions() {
        return options;
    }

    private static ParseState transition(String filePath, ParseState from, ParseState to) {
        LOG.debug("{}: {} -> {}", filePath, from, to);
        return to;
    }
}
