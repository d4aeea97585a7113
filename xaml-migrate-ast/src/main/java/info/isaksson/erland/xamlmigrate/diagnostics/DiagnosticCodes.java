package info.isaksson.erland.xamlmigrate.diagnostics;

/** Stable diagnostic codes. Codes never change meaning once published. */
public final class DiagnosticCodes {

    private DiagnosticCodes() {}

    // Parsing
    public static final String XML_EMPTY = "XML_EMPTY";
    public static final String XML_PARSE_ERROR = "XML_PARSE_ERROR";
    public static final String MARKUP_EXTENSION_SYNTAX = "MARKUP_EXTENSION_SYNTAX";
    public static final String DUPLICATE_NAME = "DUPLICATE_NAME";
    public static final String CONTENT_AMBIGUOUS = "CONTENT_AMBIGUOUS";
    public static final String WHITESPACE_EXTRACTION_FAILED = "WHITESPACE_EXTRACTION_FAILED";

    // Semantic layer
    public static final String SEMANTIC_PARSE_FAILED = "SEMANTIC_PARSE_FAILED";
    public static final String TYPE_UNRESOLVED = "TYPE_UNRESOLVED";
    public static final String PROPERTY_UNRESOLVED = "PROPERTY_UNRESOLVED";
    public static final String ENRICHMENT_CHILD_COUNT_MISMATCH = "ENRICHMENT_CHILD_COUNT_MISMATCH";
    public static final String ENRICHMENT_FAILED = "ENRICHMENT_FAILED";
    public static final String STRUCTURAL_ONLY = "STRUCTURAL_ONLY";

    // Mapping lookups during transformation
    public static final String NAMESPACE_MAPPING_NOT_FOUND = "NAMESPACE_MAPPING_NOT_FOUND";
    public static final String NAMESPACE_REQUIRES_MANUAL_REVIEW = "NAMESPACE_REQUIRES_MANUAL_REVIEW";
    public static final String TYPE_MAPPING_NOT_FOUND = "TYPE_MAPPING_NOT_FOUND";
    public static final String TYPE_REQUIRES_MANUAL_REVIEW = "TYPE_REQUIRES_MANUAL_REVIEW";
    public static final String PROPERTY_MAPPING_NOT_FOUND = "PROPERTY_MAPPING_NOT_FOUND";
    public static final String PROPERTY_REQUIRES_MANUAL_REVIEW = "PROPERTY_REQUIRES_MANUAL_REVIEW";
    public static final String PROPERTY_TYPE_CHANGED = "PROPERTY_TYPE_CHANGED";
    public static final String VALUE_CONVERSION_FAILED = "VALUE_CONVERSION_FAILED";
    public static final String EVENT_MAPPING_NOT_FOUND = "EVENT_MAPPING_NOT_FOUND";
    public static final String EVENT_REQUIRES_MANUAL_REVIEW = "EVENT_REQUIRES_MANUAL_REVIEW";
    public static final String MARKUP_EXTENSION_REVIEW = "MARKUP_EXTENSION_REVIEW";
    public static final String TRANSFORMATION_ERROR = "TRANSFORMATION_ERROR";

    // Writing
    public static final String SERIALIZATION_ERROR = "SERIALIZATION_ERROR";

    // Companion code linkage
    public static final String COMPANION_NOT_AVAILABLE = "COMPANION_NOT_AVAILABLE";
    public static final String COMPANION_NO_CLASS = "COMPANION_NO_CLASS";
    public static final String COMPANION_CLASS_MISMATCH = "COMPANION_CLASS_MISMATCH";
    public static final String COMPANION_CLASS_LINKED = "COMPANION_CLASS_LINKED";
    public static final String COMPANION_MISSING_FIELD = "COMPANION_MISSING_FIELD";
    public static final String COMPANION_MISSING_HANDLER = "COMPANION_MISSING_HANDLER";
}
