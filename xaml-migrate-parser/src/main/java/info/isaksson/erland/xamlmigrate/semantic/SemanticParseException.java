package info.isaksson.erland.xamlmigrate.semantic;

/**
 * Thrown when the type-aware parse cannot produce a semantic view: the text is rejected by the DOM
 * parser, or a type is unresolved under {@link info.isaksson.erland.xamlmigrate.types.TypeResolutionPolicy#STRICT}.
 */
public class SemanticParseException extends Exception {

    public SemanticParseException(String message) {
        super(message);
    }

    public SemanticParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
