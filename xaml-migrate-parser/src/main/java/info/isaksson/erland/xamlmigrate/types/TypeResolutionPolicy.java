package info.isaksson.erland.xamlmigrate.types;

/** How the semantic layer treats a type it cannot resolve in a namespace the type system covers. */
public enum TypeResolutionPolicy {
    /** Record a warning and leave the type unresolved. */
    LENIENT,
    /** Abort the semantic layer; the parser continues structural-only. */
    STRICT
}
