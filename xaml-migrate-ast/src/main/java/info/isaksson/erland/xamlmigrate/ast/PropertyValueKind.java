package info.isaksson.erland.xamlmigrate.ast;

/** Which member of the property value union is populated. */
public enum PropertyValueKind {
    NONE,
    LITERAL,
    ELEMENT,
    MARKUP_EXTENSION
}
