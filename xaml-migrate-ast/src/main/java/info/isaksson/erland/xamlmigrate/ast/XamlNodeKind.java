package info.isaksson.erland.xamlmigrate.ast;

public enum XamlNodeKind {
    ELEMENT,
    PROPERTY,
    MARKUP_EXTENSION,
    COMMENT
}
