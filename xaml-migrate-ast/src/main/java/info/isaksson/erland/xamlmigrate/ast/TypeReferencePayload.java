package info.isaksson.erland.xamlmigrate.ast;

/** Argument of an {@code x:Type} extension. */
public final class TypeReferencePayload extends MarkupExtensionPayload {

    /** Type name as written, possibly prefixed ({@code local:MyControl}). */
    public final String typeName;

    public TypeReferencePayload(String typeName) {
        this.typeName = typeName;
    }

    static TypeReferencePayload from(XamlMarkupExtension ext) {
        return new TypeReferencePayload(textOf(ext, "TypeName"));
    }

    public String prefix() {
        if (typeName == null) return null;
        int colon = typeName.indexOf(':');
        return colon > 0 ? typeName.substring(0, colon) : null;
    }

    public String localTypeName() {
        if (typeName == null) return null;
        int colon = typeName.indexOf(':');
        return colon >= 0 ? typeName.substring(colon + 1) : typeName;
    }
}
