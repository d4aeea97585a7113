package info.isaksson.erland.xamlmigrate.ast;

/**
 * Directive attributes from the XAML language namespace that carry structural meaning.
 *
 * <p>Declaration order is the order the writer emits directives that have no recorded source order.</p>
 */
public enum XamlDirective {
    CLASS("Class"),
    NAME("Name"),
    KEY("Key"),
    FIELD_MODIFIER("FieldModifier"),
    SHARED("Shared");

    private final String localName;

    XamlDirective(String localName) {
        this.localName = localName;
    }

    public String localName() {
        return localName;
    }

    /** Directive for a local attribute name, or null when the name is not a directive. */
    public static XamlDirective fromLocalName(String localName) {
        if (localName == null) return null;
        for (XamlDirective d : values()) {
            if (d.localName.equals(localName)) return d;
        }
        return null;
    }
}
