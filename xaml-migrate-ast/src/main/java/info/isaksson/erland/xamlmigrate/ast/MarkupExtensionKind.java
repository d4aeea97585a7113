package info.isaksson.erland.xamlmigrate.ast;

/** Well-known markup extensions, keyed by local name (prefix stripped). */
public enum MarkupExtensionKind {
    BINDING,
    TEMPLATE_BINDING,
    STATIC_RESOURCE,
    DYNAMIC_RESOURCE,
    TYPE,
    STATIC,
    NULL,
    RELATIVE_SOURCE,
    OTHER;

    public static MarkupExtensionKind fromName(String name) {
        if (name == null) return OTHER;
        String local = localName(name);
        switch (local) {
            case "Binding":
                return BINDING;
            case "TemplateBinding":
                return TEMPLATE_BINDING;
            case "StaticResource":
                return STATIC_RESOURCE;
            case "DynamicResource":
                return DYNAMIC_RESOURCE;
            case "Type":
                return TYPE;
            case "Static":
                return STATIC;
            case "Null":
                return NULL;
            case "RelativeSource":
                return RELATIVE_SOURCE;
            default:
                return OTHER;
        }
    }

    static String localName(String name) {
        int colon = name.indexOf(':');
        String local = colon >= 0 ? name.substring(colon + 1) : name;
        if (local.endsWith("Extension") && local.length() > "Extension".length()) {
            local = local.substring(0, local.length() - "Extension".length());
        }
        return local;
    }
}
