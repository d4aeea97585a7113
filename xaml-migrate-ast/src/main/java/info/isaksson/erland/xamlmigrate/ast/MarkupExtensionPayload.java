package info.isaksson.erland.xamlmigrate.ast;

/**
 * Typed view of a well-known markup extension's arguments.
 *
 * <p>Subclasses: {@link BindingPayload}, {@link ResourcePayload}, {@link TypeReferencePayload},
 * {@link StaticMemberPayload}. Payloads are derived from the extension's parameters and are rebuilt
 * by {@link XamlMarkupExtension#refreshPayload()}.</p>
 */
public abstract class MarkupExtensionPayload {

    MarkupExtensionPayload() {}

    /**
     * Payload for an extension according to the fixed name table, or null when the extension has no
     * specialized payload.
     */
    static MarkupExtensionPayload derive(XamlMarkupExtension ext) {
        switch (ext.extensionKind()) {
            case BINDING:
                return BindingPayload.from(ext, false);
            case TEMPLATE_BINDING:
                return BindingPayload.from(ext, true);
            case STATIC_RESOURCE:
                return ResourcePayload.from(ext, false);
            case DYNAMIC_RESOURCE:
                return ResourcePayload.from(ext, true);
            case TYPE:
                return TypeReferencePayload.from(ext);
            case STATIC:
                return StaticMemberPayload.from(ext);
            default:
                return null;
        }
    }

    static String textOf(XamlMarkupExtension ext, String named) {
        MarkupParameter p = ext.getNamedParameter(named);
        if (p == null && ext.getPositionalArgument() != null) {
            p = ext.getPositionalArgument();
        }
        return p == null ? null : p.asText();
    }

    static String namedText(XamlMarkupExtension ext, String named) {
        MarkupParameter p = ext.getNamedParameter(named);
        return p == null ? null : p.asText();
    }
}
