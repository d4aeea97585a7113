package info.isaksson.erland.xamlmigrate.types;

import info.isaksson.erland.xamlmigrate.ast.XamlPropertyDescriptor;
import info.isaksson.erland.xamlmigrate.ast.XamlTypeDescriptor;

/**
 * Type information the semantic layer resolves against. Lookups return null when nothing is known.
 *
 * <p>Implementations must be safe for concurrent reads.</p>
 */
public interface XamlTypeSystem {

    /** True when the type system claims to know every type of the namespace. */
    boolean coversNamespace(String namespaceUri);

    XamlTypeDescriptor resolveType(String namespaceUri, String typeName);

    /** Property or event of {@code owner}, searching base types. */
    XamlPropertyDescriptor resolveMember(XamlTypeDescriptor owner, String memberName);

    /** Attached property {@code ownerTypeName.memberName} with the owner looked up in {@code namespaceUri}. */
    default XamlPropertyDescriptor resolveAttachedMember(String namespaceUri, String ownerTypeName, String memberName) {
        XamlTypeDescriptor owner = resolveType(namespaceUri, ownerTypeName);
        if (owner == null) return null;
        XamlPropertyDescriptor p = resolveMember(owner, memberName);
        return p != null && p.attached ? p : null;
    }

    /**
     * Markup extension type for a written extension name: {@code NameExtension} first, then {@code Name}.
     */
    default XamlTypeDescriptor resolveMarkupExtension(String namespaceUri, String localName) {
        XamlTypeDescriptor t = resolveType(namespaceUri, localName.endsWith("Extension") ? localName : localName + "Extension");
        if (t == null) t = resolveType(namespaceUri, localName);
        return t != null && t.markupExtension ? t : null;
    }
}
