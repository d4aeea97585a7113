package info.isaksson.erland.xamlmigrate.ast;

import java.util.Objects;

/** Resolved type information attached to an element or markup extension by the semantic layer. */
public final class XamlTypeDescriptor {

    /** Simple XAML type name, e.g. {@code Button}. */
    public final String name;

    /** XML namespace the type was resolved in. */
    public final String namespaceUri;

    /** Fully qualified framework type name, e.g. {@code System.Windows.Controls.Button}. */
    public final String fullName;

    public final String baseTypeName;

    /** Name of the property that receives element content, or null. */
    public final String contentPropertyName;

    public final boolean markupExtension;

    public XamlTypeDescriptor(String name, String namespaceUri, String fullName, String baseTypeName,
                              String contentPropertyName, boolean markupExtension) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.namespaceUri = namespaceUri;
        this.fullName = fullName == null ? name : fullName;
        this.baseTypeName = baseTypeName;
        this.contentPropertyName = contentPropertyName;
        this.markupExtension = markupExtension;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof XamlTypeDescriptor)) return false;
        XamlTypeDescriptor that = (XamlTypeDescriptor) o;
        return fullName.equals(that.fullName) && Objects.equals(namespaceUri, that.namespaceUri);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fullName, namespaceUri);
    }

    @Override
    public String toString() {
        return fullName;
    }
}
