package info.isaksson.erland.xamlmigrate.parse.xml;

import java.util.Objects;

/** One attribute or namespace declaration of an opening tag, with its decoded value. */
public final class XmlAttributeNode {

    private final String qualifiedName;
    private final String prefix;
    private final String localName;
    private final String namespaceUri;
    private final String value;
    private final boolean namespaceDeclaration;
    private final int sourceOffset;

    XmlAttributeNode(String prefix, String localName, String namespaceUri, String value,
                     boolean namespaceDeclaration, int sourceOffset) {
        this.prefix = prefix == null || prefix.isEmpty() ? null : prefix;
        this.localName = Objects.requireNonNull(localName, "localName must not be null");
        this.namespaceUri = namespaceUri == null || namespaceUri.isEmpty() ? null : namespaceUri;
        this.value = value == null ? "" : value;
        this.namespaceDeclaration = namespaceDeclaration;
        this.sourceOffset = sourceOffset;
        this.qualifiedName = this.prefix == null ? localName : this.prefix + ":" + localName;
    }

    static XmlAttributeNode namespaceDeclaration(String declaredPrefix, String uri, int sourceOffset) {
        if (declaredPrefix == null || declaredPrefix.isEmpty()) {
            return new XmlAttributeNode(null, "xmlns", null, uri, true, sourceOffset);
        }
        return new XmlAttributeNode("xmlns", declaredPrefix, null, uri, true, sourceOffset);
    }

    /** Name as written, e.g. {@code x:Name}, {@code Grid.Row} or {@code xmlns:x}. */
    public String getQualifiedName() {
        return qualifiedName;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getLocalName() {
        return localName;
    }

    public String getNamespaceUri() {
        return namespaceUri;
    }

    public String getValue() {
        return value;
    }

    public boolean isNamespaceDeclaration() {
        return namespaceDeclaration;
    }

    /** Prefix bound by a namespace declaration; empty for the default namespace. */
    public String declaredPrefix() {
        if (!namespaceDeclaration) return null;
        return prefix == null ? "" : localName;
    }

    /** Offset of the first character of the attribute name, or -1 when it could not be located. */
    public int getSourceOffset() {
        return sourceOffset;
    }

    @Override
    public String toString() {
        return qualifiedName + "=\"" + value + "\"";
    }
}
