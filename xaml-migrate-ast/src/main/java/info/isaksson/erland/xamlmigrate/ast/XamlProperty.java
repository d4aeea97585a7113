package info.isaksson.erland.xamlmigrate.ast;

import java.util.Objects;

/**
 * An attribute or property-element value of an element.
 *
 * <p>The value is a union: at most one of literal, element and markup extension is set at a time, and
 * each setter clears the other two. An attached property always carries its owner type.</p>
 */
public final class XamlProperty extends XamlNode {

    private String name;
    private String namespaceUri;
    private String prefix;
    private PropertyKind propertyKind;
    private String ownerTypeName;

    private String literalValue;
    private XamlElement elementValue;
    private XamlMarkupExtension markupExtension;

    private XamlPropertyDescriptor resolvedProperty;

    private XamlProperty(String name, PropertyKind propertyKind, String ownerTypeName) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.propertyKind = Objects.requireNonNull(propertyKind, "propertyKind must not be null");
        if (propertyKind == PropertyKind.ATTACHED_PROPERTY && ownerTypeName == null) {
            throw new IllegalArgumentException("attached property " + name + " requires an owner type");
        }
        this.ownerTypeName = ownerTypeName;
    }

    public static XamlProperty attribute(String name, String value) {
        XamlProperty p = new XamlProperty(name, PropertyKind.ATTRIBUTE, null);
        p.setLiteralValue(value);
        return p;
    }

    public static XamlProperty attached(String ownerTypeName, String name, String value) {
        XamlProperty p = new XamlProperty(name, PropertyKind.ATTACHED_PROPERTY, ownerTypeName);
        p.setLiteralValue(value);
        return p;
    }

    /**
     * Property written as a child element {@code <Owner.Name>}. {@code ownerTypeName} is the owner as
     * written, usually the enclosing element's type.
     */
    public static XamlProperty propertyElement(String ownerTypeName, String name) {
        return new XamlProperty(name, PropertyKind.PROPERTY_ELEMENT, ownerTypeName);
    }

    /**
     * Split {@code Owner.Name} on the first separator into an attached property, or return a plain
     * attribute when the name has no separator.
     */
    public static XamlProperty parseAttribute(String writtenName, String value) {
        int dot = writtenName.indexOf('.');
        if (dot > 0 && dot < writtenName.length() - 1) {
            return attached(writtenName.substring(0, dot), writtenName.substring(dot + 1), value);
        }
        return attribute(writtenName, value);
    }

    @Override
    public XamlNodeKind kind() {
        return XamlNodeKind.PROPERTY;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String getNamespaceUri() {
        return namespaceUri;
    }

    public void setNamespaceUri(String namespaceUri) {
        this.namespaceUri = namespaceUri;
    }

    public String getPrefix() {
        return prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix == null || prefix.isEmpty() ? null : prefix;
    }

    public PropertyKind getPropertyKind() {
        return propertyKind;
    }

    public boolean isAttached() {
        return propertyKind == PropertyKind.ATTACHED_PROPERTY;
    }

    public boolean isPropertyElement() {
        return propertyKind == PropertyKind.PROPERTY_ELEMENT;
    }

    /** Owner type of an attached property, or the written owner of a property element. */
    public String getAttachedOwnerType() {
        return ownerTypeName;
    }

    public void setAttachedOwnerType(String ownerTypeName) {
        if (propertyKind == PropertyKind.ATTACHED_PROPERTY && ownerTypeName == null) {
            throw new IllegalArgumentException("attached property " + name + " requires an owner type");
        }
        this.ownerTypeName = ownerTypeName;
    }

    /** Turn an attached property into a plain attribute or back. */
    public void setPropertyKind(PropertyKind propertyKind, String ownerTypeName) {
        Objects.requireNonNull(propertyKind, "propertyKind must not be null");
        if (propertyKind == PropertyKind.ATTACHED_PROPERTY && ownerTypeName == null) {
            throw new IllegalArgumentException("attached property " + name + " requires an owner type");
        }
        this.propertyKind = propertyKind;
        this.ownerTypeName = ownerTypeName;
    }

    public PropertyValueKind valueKind() {
        if (literalValue != null) return PropertyValueKind.LITERAL;
        if (elementValue != null) return PropertyValueKind.ELEMENT;
        if (markupExtension != null) return PropertyValueKind.MARKUP_EXTENSION;
        return PropertyValueKind.NONE;
    }

    public String getLiteralValue() {
        return literalValue;
    }

    public void setLiteralValue(String value) {
        clearValue();
        this.literalValue = value;
    }

    public XamlElement getElementValue() {
        return elementValue;
    }

    public void setElementValue(XamlElement element) {
        clearValue();
        if (element != null) {
            requireDetached(element).attachTo(this);
        }
        this.elementValue = element;
    }

    public XamlMarkupExtension getMarkupExtension() {
        return markupExtension;
    }

    public void setMarkupExtension(XamlMarkupExtension extension) {
        clearValue();
        if (extension != null) {
            requireDetached(extension).attachTo(this);
        }
        this.markupExtension = extension;
    }

    private void clearValue() {
        if (elementValue != null) elementValue.detach();
        if (markupExtension != null) markupExtension.detach();
        literalValue = null;
        elementValue = null;
        markupExtension = null;
    }

    public XamlPropertyDescriptor getResolvedProperty() {
        return resolvedProperty;
    }

    public void setResolvedProperty(XamlPropertyDescriptor resolvedProperty) {
        this.resolvedProperty = resolvedProperty;
    }

    /** Enclosing element of this property, or null when detached. */
    public XamlElement getOwnerElement() {
        return enclosingElement();
    }

    /**
     * Attribute or tag name as it appears in markup: optional prefix, optional {@code Owner.} and the
     * property name.
     */
    public String writtenName() {
        StringBuilder sb = new StringBuilder();
        if (prefix != null) sb.append(prefix).append(':');
        if (ownerTypeName != null && propertyKind != PropertyKind.ATTRIBUTE) {
            sb.append(ownerTypeName).append('.');
        }
        sb.append(name);
        return sb.toString();
    }

    /** {@code Owner.Name} using the attached owner, or the enclosing element's type for plain properties. */
    public String qualifiedPropertyName() {
        String owner = ownerTypeName;
        if (owner == null) {
            XamlElement e = getOwnerElement();
            owner = e == null ? null : e.getTypeName();
        }
        return owner == null ? name : owner + "." + name;
    }

    @Override
    public String toString() {
        return "XamlProperty{" + writtenName() + ", " + propertyKind + ", " + valueKind() + "}";
    }
}
