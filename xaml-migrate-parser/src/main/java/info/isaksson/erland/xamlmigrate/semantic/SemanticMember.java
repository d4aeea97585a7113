package info.isaksson.erland.xamlmigrate.semantic;

import info.isaksson.erland.xamlmigrate.ast.XamlPropertyDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A member of a {@link SemanticObject}: an attribute, a property element, or a markup-extension argument.
 *
 * <p>The value is either text or one or more objects. Positional markup-extension arguments use the
 * reserved name {@link #POSITIONAL}.</p>
 */
public final class SemanticMember {

    /** Member name used for the positional argument of a markup extension. */
    public static final String POSITIONAL = "_PositionalParameters";

    private final String name;
    private final String ownerTypeName;
    private final boolean attached;
    private final boolean propertyElement;
    private String namespaceUri;
    private String prefix;
    private XamlPropertyDescriptor resolvedProperty;
    private String textValue;
    private final List<SemanticObject> objectValues = new ArrayList<>();

    public SemanticMember(String name, String ownerTypeName, boolean attached, boolean propertyElement) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (attached && ownerTypeName == null) {
            throw new IllegalArgumentException("attached member " + name + " requires an owner type");
        }
        this.ownerTypeName = ownerTypeName;
        this.attached = attached;
        this.propertyElement = propertyElement;
    }

    public static SemanticMember positional() {
        return new SemanticMember(POSITIONAL, null, false, false);
    }

    public String getName() {
        return name;
    }

    /** Owner as written for attached members and property elements, otherwise null. */
    public String getOwnerTypeName() {
        return ownerTypeName;
    }

    public boolean isAttached() {
        return attached;
    }

    public boolean isPropertyElement() {
        return propertyElement;
    }

    public boolean isPositional() {
        return POSITIONAL.equals(name);
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

    public XamlPropertyDescriptor getResolvedProperty() {
        return resolvedProperty;
    }

    public void setResolvedProperty(XamlPropertyDescriptor resolvedProperty) {
        this.resolvedProperty = resolvedProperty;
    }

    public String getTextValue() {
        return textValue;
    }

    public void setTextValue(String textValue) {
        this.textValue = textValue;
    }

    public List<SemanticObject> getObjectValues() {
        return Collections.unmodifiableList(objectValues);
    }

    public void addObjectValue(SemanticObject value) {
        objectValues.add(Objects.requireNonNull(value, "value must not be null"));
    }

    /** The only object value, or null when there are none or several. */
    public SemanticObject singleObject() {
        return objectValues.size() == 1 ? objectValues.get(0) : null;
    }

    @Override
    public String toString() {
        return "SemanticMember{" + (ownerTypeName == null ? "" : ownerTypeName + ".") + name + "}";
    }
}
