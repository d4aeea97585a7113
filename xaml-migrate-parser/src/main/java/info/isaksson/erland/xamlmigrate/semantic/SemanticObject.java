package info.isaksson.erland.xamlmigrate.semantic;

import info.isaksson.erland.xamlmigrate.ast.XamlDirective;
import info.isaksson.erland.xamlmigrate.ast.XamlTypeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An object node of the semantic view: an element or a markup extension with its resolved type.
 *
 * <p>Markup extensions are recognized by name: their type name always carries the
 * {@link #EXTENSION_SUFFIX} suffix, and {@link #getWrittenName()} keeps the name as it appeared in
 * the braces.</p>
 */
public final class SemanticObject {

    public static final String EXTENSION_SUFFIX = "Extension";

    private final String typeName;
    private final String namespaceUri;
    private final String prefix;
    private final String writtenName;
    private XamlTypeDescriptor resolvedType;
    private String text;

    private final List<SemanticMember> members = new ArrayList<>();
    private final List<SemanticObject> children = new ArrayList<>();
    private final EnumMap<XamlDirective, String> directives = new EnumMap<>(XamlDirective.class);
    private final Map<String, String> namespaceDeclarations = new LinkedHashMap<>();

    public SemanticObject(String typeName, String namespaceUri, String prefix, String writtenName) {
        this.typeName = Objects.requireNonNull(typeName, "typeName must not be null");
        this.namespaceUri = namespaceUri;
        this.prefix = prefix == null || prefix.isEmpty() ? null : prefix;
        this.writtenName = writtenName == null ? typeName : writtenName;
    }

    /** Object for a markup extension written as {@code {writtenName ...}}. */
    public static SemanticObject markupExtension(String writtenName, String namespaceUri) {
        int colon = writtenName.indexOf(':');
        String prefix = colon >= 0 ? writtenName.substring(0, colon) : null;
        String local = colon >= 0 ? writtenName.substring(colon + 1) : writtenName;
        String typeName = local.endsWith(EXTENSION_SUFFIX) ? local : local + EXTENSION_SUFFIX;
        return new SemanticObject(typeName, namespaceUri, prefix, writtenName);
    }

    public String getTypeName() {
        return typeName;
    }

    public String getNamespaceUri() {
        return namespaceUri;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getWrittenName() {
        return writtenName;
    }

    public boolean isMarkupExtension() {
        return typeName.endsWith(EXTENSION_SUFFIX) && typeName.length() > EXTENSION_SUFFIX.length();
    }

    public XamlTypeDescriptor getResolvedType() {
        return resolvedType;
    }

    public void setResolvedType(XamlTypeDescriptor resolvedType) {
        this.resolvedType = resolvedType;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public List<SemanticMember> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public void addMember(SemanticMember member) {
        members.add(Objects.requireNonNull(member, "member must not be null"));
    }

    public SemanticMember findMember(String name) {
        for (SemanticMember m : members) {
            if (m.getName().equals(name)) return m;
        }
        return null;
    }

    public List<SemanticObject> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(SemanticObject child) {
        children.add(Objects.requireNonNull(child, "child must not be null"));
    }

    public Map<XamlDirective, String> getDirectives() {
        return Collections.unmodifiableMap(directives);
    }

    public void setDirective(XamlDirective directive, String value) {
        directives.put(Objects.requireNonNull(directive, "directive must not be null"), value);
    }

    public Map<String, String> getNamespaceDeclarations() {
        return Collections.unmodifiableMap(namespaceDeclarations);
    }

    public void declareNamespace(String prefix, String uri) {
        namespaceDeclarations.put(prefix == null ? "" : prefix, uri);
    }

    @Override
    public String toString() {
        return "SemanticObject{" + writtenName + (resolvedType == null ? "" : " -> " + resolvedType.fullName) + "}";
    }
}
