package info.isaksson.erland.xamlmigrate.ast;

import info.isaksson.erland.xamlmigrate.diagnostics.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One markup element.
 *
 * <p>Properties and children keep insertion order, which is the order they are written back. Directive
 * attributes (see {@link XamlDirective}) live in dedicated fields, never in the property list.
 * Namespace declarations are kept apart from properties as well.</p>
 */
public final class XamlElement extends XamlNode {

    private String typeName;
    private String namespaceUri;
    private String prefix;
    private String overrideNamespace;
    private boolean synthetic;

    private final List<XamlProperty> properties = new ArrayList<>();
    private final List<XamlElement> children = new ArrayList<>();
    private final List<XamlComment> comments = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private final EnumMap<XamlDirective, String> directives = new EnumMap<>(XamlDirective.class);
    private final Map<String, String> namespaceDeclarations = new LinkedHashMap<>();
    private final List<String> headerOrder = new ArrayList<>();
    private final Map<String, FormattingHints> headerHints = new LinkedHashMap<>();

    private String textContent;
    private XamlTypeDescriptor resolvedType;

    public XamlElement(String typeName) {
        this.typeName = Objects.requireNonNull(typeName, "typeName must not be null");
    }

    public XamlElement(String typeName, String namespaceUri) {
        this(typeName);
        this.namespaceUri = namespaceUri;
    }

    /** Container created for a property element holding more than one child element. */
    public static XamlElement syntheticCollection(String typeName) {
        XamlElement e = new XamlElement(typeName);
        e.synthetic = true;
        return e;
    }

    @Override
    public XamlNodeKind kind() {
        return XamlNodeKind.ELEMENT;
    }

    public String getTypeName() {
        return typeName;
    }

    public void setTypeName(String typeName) {
        this.typeName = Objects.requireNonNull(typeName, "typeName must not be null");
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

    /** Namespace the writer uses instead of {@link #getNamespaceUri()} when set by a rule. */
    public String getOverrideNamespace() {
        return overrideNamespace;
    }

    public void setOverrideNamespace(String overrideNamespace) {
        this.overrideNamespace = overrideNamespace;
    }

    public boolean isSynthetic() {
        return synthetic;
    }

    public String qualifiedName() {
        return prefix == null ? typeName : prefix + ":" + typeName;
    }

    /** Resolved full type name when known, otherwise the written type name. */
    public String fullTypeName() {
        return resolvedType != null ? resolvedType.fullName : typeName;
    }

    public XamlTypeDescriptor getResolvedType() {
        return resolvedType;
    }

    public void setResolvedType(XamlTypeDescriptor resolvedType) {
        this.resolvedType = resolvedType;
    }

    public String getTextContent() {
        return textContent;
    }

    public void setTextContent(String textContent) {
        this.textContent = textContent;
    }

    // ---- directives ----

    public String getDirective(XamlDirective directive) {
        return directives.get(directive);
    }

    public void setDirective(XamlDirective directive, String value) {
        Objects.requireNonNull(directive, "directive must not be null");
        if (value == null) {
            directives.remove(directive);
        } else {
            directives.put(directive, value);
        }
    }

    public Map<XamlDirective, String> getDirectives() {
        return Collections.unmodifiableMap(directives);
    }

    public String getXName() {
        return directives.get(XamlDirective.NAME);
    }

    public void setXName(String name) {
        setDirective(XamlDirective.NAME, name);
    }

    public String getXKey() {
        return directives.get(XamlDirective.KEY);
    }

    public String getXClass() {
        return directives.get(XamlDirective.CLASS);
    }

    // ---- namespace declarations and header layout ----

    /** Declared prefixes in source order; the default namespace uses the empty prefix. */
    public Map<String, String> getNamespaceDeclarations() {
        return Collections.unmodifiableMap(namespaceDeclarations);
    }

    public void declareNamespace(String prefix, String uri) {
        namespaceDeclarations.put(prefix == null ? "" : prefix, Objects.requireNonNull(uri, "uri must not be null"));
    }

    public void removeNamespaceDeclaration(String prefix) {
        namespaceDeclarations.remove(prefix == null ? "" : prefix);
    }

    /**
     * Record a namespace declaration or directive attribute as it was written, so the writer can keep
     * the source order of these header attributes.
     */
    public void recordHeaderAttribute(String writtenName, FormattingHints hints) {
        if (!headerOrder.contains(writtenName)) {
            headerOrder.add(writtenName);
        }
        if (hints != null) {
            headerHints.put(writtenName, hints);
        }
    }

    public List<String> getHeaderOrder() {
        return Collections.unmodifiableList(headerOrder);
    }

    public FormattingHints getHeaderHints(String writtenName) {
        return headerHints.get(writtenName);
    }

    // ---- properties ----

    public List<XamlProperty> getProperties() {
        return Collections.unmodifiableList(properties);
    }

    public void addProperty(XamlProperty property) {
        properties.add(requireDetached(property));
        property.attachTo(this);
    }

    public void insertProperty(int index, XamlProperty property) {
        properties.add(index, requireDetached(property));
        property.attachTo(this);
    }

    public boolean removeProperty(XamlProperty property) {
        boolean removed = properties.remove(property);
        if (removed) property.detach();
        return removed;
    }

    public void replaceProperty(XamlProperty existing, XamlProperty replacement) {
        int idx = properties.indexOf(existing);
        if (idx < 0) throw new IllegalArgumentException("property is not owned by this element: " + existing);
        if (existing == replacement) return;
        requireDetached(replacement);
        existing.detach();
        properties.set(idx, replacement);
        replacement.attachTo(this);
    }

    /** First non-attached property with the given name, or null. */
    public XamlProperty findProperty(String name) {
        for (XamlProperty p : properties) {
            if (!p.isAttached() && p.getName().equals(name)) return p;
        }
        return null;
    }

    public XamlProperty findAttachedProperty(String ownerTypeName, String name) {
        for (XamlProperty p : properties) {
            if (p.isAttached() && p.getName().equals(name) && Objects.equals(p.getAttachedOwnerType(), ownerTypeName)) {
                return p;
            }
        }
        return null;
    }

    public List<XamlProperty> propertyElements() {
        List<XamlProperty> out = new ArrayList<>();
        for (XamlProperty p : properties) {
            if (p.isPropertyElement()) out.add(p);
        }
        return out;
    }

    public List<XamlProperty> attributeProperties() {
        List<XamlProperty> out = new ArrayList<>();
        for (XamlProperty p : properties) {
            if (!p.isPropertyElement()) out.add(p);
        }
        return out;
    }

    // ---- children ----

    public List<XamlElement> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(XamlElement child) {
        children.add(requireDetached(child));
        child.attachTo(this);
    }

    public void insertChild(int index, XamlElement child) {
        children.add(index, requireDetached(child));
        child.attachTo(this);
    }

    public boolean removeChild(XamlElement child) {
        boolean removed = children.remove(child);
        if (removed) child.detach();
        return removed;
    }

    public void replaceChild(XamlElement existing, XamlElement replacement) {
        int idx = children.indexOf(existing);
        if (idx < 0) throw new IllegalArgumentException("child is not owned by this element: " + existing);
        if (existing == replacement) return;
        requireDetached(replacement);
        existing.detach();
        children.set(idx, replacement);
        replacement.attachTo(this);
    }

    /** Index among the parent element's children, or -1 for a root or property value element. */
    public int siblingIndex() {
        XamlNode p = getParent();
        if (p instanceof XamlElement) {
            List<XamlElement> siblings = ((XamlElement) p).children;
            for (int i = 0; i < siblings.size(); i++) {
                if (siblings.get(i) == this) return i;
            }
        }
        return -1;
    }

    /** Number of content slots (property elements plus children) that comments anchor against. */
    public int contentSlotCount() {
        return propertyElements().size() + children.size();
    }

    // ---- comments and diagnostics ----

    public List<XamlComment> getComments() {
        return Collections.unmodifiableList(comments);
    }

    public void addComment(XamlComment comment) {
        comments.add(requireDetached(comment));
        comment.attachTo(this);
    }

    public boolean removeComment(XamlComment comment) {
        boolean removed = comments.remove(comment);
        if (removed) comment.detach();
        return removed;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(Objects.requireNonNull(diagnostic, "diagnostic must not be null"));
    }

    @Override
    public String toString() {
        return "XamlElement{" + qualifiedName() + (getXName() == null ? "" : " #" + getXName()) + "}";
    }
}
