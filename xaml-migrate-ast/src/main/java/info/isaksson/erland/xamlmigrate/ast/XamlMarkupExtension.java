package info.isaksson.erland.xamlmigrate.ast;

import info.isaksson.erland.xamlmigrate.ast.markup.MarkupExtensionPrinter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed {@code {Name ...}} value.
 *
 * <p>Holds an optional positional argument, named parameters in source order and at most one typed
 * payload selected by the extension name. Nested extensions inside parameters are owned by this node.</p>
 */
public final class XamlMarkupExtension extends XamlNode {

    private String name;
    private MarkupParameter positionalArgument;
    private final LinkedHashMap<String, MarkupParameter> namedParameters = new LinkedHashMap<>();
    private MarkupExtensionPayload payload;
    private XamlTypeDescriptor resolvedType;

    public XamlMarkupExtension(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public XamlNodeKind kind() {
        return XamlNodeKind.MARKUP_EXTENSION;
    }

    /** Name as written, including any prefix ({@code x:Static}). */
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        refreshPayload();
    }

    public String localName() {
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    public MarkupExtensionKind extensionKind() {
        return MarkupExtensionKind.fromName(name);
    }

    public MarkupParameter getPositionalArgument() {
        return positionalArgument;
    }

    public void setPositionalArgument(MarkupParameter argument) {
        release(positionalArgument);
        this.positionalArgument = adopt(argument);
        refreshPayload();
    }

    public Map<String, MarkupParameter> getNamedParameters() {
        return Collections.unmodifiableMap(namedParameters);
    }

    public MarkupParameter getNamedParameter(String key) {
        return namedParameters.get(key);
    }

    /** Set or replace a named parameter, keeping its original position when it already exists. */
    public void setNamedParameter(String key, MarkupParameter value) {
        Objects.requireNonNull(key, "key must not be null");
        if (value == null) {
            removeNamedParameter(key);
            return;
        }
        release(namedParameters.get(key));
        namedParameters.put(key, adopt(value));
        refreshPayload();
    }

    public void removeNamedParameter(String key) {
        MarkupParameter removed = namedParameters.remove(key);
        release(removed);
        refreshPayload();
    }

    /** Rename a parameter key in place, keeping its position. */
    public void renameNamedParameter(String oldKey, String newKey) {
        if (!namedParameters.containsKey(oldKey) || oldKey.equals(newKey)) return;
        List<Map.Entry<String, MarkupParameter>> entries = new ArrayList<>(namedParameters.entrySet());
        namedParameters.clear();
        for (Map.Entry<String, MarkupParameter> e : entries) {
            namedParameters.put(e.getKey().equals(oldKey) ? newKey : e.getKey(), e.getValue());
        }
        refreshPayload();
    }

    /** Nested extensions in parameter order: positional first, then named. */
    public List<XamlMarkupExtension> nestedExtensions() {
        List<XamlMarkupExtension> out = new ArrayList<>();
        if (positionalArgument != null && positionalArgument.isExtension()) {
            out.add(positionalArgument.getExtension());
        }
        for (MarkupParameter p : namedParameters.values()) {
            if (p.isExtension()) out.add(p.getExtension());
        }
        return out;
    }

    public MarkupExtensionPayload getPayload() {
        return payload;
    }

    /** Re-derive the typed payload from name and parameters. Called by every mutator. */
    public void refreshPayload() {
        this.payload = MarkupExtensionPayload.derive(this);
    }

    public XamlTypeDescriptor getResolvedType() {
        return resolvedType;
    }

    public void setResolvedType(XamlTypeDescriptor resolvedType) {
        this.resolvedType = resolvedType;
    }

    /** Property this extension is the value of, looking through enclosing extensions. */
    public XamlProperty owningProperty() {
        XamlNode p = getParent();
        while (p instanceof XamlMarkupExtension) {
            p = p.getParent();
        }
        return p instanceof XamlProperty ? (XamlProperty) p : null;
    }

    public String toMarkupString() {
        return MarkupExtensionPrinter.print(this);
    }

    private MarkupParameter adopt(MarkupParameter value) {
        if (value != null && value.isExtension()) {
            requireDetached(value.getExtension()).attachTo(this);
        }
        return value;
    }

    private static void release(MarkupParameter value) {
        if (value != null && value.isExtension()) {
            value.getExtension().detach();
        }
    }

    @Override
    public String toString() {
        return toMarkupString();
    }
}
