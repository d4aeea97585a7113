package info.isaksson.erland.xamlmigrate.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-document index of named elements, namespace prefixes and type usages.
 *
 * <p>The table is a snapshot derived from the tree. Rules mutate the tree, not the table; call
 * {@link XamlDocument#rebuildSymbolTable()} to re-derive it after transformation.</p>
 */
public final class SymbolTable {

    private final Map<String, XamlElement> namedElements = new LinkedHashMap<>();
    private final Map<String, String> namespacePrefixes = new LinkedHashMap<>();
    private final Map<String, List<XamlElement>> typeUsages = new LinkedHashMap<>();
    private final List<String> duplicateNames = new ArrayList<>();

    /**
     * Register a named element. The first registration of a name wins; later ones are remembered as
     * duplicates and returned false.
     */
    public boolean registerName(String name, XamlElement element) {
        if (name == null || name.isEmpty()) return false;
        if (namedElements.containsKey(name)) {
            duplicateNames.add(name);
            return false;
        }
        namedElements.put(name, element);
        return true;
    }

    public void registerPrefix(String prefix, String namespaceUri) {
        namespacePrefixes.putIfAbsent(prefix == null ? "" : prefix, namespaceUri);
    }

    public void registerTypeUsage(String typeName, XamlElement element) {
        typeUsages.computeIfAbsent(typeName, k -> new ArrayList<>()).add(element);
    }

    public XamlElement findNamed(String name) {
        return namedElements.get(name);
    }

    public String namespaceForPrefix(String prefix) {
        return namespacePrefixes.get(prefix == null ? "" : prefix);
    }

    /** First prefix declared for a namespace, or null. */
    public String prefixForNamespace(String namespaceUri) {
        for (Map.Entry<String, String> e : namespacePrefixes.entrySet()) {
            if (e.getValue().equals(namespaceUri)) return e.getKey();
        }
        return null;
    }

    public List<XamlElement> usagesOf(String typeName) {
        List<XamlElement> usages = typeUsages.get(typeName);
        return usages == null ? List.of() : Collections.unmodifiableList(usages);
    }

    public Map<String, XamlElement> getNamedElements() {
        return Collections.unmodifiableMap(namedElements);
    }

    public Map<String, String> getNamespacePrefixes() {
        return Collections.unmodifiableMap(namespacePrefixes);
    }

    public Map<String, List<XamlElement>> getTypeUsages() {
        return Collections.unmodifiableMap(typeUsages);
    }

    public List<String> getDuplicateNames() {
        return Collections.unmodifiableList(duplicateNames);
    }
}
