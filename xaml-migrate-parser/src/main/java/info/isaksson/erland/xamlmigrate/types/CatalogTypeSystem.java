package info.isaksson.erland.xamlmigrate.types;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.xamlmigrate.ast.XamlPropertyDescriptor;
import info.isaksson.erland.xamlmigrate.ast.XamlTypeDescriptor;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * {@link XamlTypeSystem} over a JSON {@link TypeCatalog}. Indexes are built once; instances are immutable.
 *
 * <p>Base types are looked up in the namespace of the derived type. Member lookup walks the base chain.</p>
 */
public final class CatalogTypeSystem implements XamlTypeSystem {

    /** Classpath location of the bundled presentation-framework catalog. */
    public static final String DEFAULT_RESOURCE = "info/isaksson/erland/xamlmigrate/types/wpf-type-catalog.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static volatile CatalogTypeSystem defaults;

    private final Set<String> namespaces = new HashSet<>();
    private final Map<String, TypeCatalog.CatalogType> types = new HashMap<>();
    private final Map<String, XamlTypeDescriptor> descriptors = new HashMap<>();

    public CatalogTypeSystem(TypeCatalog catalog) {
        if (catalog == null) throw new IllegalArgumentException("catalog must not be null");
        for (TypeCatalog.CatalogNamespace ns : catalog.namespaces) {
            namespaces.add(ns.uri);
            for (TypeCatalog.CatalogType t : ns.types) {
                String key = key(ns.uri, t.name);
                types.putIfAbsent(key, t);
                descriptors.putIfAbsent(key, new XamlTypeDescriptor(t.name, ns.uri, t.fullName, t.baseType,
                        t.contentProperty, t.markupExtension));
            }
        }
    }

    /** Shared instance over the bundled catalog. */
    public static CatalogTypeSystem defaults() {
        CatalogTypeSystem d = defaults;
        if (d == null) {
            synchronized (CatalogTypeSystem.class) {
                d = defaults;
                if (d == null) {
                    try {
                        d = new CatalogTypeSystem(readResource(DEFAULT_RESOURCE));
                    } catch (IOException e) {
                        throw new UncheckedIOException("bundled type catalog could not be read", e);
                    }
                    defaults = d;
                }
            }
        }
        return d;
    }

    public static TypeCatalog read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, TypeCatalog.class);
        }
    }

    public static TypeCatalog readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, TypeCatalog.class);
    }

    public static TypeCatalog readResource(String resource) throws IOException {
        try (InputStream in = CatalogTypeSystem.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) throw new FileNotFoundException("classpath resource not found: " + resource);
            return MAPPER.readValue(in, TypeCatalog.class);
        }
    }

    @Override
    public boolean coversNamespace(String namespaceUri) {
        return namespaceUri != null && namespaces.contains(namespaceUri);
    }

    @Override
    public XamlTypeDescriptor resolveType(String namespaceUri, String typeName) {
        if (namespaceUri == null || typeName == null) return null;
        return descriptors.get(key(namespaceUri, typeName));
    }

    @Override
    public XamlPropertyDescriptor resolveMember(XamlTypeDescriptor owner, String memberName) {
        if (owner == null || memberName == null) return null;
        String ns = owner.namespaceUri;
        String typeName = owner.name;
        Set<String> seen = new HashSet<>();
        while (typeName != null && seen.add(typeName)) {
            TypeCatalog.CatalogType t = types.get(key(ns, typeName));
            if (t == null) return null;
            for (TypeCatalog.CatalogMember m : t.properties) {
                if (m.name.equals(memberName)) {
                    return new XamlPropertyDescriptor(m.name, t.fullName, m.type, m.attached, false);
                }
            }
            if (t.events.contains(memberName)) {
                return new XamlPropertyDescriptor(memberName, t.fullName, null, false, true);
            }
            typeName = t.baseType;
        }
        return null;
    }

    public int typeCount() {
        return types.size();
    }

    private static String key(String ns, String name) {
        return ns + "|" + name;
    }
}
