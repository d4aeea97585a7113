package info.isaksson.erland.xamlmigrate.mapping;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link MappingRepository} over an immutable {@link MappingDatabase}.
 *
 * <p>Indexes are built once in the constructor and never modified, which makes concurrent reads safe
 * without locking. When several records share a key, the first one in the database wins.</p>
 */
public final class DefaultMappingRepository implements MappingRepository {

    private final MappingDatabase database;

    private final Map<String, NamespaceMapping> namespaces = new HashMap<>();
    private final Map<String, TypeMapping> typesByFullName = new HashMap<>();
    private final Map<String, TypeMapping> typesBySimpleName = new HashMap<>();
    private final Map<String, PropertyMapping> generalProperties = new HashMap<>();
    private final Map<String, PropertyMapping> ownedProperties = new HashMap<>();
    private final Map<String, EventMapping> generalEvents = new HashMap<>();
    private final Map<String, EventMapping> ownedEvents = new HashMap<>();

    public DefaultMappingRepository(MappingDatabase database) {
        this.database = Objects.requireNonNull(database, "database must not be null");
        for (NamespaceMapping m : database.namespaceMappings) {
            namespaces.putIfAbsent(m.sourceNamespace, m);
        }
        for (TypeMapping m : database.typeMappings) {
            typesByFullName.putIfAbsent(m.sourceTypeName, m);
            typesBySimpleName.putIfAbsent(m.sourceSimpleName(), m);
        }
        for (PropertyMapping m : database.propertyMappings) {
            if (m.ownerTypeName == null) {
                generalProperties.putIfAbsent(m.sourcePropertyName, m);
            } else {
                ownedProperties.putIfAbsent(ownedKey(m.sourcePropertyName, m.ownerTypeName), m);
            }
        }
        for (EventMapping m : database.eventMappings) {
            if (m.ownerTypeName == null) {
                generalEvents.putIfAbsent(m.sourceEventName, m);
            } else {
                ownedEvents.putIfAbsent(ownedKey(m.sourceEventName, m.ownerTypeName), m);
            }
        }
    }

    public static DefaultMappingRepository empty() {
        return new DefaultMappingRepository(MappingDatabase.empty());
    }

    public MappingDatabase getDatabase() {
        return database;
    }

    @Override
    public NamespaceMapping findNamespaceMapping(String sourceNamespace) {
        if (sourceNamespace == null) return null;
        return namespaces.get(sourceNamespace);
    }

    @Override
    public TypeMapping findTypeMapping(String sourceTypeName) {
        if (sourceTypeName == null) return null;
        TypeMapping m = typesByFullName.get(sourceTypeName);
        if (m != null) return m;
        return typesBySimpleName.get(TypeMapping.simpleName(sourceTypeName));
    }

    @Override
    public PropertyMapping findPropertyMapping(String sourcePropertyName, String ownerTypeName) {
        if (sourcePropertyName == null) return null;
        if (ownerTypeName != null && !ownerTypeName.isEmpty()) {
            PropertyMapping owned = ownedProperties.get(ownedKey(sourcePropertyName, ownerTypeName));
            if (owned != null) return owned;
        }
        return generalProperties.get(sourcePropertyName);
    }

    @Override
    public EventMapping findEventMapping(String sourceEventName, String ownerTypeName) {
        if (sourceEventName == null) return null;
        if (ownerTypeName != null && !ownerTypeName.isEmpty()) {
            EventMapping owned = ownedEvents.get(ownedKey(sourceEventName, ownerTypeName));
            if (owned != null) return owned;
        }
        return generalEvents.get(sourceEventName);
    }

    @Override
    public List<NamespaceMapping> listNamespaceMappings() {
        return Collections.unmodifiableList(database.namespaceMappings);
    }

    @Override
    public List<TypeMapping> listTypeMappings() {
        return Collections.unmodifiableList(database.typeMappings);
    }

    @Override
    public List<PropertyMapping> listPropertyMappings() {
        return Collections.unmodifiableList(database.propertyMappings);
    }

    @Override
    public List<EventMapping> listEventMappings() {
        return Collections.unmodifiableList(database.eventMappings);
    }

    private static String ownedKey(String member, String owner) {
        return TypeMapping.simpleName(owner) + "|" + member;
    }
}
