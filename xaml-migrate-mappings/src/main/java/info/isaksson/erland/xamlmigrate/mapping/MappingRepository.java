package info.isaksson.erland.xamlmigrate.mapping;

import java.util.List;

/**
 * Read-only lookup from source-framework identifiers to target-framework identifiers.
 *
 * <p>Implementations must be safe for concurrent reads: one repository is shared by all per-document
 * pipelines and nothing writes to it during transformation. Lookups return null when no mapping exists.</p>
 */
public interface MappingRepository {

    NamespaceMapping findNamespaceMapping(String sourceNamespace);

    /** Match on the fully qualified source name first, then on the simple name. */
    TypeMapping findTypeMapping(String sourceTypeName);

    /** Owner-specific mapping first, then the general mapping (one without owner). */
    PropertyMapping findPropertyMapping(String sourcePropertyName, String ownerTypeName);

    /** Owner-specific mapping first, then the general mapping (one without owner). */
    EventMapping findEventMapping(String sourceEventName, String ownerTypeName);

    List<NamespaceMapping> listNamespaceMappings();

    List<TypeMapping> listTypeMappings();

    List<PropertyMapping> listPropertyMappings();

    List<EventMapping> listEventMappings();

    default PropertyMapping findPropertyMapping(String sourcePropertyName) {
        return findPropertyMapping(sourcePropertyName, null);
    }

    default EventMapping findEventMapping(String sourceEventName) {
        return findEventMapping(sourceEventName, null);
    }
}
