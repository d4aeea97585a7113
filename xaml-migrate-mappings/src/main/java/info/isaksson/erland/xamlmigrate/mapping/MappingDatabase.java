package info.isaksson.erland.xamlmigrate.mapping;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/** Serializable container of all mapping records; the JSON document root. */
@JsonPropertyOrder({"version", "namespaceMappings", "typeMappings", "propertyMappings", "eventMappings"})
public final class MappingDatabase {
    public final String version;
    public final List<NamespaceMapping> namespaceMappings;
    public final List<TypeMapping> typeMappings;
    public final List<PropertyMapping> propertyMappings;
    public final List<EventMapping> eventMappings;

    @JsonCreator
    public MappingDatabase(
            @JsonProperty("version") String version,
            @JsonProperty("namespaceMappings") List<NamespaceMapping> namespaceMappings,
            @JsonProperty("typeMappings") List<TypeMapping> typeMappings,
            @JsonProperty("propertyMappings") List<PropertyMapping> propertyMappings,
            @JsonProperty("eventMappings") List<EventMapping> eventMappings
    ) {
        this.version = version == null ? "1.0.0" : version;
        this.namespaceMappings = namespaceMappings == null ? List.of() : List.copyOf(namespaceMappings);
        this.typeMappings = typeMappings == null ? List.of() : List.copyOf(typeMappings);
        this.propertyMappings = propertyMappings == null ? List.of() : List.copyOf(propertyMappings);
        this.eventMappings = eventMappings == null ? List.of() : List.copyOf(eventMappings);
    }

    public static MappingDatabase empty() {
        return new MappingDatabase(null, null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Mutable staging area for building a database in code. */
    public static final class Builder {
        private String version;
        private final List<NamespaceMapping> namespaces = new ArrayList<>();
        private final List<TypeMapping> types = new ArrayList<>();
        private final List<PropertyMapping> properties = new ArrayList<>();
        private final List<EventMapping> events = new ArrayList<>();

        private Builder() {}

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder namespace(NamespaceMapping mapping) {
            namespaces.add(mapping);
            return this;
        }

        public Builder namespace(String source, String target) {
            return namespace(new NamespaceMapping(source, target));
        }

        public Builder type(TypeMapping mapping) {
            types.add(mapping);
            return this;
        }

        public Builder type(String source, String target) {
            return type(new TypeMapping(source, target));
        }

        public Builder property(PropertyMapping mapping) {
            properties.add(mapping);
            return this;
        }

        public Builder event(EventMapping mapping) {
            events.add(mapping);
            return this;
        }

        public Builder addAll(MappingDatabase other) {
            namespaces.addAll(other.namespaceMappings);
            types.addAll(other.typeMappings);
            properties.addAll(other.propertyMappings);
            events.addAll(other.eventMappings);
            return this;
        }

        public MappingDatabase build() {
            return new MappingDatabase(version, namespaces, types, properties, events);
        }
    }
}
