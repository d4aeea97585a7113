package info.isaksson.erland.xamlmigrate.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** JSON root of a type catalog: namespaces with their types, members and events. */
@JsonPropertyOrder({"version", "namespaces"})
public final class TypeCatalog {
    public final String version;
    public final List<CatalogNamespace> namespaces;

    @JsonCreator
    public TypeCatalog(
            @JsonProperty("version") String version,
            @JsonProperty("namespaces") List<CatalogNamespace> namespaces
    ) {
        this.version = version == null ? "1.0.0" : version;
        this.namespaces = namespaces == null ? List.of() : List.copyOf(namespaces);
    }

    @JsonPropertyOrder({"uri", "types"})
    public static final class CatalogNamespace {
        public final String uri;
        public final List<CatalogType> types;

        @JsonCreator
        public CatalogNamespace(
                @JsonProperty("uri") String uri,
                @JsonProperty("types") List<CatalogType> types
        ) {
            this.uri = Objects.requireNonNull(uri, "uri must not be null");
            this.types = types == null ? List.of() : List.copyOf(types);
        }
    }

    @JsonPropertyOrder({"name", "fullName", "baseType", "contentProperty", "markupExtension", "properties", "events"})
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class CatalogType {
        public final String name;
        public final String fullName;

        /** Simple name of the base type in the same namespace, or null. */
        public final String baseType;

        public final String contentProperty;
        public final boolean markupExtension;
        public final List<CatalogMember> properties;
        public final List<String> events;

        @JsonCreator
        public CatalogType(
                @JsonProperty("name") String name,
                @JsonProperty("fullName") String fullName,
                @JsonProperty("baseType") String baseType,
                @JsonProperty("contentProperty") String contentProperty,
                @JsonProperty("markupExtension") boolean markupExtension,
                @JsonProperty("properties") List<CatalogMember> properties,
                @JsonProperty("events") List<String> events
        ) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.fullName = fullName == null ? name : fullName;
            this.baseType = baseType;
            this.contentProperty = contentProperty;
            this.markupExtension = markupExtension;
            this.properties = properties == null ? List.of() : List.copyOf(properties);
            this.events = events == null ? List.of() : List.copyOf(events);
        }
    }

    @JsonPropertyOrder({"name", "type", "attached"})
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class CatalogMember {
        public final String name;
        public final String type;
        public final boolean attached;

        @JsonCreator
        public CatalogMember(
                @JsonProperty("name") String name,
                @JsonProperty("type") String type,
                @JsonProperty("attached") boolean attached
        ) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.type = type;
            this.attached = attached;
        }
    }
}
