package info.isaksson.erland.xamlmigrate.mapping;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Source type to target type. Type names are fully qualified ({@code System.Windows.Controls.Button}) or
 * simple ({@code Button}); lookups accept either form.
 */
@JsonPropertyOrder({"sourceTypeName", "targetTypeName", "sourceNamespace", "targetNamespace", "category", "notes", "requiresManualReview"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TypeMapping {
    public final String sourceTypeName;
    public final String targetTypeName;

    /** XML namespace the source type is declared in, or null for any. */
    public final String sourceNamespace;

    /** XML namespace of the target type, or null to keep the element's namespace. */
    public final String targetNamespace;

    public final String category;
    public final String notes;
    public final boolean requiresManualReview;

    @JsonCreator
    public TypeMapping(
            @JsonProperty("sourceTypeName") String sourceTypeName,
            @JsonProperty("targetTypeName") String targetTypeName,
            @JsonProperty("sourceNamespace") String sourceNamespace,
            @JsonProperty("targetNamespace") String targetNamespace,
            @JsonProperty("category") String category,
            @JsonProperty("notes") String notes,
            @JsonProperty("requiresManualReview") boolean requiresManualReview
    ) {
        this.sourceTypeName = Objects.requireNonNull(sourceTypeName, "sourceTypeName must not be null");
        this.targetTypeName = Objects.requireNonNull(targetTypeName, "targetTypeName must not be null");
        this.sourceNamespace = sourceNamespace;
        this.targetNamespace = targetNamespace;
        this.category = category;
        this.notes = notes;
        this.requiresManualReview = requiresManualReview;
    }

    public TypeMapping(String sourceTypeName, String targetTypeName) {
        this(sourceTypeName, targetTypeName, null, null, null, null, false);
    }

    @JsonIgnore
    public String sourceSimpleName() {
        return simpleName(sourceTypeName);
    }

    @JsonIgnore
    public String targetSimpleName() {
        return simpleName(targetTypeName);
    }

    @JsonIgnore
    public boolean isRename() {
        return !sourceSimpleName().equals(targetSimpleName());
    }

    static String simpleName(String typeName) {
        int dot = typeName.lastIndexOf('.');
        return dot >= 0 ? typeName.substring(dot + 1) : typeName;
    }
}
