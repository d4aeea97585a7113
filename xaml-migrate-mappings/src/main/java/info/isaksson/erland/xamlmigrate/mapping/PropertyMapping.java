package info.isaksson.erland.xamlmigrate.mapping;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"sourcePropertyName", "targetPropertyName", "ownerTypeName", "sourcePropertyType", "targetPropertyType",
        "typeChanged", "attached", "valueConversionRule", "notes", "requiresManualReview"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PropertyMapping {
    public final String sourcePropertyName;
    public final String targetPropertyName;

    /** Owner type this mapping is scoped to; null for a general mapping. */
    public final String ownerTypeName;

    public final String sourcePropertyType;
    public final String targetPropertyType;
    public final boolean typeChanged;
    public final boolean attached;

    /** Tag of the value conversion to apply, e.g. {@code VisibilityToBoolean}. */
    public final String valueConversionRule;

    public final String notes;
    public final boolean requiresManualReview;

    @JsonCreator
    public PropertyMapping(
            @JsonProperty("sourcePropertyName") String sourcePropertyName,
            @JsonProperty("targetPropertyName") String targetPropertyName,
            @JsonProperty("ownerTypeName") String ownerTypeName,
            @JsonProperty("sourcePropertyType") String sourcePropertyType,
            @JsonProperty("targetPropertyType") String targetPropertyType,
            @JsonProperty("typeChanged") boolean typeChanged,
            @JsonProperty("attached") boolean attached,
            @JsonProperty("valueConversionRule") String valueConversionRule,
            @JsonProperty("notes") String notes,
            @JsonProperty("requiresManualReview") boolean requiresManualReview
    ) {
        this.sourcePropertyName = Objects.requireNonNull(sourcePropertyName, "sourcePropertyName must not be null");
        this.targetPropertyName = Objects.requireNonNull(targetPropertyName, "targetPropertyName must not be null");
        this.ownerTypeName = ownerTypeName;
        this.sourcePropertyType = sourcePropertyType;
        this.targetPropertyType = targetPropertyType;
        this.typeChanged = typeChanged;
        this.attached = attached;
        this.valueConversionRule = valueConversionRule;
        this.notes = notes;
        this.requiresManualReview = requiresManualReview;
    }

    /** Plain rename, optionally scoped to an owner type. */
    public PropertyMapping(String sourcePropertyName, String targetPropertyName, String ownerTypeName) {
        this(sourcePropertyName, targetPropertyName, ownerTypeName, null, null, false, false, null, null, false);
    }
}
