package info.isaksson.erland.xamlmigrate.mapping;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"sourceEventName", "targetEventName", "ownerTypeName", "routed", "routingStrategy", "notes", "requiresManualReview"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EventMapping {
    public final String sourceEventName;
    public final String targetEventName;
    public final String ownerTypeName;
    public final boolean routed;
    public final String routingStrategy;
    public final String notes;
    public final boolean requiresManualReview;

    @JsonCreator
    public EventMapping(
            @JsonProperty("sourceEventName") String sourceEventName,
            @JsonProperty("targetEventName") String targetEventName,
            @JsonProperty("ownerTypeName") String ownerTypeName,
            @JsonProperty("routed") boolean routed,
            @JsonProperty("routingStrategy") String routingStrategy,
            @JsonProperty("notes") String notes,
            @JsonProperty("requiresManualReview") boolean requiresManualReview
    ) {
        this.sourceEventName = Objects.requireNonNull(sourceEventName, "sourceEventName must not be null");
        this.targetEventName = Objects.requireNonNull(targetEventName, "targetEventName must not be null");
        this.ownerTypeName = ownerTypeName;
        this.routed = routed;
        this.routingStrategy = routingStrategy;
        this.notes = notes;
        this.requiresManualReview = requiresManualReview;
    }

    public EventMapping(String sourceEventName, String targetEventName, String ownerTypeName) {
        this(sourceEventName, targetEventName, ownerTypeName, false, null, null, false);
    }
}
