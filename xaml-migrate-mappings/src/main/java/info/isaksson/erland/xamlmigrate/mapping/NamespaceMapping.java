package info.isaksson.erland.xamlmigrate.mapping;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Source XML namespace to target XML namespace. */
@JsonPropertyOrder({"sourceNamespace", "targetNamespace", "notes", "requiresManualReview"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NamespaceMapping {
    public final String sourceNamespace;
    public final String targetNamespace;
    public final String notes;
    public final boolean requiresManualReview;

    @JsonCreator
    public NamespaceMapping(
            @JsonProperty("sourceNamespace") String sourceNamespace,
            @JsonProperty("targetNamespace") String targetNamespace,
            @JsonProperty("notes") String notes,
            @JsonProperty("requiresManualReview") boolean requiresManualReview
    ) {
        this.sourceNamespace = Objects.requireNonNull(sourceNamespace, "sourceNamespace must not be null");
        this.targetNamespace = Objects.requireNonNull(targetNamespace, "targetNamespace must not be null");
        this.notes = notes;
        this.requiresManualReview = requiresManualReview;
    }

    public NamespaceMapping(String sourceNamespace, String targetNamespace) {
        this(sourceNamespace, targetNamespace, null, false);
    }
}
