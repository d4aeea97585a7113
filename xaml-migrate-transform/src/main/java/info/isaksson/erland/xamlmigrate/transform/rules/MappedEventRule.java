package info.isaksson.erland.xamlmigrate.transform.rules;

import info.isaksson.erland.xamlmigrate.ast.PropertyValueKind;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlNodeKind;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.mapping.EventMapping;
import info.isaksson.erland.xamlmigrate.transform.PropertyRule;
import info.isaksson.erland.xamlmigrate.transform.TransformationContext;

/** Renames event handler attributes ({@code Click="OnOk"}) through the event mappings. */
public final class MappedEventRule implements PropertyRule {

    @Override
    public String name() {
        return "MappedEvent";
    }

    @Override
    public int priority() {
        return 20;
    }

    @Override
    public boolean canApply(XamlProperty property) {
        return !property.isPropertyElement()
                && property.valueKind() == PropertyValueKind.LITERAL
                && property.getResolvedProperty() != null
                && property.getResolvedProperty().event;
    }

    @Override
    public XamlProperty apply(XamlProperty property, TransformationContext context) {
        XamlElement owner = property.getOwnerElement();
        String ownerType = property.isAttached()
                ? property.getAttachedOwnerType()
                : owner == null ? null : TransformationContext.sourceTypeNameOf(owner);
        EventMapping mapping = context.getRepository().findEventMapping(property.getName(), ownerType);
        if (mapping == null) {
            context.info(DiagnosticCodes.EVENT_MAPPING_NOT_FOUND,
                    "No event mapping for '" + property.qualifiedPropertyName() + "'; handler '"
                            + property.getLiteralValue() + "' kept", property);
            return property;
        }
        String before = property.writtenName();
        if (!mapping.targetEventName.equals(property.getName())) {
            RuleSupport.renameProperty(property, mapping.targetEventName);
            context.recordTransformation(name(), XamlNodeKind.PROPERTY, before + " -> " + property.writtenName());
        }
        if (mapping.requiresManualReview) {
            context.warning(DiagnosticCodes.EVENT_REQUIRES_MANUAL_REVIEW,
                    "Event '" + before + "' mapped to '" + mapping.targetEventName
                            + "'; handler signature needs review" + RuleSupport.notesSuffix(mapping.notes), property);
        }
        return property;
    }
}
