package info.isaksson.erland.xamlmigrate.transform.rules;

import info.isaksson.erland.xamlmigrate.ast.PropertyValueKind;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlNamespaces;
import info.isaksson.erland.xamlmigrate.ast.XamlNodeKind;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.mapping.PropertyMapping;
import info.isaksson.erland.xamlmigrate.transform.PropertyRule;
import info.isaksson.erland.xamlmigrate.transform.TransformationContext;
import info.isaksson.erland.xamlmigrate.transform.ValueConverter;
import info.isaksson.erland.xamlmigrate.transform.ValueConverters;

/**
 * Fallback property rule driven by the mapping repository: renames, converts literal values by the mapping's
 * conversion tag and flags type changes it cannot convert.
 *
 * <p>Most properties have no mapping because they exist unchanged in the target framework. Missing mappings
 * are therefore only reported for properties the semantic pass could not resolve on a resolved element.</p>
 */
public final class MappedPropertyRule implements PropertyRule {

    @Override
    public String name() {
        return "MappedProperty";
    }

    @Override
    public boolean canApply(XamlProperty property) {
        if (property.getName() == null || TransformationContext.isRewritten(property)) return false;
        if (property.getNamespaceUri() != null && XamlNamespaces.isLanguageNamespace(property.getNamespaceUri())) {
            return false;
        }
        return property.getResolvedProperty() == null || !property.getResolvedProperty().event;
    }

    @Override
    public XamlProperty apply(XamlProperty property, TransformationContext context) {
        XamlElement owner = property.getOwnerElement();
        String ownerType = property.isAttached()
                ? property.getAttachedOwnerType()
                : owner == null ? null : TransformationContext.sourceTypeNameOf(owner);

        PropertyMapping mapping = context.getRepository().findPropertyMapping(property.getName(), ownerType);
        if (mapping == null) {
            if (property.getResolvedProperty() == null && owner != null && owner.getResolvedType() != null) {
                context.info(DiagnosticCodes.PROPERTY_MAPPING_NOT_FOUND,
                        "No property mapping for unresolved '" + property.qualifiedPropertyName() + "'", property);
            }
            return property;
        }

        String before = property.writtenName();
        StringBuilder description = new StringBuilder();
        if (!mapping.targetPropertyName.equals(property.getName())
                && !mapping.targetPropertyName.equals(property.qualifiedPropertyName())) {
            TransformationContext.rememberSource(property);
            RuleSupport.renameProperty(property, mapping.targetPropertyName);
            description.append(before).append(" -> ").append(property.writtenName());
        }

        if (mapping.valueConversionRule != null) {
            convert(property, mapping, context, description);
        } else if (mapping.typeChanged) {
            context.warning(DiagnosticCodes.PROPERTY_TYPE_CHANGED,
                    "Property '" + before + "' changes type from " + mapping.sourcePropertyType + " to "
                            + mapping.targetPropertyType + "; check the value", property);
        }

        if (mapping.requiresManualReview) {
            context.warning(DiagnosticCodes.PROPERTY_REQUIRES_MANUAL_REVIEW,
                    "Property '" + before + "' mapped to '" + mapping.targetPropertyName + "' needs review"
                            + RuleSupport.notesSuffix(mapping.notes), property);
        }
        if (description.length() > 0) {
            context.recordTransformation(name(), XamlNodeKind.PROPERTY, description.toString());
        }
        return property;
    }

    private static void convert(XamlProperty property, PropertyMapping mapping, TransformationContext context,
                                StringBuilder description) {
        ValueConverter converter = ValueConverters.forTag(mapping.valueConversionRule);
        if (converter == null) {
            context.warning(DiagnosticCodes.VALUE_CONVERSION_FAILED,
                    "Unknown value conversion '" + mapping.valueConversionRule + "' for property '"
                            + mapping.sourcePropertyName + "'", property);
            return;
        }
        if (property.valueKind() != PropertyValueKind.LITERAL) {
            context.warning(DiagnosticCodes.PROPERTY_TYPE_CHANGED,
                    "Value of '" + property.qualifiedPropertyName() + "' is not a literal; apply "
                            + mapping.valueConversionRule + " in a value converter", property);
            return;
        }
        String original = property.getLiteralValue();
        String converted = converter.convert(original);
        if (converted == null) {
            context.warning(DiagnosticCodes.VALUE_CONVERSION_FAILED,
                    "Cannot convert '" + original + "' with " + mapping.valueConversionRule + "; value kept", property);
            return;
        }
        if (!converted.equals(original)) {
            property.setLiteralValue(converted);
            if (description.length() > 0) description.append(' ');
            description.append("('").append(original).append("' -> '").append(converted).append("')");
        }
    }
}
