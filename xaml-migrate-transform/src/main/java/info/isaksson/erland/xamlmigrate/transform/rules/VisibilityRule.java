package info.isaksson.erland.xamlmigrate.transform.rules;

import info.isaksson.erland.xamlmigrate.ast.PropertyValueKind;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.transform.TransformationContext;
import info.isaksson.erland.xamlmigrate.transform.ValueConverters;

/**
 * {@code Visibility="Collapsed"} becomes {@code IsVisible="False"}. Only literal values; bound visibility
 * is left to the mapping-driven property rule, which asks for a converter.
 */
public final class VisibilityRule extends PropertyRenameRule {

    public VisibilityRule() {
        super("Visibility", "IsVisible", null, 50);
    }

    @Override
    public String name() {
        return "VisibilityToIsVisible";
    }

    @Override
    public boolean canApply(XamlProperty property) {
        return super.canApply(property)
                && !property.isPropertyElement()
                && property.valueKind() == PropertyValueKind.LITERAL;
    }

    @Override
    protected String convertValue(String value, XamlProperty property, TransformationContext context) {
        String converted = ValueConverters.VISIBILITY_TO_BOOLEAN.convert(value);
        if (converted == null) {
            context.warning(DiagnosticCodes.VALUE_CONVERSION_FAILED,
                    "Cannot convert Visibility value '" + value + "' to IsVisible; value kept", property);
            return value;
        }
        return converted;
    }
}
