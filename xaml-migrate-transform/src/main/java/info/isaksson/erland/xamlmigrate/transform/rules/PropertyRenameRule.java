package info.isaksson.erland.xamlmigrate.transform.rules;

import info.isaksson.erland.xamlmigrate.ast.PropertyValueKind;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlNodeKind;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;
import info.isaksson.erland.xamlmigrate.transform.PropertyRule;
import info.isaksson.erland.xamlmigrate.transform.TransformationContext;

import java.util.Objects;

/**
 * Renames one property, optionally only on elements of one source type. Literal values pass through
 * {@link #convertValue}; subclasses override it when the value domain changes too.
 */
public class PropertyRenameRule implements PropertyRule {

    private final String sourceName;
    private final String targetName;
    private final String ownerTypeName;
    private final int priority;

    /**
     * @param ownerTypeName source type the property must sit on, or null for any element
     * @param targetName    new name; a dotted name ({@code ToolTip.Tip}) makes the property attached
     */
    public PropertyRenameRule(String sourceName, String targetName, String ownerTypeName, int priority) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName must not be null");
        this.targetName = Objects.requireNonNull(targetName, "targetName must not be null");
        this.ownerTypeName = ownerTypeName;
        this.priority = priority;
    }

    public PropertyRenameRule(String sourceName, String targetName) {
        this(sourceName, targetName, null, 10);
    }

    @Override
    public String name() {
        return "Rename" + sourceName + "To" + targetName.replace(".", "");
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public boolean canApply(XamlProperty property) {
        if (property.isAttached() || !sourceName.equals(property.getName())) return false;
        if (ownerTypeName == null) return true;
        XamlElement owner = property.getOwnerElement();
        return owner != null && ownerTypeName.equals(TransformationContext.sourceTypeNameOf(owner));
    }

    @Override
    public XamlProperty apply(XamlProperty property, TransformationContext context) {
        String before = property.writtenName();
        RuleSupport.renameProperty(property, targetName);
        String description = before + " -> " + property.writtenName();
        if (property.valueKind() == PropertyValueKind.LITERAL) {
            String original = property.getLiteralValue();
            String converted = convertValue(original, property, context);
            if (converted != null && !converted.equals(original)) {
                property.setLiteralValue(converted);
                description += " ('" + original + "' -> '" + converted + "')";
            }
        }
        context.recordTransformation(name(), XamlNodeKind.PROPERTY, description);
        return property;
    }

    /** Convert a literal value; returning the input (or null) keeps it. Default: identity. */
    protected String convertValue(String value, XamlProperty property, TransformationContext context) {
        return value;
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getTargetName() {
        return targetName;
    }
}
