package info.isaksson.erland.xamlmigrate.transform.rules;

import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlNamespaces;
import info.isaksson.erland.xamlmigrate.ast.XamlNodeKind;
import info.isaksson.erland.xamlmigrate.transform.ElementRule;
import info.isaksson.erland.xamlmigrate.transform.TransformationContext;

import java.util.Objects;

/**
 * Renames elements of one source type to a fixed target type and namespace.
 *
 * <p>Matches on the source identity of the element, so it still applies after an earlier pass moved the
 * element to the target namespace. Subclasses add property follow-up in {@link #afterRename}.</p>
 */
public class SimpleTypeRenameRule implements ElementRule {

    private final String sourceTypeName;
    private final String targetTypeName;
    private final String sourceNamespace;
    private final String targetNamespace;
    private final int priority;

    /**
     * @param sourceNamespace namespace the source type must come from, or null for any
     * @param targetNamespace namespace to move the element to, or null to keep it
     */
    public SimpleTypeRenameRule(String sourceTypeName, String targetTypeName, String sourceNamespace,
                                String targetNamespace, int priority) {
        this.sourceTypeName = Objects.requireNonNull(sourceTypeName, "sourceTypeName must not be null");
        this.targetTypeName = Objects.requireNonNull(targetTypeName, "targetTypeName must not be null");
        this.sourceNamespace = sourceNamespace;
        this.targetNamespace = targetNamespace;
        this.priority = priority;
    }

    public SimpleTypeRenameRule(String sourceTypeName, String targetTypeName) {
        this(sourceTypeName, targetTypeName, null, XamlNamespaces.AVALONIA, 50);
    }

    @Override
    public String name() {
        return sourceTypeName.equals(targetTypeName)
                ? "Migrate" + sourceTypeName
                : "Rename" + sourceTypeName + "To" + targetTypeName;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public boolean canApply(XamlElement element) {
        if (element.isSynthetic()) return false;
        if (!sourceTypeName.equals(TransformationContext.sourceTypeNameOf(element))) return false;
        return sourceNamespace == null || sourceNamespace.equals(TransformationContext.sourceNamespaceOf(element));
    }

    @Override
    public XamlElement apply(XamlElement element, TransformationContext context) {
        TransformationContext.rememberSource(element);
        String old = element.getTypeName();
        element.setTypeName(targetTypeName);
        if (targetNamespace != null) {
            element.setNamespaceUri(targetNamespace);
        }
        RuleSupport.renamePropertyElementOwners(element, old, targetTypeName);
        afterRename(element, context);
        context.recordTransformation(name(), XamlNodeKind.ELEMENT, old + " -> " + targetTypeName);
        return element;
    }

    /** Property-level follow-up on the renamed element. Default: none. */
    protected void afterRename(XamlElement element, TransformationContext context) {
    }

    public String getSourceTypeName() {
        return sourceTypeName;
    }

    public String getTargetTypeName() {
        return targetTypeName;
    }
}
