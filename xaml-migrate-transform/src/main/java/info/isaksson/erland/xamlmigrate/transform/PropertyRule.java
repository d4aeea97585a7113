package info.isaksson.erland.xamlmigrate.transform;

import info.isaksson.erland.xamlmigrate.ast.XamlProperty;

public interface PropertyRule extends TransformationRule {

    boolean canApply(XamlProperty property);

    /** @return the property (possibly mutated), a detached replacement, or null to remove it */
    XamlProperty apply(XamlProperty property, TransformationContext context);
}
