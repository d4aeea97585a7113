package info.isaksson.erland.xamlmigrate.transform;

import info.isaksson.erland.xamlmigrate.ast.XamlElement;

public interface ElementRule extends TransformationRule {

    boolean canApply(XamlElement element);

    /** @return the element (possibly mutated), a detached replacement, or null to remove it */
    XamlElement apply(XamlElement element, TransformationContext context);
}
