package info.isaksson.erland.xamlmigrate.transform;

import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;

public interface MarkupExtensionRule extends TransformationRule {

    boolean canApply(XamlMarkupExtension extension);

    /** @return the extension (possibly mutated), a detached replacement, or null to remove it */
    XamlMarkupExtension apply(XamlMarkupExtension extension, TransformationContext context);
}
