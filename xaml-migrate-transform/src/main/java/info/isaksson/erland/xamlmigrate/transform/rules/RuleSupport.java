package info.isaksson.erland.xamlmigrate.transform.rules;

import info.isaksson.erland.xamlmigrate.ast.PropertyKind;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;

/** Small helpers shared by the built-in rules. */
final class RuleSupport {

    private RuleSupport() {}

    /** Namespaces that point at project code rather than a framework ({@code clr-namespace:}, {@code using:}). */
    static boolean isCodeNamespace(String uri) {
        return uri != null && (uri.startsWith("clr-namespace:") || uri.startsWith("using:"));
    }

    /** Property elements written as {@code Old.Member} follow a renamed element. */
    static void renamePropertyElementOwners(XamlElement element, String oldTypeName, String newTypeName) {
        if (oldTypeName.equals(newTypeName)) return;
        for (XamlProperty p : element.propertyElements()) {
            if (oldTypeName.equals(p.getAttachedOwnerType())) {
                p.setAttachedOwnerType(newTypeName);
            }
        }
    }

    /**
     * Rename a property. A dotted target ({@code ToolTip.Tip}) turns an attribute into an attached property
     * and re-owns a property element.
     */
    static void renameProperty(XamlProperty p, String target) {
        int dot = target.lastIndexOf('.');
        if (dot <= 0) {
            p.setName(target);
            return;
        }
        String owner = target.substring(0, dot);
        p.setName(target.substring(dot + 1));
        if (p.isPropertyElement()) {
            p.setAttachedOwnerType(owner);
        } else {
            p.setPropertyKind(PropertyKind.ATTACHED_PROPERTY, owner);
        }
    }

    static String notesSuffix(String notes) {
        return notes == null || notes.isBlank() ? "" : " (" + notes + ")";
    }
}
