package info.isaksson.erland.xamlmigrate.ast.visit;

import info.isaksson.erland.xamlmigrate.ast.XamlProperty;

/** Collects attached properties, optionally only those of one owner type. */
public final class AttachedPropertyCollector extends CollectingVisitor<XamlProperty> {

    private final String ownerType;

    public AttachedPropertyCollector() {
        this(null);
    }

    public AttachedPropertyCollector(String ownerType) {
        this.ownerType = ownerType;
    }

    @Override
    public VisitResult visitProperty(XamlProperty property) {
        if (property.isAttached() && (ownerType == null || ownerType.equals(property.getAttachedOwnerType()))) {
            results.add(property);
        }
        return VisitResult.CONTINUE;
    }
}
