package info.isaksson.erland.xamlmigrate.ast.visit;

import info.isaksson.erland.xamlmigrate.ast.XamlElement;

import java.util.Objects;

/** Collects elements of one type, matched by written type name or by resolved full name. */
public final class TypeUsageCollector extends CollectingVisitor<XamlElement> {

    private final String typeName;
    private final boolean useFullTypeName;

    public TypeUsageCollector(String typeName, boolean useFullTypeName) {
        this.typeName = Objects.requireNonNull(typeName, "typeName must not be null");
        this.useFullTypeName = useFullTypeName;
    }

    public TypeUsageCollector(String typeName) {
        this(typeName, false);
    }

    @Override
    public VisitResult visitElement(XamlElement element) {
        String candidate = useFullTypeName ? element.fullTypeName() : element.getTypeName();
        if (typeName.equals(candidate)) {
            results.add(element);
        }
        return VisitResult.CONTINUE;
    }
}
