package info.isaksson.erland.xamlmigrate.ast.visit;

import info.isaksson.erland.xamlmigrate.ast.XamlElement;

/** Collects every element carrying an {@code x:Name}, in document order. */
public final class NamedElementCollector extends CollectingVisitor<NamedElementCollector.NamedElement> {

    public static final class NamedElement {
        public final String name;
        public final XamlElement element;

        NamedElement(String name, XamlElement element) {
            this.name = name;
            this.element = element;
        }
    }

    @Override
    public VisitResult visitElement(XamlElement element) {
        String name = element.getXName();
        if (name != null && !name.isEmpty()) {
            results.add(new NamedElement(name, element));
        }
        return VisitResult.CONTINUE;
    }
}
