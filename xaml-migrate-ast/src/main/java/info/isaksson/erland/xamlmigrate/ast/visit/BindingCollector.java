package info.isaksson.erland.xamlmigrate.ast.visit;

import info.isaksson.erland.xamlmigrate.ast.BindingPayload;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;

/** Collects {@code Binding} and {@code TemplateBinding} extensions with their target property. */
public final class BindingCollector extends CollectingVisitor<BindingCollector.BindingReference> {

    public static final class BindingReference {
        public final BindingPayload binding;
        public final XamlMarkupExtension extension;
        public final XamlProperty property;

        BindingReference(BindingPayload binding, XamlMarkupExtension extension, XamlProperty property) {
            this.binding = binding;
            this.extension = extension;
            this.property = property;
        }
    }

    @Override
    public VisitResult visitMarkupExtension(XamlMarkupExtension extension) {
        if (extension.getPayload() instanceof BindingPayload) {
            results.add(new BindingReference((BindingPayload) extension.getPayload(), extension, extension.owningProperty()));
        }
        return VisitResult.CONTINUE;
    }
}
