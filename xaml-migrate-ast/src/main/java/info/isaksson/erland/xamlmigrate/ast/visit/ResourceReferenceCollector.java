package info.isaksson.erland.xamlmigrate.ast.visit;

import info.isaksson.erland.xamlmigrate.ast.ResourcePayload;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;

/**
 * Collects {@code StaticResource}/{@code DynamicResource} references at any nesting depth, e.g. the
 * converter of a binding.
 */
public final class ResourceReferenceCollector extends CollectingVisitor<ResourceReferenceCollector.ResourceReference> {

    public static final class ResourceReference {
        public final String resourceKey;
        public final boolean dynamic;
        public final XamlMarkupExtension extension;

        /** Property whose value (directly or nested) holds the reference. */
        public final XamlProperty property;

        ResourceReference(String resourceKey, boolean dynamic, XamlMarkupExtension extension, XamlProperty property) {
            this.resourceKey = resourceKey;
            this.dynamic = dynamic;
            this.extension = extension;
            this.property = property;
        }
    }

    @Override
    public VisitResult visitMarkupExtension(XamlMarkupExtension extension) {
        if (extension.getPayload() instanceof ResourcePayload) {
            ResourcePayload r = (ResourcePayload) extension.getPayload();
            if (r.resourceKey != null && !r.resourceKey.isEmpty()) {
                results.add(new ResourceReference(r.resourceKey, r.dynamic, extension, extension.owningProperty()));
            }
        }
        return VisitResult.CONTINUE;
    }
}
