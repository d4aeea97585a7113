package info.isaksson.erland.xamlmigrate.transform.rules;

import info.isaksson.erland.xamlmigrate.ast.MarkupExtensionKind;
import info.isaksson.erland.xamlmigrate.ast.MarkupParameter;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;
import info.isaksson.erland.xamlmigrate.ast.XamlNodeKind;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.transform.MarkupExtensionRule;
import info.isaksson.erland.xamlmigrate.transform.TransformationContext;

/**
 * Flags {@code DynamicResource} keys given as {@code x:Static} system resource keys
 * ({@code SystemColors.WindowBrushKey}); the target framework has no such keys.
 */
public final class DynamicResourceRule implements MarkupExtensionRule {

    @Override
    public String name() {
        return "DynamicResource";
    }

    @Override
    public int priority() {
        return 150;
    }

    @Override
    public boolean canApply(XamlMarkupExtension extension) {
        return extension.extensionKind() == MarkupExtensionKind.DYNAMIC_RESOURCE;
    }

    @Override
    public XamlMarkupExtension apply(XamlMarkupExtension extension, TransformationContext context) {
        MarkupParameter key = extension.getNamedParameter("ResourceKey");
        if (key == null) key = extension.getPositionalArgument();
        if (key != null && key.isExtension() && key.getExtension().extensionKind() == MarkupExtensionKind.STATIC) {
            context.warning(DiagnosticCodes.MARKUP_EXTENSION_REVIEW,
                    "DynamicResource with system resource key " + key.asText() + " has no direct equivalent",
                    extension);
            return extension;
        }
        context.recordTransformation(name(), XamlNodeKind.MARKUP_EXTENSION,
                "kept DynamicResource " + (key == null ? "" : key.asText()));
        return extension;
    }
}
