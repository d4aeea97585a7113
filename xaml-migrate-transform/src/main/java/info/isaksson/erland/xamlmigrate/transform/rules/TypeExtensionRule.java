package info.isaksson.erland.xamlmigrate.transform.rules;

import info.isaksson.erland.xamlmigrate.ast.MarkupExtensionKind;
import info.isaksson.erland.xamlmigrate.ast.MarkupParameter;
import info.isaksson.erland.xamlmigrate.ast.TypeReferencePayload;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;
import info.isaksson.erland.xamlmigrate.ast.XamlNodeKind;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.mapping.TypeMapping;
import info.isaksson.erland.xamlmigrate.transform.MarkupExtensionRule;
import info.isaksson.erland.xamlmigrate.transform.TransformationContext;

/** Renames framework types referenced by {@code x:Type} through the type mappings; prefixed types are kept. */
public final class TypeExtensionRule implements MarkupExtensionRule {

    @Override
    public String name() {
        return "TypeExtension";
    }

    @Override
    public int priority() {
        return 150;
    }

    @Override
    public boolean canApply(XamlMarkupExtension extension) {
        return extension.extensionKind() == MarkupExtensionKind.TYPE;
    }

    @Override
    public XamlMarkupExtension apply(XamlMarkupExtension extension, TransformationContext context) {
        TypeReferencePayload payload = extension.getPayload() instanceof TypeReferencePayload
                ? (TypeReferencePayload) extension.getPayload()
                : null;
        if (payload == null || payload.typeName == null || payload.typeName.isBlank()) {
            context.warning(DiagnosticCodes.MARKUP_EXTENSION_REVIEW, "x:Type without a type name", extension);
            return extension;
        }
        if (payload.prefix() != null) {
            return extension;
        }
        TypeMapping mapping = context.getRepository().findTypeMapping(payload.localTypeName());
        if (mapping == null || !mapping.isRename()) {
            return extension;
        }
        String target = mapping.targetSimpleName();
        if (extension.getNamedParameter("TypeName") != null) {
            extension.setNamedParameter("TypeName", MarkupParameter.literal(target));
        } else {
            extension.setPositionalArgument(MarkupParameter.literal(target));
        }
        context.recordTransformation(name(), XamlNodeKind.MARKUP_EXTENSION,
                "x:Type " + payload.typeName + " -> " + target);
        return extension;
    }
}
