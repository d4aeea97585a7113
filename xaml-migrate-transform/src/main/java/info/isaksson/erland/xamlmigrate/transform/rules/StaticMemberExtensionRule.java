package info.isaksson.erland.xamlmigrate.transform.rules;

import info.isaksson.erland.xamlmigrate.ast.MarkupExtensionKind;
import info.isaksson.erland.xamlmigrate.ast.StaticMemberPayload;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;
import info.isaksson.erland.xamlmigrate.ast.XamlNodeKind;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.transform.MarkupExtensionRule;
import info.isaksson.erland.xamlmigrate.transform.TransformationContext;

/**
 * Checks {@code x:Static} references. Members of project types (prefixed owner) carry over; members of
 * framework types (unprefixed owner such as {@code SystemColors}) may not exist in the target framework.
 */
public final class StaticMemberExtensionRule implements MarkupExtensionRule {

    @Override
    public String name() {
        return "StaticMemberExtension";
    }

    @Override
    public int priority() {
        return 150;
    }

    @Override
    public boolean canApply(XamlMarkupExtension extension) {
        return extension.extensionKind() == MarkupExtensionKind.STATIC;
    }

    @Override
    public XamlMarkupExtension apply(XamlMarkupExtension extension, TransformationContext context) {
        StaticMemberPayload payload = extension.getPayload() instanceof StaticMemberPayload
                ? (StaticMemberPayload) extension.getPayload()
                : null;
        if (payload == null || payload.memberReference == null || payload.memberReference.isBlank()) {
            context.warning(DiagnosticCodes.MARKUP_EXTENSION_REVIEW, "x:Static without a member reference", extension);
            return extension;
        }
        String owner = payload.ownerTypeName;
        if (owner == null || owner.indexOf(':') < 0) {
            context.warning(DiagnosticCodes.MARKUP_EXTENSION_REVIEW,
                    "x:Static refers to framework member '" + payload.memberReference
                            + "'; verify it exists in the target framework", extension);
        }
        context.recordTransformation(name(), XamlNodeKind.MARKUP_EXTENSION, "checked x:Static " + payload.memberReference);
        return extension;
    }
}
