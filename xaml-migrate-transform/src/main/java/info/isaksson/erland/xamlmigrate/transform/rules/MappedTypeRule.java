package info.isaksson.erland.xamlmigrate.transform.rules;

import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlNamespaces;
import info.isaksson.erland.xamlmigrate.ast.XamlNodeKind;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.mapping.TypeMapping;
import info.isaksson.erland.xamlmigrate.transform.ElementRule;
import info.isaksson.erland.xamlmigrate.transform.TransformationContext;

/**
 * Fallback element rule driven by the mapping repository. Elements from code namespaces and language
 * elements ({@code x:Array}) are user or XAML types and are left alone.
 */
public final class MappedTypeRule implements ElementRule {

    @Override
    public String name() {
        return "MappedType";
    }

    @Override
    public boolean canApply(XamlElement element) {
        if (element.isSynthetic()) return false;
        String ns = TransformationContext.sourceNamespaceOf(element);
        return !RuleSupport.isCodeNamespace(ns) && !XamlNamespaces.isLanguageNamespace(ns);
    }

    @Override
    public XamlElement apply(XamlElement element, TransformationContext context) {
        TypeMapping mapping = context.getRepository().findTypeMapping(element.fullTypeName());
        if (mapping == null) {
            context.info(DiagnosticCodes.TYPE_MAPPING_NOT_FOUND,
                    "No type mapping for '" + element.fullTypeName() + "'; element kept as <"
                            + element.qualifiedName() + ">", element);
            return element;
        }
        if (mapping.requiresManualReview) {
            context.warning(DiagnosticCodes.TYPE_REQUIRES_MANUAL_REVIEW,
                    "Type '" + mapping.sourceTypeName + "' mapped to '" + mapping.targetTypeName + "' needs review"
                            + RuleSupport.notesSuffix(mapping.notes), element);
        }
        TransformationContext.rememberSource(element);
        String old = element.getTypeName();
        String target = mapping.targetSimpleName();
        if (!old.equals(target)) {
            element.setTypeName(target);
            RuleSupport.renamePropertyElementOwners(element, old, target);
            context.recordTransformation(name(), XamlNodeKind.ELEMENT, old + " -> " + target);
        }
        if (mapping.targetNamespace != null && !mapping.targetNamespace.equals(element.getNamespaceUri())) {
            element.setNamespaceUri(mapping.targetNamespace);
        }
        return element;
    }
}
