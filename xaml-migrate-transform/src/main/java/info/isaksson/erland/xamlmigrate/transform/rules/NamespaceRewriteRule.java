package info.isaksson.erland.xamlmigrate.transform.rules;

import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlNamespaces;
import info.isaksson.erland.xamlmigrate.ast.XamlNodeKind;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.mapping.NamespaceMapping;
import info.isaksson.erland.xamlmigrate.transform.ElementRule;
import info.isaksson.erland.xamlmigrate.transform.TransformationContext;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Moves elements and their {@code xmlns} declarations to the target framework's namespaces.
 *
 * <p>Runs in its own pass ahead of the type rules. The element's source namespace and type name are kept in
 * node metadata first, so later rules can still match on them. The XAML language namespace and code
 * namespaces ({@code clr-namespace:}, {@code using:}) are kept as they are. A namespace without mapping is
 * reported once per document.</p>
 */
public final class NamespaceRewriteRule implements ElementRule {

    @Override
    public String name() {
        return "NamespaceRewrite";
    }

    @Override
    public boolean canApply(XamlElement element) {
        return !element.isSynthetic()
                && (element.getNamespaceUri() != null || !element.getNamespaceDeclarations().isEmpty());
    }

    @Override
    public XamlElement apply(XamlElement element, TransformationContext context) {
        TransformationContext.rememberSource(element);

        // 1) declarations, in written order
        Map<String, String> declarations = new LinkedHashMap<>(element.getNamespaceDeclarations());
        for (Map.Entry<String, String> e : declarations.entrySet()) {
            String target = targetOf(e.getValue(), element, context);
            if (target != null && !target.equals(e.getValue())) {
                element.declareNamespace(e.getKey(), target);
                String written = e.getKey().isEmpty() ? "xmlns" : "xmlns:" + e.getKey();
                context.recordTransformation(name(), XamlNodeKind.ELEMENT,
                        written + ": " + e.getValue() + " -> " + target);
            }
        }

        // 2) the element's own namespace
        String ns = element.getNamespaceUri();
        String target = targetOf(ns, element, context);
        if (target != null && !target.equals(ns)) {
            element.setNamespaceUri(target);
        }
        return element;
    }

    private static String targetOf(String uri, XamlElement at, TransformationContext context) {
        if (uri == null || XamlNamespaces.isLanguageNamespace(uri) || RuleSupport.isCodeNamespace(uri)
                || XamlNamespaces.XML.equals(uri)) {
            return null;
        }
        NamespaceMapping mapping = context.getRepository().findNamespaceMapping(uri);
        if (mapping == null) {
            if (context.firstOccurrence("namespace-missing:" + uri)) {
                context.info(DiagnosticCodes.NAMESPACE_MAPPING_NOT_FOUND,
                        "No namespace mapping for '" + uri + "'; kept as is", at);
            }
            return null;
        }
        if (mapping.requiresManualReview && context.firstOccurrence("namespace-review:" + uri)) {
            context.warning(DiagnosticCodes.NAMESPACE_REQUIRES_MANUAL_REVIEW,
                    "Namespace '" + uri + "' mapped to '" + mapping.targetNamespace + "' needs review"
                            + RuleSupport.notesSuffix(mapping.notes), at);
        }
        return mapping.targetNamespace;
    }
}
