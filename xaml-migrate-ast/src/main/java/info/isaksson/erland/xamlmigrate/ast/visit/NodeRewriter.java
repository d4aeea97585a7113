package info.isaksson.erland.xamlmigrate.ast.visit;

import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;

/**
 * Per-node rewriting callbacks for {@link XamlRewriteWalker}.
 *
 * <p>Return the node (possibly mutated) to keep it, a new detached node to replace it, or null to remove it
 * from its parent.</p>
 */
public interface NodeRewriter {

    default XamlElement rewriteElement(XamlElement element) {
        return element;
    }

    default XamlProperty rewriteProperty(XamlProperty property) {
        return property;
    }

    default XamlMarkupExtension rewriteMarkupExtension(XamlMarkupExtension extension) {
        return extension;
    }
}
