package info.isaksson.erland.xamlmigrate.ast.visit;

import info.isaksson.erland.xamlmigrate.ast.MarkupParameter;
import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;

import java.util.ArrayList;
import java.util.Map;

/**
 * Pre-order, depth-first rewriting traversal.
 *
 * <p>An element is rewritten first, then its own properties (and their values), then its children, so
 * property callbacks observe the already rewritten element. Replacements and removals are applied to the
 * owning collection immediately; a removed node leaves no hole.</p>
 */
public final class XamlRewriteWalker {

    private XamlRewriteWalker() {}

    public static void rewrite(XamlDocument document, NodeRewriter rewriter) {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        if (rewriter == null) throw new IllegalArgumentException("rewriter must not be null");
        XamlElement root = document.getRoot();
        if (root == null) return;
        XamlElement rewritten = rewriteElement(root, rewriter);
        if (rewritten != root) {
            document.setRoot(null);
            document.setRoot(rewritten);
        }
    }

    public static XamlElement rewriteElement(XamlElement element, NodeRewriter rewriter) {
        XamlElement current = rewriter.rewriteElement(element);
        if (current == null) return null;

        for (XamlProperty p : new ArrayList<>(current.getProperties())) {
            XamlProperty np = rewriteProperty(p, rewriter);
            if (np == null) {
                current.removeProperty(p);
            } else if (np != p) {
                current.replaceProperty(p, np);
            }
        }

        for (XamlElement child : new ArrayList<>(current.getChildren())) {
            XamlElement nc = rewriteElement(child, rewriter);
            if (nc == null) {
                current.removeChild(child);
            } else if (nc != child) {
                current.replaceChild(child, nc);
            }
        }
        return current;
    }

    static XamlProperty rewriteProperty(XamlProperty property, NodeRewriter rewriter) {
        XamlProperty current = rewriter.rewriteProperty(property);
        if (current == null) return null;
        switch (current.valueKind()) {
            case MARKUP_EXTENSION: {
                XamlMarkupExtension ext = current.getMarkupExtension();
                XamlMarkupExtension nx = rewriteExtension(ext, rewriter);
                if (nx == null) return null;
                if (nx != ext) current.setMarkupExtension(nx);
                break;
            }
            case ELEMENT: {
                XamlElement value = current.getElementValue();
                XamlElement nv = rewriteElement(value, rewriter);
                if (nv == null) return null;
                if (nv != value) current.setElementValue(nv);
                break;
            }
            default:
                break;
        }
        return current;
    }

    static XamlMarkupExtension rewriteExtension(XamlMarkupExtension extension, NodeRewriter rewriter) {
        XamlMarkupExtension current = rewriter.rewriteMarkupExtension(extension);
        if (current == null) return null;

        MarkupParameter positional = current.getPositionalArgument();
        if (positional != null && positional.isExtension()) {
            XamlMarkupExtension nested = positional.getExtension();
            XamlMarkupExtension nn = rewriteExtension(nested, rewriter);
            if (nn == null) {
                current.setPositionalArgument(null);
            } else if (nn != nested) {
                current.setPositionalArgument(MarkupParameter.extension(nn));
            }
        }
        for (Map.Entry<String, MarkupParameter> e : new ArrayList<>(current.getNamedParameters().entrySet())) {
            if (!e.getValue().isExtension()) continue;
            XamlMarkupExtension nested = e.getValue().getExtension();
            XamlMarkupExtension nn = rewriteExtension(nested, rewriter);
            if (nn == null) {
                current.removeNamedParameter(e.getKey());
            } else if (nn != nested) {
                current.setNamedParameter(e.getKey(), MarkupParameter.extension(nn));
            }
        }
        return current;
    }
}
