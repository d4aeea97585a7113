package info.isaksson.erland.xamlmigrate.ast.visit;

import info.isaksson.erland.xamlmigrate.ast.XamlComment;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;

/**
 * Callbacks for {@link XamlWalker}. Every callback defaults to {@link VisitResult#CONTINUE}, so a
 * visitor only implements the node kinds it cares about.
 */
public interface XamlVisitor {

    default VisitResult visitElement(XamlElement element) {
        return VisitResult.CONTINUE;
    }

    /** Called after an element's comments, properties and children; post-order hook. */
    default VisitResult endElement(XamlElement element) {
        return VisitResult.CONTINUE;
    }

    default VisitResult visitProperty(XamlProperty property) {
        return VisitResult.CONTINUE;
    }

    default VisitResult visitMarkupExtension(XamlMarkupExtension extension) {
        return VisitResult.CONTINUE;
    }

    default VisitResult visitComment(XamlComment comment) {
        return VisitResult.CONTINUE;
    }
}
