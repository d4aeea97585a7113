package info.isaksson.erland.xamlmigrate.ast.visit;

import info.isaksson.erland.xamlmigrate.ast.XamlComment;
import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;

import java.util.ArrayList;

/**
 * Depth-first, pre-order traversal driven by a {@link XamlVisitor}.
 *
 * <p>Per element: the element, its comments, its properties (each followed by its value's markup
 * extensions or element), its children, then {@link XamlVisitor#endElement}. Collections are
 * snapshotted before iteration so visitors may mutate what they are handed.</p>
 */
public final class XamlWalker {

    private XamlWalker() {}

    /** @return {@link VisitResult#STOP} if the visitor stopped the traversal, otherwise CONTINUE */
    public static VisitResult walk(XamlDocument document, XamlVisitor visitor) {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        if (visitor == null) throw new IllegalArgumentException("visitor must not be null");
        for (XamlComment c : new ArrayList<>(document.getLeadingComments())) {
            if (visitor.visitComment(c) == VisitResult.STOP) return VisitResult.STOP;
        }
        if (document.getRoot() != null && walk(document.getRoot(), visitor) == VisitResult.STOP) {
            return VisitResult.STOP;
        }
        for (XamlComment c : new ArrayList<>(document.getTrailingComments())) {
            if (visitor.visitComment(c) == VisitResult.STOP) return VisitResult.STOP;
        }
        return VisitResult.CONTINUE;
    }

    public static VisitResult walk(XamlElement element, XamlVisitor visitor) {
        VisitResult r = visitor.visitElement(element);
        if (r == VisitResult.STOP) return VisitResult.STOP;
        if (r == VisitResult.CONTINUE) {
            for (XamlComment c : new ArrayList<>(element.getComments())) {
                if (visitor.visitComment(c) == VisitResult.STOP) return VisitResult.STOP;
            }
            for (XamlProperty p : new ArrayList<>(element.getProperties())) {
                if (walkProperty(p, visitor) == VisitResult.STOP) return VisitResult.STOP;
            }
            for (XamlElement child : new ArrayList<>(element.getChildren())) {
                if (walk(child, visitor) == VisitResult.STOP) return VisitResult.STOP;
            }
        }
        return visitor.endElement(element) == VisitResult.STOP ? VisitResult.STOP : VisitResult.CONTINUE;
    }

    private static VisitResult walkProperty(XamlProperty property, XamlVisitor visitor) {
        VisitResult r = visitor.visitProperty(property);
        if (r != VisitResult.CONTINUE) return r == VisitResult.STOP ? VisitResult.STOP : VisitResult.CONTINUE;
        switch (property.valueKind()) {
            case MARKUP_EXTENSION:
                return walkExtension(property.getMarkupExtension(), visitor);
            case ELEMENT:
                return walk(property.getElementValue(), visitor);
            default:
                return VisitResult.CONTINUE;
        }
    }

    private static VisitResult walkExtension(XamlMarkupExtension extension, XamlVisitor visitor) {
        VisitResult r = visitor.visitMarkupExtension(extension);
        if (r != VisitResult.CONTINUE) return r == VisitResult.STOP ? VisitResult.STOP : VisitResult.CONTINUE;
        for (XamlMarkupExtension nested : extension.nestedExtensions()) {
            if (walkExtension(nested, visitor) == VisitResult.STOP) return VisitResult.STOP;
        }
        return VisitResult.CONTINUE;
    }
}
