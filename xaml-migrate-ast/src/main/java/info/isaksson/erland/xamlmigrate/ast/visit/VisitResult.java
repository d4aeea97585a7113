package info.isaksson.erland.xamlmigrate.ast.visit;

/** Traversal instruction returned by every {@link XamlVisitor} callback. */
public enum VisitResult {
    /** Visit this node's contents and keep going. */
    CONTINUE,
    /** Do not descend into this node's contents; continue with its next sibling. */
    SKIP_CHILDREN,
    /** Abort the whole traversal. */
    STOP
}
