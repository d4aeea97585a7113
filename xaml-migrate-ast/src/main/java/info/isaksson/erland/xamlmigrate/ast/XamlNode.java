package info.isaksson.erland.xamlmigrate.ast;

import java.util.Objects;

/**
 * Base of every node in the unified tree.
 *
 * <p>A node is owned by exactly one parent collection. {@link #getParent()} is a non-owning back-reference
 * maintained by the owning container's mutators; it is only meant for upward lookups.</p>
 */
public abstract class XamlNode {

    private XamlNode parent;
    private SourceLocation location = SourceLocation.UNKNOWN;
    private FormattingHints hints = new FormattingHints();
    private final NodeMetadata metadata = new NodeMetadata();

    public abstract XamlNodeKind kind();

    public XamlNode getParent() {
        return parent;
    }

    final void attachTo(XamlNode newParent) {
        this.parent = newParent;
    }

    final void detach() {
        this.parent = null;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public void setLocation(SourceLocation location) {
        this.location = location == null ? SourceLocation.UNKNOWN : location;
    }

    public FormattingHints getHints() {
        return hints;
    }

    public void setHints(FormattingHints hints) {
        this.hints = Objects.requireNonNull(hints, "hints must not be null");
    }

    public NodeMetadata getMetadata() {
        return metadata;
    }

    /** Nearest ancestor element, or null for a root element or a detached node. */
    public XamlElement enclosingElement() {
        XamlNode p = parent;
        while (p != null && !(p instanceof XamlElement)) {
            p = p.parent;
        }
        return (XamlElement) p;
    }

    /** Copy location, hints and metadata from another node (used when a rule replaces a node). */
    public void copyTraitsFrom(XamlNode other) {
        if (other == null) return;
        this.location = other.location;
        this.hints = other.hints.copy();
        other.metadata.copyInto(this.metadata);
    }

    static <N extends XamlNode> N requireDetached(N node) {
        Objects.requireNonNull(node, "node must not be null");
        if (((XamlNode) node).parent != null) {
            throw new IllegalStateException("node already has a parent: " + node);
        }
        return node;
    }
}
