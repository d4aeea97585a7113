package info.isaksson.erland.xamlmigrate.transform;

import info.isaksson.erland.xamlmigrate.ast.XamlNodeKind;

import java.util.Objects;

/** One entry of the transformation trace. Not a diagnostic: it records what was done, not what is wrong. */
public final class TransformationRecord {

    public final String passName;
    public final String ruleName;
    public final XamlNodeKind nodeKind;
    public final String description;

    /** Source line of the node, or null when unknown. */
    public final Integer line;

    public TransformationRecord(String passName, String ruleName, XamlNodeKind nodeKind, String description, Integer line) {
        this.passName = passName;
        this.ruleName = Objects.requireNonNull(ruleName, "ruleName must not be null");
        this.nodeKind = Objects.requireNonNull(nodeKind, "nodeKind must not be null");
        this.description = description == null ? "" : description;
        this.line = line;
    }

    @Override
    public String toString() {
        return ruleName + " [" + nodeKind + (line == null ? "" : " line " + line) + "]: " + description;
    }
}
