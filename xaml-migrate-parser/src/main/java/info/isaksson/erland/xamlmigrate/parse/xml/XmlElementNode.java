package info.isaksson.erland.xamlmigrate.parse.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Element of the generic structural tree.
 *
 * <p>Offsets: {@code startOffset} is the {@code <} of the opening tag, {@code openTagEnd} is just past its
 * {@code >}, {@code endTagStart} is the {@code <} of {@code </name>} (or -1 for a self-closing tag) and
 * {@code endOffset} is just past the element. Line and column follow the tag-name convention of
 * {@link info.isaksson.erland.xamlmigrate.parse.PositionIndex}.</p>
 */
public final class XmlElementNode extends XmlNode {

    private final String prefix;
    private final String localName;
    private final String namespaceUri;
    private final int line;
    private final int column;
    private final int openTagEnd;
    private final boolean selfClosing;
    private int endTagStart = -1;

    private final List<XmlAttributeNode> attributes = new ArrayList<>();
    private final List<XmlNode> content = new ArrayList<>();

    XmlElementNode(String prefix, String localName, String namespaceUri, int startOffset, int openTagEnd,
                   boolean selfClosing, int line, int column) {
        super(startOffset, openTagEnd);
        this.prefix = prefix == null || prefix.isEmpty() ? null : prefix;
        this.localName = localName;
        this.namespaceUri = namespaceUri == null || namespaceUri.isEmpty() ? null : namespaceUri;
        this.openTagEnd = openTagEnd;
        this.selfClosing = selfClosing;
        this.line = line;
        this.column = column;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getLocalName() {
        return localName;
    }

    public String getQualifiedName() {
        return prefix == null ? localName : prefix + ":" + localName;
    }

    public String getNamespaceUri() {
        return namespaceUri;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOpenTagEnd() {
        return openTagEnd;
    }

    public boolean isSelfClosing() {
        return selfClosing;
    }

    public int getEndTagStart() {
        return endTagStart;
    }

    void close(int endTagStart, int endOffset) {
        this.endTagStart = endTagStart;
        setEndOffset(endOffset);
    }

    /** Property-element syntax: {@code <Owner.Property>}. */
    public boolean isPropertyElement() {
        int dot = localName.indexOf('.');
        return dot > 0 && dot < localName.length() - 1;
    }

    /** Attributes and namespace declarations in source order. */
    public List<XmlAttributeNode> getAttributes() {
        return Collections.unmodifiableList(attributes);
    }

    void addAttribute(XmlAttributeNode attribute) {
        attributes.add(attribute);
    }

    void sortAttributesBySource() {
        // unlocated attributes keep their relative order at the end
        attributes.sort((a, b) -> Integer.compare(
                a.getSourceOffset() < 0 ? Integer.MAX_VALUE : a.getSourceOffset(),
                b.getSourceOffset() < 0 ? Integer.MAX_VALUE : b.getSourceOffset()));
    }

    /** Child elements, text runs and comments in document order. */
    public List<XmlNode> getContent() {
        return Collections.unmodifiableList(content);
    }

    void addContent(XmlNode node) {
        content.add(node);
    }

    XmlNode lastContent() {
        return content.isEmpty() ? null : content.get(content.size() - 1);
    }

    public List<XmlElementNode> childElements() {
        List<XmlElementNode> out = new ArrayList<>();
        for (XmlNode n : content) {
            if (n instanceof XmlElementNode) out.add((XmlElementNode) n);
        }
        return out;
    }

    @Override
    public String toString() {
        return "XmlElementNode{" + getQualifiedName() + " @" + line + ":" + column + "}";
    }
}
