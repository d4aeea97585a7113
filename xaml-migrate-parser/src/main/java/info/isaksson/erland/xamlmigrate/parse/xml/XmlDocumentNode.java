package info.isaksson.erland.xamlmigrate.parse.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Result of a structural read: optional XML declaration, prolog comments, root and epilog comments. */
public final class XmlDocumentNode {

    private final String source;
    private String declarationText;
    private String version;
    private String encoding;
    private Boolean standalone;
    private XmlElementNode root;
    private final List<XmlCommentNode> prologComments = new ArrayList<>();
    private final List<XmlCommentNode> epilogComments = new ArrayList<>();

    XmlDocumentNode(String source) {
        this.source = source;
    }

    public String getSource() {
        return source;
    }

    /** Exact {@code <?xml ...?>} text, or null when the source has no declaration. */
    public String getDeclarationText() {
        return declarationText;
    }

    public String getVersion() {
        return version;
    }

    public String getEncoding() {
        return encoding;
    }

    public Boolean getStandalone() {
        return standalone;
    }

    void setDeclaration(String text, String version, String encoding, Boolean standalone) {
        this.declarationText = text;
        this.version = version;
        this.encoding = encoding;
        this.standalone = standalone;
    }

    public XmlElementNode getRoot() {
        return root;
    }

    void setRoot(XmlElementNode root) {
        this.root = root;
    }

    public List<XmlCommentNode> getPrologComments() {
        return Collections.unmodifiableList(prologComments);
    }

    void addPrologComment(XmlCommentNode c) {
        prologComments.add(c);
    }

    public List<XmlCommentNode> getEpilogComments() {
        return Collections.unmodifiableList(epilogComments);
    }

    void addEpilogComment(XmlCommentNode c) {
        epilogComments.add(c);
    }

    /** Offset just past the last top-level node. */
    public int contentEnd() {
        int end = root == null ? 0 : root.getEndOffset();
        for (XmlCommentNode c : epilogComments) {
            end = Math.max(end, c.getEndOffset());
        }
        return end;
    }
}
