package info.isaksson.erland.xamlmigrate.parse.xml;

/** Node of the generic structural tree, spanning {@code [startOffset, endOffset)} of the source. */
public abstract class XmlNode {

    private final int startOffset;
    private int endOffset;

    protected XmlNode(int startOffset, int endOffset) {
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    void setEndOffset(int endOffset) {
        this.endOffset = endOffset;
    }
}
