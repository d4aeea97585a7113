package info.isaksson.erland.xamlmigrate.ast;

import java.util.Objects;

/**
 * A markup comment.
 *
 * <p>{@code anchorIndex} places an element-level comment before the content slot with that index
 * (property elements first, then children); a value equal to the slot count places it after the last
 * slot. Document-level comments ignore the anchor.</p>
 */
public final class XamlComment extends XamlNode {

    private String text;
    private final boolean preserve;
    private int anchorIndex;

    public XamlComment(String text, boolean preserve) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.preserve = preserve;
    }

    /** Comment taken from source text. */
    public static XamlComment preserved(String text) {
        return new XamlComment(text, true);
    }

    /** Comment produced by tooling; emitted only in diagnostic-comment mode. */
    public static XamlComment synthetic(String text) {
        return new XamlComment(text, false);
    }

    @Override
    public XamlNodeKind kind() {
        return XamlNodeKind.COMMENT;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    public boolean isPreserve() {
        return preserve;
    }

    public int getAnchorIndex() {
        return anchorIndex;
    }

    public void setAnchorIndex(int anchorIndex) {
        this.anchorIndex = anchorIndex;
    }

    @Override
    public String toString() {
        return "XamlComment{" + text + "}";
    }
}
