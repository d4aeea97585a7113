package info.isaksson.erland.xamlmigrate.ast;

/** Argument of an {@code x:Static} extension, split into owner type and member. */
public final class StaticMemberPayload extends MarkupExtensionPayload {

    /** Reference as written, e.g. {@code local:Constants.Title}. */
    public final String memberReference;
    public final String ownerTypeName;
    public final String memberName;

    public StaticMemberPayload(String memberReference) {
        this.memberReference = memberReference;
        if (memberReference == null) {
            this.ownerTypeName = null;
            this.memberName = null;
        } else {
            int dot = memberReference.lastIndexOf('.');
            this.ownerTypeName = dot > 0 ? memberReference.substring(0, dot) : null;
            this.memberName = dot > 0 ? memberReference.substring(dot + 1) : memberReference;
        }
    }

    static StaticMemberPayload from(XamlMarkupExtension ext) {
        return new StaticMemberPayload(textOf(ext, "Member"));
    }
}
