package info.isaksson.erland.xamlmigrate.ast;

/** Arguments of a {@code StaticResource} or {@code DynamicResource} extension. */
public final class ResourcePayload extends MarkupExtensionPayload {

    public final String resourceKey;
    public final boolean dynamic;

    public ResourcePayload(String resourceKey, boolean dynamic) {
        this.resourceKey = resourceKey;
        this.dynamic = dynamic;
    }

    static ResourcePayload from(XamlMarkupExtension ext, boolean dynamic) {
        return new ResourcePayload(textOf(ext, "ResourceKey"), dynamic);
    }
}
