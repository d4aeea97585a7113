package info.isaksson.erland.xamlmigrate.ast;

/** Arguments of a {@code Binding} or {@code TemplateBinding} extension. */
public final class BindingPayload extends MarkupExtensionPayload {

    public final boolean templateBinding;
    public final String path;
    public final String mode;
    public final String elementName;
    public final String source;
    public final String stringFormat;
    public final String fallbackValue;
    public final String targetNullValue;
    public final String updateSourceTrigger;
    public final String converterParameter;

    /** Converter as a nested extension, usually {@code {StaticResource ...}}; null when literal or absent. */
    public final XamlMarkupExtension converter;

    public final XamlMarkupExtension relativeSource;

    private BindingPayload(boolean templateBinding, String path, String mode, String elementName, String source,
                           String stringFormat, String fallbackValue, String targetNullValue,
                           String updateSourceTrigger, String converterParameter,
                           XamlMarkupExtension converter, XamlMarkupExtension relativeSource) {
        this.templateBinding = templateBinding;
        this.path = path;
        this.mode = mode;
        this.elementName = elementName;
        this.source = source;
        this.stringFormat = stringFormat;
        this.fallbackValue = fallbackValue;
        this.targetNullValue = targetNullValue;
        this.updateSourceTrigger = updateSourceTrigger;
        this.converterParameter = converterParameter;
        this.converter = converter;
        this.relativeSource = relativeSource;
    }

    static BindingPayload from(XamlMarkupExtension ext, boolean templateBinding) {
        String path = textOf(ext, templateBinding ? "Property" : "Path");
        MarkupParameter conv = ext.getNamedParameter("Converter");
        MarkupParameter rel = ext.getNamedParameter("RelativeSource");
        return new BindingPayload(
                templateBinding,
                path,
                namedText(ext, "Mode"),
                namedText(ext, "ElementName"),
                namedText(ext, "Source"),
                namedText(ext, "StringFormat"),
                namedText(ext, "FallbackValue"),
                namedText(ext, "TargetNullValue"),
                namedText(ext, "UpdateSourceTrigger"),
                namedText(ext, "ConverterParameter"),
                conv != null && conv.isExtension() ? conv.getExtension() : null,
                rel != null && rel.isExtension() ? rel.getExtension() : null
        );
    }

    /** Resource key of a {@code Converter={StaticResource key}} argument, or null. */
    public String converterResourceKey() {
        if (converter == null || !(converter.getPayload() instanceof ResourcePayload)) return null;
        return ((ResourcePayload) converter.getPayload()).resourceKey;
    }
}
