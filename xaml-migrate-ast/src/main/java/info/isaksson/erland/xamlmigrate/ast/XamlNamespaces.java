package info.isaksson.erland.xamlmigrate.ast;

/** Well-known namespace identifiers. */
public final class XamlNamespaces {

    private XamlNamespaces() {}

    /** XAML language namespace that owns directives such as {@code x:Name}. */
    public static final String XAML_LANGUAGE = "http://schemas.microsoft.com/winfx/2006/xaml";

    /** Default presentation namespace of the source framework. */
    public static final String WPF_PRESENTATION = "http://schemas.microsoft.com/winfx/2006/xaml/presentation";

    /** Default namespace of the target framework. */
    public static final String AVALONIA = "https://github.com/avaloniaui";

    public static final String XML = "http://www.w3.org/XML/1998/namespace";
    public static final String XMLNS = "http://www.w3.org/2000/xmlns/";

    public static final String DEFAULT_LANGUAGE_PREFIX = "x";

    public static boolean isLanguageNamespace(String uri) {
        return XAML_LANGUAGE.equals(uri);
    }
}
