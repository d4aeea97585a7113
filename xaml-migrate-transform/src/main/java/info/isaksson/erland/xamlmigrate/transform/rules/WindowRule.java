package info.isaksson.erland.xamlmigrate.transform.rules;

import info.isaksson.erland.xamlmigrate.ast.PropertyValueKind;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlNamespaces;
import info.isaksson.erland.xamlmigrate.ast.XamlNodeKind;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;
import info.isaksson.erland.xamlmigrate.transform.TransformationContext;

/**
 * Moves a presentation {@code Window} to the target framework and converts the window chrome properties:
 * {@code WindowStyle} becomes {@code SystemDecorations}, {@code ResizeMode} becomes the boolean
 * {@code CanResize}.
 */
public final class WindowRule extends SimpleTypeRenameRule {

    public WindowRule() {
        super("Window", "Window", XamlNamespaces.WPF_PRESENTATION, XamlNamespaces.AVALONIA, 100);
    }

    @Override
    protected void afterRename(XamlElement element, TransformationContext context) {
        for (XamlProperty p : element.attributeProperties()) {
            if (p.isAttached() || p.valueKind() != PropertyValueKind.LITERAL) continue;
            String value = p.getLiteralValue().trim();
            if ("WindowStyle".equals(p.getName())) {
                TransformationContext.rememberSource(p);
                p.setName("SystemDecorations");
                p.setLiteralValue(systemDecorations(value));
                context.recordTransformation(name(), XamlNodeKind.PROPERTY,
                        "WindowStyle='" + value + "' -> SystemDecorations='" + p.getLiteralValue() + "'");
            } else if ("ResizeMode".equals(p.getName())) {
                TransformationContext.rememberSource(p);
                p.setName("CanResize");
                p.setLiteralValue(canResize(value));
                context.recordTransformation(name(), XamlNodeKind.PROPERTY,
                        "ResizeMode='" + value + "' -> CanResize='" + p.getLiteralValue() + "'");
            }
        }
    }

    static String systemDecorations(String windowStyle) {
        switch (windowStyle) {
            case "None":
                return "None";
            case "ToolWindow":
                return "BorderOnly";
            default:
                return "Full";
        }
    }

    static String canResize(String resizeMode) {
        return "CanResize".equals(resizeMode) || "CanResizeWithGrip".equals(resizeMode) ? "True" : "False";
    }
}
