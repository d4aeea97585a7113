package info.isaksson.erland.xamlmigrate.transform.rules;

import info.isaksson.erland.xamlmigrate.ast.PropertyValueKind;
import info.isaksson.erland.xamlmigrate.ast.SourceLocation;
import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlNamespaces;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;
import info.isaksson.erland.xamlmigrate.ast.XamlPropertyDescriptor;
import info.isaksson.erland.xamlmigrate.ast.XamlTypeDescriptor;
import info.isaksson.erland.xamlmigrate.ast.markup.MarkupExtensionParser;
import info.isaksson.erland.xamlmigrate.diagnostics.Diagnostic;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticSeverity;
import info.isaksson.erland.xamlmigrate.mapping.MappingJson;
import info.isaksson.erland.xamlmigrate.mapping.MappingRepository;
import info.isaksson.erland.xamlmigrate.transform.RulePass;
import info.isaksson.erland.xamlmigrate.transform.TransformationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BuiltInRulesTest {

    private static final String WPF = XamlNamespaces.WPF_PRESENTATION;
    private static final String BLEND = "http://schemas.microsoft.com/expression/blend/2008";

    private XamlDocument doc;
    private XamlElement window;
    private XamlElement textBlock;
    private XamlElement button;
    private XamlElement gauge;
    private XamlElement frobnicator;
    private XamlElement border;
    private XamlElement style;
    private TransformationContext ctx;

    private static XamlElement wpf(String type, int line) {
        XamlElement e = new XamlElement(type, WPF);
        e.setLocation(new SourceLocation("MainWindow.xaml", line, 5));
        return e;
    }

    private static XamlProperty event(String name, String handler, String declaringType) {
        XamlProperty p = XamlProperty.attribute(name, handler);
        p.setResolvedProperty(new XamlPropertyDescriptor(name, declaringType, null, false, true));
        return p;
    }

    @BeforeEach
    void transform() throws Exception {
        doc = new XamlDocument("MainWindow.xaml");
        window = wpf("Window", 1);
        window.declareNamespace("", WPF);
        window.declareNamespace("x", XamlNamespaces.XAML_LANGUAGE);
        window.declareNamespace("d", BLEND);
        window.declareNamespace("local", "clr-namespace:Demo");
        window.setResolvedType(new XamlTypeDescriptor("Window", WPF, "System.Windows.Window",
                "System.Windows.Controls.ContentControl", "Content", false));
        XamlProperty title = XamlProperty.attribute("Title", "Demo");
        title.setResolvedProperty(new XamlPropertyDescriptor("Title", "System.Windows.Window", "System.String",
                false, false));
        window.addProperty(title);
        window.addProperty(XamlProperty.attribute("WindowStyle", "ToolWindow"));
        window.addProperty(XamlProperty.attribute("ResizeMode", "CanResizeWithGrip"));
        doc.setRoot(window);

        XamlElement panel = wpf("StackPanel", 2);
        window.addChild(panel);

        textBlock = wpf("TextBlock", 3);
        textBlock.addProperty(XamlProperty.attribute("Visibility", "Collapsed"));
        textBlock.addProperty(XamlProperty.attribute("ToolTip", "hint"));
        panel.addChild(textBlock);

        button = wpf("Button", 4);
        button.addProperty(event("Click", "OnOk", "System.Windows.Controls.Primitives.ButtonBase"));
        button.addProperty(event("MouseLeftButtonDown", "OnDown", "System.Windows.UIElement"));
        XamlProperty bound = XamlProperty.attribute("Visibility", null);
        bound.setMarkupExtension(MarkupExtensionParser.parse("{Binding IsShown}"));
        button.addProperty(bound);
        panel.addChild(button);

        gauge = new XamlElement("Gauge", "clr-namespace:Demo");
        gauge.setPrefix("local");
        panel.addChild(gauge);

        frobnicator = wpf("Frobnicator", 6);
        panel.addChild(frobnicator);

        border = wpf("Border", 7);
        border.setResolvedType(new XamlTypeDescriptor("Border", WPF, "System.Windows.Controls.Border",
                "System.Windows.FrameworkElement", "Child", false));
        XamlProperty background = XamlProperty.attribute("Background", null);
        background.setMarkupExtension(MarkupExtensionParser.parse("{DynamicResource {x:Static SystemColors.WindowBrushKey}}"));
        background.setResolvedProperty(new XamlPropertyDescriptor("Background", "System.Windows.Controls.Border",
                "System.Windows.Media.Brush", false, false));
        border.addProperty(background);
        border.addProperty(XamlProperty.attribute("Glow", "On"));
        panel.addChild(border);

        style = wpf("Style", 8);
        XamlProperty target = XamlProperty.attribute("TargetType", null);
        target.setMarkupExtension(MarkupExtensionParser.parse("{x:Type Button}"));
        style.addProperty(target);
        panel.addChild(style);

        MappingRepository repo = MappingJson.loadDefaults();
        ctx = BuiltInRules.defaultEngine().transform(doc, repo);
    }

    private List<Diagnostic> codes(String code) {
        return doc.getDiagnostics().byCode(code);
    }

    @Test
    void presentationNamespaceMovesToTarget() {
        assertEquals(XamlNamespaces.AVALONIA, window.getNamespaceDeclarations().get(""));
        assertEquals(XamlNamespaces.XAML_LANGUAGE, window.getNamespaceDeclarations().get("x"));
        assertEquals(BLEND, window.getNamespaceDeclarations().get("d"));
        assertEquals("clr-namespace:Demo", window.getNamespaceDeclarations().get("local"));
        assertEquals(XamlNamespaces.AVALONIA, window.getNamespaceUri());
        assertEquals(XamlNamespaces.AVALONIA, textBlock.getNamespaceUri());
        assertEquals("clr-namespace:Demo", gauge.getNamespaceUri());
        assertTrue(codes(DiagnosticCodes.NAMESPACE_MAPPING_NOT_FOUND).isEmpty());
        assertEquals(WPF, TransformationContext.sourceNamespaceOf(textBlock));
    }

    @Test
    void windowChromePropertiesAreConverted() {
        assertEquals("BorderOnly", window.findProperty("SystemDecorations").getLiteralValue());
        assertEquals("True", window.findProperty("CanResize").getLiteralValue());
        assertNull(window.findProperty("WindowStyle"));
        assertEquals("Demo", window.findProperty("Title").getLiteralValue());
        assertEquals("WindowStyle", window.findProperty("SystemDecorations").getMetadata()
                .get(TransformationContext.SOURCE_PROPERTY_NAME));
    }

    @Test
    void convertedChromePropertiesAreNotLookedUpAgain() {
        assertTrue(codes(DiagnosticCodes.PROPERTY_MAPPING_NOT_FOUND).stream()
                .noneMatch(d -> d.message.contains("SystemDecorations") || d.message.contains("CanResize")));
    }

    @Test
    void literalVisibilityBecomesIsVisible() {
        XamlProperty p = textBlock.findProperty("IsVisible");
        assertNotNull(p);
        assertEquals("False", p.getLiteralValue());
        assertNull(textBlock.findProperty("Visibility"));
    }

    @Test
    void toolTipBecomesAttachedProperty() {
        XamlProperty tip = textBlock.findAttachedProperty("ToolTip", "Tip");
        assertNotNull(tip);
        assertEquals("ToolTip.Tip", tip.writtenName());
        assertEquals("hint", tip.getLiteralValue());
    }

    @Test
    void boundVisibilityIsRenamedAndFlagged() {
        XamlProperty p = button.findProperty("IsVisible");
        assertNotNull(p);
        assertEquals(PropertyValueKind.MARKUP_EXTENSION, p.valueKind());
        List<Diagnostic> changed = codes(DiagnosticCodes.PROPERTY_TYPE_CHANGED);
        assertEquals(1, changed.size());
        assertEquals(DiagnosticSeverity.WARNING, changed.get(0).severity);
        assertEquals(Integer.valueOf(4), changed.get(0).line);
    }

    @Test
    void eventsFollowEventMappings() {
        assertEquals("OnOk", button.findProperty("Click").getLiteralValue());
        assertEquals("OnDown", button.findProperty("PointerPressed").getLiteralValue());
        assertEquals(1, codes(DiagnosticCodes.EVENT_REQUIRES_MANUAL_REVIEW).size());
        assertTrue(codes(DiagnosticCodes.EVENT_MAPPING_NOT_FOUND).isEmpty());
    }

    @Test
    void unmappedFrameworkTypeIsKeptAndReported() {
        assertEquals("Frobnicator", frobnicator.getTypeName());
        List<Diagnostic> missing = codes(DiagnosticCodes.TYPE_MAPPING_NOT_FOUND);
        assertEquals(1, missing.size());
        assertEquals(DiagnosticSeverity.INFO, missing.get(0).severity);
        assertTrue(missing.get(0).message.contains("Frobnicator"));
    }

    @Test
    void reviewTypesAndExtensionsProduceWarnings() {
        assertEquals(1, codes(DiagnosticCodes.TYPE_REQUIRES_MANUAL_REVIEW).size());
        // DynamicResource with a system key, and the framework x:Static inside it
        assertEquals(2, codes(DiagnosticCodes.MARKUP_EXTENSION_REVIEW).size());
        assertEquals("{x:Type Button}", style.findProperty("TargetType").getMarkupExtension().toMarkupString());
    }

    @Test
    void unresolvedPropertyOnResolvedElementIsReported() {
        List<Diagnostic> missing = codes(DiagnosticCodes.PROPERTY_MAPPING_NOT_FOUND);
        assertEquals(1, missing.size());
        assertTrue(missing.get(0).message.contains("Glow"));
    }

    @Test
    void traceRecordsBothPasses() {
        assertTrue(ctx.getTrace().stream().anyMatch(r -> BuiltInRules.NAMESPACES_PASS.equals(r.passName)));
        assertTrue(ctx.getTrace().stream().anyMatch(r -> BuiltInRules.MEMBERS_PASS.equals(r.passName)
                && "VisibilityToIsVisible".equals(r.ruleName)));
        assertFalse(doc.getDiagnostics().hasErrors());
    }

    @Test
    void defaultRuleSetRunsNamespacesFirst() {
        List<RulePass> passes = BuiltInRules.defaultRuleSet();

        assertEquals(2, passes.size());
        assertEquals(BuiltInRules.NAMESPACES_PASS, passes.get(0).name);
        assertEquals("Window", ((SimpleTypeRenameRule) passes.get(1).elementRules().get(0)).getSourceTypeName());
    }
}
