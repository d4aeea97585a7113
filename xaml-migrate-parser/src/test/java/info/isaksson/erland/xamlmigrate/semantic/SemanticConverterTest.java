package info.isaksson.erland.xamlmigrate.semantic;

import info.isaksson.erland.xamlmigrate.ast.PropertyValueKind;
import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.parse.PositionIndex;
import info.isaksson.erland.xamlmigrate.parse.WhitespaceExtractor;
import info.isaksson.erland.xamlmigrate.parse.structural.StructuralConverter;
import info.isaksson.erland.xamlmigrate.parse.xml.StructuralXmlReader;
import info.isaksson.erland.xamlmigrate.types.CatalogTypeSystem;
import info.isaksson.erland.xamlmigrate.types.TypeResolutionPolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SemanticConverterTest {

    private static XamlDocument structural(String text) throws Exception {
        return new StructuralConverter().convert(new StructuralXmlReader().read(text),
                new WhitespaceExtractor(new PositionIndex(text)), "MainWindow.xaml");
    }

    private static SemanticDocument semantic(String text) throws Exception {
        return new SemanticParser(CatalogTypeSystem.defaults(), TypeResolutionPolicy.LENIENT).parse(text, "MainWindow.xaml");
    }

    private static XamlElement grid(XamlDocument doc) {
        return doc.getRoot().getChildren().get(0);
    }

    @Test
    void enrichmentAttachesTypesAndMembersInPlace() throws Exception {
        String text = SemanticParserTest.fixture("MainWindow.xaml");
        XamlDocument doc = structural(text);
        XamlElement textBlock = grid(doc).getChildren().get(0);
        XamlMarkupExtension binding = textBlock.findProperty("Text").getMarkupExtension();
        int propertyCount = textBlock.getProperties().size();

        int typed = new SemanticConverter().enrich(doc, semantic(text));

        assertTrue(typed >= 8, "typed " + typed);
        assertEquals("System.Windows.Window", doc.getRoot().getResolvedType().fullName);
        assertEquals("System.Windows.Controls.TextBlock", textBlock.fullTypeName());
        assertEquals(propertyCount, textBlock.getProperties().size());
        assertTrue(textBlock.findAttachedProperty("Grid", "Row").getResolvedProperty().attached);

        // the structural extension is augmented, not replaced
        assertSame(binding, textBlock.findProperty("Text").getMarkupExtension());
        assertEquals("System.Windows.Data.Binding", binding.getResolvedType().fullName);
        assertEquals(2, binding.getNamedParameters().size());
        assertEquals("StaticResourceExtension", binding.getNamedParameter("Converter").getExtension().getResolvedType().name);

        XamlElement rows = grid(doc).propertyElements().get(0).getElementValue();
        assertTrue(rows.isSynthetic());
        for (XamlElement row : rows.getChildren()) {
            assertEquals("System.Windows.Controls.RowDefinition", row.fullTypeName());
        }

        XamlElement button = grid(doc).getChildren().get(1).getChildren().get(0);
        assertTrue(button.findProperty("Click").getResolvedProperty().event);
        assertTrue(doc.getDiagnostics().byCode(DiagnosticCodes.ENRICHMENT_CHILD_COUNT_MISMATCH).isEmpty());
    }

    @Test
    void childCountMismatchIsReportedAndSkipped() throws Exception {
        String text = SemanticParserTest.fixture("MainWindow.xaml");
        XamlDocument doc = structural(text);
        XamlElement stackPanel = grid(doc).getChildren().get(1);
        stackPanel.removeChild(stackPanel.getChildren().get(1));

        new SemanticConverter().enrich(doc, semantic(text));

        assertEquals(1, doc.getDiagnostics().byCode(DiagnosticCodes.ENRICHMENT_CHILD_COUNT_MISMATCH).size());
        assertNotNull(stackPanel.getResolvedType());
        assertNull(stackPanel.getChildren().get(0).getResolvedType());
    }

    @Test
    void missingPropertyIsCreatedFromSemanticView() throws Exception {
        String text = SemanticParserTest.fixture("MainWindow.xaml");
        XamlDocument doc = structural(text);
        XamlElement stackPanel = grid(doc).getChildren().get(1);
        stackPanel.removeProperty(stackPanel.findProperty("Orientation"));

        new SemanticConverter().enrich(doc, semantic(text));

        XamlProperty orientation = stackPanel.findProperty("Orientation");
        assertNotNull(orientation);
        assertEquals("Horizontal", orientation.getLiteralValue());
        assertNotNull(orientation.getResolvedProperty());
        assertEquals(1, stackPanel.getProperties().stream().filter(p -> p.getName().equals("Orientation")).count());
    }

    @Test
    void freshConversionBuildsTreeWithoutFormatting() throws Exception {
        XamlDocument doc = new SemanticConverter().convert(semantic(SemanticParserTest.fixture("MainWindow.xaml")));

        XamlElement window = doc.getRoot();
        assertEquals("Window", window.getTypeName());
        assertEquals("Sample.MainWindow", window.getXClass());
        assertNotNull(window.getResolvedType());
        assertEquals("local", window.getProperties().stream()
                .filter(XamlProperty::isPropertyElement).findFirst().orElseThrow()
                .getElementValue().getPrefix());

        XamlElement textBlock = grid(doc).getChildren().get(0);
        XamlProperty textProp = textBlock.findProperty("Text");
        assertEquals(PropertyValueKind.MARKUP_EXTENSION, textProp.valueKind());
        assertEquals("{Binding Path=Title, Converter={StaticResource Upper}}", textProp.getMarkupExtension().toMarkupString());
        assertNotNull(textProp.getMarkupExtension().getResolvedType());

        assertSame(grid(doc).getChildren().get(1).getChildren().get(0), doc.getSymbolTable().findNamed("okButton"));
    }
}
