package info.isaksson.erland.xamlmigrate.parse.structural;

import info.isaksson.erland.xamlmigrate.ast.PropertyKind;
import info.isaksson.erland.xamlmigrate.ast.PropertyValueKind;
import info.isaksson.erland.xamlmigrate.ast.XamlComment;
import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;
import info.isaksson.erland.xamlmigrate.ast.visit.VisitResult;
import info.isaksson.erland.xamlmigrate.ast.visit.XamlVisitor;
import info.isaksson.erland.xamlmigrate.ast.visit.XamlWalker;
import info.isaksson.erland.xamlmigrate.diagnostics.Diagnostic;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticSeverity;
import info.isaksson.erland.xamlmigrate.parse.PositionIndex;
import info.isaksson.erland.xamlmigrate.parse.WhitespaceExtractor;
import info.isaksson.erland.xamlmigrate.parse.xml.StructuralXmlReader;
import info.isaksson.erland.xamlmigrate.parse.xml.XmlDocumentNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StructuralConverterTest {

    private static final String NS = "xmlns=\"http://schemas.microsoft.com/winfx/2006/xaml/presentation\" "
            + "xmlns:x=\"http://schemas.microsoft.com/winfx/2006/xaml\"";

    private static XamlDocument convert(String text) throws Exception {
        XmlDocumentNode xml = new StructuralXmlReader().read(text);
        return new StructuralConverter().convert(xml, new WhitespaceExtractor(new PositionIndex(text)), "Test.xaml");
    }

    @Test
    void directivesAndNamespaceDeclarationsAreNotProperties() throws Exception {
        XamlDocument doc = convert("<Window x:Class=\"App.Main\" " + NS + " Title=\"T\"><Button x:Name=\"ok\" Content=\"OK\"/></Window>");
        XamlElement window = doc.getRoot();

        assertEquals("App.Main", window.getXClass());
        assertEquals(1, window.getProperties().size());
        assertEquals("Title", window.getProperties().get(0).getName());
        assertEquals(2, window.getNamespaceDeclarations().size());
        assertEquals(List.of("x:Class", "xmlns", "xmlns:x"), window.getHeaderOrder());

        XamlElement button = window.getChildren().get(0);
        assertEquals("ok", button.getXName());
        assertEquals(1, button.getProperties().size());
        assertSame(button, doc.getSymbolTable().findNamed("ok"));
        assertEquals("x", doc.languagePrefix());
    }

    @Test
    void dottedAttributesBecomeAttachedPropertiesWithOwner() throws Exception {
        XamlDocument doc = convert("<Grid " + NS + "><Button Grid.Row=\"1\" DockPanel.Dock=\"Top\" Width=\"10\"/></Grid>");
        XamlElement button = doc.getRoot().getChildren().get(0);

        XamlProperty row = button.findAttachedProperty("Grid", "Row");
        assertNotNull(row);
        assertEquals(PropertyKind.ATTACHED_PROPERTY, row.getPropertyKind());
        assertEquals("1", row.getLiteralValue());
        assertEquals("Grid.Row", row.writtenName());
        assertEquals(PropertyKind.ATTRIBUTE, button.findProperty("Width").getPropertyKind());

        XamlWalker.walk(doc, new XamlVisitor() {
            @Override
            public VisitResult visitProperty(XamlProperty property) {
                if (property.isAttached()) {
                    assertNotNull(property.getAttachedOwnerType(), property.toString());
                }
                return VisitResult.CONTINUE;
            }
        });
    }

    @Test
    void propertyElementsHoldSingleValueOrSyntheticCollection() throws Exception {
        XamlDocument doc = convert("<Grid " + NS + ">"
                + "<Grid.RowDefinitions><RowDefinition Height=\"Auto\"/><RowDefinition/></Grid.RowDefinitions>"
                + "<Grid.Tag><Button/></Grid.Tag>"
                + "<Grid.ToolTip>Tip</Grid.ToolTip>"
                + "<TextBlock>Hello</TextBlock>"
                + "</Grid>");
        XamlElement grid = doc.getRoot();

        List<XamlProperty> propertyElements = grid.propertyElements();
        assertEquals(3, propertyElements.size());

        XamlProperty rows = propertyElements.get(0);
        assertEquals("RowDefinitions", rows.getName());
        assertEquals("Grid", rows.getAttachedOwnerType());
        XamlElement collection = rows.getElementValue();
        assertTrue(collection.isSynthetic());
        assertEquals(2, collection.getChildren().size());

        XamlElement tag = propertyElements.get(1).getElementValue();
        assertFalse(tag.isSynthetic());
        assertEquals("Button", tag.getTypeName());

        assertEquals(PropertyValueKind.LITERAL, propertyElements.get(2).valueKind());
        assertEquals("Tip", propertyElements.get(2).getLiteralValue());

        assertEquals(1, grid.getChildren().size());
        assertEquals("Hello", grid.getChildren().get(0).getTextContent());
    }

    @Test
    void nestedMarkupExtensionIsParsedAndPrintsBackIdentically() throws Exception {
        String value = "{Binding Path=Value, Converter={StaticResource MyConverter}}";
        XamlDocument doc = convert("<TextBlock " + NS + " Text=\"" + value + "\"/>");
        XamlProperty text = doc.getRoot().findProperty("Text");

        assertEquals(PropertyValueKind.MARKUP_EXTENSION, text.valueKind());
        XamlMarkupExtension binding = text.getMarkupExtension();
        assertEquals("Binding", binding.getName());
        assertTrue(binding.getNamedParameter("Converter").isExtension());
        assertEquals("StaticResource", binding.getNamedParameter("Converter").getExtension().getName());
        assertEquals(value, binding.toMarkupString());
        assertEquals(value, text.getHints().originalText);
    }

    @Test
    void invalidMarkupExtensionIsKeptAsLiteralWithWarning() throws Exception {
        XamlDocument doc = convert("<TextBlock " + NS + " Text=\"{Binding Path=A, Path=B}\"/>");
        XamlProperty text = doc.getRoot().findProperty("Text");

        assertEquals(PropertyValueKind.LITERAL, text.valueKind());
        assertEquals("{Binding Path=A, Path=B}", text.getLiteralValue());
        assertEquals(1, doc.getDiagnostics().byCode(DiagnosticCodes.MARKUP_EXTENSION_SYNTAX).size());
    }

    @Test
    void escapedBraceLiteralIsNotAnExtension() throws Exception {
        XamlDocument doc = convert("<TextBlock " + NS + " Text=\"{}{0} items\"/>");
        XamlProperty text = doc.getRoot().findProperty("Text");
        assertEquals(PropertyValueKind.LITERAL, text.valueKind());
        assertEquals("{}{0} items", text.getLiteralValue());
    }

    @Test
    void commentsAnchorToContentSlots() throws Exception {
        XamlDocument doc = convert("<StackPanel " + NS + "><!-- first --><Button/><!-- second --></StackPanel>");
        List<XamlComment> comments = doc.getRoot().getComments();

        assertEquals(2, comments.size());
        assertEquals(" first ", comments.get(0).getText());
        assertEquals(0, comments.get(0).getAnchorIndex());
        assertEquals(1, comments.get(1).getAnchorIndex());
        assertTrue(comments.get(0).isPreserve());
    }

    @Test
    void textAroundChildElementsIsReported() throws Exception {
        XamlDocument doc = convert("<TextBlock " + NS + ">Hello <Run Text=\"x\"/> world</TextBlock>");

        assertEquals("Hello  world", doc.getRoot().getTextContent());
        assertEquals(1, doc.getRoot().getChildren().size());
        List<Diagnostic> ambiguous = doc.getDiagnostics().byCode(DiagnosticCodes.CONTENT_AMBIGUOUS);
        assertEquals(1, ambiguous.size());
        assertEquals(DiagnosticSeverity.INFO, ambiguous.get(0).severity);
        assertEquals(1, ambiguous.get(0).line);

        XamlDocument commented = convert("<TextBlock " + NS + ">Hello <!-- note --></TextBlock>");
        assertTrue(commented.getDiagnostics().byCode(DiagnosticCodes.CONTENT_AMBIGUOUS).isEmpty());
    }

    @Test
    void duplicateNamesAreReported() throws Exception {
        XamlDocument doc = convert("<StackPanel " + NS + "><Button x:Name=\"a\"/><Button x:Name=\"a\"/></StackPanel>");
        assertEquals(1, doc.getDiagnostics().byCode(DiagnosticCodes.DUPLICATE_NAME).size());
        assertSame(doc.getRoot().getChildren().get(0), doc.getSymbolTable().findNamed("a"));
    }

    @Test
    void locationsPointAtTagNames() throws Exception {
        XamlDocument doc = convert("<Grid " + NS + ">\n    <Button Width=\"1\"/>\n</Grid>");
        XamlElement button = doc.getRoot().getChildren().get(0);
        assertEquals(2, button.getLocation().line);
        assertEquals(6, button.getLocation().column);
        assertEquals("Test.xaml", button.getLocation().filePath);
        assertEquals("\n    ", button.getHints().leadingWhitespace);
        assertEquals(2, button.findProperty("Width").getLocation().line);
    }
}
