package info.isaksson.erland.xamlmigrate.semantic;

import info.isaksson.erland.xamlmigrate.ast.XamlDirective;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticSeverity;
import info.isaksson.erland.xamlmigrate.types.CatalogTypeSystem;
import info.isaksson.erland.xamlmigrate.types.TypeResolutionPolicy;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class SemanticParserTest {

    private static final String NS = "xmlns=\"http://schemas.microsoft.com/winfx/2006/xaml/presentation\" "
            + "xmlns:x=\"http://schemas.microsoft.com/winfx/2006/xaml\"";

    static String fixture(String name) throws IOException {
        try (InputStream in = SemanticParserTest.class.getClassLoader().getResourceAsStream("xaml/" + name)) {
            assertNotNull(in, name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static SemanticParser lenient() {
        return new SemanticParser(CatalogTypeSystem.defaults(), TypeResolutionPolicy.LENIENT);
    }

    @Test
    void resolvesTypesMembersAndMarkupExtensions() throws Exception {
        SemanticDocument sem = lenient().parse(fixture("MainWindow.xaml"), "MainWindow.xaml");
        SemanticObject window = sem.getRoot();

        assertEquals("Window", window.getTypeName());
        assertEquals("System.Windows.Window", window.getResolvedType().fullName);
        assertEquals("Sample.MainWindow", window.getDirectives().get(XamlDirective.CLASS));
        assertEquals(3, window.getNamespaceDeclarations().size());
        assertEquals("clr-namespace:Sample", window.getNamespaceDeclarations().get("local"));

        SemanticMember resources = window.findMember("Resources");
        assertTrue(resources.isPropertyElement());
        assertFalse(resources.isAttached());
        assertEquals("Window", resources.getOwnerTypeName());
        assertEquals("System.Windows.FrameworkElement", resources.getResolvedProperty().declaringTypeName);
        assertEquals("UpperCaseConverter", resources.singleObject().getTypeName());
        assertNull(resources.singleObject().getResolvedType());

        SemanticObject grid = window.getChildren().get(0);
        assertEquals(2, grid.getChildren().size());
        assertEquals(2, grid.findMember("RowDefinitions").getObjectValues().size());

        SemanticObject textBlock = grid.getChildren().get(0);
        SemanticMember row = textBlock.findMember("Row");
        assertTrue(row.isAttached());
        assertEquals("Grid", row.getOwnerTypeName());
        assertTrue(row.getResolvedProperty().attached);

        SemanticObject binding = textBlock.findMember("Text").singleObject();
        assertTrue(binding.isMarkupExtension());
        assertEquals("BindingExtension", binding.getTypeName());
        assertEquals("Binding", binding.getWrittenName());
        assertEquals("System.Windows.Data.Binding", binding.getResolvedType().fullName);
        assertEquals("Title", binding.findMember("Path").getTextValue());
        SemanticObject converter = binding.findMember("Converter").singleObject();
        assertEquals("StaticResourceExtension", converter.getTypeName());
        assertEquals("Upper", converter.findMember(SemanticMember.POSITIONAL).getTextValue());
        assertNotNull(converter.getResolvedType());
    }

    @Test
    void typesOutsideCoveredNamespacesAreInfoOnly() throws Exception {
        SemanticDocument sem = lenient().parse(fixture("MainWindow.xaml"), "MainWindow.xaml");

        assertEquals(1, sem.getDiagnostics().byCode(DiagnosticCodes.TYPE_UNRESOLVED).size());
        assertEquals(DiagnosticSeverity.INFO, sem.getDiagnostics().byCode(DiagnosticCodes.TYPE_UNRESOLVED).get(0).severity);
        assertTrue(sem.getDiagnostics().bySeverity(DiagnosticSeverity.WARNING).isEmpty());
    }

    @Test
    void unknownTypeInCoveredNamespaceFollowsPolicy() throws Exception {
        String text = "<Window " + NS + "><FancyPanel/></Window>";

        SemanticDocument sem = lenient().parse(text, "V.xaml");
        assertEquals(1, sem.getDiagnostics().bySeverity(DiagnosticSeverity.WARNING).size());
        assertNull(sem.getRoot().getChildren().get(0).getResolvedType());

        SemanticParser strict = new SemanticParser(CatalogTypeSystem.defaults(), TypeResolutionPolicy.STRICT);
        SemanticParseException ex = assertThrows(SemanticParseException.class, () -> strict.parse(text, "V.xaml"));
        assertTrue(ex.getMessage().contains("FancyPanel"));
    }

    @Test
    void unresolvedMembersAreReportedOnlyWhenAskedFor() throws Exception {
        String text = "<Button " + NS + " Foo=\"1\" Width=\"2\"/>";

        assertTrue(lenient().parse(text, "V.xaml").getDiagnostics().isEmpty());

        SemanticParser reporting = new SemanticParser(CatalogTypeSystem.defaults(), TypeResolutionPolicy.LENIENT, true);
        SemanticDocument sem = reporting.parse(text, "V.xaml");
        assertEquals(1, sem.getDiagnostics().byCode(DiagnosticCodes.PROPERTY_UNRESOLVED).size());
        assertTrue(sem.getDiagnostics().byCode(DiagnosticCodes.PROPERTY_UNRESOLVED).get(0).message.contains("Foo"));
    }

    @Test
    void malformedAndDoctypeInputIsRejected() {
        assertThrows(SemanticParseException.class, () -> lenient().parse("<Window><Button></Window>", "V.xaml"));
        assertThrows(SemanticParseException.class,
                () -> lenient().parse("<!DOCTYPE Window [<!ENTITY e \"x\">]><Window>&e;</Window>", "V.xaml"));
    }

    @Test
    void markupSyntaxErrorsFallBackToText() throws Exception {
        SemanticDocument sem = lenient().parse("<TextBlock " + NS + " Text=\"{Binding Path=A, Path=B}\"/>", "V.xaml");
        SemanticMember text = sem.getRoot().findMember("Text");
        assertEquals("{Binding Path=A, Path=B}", text.getTextValue());
        assertTrue(text.getObjectValues().isEmpty());
    }
}
