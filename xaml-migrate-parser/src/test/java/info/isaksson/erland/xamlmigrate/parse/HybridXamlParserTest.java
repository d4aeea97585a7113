package info.isaksson.erland.xamlmigrate.parse;

import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.diagnostics.Diagnostic;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticSeverity;
import info.isaksson.erland.xamlmigrate.types.TypeResolutionPolicy;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class HybridXamlParserTest {

    private static final String NS = "xmlns=\"http://schemas.microsoft.com/winfx/2006/xaml/presentation\"";

    private static String mainWindow() throws IOException {
        try (InputStream in = HybridXamlParserTest.class.getClassLoader().getResourceAsStream("xaml/MainWindow.xaml")) {
            assertNotNull(in);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void emptyTextFailsWithoutDocument() {
        HybridParseResult r = new HybridXamlParser().parse("  \n", "Empty.xaml");

        assertFalse(r.isSuccess());
        assertEquals(ParseState.FAILED, r.state);
        assertEquals(DiagnosticCodes.XML_EMPTY, r.diagnostics.all().get(0).code);
    }

    @Test
    void malformedMarkupReportsErrorWithLocation() {
        HybridParseResult r = new HybridXamlParser().parse("<Window>\n  <Button>\n</Window>", "Broken.xaml");

        assertNull(r.document);
        assertEquals(ParseState.FAILED, r.state);
        Diagnostic d = r.diagnostics.byCode(DiagnosticCodes.XML_PARSE_ERROR).get(0);
        assertEquals(DiagnosticSeverity.ERROR, d.severity);
        assertEquals("Broken.xaml", d.filePath);
        assertNotNull(d.line);
        assertNotNull(d.column);
    }

    @Test
    void wellFormedDocumentIsEnriched() throws Exception {
        HybridParseResult r = new HybridXamlParser().parse(mainWindow(), "MainWindow.xaml");

        assertTrue(r.isSemanticallyEnriched());
        assertEquals(ParseState.DONE, r.state);
        assertFalse(r.diagnostics.hasErrors());
        assertTrue(r.diagnostics.bySeverity(DiagnosticSeverity.WARNING).isEmpty(), r.diagnostics.all().toString());

        XamlElement root = r.document.getRoot();
        assertEquals("System.Windows.Window", root.fullTypeName());
        assertEquals("Sample.MainWindow", root.getXClass());
        assertNotNull(r.document.getDeclaration());
        assertEquals(1, r.document.getLeadingComments().size());
        XamlElement ok = r.document.getSymbolTable().findNamed("okButton");
        assertEquals("System.Windows.Controls.Button", ok.fullTypeName());
        assertEquals('\'', ok.findProperty("Width").getHints().quoteChar);
    }

    @Test
    void strictSemanticFailureDegradesToStructuralTree() {
        HybridParserOptions options = new HybridParserOptions();
        options.typeResolutionPolicy = TypeResolutionPolicy.STRICT;
        HybridParseResult r = new HybridXamlParser(options).parse("<Window " + NS + "><FancyPanel/></Window>", "V.xaml");

        assertTrue(r.isSuccess());
        assertEquals(ParseState.STRUCTURAL_ONLY, r.state);
        assertEquals(DiagnosticSeverity.WARNING, r.diagnostics.byCode(DiagnosticCodes.SEMANTIC_PARSE_FAILED).get(0).severity);
        assertEquals("FancyPanel", r.document.getRoot().getChildren().get(0).getTypeName());
        assertNull(r.document.getRoot().getResolvedType());
    }

    @Test
    void doctypeIsSkippedBySemanticLayer() {
        HybridParseResult r = new HybridXamlParser().parse("<!DOCTYPE Window><Window " + NS + "/>", "D.xaml");

        assertTrue(r.isSuccess());
        assertEquals(ParseState.STRUCTURAL_ONLY, r.state);
        assertEquals(1, r.diagnostics.byCode(DiagnosticCodes.SEMANTIC_PARSE_FAILED).size());
    }

    @Test
    void disabledSemanticLayerYieldsStructuralOnlyInfo() {
        HybridParserOptions options = new HybridParserOptions();
        options.enableSemanticLayer = false;
        HybridParseResult r = new HybridXamlParser(options).parse("<Window " + NS + "><Button/></Window>", "V.xaml");

        assertEquals(ParseState.STRUCTURAL_ONLY, r.state);
        assertEquals(DiagnosticSeverity.INFO, r.diagnostics.byCode(DiagnosticCodes.STRUCTURAL_ONLY).get(0).severity);
        assertNull(r.document.getRoot().getResolvedType());
    }

    @Test
    void batchKeepsInputOrderAndIsolatesFailures() {
        Map<String, String> input = new LinkedHashMap<>();
        input.put("b.xaml", "<Button " + NS + "/>");
        input.put("a.xaml", "<Window");
        input.put("c.xaml", "<Grid " + NS + "/>");

        Map<String, HybridParseResult> out = new HybridXamlParser().parseBatch(input);

        assertEquals(List.of("b.xaml", "a.xaml", "c.xaml"), new ArrayList<>(out.keySet()));
        assertTrue(out.get("b.xaml").isSemanticallyEnriched());
        assertFalse(out.get("a.xaml").isSuccess());
        assertTrue(out.get("c.xaml").isSemanticallyEnriched());
    }
}
