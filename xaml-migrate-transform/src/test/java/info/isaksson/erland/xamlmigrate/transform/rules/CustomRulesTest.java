package info.isaksson.erland.xamlmigrate.transform.rules;

import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlNamespaces;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;
import info.isaksson.erland.xamlmigrate.ast.markup.MarkupExtensionParser;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.mapping.DefaultMappingRepository;
import info.isaksson.erland.xamlmigrate.mapping.MappingDatabase;
import info.isaksson.erland.xamlmigrate.mapping.PropertyMapping;
import info.isaksson.erland.xamlmigrate.transform.TransformationContext;
import info.isaksson.erland.xamlmigrate.transform.TransformationEngine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CustomRulesTest {

    @Test
    void typeRenameCarriesPropertyElementOwners() {
        XamlDocument doc = new XamlDocument("a.xaml");
        XamlElement root = new XamlElement("Expander", XamlNamespaces.WPF_PRESENTATION);
        XamlProperty header = XamlProperty.propertyElement("Expander", "Header");
        header.setElementValue(new XamlElement("TextBlock"));
        root.addProperty(header);
        doc.setRoot(root);

        TransformationContext ctx = TransformationEngine.of(List.of(new SimpleTypeRenameRule("Expander", "Foldout")))
                .transform(doc, DefaultMappingRepository.empty());

        assertEquals("Foldout", root.getTypeName());
        assertEquals(XamlNamespaces.AVALONIA, root.getNamespaceUri());
        assertEquals("Foldout.Header", header.writtenName());
        assertEquals("Expander", TransformationContext.sourceTypeNameOf(root));
        assertEquals("RenameExpanderToFoldout", ctx.getTrace().get(0).ruleName);
    }

    @Test
    void ownerScopedPropertyRenameOnlyHitsThatOwner() {
        XamlDocument doc = new XamlDocument("a.xaml");
        XamlElement root = new XamlElement("StackPanel");
        XamlElement box = new XamlElement("TextBox");
        box.addProperty(XamlProperty.attribute("Text", "x"));
        XamlElement block = new XamlElement("TextBlock");
        block.addProperty(XamlProperty.attribute("Text", "y"));
        root.addChild(box);
        root.addChild(block);
        doc.setRoot(root);

        TransformationEngine.of(List.of(new PropertyRenameRule("Text", "Value", "TextBox", 0)))
                .transform(doc, DefaultMappingRepository.empty());

        assertNotNull(box.findProperty("Value"));
        assertNotNull(block.findProperty("Text"));
    }

    @Test
    void unknownVisibilityValueIsKeptWithWarning() {
        XamlDocument doc = new XamlDocument("a.xaml");
        XamlElement root = new XamlElement("Border");
        root.addProperty(XamlProperty.attribute("Visibility", "Sometimes"));
        doc.setRoot(root);

        TransformationEngine.of(List.of(new VisibilityRule())).transform(doc, DefaultMappingRepository.empty());

        assertEquals("Sometimes", root.findProperty("IsVisible").getLiteralValue());
        assertEquals(1, doc.getDiagnostics().byCode(DiagnosticCodes.VALUE_CONVERSION_FAILED).size());
    }

    @Test
    void mappedPropertyWithUnknownConversionWarns() {
        MappingDatabase db = MappingDatabase.builder()
                .property(new PropertyMapping("Stretch", "Stretch", null, "A", "B", true, false,
                        "NoSuchConversion", null, false))
                .build();
        XamlDocument doc = new XamlDocument("a.xaml");
        XamlElement root = new XamlElement("Image");
        root.addProperty(XamlProperty.attribute("Stretch", "Fill"));
        doc.setRoot(root);

        TransformationEngine.of(List.of(new MappedPropertyRule())).transform(doc, new DefaultMappingRepository(db));

        assertEquals("Fill", root.findProperty("Stretch").getLiteralValue());
        assertEquals(1, doc.getDiagnostics().byCode(DiagnosticCodes.VALUE_CONVERSION_FAILED).size());
    }

    @Test
    void typeExtensionFollowsRenamingTypeMapping() {
        MappingDatabase db = MappingDatabase.builder()
                .type("System.Windows.Controls.Label", "Avalonia.Controls.TextBlock")
                .build();
        XamlDocument doc = new XamlDocument("a.xaml");
        XamlElement root = new XamlElement("Style");
        XamlProperty framework = XamlProperty.attribute("TargetType", null);
        framework.setMarkupExtension(MarkupExtensionParser.parse("{x:Type Label}"));
        root.addProperty(framework);
        XamlProperty local = XamlProperty.attribute("Tag", null);
        local.setMarkupExtension(MarkupExtensionParser.parse("{x:Type local:Label}"));
        root.addProperty(local);
        doc.setRoot(root);

        TransformationEngine.of(List.of(new TypeExtensionRule())).transform(doc, new DefaultMappingRepository(db));

        assertEquals("{x:Type TextBlock}", framework.getMarkupExtension().toMarkupString());
        assertEquals("{x:Type local:Label}", local.getMarkupExtension().toMarkupString());
    }

    @Test
    void staticMemberOfProjectTypeIsNotFlagged() {
        XamlDocument doc = new XamlDocument("a.xaml");
        XamlElement root = new XamlElement("TextBlock");
        XamlProperty text = XamlProperty.attribute("Text", null);
        text.setMarkupExtension(MarkupExtensionParser.parse("{x:Static local:Constants.Title}"));
        root.addProperty(text);
        doc.setRoot(root);

        TransformationContext ctx = TransformationEngine.of(List.of(new StaticMemberExtensionRule()))
                .transform(doc, DefaultMappingRepository.empty());

        assertTrue(doc.getDiagnostics().isEmpty());
        assertEquals(1, ctx.transformationCount());
    }

    @Test
    void unmappedNamespaceIsReportedOnce() {
        XamlDocument doc = new XamlDocument("a.xaml");
        XamlElement root = new XamlElement("Panel", "urn:vendor");
        root.declareNamespace("", "urn:vendor");
        root.addChild(new XamlElement("Knob", "urn:vendor"));
        doc.setRoot(root);

        TransformationEngine.of(BuiltInRules.namespaceRules()).transform(doc, DefaultMappingRepository.empty());

        assertEquals(1, doc.getDiagnostics().byCode(DiagnosticCodes.NAMESPACE_MAPPING_NOT_FOUND).size());
        assertEquals("urn:vendor", root.getNamespaceUri());
    }
}
