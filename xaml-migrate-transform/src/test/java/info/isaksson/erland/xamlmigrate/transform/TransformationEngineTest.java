package info.isaksson.erland.xamlmigrate.transform;

import info.isaksson.erland.xamlmigrate.ast.SourceLocation;
import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlNodeKind;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;
import info.isaksson.erland.xamlmigrate.diagnostics.Diagnostic;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticSeverity;
import info.isaksson.erland.xamlmigrate.mapping.DefaultMappingRepository;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransformationEngineTest {

    private static XamlDocument sample() {
        XamlDocument doc = new XamlDocument("Sample.xaml");
        XamlElement root = new XamlElement("StackPanel");
        root.setLocation(new SourceLocation("Sample.xaml", 1, 1));
        XamlElement a = new XamlElement("TextBlock");
        a.setLocation(new SourceLocation("Sample.xaml", 2, 5));
        a.addProperty(XamlProperty.attribute("Text", "a"));
        XamlElement b = new XamlElement("Button");
        b.setLocation(new SourceLocation("Sample.xaml", 3, 5));
        root.addChild(a);
        root.addChild(b);
        doc.setRoot(root);
        return doc;
    }

    /** Renames every element of one type and records it. */
    private static ElementRule rename(String ruleName, int priority, String from, String to) {
        return new ElementRule() {
            @Override
            public String name() {
                return ruleName;
            }

            @Override
            public int priority() {
                return priority;
            }

            @Override
            public boolean canApply(XamlElement element) {
                return from.equals(element.getTypeName());
            }

            @Override
            public XamlElement apply(XamlElement element, TransformationContext context) {
                element.setTypeName(to);
                context.recordTransformation(name(), XamlNodeKind.ELEMENT, from + " -> " + to);
                return element;
            }
        };
    }

    @Test
    void higherPriorityRuleWinsAndOnlyOneRuleRunsPerNode() {
        XamlDocument doc = sample();
        TransformationEngine engine = TransformationEngine.of(List.of(
                rename("low", 0, "TextBlock", "LowText"),
                rename("high", 10, "TextBlock", "HighText")));

        TransformationContext ctx = engine.transform(doc, DefaultMappingRepository.empty());

        assertEquals("HighText", doc.getRoot().getChildren().get(0).getTypeName());
        assertEquals(1, ctx.transformationCount());
        TransformationRecord r = ctx.getTrace().get(0);
        assertEquals("high", r.ruleName);
        assertEquals("default", r.passName);
        assertEquals(Integer.valueOf(2), r.line);
    }

    @Test
    void equalPriorityKeepsRegistrationOrder() {
        XamlDocument doc = sample();
        TransformationEngine engine = TransformationEngine.of(List.of(
                rename("first", 5, "Button", "First"),
                rename("second", 5, "Button", "Second")));

        engine.transform(doc, DefaultMappingRepository.empty());

        assertEquals("First", doc.getRoot().getChildren().get(1).getTypeName());
    }

    @Test
    void ruleReturningNullRemovesNode() {
        XamlDocument doc = sample();
        ElementRule dropButtons = new ElementRule() {
            @Override
            public String name() {
                return "dropButtons";
            }

            @Override
            public boolean canApply(XamlElement element) {
                return "Button".equals(element.getTypeName());
            }

            @Override
            public XamlElement apply(XamlElement element, TransformationContext context) {
                return null;
            }
        };
        PropertyRule dropText = new PropertyRule() {
            @Override
            public String name() {
                return "dropText";
            }

            @Override
            public boolean canApply(XamlProperty property) {
                return "Text".equals(property.getName());
            }

            @Override
            public XamlProperty apply(XamlProperty property, TransformationContext context) {
                return null;
            }
        };

        TransformationEngine.of(List.of(dropButtons, dropText)).transform(doc, DefaultMappingRepository.empty());

        XamlElement root = doc.getRoot();
        assertEquals(1, root.getChildren().size());
        assertEquals("TextBlock", root.getChildren().get(0).getTypeName());
        assertTrue(root.getChildren().get(0).getProperties().isEmpty());
    }

    @Test
    void failingRuleIsReportedAndWalkContinues() {
        XamlDocument doc = sample();
        ElementRule boom = new ElementRule() {
            @Override
            public String name() {
                return "boom";
            }

            @Override
            public boolean canApply(XamlElement element) {
                return "TextBlock".equals(element.getTypeName());
            }

            @Override
            public XamlElement apply(XamlElement element, TransformationContext context) {
                throw new IllegalStateException("broken");
            }
        };

        TransformationContext ctx = TransformationEngine.of(List.of(boom, rename("buttons", 0, "Button", "Knapp")))
                .transform(doc, DefaultMappingRepository.empty());

        List<Diagnostic> errors = doc.getDiagnostics().byCode(DiagnosticCodes.TRANSFORMATION_ERROR);
        assertEquals(1, errors.size());
        Diagnostic d = errors.get(0);
        assertEquals(DiagnosticSeverity.ERROR, d.severity);
        assertEquals(Integer.valueOf(2), d.line);
        assertEquals("Sample.xaml", d.filePath);
        assertTrue(d.message.contains("boom"), d.message);
        assertEquals("TextBlock", doc.getRoot().getChildren().get(0).getTypeName());
        assertEquals("Knapp", doc.getRoot().getChildren().get(1).getTypeName());
        assertEquals(1, ctx.transformationCount());
    }

    @Test
    void passesRunInOrderAndSeeEarlierResults() {
        XamlDocument doc = sample();
        TransformationEngine engine = new TransformationEngine()
                .addPass("one", List.of(rename("a", 0, "Button", "Step1")))
                .addPass("two", List.of(rename("b", 0, "Step1", "Step2")));

        TransformationContext ctx = engine.transform(doc, DefaultMappingRepository.empty());

        assertEquals("Step2", doc.getRoot().getChildren().get(1).getTypeName());
        assertEquals(List.of("one", "two"), List.of(ctx.getTrace().get(0).passName, ctx.getTrace().get(1).passName));
        assertEquals(2, ctx.countsByRule().size());
    }

    @Test
    void documentWithoutRootIsLeftAlone() {
        XamlDocument doc = new XamlDocument("Empty.xaml");
        TransformationContext ctx = TransformationEngine.of(List.of(rename("a", 0, "X", "Y")))
                .transform(doc, DefaultMappingRepository.empty());
        assertEquals(0, ctx.transformationCount());
        assertTrue(doc.getDiagnostics().isEmpty());
    }

    @Test
    void ruleWithoutNodeCategoryIsRejected() {
        TransformationRule bare = () -> "bare";
        assertThrows(IllegalArgumentException.class, () -> new RulePass("p", List.of(bare)));
    }

    @Test
    void rulePassSortsEachCategoryByPriority() {
        RulePass pass = new RulePass("p", List.of(
                rename("low", -5, "A", "B"),
                rename("high", 5, "A", "B")));
        assertEquals(2, pass.size());
        assertEquals("high", pass.elementRules().get(0).name());
        assertTrue(pass.propertyRules().isEmpty());
    }
}
