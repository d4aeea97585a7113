package info.isaksson.erland.xamlmigrate.companion;

import info.isaksson.erland.xamlmigrate.ast.MetadataKey;
import info.isaksson.erland.xamlmigrate.ast.PropertyValueKind;
import info.isaksson.erland.xamlmigrate.ast.SourceLocation;
import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;
import info.isaksson.erland.xamlmigrate.ast.visit.NamedElementCollector;
import info.isaksson.erland.xamlmigrate.ast.visit.VisitResult;
import info.isaksson.erland.xamlmigrate.ast.visit.XamlVisitor;
import info.isaksson.erland.xamlmigrate.ast.visit.XamlWalker;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Checks the linkage between a document and its companion code unit.
 *
 * <ul>
 *   <li>{@code x:Class} must name a unit in the index (Error when only a unit with the same simple name exists,
 *   Warning when none does)</li>
 *   <li>every {@code x:Name} below the root should have a field in the unit</li>
 *   <li>every event attribute (as resolved by the semantic layer) should name a method of the unit</li>
 * </ul>
 *
 * <p>The linked unit is stored in the document metadata under {@link #COMPANION_UNIT}.</p>
 */
public final class CompanionLinkValidator {

    private static final Logger LOG = LoggerFactory.getLogger(CompanionLinkValidator.class);

    public static final MetadataKey<CompanionUnit> COMPANION_UNIT = MetadataKey.of("companion.unit", CompanionUnit.class);

    /** @return the linked unit, or null when none was found */
    public CompanionUnit validate(XamlDocument doc, CompanionCodeIndex index) {
        if (doc == null) throw new IllegalArgumentException("doc must not be null");
        DiagnosticSink diagnostics = doc.getDiagnostics();
        XamlElement root = doc.getRoot();
        if (root == null) return null;
        if (index == null) {
            diagnostics.addInfo(DiagnosticCodes.COMPANION_NOT_AVAILABLE,
                    "No companion code index available; x:Class linkage is not checked", doc.getFilePath(), null, null);
            return null;
        }
        String className = root.getXClass();
        if (className == null || className.isEmpty()) {
            LOG.debug("{} has no x:Class, skipping companion validation", doc.getFilePath());
            return null;
        }

        SourceLocation at = root.getLocation();
        CompanionUnit unit = index.findUnit(className);
        if (unit == null) {
            int dot = className.lastIndexOf('.');
            List<CompanionUnit> candidates = index.findBySimpleName(dot >= 0 ? className.substring(dot + 1) : className);
            if (!candidates.isEmpty()) {
                diagnostics.addError(DiagnosticCodes.COMPANION_CLASS_MISMATCH,
                        "x:Class '" + className + "' does not match companion unit '" + candidates.get(0).qualifiedName + "'",
                        doc.getFilePath(), at.line, at.column);
            } else {
                diagnostics.addWarning(DiagnosticCodes.COMPANION_NO_CLASS,
                        "No companion unit found for x:Class '" + className + "'", doc.getFilePath(), at.line, at.column);
            }
            return null;
        }

        diagnostics.addInfo(DiagnosticCodes.COMPANION_CLASS_LINKED,
                "x:Class '" + className + "' linked to companion unit", doc.getFilePath(), at.line, at.column);
        doc.getMetadata().put(COMPANION_UNIT, unit);

        for (NamedElementCollector.NamedElement named : new NamedElementCollector().collect(doc)) {
            if (named.element == root || unit.hasField(named.name)) continue;
            SourceLocation loc = named.element.getLocation();
            diagnostics.addWarning(DiagnosticCodes.COMPANION_MISSING_FIELD,
                    "Named element '" + named.name + "' has no field in " + unit.qualifiedName,
                    doc.getFilePath(), loc.line, loc.column);
        }

        XamlWalker.walk(doc, new XamlVisitor() {
            @Override
            public VisitResult visitProperty(XamlProperty property) {
                if (property.getResolvedProperty() == null || !property.getResolvedProperty().event) {
                    return VisitResult.CONTINUE;
                }
                if (property.valueKind() != PropertyValueKind.LITERAL) return VisitResult.CONTINUE;
                String handler = property.getLiteralValue().trim();
                if (!handler.isEmpty() && !unit.hasMethod(handler)) {
                    SourceLocation loc = property.getLocation();
                    diagnostics.addWarning(DiagnosticCodes.COMPANION_MISSING_HANDLER,
                            "Event handler '" + handler + "' for " + property.writtenName() + " is not declared in "
                                    + unit.qualifiedName,
                            doc.getFilePath(), loc.line, loc.column);
                }
                return VisitResult.CONTINUE;
            }
        });
        return unit;
    }
}
