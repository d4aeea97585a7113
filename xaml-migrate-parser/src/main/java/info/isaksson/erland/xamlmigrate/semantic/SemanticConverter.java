package info.isaksson.erland.xamlmigrate.semantic;

import info.isaksson.erland.xamlmigrate.ast.MarkupParameter;
import info.isaksson.erland.xamlmigrate.ast.PropertyKind;
import info.isaksson.erland.xamlmigrate.ast.PropertyValueKind;
import info.isaksson.erland.xamlmigrate.ast.XamlDirective;
import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bridges the semantic view into the unified tree.
 *
 * <p>{@link #convert(SemanticDocument)} builds a new tree when no structural tree exists.
 * {@link #enrich(XamlDocument, SemanticDocument)} walks an existing structural tree and the semantic view
 * in lock-step and attaches resolved types and members to the nodes already there. Properties match by
 * name and owner, children by position. A property is created only when no structural counterpart
 * exists; an existing markup extension is augmented, never duplicated.</p>
 */
public final class SemanticConverter {

    private static final Logger LOG = LoggerFactory.getLogger(SemanticConverter.class);

    // ---- fresh conversion ----

    public XamlDocument convert(SemanticDocument sem) {
        if (sem == null) throw new IllegalArgumentException("sem must not be null");
        XamlDocument doc = new XamlDocument(sem.getFilePath());
        doc.setRoot(element(sem.getRoot()));
        doc.rebuildSymbolTable();
        return doc;
    }

    private XamlElement element(SemanticObject o) {
        XamlElement e = new XamlElement(o.getTypeName(), o.getNamespaceUri());
        e.setPrefix(o.getPrefix());
        e.setResolvedType(o.getResolvedType());
        for (Map.Entry<String, String> ns : o.getNamespaceDeclarations().entrySet()) {
            e.declareNamespace(ns.getKey(), ns.getValue());
        }
        for (Map.Entry<XamlDirective, String> d : o.getDirectives().entrySet()) {
            e.setDirective(d.getKey(), d.getValue());
        }
        for (SemanticMember m : o.getMembers()) {
            e.addProperty(property(m));
        }
        for (SemanticObject c : o.getChildren()) {
            e.addChild(element(c));
        }
        if (o.getText() != null && o.getChildren().isEmpty()) {
            e.setTextContent(o.getText());
        }
        return e;
    }

    private XamlProperty property(SemanticMember m) {
        XamlProperty p;
        if (m.isPropertyElement()) {
            p = XamlProperty.propertyElement(m.getOwnerTypeName(), m.getName());
            List<SemanticObject> values = m.getObjectValues();
            if (values.size() == 1 && !values.get(0).isMarkupExtension()) {
                p.setElementValue(element(values.get(0)));
            } else if (values.size() == 1) {
                p.setMarkupExtension(extension(values.get(0)));
            } else if (!values.isEmpty()) {
                XamlElement collection = XamlElement.syntheticCollection(m.getName());
                for (SemanticObject v : values) {
                    collection.addChild(element(v));
                }
                p.setElementValue(collection);
            } else if (m.getTextValue() != null) {
                p.setLiteralValue(m.getTextValue());
            }
        } else {
            p = m.isAttached()
                    ? XamlProperty.attached(m.getOwnerTypeName(), m.getName(), null)
                    : XamlProperty.attribute(m.getName(), null);
            SemanticObject single = m.singleObject();
            if (single != null && single.isMarkupExtension()) {
                p.setMarkupExtension(extension(single));
            } else {
                p.setLiteralValue(m.getTextValue());
            }
        }
        p.setPrefix(m.getPrefix());
        p.setNamespaceUri(m.getNamespaceUri());
        p.setResolvedProperty(m.getResolvedProperty());
        return p;
    }

    private XamlMarkupExtension extension(SemanticObject o) {
        XamlMarkupExtension ext = new XamlMarkupExtension(o.getWrittenName());
        ext.setResolvedType(o.getResolvedType());
        for (SemanticMember m : o.getMembers()) {
            MarkupParameter value = parameter(m);
            if (value == null) continue;
            if (m.isPositional()) {
                ext.setPositionalArgument(value);
            } else {
                ext.setNamedParameter(m.getName(), value);
            }
        }
        return ext;
    }

    private MarkupParameter parameter(SemanticMember m) {
        SemanticObject single = m.singleObject();
        if (single != null && single.isMarkupExtension()) {
            return MarkupParameter.extension(extension(single));
        }
        return m.getTextValue() == null ? null : MarkupParameter.literal(m.getTextValue());
    }

    // ---- enrichment ----

    /**
     * Attach the semantic view to an existing structural tree. Returns the number of elements that received
     * a resolved type.
     */
    public int enrich(XamlDocument doc, SemanticDocument sem) {
        if (doc == null) throw new IllegalArgumentException("doc must not be null");
        if (sem == null) throw new IllegalArgumentException("sem must not be null");
        if (doc.getRoot() == null) return 0;
        Enrichment run = new Enrichment(doc.getDiagnostics(), doc.getFilePath());
        run.enrichElement(doc.getRoot(), sem.getRoot());
        LOG.debug("Enriched {}: {} typed elements, {} properties, {} extensions, {} created properties",
                doc.getFilePath(), run.typedElements, run.properties, run.extensions, run.created);
        return run.typedElements;
    }

    /** State of one enrichment walk. */
    private final class Enrichment {
        private final DiagnosticSink diagnostics;
        private final String filePath;
        int typedElements;
        int properties;
        int extensions;
        int created;

        Enrichment(DiagnosticSink diagnostics, String filePath) {
            this.diagnostics = diagnostics;
            this.filePath = filePath;
        }

        void enrichElement(XamlElement e, SemanticObject o) {
            if (o.getResolvedType() != null) {
                e.setResolvedType(o.getResolvedType());
                typedElements++;
            }

            int slot = 0;
            for (SemanticMember m : o.getMembers()) {
                XamlProperty p = match(e, m);
                if (p == null) {
                    p = SemanticConverter.this.property(m);
                    e.insertProperty(Math.min(slot, e.getProperties().size()), p);
                    p.setLocation(e.getLocation());
                    created++;
                    LOG.debug("Created {} on {} from semantic view", p.writtenName(), e);
                }
                enrichProperty(p, m);
                slot++;
            }

            List<XamlElement> children = e.getChildren();
            List<SemanticObject> semChildren = o.getChildren();
            if (children.size() != semChildren.size()) {
                mismatch(e, children.size(), semChildren.size());
                return;
            }
            for (int i = 0; i < children.size(); i++) {
                XamlElement child = children.get(i);
                SemanticObject semChild = semChildren.get(i);
                if (!child.getTypeName().equals(semChild.getTypeName())) {
                    diagnostics.addWarning(DiagnosticCodes.ENRICHMENT_CHILD_COUNT_MISMATCH,
                            "Child " + i + " of <" + e.qualifiedName() + "> is <" + child.qualifiedName()
                                    + "> but the semantic view has <" + semChild.getWrittenName() + ">; not enriched",
                            filePath, child.getLocation().line, child.getLocation().column);
                    continue;
                }
                enrichElement(child, semChild);
            }
        }

        private void enrichProperty(XamlProperty p, SemanticMember m) {
            if (m.getResolvedProperty() != null) {
                p.setResolvedProperty(m.getResolvedProperty());
                properties++;
            }
            SemanticObject single = m.singleObject();
            if (p.valueKind() == PropertyValueKind.MARKUP_EXTENSION) {
                if (single != null && single.isMarkupExtension()) {
                    enrichExtension(p.getMarkupExtension(), single);
                }
                return;
            }
            if (p.valueKind() != PropertyValueKind.ELEMENT) return;

            XamlElement value = p.getElementValue();
            if (value.isSynthetic()) {
                List<XamlElement> items = value.getChildren();
                List<SemanticObject> semItems = m.getObjectValues();
                if (items.size() != semItems.size()) {
                    mismatch(value, items.size(), semItems.size());
                    return;
                }
                for (int i = 0; i < items.size(); i++) {
                    enrichElement(items.get(i), semItems.get(i));
                }
            } else if (single != null && !single.isMarkupExtension()) {
                enrichElement(value, single);
            }
        }

        private void enrichExtension(XamlMarkupExtension ext, SemanticObject o) {
            if (ext.getResolvedType() == null && o.getResolvedType() != null) {
                ext.setResolvedType(o.getResolvedType());
                extensions++;
            }
            for (SemanticMember m : o.getMembers()) {
                SemanticObject nested = m.singleObject();
                if (nested == null || !nested.isMarkupExtension()) continue;
                MarkupParameter param = m.isPositional() ? ext.getPositionalArgument() : ext.getNamedParameter(m.getName());
                if (param != null && param.isExtension()) {
                    enrichExtension(param.getExtension(), nested);
                }
            }
        }

        private XamlProperty match(XamlElement e, SemanticMember m) {
            for (XamlProperty p : e.getProperties()) {
                if (!p.getName().equals(m.getName())) continue;
                if (m.isPropertyElement()) {
                    if (p.isPropertyElement() && Objects.equals(p.getAttachedOwnerType(), m.getOwnerTypeName())) return p;
                } else if (m.isAttached()) {
                    if (p.isAttached() && Objects.equals(p.getAttachedOwnerType(), m.getOwnerTypeName())) return p;
                } else if (p.getPropertyKind() == PropertyKind.ATTRIBUTE
                        && Objects.equals(p.getNamespaceUri(), m.getNamespaceUri())) {
                    return p;
                }
            }
            return null;
        }

        private void mismatch(XamlElement e, int structural, int semantic) {
            diagnostics.addWarning(DiagnosticCodes.ENRICHMENT_CHILD_COUNT_MISMATCH,
                    "<" + e.qualifiedName() + "> has " + structural + " child elements but the semantic view has "
                            + semantic + "; children are not enriched",
                    filePath, e.getLocation().isKnown() ? e.getLocation().line : null,
                    e.getLocation().isKnown() ? e.getLocation().column : null);
        }
    }
}
