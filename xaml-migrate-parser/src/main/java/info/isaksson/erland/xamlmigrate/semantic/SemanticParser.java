package info.isaksson.erland.xamlmigrate.semantic;

import info.isaksson.erland.xamlmigrate.ast.MarkupParameter;
import info.isaksson.erland.xamlmigrate.ast.XamlDirective;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;
import info.isaksson.erland.xamlmigrate.ast.XamlNamespaces;
import info.isaksson.erland.xamlmigrate.ast.XamlPropertyDescriptor;
import info.isaksson.erland.xamlmigrate.ast.XamlTypeDescriptor;
import info.isaksson.erland.xamlmigrate.ast.markup.MarkupExtensionParser;
import info.isaksson.erland.xamlmigrate.ast.markup.MarkupSyntaxException;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticBag;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.types.TypeResolutionPolicy;
import info.isaksson.erland.xamlmigrate.types.XamlTypeSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.Map;

/**
 * Type-aware parse of markup text into a {@link SemanticDocument}.
 *
 * <p>Reads the text with the JDK namespace-aware DOM (no DTDs, no external entities) and resolves element
 * types, members and markup-extension types against a {@link XamlTypeSystem}. Types in namespaces the type
 * system does not cover are reported as Info; unresolved types in covered namespaces follow the
 * {@link TypeResolutionPolicy}.</p>
 *
 * <p>DOM attribute order is not source order. Consumers that care about order use the structural layer.</p>
 */
public final class SemanticParser {

    private static final Logger LOG = LoggerFactory.getLogger(SemanticParser.class);

    private static final ErrorHandler FAIL_ON_ERROR = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
            LOG.debug("DOM warning at {}:{}: {}", e.getLineNumber(), e.getColumnNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };

    private final XamlTypeSystem typeSystem;
    private final TypeResolutionPolicy policy;
    private final boolean reportUnresolvedProperties;

    public SemanticParser(XamlTypeSystem typeSystem, TypeResolutionPolicy policy) {
        this(typeSystem, policy, false);
    }

    public SemanticParser(XamlTypeSystem typeSystem, TypeResolutionPolicy policy, boolean reportUnresolvedProperties) {
        if (typeSystem == null) throw new IllegalArgumentException("typeSystem must not be null");
        this.typeSystem = typeSystem;
        this.policy = policy == null ? TypeResolutionPolicy.LENIENT : policy;
        this.reportUnresolvedProperties = reportUnresolvedProperties;
    }

    public SemanticDocument parse(String text, String filePath) throws SemanticParseException {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        Document dom = readDom(text);
        Element rootElement = dom.getDocumentElement();
        if (rootElement == null) {
            throw new SemanticParseException("document has no root element");
        }
        DiagnosticBag diagnostics = new DiagnosticBag();
        Resolution r = new Resolution(filePath, diagnostics);
        SemanticObject root = r.object(rootElement, "");
        LOG.debug("Semantic parse of {}: {} objects, {} unresolved types", filePath, r.objects, r.unresolved);
        return new SemanticDocument(filePath, root, diagnostics);
    }

    static Document readDom(String text) throws SemanticParseException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        dbf.setCoalescing(true);
        dbf.setExpandEntityReferences(false);
        dbf.setXIncludeAware(false);
        setFeature(dbf, "http://apache.org/xml/features/disallow-doctype-decl", true);
        setFeature(dbf, "http://xml.org/sax/features/external-general-entities", false);
        setFeature(dbf, "http://xml.org/sax/features/external-parameter-entities", false);
        try {
            DocumentBuilder db = dbf.newDocumentBuilder();
            db.setErrorHandler(FAIL_ON_ERROR);
            return db.parse(new InputSource(new StringReader(text)));
        } catch (SAXParseException e) {
            throw new SemanticParseException("markup rejected at line " + e.getLineNumber() + ", column "
                    + e.getColumnNumber() + ": " + e.getMessage(), e);
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new SemanticParseException("markup could not be read: " + e.getMessage(), e);
        }
    }

    private static void setFeature(DocumentBuilderFactory dbf, String feature, boolean value) {
        try {
            dbf.setFeature(feature, value);
        } catch (ParserConfigurationException e) {
            LOG.debug("DOM feature {} not supported: {}", feature, e.getMessage());
        }
    }

    /** State of one resolution walk. */
    private final class Resolution {
        private final String filePath;
        private final DiagnosticBag diagnostics;
        int objects;
        int unresolved;

        Resolution(String filePath, DiagnosticBag diagnostics) {
            this.filePath = filePath;
            this.diagnostics = diagnostics;
        }

        SemanticObject object(Element el, String parentPath) throws SemanticParseException {
            String ns = el.getNamespaceURI();
            String local = el.getLocalName();
            String path = parentPath + "/" + el.getTagName();
            SemanticObject obj = new SemanticObject(local, ns, el.getPrefix(), el.getTagName());
            objects++;

            XamlTypeDescriptor type = typeSystem.resolveType(ns, local);
            if (type == null) {
                unresolvedType(ns, local, path);
            }
            obj.setResolvedType(type);

            NamedNodeMap attrs = el.getAttributes();
            for (int i = 0; i < attrs.getLength(); i++) {
                attribute(obj, el, (Attr) attrs.item(i), path);
            }

            StringBuilder text = new StringBuilder();
            NodeList nodes = el.getChildNodes();
            for (int i = 0; i < nodes.getLength(); i++) {
                Node n = nodes.item(i);
                switch (n.getNodeType()) {
                    case Node.ELEMENT_NODE -> {
                        Element child = (Element) n;
                        if (child.getLocalName().indexOf('.') > 0) {
                            obj.addMember(propertyElement(obj, child, path));
                        } else {
                            obj.addChild(object(child, path));
                        }
                    }
                    case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> text.append(n.getNodeValue());
                    default -> {
                        // comments and processing instructions carry no semantics
                    }
                }
            }
            if (!text.toString().isBlank()) {
                obj.setText(text.toString());
            }
            return obj;
        }

        private void attribute(SemanticObject obj, Element el, Attr a, String path) throws SemanticParseException {
            String ns = a.getNamespaceURI();
            String value = a.getValue();
            if (XamlNamespaces.XMLNS.equals(ns)) {
                obj.declareNamespace("xmlns".equals(a.getLocalName()) ? "" : a.getLocalName(), value);
                return;
            }
            if (XamlNamespaces.isLanguageNamespace(ns)) {
                XamlDirective d = XamlDirective.fromLocalName(a.getLocalName());
                if (d != null) {
                    obj.setDirective(d, value);
                    return;
                }
            }

            String local = a.getLocalName();
            int dot = local.indexOf('.');
            SemanticMember m;
            if (dot > 0 && dot < local.length() - 1) {
                String owner = local.substring(0, dot);
                String name = local.substring(dot + 1);
                m = new SemanticMember(name, owner, true, false);
                String ownerNs = ns != null ? ns : el.lookupNamespaceURI(null);
                m.setResolvedProperty(typeSystem.resolveAttachedMember(ownerNs, owner, name));
            } else {
                m = new SemanticMember(local, null, false, false);
                if (ns == null) {
                    m.setResolvedProperty(typeSystem.resolveMember(obj.getResolvedType(), local));
                }
            }
            m.setNamespaceUri(ns);
            m.setPrefix(a.getPrefix());
            unresolvedMember(obj, m, path, ns);

            if (MarkupExtensionParser.isMarkupExtension(value)) {
                try {
                    m.addObjectValue(markupObject(MarkupExtensionParser.parse(value), el, path));
                    obj.addMember(m);
                    return;
                } catch (MarkupSyntaxException e) {
                    LOG.debug("Markup extension in {} on {} kept as text: {}", a.getName(), path, e.getMessage());
                }
            }
            m.setTextValue(value);
            obj.addMember(m);
        }

        private SemanticMember propertyElement(SemanticObject obj, Element el, String path) throws SemanticParseException {
            String local = el.getLocalName();
            int dot = local.indexOf('.');
            String owner = local.substring(0, dot);
            String name = local.substring(dot + 1);
            boolean attached = !owner.equals(obj.getTypeName());
            SemanticMember m = new SemanticMember(name, owner, attached, true);
            m.setNamespaceUri(el.getNamespaceURI());
            m.setPrefix(el.getPrefix());

            XamlPropertyDescriptor p = attached
                    ? typeSystem.resolveAttachedMember(el.getNamespaceURI(), owner, name)
                    : typeSystem.resolveMember(obj.getResolvedType(), name);
            if (p == null && attached) {
                p = typeSystem.resolveMember(typeSystem.resolveType(el.getNamespaceURI(), owner), name);
            }
            m.setResolvedProperty(p);
            unresolvedMember(obj, m, path, null);

            String elementPath = path + "/" + el.getTagName();
            StringBuilder text = new StringBuilder();
            NodeList nodes = el.getChildNodes();
            for (int i = 0; i < nodes.getLength(); i++) {
                Node n = nodes.item(i);
                if (n.getNodeType() == Node.ELEMENT_NODE) {
                    m.addObjectValue(object((Element) n, elementPath));
                } else if (n.getNodeType() == Node.TEXT_NODE || n.getNodeType() == Node.CDATA_SECTION_NODE) {
                    text.append(n.getNodeValue());
                }
            }
            if (m.getObjectValues().isEmpty() && !text.toString().isBlank()) {
                m.setTextValue(text.toString());
            }
            return m;
        }

        private SemanticObject markupObject(XamlMarkupExtension ext, Element context, String path) throws SemanticParseException {
            String written = ext.getName();
            int colon = written.indexOf(':');
            String prefix = colon >= 0 ? written.substring(0, colon) : null;
            String ns = context.lookupNamespaceURI(prefix);
            SemanticObject obj = SemanticObject.markupExtension(written, ns);
            objects++;

            XamlTypeDescriptor type = typeSystem.resolveMarkupExtension(ns, ext.localName());
            if (type == null) {
                unresolvedType(ns, obj.getTypeName(), path + "/{" + written + "}");
            }
            obj.setResolvedType(type);

            MarkupParameter positional = ext.getPositionalArgument();
            if (positional != null) {
                SemanticMember m = SemanticMember.positional();
                parameterValue(m, positional, context, path);
                obj.addMember(m);
            }
            for (Map.Entry<String, MarkupParameter> e : ext.getNamedParameters().entrySet()) {
                SemanticMember m = new SemanticMember(e.getKey(), null, false, false);
                m.setResolvedProperty(typeSystem.resolveMember(type, e.getKey()));
                parameterValue(m, e.getValue(), context, path);
                obj.addMember(m);
            }
            return obj;
        }

        private void parameterValue(SemanticMember m, MarkupParameter value, Element context, String path) throws SemanticParseException {
            if (value.isExtension()) {
                m.addObjectValue(markupObject(value.getExtension(), context, path));
            } else {
                m.setTextValue(value.getLiteral());
            }
        }

        private void unresolvedType(String ns, String typeName, String path) throws SemanticParseException {
            unresolved++;
            if (ns == null || !typeSystem.coversNamespace(ns)) {
                diagnostics.addInfo(DiagnosticCodes.TYPE_UNRESOLVED,
                        "Type '" + typeName + "' at " + path + " is in a namespace without type information"
                                + (ns == null ? "" : " (" + ns + ")"),
                        filePath, null, null);
                return;
            }
            String message = "Type '" + typeName + "' at " + path + " is not defined in " + ns;
            if (policy == TypeResolutionPolicy.STRICT) {
                throw new SemanticParseException(message);
            }
            diagnostics.addWarning(DiagnosticCodes.TYPE_UNRESOLVED, message, filePath, null, null);
        }

        private void unresolvedMember(SemanticObject obj, SemanticMember m, String path, String attributeNs) {
            if (!reportUnresolvedProperties || m.getResolvedProperty() != null) return;
            if (attributeNs != null) return;
            if (!m.isAttached() && obj.getResolvedType() == null) return;
            diagnostics.addInfo(DiagnosticCodes.PROPERTY_UNRESOLVED,
                    "Member '" + (m.getOwnerTypeName() == null ? "" : m.getOwnerTypeName() + ".") + m.getName()
                            + "' at " + path + " is not known to the type system",
                    filePath, null, null);
        }
    }
}
