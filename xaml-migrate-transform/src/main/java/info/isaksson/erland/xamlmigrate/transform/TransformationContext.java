package info.isaksson.erland.xamlmigrate.transform;

import info.isaksson.erland.xamlmigrate.ast.MetadataKey;
import info.isaksson.erland.xamlmigrate.ast.SourceLocation;
import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlNode;
import info.isaksson.erland.xamlmigrate.ast.XamlNodeKind;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticSink;
import info.isaksson.erland.xamlmigrate.mapping.MappingRepository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * State threaded through every rule invocation of one document: the mapping repository, the document's
 * diagnostic sink and the transformation trace.
 *
 * <p>Also remembers the source-framework identity of renamed elements ({@link #SOURCE_NAMESPACE},
 * {@link #SOURCE_TYPE_NAME}) so rules of later passes can still match on source names. Properties a rule has
 * already rewritten carry {@link #SOURCE_PROPERTY_NAME}.</p>
 */
public final class TransformationContext {

    public static final MetadataKey<String> SOURCE_NAMESPACE = MetadataKey.of("transform.sourceNamespace", String.class);
    public static final MetadataKey<String> SOURCE_TYPE_NAME = MetadataKey.of("transform.sourceTypeName", String.class);
    public static final MetadataKey<String> SOURCE_PROPERTY_NAME =
            MetadataKey.of("transform.sourcePropertyName", String.class);

    private final XamlDocument document;
    private final MappingRepository repository;
    private final DiagnosticSink diagnostics;
    private final List<TransformationRecord> trace = new ArrayList<>();
    private final Map<String, Integer> countsByRule = new LinkedHashMap<>();
    private final Set<String> reported = new HashSet<>();

    private String passName;
    private XamlNode currentNode;

    public TransformationContext(XamlDocument document, MappingRepository repository) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.diagnostics = document.getDiagnostics();
    }

    public XamlDocument getDocument() {
        return document;
    }

    public MappingRepository getRepository() {
        return repository;
    }

    public DiagnosticSink getDiagnostics() {
        return diagnostics;
    }

    public String getPassName() {
        return passName;
    }

    void setPassName(String passName) {
        this.passName = passName;
    }

    /** Node the engine is currently offering to a rule. */
    public XamlNode getCurrentNode() {
        return currentNode;
    }

    void setCurrentNode(XamlNode currentNode) {
        this.currentNode = currentNode;
    }

    // ---- trace ----

    public void recordTransformation(String ruleName, XamlNodeKind nodeKind, String description) {
        Integer line = null;
        if (currentNode != null && currentNode.getLocation().isKnown()) {
            line = currentNode.getLocation().line;
        }
        trace.add(new TransformationRecord(passName, ruleName, nodeKind, description, line));
        countsByRule.merge(ruleName, 1, Integer::sum);
    }

    public List<TransformationRecord> getTrace() {
        return Collections.unmodifiableList(trace);
    }

    /** Applied transformations per rule name, in order of first application. */
    public Map<String, Integer> countsByRule() {
        return Collections.unmodifiableMap(countsByRule);
    }

    public int transformationCount() {
        return trace.size();
    }

    // ---- diagnostics located at a node ----

    /** True the first time {@code key} is seen for this document; used to report a finding once. */
    public boolean firstOccurrence(String key) {
        return reported.add(key);
    }

    public void info(String code, String message, XamlNode at) {
        SourceLocation loc = locationOf(at);
        diagnostics.addInfo(code, message, document.getFilePath(), line(loc), column(loc));
    }

    public void warning(String code, String message, XamlNode at) {
        SourceLocation loc = locationOf(at);
        diagnostics.addWarning(code, message, document.getFilePath(), line(loc), column(loc));
    }

    public void error(String code, String message, XamlNode at) {
        SourceLocation loc = locationOf(at);
        diagnostics.addError(code, message, document.getFilePath(), line(loc), column(loc));
    }

    private static SourceLocation locationOf(XamlNode at) {
        XamlNode n = at;
        while (n != null && !n.getLocation().isKnown()) {
            n = n.getParent();
        }
        return n == null ? SourceLocation.UNKNOWN : n.getLocation();
    }

    private static Integer line(SourceLocation loc) {
        return loc.isKnown() ? loc.line : null;
    }

    private static Integer column(SourceLocation loc) {
        return loc.isKnown() ? loc.column : null;
    }

    // ---- source identity ----

    /** Record the element's current namespace and type name as its source identity, unless already recorded. */
    public static void rememberSource(XamlElement element) {
        if (!element.getMetadata().contains(SOURCE_NAMESPACE) && element.getNamespaceUri() != null) {
            element.getMetadata().put(SOURCE_NAMESPACE, element.getNamespaceUri());
        }
        if (!element.getMetadata().contains(SOURCE_TYPE_NAME)) {
            element.getMetadata().put(SOURCE_TYPE_NAME, element.getTypeName());
        }
    }

    /** Mark a property as rewritten by a rule; mapping lookups skip it afterwards. */
    public static void rememberSource(XamlProperty property) {
        if (!property.getMetadata().contains(SOURCE_PROPERTY_NAME)) {
            property.getMetadata().put(SOURCE_PROPERTY_NAME, property.getName());
        }
    }

    public static boolean isRewritten(XamlProperty property) {
        return property.getMetadata().contains(SOURCE_PROPERTY_NAME);
    }

    public static String sourceNamespaceOf(XamlElement element) {
        String ns = element.getMetadata().get(SOURCE_NAMESPACE);
        return ns != null ? ns : element.getNamespaceUri();
    }

    public static String sourceTypeNameOf(XamlElement element) {
        String t = element.getMetadata().get(SOURCE_TYPE_NAME);
        return t != null ? t : element.getTypeName();
    }
}
