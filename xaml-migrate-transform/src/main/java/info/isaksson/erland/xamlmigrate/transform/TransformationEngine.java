package info.isaksson.erland.xamlmigrate.transform;

import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;
import info.isaksson.erland.xamlmigrate.ast.XamlMarkupExtension;
import info.isaksson.erland.xamlmigrate.ast.XamlNode;
import info.isaksson.erland.xamlmigrate.ast.XamlProperty;
import info.isaksson.erland.xamlmigrate.ast.visit.NodeRewriter;
import info.isaksson.erland.xamlmigrate.ast.visit.XamlRewriteWalker;
import info.isaksson.erland.xamlmigrate.diagnostics.DiagnosticCodes;
import info.isaksson.erland.xamlmigrate.mapping.MappingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Applies rule passes to a document in place.
 *
 * <p>Each pass is one pre-order, depth-first walk: an element is offered to the element rules, then its
 * properties to the property rules (so they see the already rewritten element), then the markup extensions
 * in those property values, then the children. Per node and pass only the first applicable rule runs.
 * A rule that throws is reported as {@link DiagnosticCodes#TRANSFORMATION_ERROR} and the node is kept.</p>
 *
 * <p>The engine holds no per-document state; one instance may transform documents on several threads as
 * long as its rules are stateless.</p>
 */
public final class TransformationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TransformationEngine.class);

    private final List<RulePass> passes = new ArrayList<>();

    public TransformationEngine() {
    }

    /** Engine with a single pass named {@code default}. */
    public static TransformationEngine of(Collection<? extends TransformationRule> rules) {
        return new TransformationEngine().addPass("default", rules);
    }

    public TransformationEngine addPass(String name, Collection<? extends TransformationRule> rules) {
        passes.add(new RulePass(name, rules));
        return this;
    }

    public TransformationEngine addPass(RulePass pass) {
        if (pass == null) throw new IllegalArgumentException("pass must not be null");
        passes.add(pass);
        return this;
    }

    public List<RulePass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    public TransformationContext transform(XamlDocument document, MappingRepository repository) {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        if (repository == null) throw new IllegalArgumentException("repository must not be null");
        TransformationContext context = new TransformationContext(document, repository);
        if (document.getRoot() == null) {
            LOG.debug("{} has no root element, nothing to transform", document.getFilePath());
            return context;
        }
        for (RulePass pass : passes) {
            runPass(pass, context);
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Transformed {}: {} transformations", document.getFilePath(), context.transformationCount());
            for (Map.Entry<String, Integer> e : context.countsByRule().entrySet()) {
                LOG.debug("  {}: {}", e.getKey(), e.getValue());
            }
        }
        return context;
    }

    private static void runPass(RulePass pass, TransformationContext context) {
        context.setPassName(pass.name);
        int before = context.transformationCount();
        XamlRewriteWalker.rewrite(context.getDocument(), new PassRewriter(pass, context));
        context.setCurrentNode(null);
        LOG.debug("Pass {} on {}: {} transformations", pass.name, context.getDocument().getFilePath(),
                context.transformationCount() - before);
    }

    /** Bridges one pass onto the rewrite walker. */
    private static final class PassRewriter implements NodeRewriter {
        private final RulePass pass;
        private final TransformationContext context;

        PassRewriter(RulePass pass, TransformationContext context) {
            this.pass = pass;
            this.context = context;
        }

        @Override
        public XamlElement rewriteElement(XamlElement element) {
            for (ElementRule rule : pass.elementRules()) {
                context.setCurrentNode(element);
                try {
                    if (!rule.canApply(element)) continue;
                    return rule.apply(element, context);
                } catch (RuntimeException e) {
                    failed(rule, element, "<" + element.qualifiedName() + ">", e);
                    return element;
                }
            }
            return element;
        }

        @Override
        public XamlProperty rewriteProperty(XamlProperty property) {
            for (PropertyRule rule : pass.propertyRules()) {
                context.setCurrentNode(property);
                try {
                    if (!rule.canApply(property)) continue;
                    return rule.apply(property, context);
                } catch (RuntimeException e) {
                    failed(rule, property, property.writtenName(), e);
                    return property;
                }
            }
            return property;
        }

        @Override
        public XamlMarkupExtension rewriteMarkupExtension(XamlMarkupExtension extension) {
            for (MarkupExtensionRule rule : pass.extensionRules()) {
                context.setCurrentNode(extension);
                try {
                    if (!rule.canApply(extension)) continue;
                    return rule.apply(extension, context);
                } catch (RuntimeException e) {
                    failed(rule, extension, extension.getName(), e);
                    return extension;
                }
            }
            return extension;
        }

        private void failed(TransformationRule rule, XamlNode node, String what, RuntimeException e) {
            LOG.debug("Rule {} failed on {}", rule.name(), what, e);
            context.error(DiagnosticCodes.TRANSFORMATION_ERROR,
                    "Rule " + rule.name() + " failed on " + what + ": " + e, node);
        }
    }
}
