package info.isaksson.erland.xamlmigrate.transform.rules;

import info.isaksson.erland.xamlmigrate.transform.RulePass;
import info.isaksson.erland.xamlmigrate.transform.TransformationEngine;
import info.isaksson.erland.xamlmigrate.transform.TransformationRule;

import java.util.List;

/**
 * The stock rule set for presentation-to-Avalonia migration.
 *
 * <p>Two passes: {@value #NAMESPACES_PASS} moves namespaces, then {@value #MEMBERS_PASS} handles types,
 * properties, events and markup extensions. Rules are first-match per node and pass, so the namespace
 * rewrite needs its own pass to combine with type rules on the same element.</p>
 */
public final class BuiltInRules {

    public static final String NAMESPACES_PASS = "namespaces";
    public static final String MEMBERS_PASS = "members";

    private BuiltInRules() {}

    public static List<TransformationRule> namespaceRules() {
        return List.of(new NamespaceRewriteRule());
    }

    public static List<TransformationRule> memberRules() {
        return List.of(
                new WindowRule(),
                new MappedTypeRule(),
                new VisibilityRule(),
                new MappedEventRule(),
                new MappedPropertyRule(),
                new StaticMemberExtensionRule(),
                new TypeExtensionRule(),
                new DynamicResourceRule());
    }

    /** Both passes in run order, rules sorted by priority. */
    public static List<RulePass> defaultRuleSet() {
        return List.of(new RulePass(NAMESPACES_PASS, namespaceRules()), new RulePass(MEMBERS_PASS, memberRules()));
    }

    /** A fresh engine with both passes; callers may add further passes. */
    public static TransformationEngine defaultEngine() {
        TransformationEngine engine = new TransformationEngine();
        for (RulePass pass : defaultRuleSet()) {
            engine.addPass(pass);
        }
        return engine;
    }
}
