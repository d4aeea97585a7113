package info.isaksson.erland.xamlmigrate.transform;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A named, ordered set of rules applied in one pre-order walk over the tree. Rules are split by node
 * category and sorted by descending priority; the sort is stable.
 */
public final class RulePass {

    private static final Comparator<TransformationRule> BY_PRIORITY =
            Comparator.comparingInt(TransformationRule::priority).reversed();

    public final String name;
    private final List<ElementRule> elementRules = new ArrayList<>();
    private final List<PropertyRule> propertyRules = new ArrayList<>();
    private final List<MarkupExtensionRule> extensionRules = new ArrayList<>();

    public RulePass(String name, Collection<? extends TransformationRule> rules) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (rules == null) throw new IllegalArgumentException("rules must not be null");
        for (TransformationRule r : rules) {
            boolean placed = false;
            if (r instanceof ElementRule) {
                elementRules.add((ElementRule) r);
                placed = true;
            }
            if (r instanceof PropertyRule) {
                propertyRules.add((PropertyRule) r);
                placed = true;
            }
            if (r instanceof MarkupExtensionRule) {
                extensionRules.add((MarkupExtensionRule) r);
                placed = true;
            }
            if (!placed) {
                throw new IllegalArgumentException("rule " + r.name() + " implements no rule category");
            }
        }
        elementRules.sort(BY_PRIORITY);
        propertyRules.sort(BY_PRIORITY);
        extensionRules.sort(BY_PRIORITY);
    }

    public List<ElementRule> elementRules() {
        return Collections.unmodifiableList(elementRules);
    }

    public List<PropertyRule> propertyRules() {
        return Collections.unmodifiableList(propertyRules);
    }

    public List<MarkupExtensionRule> extensionRules() {
        return Collections.unmodifiableList(extensionRules);
    }

    public int size() {
        return elementRules.size() + propertyRules.size() + extensionRules.size();
    }

    @Override
    public String toString() {
        return "RulePass{" + name + ", " + size() + " rules}";
    }
}
