package info.isaksson.erland.xamlmigrate.ast.visit;

import info.isaksson.erland.xamlmigrate.ast.XamlDocument;
import info.isaksson.erland.xamlmigrate.ast.XamlElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base for visitors that gather results over a whole traversal.
 *
 * @param <T> result item type
 */
public abstract class CollectingVisitor<T> implements XamlVisitor {

    protected final List<T> results = new ArrayList<>();

    public List<T> collect(XamlDocument document) {
        results.clear();
        XamlWalker.walk(document, this);
        return results();
    }

    public List<T> collect(XamlElement root) {
        results.clear();
        XamlWalker.walk(root, this);
        return results();
    }

    public List<T> results() {
        return Collections.unmodifiableList(new ArrayList<>(results));
    }
}
