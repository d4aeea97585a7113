package info.isaksson.erland.xamlmigrate.writer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class OutputElement extends OutputNode {

    public final String name;
    public final List<OutputAttribute> attributes = new ArrayList<>();
    public final List<OutputNode> content = new ArrayList<>();

    /** Whitespace between the last attribute and {@code >} or {@code />}. */
    public String tagCloseWhitespace = "";

    /** Whitespace before the end tag. */
    public String closingWhitespace = "";

    /** Write {@code <Name/>}; only honoured when {@link #content} is empty. */
    public boolean selfClosing;

    public OutputElement(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public OutputAttribute findAttribute(String name) {
        for (OutputAttribute a : attributes) {
            if (a.name.equals(name)) return a;
        }
        return null;
    }

    /** Child elements in content order. */
    public List<OutputElement> elements() {
        List<OutputElement> out = new ArrayList<>();
        for (OutputNode n : content) {
            if (n instanceof OutputElement) out.add((OutputElement) n);
        }
        return out;
    }
}
