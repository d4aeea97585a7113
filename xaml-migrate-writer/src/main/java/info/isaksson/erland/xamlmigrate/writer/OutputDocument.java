package info.isaksson.erland.xamlmigrate.writer;

import java.util.ArrayList;
import java.util.List;

/** Output tree of one document; see {@link XamlSerializer}. */
public final class OutputDocument {

    /** XML declaration text, or null. */
    public String declaration;

    /** Comments before the root. */
    public final List<OutputNode> prolog = new ArrayList<>();

    public OutputElement root;

    /** Comments after the root, including the diagnostic banner. */
    public final List<OutputNode> epilog = new ArrayList<>();

    public String trailingWhitespace = "";
}
