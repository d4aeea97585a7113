package info.isaksson.erland.xamlmigrate.writer;

/** Node of the output tree: what the renderer writes, with the whitespace to write before it. */
public abstract class OutputNode {

    /** Text written before the node; never null. */
    public String leadingWhitespace = "";
}
