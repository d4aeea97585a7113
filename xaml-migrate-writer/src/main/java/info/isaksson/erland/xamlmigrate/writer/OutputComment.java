package info.isaksson.erland.xamlmigrate.writer;

import java.util.Objects;

public final class OutputComment extends OutputNode {

    /** Text between {@code <!--} and {@code -->}. */
    public final String text;

    public OutputComment(String text) {
        this.text = Objects.requireNonNull(text, "text must not be null");
    }
}
