package info.isaksson.erland.xamlmigrate.ast;

import java.util.Objects;

/**
 * Position of a node in its source text.
 *
 * <p>{@code line} is 1-based. {@code column} follows the structural parser convention of pointing at
 * the first character of the tag or attribute name, which is one past the {@code <} for elements.</p>
 */
public final class SourceLocation {

    public static final SourceLocation UNKNOWN = new SourceLocation(null, 0, 0);

    public final String filePath;
    public final int line;
    public final int column;

    public SourceLocation(String filePath, int line, int column) {
        this.filePath = filePath;
        this.line = line;
        this.column = column;
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column && Objects.equals(filePath, that.filePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filePath, line, column);
    }

    @Override
    public String toString() {
        return (filePath == null ? "" : filePath + ":") + line + ":" + column;
    }
}
