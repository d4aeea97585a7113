package info.isaksson.erland.xamlmigrate.parse;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PositionIndexTest {

    @Test
    void everyLineSeparatorEndsExactlyOneLine() {
        PositionIndex index = new PositionIndex("a\nbc\r\nd\re");

        assertEquals(4, index.lineCount());
        assertEquals(0, index.lineStart(1));
        assertEquals(2, index.lineStart(2));
        assertEquals(6, index.lineStart(3));
        assertEquals(8, index.lineStart(4));
        assertEquals(3, index.lineOf(6));
        assertEquals(3, index.lineOf(7));
        assertEquals(2, index.columnOf(7));
        assertEquals(4, index.lineOf(8));
    }

    @Test
    void characterPositionMapsTagNameColumnBackToAngleBracket() {
        String text = "<Window>\n  <Grid/>\n</Window>";
        PositionIndex index = new PositionIndex(text);

        // <Grid is reported at line 2, column 4 (first character of the tag name)
        int pos = index.characterPosition(2, 4);
        assertEquals(11, pos);
        assertEquals('<', text.charAt(pos));
        assertEquals(4, index.tagNameColumnOf(pos));
        assertEquals(0, index.characterPosition(1, 2));
    }

    @Test
    void outOfRangeLinesAreRejected() {
        PositionIndex index = new PositionIndex("one line");
        assertThrows(IllegalArgumentException.class, () -> index.lineStart(0));
        assertThrows(IllegalArgumentException.class, () -> index.lineStart(2));
        assertThrows(IllegalArgumentException.class, () -> index.characterPosition(1, 40));
        assertThrows(IllegalArgumentException.class, () -> new PositionIndex(null));
    }

    @Test
    void emptyTextHasOneLine() {
        PositionIndex index = new PositionIndex("");
        assertEquals(1, index.lineCount());
        assertEquals(1, index.lineOf(0));
    }
}
