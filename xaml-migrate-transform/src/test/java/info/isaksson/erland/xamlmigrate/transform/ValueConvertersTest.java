package info.isaksson.erland.xamlmigrate.transform;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ValueConvertersTest {

    @Test
    void visibilityToBoolean() {
        ValueConverter c = ValueConverters.VISIBILITY_TO_BOOLEAN;
        assertEquals("True", c.convert("Visible"));
        assertEquals("False", c.convert("Collapsed"));
        assertEquals("False", c.convert("Hidden"));
        assertNull(c.convert("Sometimes"));
    }

    @Test
    void booleanToVisibilityIgnoresCase() {
        ValueConverter c = ValueConverters.BOOLEAN_TO_VISIBILITY;
        assertEquals("Visible", c.convert("true"));
        assertEquals("Collapsed", c.convert("False"));
        assertNull(c.convert("maybe"));
    }

    @Test
    void lookupByTag() {
        assertSame(ValueConverters.VISIBILITY_TO_BOOLEAN, ValueConverters.forTag(ValueConverters.VISIBILITY_TO_BOOLEAN_TAG));
        assertNull(ValueConverters.forTag("NoSuchConversion"));
        assertNull(ValueConverters.forTag(null));
    }
}
