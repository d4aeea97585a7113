package info.isaksson.erland.xamlmigrate.transform;

import java.util.Locale;
import java.util.Map;

/** Built-in value conversions, looked up by the tag used in property mappings. */
public final class ValueConverters {

    public static final String VISIBILITY_TO_BOOLEAN_TAG = "VisibilityToBoolean";
    public static final String BOOLEAN_TO_VISIBILITY_TAG = "BooleanToVisibility";

    /** {@code Visible} to {@code True}; {@code Collapsed} and {@code Hidden} to {@code False}. */
    public static final ValueConverter VISIBILITY_TO_BOOLEAN = value -> {
        if (value == null) return null;
        switch (value.trim()) {
            case "Visible":
                return "True";
            case "Collapsed":
            case "Hidden":
                return "False";
            default:
                return null;
        }
    };

    /** {@code True} to {@code Visible}, {@code False} to {@code Collapsed}; case-insensitive. */
    public static final ValueConverter BOOLEAN_TO_VISIBILITY = value -> {
        if (value == null) return null;
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
                return "Visible";
            case "false":
                return "Collapsed";
            default:
                return null;
        }
    };

    private static final Map<String, ValueConverter> BY_TAG = Map.of(
            VISIBILITY_TO_BOOLEAN_TAG, VISIBILITY_TO_BOOLEAN,
            BOOLEAN_TO_VISIBILITY_TAG, BOOLEAN_TO_VISIBILITY);

    private ValueConverters() {}

    /** @return the converter for a mapping tag, or null when the tag is unknown */
    public static ValueConverter forTag(String tag) {
        return tag == null ? null : BY_TAG.get(tag);
    }
}
