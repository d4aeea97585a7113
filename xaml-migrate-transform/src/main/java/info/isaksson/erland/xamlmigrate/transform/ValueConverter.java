package info.isaksson.erland.xamlmigrate.transform;

/** Converts a literal attribute value between value domains. */
@FunctionalInterface
public interface ValueConverter {

    /** @return the converted value, or null when {@code value} is outside the source domain */
    String convert(String value);
}
