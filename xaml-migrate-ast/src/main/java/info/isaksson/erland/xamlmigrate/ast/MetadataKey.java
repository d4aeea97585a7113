package info.isaksson.erland.xamlmigrate.ast;

import java.util.Objects;

/**
 * Typed key into a {@link NodeMetadata} slot.
 *
 * <p>Keys compare by identity; declare them as constants next to the code that owns the fact.</p>
 *
 * @param <T> value type stored under this key
 */
public final class MetadataKey<T> {

    private final String name;
    private final Class<T> type;

    private MetadataKey(String name, Class<T> type) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    public static <T> MetadataKey<T> of(String name, Class<T> type) {
        return new MetadataKey<>(name, type);
    }

    public String name() {
        return name;
    }

    public Class<T> type() {
        return type;
    }

    T cast(Object value) {
        return type.cast(value);
    }

    @Override
    public String toString() {
        return name + ":" + type.getSimpleName();
    }
}
