package info.isaksson.erland.xamlmigrate.ast;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** Extension slot for cross-pass facts, keyed by {@link MetadataKey} so reads stay type-safe. */
public final class NodeMetadata {

    private final Map<MetadataKey<?>, Object> values = new IdentityHashMap<>();

    public <T> T get(MetadataKey<T> key) {
        Object v = values.get(Objects.requireNonNull(key, "key must not be null"));
        return v == null ? null : key.cast(v);
    }

    public <T> void put(MetadataKey<T> key, T value) {
        Objects.requireNonNull(key, "key must not be null");
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, key.cast(value));
        }
    }

    public boolean contains(MetadataKey<?> key) {
        return values.containsKey(key);
    }

    public void remove(MetadataKey<?> key) {
        values.remove(key);
    }

    public Set<MetadataKey<?>> keys() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values.keySet()));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    void copyInto(NodeMetadata target) {
        target.values.putAll(values);
    }
}
