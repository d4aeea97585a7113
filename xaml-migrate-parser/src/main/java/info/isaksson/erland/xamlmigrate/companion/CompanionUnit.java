package info.isaksson.erland.xamlmigrate.companion;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** Member symbols of a companion code unit (the class named by {@code x:Class}). */
public final class CompanionUnit {

    public final String qualifiedName;
    public final Set<String> fieldNames;
    public final Set<String> methodNames;

    public CompanionUnit(String qualifiedName, Set<String> fieldNames, Set<String> methodNames) {
        this.qualifiedName = Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        this.fieldNames = fieldNames == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(fieldNames));
        this.methodNames = methodNames == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(methodNames));
    }

    public String simpleName() {
        int dot = qualifiedName.lastIndexOf('.');
        return dot >= 0 ? qualifiedName.substring(dot + 1) : qualifiedName;
    }

    public boolean hasField(String name) {
        return fieldNames.contains(name);
    }

    public boolean hasMethod(String name) {
        return methodNames.contains(name);
    }

    @Override
    public String toString() {
        return "CompanionUnit{" + qualifiedName + "}";
    }
}
