package info.isaksson.erland.xamlmigrate.companion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** {@link CompanionCodeIndex} over units registered up front. Safe for concurrent reads once built. */
public final class InMemoryCompanionCodeIndex implements CompanionCodeIndex {

    private final Map<String, CompanionUnit> units = new LinkedHashMap<>();

    public InMemoryCompanionCodeIndex(List<CompanionUnit> units) {
        if (units == null) throw new IllegalArgumentException("units must not be null");
        for (CompanionUnit u : units) {
            this.units.putIfAbsent(u.qualifiedName, u);
        }
    }

    @Override
    public CompanionUnit findUnit(String qualifiedName) {
        return qualifiedName == null ? null : units.get(qualifiedName);
    }

    @Override
    public List<CompanionUnit> findBySimpleName(String simpleName) {
        if (simpleName == null) return List.of();
        List<CompanionUnit> out = new ArrayList<>();
        for (CompanionUnit u : units.values()) {
            if (u.simpleName().equals(simpleName)) out.add(u);
        }
        return Collections.unmodifiableList(out);
    }

    public int size() {
        return units.size();
    }
}
