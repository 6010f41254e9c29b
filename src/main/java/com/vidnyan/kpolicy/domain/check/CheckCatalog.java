package com.vidnyan.kpolicy.domain.check;

import com.vidnyan.kpolicy.domain.config.Configuration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in checks in their declared order.
 * Immutable once constructed; custom checks come from the per-call {@link Configuration}
 * and are never added here.
 */
public final class CheckCatalog {

    private final Map<String, CheckDefinition> builtIns;

    private CheckCatalog(Map<String, CheckDefinition> builtIns) {
        this.builtIns = Collections.unmodifiableMap(builtIns);
    }

    /**
     * Build a catalog from definitions in evaluation order. Duplicate IDs are rejected.
     */
    public static CheckCatalog of(List<CheckDefinition> definitions) {
        Map<String, CheckDefinition> ordered = new LinkedHashMap<>();
        for (CheckDefinition definition : definitions) {
            if (ordered.putIfAbsent(definition.id(), definition) != null) {
                throw new IllegalArgumentException("Duplicate built-in check: " + definition.id());
            }
        }
        return new CheckCatalog(ordered);
    }

    public static CheckCatalog empty() {
        return new CheckCatalog(new LinkedHashMap<>());
    }

    /**
     * Resolve a check ID; custom checks shadow built-ins with the same ID.
     */
    public Optional<CheckDefinition> resolve(String checkId, Configuration configuration) {
        CheckDefinition custom = configuration.customChecks().get(checkId);
        if (custom != null) {
            return Optional.of(custom);
        }
        return Optional.ofNullable(builtIns.get(checkId));
    }

    public Optional<CheckDefinition> builtIn(String checkId) {
        return Optional.ofNullable(builtIns.get(checkId));
    }

    public List<String> builtInIds() {
        return List.copyOf(builtIns.keySet());
    }

    public int size() {
        return builtIns.size();
    }
}
