package com.vidnyan.kpolicy.domain.config;

import com.vidnyan.kpolicy.domain.check.CheckDefinition;
import com.vidnyan.kpolicy.domain.check.Severity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Active policy for one evaluation call.
 * Immutable; the same instance may be shared by concurrent passes.
 */
public record Configuration(
    Map<String, Severity> checks,
    Map<String, CheckDefinition> customChecks,
    List<Exemption> exemptions,
    boolean disallowExemptions
) {

    public Configuration {
        checks = checks == null ? Map.of() : Map.copyOf(checks);
        customChecks = customChecks == null ? Map.of() : Map.copyOf(customChecks);
        exemptions = exemptions == null ? List.of() : List.copyOf(exemptions);
    }

    /**
     * Configured check IDs in lexicographic order.
     */
    public Set<String> sortedCheckIds() {
        return new TreeSet<>(checks.keySet());
    }

    public Severity severityOf(String checkId) {
        return checks.getOrDefault(checkId, Severity.IGNORE);
    }

    public Configuration withDisallowExemptions(boolean disallow) {
        return new Configuration(checks, customChecks, exemptions, disallow);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Severity> checks = new LinkedHashMap<>();
        private final Map<String, CheckDefinition> customChecks = new LinkedHashMap<>();
        private List<Exemption> exemptions = List.of();
        private boolean disallowExemptions;

        public Builder check(String id, Severity severity) { checks.put(id, severity); return this; }
        public Builder checks(Map<String, Severity> all) { checks.putAll(all); return this; }
        public Builder customCheck(CheckDefinition check) { customChecks.put(check.id(), check); return this; }
        public Builder exemptions(List<Exemption> list) { this.exemptions = list; return this; }
        public Builder disallowExemptions(boolean disallow) { this.disallowExemptions = disallow; return this; }

        public Configuration build() {
            return new Configuration(checks, customChecks, exemptions, disallowExemptions);
        }
    }
}
