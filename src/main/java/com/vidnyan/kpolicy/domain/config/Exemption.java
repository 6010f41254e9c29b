package com.vidnyan.kpolicy.domain.config;

import java.util.List;

/**
 * Configuration-level exemption rule.
 * Every filter that is set must match; an empty {@code rules} list exempts all checks.
 */
public record Exemption(
    String namespace,
    List<String> controllerNames,
    List<String> containerNames,
    List<String> rules
) {

    public Exemption {
        controllerNames = controllerNames == null ? List.of() : List.copyOf(controllerNames);
        containerNames = containerNames == null ? List.of() : List.copyOf(containerNames);
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * Whether this rule exempts {@code checkId} for the given object and container.
     * Controller names match by prefix so generated pod names are covered.
     */
    public boolean exempts(String checkId, String namespace, String name, String containerName) {
        if (this.namespace != null && !this.namespace.isEmpty() && !this.namespace.equals(namespace)) {
            return false;
        }
        if (!controllerNames.isEmpty()
                && (name == null || controllerNames.stream().noneMatch(name::startsWith))) {
            return false;
        }
        if (!containerNames.isEmpty() && !containerNames.contains(containerName)) {
            return false;
        }
        return rules.isEmpty() || rules.contains(checkId);
    }
}
