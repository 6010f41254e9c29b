package com.vidnyan.kpolicy.domain.check;

import java.util.List;
import java.util.Objects;

/**
 * A single structural check.
 * Immutable value object; the predicate is bound once, at decode time.
 *
 * <p>{@code target} is the scope the check runs in, {@code schemaTarget} the shape of the
 * fragment its predicate expects. They are equal except for container checks whose predicate
 * is written against a pod spec.
 */
public record CheckDefinition(
    String id,
    String category,
    TargetScope target,
    TargetScope schemaTarget,
    String successMessage,
    String failureMessage,
    IncludeExcludeList controllers,
    IncludeExcludeList containers,
    List<String> kinds,
    CheckPredicate predicate
) {

    public static final String CONTAINER = "container";
    public static final String INIT_CONTAINER = "initContainer";

    public CheckDefinition {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(predicate, "predicate");
        if (schemaTarget == null) {
            schemaTarget = target;
        }
        if (schemaTarget != target && !(target == TargetScope.CONTAINER && schemaTarget == TargetScope.POD)) {
            throw new IllegalArgumentException(String.format(
                    "Check %s: schema target %s is not compatible with target %s",
                    id, schemaTarget.value(), target.value()));
        }
        controllers = controllers == null ? IncludeExcludeList.ANY : controllers;
        containers = containers == null ? IncludeExcludeList.ANY : containers;
        kinds = kinds == null ? List.of() : List.copyOf(kinds);
    }

    /**
     * Copy with a different ID. Definitions are keyed by file name or configuration key.
     */
    public CheckDefinition withId(String newId) {
        return new CheckDefinition(newId, category, target, schemaTarget, successMessage,
                failureMessage, controllers, containers, kinds, predicate);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String category;
        private TargetScope target;
        private TargetScope schemaTarget;
        private String successMessage = "";
        private String failureMessage = "";
        private IncludeExcludeList controllers = IncludeExcludeList.ANY;
        private IncludeExcludeList containers = IncludeExcludeList.ANY;
        private List<String> kinds = List.of();
        private CheckPredicate predicate;

        public Builder id(String id) { this.id = id; return this; }
        public Builder category(String category) { this.category = category; return this; }
        public Builder target(TargetScope target) { this.target = target; return this; }
        public Builder schemaTarget(TargetScope schemaTarget) { this.schemaTarget = schemaTarget; return this; }
        public Builder successMessage(String msg) { this.successMessage = msg; return this; }
        public Builder failureMessage(String msg) { this.failureMessage = msg; return this; }
        public Builder controllers(IncludeExcludeList list) { this.controllers = list; return this; }
        public Builder containers(IncludeExcludeList list) { this.containers = list; return this; }
        public Builder kinds(List<String> kinds) { this.kinds = kinds; return this; }
        public Builder predicate(CheckPredicate predicate) { this.predicate = predicate; return this; }

        public CheckDefinition build() {
            return new CheckDefinition(id, category, target, schemaTarget, successMessage,
                    failureMessage, controllers, containers, kinds, predicate);
        }
    }
}
