package com.vidnyan.kpolicy.domain.engine;

import com.vidnyan.kpolicy.domain.check.CheckCatalog;
import com.vidnyan.kpolicy.domain.check.CheckDefinition;
import com.vidnyan.kpolicy.domain.check.TargetScope;
import com.vidnyan.kpolicy.domain.config.Configuration;
import com.vidnyan.kpolicy.domain.error.CheckNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Decides whether a configured check applies to the scope being evaluated.
 * An empty result means skip; an unknown check ID is an error.
 */
@Slf4j
public class ScopeResolver {

    /**
     * Resolve {@code checkId} and test both global and structural actionability.
     *
     * @throws CheckNotFoundException if neither the configuration nor the catalog defines the check
     */
    public Optional<CheckDefinition> resolve(CheckCatalog catalog, String checkId,
                                             EvaluationContext context, Configuration configuration) {
        CheckDefinition check = catalog.resolve(checkId, configuration)
                .orElseThrow(() -> new CheckNotFoundException(checkId, context.identity()));

        if (!isGloballyActionable(configuration, check.id(), context)) {
            log.debug("Skipping {} for {}: not actionable under configuration", check.id(), context.identity());
            return Optional.empty();
        }
        if (!isStructurallyActionable(check, context)) {
            return Optional.empty();
        }
        return Optional.of(check);
    }

    /**
     * Severity must not be {@code ignore} and no configuration exemption may cover the object.
     */
    public boolean isGloballyActionable(Configuration configuration, String checkId, EvaluationContext context) {
        if (!configuration.severityOf(checkId).isActionable()) {
            return false;
        }
        String namespace = context.meta().namespace();
        String name = context.meta().name();
        return configuration.exemptions().stream()
                .noneMatch(e -> e.exempts(checkId, namespace, name, context.containerName()));
    }

    /**
     * Target scope must match; controller kind, container type and resource kind filters must admit.
     */
    public boolean isStructurallyActionable(CheckDefinition check, EvaluationContext context) {
        if (check.target() != context.target()) {
            return false;
        }
        if (context.target() == TargetScope.OTHER) {
            return matchesKind(check, context);
        }
        if (!check.controllers().admits(context.kind())) {
            return false;
        }
        if (context.target() == TargetScope.CONTAINER) {
            String containerType = context.initContainer()
                    ? CheckDefinition.INIT_CONTAINER
                    : CheckDefinition.CONTAINER;
            return check.containers().admits(containerType);
        }
        return true;
    }

    private boolean matchesKind(CheckDefinition check, EvaluationContext context) {
        if (check.kinds().isEmpty()) {
            return true;
        }
        String qualified = context.apiGroup().isEmpty()
                ? context.kind()
                : context.apiGroup() + "/" + context.kind();
        return check.kinds().stream()
                .anyMatch(k -> k.equals(context.kind()) || k.equals(qualified));
    }
}
