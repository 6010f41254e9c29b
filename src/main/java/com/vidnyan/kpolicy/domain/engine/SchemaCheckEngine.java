package com.vidnyan.kpolicy.domain.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.kpolicy.domain.check.CheckCatalog;
import com.vidnyan.kpolicy.domain.check.CheckDefinition;
import com.vidnyan.kpolicy.domain.check.TargetScope;
import com.vidnyan.kpolicy.domain.config.Configuration;
import com.vidnyan.kpolicy.domain.error.CheckNotFoundException;
import com.vidnyan.kpolicy.domain.error.MalformedCheckException;
import com.vidnyan.kpolicy.domain.manifest.KubernetesResource;
import com.vidnyan.kpolicy.domain.manifest.Workload;
import com.vidnyan.kpolicy.domain.result.ResultSet;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.function.Function;

/**
 * Applies configured checks to one scope of a manifest.
 *
 * <p>Every pass walks the configured check IDs in sorted order through the same pipeline:
 * annotation exemptions, scope resolution, evaluation, aggregation. Errors abort the pass;
 * a partially filled result set is never returned.
 *
 * <p>Holds no per-pass state, so one instance serves any number of concurrent passes.
 */
@Slf4j
public class SchemaCheckEngine {

    private final CheckCatalog catalog;
    private final ExemptionFilter exemptionFilter;
    private final ScopeResolver scopeResolver;
    private final CheckEvaluator evaluator;
    private final ResultAggregator aggregator;

    public SchemaCheckEngine(CheckCatalog catalog, ExemptionFilter exemptionFilter, ScopeResolver scopeResolver,
                             CheckEvaluator evaluator, ResultAggregator aggregator) {
        this.catalog = catalog;
        this.exemptionFilter = exemptionFilter;
        this.scopeResolver = scopeResolver;
        this.evaluator = evaluator;
        this.aggregator = aggregator;
    }

    public SchemaCheckEngine(CheckCatalog catalog) {
        this(catalog, new ExemptionFilter(), new ScopeResolver(), new CheckEvaluator(), new ResultAggregator());
    }

    public CheckCatalog catalog() {
        return catalog;
    }

    /**
     * Run pod-scope checks against the workload's pod spec.
     *
     * @throws CheckNotFoundException  if a configured check does not exist
     * @throws MalformedCheckException if a check cannot be evaluated
     */
    public ResultSet applyPodChecks(Configuration configuration, Workload workload) {
        EvaluationContext context = EvaluationContext.forWorkload(workload, TargetScope.POD);
        return run(configuration, context, workload.meta().annotations(),
                check -> evaluator.evaluate(check, workload, context.identity()));
    }

    /**
     * Run controller-scope checks against the original controller object.
     */
    public ResultSet applyControllerChecks(Configuration configuration, Workload workload) {
        EvaluationContext context = EvaluationContext.forWorkload(workload, TargetScope.CONTROLLER);
        return run(configuration, context, workload.meta().annotations(),
                check -> evaluator.evaluate(check, workload, context.identity()));
    }

    /**
     * Run container-scope checks against one container of the workload.
     */
    public ResultSet applyContainerChecks(Configuration configuration, Workload workload,
                                          JsonNode container, boolean initContainer) {
        EvaluationContext context = EvaluationContext.forContainer(
                workload, container.path("name").asText(""), initContainer);
        return run(configuration, context, workload.meta().annotations(),
                check -> evaluator.evaluate(check, workload, container, context.identity()));
    }

    /**
     * Run checks that target arbitrary resource kinds. Annotations are not consulted here.
     */
    public ResultSet applyOtherChecks(Configuration configuration, KubernetesResource resource) {
        EvaluationContext context = EvaluationContext.forResource(resource);
        return run(configuration, context, Map.of(),
                check -> evaluator.evaluate(check, resource));
    }

    private ResultSet run(Configuration configuration, EvaluationContext context,
                          Map<String, String> annotations, Function<CheckDefinition, Boolean> evaluate) {
        ResultSet results = new ResultSet();
        for (String checkId : configuration.sortedCheckIds()) {
            if (exemptionFilter.isExempt(annotations, checkId, configuration.disallowExemptions())) {
                log.debug("Skipping {} for {}: exempted by annotation", checkId, context.identity());
                continue;
            }
            CheckDefinition check = scopeResolver.resolve(catalog, checkId, context, configuration).orElse(null);
            if (check == null) {
                continue;
            }
            boolean passed = evaluate.apply(check);
            aggregator.recordInto(results, configuration, check, passed);
        }
        return results;
    }
}
