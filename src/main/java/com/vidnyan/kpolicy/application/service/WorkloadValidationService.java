package com.vidnyan.kpolicy.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.kpolicy.application.port.in.ValidateWorkloadUseCase;
import com.vidnyan.kpolicy.domain.config.Configuration;
import com.vidnyan.kpolicy.domain.engine.SchemaCheckEngine;
import com.vidnyan.kpolicy.domain.error.CheckNotFoundException;
import com.vidnyan.kpolicy.domain.error.MalformedCheckException;
import com.vidnyan.kpolicy.domain.manifest.KubernetesResource;
import com.vidnyan.kpolicy.domain.manifest.Workload;
import com.vidnyan.kpolicy.domain.result.ContainerResult;
import com.vidnyan.kpolicy.domain.result.ResourceResult;
import com.vidnyan.kpolicy.domain.result.ResultSet;
import com.vidnyan.kpolicy.domain.result.WorkloadResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Orchestrates the per-scope passes of {@link SchemaCheckEngine} for whole objects.
 */
@Slf4j
@RequiredArgsConstructor
public class WorkloadValidationService implements ValidateWorkloadUseCase {

    private final SchemaCheckEngine engine;

    @Override
    public WorkloadResult validateWorkload(Configuration configuration, Workload workload) {
        ResultSet controllerResults = engine.applyControllerChecks(configuration, workload);
        ResultSet podResults = engine.applyPodChecks(configuration, workload);

        List<ContainerResult> containerResults = new ArrayList<>();
        for (JsonNode container : workload.initContainers()) {
            containerResults.add(new ContainerResult(container.path("name").asText(""), true,
                    engine.applyContainerChecks(configuration, workload, container, true)));
        }
        for (JsonNode container : workload.containers()) {
            containerResults.add(new ContainerResult(container.path("name").asText(""), false,
                    engine.applyContainerChecks(configuration, workload, container, false)));
        }

        return new WorkloadResult(workload.kind(), workload.meta().namespace(), workload.meta().name(),
                controllerResults, podResults, containerResults);
    }

    @Override
    public ResourceResult validateResource(Configuration configuration, KubernetesResource resource) {
        ResultSet results = engine.applyOtherChecks(configuration, resource);
        return new ResourceResult(resource.kind(), resource.meta().namespace(), resource.meta().name(), results);
    }

    @Override
    public AuditReport audit(Configuration configuration, List<JsonNode> objects) {
        List<WorkloadResult> workloads = new ArrayList<>();
        List<ResourceResult> resources = new ArrayList<>();
        List<AuditError> errors = new ArrayList<>();

        for (JsonNode object : objects) {
            Optional<Workload> workload = Workload.from(object);
            String identity = workload.map(Workload::identity)
                    .orElseGet(() -> KubernetesResource.from(object).identity());
            try {
                if (workload.isPresent()) {
                    workloads.add(validateWorkload(configuration, workload.get()));
                } else {
                    resources.add(validateResource(configuration, KubernetesResource.from(object)));
                }
            } catch (CheckNotFoundException e) {
                log.error("Validation of {} aborted: {}", identity, e.getMessage());
                errors.add(new AuditError(identity, e.getCheckId(), e.getMessage()));
            } catch (MalformedCheckException e) {
                log.error("Validation of {} aborted: {}", identity, e.getMessage());
                errors.add(new AuditError(identity, e.getCheckId(), e.getMessage()));
            }
        }

        log.info("Audited {} workloads and {} other objects, {} errors",
                workloads.size(), resources.size(), errors.size());
        return new AuditReport(workloads, resources, errors);
    }
}
