package com.vidnyan.kpolicy.application.port.in;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.kpolicy.domain.config.Configuration;
import com.vidnyan.kpolicy.domain.manifest.KubernetesResource;
import com.vidnyan.kpolicy.domain.manifest.Workload;
import com.vidnyan.kpolicy.domain.result.CountSummary;
import com.vidnyan.kpolicy.domain.result.ResourceResult;
import com.vidnyan.kpolicy.domain.result.WorkloadResult;

import java.util.List;

/**
 * Primary use case: validate manifests against a policy.
 */
public interface ValidateWorkloadUseCase {

    /**
     * Run controller, pod and container passes for one workload.
     * Errors from any pass propagate.
     */
    WorkloadResult validateWorkload(Configuration configuration, Workload workload);

    /**
     * Run other-object checks for a resource without a pod template.
     */
    ResourceResult validateResource(Configuration configuration, KubernetesResource resource);

    /**
     * Validate many objects. A failing object is reported in the audit and does not stop the others.
     */
    AuditReport audit(Configuration configuration, List<JsonNode> objects);

    /**
     * Audit outcome.
     */
    record AuditReport(
        List<WorkloadResult> workloads,
        List<ResourceResult> resources,
        List<AuditError> errors
    ) {
        public CountSummary summary() {
            CountSummary summary = CountSummary.empty();
            for (WorkloadResult workload : workloads) {
                summary = summary.plus(workload.summary());
            }
            for (ResourceResult resource : resources) {
                summary = summary.plus(resource.summary());
            }
            return summary;
        }

        public boolean hasErrors() {
            return !errors.isEmpty();
        }
    }

    /**
     * An object whose validation was aborted.
     */
    record AuditError(
        String objectIdentity,
        String checkId,
        String message
    ) {}
}
