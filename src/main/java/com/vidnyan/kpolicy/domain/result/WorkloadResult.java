package com.vidnyan.kpolicy.domain.result;

import java.util.List;

/**
 * All results for one workload: controller, pod and per-container passes.
 */
public record WorkloadResult(
    String kind,
    String namespace,
    String name,
    ResultSet controllerResults,
    ResultSet podResults,
    List<ContainerResult> containerResults
) {

    public WorkloadResult {
        containerResults = List.copyOf(containerResults);
    }

    public CountSummary summary() {
        CountSummary summary = controllerResults.summary().plus(podResults.summary());
        for (ContainerResult container : containerResults) {
            summary = summary.plus(container.results().summary());
        }
        return summary;
    }
}
