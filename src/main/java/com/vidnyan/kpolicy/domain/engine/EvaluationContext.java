package com.vidnyan.kpolicy.domain.engine;

import com.vidnyan.kpolicy.domain.check.TargetScope;
import com.vidnyan.kpolicy.domain.manifest.KubernetesResource;
import com.vidnyan.kpolicy.domain.manifest.ObjectMeta;
import com.vidnyan.kpolicy.domain.manifest.Workload;

/**
 * What is being evaluated in one pass. Lives for a single pass only.
 *
 * @param kind          object kind
 * @param apiGroup      API group of the object, empty for core and for workloads
 * @param meta          object metadata
 * @param target        scope being evaluated
 * @param containerName container name for container passes, empty otherwise
 * @param initContainer whether the container is an init container
 */
public record EvaluationContext(
    String kind,
    String apiGroup,
    ObjectMeta meta,
    TargetScope target,
    String containerName,
    boolean initContainer
) {

    public static EvaluationContext forWorkload(Workload workload, TargetScope target) {
        return new EvaluationContext(workload.kind(), "", workload.meta(), target, "", false);
    }

    public static EvaluationContext forContainer(Workload workload, String containerName, boolean initContainer) {
        return new EvaluationContext(workload.kind(), "", workload.meta(), TargetScope.CONTAINER,
                containerName == null ? "" : containerName, initContainer);
    }

    public static EvaluationContext forResource(KubernetesResource resource) {
        return new EvaluationContext(resource.kind(), resource.group(), resource.meta(), TargetScope.OTHER, "", false);
    }

    public String identity() {
        String base = kind + " " + meta.displayName();
        return containerName.isEmpty() ? base : base + " container " + containerName;
    }
}
