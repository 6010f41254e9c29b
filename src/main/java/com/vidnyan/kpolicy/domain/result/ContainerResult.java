package com.vidnyan.kpolicy.domain.result;

/**
 * Results for one container of a workload.
 */
public record ContainerResult(
    String name,
    boolean initContainer,
    ResultSet results
) {
}
