package com.vidnyan.kpolicy.domain.result;

/**
 * Results for an object without a pod template.
 */
public record ResourceResult(
    String kind,
    String namespace,
    String name,
    ResultSet results
) {

    public CountSummary summary() {
        return results.summary();
    }
}
