package com.vidnyan.kpolicy.domain.manifest;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Any object without a pod template (Ingress, PodDisruptionBudget, ...).
 */
public record KubernetesResource(
    String apiVersion,
    String kind,
    ObjectMeta meta,
    JsonNode object
) {

    public static KubernetesResource from(JsonNode object) {
        return new KubernetesResource(
                object.path("apiVersion").asText(""),
                object.path("kind").asText(""),
                ObjectMeta.from(object),
                object);
    }

    /**
     * API group, empty for the core group.
     */
    public String group() {
        int slash = apiVersion.indexOf('/');
        return slash < 0 ? "" : apiVersion.substring(0, slash);
    }

    public String identity() {
        return kind + " " + meta.displayName();
    }
}
