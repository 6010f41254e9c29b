package com.vidnyan.kpolicy.domain.manifest;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A pod-bearing object: a bare Pod or a controller with a pod template.
 *
 * @param kind           object kind, e.g. "Deployment"
 * @param meta           metadata of the top-level object
 * @param podSpec        the pod spec (template spec for controllers)
 * @param originalObject the whole object as read
 */
public record Workload(
    String kind,
    ObjectMeta meta,
    JsonNode podSpec,
    JsonNode originalObject
) {

    // Path from the object root to its pod spec, by kind
    private static final Map<String, String> POD_SPEC_PATHS = Map.of(
            "Pod", "/spec",
            "Deployment", "/spec/template/spec",
            "StatefulSet", "/spec/template/spec",
            "DaemonSet", "/spec/template/spec",
            "ReplicaSet", "/spec/template/spec",
            "ReplicationController", "/spec/template/spec",
            "Job", "/spec/template/spec",
            "CronJob", "/spec/jobTemplate/spec/template/spec");

    /**
     * Build a workload from a manifest object, or empty if its kind carries no pod template.
     */
    public static Optional<Workload> from(JsonNode object) {
        String kind = object.path("kind").asText("");
        String path = POD_SPEC_PATHS.get(kind);
        if (path == null) {
            return Optional.empty();
        }
        return Optional.of(new Workload(kind, ObjectMeta.from(object), object.at(path), object));
    }

    public static boolean isWorkloadKind(String kind) {
        return POD_SPEC_PATHS.containsKey(kind);
    }

    public List<JsonNode> containers() {
        return list("containers");
    }

    public List<JsonNode> initContainers() {
        return list("initContainers");
    }

    private List<JsonNode> list(String field) {
        List<JsonNode> result = new ArrayList<>();
        if (podSpec != null) {
            podSpec.path(field).forEach(result::add);
        }
        return result;
    }

    public String identity() {
        return kind + " " + meta.displayName();
    }
}
