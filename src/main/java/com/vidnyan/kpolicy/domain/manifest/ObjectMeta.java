package com.vidnyan.kpolicy.domain.manifest;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Object metadata used for exemptions and actionability.
 */
public record ObjectMeta(
    String namespace,
    String name,
    Map<String, String> annotations
) {

    public ObjectMeta {
        namespace = namespace == null ? "" : namespace;
        name = name == null ? "" : name;
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
    }

    /**
     * Read {@code metadata} from a manifest object. Missing fields become empty.
     */
    public static ObjectMeta from(JsonNode object) {
        JsonNode metadata = object == null ? null : object.path("metadata");
        if (metadata == null || !metadata.isObject()) {
            return new ObjectMeta("", "", Map.of());
        }
        Map<String, String> annotations = new LinkedHashMap<>();
        metadata.path("annotations").fields()
                .forEachRemaining(e -> annotations.put(e.getKey(), e.getValue().asText()));
        return new ObjectMeta(
                metadata.path("namespace").asText(""),
                metadata.path("name").asText(""),
                annotations);
    }

    public String displayName() {
        return namespace.isEmpty() ? name : namespace + "/" + name;
    }
}
