package com.vidnyan.kpolicy.application.port.out;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for reading manifest objects from files.
 */
public interface ManifestSource {

    /**
     * Read all objects from a file, or from every manifest file under a directory.
     * List objects ({@code kind: List}) are flattened.
     */
    List<JsonNode> read(Path path);
}
