package com.vidnyan.kpolicy.adapter.out.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.kpolicy.application.port.out.ManifestSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads multi-document YAML (or JSON) manifests from disk.
 */
@Slf4j
@RequiredArgsConstructor
public class YamlManifestSource implements ManifestSource {

    private final ObjectMapper yamlMapper;

    @Override
    public List<JsonNode> read(Path path) {
        List<JsonNode> objects = new ArrayList<>();
        for (Path file : manifestFiles(path)) {
            readFile(file, objects);
        }
        log.info("Read {} objects from {}", objects.size(), path);
        return objects;
    }

    private List<Path> manifestFiles(Path path) {
        if (!Files.isDirectory(path)) {
            return List.of(path);
        }
        try (Stream<Path> files = Files.walk(path)) {
            return files.filter(Files::isRegularFile)
                    .filter(this::isManifestFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list manifests under " + path, e);
        }
    }

    private boolean isManifestFile(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json");
    }

    private void readFile(Path file, List<JsonNode> objects) {
        try (MappingIterator<JsonNode> documents = yamlMapper.readerFor(JsonNode.class).readValues(file.toFile())) {
            while (documents.hasNext()) {
                collect(documents.next(), objects);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read manifest " + file, e);
        }
    }

    private void collect(JsonNode document, List<JsonNode> objects) {
        if (document == null || !document.isObject()) {
            return;
        }
        if (document.path("kind").asText().endsWith("List")) {
            document.path("items").forEach(item -> collect(item, objects));
            return;
        }
        if (document.hasNonNull("kind")) {
            objects.add(document);
        }
    }
}
