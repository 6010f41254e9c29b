package com.vidnyan.kpolicy.adapter.out.check;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.kpolicy.domain.check.CheckDefinition;
import com.vidnyan.kpolicy.domain.check.CheckPredicate;
import com.vidnyan.kpolicy.domain.check.IncludeExcludeList;
import com.vidnyan.kpolicy.domain.check.TargetScope;
import com.vidnyan.kpolicy.domain.error.CatalogLoadException;
import com.vidnyan.kpolicy.domain.error.MalformedCheckException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Decodes declarative check definitions (YAML or JSON) into {@link CheckDefinition}s.
 *
 * <p>The predicate is either an inline {@code schema} object or a {@code jsonSchema} string.
 */
@Slf4j
@RequiredArgsConstructor
public class SchemaCheckParser {

    private final ObjectMapper yamlMapper;

    /**
     * Decode a check. Any problem is a {@link CatalogLoadException} naming {@code source}.
     */
    public CheckDefinition parse(String checkId, JsonNode node, String source) {
        CheckDto dto = readDto(node, source);
        JsonNode schemaNode = readSchema(dto, source);
        CheckPredicate predicate;
        try {
            predicate = JsonSchemaPredicate.compile(schemaNode);
        } catch (RuntimeException e) {
            throw new CatalogLoadException(source, "invalid schema: " + e.getMessage(), e);
        }
        return build(checkId, dto, predicate, source);
    }

    /**
     * Decode a custom check. A schema that is missing, unparseable or does not compile yields a
     * definition whose predicate reports {@link MalformedCheckException} when it is evaluated,
     * so only passes that actually run the check are affected.
     *
     * @return empty if the definition itself cannot be decoded (not an object, bad target); the
     *         check is then unknown and passes that reference it fail with "check not found"
     */
    public Optional<CheckDefinition> parseCustom(String checkId, JsonNode node, String source) {
        CheckDto dto;
        try {
            dto = readDto(node, source);
        } catch (CatalogLoadException e) {
            log.warn("Dropping custom check {}: {}", checkId, e.getMessage());
            return Optional.empty();
        }
        CheckPredicate predicate;
        try {
            predicate = JsonSchemaPredicate.compile(readSchema(dto, source));
        } catch (RuntimeException e) {
            log.warn("Custom check {} has an invalid schema: {}", checkId, e.getMessage());
            String reason = "invalid schema: " + e.getMessage();
            predicate = fragment -> {
                throw new MalformedCheckException(reason, e);
            };
        }
        try {
            return Optional.of(build(checkId, dto, predicate, source));
        } catch (CatalogLoadException e) {
            log.warn("Dropping custom check {}: {}", checkId, e.getMessage());
            return Optional.empty();
        }
    }

    private CheckDto readDto(JsonNode node, String source) {
        if (node == null || !node.isObject()) {
            throw new CatalogLoadException(source, "check definition must be an object", null);
        }
        try {
            return yamlMapper.treeToValue(node, CheckDto.class);
        } catch (JsonProcessingException e) {
            throw new CatalogLoadException(source, e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new CatalogLoadException(source, e.getMessage(), e);
        }
    }

    private JsonNode readSchema(CheckDto dto, String source) {
        if (dto.schema != null && !dto.schema.isNull()) {
            return dto.schema;
        }
        if (dto.jsonSchema != null && !dto.jsonSchema.isBlank()) {
            try {
                return yamlMapper.readTree(dto.jsonSchema);
            } catch (JsonProcessingException e) {
                throw new CatalogLoadException(source, "jsonSchema is not valid JSON: " + e.getOriginalMessage(), e);
            }
        }
        throw new CatalogLoadException(source, "check has neither schema nor jsonSchema", null);
    }

    private CheckDefinition build(String checkId, CheckDto dto, CheckPredicate predicate, String source) {
        if (dto.target == null) {
            throw new CatalogLoadException(source, "target is required", null);
        }
        try {
            return CheckDefinition.builder()
                    .id(checkId)
                    .category(dto.category)
                    .target(TargetScope.fromValue(dto.target))
                    .schemaTarget(dto.schemaTarget == null ? null : TargetScope.fromValue(dto.schemaTarget))
                    .successMessage(dto.successMessage)
                    .failureMessage(dto.failureMessage)
                    .controllers(toList(dto.controllers))
                    .containers(toList(dto.containers))
                    .kinds(dto.kinds)
                    .predicate(predicate)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new CatalogLoadException(source, e.getMessage(), e);
        }
    }

    private IncludeExcludeList toList(IncludeExcludeDto dto) {
        if (dto == null) return IncludeExcludeList.ANY;
        return new IncludeExcludeList(dto.include, dto.exclude);
    }

    // DTO classes for YAML deserialization
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CheckDto {
        public String category;
        public String target;
        public String schemaTarget;
        public String successMessage;
        public String failureMessage;
        public IncludeExcludeDto controllers;
        public IncludeExcludeDto containers;
        public List<String> kinds;
        public JsonNode schema;
        public String jsonSchema;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class IncludeExcludeDto {
        public List<String> include;
        public List<String> exclude;
    }
}
