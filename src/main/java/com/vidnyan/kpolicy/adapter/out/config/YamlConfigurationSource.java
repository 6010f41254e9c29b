package com.vidnyan.kpolicy.adapter.out.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.kpolicy.adapter.out.check.SchemaCheckParser;
import com.vidnyan.kpolicy.application.port.out.ConfigurationSource;
import com.vidnyan.kpolicy.domain.check.Severity;
import com.vidnyan.kpolicy.domain.config.Configuration;
import com.vidnyan.kpolicy.domain.config.Exemption;
import com.vidnyan.kpolicy.domain.error.CatalogLoadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads policy configuration from YAML.
 *
 * <pre>
 * checks:
 *   memoryLimitsMissing: warning
 * customChecks:
 *   myOrgCheck: { target: Container, schema: {...} }
 * exemptions:
 *   - namespace: kube-system
 *     controllerNames: [kube-proxy]
 *     rules: [hostNetworkSet]
 * disallowExemptions: false
 * </pre>
 */
@Slf4j
public class YamlConfigurationSource implements ConfigurationSource {

    public static final String DEFAULT_CONFIG = "config.yaml";

    private final ObjectMapper yamlMapper;
    private final SchemaCheckParser checkParser;

    public YamlConfigurationSource(ObjectMapper yamlMapper) {
        this.yamlMapper = yamlMapper;
        this.checkParser = new SchemaCheckParser(yamlMapper);
    }

    @Override
    public Configuration loadDefault() {
        ClassPathResource resource = new ClassPathResource(DEFAULT_CONFIG);
        try (InputStream in = resource.getInputStream()) {
            return parse(yamlMapper.readTree(in), "classpath:" + DEFAULT_CONFIG);
        } catch (IOException e) {
            throw new CatalogLoadException("classpath:" + DEFAULT_CONFIG, e.getMessage(), e);
        }
    }

    @Override
    public Configuration load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(yamlMapper.readTree(in), path.toString());
        } catch (IOException e) {
            throw new CatalogLoadException(path.toString(), e.getMessage(), e);
        }
    }

    /**
     * Decode a configuration tree. An empty document yields an empty configuration.
     */
    public Configuration parse(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return Configuration.builder().build();
        }
        ConfigDto dto;
        try {
            dto = yamlMapper.treeToValue(root, ConfigDto.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new CatalogLoadException(source, e.getMessage(), e);
        }

        Configuration.Builder builder = Configuration.builder()
                .disallowExemptions(Boolean.TRUE.equals(dto.disallowExemptions));
        if (dto.checks != null) {
            dto.checks.forEach((id, severity) -> builder.check(id, parseSeverity(id, severity, source)));
        }
        if (dto.customChecks != null) {
            dto.customChecks.forEach((id, node) ->
                    checkParser.parseCustom(id, node, source + "#customChecks." + id)
                            .ifPresent(builder::customCheck));
        }
        builder.exemptions(mapExemptions(dto.exemptions));

        Configuration configuration = builder.build();
        log.info("Loaded policy from {}: {} checks, {} custom, {} exemptions",
                source, configuration.checks().size(), configuration.customChecks().size(),
                configuration.exemptions().size());
        return configuration;
    }

    private Severity parseSeverity(String checkId, String value, String source) {
        try {
            return Severity.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new CatalogLoadException(source, "check " + checkId + ": " + e.getMessage(), e);
        }
    }

    private List<Exemption> mapExemptions(List<ExemptionDto> dtos) {
        List<Exemption> exemptions = new ArrayList<>();
        if (dtos == null) return exemptions;
        for (ExemptionDto dto : dtos) {
            exemptions.add(new Exemption(dto.namespace, dto.controllerNames, dto.containerNames, dto.rules));
        }
        return exemptions;
    }

    // DTO classes for YAML deserialization
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ConfigDto {
        public Map<String, String> checks;
        public Map<String, JsonNode> customChecks;
        public List<ExemptionDto> exemptions;
        public Boolean disallowExemptions;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ExemptionDto {
        public String namespace;
        public List<String> controllerNames;
        public List<String> containerNames;
        public List<String> rules;
    }
}
