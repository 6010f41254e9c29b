package com.vidnyan.kpolicy.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.vidnyan.kpolicy.PolicyProperties;
import com.vidnyan.kpolicy.adapter.out.check.ClasspathCheckDefinitionSource;
import com.vidnyan.kpolicy.adapter.out.config.YamlConfigurationSource;
import com.vidnyan.kpolicy.adapter.out.manifest.YamlManifestSource;
import com.vidnyan.kpolicy.application.port.in.ValidateWorkloadUseCase;
import com.vidnyan.kpolicy.application.port.out.CheckDefinitionSource;
import com.vidnyan.kpolicy.application.port.out.ConfigurationSource;
import com.vidnyan.kpolicy.application.port.out.ManifestSource;
import com.vidnyan.kpolicy.application.service.WorkloadValidationService;
import com.vidnyan.kpolicy.domain.check.CheckCatalog;
import com.vidnyan.kpolicy.domain.config.Configuration;
import com.vidnyan.kpolicy.domain.engine.SchemaCheckEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;

/**
 * Spring configuration for the policy engine.
 * Wires together the clean architecture components.
 */
@Slf4j
@org.springframework.context.annotation.Configuration
public class PolicyEngineConfiguration {

    /**
     * ObjectMapper for check definitions, policy files and manifests.
     */
    @Bean
    public ObjectMapper yamlMapper() {
        return YAMLMapper.builder()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .build();
    }

    @Bean
    public CheckDefinitionSource checkDefinitionSource(ObjectMapper yamlMapper) {
        return new ClasspathCheckDefinitionSource(yamlMapper);
    }

    @Bean
    public ConfigurationSource configurationSource(ObjectMapper yamlMapper) {
        return new YamlConfigurationSource(yamlMapper);
    }

    @Bean
    public ManifestSource manifestSource(ObjectMapper yamlMapper) {
        return new YamlManifestSource(yamlMapper);
    }

    /**
     * Built-in catalog. A broken definition fails context startup.
     */
    @Bean
    public CheckCatalog checkCatalog(CheckDefinitionSource source) {
        CheckCatalog catalog = CheckCatalog.of(source.loadBuiltIns());
        log.info("Check catalog ready: {}", catalog.builtInIds());
        return catalog;
    }

    /**
     * Active policy: the configured file if set, the bundled default otherwise.
     */
    @Bean
    public Configuration policyConfiguration(ConfigurationSource source, PolicyProperties properties) {
        Configuration configuration = properties.getConfigPath() == null || properties.getConfigPath().isBlank()
                ? source.loadDefault()
                : source.load(Path.of(properties.getConfigPath()));
        if (properties.isDisallowExemptions()) {
            configuration = configuration.withDisallowExemptions(true);
        }
        return configuration;
    }

    @Bean
    public SchemaCheckEngine schemaCheckEngine(CheckCatalog checkCatalog) {
        return new SchemaCheckEngine(checkCatalog);
    }

    @Bean
    public ValidateWorkloadUseCase validateWorkloadUseCase(SchemaCheckEngine engine) {
        return new WorkloadValidationService(engine);
    }
}
