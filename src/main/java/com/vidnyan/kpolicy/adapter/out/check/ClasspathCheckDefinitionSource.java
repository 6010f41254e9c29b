package com.vidnyan.kpolicy.adapter.out.check;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.kpolicy.application.port.out.CheckDefinitionSource;
import com.vidnyan.kpolicy.domain.check.CheckDefinition;
import com.vidnyan.kpolicy.domain.error.CatalogLoadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads built-in checks from {@code checks/<id>.yaml} on the classpath.
 */
@Slf4j
public class ClasspathCheckDefinitionSource implements CheckDefinitionSource {

    // Explicit order keeps evaluation-order-dependent fixtures stable
    public static final List<String> BUILT_IN_ORDER = List.of(
            // Controller checks
            "multipleReplicasForDeployment",
            // Pod checks
            "hostIPCSet",
            "hostPIDSet",
            "hostNetworkSet",
            // Container checks
            "memoryLimitsMissing",
            "memoryRequestsMissing",
            "cpuLimitsMissing",
            "cpuRequestsMissing",
            "readinessProbeMissing",
            "livenessProbeMissing",
            "pullPolicyNotAlways",
            "tagNotSpecified",
            "hostPortSet",
            "runAsRootAllowed",
            "runAsPrivileged",
            "notReadOnlyRootFilesystem",
            "privilegeEscalationAllowed",
            "dangerousCapabilities",
            "insecureCapabilities",
            "priorityClassNotSet",
            // Other checks
            "tlsSettingsMissing",
            "pdbDisruptionsAllowedGreaterThanZero"
    );

    private final ObjectMapper yamlMapper;
    private final SchemaCheckParser parser;
    private final String location;
    private final List<String> order;

    public ClasspathCheckDefinitionSource(ObjectMapper yamlMapper) {
        this(yamlMapper, "checks", BUILT_IN_ORDER);
    }

    public ClasspathCheckDefinitionSource(ObjectMapper yamlMapper, String location, List<String> order) {
        this.yamlMapper = yamlMapper;
        this.parser = new SchemaCheckParser(yamlMapper);
        this.location = location;
        this.order = List.copyOf(order);
    }

    @Override
    public List<CheckDefinition> loadBuiltIns() {
        List<CheckDefinition> checks = new ArrayList<>();
        for (String checkId : order) {
            String path = location + "/" + checkId + ".yaml";
            checks.add(parser.parse(checkId, readResource(new ClassPathResource(path), path), path));
        }
        log.info("Loaded {} built-in checks from classpath:{}", checks.size(), location);
        return checks;
    }

    private JsonNode readResource(Resource resource, String path) {
        if (!resource.exists()) {
            throw new CatalogLoadException(path, "resource not found", null);
        }
        try (InputStream in = resource.getInputStream()) {
            return yamlMapper.readTree(in);
        } catch (IOException e) {
            throw new CatalogLoadException(path, e.getMessage(), e);
        }
    }
}
