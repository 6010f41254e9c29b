package com.vidnyan.kpolicy.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.vidnyan.kpolicy.adapter.out.check.ClasspathCheckDefinitionSource;
import com.vidnyan.kpolicy.adapter.out.config.YamlConfigurationSource;
import com.vidnyan.kpolicy.adapter.out.manifest.YamlManifestSource;
import com.vidnyan.kpolicy.application.port.in.ValidateWorkloadUseCase.AuditError;
import com.vidnyan.kpolicy.application.port.in.ValidateWorkloadUseCase.AuditReport;
import com.vidnyan.kpolicy.domain.check.CheckCatalog;
import com.vidnyan.kpolicy.domain.check.Severity;
import com.vidnyan.kpolicy.domain.config.Configuration;
import com.vidnyan.kpolicy.domain.engine.SchemaCheckEngine;
import com.vidnyan.kpolicy.domain.error.CheckNotFoundException;
import com.vidnyan.kpolicy.domain.manifest.Workload;
import com.vidnyan.kpolicy.domain.result.ContainerResult;
import com.vidnyan.kpolicy.domain.result.ResourceResult;
import com.vidnyan.kpolicy.domain.result.ResultRecord;
import com.vidnyan.kpolicy.domain.result.WorkloadResult;
import com.vidnyan.kpolicy.support.Manifests;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end validation with the bundled checks and default policy.
 */
class WorkloadValidationServiceTest {

    private static final YAMLMapper YAML = new YAMLMapper();

    private static WorkloadValidationService service;
    private static Configuration defaults;

    @BeforeAll
    static void setUp() {
        CheckCatalog catalog = CheckCatalog.of(new ClasspathCheckDefinitionSource(YAML).loadBuiltIns());
        service = new WorkloadValidationService(new SchemaCheckEngine(catalog));
        defaults = new YamlConfigurationSource(YAML).loadDefault();
    }

    private static ContainerResult container(WorkloadResult result, String name) {
        return result.containerResults().stream()
                .filter(c -> c.name().equals(name))
                .findFirst()
                .orElseThrow();
    }

    private static List<JsonNode> readManifests(String resource) throws URISyntaxException {
        Path path = Path.of(WorkloadValidationServiceTest.class.getClassLoader().getResource(resource).toURI());
        return new YamlManifestSource(YAML).read(path);
    }

    @Test
    void missingMemoryLimits_ShouldFail() {
        Workload workload = Manifests.workloadResource("manifests/deployment-no-memory-limits.yaml");

        WorkloadResult result = service.validateWorkload(defaults, workload);

        ResultRecord memory = container(result, "web").results().get("memoryLimitsMissing").orElseThrow();
        assertFalse(memory.success());
        assertEquals(Severity.WARNING, memory.severity());
        assertEquals("Resources", memory.category());
        assertEquals("Memory limits should be set", memory.message());
        assertTrue(container(result, "web").results().get("cpuLimitsMissing").orElseThrow().success());
        assertTrue(container(result, "web").results().get("tagNotSpecified").orElseThrow().success());
    }

    @Test
    void memoryLimitsExemption_ShouldDropOnlyThatCheck() {
        Workload workload = Manifests.workloadResource("manifests/deployment-no-memory-limits-exempt.yaml");

        WorkloadResult result = service.validateWorkload(defaults, workload);

        ContainerResult web = container(result, "web");
        assertFalse(web.results().contains("memoryLimitsMissing"));
        assertTrue(web.results().contains("memoryRequestsMissing"));
        assertTrue(web.results().contains("cpuLimitsMissing"));
    }

    @Test
    void disallowedExemptions_ShouldRestoreMemoryLimitsResult() {
        Workload workload = Manifests.workloadResource("manifests/deployment-no-memory-limits-exempt.yaml");

        WorkloadResult result = service.validateWorkload(defaults.withDisallowExemptions(true), workload);

        ResultRecord memory = container(result, "web").results().get("memoryLimitsMissing").orElseThrow();
        assertFalse(memory.success());
    }

    @Test
    void unknownCustomCheck_ShouldFailWithCheckNotFound() {
        Workload workload = Manifests.workloadResource("manifests/deployment-no-memory-limits.yaml");
        Configuration conf = Configuration.builder()
                .checks(defaults.checks())
                .check("myOrgCheck", Severity.DANGER)
                .build();

        CheckNotFoundException e = assertThrows(CheckNotFoundException.class,
                () -> service.validateWorkload(conf, workload));

        assertEquals("myOrgCheck", e.getCheckId());
        assertTrue(e.getMessage().contains("default/web"));

        AuditReport report = service.audit(conf, List.of(workload.originalObject()));
        assertTrue(report.workloads().isEmpty());
        assertEquals(1, report.errors().size());
        assertEquals("myOrgCheck", report.errors().get(0).checkId());
    }

    @Test
    void hardenedPod_ShouldPassEveryCheck() {
        Workload workload = Manifests.workloadResource("manifests/hardened-pod.yaml");

        WorkloadResult result = service.validateWorkload(defaults, workload);

        assertEquals(0, result.summary().warnings());
        assertEquals(0, result.summary().dangers());
        assertEquals(100, result.summary().score());
        assertEquals(List.of("setup", "app"),
                result.containerResults().stream().map(ContainerResult::name).toList());
        assertTrue(container(result, "setup").initContainer());
        // Probe checks do not apply to init containers
        assertFalse(container(result, "setup").results().contains("readinessProbeMissing"));
        assertTrue(container(result, "app").results().contains("readinessProbeMissing"));
    }

    @Test
    void validation_ShouldBeRepeatable() {
        Workload workload = Manifests.workloadResource("manifests/hardened-pod.yaml");

        WorkloadResult first = service.validateWorkload(defaults, workload);
        WorkloadResult second = service.validateWorkload(defaults, workload);

        assertEquals(first, second);
    }

    @Test
    void concurrentValidation_ShouldMatchSequentialResult() {
        Workload workload = Manifests.workloadResource("manifests/deployment-no-memory-limits.yaml");
        WorkloadResult expected = service.validateWorkload(defaults, workload);

        List<WorkloadResult> results = IntStream.range(0, 64)
                .parallel()
                .mapToObj(i -> service.validateWorkload(defaults, workload))
                .toList();

        results.forEach(r -> assertEquals(expected, r));
    }

    @Test
    void audit_ShouldCoverWorkloadsAndOtherObjects() throws URISyntaxException {
        AuditReport report = service.audit(defaults, readManifests("manifests/mixed.yaml"));

        assertFalse(report.hasErrors());
        assertEquals(1, report.workloads().size());
        WorkloadResult agent = report.workloads().get(0);
        assertFalse(agent.podResults().get("hostNetworkSet").orElseThrow().success());
        ResultRecord tag = container(agent, "agent").results().get("tagNotSpecified").orElseThrow();
        assertFalse(tag.success());
        assertEquals(Severity.DANGER, tag.severity());

        assertEquals(List.of("Ingress", "Service"),
                report.resources().stream().map(ResourceResult::kind).toList());
        ResourceResult ingress = report.resources().get(0);
        assertFalse(ingress.results().get("tlsSettingsMissing").orElseThrow().success());
        assertTrue(report.resources().get(1).results().isEmpty());
        assertTrue(report.summary().dangers() >= 1);
    }

    @Test
    void audit_ShouldReportMalformedCustomCheckAndContinue() throws URISyntaxException {
        Configuration custom = new YamlConfigurationSource(YAML)
                .parse(Manifests.resource("policies/custom.yaml"), "custom.yaml");

        AuditReport report = service.audit(custom, readManifests("manifests/mixed.yaml"));

        assertEquals(1, report.errors().size());
        AuditError error = report.errors().get(0);
        assertEquals("brokenCheck", error.checkId());
        assertEquals("DaemonSet monitoring/agent", error.objectIdentity());
        assertTrue(report.workloads().isEmpty());
        assertEquals(2, report.resources().size());
    }
}
