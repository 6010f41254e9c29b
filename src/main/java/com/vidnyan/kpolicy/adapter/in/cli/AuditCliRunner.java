package com.vidnyan.kpolicy.adapter.in.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.kpolicy.PolicyProperties;
import com.vidnyan.kpolicy.application.port.in.ValidateWorkloadUseCase;
import com.vidnyan.kpolicy.application.port.in.ValidateWorkloadUseCase.AuditError;
import com.vidnyan.kpolicy.application.port.in.ValidateWorkloadUseCase.AuditReport;
import com.vidnyan.kpolicy.application.port.out.ManifestSource;
import com.vidnyan.kpolicy.domain.config.Configuration;
import com.vidnyan.kpolicy.domain.result.ContainerResult;
import com.vidnyan.kpolicy.domain.result.CountSummary;
import com.vidnyan.kpolicy.domain.result.ResourceResult;
import com.vidnyan.kpolicy.domain.result.ResultRecord;
import com.vidnyan.kpolicy.domain.result.ResultSet;
import com.vidnyan.kpolicy.domain.result.WorkloadResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * CLI Runner for one-shot audits.
 * Runs when kpolicy.audit.path is set. The exit code, picked up by {@code KpolicyApplication.main},
 * is 1 if any danger-level check fails or an object could not be validated, 2 if the audit
 * could not run at all.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditCliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_FINDINGS = 1;
    static final int EXIT_FAILURE = 2;

    private final ValidateWorkloadUseCase validateWorkloadUseCase;
    private final ManifestSource manifestSource;
    private final Configuration policyConfiguration;
    private final PolicyProperties properties;

    private int exitCode;

    @Override
    public void run(String... args) {
        String auditPath = properties.getAudit().getPath();
        if (auditPath == null || auditPath.isBlank()) {
            log.info("No audit path specified. Set kpolicy.audit.path property.");
            return;
        }

        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" kpolicy audit: {}", auditPath);
        log.info("═══════════════════════════════════════════════════════════════");

        try {
            List<JsonNode> objects = manifestSource.read(Path.of(auditPath));
            AuditReport report = validateWorkloadUseCase.audit(policyConfiguration, objects);
            printReport(report);

            if (report.hasErrors() || report.summary().dangers() > 0) {
                exitCode = EXIT_FINDINGS;
            }
        } catch (RuntimeException e) {
            log.error("Audit of {} failed: {}", auditPath, e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void printReport(AuditReport report) {
        for (WorkloadResult workload : report.workloads()) {
            log.info("");
            log.info(" {} {}/{}", workload.kind(), workload.namespace(), workload.name());
            printResults("controller", workload.controllerResults());
            printResults("pod", workload.podResults());
            for (ContainerResult container : workload.containerResults()) {
                printResults((container.initContainer() ? "initContainer " : "container ") + container.name(),
                        container.results());
            }
        }
        for (ResourceResult resource : report.resources()) {
            if (resource.results().isEmpty()) continue;
            log.info("");
            log.info(" {} {}/{}", resource.kind(), resource.namespace(), resource.name());
            printResults("object", resource.results());
        }

        if (report.hasErrors()) {
            log.info("");
            log.info(" ERRORS:");
            for (AuditError error : report.errors()) {
                log.error("   {} [{}]: {}", error.objectIdentity(), error.checkId(), error.message());
            }
        }

        CountSummary summary = report.summary();
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" Passing:  {}", summary.successes());
        log.info(" Warnings: {}", summary.warnings());
        log.info(" Dangers:  {}", summary.dangers());
        log.info(" Score:    {}%", summary.score());
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private void printResults(String scope, ResultSet results) {
        for (ResultRecord record : results) {
            String status = record.success() ? "PASS" : record.severity().value().toUpperCase(Locale.ROOT);
            log.info("   [{}] {} {}: {}", status, scope, record.id(), record.message());
        }
    }
}
