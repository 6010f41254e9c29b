package com.vidnyan.kpolicy;

import com.vidnyan.kpolicy.application.port.in.ValidateWorkloadUseCase;
import com.vidnyan.kpolicy.domain.check.CheckCatalog;
import com.vidnyan.kpolicy.domain.config.Configuration;
import com.vidnyan.kpolicy.domain.result.WorkloadResult;
import com.vidnyan.kpolicy.support.Manifests;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class KpolicyApplicationTests {

    @Autowired
    private CheckCatalog checkCatalog;

    @Autowired
    private Configuration policyConfiguration;

    @Autowired
    private ValidateWorkloadUseCase validateWorkloadUseCase;

    @Test
    void contextLoads_WithBuiltInCatalogAndDefaultPolicy() {
        assertEquals(22, checkCatalog.size());
        assertFalse(policyConfiguration.checks().isEmpty());
    }

    @Test
    void wiredUseCase_ShouldValidateWorkload() {
        WorkloadResult result = validateWorkloadUseCase.validateWorkload(policyConfiguration,
                Manifests.workloadResource("manifests/deployment-no-memory-limits.yaml"));

        assertFalse(result.containerResults().get(0).results()
                .get("memoryLimitsMissing").orElseThrow().success());
    }
}
