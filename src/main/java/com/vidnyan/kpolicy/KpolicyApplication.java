package com.vidnyan.kpolicy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * kpolicy - Kubernetes workload policy engine.
 *
 * Audits manifests against configurable JSON-schema checks.
 */
@SpringBootApplication
public class KpolicyApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(KpolicyApplication.class, args)));
    }
}
