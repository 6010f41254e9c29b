package com.vidnyan.kpolicy;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the policy engine.
 * Can be configured via application.yml or command-line properties.
 */
@Data
@Component
@ConfigurationProperties(prefix = "kpolicy")
public class PolicyProperties {

    /**
     * Policy file to use instead of the bundled config.yaml.
     */
    private String configPath;

    /**
     * Forces annotation exemptions off regardless of the policy file.
     */
    private boolean disallowExemptions;

    private final Audit audit = new Audit();

    @Data
    public static class Audit {
        /**
         * Manifest file or directory to audit on startup. Nothing runs if unset.
         */
        private String path;
    }
}
