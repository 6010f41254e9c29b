package com.vidnyan.kpolicy.application.port.out;

import com.vidnyan.kpolicy.domain.config.Configuration;

import java.nio.file.Path;

/**
 * Port for loading policy configuration.
 */
public interface ConfigurationSource {

    /**
     * The policy bundled with the application.
     */
    Configuration loadDefault();

    /**
     * A policy file on disk.
     */
    Configuration load(Path path);
}
