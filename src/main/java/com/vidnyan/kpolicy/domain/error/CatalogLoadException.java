package com.vidnyan.kpolicy.domain.error;

/**
 * A check definition or policy file could not be decoded.
 * Fatal when raised while loading the built-in catalog.
 */
public class CatalogLoadException extends PolicyEngineException {

    private final String source;

    public CatalogLoadException(String source, String message, Throwable cause) {
        super(String.format("Failed to load %s: %s", source, message), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
