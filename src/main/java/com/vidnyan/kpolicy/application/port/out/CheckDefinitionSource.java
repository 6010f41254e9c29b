package com.vidnyan.kpolicy.application.port.out;

import com.vidnyan.kpolicy.domain.check.CheckDefinition;
import com.vidnyan.kpolicy.domain.error.CatalogLoadException;

import java.util.List;

/**
 * Port for loading the built-in check definitions.
 */
public interface CheckDefinitionSource {

    /**
     * Load every built-in check in evaluation order.
     *
     * @throws CatalogLoadException if any definition is missing or cannot be decoded
     */
    List<CheckDefinition> loadBuiltIns();
}
