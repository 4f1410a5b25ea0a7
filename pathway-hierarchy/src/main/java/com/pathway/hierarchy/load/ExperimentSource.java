package com.pathway.hierarchy.load;

import java.util.Optional;

/**
 * Source of experiment definition JSON (e.g. the document store behind the authoring UI).
 * Implementations are provided by the runtime.
 */
public interface ExperimentSource {

    /**
     * @param experimentId experiment id
     * @param version      version to load; null means the latest published version
     * @return definition JSON if present
     */
    Optional<String> find(String experimentId, String version);
}
