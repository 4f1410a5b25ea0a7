package com.pathway.hierarchy.load;

import com.pathway.hierarchy.ConfigurationException;
import com.pathway.hierarchy.HierarchyConfig;
import com.pathway.hierarchy.config.ExperimentDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads experiment definitions in order: {@link ExperimentSource} → {@code <experimentDir>/<experimentId>-<version>.json}
 * → {@code <experimentDir>/<experimentId>.json}. A source failure or an unparseable document is logged and the next
 * location is tried.
 */
public final class ExperimentLoader {

    private static final Logger log = LoggerFactory.getLogger(ExperimentLoader.class);

    private final ExperimentSource source;
    private final Path experimentDir;

    /**
     * @param source        optional source (null = local files only)
     * @param experimentDir directory for local definition files; null = no local lookup
     */
    public ExperimentLoader(ExperimentSource source, Path experimentDir) {
        this.source = source;
        this.experimentDir = experimentDir;
    }

    /**
     * Loads an experiment definition.
     *
     * @throws ConfigurationException when no location yields a parseable definition
     */
    public ExperimentDefinition load(String experimentId, String version) {
        if (experimentId == null || experimentId.isBlank()) {
            throw new ConfigurationException("Experiment id is required");
        }
        Optional<ExperimentDefinition> fromSource = fromSource(experimentId, version);
        if (fromSource.isPresent()) {
            log.info("Loaded experiment from source | experimentId={} | version={}", experimentId, version);
            return fromSource.get();
        }
        if (experimentDir != null) {
            if (version != null && !version.isBlank()) {
                Optional<ExperimentDefinition> versioned = fromFile(experimentDir.resolve(experimentId + "-" + version.trim() + ".json"));
                if (versioned.isPresent()) return versioned.get();
            }
            Optional<ExperimentDefinition> plain = fromFile(experimentDir.resolve(experimentId + ".json"));
            if (plain.isPresent()) return plain.get();
        }
        throw new ConfigurationException("No definition found for experiment " + experimentId
                + (version != null ? " version " + version : ""));
    }

    /**
     * Loads a definition directly from a file.
     *
     * @throws ConfigurationException when the file cannot be read or parsed
     */
    public static ExperimentDefinition loadFile(Path file) {
        try {
            return HierarchyConfig.fromJson(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException | UncheckedIOException e) {
            throw new ConfigurationException("Cannot read experiment file " + file + ": " + e.getMessage(), e);
        }
    }

    private Optional<ExperimentDefinition> fromSource(String experimentId, String version) {
        if (source == null) return Optional.empty();
        try {
            Optional<String> json = source.find(experimentId, version);
            if (json.isPresent() && !json.get().isBlank()) {
                return Optional.of(HierarchyConfig.fromJson(json.get()));
            }
        } catch (RuntimeException e) {
            log.warn("Experiment source lookup failed | experimentId={} | version={} | error={}", experimentId, version, e.getMessage(), e);
        }
        return Optional.empty();
    }

    private static Optional<ExperimentDefinition> fromFile(Path file) {
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            ExperimentDefinition definition = loadFile(file);
            log.info("Loaded experiment from file | path={}", file);
            return Optional.of(definition);
        } catch (ConfigurationException e) {
            log.warn("Skipping unreadable experiment file | path={} | error={}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
