package com.pathway.hierarchy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pathway.hierarchy.config.ExperimentDefinition;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of experiment definitions.
 * Unknown JSON properties (authoring-only fields such as task content) are ignored; nulls are excluded on write.
 */
public final class HierarchyConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private HierarchyConfig() {
    }

    /**
     * Deserializes an experiment definition from JSON.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static ExperimentDefinition fromJson(String json) {
        try {
            return MAPPER.readValue(json, ExperimentDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toJson(ExperimentDefinition definition) {
        try {
            return MAPPER.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static String toJsonPretty(ExperimentDefinition definition) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
