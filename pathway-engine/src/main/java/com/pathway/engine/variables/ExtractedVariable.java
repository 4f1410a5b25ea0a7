package com.pathway.engine.variables;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A variable referenced by visibility rules or pick conditions, with its inferred type and domain.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExtractedVariable {

    private final String path;
    private final VariableType type;
    private final List<String> options;
    private final Double min;
    private final Double max;
    private final List<String> sources;

    @JsonCreator
    public ExtractedVariable(
            @JsonProperty("path") String path,
            @JsonProperty("type") VariableType type,
            @JsonProperty("options") List<String> options,
            @JsonProperty("min") Double min,
            @JsonProperty("max") Double max,
            @JsonProperty("sources") List<String> sources) {
        this.path = path;
        this.type = type != null ? type : VariableType.UNKNOWN;
        this.options = options != null && !options.isEmpty() ? List.copyOf(options) : null;
        this.min = min;
        this.max = max;
        this.sources = sources != null ? List.copyOf(sources) : List.of();
    }

    @JsonProperty("path")
    public String getPath() {
        return path;
    }

    @JsonProperty("type")
    public VariableType getType() {
        return type;
    }

    /** Known values for categorical variables; null when none were found. */
    @JsonProperty("options")
    public List<String> getOptions() {
        return options;
    }

    @JsonProperty("min")
    public Double getMin() {
        return min;
    }

    @JsonProperty("max")
    public Double getMax() {
        return max;
    }

    /** Ids of the nodes whose rules reference the variable. */
    @JsonProperty("sources")
    public List<String> getSources() {
        return sources;
    }

    @Override
    public String toString() {
        return "ExtractedVariable{" + path + ", " + type.toValue() + ", options=" + options + ", min=" + min + ", max=" + max + "}";
    }
}
