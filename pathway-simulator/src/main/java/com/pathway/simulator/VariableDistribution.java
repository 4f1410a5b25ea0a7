package com.pathway.simulator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pathway.engine.variables.VariableType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SplittableRandom;

/**
 * How values of one variable are drawn for synthetic participants.
 * <ul>
 *   <li>categorical: {@code distribution} maps each option to a weight; without it {@code options} are uniform.</li>
 *   <li>numeric: {@code distribution} is {@code uniform} (default) or {@code normal} over [{@code min}, {@code max}];
 *   normal uses the midpoint as mean and a sixth of the range as standard deviation, clamped to the range.</li>
 *   <li>boolean: true with probability {@code truePercentage}.</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class VariableDistribution {

    public static final String UNIFORM = "uniform";
    public static final String NORMAL = "normal";

    private final VariableType type;
    private final Map<String, Double> weights;
    private final String shape;
    private final List<String> options;
    private final Double min;
    private final Double max;
    private final Double truePercentage;

    @JsonCreator
    public VariableDistribution(
            @JsonProperty("type") VariableType type,
            @JsonProperty("distribution") Object distribution,
            @JsonProperty("options") List<String> options,
            @JsonProperty("min") Double min,
            @JsonProperty("max") Double max,
            @JsonProperty("truePercentage") Double truePercentage) {
        this.type = type != null ? type : VariableType.CATEGORICAL;
        this.weights = toWeights(distribution);
        this.shape = distribution instanceof String ? ((String) distribution).trim().toLowerCase(Locale.ROOT) : null;
        this.options = options != null ? List.copyOf(options) : List.of();
        this.min = min;
        this.max = max;
        this.truePercentage = truePercentage;
    }

    public static VariableDistribution categorical(Map<String, Double> weights) {
        return new VariableDistribution(VariableType.CATEGORICAL, weights, null, null, null, null);
    }

    public static VariableDistribution options(List<String> options) {
        return new VariableDistribution(VariableType.CATEGORICAL, null, options, null, null, null);
    }

    public static VariableDistribution numeric(double min, double max, String shape) {
        return new VariableDistribution(VariableType.NUMERIC, shape, null, min, max, null);
    }

    public static VariableDistribution bool(double truePercentage) {
        return new VariableDistribution(VariableType.BOOLEAN, null, null, null, null, truePercentage);
    }

    @JsonProperty("type")
    public VariableType getType() {
        return type;
    }

    /** Option weights of a categorical variable, or the shape name of a numeric one. */
    @JsonProperty("distribution")
    public Object getDistribution() {
        return !weights.isEmpty() ? weights : shape;
    }

    @JsonIgnore
    public Map<String, Double> getWeights() {
        return weights;
    }

    /** Numeric shape; {@link #UNIFORM} when not given. */
    @JsonIgnore
    public String getShape() {
        return shape != null ? shape : UNIFORM;
    }

    @JsonProperty("options")
    public List<String> getOptions() {
        return options.isEmpty() ? null : options;
    }

    @JsonProperty("min")
    public Double getMin() {
        return min;
    }

    @JsonProperty("max")
    public Double getMax() {
        return max;
    }

    @JsonProperty("truePercentage")
    public Double getTruePercentage() {
        return truePercentage;
    }

    /** Draws one value. Callers validate first. */
    public Object sample(SplittableRandom rng) {
        switch (type) {
            case NUMERIC: {
                double lo = min != null ? min : 0;
                double hi = max != null ? max : 100;
                if (NORMAL.equals(getShape())) {
                    double mean = (lo + hi) / 2;
                    double sd = (hi - lo) / 6;
                    return Math.max(lo, Math.min(hi, mean + sd * rng.nextGaussian()));
                }
                return hi > lo ? lo + rng.nextDouble() * (hi - lo) : lo;
            }
            case BOOLEAN:
                return rng.nextDouble() < (truePercentage != null ? truePercentage : 0.5);
            default:
                if (!weights.isEmpty()) return weightedChoice(rng);
                if (!options.isEmpty()) return options.get(rng.nextInt(options.size()));
                return null;
        }
    }

    private String weightedChoice(SplittableRandom rng) {
        double total = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        double target = rng.nextDouble() * total;
        double cumulative = 0;
        String last = null;
        for (Map.Entry<String, Double> e : weights.entrySet()) {
            if (e.getValue() <= 0) continue;
            cumulative += e.getValue();
            last = e.getKey();
            if (target < cumulative) return e.getKey();
        }
        return last;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Double> toWeights(Object distribution) {
        if (!(distribution instanceof Map)) return Map.of();
        Map<String, Double> out = new LinkedHashMap<>();
        ((Map<Object, Object>) distribution).forEach((k, v) -> {
            double w = v instanceof Number ? ((Number) v).doubleValue() : Double.NaN;
            if (v instanceof String) {
                try {
                    w = Double.parseDouble((String) v);
                } catch (NumberFormatException e) {
                    w = Double.NaN;
                }
            }
            out.put(String.valueOf(k), w);
        });
        return Collections.unmodifiableMap(out);
    }

    /** Problems with this distribution, prefixed with the variable path. */
    List<String> problems(String path) {
        List<String> errors = new ArrayList<>();
        switch (type) {
            case CATEGORICAL: {
                if (weights.isEmpty() && options.isEmpty()) {
                    errors.add(path + ": categorical variable needs a distribution or options");
                }
                double total = 0;
                for (Map.Entry<String, Double> e : weights.entrySet()) {
                    double w = e.getValue();
                    if (Double.isNaN(w) || Double.isInfinite(w) || w < 0) {
                        errors.add(path + ": weight of '" + e.getKey() + "' must be a non-negative number");
                    } else {
                        total += w;
                    }
                }
                if (!weights.isEmpty() && total <= 0) {
                    errors.add(path + ": weights must sum to a positive value");
                }
                break;
            }
            case NUMERIC:
                if (min == null || max == null) {
                    errors.add(path + ": numeric variable needs min and max");
                } else if (min.isNaN() || max.isNaN() || min.isInfinite() || max.isInfinite() || min > max) {
                    errors.add(path + ": min must not exceed max (" + min + " > " + max + ")");
                }
                if (!UNIFORM.equals(getShape()) && !NORMAL.equals(getShape())) {
                    errors.add(path + ": unknown numeric distribution '" + shape + "'");
                }
                break;
            case BOOLEAN:
                if (truePercentage != null && (truePercentage.isNaN() || truePercentage < 0 || truePercentage > 1)) {
                    errors.add(path + ": truePercentage must be between 0 and 1");
                }
                break;
            default:
                errors.add(path + ": unsupported variable type");
                break;
        }
        return errors;
    }
}
