package com.pathway.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pathway.config.PathwayConfig;
import com.pathway.hierarchy.ConfigurationException;
import com.pathway.hierarchy.config.ExperimentDefinition;
import com.pathway.hierarchy.load.ExperimentLoader;
import com.pathway.hierarchy.validation.ValidationResult;
import com.pathway.simulator.InvalidDistributionException;
import com.pathway.simulator.VariableDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command line entry point:
 * <pre>
 * PathwayApplication &lt;experiment.json&gt; [paths|variables|simulate &lt;n&gt; [distributions.json]|validate]
 * </pre>
 * Prints JSON to stdout. Engine settings come from the {@code PATHWAY_*} environment variables.
 * Exit code 0 on success, 1 for an invalid experiment or distribution file, 2 for bad usage.
 */
public final class PathwayApplication {

    private static final Logger log = LoggerFactory.getLogger(PathwayApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
            "usage: PathwayApplication <experiment.json> [paths|variables|simulate <n> [distributions.json]|validate]";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private PathwayApplication() {
    }

    public static void main(String[] args) {
        int code = run(args, PathwayConfig.fromEnvironment(), System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, PathwayConfig config, PrintStream out, PrintStream err) {
        if (args == null || args.length == 0) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        String command = args.length > 1 ? args[1] : "paths";
        ExperimentDefinition definition;
        try {
            definition = ExperimentLoader.loadFile(Path.of(args[0]));
        } catch (ConfigurationException e) {
            err.println(e.getMessage());
            return EXIT_INVALID;
        }
        try (ExperimentService service = new ExperimentService(config)) {
            switch (command) {
                case "validate":
                    return validate(service, definition, out);
                case "paths":
                    service.publish(definition);
                    print(out, service.paths(definition.getExperimentId()));
                    return EXIT_OK;
                case "variables":
                    service.publish(definition);
                    print(out, service.simulateVariables(definition.getExperimentId()));
                    return EXIT_OK;
                case "simulate":
                    return simulate(service, definition, args, out, err);
                default:
                    err.println("Unknown command: " + command);
                    err.println(USAGE);
                    return EXIT_USAGE;
            }
        } catch (ConfigurationException e) {
            for (String error : e.getErrors()) {
                err.println(error);
            }
            return EXIT_INVALID;
        } catch (InvalidDistributionException e) {
            for (String error : e.getErrors()) {
                err.println(error);
            }
            return EXIT_INVALID;
        } catch (IOException e) {
            log.error("Command failed | command={} | error={}", command, e.getMessage(), e);
            err.println(e.getMessage());
            return EXIT_INVALID;
        }
    }

    private static int validate(ExperimentService service, ExperimentDefinition definition, PrintStream out)
            throws IOException {
        ValidationResult result = service.getRegistry().validate(definition);
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("experimentId", definition.getExperimentId());
        report.put("valid", result.isValid());
        report.put("errors", result.getErrors());
        report.put("warnings", result.getWarnings());
        print(out, report);
        return result.isValid() ? EXIT_OK : EXIT_INVALID;
    }

    private static int simulate(ExperimentService service, ExperimentDefinition definition, String[] args,
                                PrintStream out, PrintStream err) throws IOException {
        if (args.length < 3) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        int count;
        try {
            count = Integer.parseInt(args[2].trim());
        } catch (NumberFormatException e) {
            err.println("Participant count is not a number: " + args[2]);
            return EXIT_USAGE;
        }
        Map<String, VariableDistribution> distributions = args.length > 3 ? readDistributions(Path.of(args[3])) : Map.of();
        service.publish(definition);
        print(out, service.simulate(definition.getExperimentId(), count, distributions, false));
        return EXIT_OK;
    }

    static Map<String, VariableDistribution> readDistributions(Path file) throws IOException {
        String json = Files.readString(file, StandardCharsets.UTF_8);
        Map<String, VariableDistribution> parsed = MAPPER.readValue(json, new TypeReference<LinkedHashMap<String, VariableDistribution>>() {
        });
        return parsed != null ? parsed : Map.of();
    }

    private static void print(PrintStream out, Object value) throws IOException {
        out.println(MAPPER.writeValueAsString(value));
    }
}
