package io.latexium.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.latexium.core.simplify.SimplifyOptions;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link EngineConfig} from a YAML file with an environment variable overlay.
 *
 * <p>YAML layout:
 *
 * <pre>
 * simplify:
 *   combine-like-terms: true
 *   expand: true
 *   simplify-fractions: true
 *   apply-identities: true
 *   factor: false
 *   max-depth: 10
 *   overlap-max-iterations: 5
 *   max-expansion-power: 10
 * integration:
 *   max-depth: 3
 *   legacy-fallback: true
 * approximation:
 *   precision: 6
 * logging:
 *   format: text
 *   level: INFO
 * </pre>
 *
 * <p>Every key can be overridden by a {@code LATEXIUM_*} environment variable, which wins over
 * YAML. A variable counts as set only when it is defined and non-blank after trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Looked up in the working directory when no {@code --config} is given. */
    public static final String DEFAULT_CONFIG_FILE = "latexium.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration at {@code configPath}, overlaid with {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds invalid values
     */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration at {@code configPath}, overlaid with variables from {@code envLookup}.
     * The lookup returns {@code null} for an undefined variable.
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (Exception e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Defaults overlaid with environment variables, for runs without a configuration file. */
    public static EngineConfig fromEnvironment(Function<String, String> envLookup) {
        try {
            return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in environment: " + e.getMessage(), e);
        }
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        EngineConfig.Builder builder = EngineConfig.builder();
        SimplifyOptions defaults = SimplifyOptions.defaults();
        SimplifyOptions.Builder simplify = defaults.toBuilder();

        // --- YAML mapping ---

        JsonNode simplifyNode = root.path("simplify");
        simplify.combineLikeTerms(boolOrDefault(simplifyNode, "combine-like-terms", defaults.combineLikeTerms()));
        simplify.expand(boolOrDefault(simplifyNode, "expand", defaults.expand()));
        simplify.simplifyFractions(boolOrDefault(simplifyNode, "simplify-fractions", defaults.simplifyFractions()));
        simplify.applyIdentities(boolOrDefault(simplifyNode, "apply-identities", defaults.applyIdentities()));
        simplify.factor(boolOrDefault(simplifyNode, "factor", defaults.factor()));
        simplify.maxDepth(intOrDefault(simplifyNode, "max-depth", defaults.maxDepth()));
        if (simplifyNode.has("overlap-max-iterations"))
            builder.overlapMaxIterations(simplifyNode.get("overlap-max-iterations").asInt());
        if (simplifyNode.has("max-expansion-power"))
            builder.maxExpansionPower(simplifyNode.get("max-expansion-power").asInt());

        JsonNode integration = root.path("integration");
        if (integration.has("max-depth")) builder.integrationMaxDepth(integration.get("max-depth").asInt());
        if (integration.has("legacy-fallback"))
            builder.legacyFallback(integration.get("legacy-fallback").asBoolean());

        JsonNode approximation = root.path("approximation");
        if (approximation.has("precision"))
            builder.approximationPrecision(approximation.get("precision").asInt());

        JsonNode logging = root.path("logging");
        builder.loggingFormat(textOrDefault(logging, "format", "text"));
        builder.loggingLevel(textOrDefault(logging, "level", "INFO"));

        // --- Environment variable overlay ---

        envBool(envLookup, "LATEXIUM_SIMPLIFY_COMBINE_LIKE_TERMS", simplify::combineLikeTerms);
        envBool(envLookup, "LATEXIUM_SIMPLIFY_EXPAND", simplify::expand);
        envBool(envLookup, "LATEXIUM_SIMPLIFY_FRACTIONS", simplify::simplifyFractions);
        envBool(envLookup, "LATEXIUM_SIMPLIFY_APPLY_IDENTITIES", simplify::applyIdentities);
        envBool(envLookup, "LATEXIUM_SIMPLIFY_FACTOR", simplify::factor);
        envInt(envLookup, "LATEXIUM_SIMPLIFY_MAX_DEPTH", simplify::maxDepth);
        envInt(envLookup, "LATEXIUM_SIMPLIFY_OVERLAP_MAX_ITERATIONS", builder::overlapMaxIterations);
        envInt(envLookup, "LATEXIUM_SIMPLIFY_MAX_EXPANSION_POWER", builder::maxExpansionPower);
        envInt(envLookup, "LATEXIUM_INTEGRATION_MAX_DEPTH", builder::integrationMaxDepth);
        envBool(envLookup, "LATEXIUM_INTEGRATION_LEGACY_FALLBACK", builder::legacyFallback);
        envInt(envLookup, "LATEXIUM_APPROXIMATION_PRECISION", builder::approximationPrecision);
        envString(envLookup, "LATEXIUM_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LATEXIUM_LOG_LEVEL", builder::loggingLevel);

        return builder.simplify(simplify.build()).build();
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    // --- YAML helpers ---

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.has(field) ? node.get(field).asText() : defaultValue;
    }

    private static boolean boolOrDefault(JsonNode node, String field, boolean defaultValue) {
        return node.has(field) ? node.get(field).asBoolean() : defaultValue;
    }

    private static int intOrDefault(JsonNode node, String field, int defaultValue) {
        return node.has(field) ? node.get(field).asInt() : defaultValue;
    }
}
