package io.latexium.cli;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed command line: {@code latexium <operation> <latex> [--var x] [--bind x=2]... [--factor]
 * [--config path] [--json]}.
 *
 * @param operation  one of {@link #OPERATIONS}
 * @param input      LaTeX text, or an AST JSON document for {@code render}
 * @param variable   variable to work in, or {@code null} to infer it
 * @param bindings   values for {@code evaluate} and {@code approximate}
 * @param factor     factor the result of {@code simplify}
 * @param configPath explicit configuration file, or {@code null}
 * @param json       print the JSON result instead of text
 */
public record CliArguments(
        String operation,
        String input,
        String variable,
        Map<String, Double> bindings,
        boolean factor,
        Path configPath,
        boolean json) {

    public static final List<String> OPERATIONS = List.of(
            "differentiate", "integrate", "solve", "evaluate", "approximate", "simplify", "factor", "parse", "render");

    public static final String USAGE = "Usage: latexium <" + String.join("|", OPERATIONS) + "> <latex>"
            + " [--var x] [--bind x=2]... [--factor] [--config path] [--json]";

    public CliArguments {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(input, "input must not be null");
        bindings = Map.copyOf(bindings);
    }

    /** Raised for arguments that do not match {@link #USAGE}. */
    public static final class UsageException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public UsageException(String message) {
            super(message);
        }
    }

    /**
     * @throws UsageException on an unknown operation or option, a missing value, or a malformed
     *     binding
     */
    public static CliArguments parse(String[] args) {
        String operation = null;
        String input = null;
        String variable = null;
        Map<String, Double> bindings = new LinkedHashMap<>();
        boolean factor = false;
        Path configPath = null;
        boolean json = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--var" -> variable = value(args, ++i, arg);
                case "--bind" -> bind(bindings, value(args, ++i, arg));
                case "--factor" -> factor = true;
                case "--config" -> configPath = Path.of(value(args, ++i, arg));
                case "--json" -> json = true;
                default -> {
                    if (arg.startsWith("--")) {
                        throw new UsageException("Unknown option " + arg);
                    }
                    if (operation == null) {
                        operation = arg;
                    } else if (input == null) {
                        input = arg;
                    } else {
                        throw new UsageException("Unexpected argument '" + arg + "'");
                    }
                }
            }
        }
        if (operation == null || input == null) {
            throw new UsageException("Missing operation or input");
        }
        if (!OPERATIONS.contains(operation)) {
            throw new UsageException("Unknown operation '" + operation + "'");
        }
        return new CliArguments(operation, input, variable, bindings, factor, configPath, json);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new UsageException(option + " requires a value");
        }
        return args[index];
    }

    private static void bind(Map<String, Double> bindings, String binding) {
        int eq = binding.indexOf('=');
        if (eq <= 0 || eq == binding.length() - 1) {
            throw new UsageException("--bind expects name=value, got '" + binding + "'");
        }
        String name = binding.substring(0, eq).trim();
        String value = binding.substring(eq + 1).trim();
        try {
            bindings.put(name, Double.parseDouble(value));
        } catch (NumberFormatException e) {
            throw new UsageException("--bind value for " + name + " is not a number: '" + value + "'");
        }
    }
}
