package io.latexium.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.latexium.core.Latexium;
import io.latexium.core.config.ConfigLoadException;
import io.latexium.core.config.ConfigLoader;
import io.latexium.core.config.EngineConfig;
import io.latexium.core.model.AnalysisResult;
import io.latexium.core.model.StepTree;
import io.latexium.core.simplify.SimplifyOptions;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one command line: load configuration, configure logging, dispatch the operation, print the
 * result.
 *
 * <p>Kept apart from {@link LatexiumMain} so that tests can run it without {@code System.exit}.
 */
public final class LatexiumCli {

    private static final Logger LOG = LoggerFactory.getLogger(LatexiumCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ANALYSIS_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final ObjectMapper JSON = new ObjectMapper();

    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> envLookup;

    public LatexiumCli(PrintStream out, PrintStream err, Function<String, String> envLookup) {
        this.out = out;
        this.err = err;
        this.envLookup = envLookup;
    }

    /**
     * @return the process exit code: 0 on success, 1 on an analysis or configuration error, 2 on a
     *     usage error
     * @throws IOException if the JSON result cannot be written
     */
    public int run(String[] args) throws IOException {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (CliArguments.UsageException e) {
            err.println(e.getMessage());
            err.println(CliArguments.USAGE);
            return EXIT_USAGE;
        }

        EngineConfig config;
        try {
            config = loadConfig(arguments.configPath());
        } catch (ConfigLoadException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ANALYSIS_ERROR;
        }
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.debug("cli.start operation={} json={}", arguments.operation(), arguments.json());

        AnalysisResult result = dispatch(new Latexium(config), arguments, config);
        if (arguments.json()) {
            out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(result.toJson()));
        } else {
            printText(result);
        }
        return result.isSuccess() ? EXIT_OK : EXIT_ANALYSIS_ERROR;
    }

    private EngineConfig loadConfig(Path explicit) {
        if (explicit != null) {
            return ConfigLoader.load(explicit, envLookup);
        }
        Path fallback = Path.of(ConfigLoader.DEFAULT_CONFIG_FILE);
        return Files.exists(fallback)
                ? ConfigLoader.load(fallback, envLookup)
                : ConfigLoader.fromEnvironment(envLookup);
    }

    private static AnalysisResult dispatch(Latexium latexium, CliArguments arguments, EngineConfig config) {
        String input = arguments.input();
        String variable = arguments.variable();
        return switch (arguments.operation()) {
            case "differentiate" -> latexium.differentiate(input, variable);
            case "integrate" -> latexium.integrate(input, variable);
            case "solve" -> latexium.solve(input, variable);
            case "evaluate" -> latexium.evaluate(input, arguments.bindings());
            case "approximate" -> latexium.approximate(input, arguments.bindings());
            case "simplify" -> {
                SimplifyOptions options = arguments.factor()
                        ? config.simplify().toBuilder().factor(true).build()
                        : config.simplify();
                yield latexium.simplify(input, options);
            }
            case "factor" -> latexium.factor(input, variable);
            case "parse" -> latexium.parse(input);
            case "render" -> latexium.render(input);
            default -> throw new IllegalStateException("Unhandled operation " + arguments.operation());
        };
    }

    private void printText(AnalysisResult result) {
        if (result.isSuccess()) {
            out.println(result.value());
        }
        if (!result.steps().isEmpty()) {
            out.println("Steps:");
            printSteps(result.steps(), 1);
        }
        if (result.isError()) {
            err.println("Error: " + result.error());
        }
    }

    private void printSteps(List<StepTree> steps, int depth) {
        for (StepTree step : steps) {
            if (step instanceof StepTree.Leaf leaf) {
                out.println("  ".repeat(depth) + leaf.text());
            } else if (step instanceof StepTree.Branch branch) {
                printSteps(branch.children(), depth + 1);
            }
        }
    }
}
