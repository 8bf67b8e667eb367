package io.latexium.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point. Delegates to {@link LatexiumCli#run(String[])} and exits with its
 * code; any unexpected failure is logged and exits with status 1.
 */
public final class LatexiumMain {

    private static final Logger LOG = LoggerFactory.getLogger(LatexiumMain.class);

    private LatexiumMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int code;
        try {
            code = new LatexiumCli(System.out, System.err, System::getenv).run(args);
        } catch (Exception e) {
            LOG.error("latexium failed: {}", e.getMessage(), e);
            code = LatexiumCli.EXIT_ANALYSIS_ERROR;
        }
        if (code != LatexiumCli.EXIT_OK) {
            System.exit(code);
        }
    }
}
