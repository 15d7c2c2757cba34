package io.topicvote.standalone;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.topicvote.standalone.config.ConfigLoader;
import io.topicvote.standalone.config.VotingConfig;
import java.io.IOException;
import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: {@code --config <yaml> --input <json> [--voting <text>]}.
 *
 * <p>Prints the result document to stdout. Any failure is logged and ends the process with exit
 * code 1.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            CliArguments arguments = CliArguments.parse(args);
            VotingConfig config = ConfigLoader.load(arguments.configPath());
            LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
            LOG.info("Configuration loaded from {}", arguments.configPath());
            execute(arguments, config, System.out);
        } catch (Exception e) {
            LOG.error("Voting run failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /** Everything after configuration: registration, evaluation and output. */
    static ObjectNode execute(CliArguments arguments, VotingConfig config, PrintStream out) throws IOException {
        VotingRunner runner = new VotingRunner(config);
        ContextDocument document = ContextDocument.read(arguments.inputPath());
        ObjectNode result = runner.run(document, arguments.voting());
        out.println(ContextDocument.JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        return result;
    }
}
