package io.topicvote.standalone;

import io.topicvote.standalone.config.ConfigLoader;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Parsed command line: {@code --config <yaml> --input <json> [--voting <text>]}.
 *
 * @param configPath YAML configuration, defaults to {@value ConfigLoader#DEFAULT_CONFIG_FILE}
 * @param inputPath  JSON context document
 * @param voting     voting text overriding the configured default, may be null
 */
public record CliArguments(Path configPath, Path inputPath, String voting) {

    public CliArguments {
        Objects.requireNonNull(configPath, "configPath");
        Objects.requireNonNull(inputPath, "inputPath");
    }

    /**
     * @throws IllegalArgumentException for unknown options, options without a value or a missing
     *     {@code --input}
     */
    public static CliArguments parse(String[] args) {
        Path config = Path.of(ConfigLoader.DEFAULT_CONFIG_FILE);
        Path input = null;
        String voting = null;
        for (int i = 0; i < args.length; i++) {
            String option = args[i];
            switch (option) {
                case "--config" -> config = Path.of(valueOf(args, ++i, option));
                case "--input" -> input = Path.of(valueOf(args, ++i, option));
                case "--voting" -> voting = valueOf(args, ++i, option);
                default -> throw new IllegalArgumentException("Unknown argument: " + option);
            }
        }
        if (input == null) {
            throw new IllegalArgumentException("--input <path> is required");
        }
        return new CliArguments(config, input, voting);
    }

    private static String valueOf(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }
}
