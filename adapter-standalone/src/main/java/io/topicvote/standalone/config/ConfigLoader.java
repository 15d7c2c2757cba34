package io.topicvote.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link VotingConfig} from a YAML file with an optional environment variable overlay.
 *
 * <p>Recognised YAML keys:
 * <pre>
 * votings:
 *   declarations: [ "declare a { ... }", ... ]
 *   aliases: { name: "declare b { ... }" }
 *   default: "CombSum"
 * evaluation:
 *   epsilon: 1.0E-6
 * logging:
 *   format: text | json
 *   level: INFO
 * </pre>
 *
 * <p>Environment variables take precedence over YAML values: {@code TOPICVOTE_DEFAULT_VOTING},
 * {@code TOPICVOTE_EPSILON}, {@code TOPICVOTE_LOG_FORMAT} and {@code TOPICVOTE_LOG_LEVEL}. A
 * variable counts as set only if it is defined and non-blank after trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Set<String> LOGGING_FORMATS = Set.of("text", "json");

    public static final String DEFAULT_CONFIG_FILE = "topicvote.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, overlaying variables from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or holds invalid values
     */
    public static VotingConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}. {@code envLookup} returns {@code null} for
     * undefined variables.
     *
     * @throws ConfigLoadException if the file is missing, unreadable or holds invalid values
     */
    public static VotingConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    private static VotingConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        VotingConfig.Builder builder = VotingConfig.builder();

        JsonNode votings = root.path("votings");
        builder.declarations(textList(votings.path("declarations"), "votings.declarations"));
        JsonNode aliases = votings.path("aliases");
        if (!aliases.isMissingNode() && !aliases.isNull()) {
            if (!aliases.isObject()) {
                throw new ConfigLoadException("votings.aliases must be a mapping of name to declaration");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = aliases.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.alias(field.getKey(), requireText(field.getValue(), "votings.aliases." + field.getKey()));
            }
        }
        if (votings.has("default")) builder.defaultVoting(requireText(votings.get("default"), "votings.default"));

        JsonNode evaluation = root.path("evaluation");
        if (evaluation.has("epsilon")) {
            JsonNode epsilon = evaluation.get("epsilon");
            if (!epsilon.isNumber()) {
                throw new ConfigLoadException("evaluation.epsilon must be a number, got: " + epsilon);
            }
            builder.epsilon(epsilon.doubleValue());
        }

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        applyEnvOverrides(builder, envLookup);
        return validate(builder.build());
    }

    private static void applyEnvOverrides(VotingConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "TOPICVOTE_DEFAULT_VOTING", builder::defaultVoting);
        envString(envLookup, "TOPICVOTE_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "TOPICVOTE_LOG_LEVEL", builder::loggingLevel);
        envDouble(envLookup, "TOPICVOTE_EPSILON", builder::epsilon);
    }

    private static VotingConfig validate(VotingConfig config) {
        if (!Double.isFinite(config.epsilon()) || config.epsilon() < 0) {
            throw new ConfigLoadException("epsilon must be a finite, non-negative number, got: " + config.epsilon());
        }
        String format = config.loggingFormat().trim().toLowerCase();
        if (!LOGGING_FORMATS.contains(format)) {
            throw new ConfigLoadException(
                    "logging.format must be one of " + LOGGING_FORMATS + ", got: " + config.loggingFormat());
        }
        return config;
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envDouble(Function<String, String> envLookup, String envVar, Consumer<Double> setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Double.parseDouble(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException("Invalid number in " + envVar + ": '" + raw + "'", e);
            }
        }
    }

    // --- YAML helpers ---

    private static String requireText(JsonNode node, String key) {
        if (node == null || !node.isTextual()) {
            throw new ConfigLoadException(key + " must be a string");
        }
        return node.textValue();
    }

    private static List<String> textList(JsonNode node, String key) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ConfigLoadException(key + " must be a list of strings");
        }
        List<String> texts = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            texts.add(requireText(node.get(i), key + "[" + i + "]"));
        }
        return texts;
    }
}
