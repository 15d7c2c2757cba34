package io.topicvote.standalone.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root configuration of the standalone voting host.
 *
 * <p>Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param declarations  {@code declare} texts registered in order at startup
 * @param aliases       additional names, each bound to a declaration text
 * @param defaultVoting voting text evaluated when none is given on the command line, may be null
 * @param epsilon       value bound to {@code epsilon} in the global context when the input lacks it
 * @param loggingFormat json or text
 * @param loggingLevel  root log level
 */
public record VotingConfig(
        List<String> declarations,
        Map<String, String> aliases,
        String defaultVoting,
        double epsilon,
        String loggingFormat,
        String loggingLevel) {

    public static final double DEFAULT_EPSILON = 1.0E-6;

    public VotingConfig {
        declarations = List.copyOf(declarations);
        aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        Objects.requireNonNull(loggingFormat, "loggingFormat");
        Objects.requireNonNull(loggingLevel, "loggingLevel");
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link VotingConfig}. */
    public static final class Builder {
        private List<String> declarations = List.of();
        private final Map<String, String> aliases = new LinkedHashMap<>();
        private String defaultVoting;
        private double epsilon = DEFAULT_EPSILON;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder declarations(List<String> declarations) {
            this.declarations = declarations;
            return this;
        }

        public Builder alias(String name, String declaration) {
            this.aliases.put(name, declaration);
            return this;
        }

        public Builder defaultVoting(String defaultVoting) {
            this.defaultVoting = defaultVoting;
            return this;
        }

        public Builder epsilon(double epsilon) {
            this.epsilon = epsilon;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public VotingConfig build() {
            return new VotingConfig(declarations, aliases, defaultVoting, epsilon, loggingFormat, loggingLevel);
        }
    }
}
