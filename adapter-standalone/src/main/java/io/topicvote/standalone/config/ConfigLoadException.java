package io.topicvote.standalone.config;

/**
 * Thrown when configuration loading fails: a missing file, unreadable YAML or a value outside its
 * allowed range. The message is meant for startup error output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
