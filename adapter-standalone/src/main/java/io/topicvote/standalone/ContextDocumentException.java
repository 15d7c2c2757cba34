package io.topicvote.standalone;

/** Thrown when an input context document cannot be read or does not have the expected shape. */
public class ContextDocumentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ContextDocumentException(String message) {
        super(message);
    }

    public ContextDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
