package io.mcoda.context;

public class SummarizerFailureException extends RuntimeException {
    public SummarizerFailureException(String message) {
        super(message);
    }

    public SummarizerFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
