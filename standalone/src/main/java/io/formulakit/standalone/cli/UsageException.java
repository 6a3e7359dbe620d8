package io.formulakit.standalone.cli;

/** Thrown when the command line cannot be interpreted. Maps to exit code {@code 2}. */
final class UsageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    UsageException(String message) {
        super(message);
    }
}
