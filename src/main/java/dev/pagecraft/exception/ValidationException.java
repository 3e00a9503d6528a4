package dev.pagecraft.exception;

/**
 * Malformed input: missing or mistyped arguments, empty path segments, unknown component types.
 */
public class ValidationException extends PageEngineException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }
}
