package dev.pagecraft.exception;

/**
 * Thrown when a structural rule forbids the operation, e.g. moving or deleting the root page.
 */
public class InvalidOperationException extends PageEngineException {

    public InvalidOperationException(String message) {
        super(ErrorKind.INVALID_OPERATION, message);
    }
}
