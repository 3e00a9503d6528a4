package dev.pagecraft.exception;

public class ResourceNotFoundException extends PageEngineException {

    public ResourceNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public ResourceNotFoundException(String resource, String field, Object value) {
        this(resource + " not found with " + field + ": " + value);
    }
}
