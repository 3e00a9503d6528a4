package dev.pagecraft.exception;

import lombok.Getter;

/**
 * Base type for every rejected page or component operation.
 */
@Getter
public abstract class PageEngineException extends RuntimeException {

    private final ErrorKind kind;

    protected PageEngineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
