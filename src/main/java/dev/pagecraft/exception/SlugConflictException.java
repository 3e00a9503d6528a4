package dev.pagecraft.exception;

public class SlugConflictException extends PageEngineException {

    public SlugConflictException(String slug, Long parentId) {
        super(ErrorKind.SLUG_CONFLICT,
                "A page with slug '" + slug + "' already exists under parent " + parentId);
    }
}
