package dev.pagecraft.exception;

public class CycleDetectedException extends PageEngineException {

    public CycleDetectedException(Long pageId, Long newParentId) {
        super(ErrorKind.CYCLE_DETECTED,
                "Cannot move page " + pageId + " under " + newParentId + ": the target is the page itself or one of its descendants");
    }
}
